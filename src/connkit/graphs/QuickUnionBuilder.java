/*******************************************************************************
 * ConnectivityKit - Graph connectivity algorithms
 * Copyright 2026 ConnectivityKit developers
 *
 * This file is part of ConnectivityKit.
 *
 *     ConnectivityKit is free software: you can redistribute it and/or modify
 *     it under the terms of the GNU General Public License as published by
 *     the Free Software Foundation, either version 3 of the License, or
 *     (at your option) any later version.
 *
 *     ConnectivityKit is distributed in the hope that it will be useful,
 *     but WITHOUT ANY WARRANTY; without even the implied warranty of
 *     MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 *     GNU General Public License for more details.
 *
 *     You should have received a copy of the GNU General Public License
 *     along with ConnectivityKit.  If not, see <http://www.gnu.org/licenses/>.
 *******************************************************************************/
package connkit.graphs;

/**
 * Batched union without balancing. The root of each minor vertex is attached under the root
 * of the corresponding main vertex.
 *
 * The call is skipped only if every pair of the batch already shares a root. Otherwise all pairs
 * are assigned, including pairs that are already connected, for which the assignment is a
 * self assignment of the root. When the same minor root appears more than once in a batch,
 * the last assignment wins.
 *
 * This builder does not maintain root sizes. Use {@link WeightedQuickUnionBuilder} for unions
 * balanced by size, which accepts one pair per call
 * @author ConnectivityKit developers
 */
public class QuickUnionBuilder {
	private final RootFinder finder;

	public QuickUnionBuilder(RootFinder finder) {
		this.finder = finder;
	}

	public QuickUnionBuilder(ParentMapping mapping) {
		this(new RootFinder(mapping));
	}

	/**
	 * Unites the sets of the given pairs using path halving compression
	 * @param minor Vertices whose roots will be attached
	 * @param main Vertices whose roots will become the parents
	 */
	public void union(int [] minor, int [] main) {
		union(minor, main, true, PathCompression.PATH_HALVING);
	}

	/**
	 * Unites the sets of the given pairs
	 * @param minor Vertices whose roots will be attached
	 * @param main Vertices whose roots will become the parents. Must have the same length as minor
	 * @param compress Tells if path compression should be applied while searching for roots
	 * @param mode Type of path compression. Ignored if compress is false
	 */
	public void union(int [] minor, int [] main, boolean compress, PathCompression mode) {
		if(minor.length!=main.length) throw new IllegalArgumentException("Minor and main arrays must have the same length. Minor: "+minor.length+" main: "+main.length);
		ParentMapping mapping = finder.getMapping();
		mapping.checkVertices(minor);
		mapping.checkVertices(main);
		int [] i;
		int [] j;
		if(compress) {
			i = finder.findRoots(minor, mode);
			j = finder.findRoots(main, mode);
		} else {
			i = finder.findRoots(minor);
			j = finder.findRoots(main);
		}
		if(allEqual(i, j)) return;
		for(int k=0;k<i.length;k++) mapping.setParent(i[k], j[k]);
	}

	private static boolean allEqual(int [] i, int [] j) {
		for(int k=0;k<i.length;k++) {
			if(i[k]!=j[k]) return false;
		}
		return true;
	}
}
