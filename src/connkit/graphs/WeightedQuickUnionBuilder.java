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

import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Union of two trees attaching the root of the smaller tree under the root of the larger one.
 * Ties keep the root of the main vertex. Sizes are taken from a {@link RootSizeTable} that is
 * built on the first union and rebuilt whenever it does not match the parent mapping.
 *
 * Unlike {@link QuickUnionBuilder} this builder receives a single pair of vertices per call,
 * because the size bookkeeping is done pair by pair
 * @author ConnectivityKit developers
 */
public class WeightedQuickUnionBuilder {
	private Logger log = Logger.getLogger(WeightedQuickUnionBuilder.class.getName());
	private final RootFinder finder;
	private RootSizeTable sizeTable = null;

	public WeightedQuickUnionBuilder(RootFinder finder) {
		this.finder = finder;
	}

	public WeightedQuickUnionBuilder(ParentMapping mapping) {
		this(new RootFinder(mapping));
	}

	public Logger getLog() {
		return log;
	}

	public void setLog(Logger log) {
		this.log = log;
	}

	/**
	 * Unites the sets of the given vertices using path halving compression
	 * @param minor First vertex
	 * @param main Second vertex
	 */
	public void union(int minor, int main) {
		union(VertexId.of(minor), VertexId.of(main), true, PathCompression.PATH_HALVING);
	}

	/**
	 * Unites the sets of two vertices given as untyped values
	 * @param minor First vertex. Must be an integral scalar
	 * @param main Second vertex. Must be an integral scalar
	 * @param compress Tells if path compression should be applied while searching for roots
	 * @param mode Type of path compression. Ignored if compress is false
	 * @throws IllegalArgumentException If either value is not an integral scalar
	 */
	public void union(Object minor, Object main, boolean compress, PathCompression mode) {
		union(VertexId.fromObject(minor), VertexId.fromObject(main), compress, mode);
	}

	/**
	 * Unites the sets of the given vertices
	 * @param minor First vertex
	 * @param main Second vertex
	 * @param compress Tells if path compression should be applied while searching for roots
	 * @param mode Type of path compression. Ignored if compress is false
	 */
	public void union(VertexId minor, VertexId main, boolean compress, PathCompression mode) {
		ParentMapping mapping = finder.getMapping();
		mapping.checkVertex(minor.getId());
		mapping.checkVertex(main.getId());
		int i;
		int j;
		if(compress) {
			i = finder.findRoot(minor.getId(), mode);
			j = finder.findRoot(main.getId(), mode);
		} else {
			i = finder.findRoot(minor.getId());
			j = finder.findRoot(main.getId());
		}
		if(i==j) return;
		RootSizeTable table = getRootSizeTable();
		if(!table.containsRoot(i) || !table.containsRoot(j)) table = rebuildRootSizeTable();
		int iSize = table.getSize(i);
		int jSize = table.getSize(j);
		if(iSize<=jSize) {
			mapping.setParent(i, j);
			table.merge(i, j);
		} else {
			mapping.setParent(j, i);
			table.merge(j, i);
		}
	}

	/**
	 * Returns the current size table, building it if it does not exist or if its number of
	 * vertices differs from the number of vertices of the mapping. Building the table finds
	 * the roots of every vertex with full path compression, which rewrites the parent mapping
	 * so that every vertex points directly to its root.
	 * Use {@link #hasRootSizeTable()} to check for a table without building it
	 * @return RootSizeTable consistent with the size of the parent mapping
	 */
	public RootSizeTable getRootSizeTable() {
		if(sizeTable==null || sizeTable.getNumVertices()!=finder.getMapping().size()) {
			return rebuildRootSizeTable();
		}
		return sizeTable;
	}

	/**
	 * @return boolean true if a size table was already built
	 */
	public boolean hasRootSizeTable() {
		return sizeTable!=null;
	}

	private RootSizeTable rebuildRootSizeTable() {
		int n = finder.getMapping().size();
		if(sizeTable!=null && log!=null) log.log(Level.FINE, "Rebuilding root sizes. Table vertices: {0} mapping vertices: {1}", new Object[] {sizeTable.getNumVertices(), n});
		int [] all = new int[n];
		for(int v=0;v<n;v++) all[v] = v;
		int [] roots = finder.findRoots(all, PathCompression.FULL);
		sizeTable = RootSizeTable.fromRoots(roots);
		if(log!=null) log.fine("Built root sizes table for "+n+" vertices and "+sizeTable.getNumRoots()+" roots");
		return sizeTable;
	}
}
