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

import java.util.Arrays;

/**
 * Root lookups over a parent mapping. Batched lookups advance all the given vertices together
 * until every one of them reaches its root. Vertices that already reached their root
 * keep pointing to themselves while the others continue.
 *
 * The compressing lookups are not pure queries: they rewrite the parents of the visited vertices
 * @author ConnectivityKit developers
 */
public class RootFinder {
	private final ParentMapping mapping;

	public RootFinder(ParentMapping mapping) {
		this.mapping = mapping;
	}

	public ParentMapping getMapping() {
		return mapping;
	}

	/**
	 * Finds the roots of the given vertices without changing the mapping
	 * @param vertices Ids of the vertices whose roots are sought
	 * @return int [] Roots aligned with the input array
	 */
	public int [] findRoots(int [] vertices) {
		mapping.checkVertices(vertices);
		int [] current = Arrays.copyOf(vertices, vertices.length);
		while(!allRoots(current)) {
			for(int k=0;k<current.length;k++) current[k] = mapping.parentOf(current[k]);
		}
		return current;
	}

	/**
	 * Finds the roots of the given vertices compressing the visited paths
	 * @param vertices Ids of the vertices whose roots are sought
	 * @param mode Type of path compression
	 * @return int [] Roots aligned with the input array
	 */
	public int [] findRoots(int [] vertices, PathCompression mode) {
		mapping.checkVertices(vertices);
		if(mode == PathCompression.FULL) return findRootsFullCompression(vertices);
		return findRootsPathHalving(vertices);
	}

	public int findRoot(int vertex) {
		return findRoots(new int[] {vertex})[0];
	}

	public int findRoot(int vertex, PathCompression mode) {
		return findRoots(new int[] {vertex}, mode)[0];
	}

	private int [] findRootsPathHalving(int [] vertices) {
		int n = vertices.length;
		int [] current = Arrays.copyOf(vertices, n);
		int [] grandparents = new int[n];
		while(!allRoots(current)) {
			// Grandparents are read for the whole batch before any parent is rewritten
			for(int k=0;k<n;k++) grandparents[k] = mapping.parentOf(mapping.parentOf(current[k]));
			for(int k=0;k<n;k++) mapping.setParent(current[k], grandparents[k]);
			for(int k=0;k<n;k++) current[k] = mapping.parentOf(current[k]);
		}
		return current;
	}

	private int [] findRootsFullCompression(int [] vertices) {
		int n = vertices.length;
		int [] roots = findRoots(vertices);
		int [] current = Arrays.copyOf(vertices, n);
		int [] next = new int[n];
		while(!Arrays.equals(current, roots)) {
			for(int k=0;k<n;k++) next[k] = mapping.parentOf(current[k]);
			for(int k=0;k<n;k++) mapping.setParent(current[k], roots[k]);
			int [] tmp = current;
			current = next;
			next = tmp;
		}
		return roots;
	}

	private boolean allRoots(int [] current) {
		for(int v:current) {
			if(mapping.parentOf(v)!=v) return false;
		}
		return true;
	}
}
