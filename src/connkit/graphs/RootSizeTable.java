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
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Number of vertices in each tree, indexed by root. Roots are kept in increasing order
 * as they were found when the table was built. The table also keeps a snapshot of the
 * root of every vertex, which is updated when trees are merged so that the sizes never
 * require a rescan of all vertices.
 *
 * The sum of the sizes always equals the number of vertices of the snapshot
 */
public class RootSizeTable {
	private final int [] vertexRoots;
	private int [] roots;
	private int [] sizes;
	private int numRoots;

	private RootSizeTable(int [] vertexRoots) {
		this.vertexRoots = vertexRoots;
		int [] sorted = Arrays.copyOf(vertexRoots, vertexRoots.length);
		Arrays.sort(sorted);
		roots = new int[sorted.length];
		sizes = new int[sorted.length];
		numRoots = 0;
		for(int k=0;k<sorted.length;k++) {
			if(numRoots>0 && roots[numRoots-1]==sorted[k]) {
				sizes[numRoots-1]++;
			} else {
				roots[numRoots] = sorted[k];
				sizes[numRoots] = 1;
				numRoots++;
			}
		}
	}

	/**
	 * Builds the table from the roots of every vertex
	 * @param vertexRoots Root of each vertex. The array is copied
	 * @return RootSizeTable with the frequency of each root
	 */
	public static RootSizeTable fromRoots(int [] vertexRoots) {
		return new RootSizeTable(Arrays.copyOf(vertexRoots, vertexRoots.length));
	}

	/**
	 * @return int Number of vertices covered by this table
	 */
	public int getNumVertices() {
		return vertexRoots.length;
	}

	public int getNumRoots() {
		return numRoots;
	}

	/**
	 * Linear search of the position of the given root
	 * @param root Root to search
	 * @return int position of the root or -1 if it is not a root of this table
	 */
	public int indexOf(int root) {
		for(int k=0;k<numRoots;k++) {
			if(roots[k]==root) return k;
		}
		return -1;
	}

	public boolean containsRoot(int root) {
		return indexOf(root)>=0;
	}

	/**
	 * @param root Root of a tree
	 * @return int Number of vertices of the tree
	 * @throws IllegalArgumentException If the given vertex is not a root of the table
	 */
	public int getSize(int root) {
		int idx = indexOf(root);
		if(idx<0) throw new IllegalArgumentException("Vertex "+root+" is not a root of the size table");
		return sizes[idx];
	}

	/**
	 * Registers that the tree rooted at absorbed now hangs from the root keeper
	 * @param absorbed Root that stops being a root
	 * @param keeper Root that keeps being a root
	 */
	void merge(int absorbed, int keeper) {
		int absorbedIdx = indexOf(absorbed);
		int keeperIdx = indexOf(keeper);
		if(absorbedIdx<0 || keeperIdx<0) throw new IllegalArgumentException("Can not merge non roots "+absorbed+" and "+keeper);
		for(int v=0;v<vertexRoots.length;v++) {
			if(vertexRoots[v]==absorbed) vertexRoots[v] = keeper;
		}
		sizes[keeperIdx]+=sizes[absorbedIdx];
		System.arraycopy(roots, absorbedIdx+1, roots, absorbedIdx, numRoots-absorbedIdx-1);
		System.arraycopy(sizes, absorbedIdx+1, sizes, absorbedIdx, numRoots-absorbedIdx-1);
		numRoots--;
	}

	/**
	 * @return long sum of the sizes of all trees
	 */
	public long getTotalSize() {
		long total = 0;
		for(int k=0;k<numRoots;k++) total+=sizes[k];
		return total;
	}

	/**
	 * @return int [] copy of the root assigned to each vertex
	 */
	public int [] getRootsSnapshot() {
		return Arrays.copyOf(vertexRoots, vertexRoots.length);
	}

	/**
	 * @return Map<Integer,Integer> sizes by root in increasing order of root
	 */
	public Map<Integer,Integer> getSizesByRoot() {
		Map<Integer,Integer> answer = new LinkedHashMap<Integer, Integer>();
		for(int k=0;k<numRoots;k++) answer.put(roots[k], sizes[k]);
		return answer;
	}
}
