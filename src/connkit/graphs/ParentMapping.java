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
 * Array based encoding of a forest. Position i stores the parent of vertex i and roots point to themselves.
 * Instances are not thread safe
 * @author ConnectivityKit developers
 */
public class ParentMapping {
	private int [] parents;

	/**
	 * Creates a mapping from the given parents array. The array is copied
	 * @param parents Parent of each vertex. Every parent must be a vertex id in [0, parents.length)
	 * @throws IndexOutOfBoundsException If a parent is out of range
	 * @throws IllegalArgumentException If the array encodes a cycle other than a root self loop
	 */
	public ParentMapping(int [] parents) {
		this.parents = Arrays.copyOf(parents, parents.length);
		for(int i=0;i<this.parents.length;i++) checkVertex(this.parents[i]);
		validateForest();
	}

	/**
	 * Creates a mapping in which every vertex is its own root
	 * @param n Number of vertices
	 * @return ParentMapping with n singleton trees
	 */
	public static ParentMapping identity(int n) {
		if(n<0) throw new IllegalArgumentException("Number of vertices can not be negative: "+n);
		int [] parents = new int[n];
		for(int i=0;i<n;i++) parents[i] = i;
		return new ParentMapping(parents);
	}

	private void validateForest() {
		int n = parents.length;
		//0: not visited, 1: in the current walk, 2: known to reach a root
		byte [] state = new byte[n];
		int [] path = new int[n];
		for(int v=0;v<n;v++) {
			int length = 0;
			int x = v;
			while(state[x]==0) {
				state[x] = 1;
				path[length++] = x;
				if(parents[x]==x) break;
				x = parents[x];
			}
			if(state[x]==1 && parents[x]!=x) throw new IllegalArgumentException("Parents array contains a cycle through vertex "+x);
			for(int k=0;k<length;k++) state[path[k]] = 2;
		}
	}

	/**
	 * @return int number of vertices
	 */
	public int size() {
		return parents.length;
	}

	public int getParent(int vertex) {
		checkVertex(vertex);
		return parents[vertex];
	}

	/**
	 * Direct parent assignment used by root finders and union builders
	 * @param vertex Vertex to update
	 * @param parent New parent
	 */
	void setParent(int vertex, int parent) {
		parents[vertex] = parent;
	}

	/**
	 * Unchecked parent lookup for internal loops. Callers must validate the vertex beforehand
	 */
	int parentOf(int vertex) {
		return parents[vertex];
	}

	public boolean isRoot(int vertex) {
		return getParent(vertex)==vertex;
	}

	/**
	 * Appends new vertices, each one being its own root
	 * @param count Number of vertices to add
	 * @return int id of the first added vertex
	 */
	public int addVertices(int count) {
		if(count<0) throw new IllegalArgumentException("Number of vertices to add can not be negative: "+count);
		int first = parents.length;
		parents = Arrays.copyOf(parents, first+count);
		for(int i=first;i<parents.length;i++) parents[i] = i;
		return first;
	}

	/**
	 * Verifies that the given id is a vertex of this mapping
	 * @param vertex Id to check
	 * @throws IndexOutOfBoundsException If the id is outside [0, size())
	 */
	public void checkVertex(int vertex) {
		if(vertex<0 || vertex>=parents.length) throw new IndexOutOfBoundsException("Vertex "+vertex+" out of range. Number of vertices: "+parents.length);
	}

	public void checkVertices(int [] vertices) {
		for(int v:vertices) checkVertex(v);
	}

	/**
	 * @return int [] copy of the current parents array
	 */
	public int [] toArray() {
		return Arrays.copyOf(parents, parents.length);
	}

	@Override
	public String toString() {
		return Arrays.toString(parents);
	}
}
