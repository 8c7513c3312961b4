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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Labels the connected components of a graph given as an adjacency list.
 * Vertices are scanned in increasing order and each unvisited vertex starts a new component,
 * so labels are numbered 0..K-1 in order of discovery. The traversal of each component uses
 * an explicit stack instead of recursion, so component size is not bounded by the call stack
 * @author ConnectivityKit developers
 */
public class DepthFirstConnectivityLabeler {
	public static final int UNVISITED = -1;

	private final AdjacencyList adjacencyList;
	private int [] labels = null;
	private int numComponents = 0;

	public DepthFirstConnectivityLabeler(AdjacencyList adjacencyList) {
		this.adjacencyList = adjacencyList;
	}

	public AdjacencyList getAdjacencyList() {
		return adjacencyList;
	}

	/**
	 * Calculates the component label of every vertex
	 * @return int [] Label of each vertex
	 */
	public int [] computeLabels() {
		int n = adjacencyList.getNumVertices();
		int [] answer = new int[n];
		Arrays.fill(answer, UNVISITED);
		// Every vertex is pushed at most once because it is labeled when pushed
		int [] stack = new int[n];
		int current = UNVISITED;
		for(int i=0;i<n;i++) {
			if(answer[i]!=UNVISITED) continue;
			current++;
			int top = 0;
			answer[i] = current;
			stack[top++] = i;
			while(top>0) {
				int u = stack[--top];
				for(int v:adjacencyList.neighborsOf(u)) {
					if(answer[v]==UNVISITED) {
						answer[v] = current;
						stack[top++] = v;
					}
				}
			}
		}
		labels = answer;
		numComponents = current+1;
		return Arrays.copyOf(labels, n);
	}

	/**
	 * @return int Number of components found by the last call to computeLabels
	 */
	public int getNumComponents() {
		checkComputed();
		return numComponents;
	}

	/**
	 * @return int [] copy of the labels calculated by the last call to computeLabels
	 */
	public int [] getLabels() {
		checkComputed();
		return Arrays.copyOf(labels, labels.length);
	}

	/**
	 * Groups the vertices by label
	 * @return List<List<Integer>> Position k contains the vertices of component k in increasing order
	 */
	public List<List<Integer>> getComponents() {
		checkComputed();
		List<List<Integer>> components = new ArrayList<>(numComponents);
		for(int k=0;k<numComponents;k++) components.add(new ArrayList<>());
		for(int v=0;v<labels.length;v++) components.get(labels[v]).add(v);
		return components;
	}

	private void checkComputed() {
		if(labels==null) throw new IllegalStateException("Labels have not been calculated");
	}
}
