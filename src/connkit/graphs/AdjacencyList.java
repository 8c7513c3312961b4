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
 * Immutable list of neighbors for each vertex. Edges are followed as stored, so undirected
 * graphs must list each edge in both directions. {@link #fromEdges(int, int[][])} builds such
 * a list from vertex pairs
 * @author ConnectivityKit developers
 */
public class AdjacencyList {
	private final int [][] neighbors;

	/**
	 * Creates an adjacency list from arrays of neighbors. Arrays are copied
	 * @param neighbors Position i contains the neighbors of vertex i
	 * @throws IndexOutOfBoundsException If a neighbor id is outside [0, neighbors.length)
	 */
	public AdjacencyList(int [][] neighbors) {
		int n = neighbors.length;
		this.neighbors = new int[n][];
		for(int i=0;i<n;i++) {
			int [] adj = neighbors[i];
			this.neighbors[i] = (adj==null)?new int[0]:Arrays.copyOf(adj, adj.length);
			for(int j:this.neighbors[i]) checkNeighbor(i, j, n);
		}
	}

	/**
	 * Creates an adjacency list from lists of neighbors
	 * @param adjacencyList Position i contains the neighbors of vertex i
	 */
	public AdjacencyList(List<List<Integer>> adjacencyList) {
		this(toArrays(adjacencyList));
	}

	private static int [][] toArrays(List<List<Integer>> adjacencyList) {
		int [][] answer = new int[adjacencyList.size()][];
		for(int i=0;i<answer.length;i++) {
			List<Integer> adj = adjacencyList.get(i);
			if(adj==null) {
				answer[i] = new int[0];
				continue;
			}
			answer[i] = new int[adj.size()];
			for(int k=0;k<answer[i].length;k++) answer[i][k] = adj.get(k);
		}
		return answer;
	}

	/**
	 * Builds a symmetric adjacency list from undirected edges. For each pair {a,b}
	 * b is appended to the neighbors of a and a to the neighbors of b, in the order of the edges
	 * @param numVertices Number of vertices
	 * @param edges Pairs of vertex ids
	 * @return AdjacencyList with reciprocal entries for every edge
	 */
	public static AdjacencyList fromEdges(int numVertices, int [][] edges) {
		if(numVertices<0) throw new IllegalArgumentException("Number of vertices can not be negative: "+numVertices);
		List<List<Integer>> adj = new ArrayList<>(numVertices);
		for(int i=0;i<numVertices;i++) adj.add(new ArrayList<>());
		for(int [] edge:edges) {
			if(edge.length!=2) throw new IllegalArgumentException("Edges must have exactly two vertices. Found: "+Arrays.toString(edge));
			int a = edge[0];
			int b = edge[1];
			checkNeighbor(a, b, numVertices);
			checkNeighbor(b, a, numVertices);
			adj.get(a).add(b);
			adj.get(b).add(a);
		}
		return new AdjacencyList(adj);
	}

	private static void checkNeighbor(int vertex, int neighbor, int n) {
		if(neighbor<0 || neighbor>=n) throw new IndexOutOfBoundsException("Neighbor "+neighbor+" of vertex "+vertex+" out of range. Number of vertices: "+n);
	}

	public int getNumVertices() {
		return neighbors.length;
	}

	/**
	 * @param vertex Vertex id
	 * @return int [] copy of the neighbors of the given vertex
	 */
	public int [] getNeighbors(int vertex) {
		int [] adj = neighborsOf(vertex);
		return Arrays.copyOf(adj, adj.length);
	}

	public int getDegree(int vertex) {
		return neighborsOf(vertex).length;
	}

	int [] neighborsOf(int vertex) {
		if(vertex<0 || vertex>=neighbors.length) throw new IndexOutOfBoundsException("Vertex "+vertex+" out of range. Number of vertices: "+neighbors.length);
		return neighbors[vertex];
	}

	public long getNumEntries() {
		long total = 0;
		for(int [] adj:neighbors) total+=adj.length;
		return total;
	}
}
