package connkit.graphs.test;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Random;

import junit.framework.TestCase;
import connkit.graphs.AdjacencyList;
import connkit.graphs.DepthFirstConnectivityLabeler;
import connkit.graphs.DisjointSets;

import static connkit.graphs.test.RootFinderTest.assertArrayEquals;

public class DepthFirstConnectivityLabelerTest extends TestCase {

	public static int [][] createExampleGraph() {
		return new int[][] {
			{1, 2},
			{0},
			{0},
			{4, 5},
			{3, 9},
			{3},
			{9},
			{},
			{9, 10},
			{4, 6, 8},
			{8}
		};
	}

	public void testExampleGraph() {
		DepthFirstConnectivityLabeler labeler = new DepthFirstConnectivityLabeler(new AdjacencyList(createExampleGraph()));
		assertArrayEquals(new int[] {0, 0, 0, 1, 1, 1, 1, 2, 1, 1, 1}, labeler.computeLabels());
		assertEquals(3, labeler.getNumComponents());
		List<List<Integer>> components = labeler.getComponents();
		assertEquals(Arrays.asList(0, 1, 2), components.get(0));
		assertEquals(Arrays.asList(3, 4, 5, 6, 8, 9, 10), components.get(1));
		assertEquals(Arrays.asList(7), components.get(2));
	}

	public void testListConstructor() {
		List<List<Integer>> adj = new ArrayList<>();
		for(int [] neighbors:createExampleGraph()) {
			List<Integer> list = new ArrayList<>();
			for(int v:neighbors) list.add(v);
			adj.add(list);
		}
		int [] labels = new DepthFirstConnectivityLabeler(new AdjacencyList(adj)).computeLabels();
		assertArrayEquals(new int[] {0, 0, 0, 1, 1, 1, 1, 2, 1, 1, 1}, labels);
	}

	public void testEdgesMatchAdjacencyList() {
		int [][] edges = {{0, 1}, {0, 2}, {3, 4}, {3, 5}, {4, 9}, {6, 9}, {8, 9}, {8, 10}};
		AdjacencyList adj = AdjacencyList.fromEdges(11, edges);
		assertArrayEquals(new int[] {1, 2}, adj.getNeighbors(0));
		assertArrayEquals(new int[] {4, 6, 8}, adj.getNeighbors(9));
		assertEquals(0, adj.getDegree(7));
		assertEquals(16, adj.getNumEntries());
		int [] labels = new DepthFirstConnectivityLabeler(adj).computeLabels();
		assertArrayEquals(new int[] {0, 0, 0, 1, 1, 1, 1, 2, 1, 1, 1}, labels);
	}

	public void testEdgesAreFollowedAsListed() {
		int [] labels = new DepthFirstConnectivityLabeler(new AdjacencyList(new int[][] {{1}, {}})).computeLabels();
		assertArrayEquals(new int[] {0, 0}, labels);
		labels = new DepthFirstConnectivityLabeler(new AdjacencyList(new int[][] {{}, {0}})).computeLabels();
		assertArrayEquals(new int[] {0, 1}, labels);
	}

	public void testEmptyGraph() {
		DepthFirstConnectivityLabeler labeler = new DepthFirstConnectivityLabeler(new AdjacencyList(new int[0][]));
		assertEquals(0, labeler.computeLabels().length);
		assertEquals(0, labeler.getNumComponents());
	}

	public void testLongPath() {
		int n = 200000;
		int [][] edges = new int[n-1][];
		for(int i=0;i<n-1;i++) edges[i] = new int[] {i, i+1};
		DepthFirstConnectivityLabeler labeler = new DepthFirstConnectivityLabeler(AdjacencyList.fromEdges(n, edges));
		int [] labels = labeler.computeLabels();
		assertEquals(1, labeler.getNumComponents());
		for(int label:labels) assertEquals(0, label);
	}

	public void testPartitionMatchesUnionFind() {
		Random random = new Random(5);
		for(int t=0;t<20;t++) {
			int n = 100+random.nextInt(200);
			int m = random.nextInt(n);
			int [][] edges = new int[m][];
			DisjointSets sets = new DisjointSets(n);
			for(int k=0;k<m;k++) {
				edges[k] = new int[] {random.nextInt(n), random.nextInt(n)};
				sets.weightedUnion(edges[k][0], edges[k][1]);
			}
			DepthFirstConnectivityLabeler labeler = new DepthFirstConnectivityLabeler(AdjacencyList.fromEdges(n, edges));
			int [] labels = labeler.computeLabels();
			int k = labeler.getNumComponents();
			assertEquals(sets.getNumSubsets(), k);
			int nextLabel = 0;
			for(int v=0;v<n;v++) {
				assertTrue(labels[v]>=0 && labels[v]<k);
				//Labels appear for the first time in increasing order
				if(labels[v]==nextLabel) nextLabel++;
				else assertTrue(labels[v]<nextLabel);
			}
			for(int i=0;i<30;i++) {
				int a = random.nextInt(n);
				int b = random.nextInt(n);
				assertEquals(sets.sameSubsets(a, b), labels[a]==labels[b]);
			}
		}
	}

	public void testInvalidInput() {
		try {
			new AdjacencyList(new int[][] {{1}, {2}});
			fail("Neighbor out of range should be rejected");
		} catch (IndexOutOfBoundsException e) {
			//Expected
		}
		try {
			AdjacencyList.fromEdges(3, new int[][] {{0, 1, 2}});
			fail("Edges with three vertices should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			new DepthFirstConnectivityLabeler(new AdjacencyList(new int[][] {{}})).getLabels();
			fail("Labels are not available before computing them");
		} catch (IllegalStateException e) {
			//Expected
		}
	}
}
