package connkit.graphs.test;

import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

import junit.framework.TestCase;
import connkit.graphs.DisjointSets;
import connkit.graphs.PathCompression;
import connkit.graphs.VertexId;

import static connkit.graphs.test.RootFinderTest.assertArrayEquals;

public class DisjointSetsTest extends TestCase {
	private static final int [] GRAPH = {0, 0, 0, 3, 3, 3, 9, 7, 9, 4, 8};

	public void testQueriesDoNotModify() {
		DisjointSets sets = new DisjointSets(GRAPH);
		assertTrue(sets.sameSubsets(1, 2));
		assertTrue(sets.sameSubsets(10, 5));
		assertFalse(sets.sameSubsets(7, 0));
		assertEquals(3, sets.getNumSubsets());
		Map<Integer,Set<Integer>> subsets = sets.getSubsets();
		assertEquals(3, subsets.size());
		assertEquals(new TreeSet<>(java.util.Arrays.asList(0, 1, 2)), subsets.get(0));
		assertEquals(new TreeSet<>(java.util.Arrays.asList(3, 4, 5, 6, 8, 9, 10)), subsets.get(3));
		assertEquals(1, subsets.get(7).size());
		assertArrayEquals(GRAPH, sets.getParents());
	}

	public void testFindCompresses() {
		DisjointSets sets = new DisjointSets(GRAPH);
		assertEquals(3, sets.find(10));
		assertArrayEquals(new int[] {0, 0, 0, 3, 3, 3, 9, 7, 9, 3, 9}, sets.getParents());
		assertArrayEquals(new int[] {3, 3}, sets.findRoots(new int[] {6, 8}, false, PathCompression.FULL));
		assertArrayEquals(new int[] {0, 0, 0, 3, 3, 3, 9, 7, 9, 3, 9}, sets.getParents());
	}

	public void testMixedUnions() {
		DisjointSets sets = new DisjointSets(6);
		sets.union(new int[] {0, 2}, new int[] {1, 3});
		assertEquals(4, sets.getNumSubsets());
		sets.weightedUnion(VertexId.of(4), VertexId.of(0), true, PathCompression.FULL);
		assertTrue(sets.sameSubsets(4, 1));
		sets.weightedUnion(5, 2);
		assertTrue(sets.sameSubsets(5, 3));
		assertEquals(2, sets.getNumSubsets());
		assertEquals(6, sets.getWeightedUnionBuilder().getRootSizeTable().getTotalSize());
	}

	public void testAddVertices() {
		DisjointSets sets = new DisjointSets(GRAPH);
		sets.weightedUnion(2, 7);
		assertEquals(11, sets.addVertices(1));
		assertEquals(12, sets.size());
		assertEquals(3, sets.getNumSubsets());
		sets.weightedUnion(11, 0);
		assertEquals(0, sets.getParents()[11]);
		assertEquals(5, sets.getWeightedUnionBuilder().getRootSizeTable().getSize(0));
		assertEquals(12, sets.getWeightedUnionBuilder().getRootSizeTable().getTotalSize());
	}
}
