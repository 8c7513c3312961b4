package connkit.graphs.test;

import java.util.Map;
import java.util.Random;

import junit.framework.TestCase;
import connkit.graphs.ParentMapping;
import connkit.graphs.PathCompression;
import connkit.graphs.RootFinder;
import connkit.graphs.RootSizeTable;
import connkit.graphs.VertexId;
import connkit.graphs.WeightedQuickUnionBuilder;

import static connkit.graphs.test.RootFinderTest.assertArrayEquals;

public class WeightedQuickUnionBuilderTest extends TestCase {
	private static final int [] GRAPH = {0, 0, 0, 3, 3, 3, 9, 7, 9, 4, 8};

	public void testWeightedUnion() {
		ParentMapping mapping = new ParentMapping(GRAPH);
		WeightedQuickUnionBuilder builder = new WeightedQuickUnionBuilder(mapping);
		assertFalse(builder.hasRootSizeTable());
		builder.union(2, 7);
		assertTrue(builder.hasRootSizeTable());
		assertArrayEquals(new int[] {0, 0, 0, 3, 3, 3, 3, 0, 3, 3, 3}, mapping.toArray());
		RootSizeTable table = builder.getRootSizeTable();
		Map<Integer,Integer> sizes = table.getSizesByRoot();
		assertEquals(2, sizes.size());
		assertEquals(Integer.valueOf(4), sizes.get(0));
		assertEquals(Integer.valueOf(7), sizes.get(3));
		assertArrayEquals(new int[] {0, 0, 0, 3, 3, 3, 3, 0, 3, 3, 3}, table.getRootsSnapshot());
	}

	public void testTiesKeepMainRoot() {
		ParentMapping mapping = ParentMapping.identity(4);
		WeightedQuickUnionBuilder builder = new WeightedQuickUnionBuilder(mapping);
		builder.union(0, 1);
		assertEquals(1, mapping.getParent(0));
		builder.union(3, 2);
		assertEquals(2, mapping.getParent(3));
		builder.union(2, 0);
		assertEquals(1, mapping.getParent(2));
		assertEquals(4, builder.getRootSizeTable().getSize(1));
		assertEquals(1, builder.getRootSizeTable().getNumRoots());
	}

	public void testSameRootIsNoOp() {
		ParentMapping mapping = new ParentMapping(GRAPH);
		WeightedQuickUnionBuilder builder = new WeightedQuickUnionBuilder(mapping);
		builder.union(VertexId.of(1), VertexId.of(2), false, PathCompression.FULL);
		assertArrayEquals(GRAPH, mapping.toArray());
		assertFalse(builder.hasRootSizeTable());
	}

	public void testSizeConservationAndConnectivity() {
		Random random = new Random(11);
		int n = 500;
		for(PathCompression mode:PathCompression.values()) {
			ParentMapping mapping = ParentMapping.identity(n);
			RootFinder finder = new RootFinder(mapping);
			WeightedQuickUnionBuilder builder = new WeightedQuickUnionBuilder(finder);
			for(int t=0;t<400;t++) {
				int a = random.nextInt(n);
				int b = random.nextInt(n);
				builder.union(VertexId.of(a), VertexId.of(b), random.nextBoolean(), mode);
				assertEquals(finder.findRoot(a), finder.findRoot(b));
				if(builder.hasRootSizeTable()) {
					RootSizeTable table = builder.getRootSizeTable();
					assertEquals(n, table.getTotalSize());
					int root = finder.findRoot(a);
					int count = 0;
					for(int v=0;v<n;v++) if(finder.findRoot(v)==root) count++;
					assertEquals(count, table.getSize(root));
				}
			}
		}
	}

	public void testHeightIsLogarithmic() {
		int n = 1024;
		Random random = new Random(3);
		ParentMapping mapping = ParentMapping.identity(n);
		WeightedQuickUnionBuilder builder = new WeightedQuickUnionBuilder(mapping);
		for(int t=0;t<5000;t++) {
			builder.union(VertexId.of(random.nextInt(n)), VertexId.of(random.nextInt(n)), false, PathCompression.PATH_HALVING);
		}
		for(int v=0;v<n;v++) {
			int depth = 0;
			int x = v;
			while(mapping.getParent(x)!=x) {
				x = mapping.getParent(x);
				depth++;
			}
			assertTrue("Depth "+depth+" of vertex "+v, depth<=10);
		}
	}

	public void testRebuildAfterAddingVertices() {
		ParentMapping mapping = ParentMapping.identity(4);
		WeightedQuickUnionBuilder builder = new WeightedQuickUnionBuilder(mapping);
		builder.union(0, 1);
		assertEquals(4, builder.getRootSizeTable().getNumVertices());
		mapping.addVertices(2);
		builder.union(4, 1);
		RootSizeTable table = builder.getRootSizeTable();
		assertEquals(6, table.getNumVertices());
		assertEquals(6, table.getTotalSize());
		assertEquals(3, table.getSize(1));
		assertEquals(1, mapping.getParent(4));
		assertEquals(4, table.getNumRoots());
	}

	public void testRejectsNonScalarIds() {
		WeightedQuickUnionBuilder builder = new WeightedQuickUnionBuilder(new ParentMapping(GRAPH));
		try {
			builder.union(2.5, 7, true, PathCompression.PATH_HALVING);
			fail("Floating point ids should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			builder.union(new int[] {2, 0}, new int[] {7, 6}, true, PathCompression.PATH_HALVING);
			fail("Arrays of ids should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			builder.union(2, 11);
			fail("Vertex out of range should be rejected");
		} catch (IndexOutOfBoundsException e) {
			//Expected
		}
		builder.union(2L, 7, true, PathCompression.FULL);
		assertEquals(0, builder.getRootSizeTable().getRootsSnapshot()[7]);
	}

	public void testVertexIds() {
		assertEquals(5, VertexId.parse(" 5 ").getId());
		assertEquals(VertexId.of(3), VertexId.fromObject(Short.valueOf((short)3)));
		try {
			VertexId.of(-1);
			fail("Negative ids should be rejected");
		} catch (IndexOutOfBoundsException e) {
			//Expected
		}
		try {
			VertexId.parse("2.0");
			fail("Non integral ids should be rejected");
		} catch (IllegalArgumentException e) {
			//Expected
		}
		try {
			VertexId.fromObject(1L+Integer.MAX_VALUE);
			fail("Ids out of the int range should be rejected");
		} catch (IndexOutOfBoundsException e) {
			//Expected
		}
		try {
			VertexId.parse("-3");
			fail("Negative ids should be rejected");
		} catch (IndexOutOfBoundsException e) {
			//Expected
		}
	}

	public void testNegativeIdsDoNotChangeMapping() {
		ParentMapping mapping = new ParentMapping(GRAPH);
		WeightedQuickUnionBuilder builder = new WeightedQuickUnionBuilder(mapping);
		int [] before = mapping.toArray();
		try {
			builder.union(-4294967295L, 7L, true, PathCompression.PATH_HALVING);
			fail("Long ids below the int range should be rejected");
		} catch (IndexOutOfBoundsException e) {
			//Expected
		}
		try {
			builder.union(-1, 2);
			fail("Negative ids should be rejected");
		} catch (IndexOutOfBoundsException e) {
			//Expected
		}
		try {
			builder.union(Long.valueOf(-1), 2, false, PathCompression.FULL);
			fail("Negative long ids should be rejected");
		} catch (IndexOutOfBoundsException e) {
			//Expected
		}
		assertArrayEquals(before, mapping.toArray());
		assertFalse(builder.hasRootSizeTable());
	}

	public void testSizeTableAccessCompressesMapping() {
		ParentMapping mapping = new ParentMapping(GRAPH);
		WeightedQuickUnionBuilder builder = new WeightedQuickUnionBuilder(mapping);
		assertFalse(builder.hasRootSizeTable());
		RootSizeTable table = builder.getRootSizeTable();
		assertTrue(builder.hasRootSizeTable());
		assertEquals(GRAPH.length, table.getTotalSize());
		for(int v=0;v<mapping.size();v++) {
			assertTrue(mapping.isRoot(mapping.getParent(v)));
		}
		assertSame(table, builder.getRootSizeTable());
	}
}
