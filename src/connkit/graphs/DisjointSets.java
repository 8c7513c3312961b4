package connkit.graphs;

import java.util.HashMap;
import java.util.Map;
import java.util.Set;
import java.util.TreeSet;

/**
 * Union-find engine over a single parent mapping. Offers batched root lookups and quick unions,
 * plus the weighted union which only accepts one pair of vertices per call.
 * Lookups with compression and both unions modify the mapping. The queries
 * sameSubsets, getNumSubsets and getSubsets never modify it.
 *
 * Quick unions do not update the sizes used by weighted unions, following the behavior of
 * {@link QuickUnionBuilder}
 */
public class DisjointSets {
	private final ParentMapping mapping;
	private final RootFinder finder;
	private final QuickUnionBuilder quickUnion;
	private final WeightedQuickUnionBuilder weightedUnion;

	public DisjointSets (int n) {
		this(ParentMapping.identity(n));
	}

	public DisjointSets (int [] parents) {
		this(new ParentMapping(parents));
	}

	public DisjointSets (ParentMapping mapping) {
		this.mapping = mapping;
		this.finder = new RootFinder(mapping);
		this.quickUnion = new QuickUnionBuilder(finder);
		this.weightedUnion = new WeightedQuickUnionBuilder(finder);
	}

	public ParentMapping getMapping() {
		return mapping;
	}

	public WeightedQuickUnionBuilder getWeightedUnionBuilder() {
		return weightedUnion;
	}

	public int size() {
		return mapping.size();
	}

	public int [] findRoots(int [] vertices) {
		return finder.findRoots(vertices);
	}

	public int [] findRoots(int [] vertices, PathCompression mode) {
		return finder.findRoots(vertices, mode);
	}

	public int [] findRoots(int [] vertices, boolean compress, PathCompression mode) {
		if(compress) return finder.findRoots(vertices, mode);
		return finder.findRoots(vertices);
	}

	public int find (int i) {
		return finder.findRoot(i, PathCompression.PATH_HALVING);
	}

	public void union (int [] minor, int [] main) {
		quickUnion.union(minor, main);
	}

	public void union (int [] minor, int [] main, boolean compress, PathCompression mode) {
		quickUnion.union(minor, main, compress, mode);
	}

	public void weightedUnion (int minor, int main) {
		weightedUnion.union(minor, main);
	}

	public void weightedUnion (VertexId minor, VertexId main, boolean compress, PathCompression mode) {
		weightedUnion.union(minor, main, compress, mode);
	}

	/**
	 * Appends singleton vertices. The sizes table of the weighted union is rebuilt on its next use
	 * @param count Number of vertices to add
	 * @return int id of the first new vertex
	 */
	public int addVertices(int count) {
		return mapping.addVertices(count);
	}

	public boolean sameSubsets(int i, int j) {
		int [] roots = finder.findRoots(new int[] {i, j});
		return roots[0]==roots[1];
	}

	public int getNumSubsets() {
		int count = 0;
		for(int i=0;i<mapping.size();i++) {
			if(mapping.parentOf(i)==i) count++;
		}
		return count;
	}

	/**
	 * @return Map<Integer,Set<Integer>> Vertices of each subset indexed by root
	 */
	public Map<Integer,Set<Integer>> getSubsets() {
		int n = mapping.size();
		int [] all = new int[n];
		for(int i=0;i<n;i++) all[i] = i;
		int [] roots = finder.findRoots(all);
		Map<Integer,Set<Integer>> subsetsMap = new HashMap<>();
		for(int i=0;i<n;i++) {
			Set<Integer> set = subsetsMap.computeIfAbsent(roots[i],l->new TreeSet<>());
			set.add(i);
		}
		return subsetsMap;
	}

	public int [] getParents() {
		return mapping.toArray();
	}
}
