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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.PrintStream;
import java.util.ArrayList;
import java.util.List;
import java.util.logging.Logger;

import connkit.main.CommandsDescriptor;
import connkit.main.OptionValuesDecoder;
import connkit.main.io.ParseUtils;

/**
 * Program to apply a sequence of unions to an initial forest given as a parents array
 */
public class DisjointSetsMerger {

	public static final int DEF_BATCH_SIZE = 1;
	private Logger log = Logger.getLogger(DisjointSetsMerger.class.getName());
	private boolean weighted = false;
	private boolean noCompression = false;
	private PathCompression compressionType = PathCompression.PATH_HALVING;
	private int batchSize = DEF_BATCH_SIZE;

	public static void main(String[] args) throws Exception {
		DisjointSetsMerger instance = new DisjointSetsMerger();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		String parentsFile = args[i++];
		String unionsFile = args[i];
		instance.run(parentsFile, unionsFile, System.out);
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public boolean isWeighted() {
		return weighted;
	}
	public void setWeighted(boolean weighted) {
		this.weighted = weighted;
	}
	public void setWeighted(Boolean weighted) {
		setWeighted(weighted.booleanValue());
	}
	public boolean isNoCompression() {
		return noCompression;
	}
	public void setNoCompression(boolean noCompression) {
		this.noCompression = noCompression;
	}
	public void setNoCompression(Boolean noCompression) {
		setNoCompression(noCompression.booleanValue());
	}
	public PathCompression getCompressionType() {
		return compressionType;
	}
	public void setCompressionType(PathCompression compressionType) {
		this.compressionType = compressionType;
	}
	public int getBatchSize() {
		return batchSize;
	}
	/**
	 * @param batchSize Number of consecutive pairs sent in each call to the quick union. Ignored for weighted unions
	 */
	public void setBatchSize(int batchSize) {
		if(batchSize<1) throw new IllegalArgumentException("Batch size must be positive. Received: "+batchSize);
		this.batchSize = batchSize;
	}
	public void setBatchSize(String value) {
		setBatchSize((int)OptionValuesDecoder.decode(value, Integer.class));
	}

	/**
	 * Loads the forest and the unions, applies the unions and prints the resulting forest
	 * @param parentsFile File with the parent of each vertex. A dash means standard input
	 * @param unionsFile File with one pair of vertices per line
	 * @param out Stream to print one line per vertex with its parent and its root
	 * @return DisjointSets after all unions
	 * @throws IOException If one of the files can not be read
	 */
	public DisjointSets run(String parentsFile, String unionsFile, PrintStream out) throws IOException {
		int [] parents;
		try (BufferedReader in = ParseUtils.openReader(parentsFile)) {
			parents = loadParents(in);
		}
		log.info("Loaded parents of "+parents.length+" vertices from "+parentsFile);
		List<int []> pairs;
		try (BufferedReader in = ParseUtils.openReader(unionsFile)) {
			pairs = loadPairs(in);
		}
		log.info("Loaded "+pairs.size()+" unions from "+unionsFile);
		DisjointSets sets = new DisjointSets(parents);
		process(sets, pairs);
		log.info("Unions finished. Number of subsets: "+sets.getNumSubsets());
		int [] finalParents = sets.getParents();
		int [] all = new int[finalParents.length];
		for(int v=0;v<all.length;v++) all[v] = v;
		int [] roots = sets.findRoots(all);
		for(int v=0;v<finalParents.length;v++) out.println(v+"\t"+finalParents[v]+"\t"+roots[v]);
		out.flush();
		return sets;
	}

	/**
	 * Applies the given unions pair by pair (weighted) or in batches (quick union)
	 * @param sets Structure to modify
	 * @param pairs Pairs of minor and main vertices
	 */
	public void process(DisjointSets sets, List<int []> pairs) {
		boolean compress = !noCompression;
		if(weighted) {
			for(int [] pair:pairs) {
				sets.weightedUnion(VertexId.of(pair[0]), VertexId.of(pair[1]), compress, compressionType);
			}
			return;
		}
		for(int start=0;start<pairs.size();start+=batchSize) {
			int end = Math.min(pairs.size(), start+batchSize);
			int [] minor = new int[end-start];
			int [] main = new int[end-start];
			for(int k=start;k<end;k++) {
				minor[k-start] = pairs.get(k)[0];
				main[k-start] = pairs.get(k)[1];
			}
			sets.union(minor, main, compress, compressionType);
		}
	}

	/**
	 * Loads the parents array. Ids can be separated by tabs, spaces or new lines
	 * @param in Reader of the parents
	 * @return int [] Parent of each vertex
	 * @throws IOException If the input can not be read or contains non integer values
	 */
	public int [] loadParents(BufferedReader in) throws IOException {
		List<Integer> parents = new ArrayList<>();
		String line = in.readLine();
		for(int lineNumber=1;line!=null;lineNumber++) {
			if(!line.startsWith("#")) {
				try {
					for(int p:ParseUtils.parseIntegers(line)) parents.add(p);
				} catch (NumberFormatException e) {
					throw new IOException("Invalid parent id at line "+lineNumber+": "+line,e);
				}
			}
			line = in.readLine();
		}
		int [] answer = new int[parents.size()];
		for(int i=0;i<answer.length;i++) answer[i] = parents.get(i);
		return answer;
	}

	/**
	 * Loads pairs of minor and main vertices, one pair per line
	 * @param in Reader of the unions
	 * @return List<int []> Pairs in the order of the input
	 * @throws IOException If the input can not be read or a line does not contain exactly two vertex ids
	 */
	public List<int []> loadPairs(BufferedReader in) throws IOException {
		List<int []> pairs = new ArrayList<>();
		String line = in.readLine();
		for(int lineNumber=1;line!=null;lineNumber++) {
			if(!line.startsWith("#") && line.trim().length()>0) {
				String [] items = ParseUtils.parseString(line.trim(), '\t', ' ');
				List<VertexId> ids = new ArrayList<>(2);
				for(String item:items) {
					if(item.length()==0) continue;
					try {
						ids.add(VertexId.parse(item));
					} catch (IllegalArgumentException | IndexOutOfBoundsException e) {
						throw new IOException("Invalid vertex id at line "+lineNumber+": "+line,e);
					}
				}
				if(ids.size()!=2) throw new IOException("Line "+lineNumber+" does not contain exactly two vertex ids: "+line);
				pairs.add(new int[] {ids.get(0).getId(), ids.get(1).getId()});
			}
			line = in.readLine();
		}
		return pairs;
	}
}
