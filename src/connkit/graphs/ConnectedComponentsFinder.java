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
 * Program to label the connected components of a graph stored as an adjacency list or as a list of edges
 */
public class ConnectedComponentsFinder {

	public static final int DEF_NUM_VERTICES = 0;
	private Logger log = Logger.getLogger(ConnectedComponentsFinder.class.getName());
	private boolean edgeList = false;
	private int numVertices = DEF_NUM_VERTICES;

	public static void main(String[] args) throws Exception {
		ConnectedComponentsFinder instance = new ConnectedComponentsFinder();
		int i = CommandsDescriptor.getInstance().loadOptions(instance, args);
		instance.run(args[i], System.out);
	}

	public Logger getLog() {
		return log;
	}
	public void setLog(Logger log) {
		this.log = log;
	}
	public boolean isEdgeList() {
		return edgeList;
	}
	public void setEdgeList(boolean edgeList) {
		this.edgeList = edgeList;
	}
	public void setEdgeList(Boolean edgeList) {
		setEdgeList(edgeList.booleanValue());
	}
	public int getNumVertices() {
		return numVertices;
	}
	/**
	 * @param numVertices Number of vertices of the graph. If zero, it is inferred from the input
	 */
	public void setNumVertices(int numVertices) {
		if(numVertices<0) throw new IllegalArgumentException("Number of vertices can not be negative: "+numVertices);
		this.numVertices = numVertices;
	}
	public void setNumVertices(String value) {
		setNumVertices((int)OptionValuesDecoder.decode(value, Integer.class));
	}

	/**
	 * Labels the components of the graph in the given file
	 * @param filename Input file. A dash means standard input
	 * @param out Stream to print one line per vertex with its label
	 * @return int [] labels of the vertices
	 * @throws IOException If the input can not be read
	 */
	public int [] run(String filename, PrintStream out) throws IOException {
		AdjacencyList adjacencyList;
		try (BufferedReader in = ParseUtils.openReader(filename)) {
			adjacencyList = edgeList?loadEdges(in):loadAdjacencyList(in);
		}
		log.info("Loaded graph with "+adjacencyList.getNumVertices()+" vertices and "+adjacencyList.getNumEntries()+" adjacency entries from "+filename);
		DepthFirstConnectivityLabeler labeler = new DepthFirstConnectivityLabeler(adjacencyList);
		int [] labels = labeler.computeLabels();
		log.info("Found "+labeler.getNumComponents()+" connected components");
		for(int v=0;v<labels.length;v++) out.println(v+"\t"+labels[v]);
		out.flush();
		return labels;
	}

	/**
	 * Loads an adjacency list in which line i contains the neighbors of vertex i.
	 * Lines starting with # are ignored
	 * @param in Reader of the input
	 * @return AdjacencyList loaded graph
	 * @throws IOException If the input can not be read
	 */
	public AdjacencyList loadAdjacencyList(BufferedReader in) throws IOException {
		List<int []> neighbors = new ArrayList<>();
		String line = in.readLine();
		for(int lineNumber=1;line!=null;lineNumber++) {
			if(!line.startsWith("#")) {
				try {
					neighbors.add(ParseUtils.parseIntegers(line));
				} catch (NumberFormatException e) {
					throw new IOException("Invalid neighbor at line "+lineNumber+": "+line,e);
				}
			}
			line = in.readLine();
		}
		if(numVertices>0 && neighbors.size()>numVertices) throw new IOException("Found "+neighbors.size()+" adjacency lines for a graph of "+numVertices+" vertices");
		while(neighbors.size()<numVertices) neighbors.add(new int[0]);
		return new AdjacencyList(neighbors.toArray(new int[0][]));
	}

	/**
	 * Loads a list of undirected edges, one pair of vertex ids per line
	 * @param in Reader of the input
	 * @return AdjacencyList with reciprocal entries for each edge
	 * @throws IOException If the input can not be read or a line does not have two vertex ids
	 */
	public AdjacencyList loadEdges(BufferedReader in) throws IOException {
		List<int []> edges = new ArrayList<>();
		int maxVertex = -1;
		String line = in.readLine();
		for(int lineNumber=1;line!=null;lineNumber++) {
			if(!line.startsWith("#") && line.trim().length()>0) {
				int [] edge;
				try {
					edge = ParseUtils.parseIntegers(line);
				} catch (NumberFormatException e) {
					throw new IOException("Invalid vertex id at line "+lineNumber+": "+line,e);
				}
				if(edge.length!=2) throw new IOException("Line "+lineNumber+" does not contain exactly two vertex ids: "+line);
				maxVertex = Math.max(maxVertex, Math.max(edge[0], edge[1]));
				edges.add(edge);
			}
			line = in.readLine();
		}
		int n = numVertices>0?numVertices:maxVertex+1;
		return AdjacencyList.fromEdges(n, edges.toArray(new int[0][]));
	}
}
