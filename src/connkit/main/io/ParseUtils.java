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
package connkit.main.io;

import java.io.BufferedReader;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

public class ParseUtils {

	/**
	 * Parse the given string sequence looking for two delimiters. Consecutive delimiters
	 * produce empty tokens
	 * @param s The string to parse
	 * @param delim1 First delimiter
	 * @param delim2 Second delimiter
	 * @return String [] Array of strings with the identified tokens
	 */
	public static String[] parseString(String s,char delim1, char delim2) {
		char [] a = s.toCharArray();
		List<String> answer = new ArrayList<String>();
		StringBuilder current = new StringBuilder(a.length);
		for (int i=0;i<a.length;i++) {
			if(a[i] == delim1 || a[i] == delim2) {
				answer.add(current.toString());
				current = new StringBuilder(a.length);
				continue;
			}
			current.append(a[i]);
		}
		answer.add(current.toString());
		return answer.toArray(new String[0]);
	}

	/**
	 * Parses the integers of a line separated by tabs or spaces. Empty tokens are ignored
	 * @param line Line to parse
	 * @return int [] Integers found in the line
	 * @throws NumberFormatException If a token is not an integer
	 */
	public static int [] parseIntegers(String line) {
		String [] items = parseString(line, '\t', ' ');
		int [] values = new int[items.length];
		int n = 0;
		for(String item:items) {
			String token = item.trim();
			if(token.length()==0) continue;
			values[n++] = Integer.parseInt(token);
		}
		int [] answer = new int[n];
		System.arraycopy(values, 0, answer, 0, n);
		return answer;
	}

	/**
	 * Opens a text reader over a file or over the standard input if the file name is a dash
	 * @param filename Name of the file or - for the standard input
	 * @return BufferedReader ready to read lines
	 * @throws IOException If the file can not be opened
	 */
	public static BufferedReader openReader(String filename) throws IOException {
		InputStream in = "-".equals(filename)?System.in:new FileInputStream(filename);
		return new BufferedReader(new InputStreamReader(in,StandardCharsets.UTF_8));
	}
}
