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
package connkit.main;

import connkit.graphs.PathCompression;

public class OptionValuesDecoder {
	/**
	 * Decodes the value of an option
	 * @param value Text given in the command line
	 * @param type Class of the decoded value
	 * @return Object decoded value
	 * @throws NumberFormatException If a numeric value can not be parsed
	 * @throws IllegalArgumentException If the value can not be decoded to the given type
	 */
	public static Object decode (String value, Class<?> type) {
		if(Integer.class.equals(type)) {
			return Integer.parseInt(value);
		}
		if(Boolean.class.equals(type)) {
			return Boolean.parseBoolean(value);
		}
		if(PathCompression.class.equals(type)) {
			return PathCompression.fromName(value);
		}
		if(String.class.equals(type)) {
			return value;
		}
		throw new IllegalArgumentException("Can not decode value of type: "+type.toString());
	}
}
