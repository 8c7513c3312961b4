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

/**
 * Path compression variants applied while searching for roots
 */
public enum PathCompression {
	/**
	 * One pass. Every visited vertex is made to point to its grandparent
	 */
	PATH_HALVING("path_halving"),
	/**
	 * Two passes. The root is located first and then every visited vertex is made to point to it
	 */
	FULL("full");

	private final String externalName;

	PathCompression(String externalName) {
		this.externalName = externalName;
	}

	public String getExternalName() {
		return externalName;
	}

	/**
	 * Decodes a compression type from its external name. The name full_pc is accepted as an alias of full
	 * @param name External name or enum constant name, case insensitive
	 * @return PathCompression the decoded type
	 * @throws IllegalArgumentException If the name does not match any type
	 */
	public static PathCompression fromName(String name) {
		if(name==null) throw new IllegalArgumentException("Path compression type can not be null");
		String n = name.trim().toLowerCase();
		if("full_pc".equals(n)) return FULL;
		for(PathCompression type:values()) {
			if(type.externalName.equals(n) || type.name().toLowerCase().equals(n)) return type;
		}
		throw new IllegalArgumentException("Unrecognized path compression type: "+name+". Valid types: path_halving, full");
	}
}
