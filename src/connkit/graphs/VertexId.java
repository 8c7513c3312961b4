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
 * Validated scalar vertex identifier. Used at the entry point of the weighted union,
 * which only accepts one pair of vertices per call
 * @author ConnectivityKit developers
 */
public final class VertexId implements Comparable<VertexId> {
	private final int id;

	private VertexId(int id) {
		this.id = id;
	}

	/**
	 * Creates a vertex id from a primitive value
	 * @param id Non negative vertex id
	 * @return VertexId wrapping the given value
	 * @throws IndexOutOfBoundsException If the id is negative
	 */
	public static VertexId of(int id) {
		if(id<0) throw new IndexOutOfBoundsException("Vertex ids must be non negative. Received: "+id);
		return new VertexId(id);
	}

	/**
	 * Creates a vertex id from an untyped value. Only integral scalars are accepted.
	 * Arrays, collections and floating point values are rejected
	 * @param value Object to convert
	 * @return VertexId with the value of the given object
	 * @throws IllegalArgumentException If the object is not an integral scalar
	 * @throws IndexOutOfBoundsException If the value is negative or larger than the largest int
	 */
	public static VertexId fromObject(Object value) {
		if(value instanceof VertexId) return (VertexId)value;
		if(value instanceof Integer || value instanceof Short || value instanceof Byte) {
			return of(((Number)value).intValue());
		}
		if(value instanceof Long) {
			long l = (Long)value;
			if(l<0 || l>Integer.MAX_VALUE) throw new IndexOutOfBoundsException("Vertex id "+l+" is out of the range of valid ids");
			return of((int)l);
		}
		String type = (value==null)?"null":value.getClass().getName();
		throw new IllegalArgumentException("Received ids must be integral scalars. Received value: "+value+" of type: "+type);
	}

	/**
	 * Parses a vertex id from a text token
	 * @param token Text with a non negative integer
	 * @return VertexId parsed from the token
	 * @throws IllegalArgumentException If the token is not an integer
	 * @throws IndexOutOfBoundsException If the integer is negative
	 */
	public static VertexId parse(String token) {
		if(token==null) throw new IllegalArgumentException("Can not parse a vertex id from a null token");
		try {
			return of(Integer.parseInt(token.trim()));
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException("Received id \""+token+"\" is not an integral vertex id",e);
		}
	}

	public int getId() {
		return id;
	}

	@Override
	public int compareTo(VertexId o) {
		return Integer.compare(id, o.id);
	}

	@Override
	public boolean equals(Object obj) {
		if(this==obj) return true;
		if(!(obj instanceof VertexId)) return false;
		return id == ((VertexId)obj).id;
	}

	@Override
	public int hashCode() {
		return Integer.hashCode(id);
	}

	@Override
	public String toString() {
		return String.valueOf(id);
	}
}
