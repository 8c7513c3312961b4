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

import java.lang.reflect.Method;

import connkit.graphs.PathCompression;

/**
 * Option of a command line program. Each option is bound to an attribute of the program,
 * which is set through its setter method
 */
public class CommandOption {
	public static final String TYPE_INT = "INT";
	public static final String TYPE_STRING = "STRING";
	public static final String TYPE_FILE = "FILE";
	public static final String TYPE_COMPRESSION = "COMPRESSION";
	public static final String TYPE_BOOLEAN = "BOOLEAN";

	private final String id;
	private String type = TYPE_BOOLEAN;
	private String defaultValue=null;
	private String description;
	private String attribute;

	public CommandOption(String id) {
		this.id = id;
	}
	public String getId() {
		return id;
	}
	public String getType() {
		return type;
	}
	public void setType(String type) {
		getTypeClass(type);
		this.type = type;
	}
	public String getDefaultValue() {
		return defaultValue;
	}
	public void setDefaultValue(String defaultValue) {
		this.defaultValue = defaultValue;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	public String getAttribute() {
		return attribute;
	}
	public void setAttribute(String attribute) {
		this.attribute = attribute;
	}
	public boolean isBoolean() {
		return TYPE_BOOLEAN.equals(type);
	}
	public int getPrintLength() {
		int length = id.length()+9;
		if(!isBoolean()) length+=type.length()+1;
		return length;
	}
	/**
	 * Finds the setter of the attribute bound to this option. A setter receiving the type
	 * of the option is preferred over a setter receiving a String
	 * @param instance Object implementing the program
	 * @return Method setter to call with the option value
	 */
	public Method findSetMethod (Object instance) {
		if(attribute==null || attribute.length()==0) throw new RuntimeException("Attribute not set for option: "+id);
		String methodName = "set"+Character.toUpperCase(attribute.charAt(0))+attribute.substring(1);
		Class<?> typeClass = getTypeClass(type);
		try {
			return instance.getClass().getMethod(methodName,typeClass);
		} catch (NoSuchMethodException e) {
			try {
				return instance.getClass().getMethod(methodName,String.class);
			} catch (NoSuchMethodException e1) {
				throw new RuntimeException("Class "+instance.getClass().getName()+" does not have a setter "+methodName+" for option "+id, e1);
			}
		}
	}
	private static Class<?> getTypeClass(String type) {
		if(TYPE_BOOLEAN.equals(type)) return Boolean.class;
		if(TYPE_INT.equals(type)) return Integer.class;
		if(TYPE_COMPRESSION.equals(type)) return PathCompression.class;
		if(TYPE_STRING.equals(type) || TYPE_FILE.equals(type)) return String.class;
		throw new RuntimeException("Can not decode option of unrecognized type: "+type);
	}
	public Object decodeValue (String value) {
		return OptionValuesDecoder.decode(value, getTypeClass(type));
	}
}
