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
package connkit;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.util.Arrays;

import connkit.main.Command;
import connkit.main.CommandsDescriptor;

public class ConnectivityKit {

	/**
	 * Runs the command given as first argument with the remaining arguments
	 * @param args Command id followed by its options and arguments
	 */
	public static void main(String[] args) throws Exception {
		CommandsDescriptor descriptor = CommandsDescriptor.getInstance();
		if(args.length == 0 || args[0].equals("help") || args[0].equals("-h") || args[0].equals("--help")){
			descriptor.printUsage(System.err);
			return;
		} else if(args[0].equals("version") || args[0].equals("-v") || args[0].equals("--version")){
			descriptor.printVersion(System.err);
			return;
		}
		Command command = descriptor.getCommand(args[0]);
		if(command == null) {
			System.err.println("ERROR: Unrecognized command "+args[0]);
			descriptor.printUsage(System.err);
			System.exit(1);
		}
		Method main = command.getProgram().getDeclaredMethod("main", String[].class);
		String[] mainArgs = Arrays.copyOfRange(args, 1, args.length);
		try {
			main.invoke(null, (Object)mainArgs);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if(cause instanceof Exception) throw (Exception)cause;
			throw e;
		}
	}

}
