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

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Description of one command line program: its id, the class implementing it,
 * help texts, positional arguments and options
 */
public class Command {
	private final String id;
	private final Class<?> program;
	private String title;
	private String intro;
	private String description;
	private String groupId;

	private Map<String,Boolean> arguments = new LinkedHashMap<>();
	private Map<String, CommandOption> options = new LinkedHashMap<>();

	public Command(String id, Class<?> program) {
		this.id = id;
		this.program = program;
	}
	public String getId() {
		return id;
	}
	public Class<?> getProgram() {
		return program;
	}
	public String getTitle() {
		return title;
	}
	public void setTitle(String title) {
		this.title = title;
	}
	public String getIntro() {
		return intro;
	}
	public void setIntro(String intro) {
		this.intro = intro;
	}
	public String getDescription() {
		return description;
	}
	public void setDescription(String description) {
		this.description = description;
	}
	public String getGroupId() {
		return groupId;
	}
	public void setGroupId(String groupId) {
		this.groupId = groupId;
	}
	/**
	 * @return List<String> names of the positional arguments in order
	 */
	public List<String> getArguments() {
		return new ArrayList<>(arguments.keySet());
	}
	/**
	 * @param argument Name of a positional argument
	 * @return boolean true if the argument can be repeated
	 */
	public boolean isMultiple(String argument) {
		Boolean mult = arguments.get(argument);
		return mult!=null && mult;
	}
	public void addArgument(String argument, boolean isMultiple) {
		arguments.put(argument,isMultiple);
	}
	public List<CommandOption> getOptionsList() {
		return new ArrayList<>(options.values());
	}
	public void addOption(CommandOption option) {
		if(options.containsKey(option.getId())) throw new IllegalArgumentException("Duplicated option id: "+option.getId()+" for command: "+id);
		options.put(option.getId(), option);
	}
	public CommandOption getOption(String optionId) {
		return options.get(optionId);
	}
}
