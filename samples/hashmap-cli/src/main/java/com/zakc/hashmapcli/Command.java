/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.hashmapcli;

/**
 * The commands understood by the shell, in the order in which the help lists them.
 */
public enum Command
{
	HELP("help", "Print this help message"),
	PRINT("print", "Print the entire hash map"),
	NEW("new", "Create a new hash map"),
	INSERT("insert", "Insert a new key-value pair into the hash map"),
	REMOVE("remove", "Remove a key-value pair from the hash map"),
	GET("get", "Retrieve the value associated with a given key"),
	CONTAINS("contains", "Check if the hash map contains a given key"),
	DROP("drop", "Delete the entire hash map"),
	LEN("len", "Print the number of items in the hash map"),
	CAPACITY("capacity", "Print the current capacity of the hash map"),
	RESERVE("reserve", "Change the capacity of the hash map"),
	QUIT("quit", "Exit the program");

	private final String cmdName;
	private final String description;

	Command(String cmdName, String description) {
		this.cmdName = cmdName;
		this.description = description;
	}

	public String getName() {return cmdName;}
	public String getDescription() {return description;}

	// command names are case-sensitive and must match exactly
	public static Command lookup(String name)
	{
		for (Command cmd : values()) {
			if (cmd.cmdName.equals(name)) return cmd;
		}
		return null;
	}
}
