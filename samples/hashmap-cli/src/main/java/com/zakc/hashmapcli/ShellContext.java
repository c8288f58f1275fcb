/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.hashmapcli;

import com.zakc.base.collections.HashMap;
import com.zakc.base.config.SysProps;
import com.zakc.logging.Logger;

/**
 * Holds the state of a shell session, ie. its I/O streams, its diagnostics logger and the hash map it operates on.
 * <br>
 * The map is null until the user creates it.
 */
public class ShellContext
{
	public static final String SYSPROP_KEYSIZE = "zakc.hashmapcli.keysize";

	private final java.io.BufferedReader in;
	private final java.io.PrintStream out;
	private final Logger log;
	private final int keysize;

	private HashMap<String, Integer> map;

	public ShellContext(java.io.InputStream in, java.io.PrintStream out, Logger log)
	{
		this(new java.io.BufferedReader(new java.io.InputStreamReader(in, java.nio.charset.StandardCharsets.UTF_8)), out, log,
				SysProps.get(SYSPROP_KEYSIZE, 64));
	}

	public ShellContext(java.io.BufferedReader in, java.io.PrintStream out, Logger log, int keysize)
	{
		if (keysize < 2) throw new IllegalArgumentException("Key buffer size must be at least 2 - "+keysize);
		this.in = in;
		this.out = out;
		this.log = log;
		this.keysize = keysize;
	}

	public HashMap<String, Integer> getMap() {return map;}
	public void setMap(HashMap<String, Integer> map) {this.map = map;}
	public Logger getLogger() {return log;}
	public java.io.PrintStream getOutput() {return out;}
	public int getKeySize() {return keysize;}

	public void println(String txt)
	{
		out.println(txt);
	}

	/**
	 * Displays the prompt and returns the next line of input, without its line terminator.
	 * Returns null on end of input.
	 */
	public String prompt(String txt) throws java.io.IOException
	{
		out.print(txt);
		out.flush();
		return in.readLine();
	}

	/**
	 * Prompts for a key, which is truncated to one less than the key buffer size, mirroring a fixed-size line buffer that
	 * also has to hold the terminator.
	 */
	public String promptKey() throws java.io.IOException
	{
		String key = prompt("Enter key: ");
		if (key != null && key.length() >= keysize) key = key.substring(0, keysize - 1);
		return key;
	}

	/**
	 * Prompts for an integer. Returns null on end of input, and logs an error and returns null if the input is not an integer.
	 */
	public Integer promptInt(String txt) throws java.io.IOException
	{
		String line = prompt(txt);
		if (line == null) return null;
		try {
			return Integer.valueOf(line.trim());
		} catch (NumberFormatException ex) {
			log.error("invalid value");
			return null;
		}
	}
}
