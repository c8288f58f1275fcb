/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.hashmapcli;

import com.zakc.base.collections.HashMap;
import com.zakc.base.collections.KeyPolicy;
import com.zakc.logging.Logger;

/**
 * Interactive command loop which operates on a single hash map, keyed on strings and holding integers.
 * <br>
 * Results are printed on the output stream, while success and failure diagnostics go to the logger, so their visibility
 * depends on its level. A failed command never ends the loop, which only terminates on the quit command or end of input.
 */
public class Shell
{
	private final ShellContext ctx;
	private final Logger log;

	public Shell(ShellContext ctx)
	{
		this.ctx = ctx;
		log = ctx.getLogger();
	}

	public void run() throws java.io.IOException
	{
		String cmdline;
		while ((cmdline = ctx.prompt("> ")) != null) {
			if (!execute(cmdline)) return;
		}
		// end of input is treated as quit
		ctx.println("");
	}

	/**
	 * Executes a single command, and returns false if it was the quit command.
	 */
	public boolean execute(String cmdline) throws java.io.IOException
	{
		Command cmd = Command.lookup(cmdline);
		if (cmd == null) {
			log.error("invalid command");
			return true;
		}
		if (cmd == Command.QUIT) return false;
		if (cmd == Command.HELP) {
			help();
			return true;
		}
		if (cmd == Command.NEW) {
			create();
			return true;
		}

		HashMap<String, Integer> map = ctx.getMap();
		if (map == null) {
			log.error("hash map is not created");
			return true;
		}

		switch (cmd) {
		case PRINT:
			print(map);
			break;
		case DROP:
			drop(map);
			break;
		case INSERT:
			insert(map);
			break;
		case REMOVE:
			remove(map);
			break;
		case CONTAINS:
			contains(map);
			break;
		case GET:
			get(map);
			break;
		case CAPACITY:
			ctx.println("Capacity of hash map: "+map.capacity());
			break;
		case LEN:
			ctx.println("Number of items in hash map: "+map.size());
			break;
		case RESERVE:
			reserve(map);
			break;
		default:
			throw new IllegalStateException("Missing case for command="+cmd);
		}
		return true;
	}

	private void help()
	{
		ctx.println("Available commands:");
		for (Command cmd : Command.values()) {
			ctx.println(String.format("  %-12s%s", cmd.getName(), cmd.getDescription()));
		}
	}

	private void create()
	{
		if (ctx.getMap() != null) {
			log.error("hash map already exists");
			return;
		}
		ctx.setMap(new HashMap<>(KeyPolicy.strings()));
		log.info("hash map created");
	}

	private void print(HashMap<String, Integer> map)
	{
		if (map.isEmpty()) {
			log.info("hash map is empty");
		} else {
			ctx.println("Hash map:");
			map.iterate((k, v) -> ctx.println("  "+k+" => "+v));
		}
		log.debug("cap: "+map.capacity());
		log.debug("len: "+map.size());
	}

	private void drop(HashMap<String, Integer> map)
	{
		if (!map.isEmpty() && log.isActive(Logger.LEVEL.TRC)) {
			log.debug("deleting items:");
			map.iterate((k, v) -> log.debug("  "+k+" => "+v));
		}
		map.drop();
		ctx.setMap(null);
		log.info("hash map deleted");
	}

	private void insert(HashMap<String, Integer> map) throws java.io.IOException
	{
		String key = ctx.promptKey();
		if (key == null) return;
		Integer val = ctx.promptInt("Enter value: ");
		if (val == null) return;

		if (map.insert(key, val)) {
			log.info("item inserted");
		} else {
			log.error("failed to insert item");
		}
	}

	private void remove(HashMap<String, Integer> map) throws java.io.IOException
	{
		String key = ctx.promptKey();
		if (key == null) return;
		Integer val = map.remove(key);
		if (val != null) {
			log.info("item removed (value = "+val+")");
		} else {
			log.error("item not found");
		}
	}

	private void contains(HashMap<String, Integer> map) throws java.io.IOException
	{
		String key = ctx.promptKey();
		if (key == null) return;
		if (map.contains(key)) {
			log.info("key exists in hash map");
		} else {
			log.warn("key does not exist in hash map");
		}
	}

	private void get(HashMap<String, Integer> map) throws java.io.IOException
	{
		String key = ctx.promptKey();
		if (key == null) return;
		Integer val = map.get(key);
		if (val != null) {
			log.info("value: "+val);
		} else {
			log.error("key not found");
		}
	}

	private void reserve(HashMap<String, Integer> map) throws java.io.IOException
	{
		Integer cap = ctx.promptInt("Enter number of items to reserve space for: ");
		if (cap == null) return;
		if (map.reserve(cap)) {
			log.info("space reserved");
		} else {
			log.error("failed to reserve space");
		}
	}
}
