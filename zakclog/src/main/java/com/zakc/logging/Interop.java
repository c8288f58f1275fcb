/*
 * Copyright 2011-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.logging;

import com.zakc.logging.Logger.LEVEL;

/**
 * Maps our log levels to and from their names and the SLF4J levels.
 * <br>
 * The names are the ones used on command lines, ie. none, error, warn, info, debug and trace.
 */
public class Interop
{
	public static boolean isActive(LEVEL logger, LEVEL msg)
	{
		if (logger == LEVEL.OFF || msg == LEVEL.OFF) return false;
		if (logger == LEVEL.ALL || msg == LEVEL.ALL) return true;  //msg=ALL doesn't really make sense, but pass it
		return (msg.ordinal() <= logger.ordinal());
	}

	public static String levelName(LEVEL lvl)
	{
		switch (lvl)
		{
			case OFF: return "none";
			case ERR: return "error";
			case WARN: return "warn";
			case INFO: return "info";
			case TRC: return "debug";
			case TRC2: return "trace";
			default: return "all";
		}
	}

	/**
	 * Accepts either the display name of a level (as returned by {@link #levelName(LEVEL)}) or its enum constant, in any case.
	 */
	public static LEVEL parseLevel(String name)
	{
		if (name == null) throw new IllegalArgumentException("Missing log level");
		String lcname = name.trim().toLowerCase();
		for (LEVEL lvl : LEVEL.values()) {
			if (lcname.equals(levelName(lvl)) || lcname.equals(lvl.name().toLowerCase())) return lvl;
		}
		throw new IllegalArgumentException("invalid log level: "+name);
	}

	public static LEVEL getLevel(org.slf4j.Logger log)
	{
		if (log.isTraceEnabled()) return LEVEL.TRC2;
		if (log.isDebugEnabled()) return LEVEL.TRC;
		if (log.isInfoEnabled()) return LEVEL.INFO;
		if (log.isWarnEnabled()) return LEVEL.WARN;
		if (log.isErrorEnabled()) return LEVEL.ERR;
		return LEVEL.OFF;
	}

	public static LEVEL mapLevel(org.slf4j.event.Level lvl)
	{
		switch (lvl)
		{
			case ERROR: return LEVEL.ERR;
			case WARN: return LEVEL.WARN;
			case INFO: return LEVEL.INFO;
			case DEBUG: return LEVEL.TRC;
			case TRACE: return LEVEL.TRC2;
			default: return LEVEL.ERR;
		}
	}

	// returns null for OFF, as SLF4J has no such level
	public static org.slf4j.event.Level mapLevel(LEVEL lvl)
	{
		switch (lvl)
		{
			case OFF: return null;
			case ERR: return org.slf4j.event.Level.ERROR;
			case WARN: return org.slf4j.event.Level.WARN;
			case INFO: return org.slf4j.event.Level.INFO;
			case TRC: return org.slf4j.event.Level.DEBUG;
			default: return org.slf4j.event.Level.TRACE;
		}
	}
}
