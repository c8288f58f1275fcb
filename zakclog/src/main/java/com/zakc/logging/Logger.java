/*
 * Copyright 2010-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.logging;

import java.time.format.DateTimeFormatter;

/**
 * Base class for a range of level-filtered loggers offering basic log() interfaces.
 * <br>
 * The subclasses are meant to be created via {@link Factory} and accessed via this type.
 * <p>
 * Each log entry consists of an optional timestamp, then a bracketed label naming its level, and then the message.
 * If colour is enabled, the label is rendered in the ANSI style associated with its level.
 * Messages logged at level ALL have no label.
 * <p>
 * Beware that this class is single-threaded.
 */
abstract public class Logger
	implements java.io.Closeable, java.io.Flushable
{
	public enum LEVEL {OFF, ERR, WARN, INFO, TRC, TRC2, ALL}

	private static final String ANSI_RESET = "\u001B[0m";
	private static final DateTimeFormatter TIMESTAMP_FMT = DateTimeFormatter.ofPattern("yyyy-MM-dd HH:mm:ss.SSS");

	private final String name;
	private final String this_string;
	private final java.io.OutputStream strm_base;
	private final java.time.Clock clock;
	private final boolean withColour;
	private final boolean withTimestamp;
	protected final int bufsiz;

	private LEVEL maxLevel; //active log level

	abstract public void log(LEVEL lvl, CharSequence msg);

	// most subclasses would override these
	protected void openStream(java.io.OutputStream strm) throws java.io.IOException {}
	protected void closeStream() throws java.io.IOException {}
	@Override
	public void flush() throws java.io.IOException {}

	public boolean isActive(LEVEL lvl) {return Interop.isActive(getLevel(), lvl);}
	public String getName() {return name;}
	public LEVEL getLevel() {return maxLevel;}
	public boolean withColour() {return withColour;}
	public boolean withTimestamp() {return withTimestamp;}
	public java.time.Clock getClock() {return clock;}
	@Override
	public String toString() {return this_string;}

	protected Logger(Parameters params, String logname)
	{
		name = logname;
		strm_base = params.getStream();
		clock = params.getClock();
		withColour = params.withColour();
		withTimestamp = params.withTimestamp();
		bufsiz = params.getBufSize();
		maxLevel = params.getLogLevel();

		String desc = (name == null ? "" : "Name="+name+" ");
		desc += params.toString();
		this_string = desc;
	}

	// This has to be called after the constructor, as it calls back into the not-yet-constructed subclasses.
	// Factory takes care of that, which is why the Logger constructors are protected.
	protected void init() throws java.io.IOException
	{
		if (strm_base != null) openStream(strm_base);
	}

	public LEVEL setLevel(LEVEL newlvl)
	{
		LEVEL oldlvl = maxLevel;
		if (newlvl == oldlvl) return oldlvl;
		maxLevel = newlvl;
		String action = (newlvl.ordinal() < oldlvl.ordinal()) ? "Reduced" : "Increased";
		log(LEVEL.ALL, action+" log level from "+oldlvl+" to "+newlvl);
		return oldlvl;
	}

	@Override
	public void close()
	{
		try {
			flush();
			closeStream();
		} catch (java.io.IOException ex) {
			throw new java.io.UncheckedIOException("Failed to close logger - "+this_string, ex);
		}
	}

	public void log(LEVEL lvl, Throwable ex, boolean dumpStack, CharSequence msg)
	{
		if (!isActive(lvl)) return;
		if (ex == null) {log(lvl, msg); return;}
		if (ex instanceof NullPointerException || ex instanceof ArrayIndexOutOfBoundsException) dumpStack = true;
		String conj = (dumpStack ? "\n\t" : " - ");
		log(lvl, msg+conj+summary(ex, dumpStack));
	}

	// Builds the prefix of a new log entry, ie. everything that precedes the message text.
	protected StringBuilder setLogEntry(LEVEL lvl, StringBuilder pfxbuf)
	{
		pfxbuf.setLength(0);
		if (withTimestamp) {
			TIMESTAMP_FMT.formatTo(java.time.LocalDateTime.now(clock), pfxbuf);
			pfxbuf.append(' ');
		}
		if (lvl != LEVEL.ALL) {
			pfxbuf.append('[');
			if (withColour) pfxbuf.append(ansiStyle(lvl));
			pfxbuf.append(Interop.levelName(lvl));
			if (withColour) pfxbuf.append(ANSI_RESET);
			pfxbuf.append("] ");
		}
		return pfxbuf;
	}

	// Convenience methods with the same names as the SLF4J ones
	public void error(CharSequence msg) {log(LEVEL.ERR, msg);}
	public void warn(CharSequence msg) {log(LEVEL.WARN, msg);}
	public void info(CharSequence msg) {log(LEVEL.INFO, msg);}
	public void debug(CharSequence msg) {log(LEVEL.TRC, msg);}
	public void trace(CharSequence msg) {log(LEVEL.TRC2, msg);}

	static String ansiStyle(LEVEL lvl)
	{
		switch (lvl)
		{
			case ERR: return "\u001B[1;31m";   //bold red
			case WARN: return "\u001B[1;33m";  //bold yellow
			case INFO: return "\u001B[32m";    //green
			case TRC: return "\u001B[3;34m";   //italic blue
			case TRC2: return "\u001B[3;36m";  //italic cyan
			default: return "";
		}
	}

	/**
	 * Summarises an exception and its chain of causes on one line, or returns its full stack trace.
	 */
	public static String summary(Throwable ex, boolean withStack)
	{
		if (withStack) {
			java.io.StringWriter sw = new java.io.StringWriter();
			ex.printStackTrace(new java.io.PrintWriter(sw, true));
			return sw.toString().trim();
		}
		StringBuilder sb = new StringBuilder();
		String dlm = "";
		java.util.Set<Throwable> seen = java.util.Collections.newSetFromMap(new java.util.IdentityHashMap<>());
		for (Throwable cause = ex; cause != null && seen.add(cause); cause = cause.getCause()) {
			sb.append(dlm).append(cause.getClass().getName());
			if (cause.getMessage() != null) sb.append(": ").append(cause.getMessage());
			dlm = " / Caused by ";
		}
		return sb.toString();
	}

	public static String summary(Throwable ex)
	{
		return summary(ex, false);
	}
}
