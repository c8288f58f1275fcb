/*
 * Copyright 2012-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.logging;

/**
 * Accumulates log messages as an in-memory string.
 */
public class MemLogger
	extends Logger
{
	private static final String eolstr = com.zakc.base.config.SysProps.EOL;
	private final StringBuilder logbuf = new StringBuilder();
	private final StringBuilder msgbuf = new StringBuilder();  //preallocated for efficiency

	public final CharSequence get() {return logbuf;}
	public final int length() {return logbuf.length();}
	public void reset() {logbuf.setLength(0);}

	protected MemLogger(Parameters params, String logname)
	{
		super(adjust(params), logname);
	}

	// Doesn't actually close, just discards contents and capacity.
	// Users can continue to call log()
	@Override
	protected void closeStream()
	{
		reset();
		logbuf.trimToSize();
	}

	@Override
	public void log(LEVEL lvl, CharSequence msg)
	{
		if (!isActive(lvl)) return;
		setLogEntry(lvl, msgbuf);
		logbuf.append(msgbuf).append(msg).append(eolstr);
	}

	// remove settings that make no sense for this logger
	private static Parameters adjust(Parameters params)
	{
		Parameters.Builder bldr = new Parameters.Builder(params);
		return bldr
				.withStream(null)
				.withColour(false)
				.build();
	}
}
