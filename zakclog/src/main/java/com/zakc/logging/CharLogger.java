/*
 * Copyright 2010-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.logging;

/**
 * This logger writes each message to its output stream in UTF-8, and flushes it straight away so that diagnostics
 * interleave correctly with any other output on an interactive terminal.
 * <br>
 * The stream is not closed when this logger is closed, as it belongs to the caller.
 */
public class CharLogger
	extends Logger
{
	private static final String eolstr = com.zakc.base.config.SysProps.EOL;

	private final StringBuilder logmsg_buf = new StringBuilder();
	private java.io.Writer logstrm;

	protected CharLogger(Parameters params, String logname)
	{
		super(params, logname);
	}

	@Override
	protected void openStream(java.io.OutputStream strm)
	{
		java.io.Writer wrt = new java.io.OutputStreamWriter(strm, java.nio.charset.StandardCharsets.UTF_8);
		logstrm = (bufsiz == 0 ? wrt : new java.io.BufferedWriter(wrt, bufsiz));
	}

	@Override
	protected void closeStream()
	{
		logstrm = null;
	}

	@Override
	public void flush() throws java.io.IOException
	{
		if (logstrm != null) logstrm.flush();
	}

	@Override
	public void log(LEVEL lvl, CharSequence msg)
	{
		if (!isActive(lvl) || logstrm == null) return;
		setLogEntry(lvl, logmsg_buf);
		logmsg_buf.append(msg).append(eolstr);
		try {
			logstrm.append(logmsg_buf);
			logstrm.flush();
		} catch (java.io.IOException ex) {
			throw new java.io.UncheckedIOException("Failed to write logger="+getName(), ex);
		}
	}
}
