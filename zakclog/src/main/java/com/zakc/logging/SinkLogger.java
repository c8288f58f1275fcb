/*
 * Copyright 2011-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.logging;

/** Null logger which discards all the messages passed to it.
 * Its level is forced to OFF, so callers that check isActive() skip building their messages.
 */
public class SinkLogger
	extends Logger
{
	public SinkLogger(String logname)
	{
		this(new Parameters.Builder().withLogClass(SinkLogger.class).build(), logname);
	}

	public SinkLogger(Parameters params, String logname)
	{
		super(adjust(params), logname);
	}

	@Override
	public void log(LEVEL lvl, CharSequence msg)
	{
		return;
	}

	private static Parameters adjust(Parameters params)
	{
		Parameters.Builder bldr = new Parameters.Builder(params);
		return bldr
				.withLogLevel(LEVEL.OFF)
				.withStream(null)
				.build();
	}
}
