/*
 * Copyright 2011-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.logging;

import java.time.Clock;

import com.zakc.base.config.SysProps;

public class Parameters
{
	public static final String SYSPROP_LOGCLASS = "zakc.logger.class";
	public static final String SYSPROP_LOGLEVEL = "zakc.logger.level";
	public static final String SYSPROP_COLOUR = "zakc.logger.colour";
	public static final String SYSPROP_TIMESTAMP = "zakc.logger.timestamp";
	public static final String SYSPROP_BUFSIZ = "zakc.logger.bufsiz";

	private static final Class<?> DFLTCLASS = CharLogger.class;

	private final String logClass;
	private final Logger.LEVEL logLevel;
	private final java.io.OutputStream strm;
	private final int bufSize;
	private final Clock clock;
	private final boolean withColour;
	private final boolean withTimestamp;

	private Parameters(Builder bldr) {
		logClass = bldr.logClass;
		logLevel = bldr.logLevel;
		strm = bldr.strm;
		bufSize = bldr.bufSize;
		clock = bldr.clock;
		withColour = bldr.withColour;
		withTimestamp = bldr.withTimestamp;
	}

	public String getLogClass() {
		return logClass;
	}

	public Logger.LEVEL getLogLevel() {
		return logLevel;
	}

	public java.io.OutputStream getStream() {
		return strm;
	}

	public int getBufSize() {
		return bufSize;
	}

	public Clock getClock() {
		return clock;
	}

	public boolean withColour() {
		return withColour;
	}

	public boolean withTimestamp() {
		return withTimestamp;
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append(getClass().getName());
		sb.append("[Level=").append(logLevel);
		sb.append(", Dest=");
		if (getStream() == System.out) {
			sb.append("stdout");
		} else if (getStream() == System.err) {
			sb.append("stderr");
		} else if (getStream() == null) {
			sb.append("SINK");
		} else {
			sb.append(getStream().getClass().getName());
		}
		sb.append(" Type=").append(getLogClass());
		if (getBufSize() != 0) sb.append(" Buffer=").append(getBufSize());
		if (withColour()) sb.append(" colour");
		if (withTimestamp()) sb.append(" timestamp");
		sb.append("]");
		return sb.toString();
	}


	public static class Builder {
		private String logClass = SysProps.get(SYSPROP_LOGCLASS, DFLTCLASS.getName());
		private Logger.LEVEL logLevel = Interop.parseLevel(SysProps.get(SYSPROP_LOGLEVEL, Logger.LEVEL.INFO.name()));
		private java.io.OutputStream strm = System.err;
		private int bufSize = SysProps.get(SYSPROP_BUFSIZ, 8 * 1024);
		private Clock clock = Clock.systemDefaultZone();
		private boolean withColour = SysProps.get(SYSPROP_COLOUR, System.console() != null);
		private boolean withTimestamp = SysProps.get(SYSPROP_TIMESTAMP, false);

		public Builder() {}

		public Builder(Parameters params) {
			logClass = params.getLogClass();
			logLevel = params.getLogLevel();
			strm = params.getStream();
			bufSize = params.getBufSize();
			clock = params.getClock();
			withColour = params.withColour();
			withTimestamp = params.withTimestamp();
		}

		public Builder withLogClass(String v) {
			logClass = v;
			return this;
		}

		public Builder withLogClass(Class<?> v) {
			return withLogClass(v.getName());
		}

		public Builder withLogLevel(Logger.LEVEL v) {
			logLevel = v;
			return this;
		}

		public Builder withStream(java.io.OutputStream v) {
			strm = v;
			return this;
		}

		public Builder withBufferSize(int v) {
			bufSize = v;
			return this;
		}

		public Builder withClock(Clock v) {
			clock = v;
			return this;
		}

		public Builder withColour(boolean v) {
			withColour = v;
			return this;
		}

		public Builder withTimestamp(boolean v) {
			withTimestamp = v;
			return this;
		}

		public Parameters build() {
			if (logLevel == null) throw new IllegalArgumentException("Missing log level");
			if (bufSize < 0) throw new IllegalArgumentException("Negative buffer size="+bufSize);
			if (strm == null) bufSize = 0;
			return new Parameters(this);
		}
	}
}
