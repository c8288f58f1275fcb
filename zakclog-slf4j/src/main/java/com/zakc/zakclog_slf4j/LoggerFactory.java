/*
 * Copyright 2011-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.zakclog_slf4j;

import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import com.zakc.base.config.SysProps;
import com.zakc.logging.Interop;
import com.zakc.logging.Parameters;

/**
 * Creates a zakclog logger for each SLF4J logger name, and routes the SLF4J calls into it.
 * <br>
 * The level of these loggers is given by the zakc.slf4j.level setting if present, else zakc.logger.level as for any
 * other zakclog logger.
 */
public class LoggerFactory
	implements org.slf4j.ILoggerFactory
{
	public static final String SYSPROP_LEVEL = "zakc.slf4j.level";

	private final Map<String,LoggerAdapter> loggers = new ConcurrentHashMap<>();

	@Override
	public org.slf4j.Logger getLogger(String name)
	{
		return loggers.computeIfAbsent(name, LoggerFactory::createLogger);
	}

	private static LoggerAdapter createLogger(String name) {
		Parameters.Builder bldr = new Parameters.Builder();
		String lvl = SysProps.get(SYSPROP_LEVEL);
		if (lvl != null) bldr = bldr.withLogLevel(Interop.parseLevel(lvl));
		com.zakc.logging.Logger logger = com.zakc.logging.Factory.getLoggerNoEx(bldr.build(), name);
		return new LoggerAdapter(name, logger);
	}
}
