/*
 * Copyright 2011-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.logging;

public class Factory
{
	public static final String DFLT_LOGNAME = "default";

	/*
	 * Creates a logger based on the default parameters, which are taken from the zakc.logger.* settings.
	 */
	public static Logger getLogger() throws java.io.IOException
	{
		return getLogger(DFLT_LOGNAME);
	}

	public static Logger getLogger(String name) throws java.io.IOException
	{
		return getLogger(null, name);
	}

	public static Logger getLogger(Parameters params, String name) throws java.io.IOException
	{
		if (name == null || name.isEmpty()) name = DFLT_LOGNAME;
		if (params == null) params = new Parameters.Builder().build();
		Logger log;
		try {
			Class<?> clss = Class.forName(params.getLogClass(), true, Factory.class.getClassLoader());
			java.lang.reflect.Constructor<?> ctor = clss.getDeclaredConstructor(Parameters.class, String.class);
			ctor.setAccessible(true);
			log = Logger.class.cast(ctor.newInstance(params, name));
		} catch (ReflectiveOperationException | ClassCastException ex) {
			throw new IllegalArgumentException("Failed to create logger="+params.getLogClass(), ex);
		}
		log.init();
		return log;
	}

	public static Logger getLoggerNoEx(Parameters params, String name)
	{
		try {
			return getLogger(params, name);
		} catch (java.io.IOException ex) {
			throw new IllegalStateException("ZakcLog-Factory failed to create logger="+name, ex);
		}
	}

	public static Logger getLoggerNoEx(String name)
	{
		return getLoggerNoEx(null, name);
	}
}
