/*
 * Copyright 2010-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.base.config;

import java.util.Collections;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Single point of access for the zakc tunables.
 * <br>
 * A setting is resolved from the in-process application environment (see {@link #setAppEnv(String, String)}), then the
 * OS environment (with the property name upper-cased and dots replaced by underscores), then the JVM system properties,
 * and finally the caller's default.
 */
public class SysProps
{
	private static final Map<String,String> AppEnv = new ConcurrentHashMap<>(); //primarily intended for the benefit of tests

	public static final String NULLMARKER = "-";  // placeholder value that translates to null - prevents us traversing a chain of defaults
	public static final String EOL = System.getProperty("line.separator", "\n");

	public static String get(String name)
	{
		return get(name, null);
	}

	public static String get(String name, String dflt)
	{
		String envName = name.replace('.', '_').toUpperCase();
		String val = AppEnv.get(envName);
		if (val == null || val.isEmpty()) val = System.getenv(envName);
		if (val == null || val.isEmpty()) val = System.getProperty(name);
		if (val == null || val.isEmpty()) val = dflt;
		if (val == null || val.isEmpty() || NULLMARKER.equals(val)) val = null;
		return val;
	}

	public static boolean get(String name, boolean dflt)
	{
		return stringAsBool(get(name, boolAsString(dflt)));
	}

	public static int get(String name, int dflt)
	{
		return Integer.parseInt(get(name, Integer.toString(dflt)));
	}

	public static String set(String name, String newval)
	{
		java.util.Properties props = System.getProperties();
		String oldval = (newval == null || newval.isEmpty() ? (String)props.remove(name) : (String)props.setProperty(name, newval));
		if (oldval != null && oldval.isEmpty()) oldval = null;
		return oldval;
	}

	public static boolean set(String name, boolean val)
	{
		String oldval = set(name, boolAsString(val));
		return stringAsBool(oldval);
	}

	public static int set(String name, int val)
	{
		String oldval = set(name, Integer.toString(val));
		return (oldval == null ? 0 : Integer.parseInt(oldval));
	}

	public static void setAppEnv(String name, String val) {
		name = name.replace('.', '_').toUpperCase();
		if (val == null || val.isEmpty()) {
			AppEnv.remove(name);
		} else {
			AppEnv.put(name, val);
		}
	}

	public static void clearAppEnv() {
		AppEnv.clear();
	}

	public static Map<String,String> getAppEnv() {
		return Collections.unmodifiableMap(AppEnv);
	}

	// Y/yes/true/on all count as true, and anything else (including null) is false
	static boolean stringAsBool(String val)
	{
		if (val == null) return false;
		return (val.equalsIgnoreCase("y") || val.equalsIgnoreCase("yes")
				|| val.equalsIgnoreCase("true") || val.equalsIgnoreCase("on"));
	}

	static String boolAsString(boolean val)
	{
		return (val ? "Y" : "N");
	}
}
