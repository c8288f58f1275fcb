/*
 * Copyright 2012-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.base.utils;

/*
 * Parses GNU-style command lines, where each option has a short form (-l) and/or a long form (--log).
 * As with getopts, a colon-terminated option spec denotes an option which takes a value, and aliases are separated
 * by commas, so "l,log:" declares an option which can be given as "-l warn" or "--log warn".
 * The handler is always invoked with the final (canonical) alias of the spec, which is "log" in that example.
 * Short options cannot be concatenated.
 */
public final class CommandParser
{
	public abstract static class OptionsHandler
	{
		private final java.util.Map<String,String> opts_solo = new java.util.HashMap<String,String>();
		private final java.util.Map<String,String> opts_withval = new java.util.HashMap<String,String>();
		final int min_params;
		final int max_params;

		public void setOption(String opt) {throw new IllegalStateException("Missing handler for bool-option="+opt);}
		public void setOption(String opt, String val) {throw new IllegalStateException("Missing handler for option="+opt+"="+val);}
		public String displayUsage() {return null;}

		String soloOption(String opt) {return opts_solo.get(opt);}
		String valueOption(String opt) {return opts_withval.get(opt);}

		public OptionsHandler(String[] opts, int min, int max)
		{
			if (opts != null) {
				for (int idx = 0; idx != opts.length; idx++) {
					String spec = opts[idx];
					java.util.Map<String,String> registry = opts_solo;
					if (spec.endsWith(":")) {
						spec = spec.substring(0, spec.length() - 1);
						registry = opts_withval;
					}
					String[] aliases = spec.split(",");
					String canonical = aliases[aliases.length - 1];
					for (String alias : aliases) {
						registry.put(alias, canonical);
					}
				}
			}
			min_params = min;
			max_params = max;
		}
	}

	private final java.util.List<OptionsHandler> handlers = new java.util.ArrayList<OptionsHandler>();
	private final java.io.PrintStream out;

	public void addHandler(OptionsHandler h) {handlers.add(0, h);}
	private OptionsHandler mainHandler() {return handlers.get(0);}

	public CommandParser(OptionsHandler default_handler) {this(default_handler, System.out);}

	/**
	 * @param out Where usage and error text is written. Null means silent, which is mainly of use to tests.
	 */
	public CommandParser(OptionsHandler default_handler, java.io.PrintStream out)
	{
		this.out = out;
		addHandler(default_handler);
	}

	public int parse(String[] args)
	{
		return parse(args, 0);
	}

	/**
	 * Returns the index of the first param (ie. first non-options arg), or -1 if the command line was invalid or help was
	 * requested.
	 */
	public int parse(String[] args, int arg)
	{
		int arg0 = arg;
		while (arg < args.length && args[arg].length() > 1 && args[arg].charAt(0) == '-') {
			String opt = stripDashes(args[arg++]);
			if (opt.length() == 0) break; //"--" is the special marker to indicate end-of-options
			boolean handled = false;
			int idx = 0;
			do {
				if (idx == handlers.size()) {
					if (opt.equals("h") || opt.equals("help")) {
						if (out != null) out.print(usage());
						return -1;
					}
					return fail(args, arg0, "invalid option: "+args[arg-1]);
				}
				OptionsHandler handler = handlers.get(idx++);
				String canonical;
				if ((canonical = handler.soloOption(opt)) != null) {
					handler.setOption(canonical);
					handled = true;
				} else if ((canonical = handler.valueOption(opt)) != null) {
					if (arg == args.length) {
						return fail(args, arg0, "missing value for option: "+args[arg-1]);
					}
					handler.setOption(canonical, args[arg++]);
					handled = true;
				}
			} while (!handled);
		}
		// main handler determines if number of parameters is acceptable
		OptionsHandler handler = mainHandler();
		int param_cnt = args.length - arg;
		if (param_cnt < handler.min_params) return fail(args, arg0, "Insufficient params="+param_cnt+" vs min="+handler.min_params);
		if (handler.max_params != -1 && param_cnt > handler.max_params) return fail(args, arg0, "Excess params="+param_cnt+" vs max="+handler.max_params);
		return arg;
	}

	public String usage(String[] args, int arg0, String errmsg)
	{
		StringBuilder sb = new StringBuilder();
		sb.append("\nInvalid parameters=").append(args.length - arg0).append(":\n");
		for (int idx = arg0; idx != args.length; idx++) sb.append(' ').append(args[idx]);
		sb.append("\n*** ").append(errmsg).append('\n');
		sb.append(usage());
		String txt = sb.toString();
		if (out != null) out.print(txt);
		return txt;
	}

	public String usage(String[] args, String errmsg)
	{
		return usage(args, 0, errmsg);
	}

	public String usage()
	{
		String txt = "Usage:\n";
		String txt2 = mainHandler().displayUsage();
		if (txt2 == null) txt2 = "\tNo help available";
		txt += txt2+"\n";
		return txt;
	}

	private int fail(String[] args, int arg0, String errmsg)
	{
		usage(args, arg0, errmsg);
		return -1;
	}

	private static String stripDashes(String arg)
	{
		if (arg.startsWith("--")) return arg.substring(2);
		return arg.substring(1);
	}
}
