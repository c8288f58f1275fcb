/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.hashmapcli;

import com.zakc.base.utils.CommandParser;
import com.zakc.logging.Factory;
import com.zakc.logging.Logger;
import com.zakc.logging.Parameters;
import com.zakc.logging.SinkLogger;

import org.slf4j.LoggerFactory;

/**
 * Command-line entry point of the hash map shell.
 */
public class App
{
	private static final org.slf4j.Logger LOG = LoggerFactory.getLogger(App.class);

	public static final String NAME = "cli";
	public static final String VERSION = "0.1.0";

	static final String[] opts = new String[]{"l,log:", "h,help", "V,version"};

	private static final String[] LEVEL_NAMES = {"none", "error", "warn", "info", "debug", "trace"};
	private static final Logger.LEVEL[] LEVELS = {Logger.LEVEL.OFF, Logger.LEVEL.ERR, Logger.LEVEL.WARN, Logger.LEVEL.INFO,
			Logger.LEVEL.TRC, Logger.LEVEL.TRC2};
	private static final String DFLT_LEVEL = "warn";

	public static void main(String[] args) throws java.io.IOException
	{
		App app = new App(System.in, System.out, System.err);
		int status = app.run(args);
		if (status != 0) System.exit(status);
	}

	private static class OptsHandler extends CommandParser.OptionsHandler
	{
		String loglevel = DFLT_LEVEL;
		boolean help;
		boolean version;

		public OptsHandler() {super(opts, 0, 0);}

		@Override
		public void setOption(String opt) {
			if (opt.equals("help")) {
				help = true;
			} else if (opt.equals("version")) {
				version = true;
			} else {
				super.setOption(opt);
			}
		}

		@Override
		public void setOption(String opt, String val) {
			if (opt.equals("log")) {
				loglevel = val;
			} else {
				super.setOption(opt, val);
			}
		}

		@Override
		public String displayUsage()
		{
			String txt = "\t"+NAME+" [OPTIONS]";
			txt += "\nOptions:";
			txt += "\n  -l, --log <LEVEL>    Logging level [default: "+DFLT_LEVEL+"]";
			txt += "\n  -h, --help           Print help information";
			txt += "\n  -V, --version        Print version information";
			return txt;
		}
	}

	private final java.io.InputStream in;
	private final java.io.PrintStream out;
	private final java.io.PrintStream err;

	public App(java.io.InputStream in, java.io.PrintStream out, java.io.PrintStream err)
	{
		this.in = in;
		this.out = out;
		this.err = err;
	}

	/**
	 * Parses the command line and runs the shell until it quits.
	 * Returns the process exit status, which is non-zero if the command line was invalid.
	 */
	public int run(String[] args) throws java.io.IOException
	{
		OptsHandler options = new OptsHandler();
		CommandParser cmdParser = new CommandParser(options, err);
		if (cmdParser.parse(args) == -1) return 1;

		if (options.help) {
			out.println(NAME+" "+VERSION);
			out.println();
			out.println("Usage: "+NAME+" [OPTIONS]");
			out.println();
			out.println("Options:");
			out.println("  -l, --log <LEVEL>    Logging level [default: "+DFLT_LEVEL+"]");
			out.println("  -h, --help           Print help information");
			out.println("  -V, --version        Print version information");
			return 0;
		}
		if (options.version) {
			out.println(NAME+" "+VERSION);
			return 0;
		}
		Logger.LEVEL lvl = parseLevel(options.loglevel);
		if (lvl == null) {
			cmdParser.usage(args, "invalid log level: "+options.loglevel);
			return 1;
		}
		LOG.debug("Starting {} {} with log level={}", NAME, VERSION, lvl);

		Parameters.Builder bldr = new Parameters.Builder()
				.withLogLevel(lvl)
				.withStream(err);
		if (lvl == Logger.LEVEL.OFF) bldr = bldr.withLogClass(SinkLogger.class);
		Logger log = Factory.getLogger(bldr.build(), NAME);
		try {
			ShellContext ctx = new ShellContext(in, out, log);
			Shell shell = new Shell(ctx);
			shell.run();
		} finally {
			log.close();
		}
		LOG.debug("Terminating {}", NAME);
		return 0;
	}

	// only the lower-case display names are accepted on the command line
	static Logger.LEVEL parseLevel(String name)
	{
		for (int idx = 0; idx != LEVEL_NAMES.length; idx++) {
			if (LEVEL_NAMES[idx].equals(name)) return LEVELS[idx];
		}
		return null;
	}
}
