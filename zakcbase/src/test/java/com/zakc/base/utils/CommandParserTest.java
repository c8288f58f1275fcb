/*
 * Copyright 2012-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.base.utils;

public class CommandParserTest
{
	public static class Handler extends CommandParser.OptionsHandler
	{
		public String level;
		public String width;
		public boolean verbose;
		public boolean quiet;

		public Handler(String[] opts, int min, int max) {super(opts, min, max);}

		@Override
		public void setOption(String opt) {
			if (opt.equals("verbose")) {
				verbose = true;
			} else if (opt.equals("q")) {
				quiet = true;
			} else {
				super.setOption(opt);
			}
		}

		@Override
		public void setOption(String opt, String val) {
			if (opt.equals("log")) {
				level = val;
			} else if (opt.equals("w")) {
				width = val;
			} else {
				super.setOption(opt, val);
			}
		}

		@Override
		public String displayUsage() {
			return "\t[-v] [-q] [-l level] [-w width]";
		}
	}

	private static final String[] opts = new String[]{"v,verbose", "q", "l,log:", "w:"};

	private final java.io.ByteArrayOutputStream bstrm = new java.io.ByteArrayOutputStream();
	private final java.io.PrintStream out = new java.io.PrintStream(bstrm, true);

	@org.junit.Test
	public void validCommand()
	{
		String[] args = new String[]{"-bad", "--log", "warn", "-q", "param1", "param2"};
		Handler handler = new Handler(opts, 2, -1);
		CommandParser parser = new CommandParser(handler, out);
		int param1 = parser.parse(args, 1);
		org.junit.Assert.assertEquals(4, param1);
		org.junit.Assert.assertEquals("param1", args[param1]);
		org.junit.Assert.assertEquals("param2", args[param1+1]);
		org.junit.Assert.assertFalse(handler.verbose);
		org.junit.Assert.assertTrue(handler.quiet);
		org.junit.Assert.assertEquals("warn", handler.level);
		org.junit.Assert.assertNull(handler.width);

		args = new String[]{"-w", "val2", "-v", "-l", "debug"};
		handler = new Handler(opts, 0, 0);
		parser = new CommandParser(handler, out);
		param1 = parser.parse(args);
		org.junit.Assert.assertEquals(args.length, param1);
		org.junit.Assert.assertTrue(handler.verbose);
		org.junit.Assert.assertFalse(handler.quiet);
		org.junit.Assert.assertEquals("debug", handler.level);
		org.junit.Assert.assertEquals("val2", handler.width);

		args = new String[]{"param1", "param2"};
		handler = new Handler(null, 0, 2);
		parser = new CommandParser(handler, out);
		param1 = parser.parse(args, 0);
		org.junit.Assert.assertEquals(0, param1);
		org.junit.Assert.assertEquals("param1", args[param1]);

		args = new String[]{"--verbose", "--", "-arg1", "arg2"};
		handler = new Handler(opts, 0, 2);
		parser = new CommandParser(handler, out);
		param1 = parser.parse(args, 0);
		org.junit.Assert.assertEquals(2, param1);
		org.junit.Assert.assertTrue(handler.verbose);
		org.junit.Assert.assertEquals("-arg1", args[param1]);
		org.junit.Assert.assertEquals("arg2", args[param1+1]);
		org.junit.Assert.assertEquals(0, bstrm.size());
	}

	@org.junit.Test
	public void invalidCommand()
	{
		String[] args = new String[]{"-bad", "-l", "val1", "-q", "param1", "param2"};
		Handler handler = new Handler(opts, 0, -1);
		CommandParser parser = new CommandParser(handler, out);
		int param1 = parser.parse(args);
		org.junit.Assert.assertEquals(-1, param1);
		String txt = bstrm.toString();
		org.junit.Assert.assertTrue(txt, txt.contains("invalid option: -bad"));
		org.junit.Assert.assertTrue(txt, txt.contains("Usage:\n\t[-v] [-q] [-l level] [-w width]"));

		bstrm.reset();
		args = new String[]{"-q", "--log"};
		handler = new Handler(opts, 0, -1);
		parser = new CommandParser(handler, out);
		param1 = parser.parse(args);
		org.junit.Assert.assertEquals(-1, param1);
		txt = bstrm.toString();
		org.junit.Assert.assertTrue(txt, txt.contains("missing value for option: --log"));

		handler = new Handler(null, 0, -1);
		parser = new CommandParser(handler, null);
		param1 = parser.parse(args);
		org.junit.Assert.assertEquals(-1, param1);

		args = new String[0];
		handler = new Handler(null, 1, -1);
		parser = new CommandParser(handler, null);
		param1 = parser.parse(args);
		org.junit.Assert.assertEquals(-1, param1);

		args = new String[]{"param1"};
		handler = new Handler(null, 0, 0);
		parser = new CommandParser(handler, null);
		param1 = parser.parse(args);
		org.junit.Assert.assertEquals(-1, param1);
	}

	@org.junit.Test
	public void help()
	{
		String[] args = new String[]{"-l", "val1", "-q", "-h", "-v", "param1"};
		Handler handler = new Handler(opts, 0, -1);
		CommandParser parser = new CommandParser(handler, out);
		int param1 = parser.parse(args);
		org.junit.Assert.assertEquals(-1, param1);
		org.junit.Assert.assertEquals(parser.usage(), bstrm.toString());
		org.junit.Assert.assertFalse(handler.verbose);

		args = new String[]{"--help"};
		handler = new Handler(null, 0, -1);
		parser = new CommandParser(handler, null);
		param1 = parser.parse(args);
		org.junit.Assert.assertEquals(-1, param1);
		org.junit.Assert.assertEquals("Usage:\n\tNo help available\n", new CommandParser(new CommandParser.OptionsHandler(null, 0, 0) {}, null).usage());
	}

	@org.junit.Test
	public void extraHandler()
	{
		Handler handler = new Handler(new String[]{"q"}, 0, 0);
		Handler extra = new Handler(new String[]{"w:"}, 0, 0);
		CommandParser parser = new CommandParser(handler, null);
		parser.addHandler(extra);
		int param1 = parser.parse(new String[]{"-q", "-w", "80"});
		org.junit.Assert.assertEquals(3, param1);
		org.junit.Assert.assertTrue(handler.quiet);
		org.junit.Assert.assertEquals("80", extra.width);
		org.junit.Assert.assertNull(handler.width);
	}
}
