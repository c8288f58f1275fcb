/*
 * Copyright 2018-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.zakclog_slf4j;

import org.slf4j.Logger;

import org.junit.After;
import org.junit.Test;
import org.junit.Assert;

import com.zakc.base.config.SysProps;
import com.zakc.logging.MemLogger;
import com.zakc.logging.Parameters;

public class LoggerFactoryTest {
	@After
	public void teardown() {
		SysProps.clearAppEnv();
	}

	@Test
	public void testBasic() {
		Logger log = org.slf4j.LoggerFactory.getLogger(getClass());
		Assert.assertSame(LoggerAdapter.class, log.getClass());

		Logger log2 = org.slf4j.LoggerFactory.getLogger(getClass());
		Assert.assertSame(log, log2);

		log2 = org.slf4j.LoggerFactory.getLogger("anotherclass");
		Assert.assertSame(LoggerAdapter.class, log2.getClass());
		Assert.assertNotSame(log, log2);
		Assert.assertEquals("anotherclass", log2.getName());
	}

	@Test
	public void testRouting() {
		SysProps.setAppEnv(Parameters.SYSPROP_LOGCLASS, MemLogger.class.getName());
		SysProps.setAppEnv(Parameters.SYSPROP_TIMESTAMP, "N");
		SysProps.setAppEnv(LoggerFactory.SYSPROP_LEVEL, "info");
		LoggerFactory factory = new LoggerFactory();
		LoggerAdapter log = (LoggerAdapter)factory.getLogger("routed");
		MemLogger mlog = (MemLogger)log.getDelegate();
		Assert.assertTrue(log.isInfoEnabled());
		Assert.assertTrue(log.isErrorEnabled());
		Assert.assertFalse(log.isDebugEnabled());
		Assert.assertFalse(log.isTraceEnabled());

		String eol = SysProps.EOL;
		log.debug("Dummy debug msg");
		Assert.assertEquals(0, mlog.length());
		log.info("Dummy msg with param1={}, param2={}", "val1", "val2");
		Assert.assertEquals("[info] routed: Dummy msg with param1=val1, param2=val2"+eol, mlog.get().toString());
		mlog.reset();
		log.warn("Dummy warning with param1={}", "val1", new Exception("Dummy Exception"));
		Assert.assertEquals("[warn] routed: Dummy warning with param1=val1 - java.lang.Exception: Dummy Exception"+eol, mlog.get().toString());
		log.close();
	}

	@Test
	public void testSilenced() {
		SysProps.setAppEnv(Parameters.SYSPROP_LOGCLASS, MemLogger.class.getName());
		SysProps.setAppEnv(LoggerFactory.SYSPROP_LEVEL, "none");
		LoggerAdapter log = (LoggerAdapter)new LoggerFactory().getLogger("silenced");
		Assert.assertFalse(log.isErrorEnabled());
		log.error("Should not come out");
		Assert.assertEquals(0, ((MemLogger)log.getDelegate()).length());
	}
}
