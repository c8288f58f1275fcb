/*
 * Copyright 2011-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.zakclog_slf4j;

import com.zakc.logging.Interop;
import com.zakc.logging.Logger.LEVEL;

//NB: This class is of type org.slf4j.Logger, as its LegacyAbstractLogger superclass implements the interface
public class LoggerAdapter
	extends org.slf4j.helpers.LegacyAbstractLogger
	implements java.io.Closeable, java.io.Flushable
{
	private static final long serialVersionUID = 1L;
	private static final boolean dumpStack = com.zakc.base.config.SysProps.get("zakc.slf4j.dumpstack", false);

	private final transient com.zakc.logging.Logger delegate;

	public com.zakc.logging.Logger getDelegate() {return delegate;}

	protected LoggerAdapter(String lname, com.zakc.logging.Logger logger) {
		if (logger == null) throw new IllegalArgumentException(getClass().getName()+" has null delegate");
		this.name = lname;
		this.delegate = logger;
	}

	@Override
	protected String getFullyQualifiedCallerName() {return null;}

	@Override
	public void flush() throws java.io.IOException {
		delegate.flush();
	}

	@Override
	public void close() {
		delegate.close();
	}

	@Override
	public boolean isTraceEnabled() {
		return delegate.isActive(LEVEL.TRC2);
	}

	@Override
	public boolean isDebugEnabled() {
		return delegate.isActive(LEVEL.TRC);
	}

	@Override
	public boolean isInfoEnabled() {
		return delegate.isActive(LEVEL.INFO);
	}

	@Override
	public boolean isWarnEnabled() {
		return delegate.isActive(LEVEL.WARN);
	}

	@Override
	public boolean isErrorEnabled() {
		return delegate.isActive(LEVEL.ERR);
	}

	@Override
	protected void handleNormalizedLoggingCall(org.slf4j.event.Level slf4jLevel, org.slf4j.Marker marker, String fmt, Object[] args, Throwable ex) {
		LEVEL lvl = Interop.mapLevel(slf4jLevel);
		if (!delegate.isActive(lvl)) return;
		org.slf4j.helpers.FormattingTuple tp = org.slf4j.helpers.MessageFormatter.arrayFormat(fmt, args);
		delegate.log(lvl, ex, dumpStack, getName()+": "+tp.getMessage());
	}

	@Override
	public String toString() {
		return super.toString()+" with delegate="+delegate.getClass().getName()+"/"+delegate;
	}
}
