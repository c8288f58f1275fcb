/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.base.collections;

/**
 * Declares whether a container owns the payloads stored in it.
 * <br>
 * A container created with a borrowing policy never does anything with its payloads beyond storing and returning them,
 * so their lifetime remains entirely the caller's concern.
 * A container created with an owning policy passes every payload it discards to the releaser, ie. payloads that get
 * overwritten, truncated or dropped. Payloads which are handed back to the caller (eg. by pop or remove) are never
 * released, as ownership passes back to the caller along with them.
 * <p>
 * Null payloads are never passed to the releaser.
 */
public final class Ownership<T>
{
	private static final Ownership<Object> BORROWED = new Ownership<>(null);

	private final java.util.function.Consumer<? super T> releaser;

	public static <T> Ownership<T> borrowed() {
		@SuppressWarnings("unchecked") Ownership<T> own = (Ownership<T>)BORROWED;
		return own;
	}

	public static <T> Ownership<T> owned(java.util.function.Consumer<? super T> releaser) {
		if (releaser == null) throw new IllegalArgumentException("Owning policy requires a releaser");
		return new Ownership<>(releaser);
	}

	private Ownership(java.util.function.Consumer<? super T> releaser) {
		this.releaser = releaser;
	}

	public boolean isOwner() {return releaser != null;}

	void release(T obj) {
		if (releaser == null || obj == null) return;
		releaser.accept(obj);
	}

	@Override
	public String toString() {
		return "Ownership="+(isOwner() ? "owned" : "borrowed");
	}
}
