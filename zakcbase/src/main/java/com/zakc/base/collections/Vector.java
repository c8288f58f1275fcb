/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.base.collections;

import java.util.Arrays;

/**
 * This class implements a growable array, whose capacity doubles whenever an append or insert finds it full, and which
 * gives back memory when removals leave it less than half occupied.
 * <br>
 * A new Vector has zero capacity and no backing buffer, which is only allocated on first growth.
 * <p>
 * Invalid operations (out-of-range indexes, removal from an empty vector, a reserve that would truncate live elements)
 * are not treated as errors. They are reported by returning false from mutators and null from queries, so callers must
 * check the return values, and should beware of storing null members as that makes the null return ambiguous.
 * An allocation failure during growth is reported the same way.
 * <br>
 * Beware that this class is single-threaded and non-reentrant.
 */
public final class Vector<T>
	implements Iterable<T>
{
	private final Ownership<? super T> ownership;

	private Object[] buffer; //null until first growth, and capacity is its length
	private int len;
	private int modcnt;

	public Vector() {this(Ownership.borrowed());}

	public Vector(Ownership<? super T> own)
	{
		ownership = own;
	}

	public int size() {return len;}
	public boolean isEmpty() {return (len == 0);}
	public int capacity() {return (buffer == null ? 0 : buffer.length);}

	public boolean append(T obj)
	{
		if (len + 1 > capacity()) {
			if (!grow()) return false;
		}
		buffer[len++] = obj;
		modcnt++;
		return true;
	}

	/**
	 * Appends all the members of the other Vector to this one, in order.
	 * Both Vectors must already have a backing buffer, so this fails if either has never been grown.
	 */
	public boolean extend(Vector<? extends T> other)
	{
		if (buffer == null || other.buffer == null) return false;
		int newlen = len + other.len;
		if (newlen > capacity()) {
			if (!reserve(newlen)) return false;
		}
		System.arraycopy(other.buffer, 0, buffer, len, other.len);
		len = newlen;
		modcnt++;
		return true;
	}

	public boolean insert(int pos, T obj)
	{
		if (pos < 0 || pos > len) return false;
		if (len == capacity()) {
			if (!grow()) return false;
		}
		System.arraycopy(buffer, pos, buffer, pos + 1, len - pos);
		buffer[pos] = obj;
		len++;
		modcnt++;
		return true;
	}

	public T pop()
	{
		if (len == 0) return null;
		return remove(len - 1);
	}

	public T remove(int pos)
	{
		if (pos < 0 || pos >= len) return null;
		@SuppressWarnings("unchecked") T obj = (T)buffer[pos];
		System.arraycopy(buffer, pos + 1, buffer, pos, len - pos - 1);
		buffer[--len] = null;  //release the vacated slot's object reference
		modcnt++;

		if (len < capacity() / 2 && capacity() > 1) {
			// can't fail, as we're shrinking to a size which holds all the live members
			reserve(len);
		}
		return obj;
	}

	public T get(int pos)
	{
		if (pos < 0 || pos >= len) return null;
		@SuppressWarnings("unchecked") T obj = (T)buffer[pos];
		return obj;
	}

	public boolean set(int pos, T obj)
	{
		if (pos < 0 || pos >= len) return false;
		@SuppressWarnings("unchecked") T oldobj = (T)buffer[pos];
		buffer[pos] = obj;
		if (oldobj != obj) ownership.release(oldobj);
		return true;
	}

	public boolean contains(Object obj)
	{
		for (int idx = 0; idx != len; idx++) {
			if (java.util.Objects.equals(obj, buffer[idx])) return true;
		}
		return false;
	}

	/**
	 * Sets the capacity to exactly the requested size, preserving the current members.
	 * Fails if that would truncate any members, and succeeds without doing anything if the capacity is already as requested.
	 * A capacity of zero releases the backing buffer.
	 */
	public boolean reserve(int cap)
	{
		if (cap < len) return false;
		if (cap == capacity()) return true;
		if (cap == 0) {
			buffer = null;
			return true;
		}
		Object[] newbuf;
		try {
			newbuf = (buffer == null ? new Object[cap] : Arrays.copyOf(buffer, cap));
		} catch (OutOfMemoryError ex) {
			return false;
		}
		buffer = newbuf;
		return true;
	}

	/**
	 * Reduces the capacity to the current size. Fails on an empty Vector.
	 */
	public boolean shrinkToFit()
	{
		if (len == 0) return false;
		return reserve(len);
	}

	/**
	 * Sets the number of members.
	 * If this exceeds the current size, then the capacity grows as necessary and the new slots are null.
	 * If it is less, then the excess members are discarded but the capacity is retained.
	 */
	public boolean resize(int newlen)
	{
		if (newlen < 0) return false;
		if (newlen > capacity()) {
			if (!reserve(newlen)) return false;
		}
		if (newlen < len) {
			for (int idx = newlen; idx != len; idx++) {
				@SuppressWarnings("unchecked") T obj = (T)buffer[idx];
				buffer[idx] = null;
				ownership.release(obj);
			}
		} else if (newlen > len) {
			Arrays.fill(buffer, len, newlen, null);
		}
		len = newlen;
		modcnt++;
		return true;
	}

	/**
	 * Releases the backing buffer, and also the members if this Vector owns them.
	 * The Vector is left in its initial empty state, with zero capacity.
	 */
	public void drop()
	{
		for (int idx = 0; idx != len; idx++) {
			@SuppressWarnings("unchecked") T obj = (T)buffer[idx];
			ownership.release(obj);
		}
		buffer = null;
		len = 0;
		modcnt++;
	}

	/**
	 * Returns a copy of the current members, whose length is the size (not the capacity) of this Vector.
	 */
	public Object[] array()
	{
		if (buffer == null) return new Object[0];
		return Arrays.copyOf(buffer, len);
	}

	private boolean grow()
	{
		int cap = capacity();
		return reserve(cap == 0 ? 1 : cap << 1);
	}

	@Override
	public java.util.Iterator<T> iterator()
	{
		return new java.util.Iterator<T>() {
			private final int expmodcnt = modcnt;
			private int pos;

			@Override
			public boolean hasNext() {return pos != len;}

			@Override
			public T next() {
				if (modcnt != expmodcnt) throw new java.util.ConcurrentModificationException("Next on "+Vector.this.getClass().getName());
				if (!hasNext()) throw new java.util.NoSuchElementException();
				@SuppressWarnings("unchecked") T obj = (T)buffer[pos++];
				return obj;
			}
		};
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("Vector=").append(len).append("/cap=").append(capacity()).append('/').append(ownership);
		String dlm = " [";
		for (int idx = 0; idx != len; idx++) {
			sb.append(dlm).append(buffer[idx]);
			dlm = ", ";
		}
		if (len != 0) sb.append(']');
		return sb.toString();
	}
}
