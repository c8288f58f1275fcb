/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.base.collections;

import java.util.ConcurrentModificationException;

/**
 * Open-hashing map, in which each bucket is the head of a singly linked chain of entries.
 * <br>
 * The hashing and equality of keys is delegated to a {@link KeyPolicy}, so keys need not implement hashCode() and equals()
 * and this map can be keyed on types such as byte arrays.
 * <p>
 * A new map is uninitialised, meaning it has zero capacity and no bucket array. The first insert gives it a capacity of 1,
 * and thereafter the capacity doubles whenever an insert would take the population above 80% of the capacity.
 * The capacity is the number of buckets and the bucket for a key is its hash modulo the capacity, so every change of
 * capacity rehashes all the entries.
 * <br>
 * As with the other containers in this package, a failed operation is reported by a false or null return, not an exception.
 * <p>
 * Beware that this class is single-threaded and non-reentrant.
 */
public final class HashMap<K,V>
	implements Iterable<HashMap.Entry<K,V>>
{
	private static final float LOADFACTOR = 0.8f;

	public static final class Entry<K,V>
	{
		private final K key;
		private V value;
		private Entry<K,V> next;

		Entry(K key, V value, Entry<K,V> next) {
			this.key = key;
			this.value = value;
			this.next = next;
		}

		public K getKey() {return key;}
		public V getValue() {return value;}

		@Override
		public String toString() {
			return key+"="+value;
		}
	}

	private final KeyPolicy<K> policy;
	private final Ownership<? super K> keyOwnership;
	private final Ownership<? super V> valueOwnership;

	private Entry<K,V>[] buckets; //null while uninitialised, and capacity is its length
	private int entrycnt;
	private int modcnt;

	public HashMap(KeyPolicy<K> policy)
	{
		this(policy, Ownership.borrowed(), Ownership.borrowed());
	}

	public HashMap(KeyPolicy<K> policy, Ownership<? super K> keyOwnership, Ownership<? super V> valueOwnership)
	{
		this.policy = policy;
		this.keyOwnership = keyOwnership;
		this.valueOwnership = valueOwnership;
	}

	public int size() {return entrycnt;}
	public boolean isEmpty() {return (entrycnt == 0);}
	public int capacity() {return (buckets == null ? 0 : buckets.length);}

	/**
	 * Maps the key to the value, overwriting the value of any existing mapping for an equal key.
	 * The only possible failure is an inability to allocate a larger bucket array.
	 * <br>
	 * When an existing mapping is overwritten, the stored key is retained and the new key is discarded.
	 */
	public boolean insert(K key, V value)
	{
		if (buckets == null) {
			if (!reserve(1)) return false;
		}

		// It may turn out that we're overwriting an existing value rather than adding a new entry, but we grow anyway
		if (entrycnt + 1 > buckets.length * LOADFACTOR) {
			if (!reserve(buckets.length << 1)) return false;
		}
		final int bktid = bucketIndex(key, buckets.length);

		for (Entry<K,V> ent = buckets[bktid]; ent != null; ent = ent.next) {
			if (policy.equal(key, ent.key)) {
				V oldval = ent.value;
				ent.value = value;
				if (oldval != value) valueOwnership.release(oldval);
				if (key != ent.key) keyOwnership.release(key);
				return true;
			}
		}
		buckets[bktid] = new Entry<>(key, value, buckets[bktid]);
		entrycnt++;
		modcnt++;
		return true;
	}

	/**
	 * Removes the mapping for the key and returns its value, or null if there was no such mapping.
	 * The value passes back to the caller, but the stored key is released if this map owns its keys.
	 */
	public V remove(K key)
	{
		if (buckets == null) return null;
		final int bktid = bucketIndex(key, buckets.length);
		Entry<K,V> prev = null;

		for (Entry<K,V> ent = buckets[bktid]; ent != null; ent = ent.next) {
			if (policy.equal(key, ent.key)) {
				if (prev == null) {
					buckets[bktid] = ent.next;
				} else {
					prev.next = ent.next;
				}
				ent.next = null;
				entrycnt--;
				modcnt++;
				keyOwnership.release(ent.key);
				return ent.value;
			}
			prev = ent;
		}
		return null;
	}

	public boolean contains(K key)
	{
		return (find(key) != null);
	}

	public V get(K key)
	{
		Entry<K,V> ent = find(key);
		return (ent == null ? null : ent.value);
	}

	/**
	 * Rehashes the entries into a new bucket array of exactly the requested capacity.
	 * <br>
	 * Fails if the new capacity is less than the current population, since that would breach the load factor (and a zero
	 * capacity could not hold any entries at all). Reserving zero capacity on an empty map returns it to the uninitialised
	 * state.
	 */
	public boolean reserve(int cap)
	{
		if (cap < 0 || cap < entrycnt) return false;
		if (cap == 0) {
			buckets = null;
			modcnt++;
			return true;
		}
		Entry<K,V>[] newbuckets;
		try {
			newbuckets = allocateBuckets(cap);
		} catch (OutOfMemoryError ex) {
			return false;
		}

		if (buckets != null) {
			for (int idx = 0; idx != buckets.length; idx++) {
				Entry<K,V> ent = buckets[idx];
				while (ent != null) {
					Entry<K,V> nxt = ent.next;
					int bktid = bucketIndex(ent.key, cap);
					ent.next = newbuckets[bktid];
					newbuckets[bktid] = ent;
					ent = nxt;
				}
			}
		}
		buckets = newbuckets;
		modcnt++;
		return true;
	}

	/**
	 * Invokes the visitor on every entry, in bucket order and then chain order.
	 * The visitor must not modify this map.
	 */
	public void iterate(java.util.function.BiConsumer<? super K, ? super V> visitor)
	{
		if (buckets == null) return;
		final int expmodcnt = modcnt;
		for (int idx = 0; idx != buckets.length; idx++) {
			for (Entry<K,V> ent = buckets[idx]; ent != null; ent = ent.next) {
				visitor.accept(ent.key, ent.value);
				if (modcnt != expmodcnt) throw new ConcurrentModificationException("Visitor modified "+getClass().getName());
			}
		}
	}

	/**
	 * Discards all the entries and the bucket array, releasing the keys and values according to this map's ownership
	 * policies. The map is left uninitialised.
	 */
	public void drop()
	{
		if (buckets != null) {
			for (int idx = 0; idx != buckets.length; idx++) {
				Entry<K,V> ent = buckets[idx];
				buckets[idx] = null;
				while (ent != null) {
					Entry<K,V> nxt = ent.next;
					ent.next = null;
					keyOwnership.release(ent.key);
					valueOwnership.release(ent.value);
					ent = nxt;
				}
			}
		}
		buckets = null;
		entrycnt = 0;
		modcnt++;
	}

	private Entry<K,V> find(K key)
	{
		if (buckets == null) return null;
		for (Entry<K,V> ent = buckets[bucketIndex(key, buckets.length)]; ent != null; ent = ent.next) {
			if (policy.equal(key, ent.key)) return ent;
		}
		return null;
	}

	// the hash is an unsigned 64-bit value
	private int bucketIndex(K key, int cap)
	{
		return (int)Long.remainderUnsigned(policy.hash(key), cap);
	}

	private static <K,V> Entry<K,V>[] allocateBuckets(int cap)
	{
		@SuppressWarnings("unchecked") Entry<K,V>[] arr = (Entry<K,V>[])new Entry<?,?>[cap];
		return arr;
	}

	@Override
	public java.util.Iterator<Entry<K,V>> iterator()
	{
		return new EntriesIterator();
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder(size() * 5);
		sb.append(getClass().getName()).append('=').append(size()).append("/cap=").append(capacity()).append(" {");
		String dlm = "";
		for (int idx = 0; idx != capacity(); idx++) {
			for (Entry<K,V> ent = buckets[idx]; ent != null; ent = ent.next) {
				sb.append(dlm).append(ent.key).append('=').append(ent.value);
				dlm = ", ";
			}
		}
		sb.append("}");
		return sb.toString();
	}


	private final class EntriesIterator
		implements java.util.Iterator<Entry<K,V>>
	{
		private final int expmodcnt = modcnt;
		private int bktid = -1;
		private Entry<K,V> nextent;

		EntriesIterator() {advance(null);}

		@Override
		public boolean hasNext()
		{
			return (nextent != null);
		}

		@Override
		public Entry<K,V> next()
		{
			if (modcnt != expmodcnt) throw new ConcurrentModificationException("Next on "+HashMap.this.getClass().getName());
			if (nextent == null) throw new java.util.NoSuchElementException();
			Entry<K,V> ent = nextent;
			advance(ent.next);
			return ent;
		}

		private void advance(Entry<K,V> ent)
		{
			while (ent == null && buckets != null && ++bktid < buckets.length) {
				ent = buckets[bktid];
			}
			nextent = ent;
		}
	}
}
