/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.base.collections;

/**
 * The hash and equality functions which a {@link HashMap} applies to its keys.
 * <br>
 * The two functions must agree, ie. keys which are equal must have the same hash.
 * The hash is treated as an unsigned 64-bit value.
 */
public interface KeyPolicy<K>
{
	long DJB2_SEED = 5381;

	long hash(K key);
	boolean equal(K left, K right);

	static <K> KeyPolicy<K> of(java.util.function.ToLongFunction<? super K> hashfunc,
			java.util.function.BiPredicate<? super K, ? super K> eqfunc)
	{
		return new KeyPolicy<K>() {
			@Override
			public long hash(K key) {return hashfunc.applyAsLong(key);}
			@Override
			public boolean equal(K left, K right) {return eqfunc.test(left, right);}
		};
	}

	/**
	 * Text keys, compared by content.
	 */
	static KeyPolicy<String> strings()
	{
		return of(KeyPolicy::stringHash, String::equals);
	}

	/**
	 * Byte-array keys of a fixed length, of which only the first len bytes are hashed and compared.
	 * Every key must be at least len bytes long.
	 */
	static KeyPolicy<byte[]> bytes(int len)
	{
		if (len < 0) throw new IllegalArgumentException("Negative key length="+len);
		return of(k -> bytesHash(k, len), (l, r) -> java.util.Arrays.equals(l, 0, len, r, 0, len));
	}

	/**
	 * Keys which supply their own hashCode() and equals().
	 */
	static <K> KeyPolicy<K> natural()
	{
		return of(k -> k.hashCode() & 0xFFFFFFFFL, Object::equals);
	}

	// DJB2 with XOR in place of addition, applied to the UTF-16 chars
	static long stringHash(CharSequence str)
	{
		long hash = DJB2_SEED;
		int len = str.length();
		for (int idx = 0; idx != len; idx++) {
			hash = ((hash << 5) + hash) ^ str.charAt(idx);
		}
		return hash;
	}

	static long bytesHash(byte[] data, int len)
	{
		long hash = DJB2_SEED;
		for (int idx = 0; idx != len; idx++) {
			hash = ((hash << 5) + hash) ^ (data[idx] & 0xFF);
		}
		return hash;
	}
}
