/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.base.collections;

public class VectorTest
{
	@org.junit.Test
	public void testAppendGrowth()
	{
		Vector<Integer> vec = new Vector<>();
		org.junit.Assert.assertEquals(0, vec.size());
		org.junit.Assert.assertEquals(0, vec.capacity());
		org.junit.Assert.assertTrue(vec.isEmpty());
		int[] expcaps = new int[]{1, 2, 4, 4, 8, 8, 8, 8, 16};
		for (int idx = 0; idx != expcaps.length; idx++) {
			org.junit.Assert.assertTrue(vec.append(idx));
			org.junit.Assert.assertEquals(idx + 1, vec.size());
			org.junit.Assert.assertEquals("append #"+idx, expcaps[idx], vec.capacity());
		}
		org.junit.Assert.assertFalse(vec.isEmpty());
		for (int idx = 0; idx != expcaps.length; idx++) {
			org.junit.Assert.assertEquals(Integer.valueOf(idx), vec.get(idx));
		}
	}

	@org.junit.Test
	public void testPopScenario()
	{
		Vector<Integer> vec = new Vector<>();
		vec.append(1);
		org.junit.Assert.assertEquals(1, vec.capacity());
		vec.append(2);
		org.junit.Assert.assertEquals(2, vec.capacity());
		vec.append(3);
		org.junit.Assert.assertEquals(4, vec.capacity());
		org.junit.Assert.assertEquals(Integer.valueOf(2), vec.get(1));
		org.junit.Assert.assertEquals(Integer.valueOf(3), vec.pop());
		org.junit.Assert.assertEquals(2, vec.size());
		org.junit.Assert.assertEquals(4, vec.capacity());
	}

	@org.junit.Test
	public void testShrinkOnRemove()
	{
		Vector<String> vec = new Vector<>();
		for (int idx = 0; idx != 8; idx++) vec.append("s"+idx);
		org.junit.Assert.assertEquals(8, vec.capacity());
		vec.pop();
		vec.pop();
		vec.pop();
		vec.pop();
		org.junit.Assert.assertEquals(4, vec.size());
		org.junit.Assert.assertEquals(8, vec.capacity());
		org.junit.Assert.assertEquals("s0", vec.remove(0));
		org.junit.Assert.assertEquals(3, vec.size());
		org.junit.Assert.assertEquals(3, vec.capacity());
		org.junit.Assert.assertEquals("s1", vec.get(0));
		org.junit.Assert.assertEquals("s3", vec.get(2));
		org.junit.Assert.assertEquals("s3", vec.pop());
		org.junit.Assert.assertEquals("s2", vec.pop());
		org.junit.Assert.assertEquals(1, vec.size());
		org.junit.Assert.assertEquals(3, vec.capacity());
		org.junit.Assert.assertEquals("s1", vec.pop());
		org.junit.Assert.assertEquals(0, vec.size());
		org.junit.Assert.assertEquals(0, vec.capacity());
		org.junit.Assert.assertNull(vec.pop());
		org.junit.Assert.assertTrue(vec.append("s4"));
		org.junit.Assert.assertEquals(1, vec.capacity());
	}

	@org.junit.Test
	public void testInsertRemove()
	{
		Vector<String> vec = new Vector<>();
		org.junit.Assert.assertTrue(vec.insert(0, "b"));
		org.junit.Assert.assertTrue(vec.insert(0, "a"));
		org.junit.Assert.assertTrue(vec.insert(2, "d"));
		org.junit.Assert.assertTrue(vec.insert(2, "c"));
		org.junit.Assert.assertFalse(vec.insert(5, "x"));
		org.junit.Assert.assertFalse(vec.insert(-1, "x"));
		verifyOrder(vec, "a", "b", "c", "d");

		for (int idx = 0; idx <= vec.size(); idx++) {
			Vector<String> vec2 = new Vector<>();
			for (String s : vec) vec2.append(s);
			org.junit.Assert.assertTrue(vec2.insert(idx, "new"));
			org.junit.Assert.assertEquals("new", vec2.get(idx));
			org.junit.Assert.assertEquals(vec.size() + 1, vec2.size());
		}

		org.junit.Assert.assertEquals("b", vec.remove(1));
		verifyOrder(vec, "a", "c", "d");
		org.junit.Assert.assertNull(vec.remove(3));
		org.junit.Assert.assertNull(vec.remove(-1));
		org.junit.Assert.assertNull(vec.get(3));
		org.junit.Assert.assertEquals("d", vec.remove(2));
		verifyOrder(vec, "a", "c");
	}

	@org.junit.Test
	public void testSetContains()
	{
		Vector<String> vec = new Vector<>();
		org.junit.Assert.assertFalse(vec.set(0, "x"));
		vec.append("one");
		vec.append("two");
		org.junit.Assert.assertTrue(vec.set(1, "2"));
		org.junit.Assert.assertFalse(vec.set(2, "3"));
		verifyOrder(vec, "one", "2");
		org.junit.Assert.assertTrue(vec.contains("one"));
		org.junit.Assert.assertTrue(vec.contains(new String("2")));
		org.junit.Assert.assertFalse(vec.contains("two"));
		org.junit.Assert.assertFalse(vec.contains(null));
		vec.append(null);
		org.junit.Assert.assertTrue(vec.contains(null));
	}

	@org.junit.Test
	public void testExtend()
	{
		Vector<Integer> vec1 = new Vector<>();
		Vector<Integer> vec2 = new Vector<>();
		org.junit.Assert.assertFalse(vec1.extend(vec2));
		vec1.append(1);
		org.junit.Assert.assertFalse(vec1.extend(vec2));
		org.junit.Assert.assertFalse(vec2.extend(vec1));
		vec2.append(2);
		vec2.append(3);
		vec2.append(4);
		org.junit.Assert.assertTrue(vec1.extend(vec2));
		org.junit.Assert.assertEquals(4, vec1.size());
		org.junit.Assert.assertEquals(4, vec1.capacity());
		org.junit.Assert.assertArrayEquals(new Object[]{1, 2, 3, 4}, vec1.array());
		org.junit.Assert.assertEquals(3, vec2.size());

		// the buffer remains allocated after being emptied, so it can still be extended
		vec2.pop();
		vec2.pop();
		vec2.pop();
		org.junit.Assert.assertEquals(1, vec2.capacity());
		org.junit.Assert.assertTrue(vec2.extend(vec1));
		org.junit.Assert.assertEquals(4, vec2.size());
	}

	@org.junit.Test
	public void testReserve()
	{
		Vector<String> vec = new Vector<>();
		org.junit.Assert.assertTrue(vec.reserve(10));
		org.junit.Assert.assertEquals(10, vec.capacity());
		org.junit.Assert.assertEquals(0, vec.size());
		vec.append("a");
		vec.append("b");
		vec.append("c");
		org.junit.Assert.assertFalse(vec.reserve(2));
		org.junit.Assert.assertFalse(vec.reserve(-1));
		org.junit.Assert.assertEquals(10, vec.capacity());
		org.junit.Assert.assertTrue(vec.reserve(10));
		org.junit.Assert.assertTrue(vec.reserve(3));
		org.junit.Assert.assertEquals(3, vec.capacity());
		verifyOrder(vec, "a", "b", "c");
		org.junit.Assert.assertTrue(vec.append("d"));
		org.junit.Assert.assertEquals(6, vec.capacity());
		org.junit.Assert.assertTrue(vec.shrinkToFit());
		org.junit.Assert.assertEquals(4, vec.capacity());
		verifyOrder(vec, "a", "b", "c", "d");

		Vector<String> vec2 = new Vector<>();
		org.junit.Assert.assertFalse(vec2.shrinkToFit());
	}

	@org.junit.Test
	public void testResize()
	{
		Vector<String> vec = new Vector<>();
		org.junit.Assert.assertFalse(vec.resize(-1));
		org.junit.Assert.assertTrue(vec.resize(3));
		org.junit.Assert.assertEquals(3, vec.size());
		org.junit.Assert.assertEquals(3, vec.capacity());
		org.junit.Assert.assertNull(vec.get(0));
		org.junit.Assert.assertNull(vec.get(2));
		vec.set(0, "a");
		vec.set(1, "b");
		vec.set(2, "c");
		org.junit.Assert.assertTrue(vec.resize(1));
		org.junit.Assert.assertEquals(1, vec.size());
		org.junit.Assert.assertEquals(3, vec.capacity());
		org.junit.Assert.assertTrue(vec.resize(2));
		org.junit.Assert.assertEquals(3, vec.capacity());
		org.junit.Assert.assertEquals("a", vec.get(0));
		org.junit.Assert.assertNull(vec.get(1));
	}

	@org.junit.Test
	public void testOwnership()
	{
		@SuppressWarnings("unchecked")
		java.util.function.Consumer<String> releaser = org.mockito.Mockito.mock(java.util.function.Consumer.class);
		Vector<String> vec = new Vector<>(Ownership.owned(releaser));
		vec.append("a");
		vec.append("b");
		vec.append("c");
		vec.append("d");
		vec.set(0, "a2");
		org.mockito.Mockito.verify(releaser).accept("a");
		org.junit.Assert.assertEquals("d", vec.pop());
		org.mockito.Mockito.verify(releaser, org.mockito.Mockito.never()).accept("d");
		vec.resize(2);
		org.mockito.Mockito.verify(releaser).accept("c");
		vec.drop();
		org.mockito.Mockito.verify(releaser).accept("a2");
		org.mockito.Mockito.verify(releaser).accept("b");
		org.mockito.Mockito.verifyNoMoreInteractions(releaser);
		org.junit.Assert.assertEquals(0, vec.size());
		org.junit.Assert.assertEquals(0, vec.capacity());
	}

	@org.junit.Test
	public void testIterator()
	{
		Vector<String> vec = new Vector<>();
		org.junit.Assert.assertFalse(vec.iterator().hasNext());
		vec.append("a");
		vec.append("b");
		java.util.Iterator<String> it = vec.iterator();
		org.junit.Assert.assertEquals("a", it.next());
		vec.append("c");
		try {
			it.next();
			org.junit.Assert.fail("Failed to detect concurrent modification");
		} catch (java.util.ConcurrentModificationException ex) {}
		org.junit.Assert.assertTrue(vec.toString(), vec.toString().startsWith("Vector=3/cap=4/Ownership=borrowed [a, b, c]"));
	}

	private static void verifyOrder(Vector<String> vec, String... expect)
	{
		org.junit.Assert.assertEquals(expect.length, vec.size());
		for (int idx = 0; idx != expect.length; idx++) {
			org.junit.Assert.assertEquals(expect[idx], vec.get(idx));
		}
		org.junit.Assert.assertArrayEquals(expect, vec.array());
	}
}
