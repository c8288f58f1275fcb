/*
 * Copyright 2022-2026 Yusef Badri - All rights reserved.
 * NAF is distributed under the terms of the GNU Affero General Public License, Version 3 (AGPLv3).
 */
package com.zakc.base.collections;

/**
 * Doubly linked list, with constant-time operations at either end and linear-time indexed access.
 * <br>
 * As with {@link Vector}, invalid operations are reported by returning false or null rather than by throwing.
 * <br>
 * Beware that this class is single-threaded and non-reentrant.
 */
public final class LinkedList<T>
	implements Iterable<T>
{
	private static final class Node<T> {
		Node<T> prev;
		Node<T> next;
		T data;
		Node(T data) {this.data = data;}
	}

	private final Ownership<? super T> ownership;

	private Node<T> head;
	private Node<T> tail;
	private int len;
	private int modcnt;

	public LinkedList() {this(Ownership.borrowed());}

	public LinkedList(Ownership<? super T> own)
	{
		ownership = own;
	}

	public int size() {return len;}
	public boolean isEmpty() {return (len == 0);}
	public T first() {return (head == null ? null : head.data);}
	public T last() {return (tail == null ? null : tail.data);}

	public boolean append(T obj)
	{
		Node<T> node = new Node<>(obj);
		if (tail == null) {
			head = node;
		} else {
			node.prev = tail;
			tail.next = node;
		}
		tail = node;
		len++;
		modcnt++;
		return true;
	}

	public boolean prepend(T obj)
	{
		Node<T> node = new Node<>(obj);
		if (head == null) {
			tail = node;
		} else {
			node.next = head;
			head.prev = node;
		}
		head = node;
		len++;
		modcnt++;
		return true;
	}

	/**
	 * Inserts the new member so that it ends up at the specified position.
	 * Inserting at the size of the list is equivalent to append.
	 */
	public boolean insert(int pos, T obj)
	{
		if (pos < 0 || pos > len) return false;
		if (pos == len) return append(obj);
		if (pos == 0) return prepend(obj);

		Node<T> succ = nodeAt(pos);
		Node<T> node = new Node<>(obj);
		node.prev = succ.prev;
		node.next = succ;
		succ.prev.next = node;
		succ.prev = node;
		len++;
		modcnt++;
		return true;
	}

	/**
	 * Removes and returns the tail member.
	 */
	public T pop()
	{
		if (tail == null) return null;
		return unlink(tail);
	}

	/**
	 * Removes and returns the head member.
	 */
	public T shift()
	{
		if (head == null) return null;
		return unlink(head);
	}

	public T remove(int pos)
	{
		if (pos < 0 || pos >= len) return null;
		return unlink(nodeAt(pos));
	}

	public T get(int pos)
	{
		if (pos < 0 || pos >= len) return null;
		return nodeAt(pos).data;
	}

	public boolean set(int pos, T obj)
	{
		if (pos < 0 || pos >= len) return false;
		Node<T> node = nodeAt(pos);
		T oldobj = node.data;
		node.data = obj;
		if (oldobj != obj) ownership.release(oldobj);
		return true;
	}

	public boolean contains(Object obj)
	{
		for (Node<T> node = head; node != null; node = node.next) {
			if (java.util.Objects.equals(obj, node.data)) return true;
		}
		return false;
	}

	/**
	 * Reverses the order of the members in place. Fails on an empty list.
	 */
	public boolean reverse()
	{
		if (head == null) return false;
		Node<T> node = head;
		while (node != null) {
			Node<T> nxt = node.next;
			node.next = node.prev;
			node.prev = nxt;
			node = nxt;
		}
		Node<T> oldhead = head;
		head = tail;
		tail = oldhead;
		modcnt++;
		return true;
	}

	/**
	 * Discards all the nodes, and also releases the members if this list owns them.
	 */
	public void drop()
	{
		Node<T> node = head;
		while (node != null) {
			Node<T> nxt = node.next;
			ownership.release(node.data);
			node.prev = null;
			node.next = null;
			node.data = null;
			node = nxt;
		}
		head = null;
		tail = null;
		len = 0;
		modcnt++;
	}

	private Node<T> nodeAt(int pos)
	{
		Node<T> node = head;
		for (int idx = 0; idx != pos; idx++) {
			node = node.next;
		}
		return node;
	}

	private T unlink(Node<T> node)
	{
		if (node.prev == null) {
			head = node.next;
		} else {
			node.prev.next = node.next;
		}
		if (node.next == null) {
			tail = node.prev;
		} else {
			node.next.prev = node.prev;
		}
		T obj = node.data;
		node.prev = null;
		node.next = null;
		node.data = null;
		len--;
		modcnt++;
		return obj;
	}

	@Override
	public java.util.Iterator<T> iterator()
	{
		return new ListIterator(true);
	}

	/**
	 * Walks the list from tail to head.
	 */
	public java.util.Iterator<T> descendingIterator()
	{
		return new ListIterator(false);
	}

	@Override
	public String toString()
	{
		StringBuilder sb = new StringBuilder();
		sb.append("LinkedList=").append(len).append('/').append(ownership);
		String dlm = " [";
		for (Node<T> node = head; node != null; node = node.next) {
			sb.append(dlm).append(node.data);
			dlm = ", ";
		}
		if (len != 0) sb.append(']');
		return sb.toString();
	}


	private final class ListIterator
		implements java.util.Iterator<T>
	{
		private final boolean forward;
		private final int expmodcnt;
		private Node<T> nextnode;

		ListIterator(boolean forward)
		{
			this.forward = forward;
			expmodcnt = modcnt;
			nextnode = (forward ? head : tail);
		}

		@Override
		public boolean hasNext()
		{
			return (nextnode != null);
		}

		@Override
		public T next()
		{
			if (modcnt != expmodcnt) throw new java.util.ConcurrentModificationException("Next on "+LinkedList.this.getClass().getName());
			if (nextnode == null) throw new java.util.NoSuchElementException();
			Node<T> node = nextnode;
			nextnode = (forward ? node.next : node.prev);
			return node.data;
		}
	}
}
