/*
 * Copyright (C) 2026, The bytediff authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.text;

import static java.nio.charset.StandardCharsets.UTF_8;

import java.util.Arrays;

/**
 * A run of bytes, either borrowed from another array or owned.
 * <p>
 * A borrowed buffer is a window onto storage that belongs to somebody else,
 * such as the caller's input array or the buffer a slice was taken from. An
 * owned buffer holds storage nobody else references. Every mutator first
 * converts a borrowed buffer into an owned one, so modifying a slice never
 * changes the bytes of the buffer it was sliced from.
 * <p>
 * Range arguments of the slicing methods are clamped; a request that lies
 * outside of the buffer yields an empty buffer instead of an exception.
 */
public final class Buffer implements Comparable<Buffer> {
	private static final byte[] NO_BYTES = {};

	private byte[] data;

	private int offset;

	private int size;

	private boolean owned;

	/** Set once a slice has been handed out over owned storage. */
	private boolean shared;

	/**
	 * Create a new, empty, owned buffer.
	 */
	public Buffer() {
		this(NO_BYTES, 0, 0, true);
	}

	/**
	 * Create an owned copy of another buffer.
	 *
	 * @param that
	 *            buffer to copy the contents of.
	 */
	public Buffer(Buffer that) {
		this(Arrays.copyOfRange(that.data, that.offset, that.offset + that.size),
				0, that.size, true);
	}

	private Buffer(byte[] data, int offset, int size, boolean owned) {
		this.data = data;
		this.offset = offset;
		this.size = size;
		this.owned = owned;
	}

	/**
	 * Borrow an array without copying it.
	 * <p>
	 * The caller must not modify the array while the buffer, or anything
	 * sliced from it, is in use.
	 *
	 * @param data
	 *            the bytes to wrap.
	 * @return a borrowed buffer over the whole array.
	 */
	public static Buffer wrap(byte[] data) {
		return new Buffer(data, 0, data.length, false);
	}

	/**
	 * Borrow a region of an array without copying it.
	 *
	 * @param data
	 *            the bytes to wrap.
	 * @param off
	 *            first byte of the region.
	 * @param len
	 *            number of bytes in the region.
	 * @return a borrowed buffer over the region.
	 * @throws java.lang.IndexOutOfBoundsException
	 *             the region does not fit into {@code data}.
	 */
	public static Buffer wrap(byte[] data, int off, int len) {
		if (off < 0 || len < 0 || off + len > data.length)
			throw new IndexOutOfBoundsException(off + "+" + len); //$NON-NLS-1$
		return new Buffer(data, off, len, false);
	}

	/**
	 * Copy an array into a new owned buffer.
	 *
	 * @param data
	 *            the bytes to copy.
	 * @return an owned buffer.
	 */
	public static Buffer copyOf(byte[] data) {
		return new Buffer(data.clone(), 0, data.length, true);
	}

	/**
	 * Copy a string, encoded as UTF-8, into a new owned buffer.
	 *
	 * @param str
	 *            the string to encode.
	 * @return an owned buffer.
	 */
	public static Buffer of(String str) {
		byte[] raw = str.getBytes(UTF_8);
		return new Buffer(raw, 0, raw.length, true);
	}

	/**
	 * Get the number of bytes.
	 *
	 * @return number of bytes in this buffer.
	 */
	public int size() {
		return size;
	}

	/**
	 * Whether the buffer holds no bytes.
	 *
	 * @return true if {@link #size()} is 0.
	 */
	public boolean isEmpty() {
		return size == 0;
	}

	/**
	 * Whether the storage belongs to this buffer.
	 *
	 * @return true if the buffer owns its storage, false if it is a view onto
	 *         storage of somebody else.
	 */
	public boolean isOwned() {
		return owned;
	}

	/**
	 * Get a single byte.
	 *
	 * @param i
	 *            index, must be in the range [0, {@link #size()}).
	 * @return the byte at the index.
	 * @throws java.lang.IndexOutOfBoundsException
	 *             the index is outside of the buffer.
	 */
	public byte byteAt(int i) {
		if (i < 0 || i >= size)
			throw new IndexOutOfBoundsException(Integer.toString(i));
		return data[offset + i];
	}

	/**
	 * Borrow the bytes from {@code start} to the end.
	 *
	 * @param start
	 *            first byte of the slice, clamped to the buffer.
	 * @return a borrowed view.
	 */
	public Buffer slice(int start) {
		return slice(start, size - Math.max(0, start));
	}

	/**
	 * Borrow a range of bytes.
	 *
	 * @param start
	 *            first byte of the slice, clamped to the buffer.
	 * @param len
	 *            number of bytes, clamped to the bytes available.
	 * @return a borrowed view, empty if the range is outside of the buffer.
	 */
	public Buffer slice(int start, int len) {
		if (start < 0)
			start = 0;
		shared |= owned;
		if (start >= size || len <= 0)
			return new Buffer(data, offset + Math.min(start, size), 0, false);
		return new Buffer(data, offset + start, Math.min(len, size - start),
				false);
	}

	/**
	 * Add bytes at the end of this buffer.
	 *
	 * @param that
	 *            bytes to append.
	 */
	public void append(Buffer that) {
		if (that.size == 0)
			return;
		int n = that.size;
		ensureOwned(size + n);
		System.arraycopy(that.data, that.offset, data, offset + size, n);
		size += n;
	}

	/**
	 * Add bytes at the start of this buffer.
	 *
	 * @param that
	 *            bytes to prepend.
	 */
	public void prepend(Buffer that) {
		if (that.size == 0)
			return;
		int n = that.size;
		byte[] r = new byte[grow(size + n)];
		System.arraycopy(that.data, that.offset, r, 0, n);
		System.arraycopy(data, offset, r, n, size);
		data = r;
		offset = 0;
		size += n;
		owned = true;
		shared = false;
	}

	/**
	 * Remove bytes from the end of the buffer.
	 *
	 * @param n
	 *            number of trailing bytes to drop.
	 */
	public void shrink(int n) {
		size -= Math.max(0, Math.min(n, size));
	}

	/**
	 * Remove bytes from the start of the buffer.
	 *
	 * @param n
	 *            number of leading bytes to drop.
	 */
	public void skip(int n) {
		n = Math.max(0, Math.min(n, size));
		offset += n;
		size -= n;
	}

	/**
	 * Forget all bytes; the buffer becomes empty and owned.
	 */
	public void clear() {
		data = NO_BYTES;
		offset = 0;
		size = 0;
		owned = true;
		shared = false;
	}

	/**
	 * Check whether a region of this buffer holds the same bytes as another
	 * buffer.
	 *
	 * @param start
	 *            position in this buffer where the comparison starts.
	 * @param that
	 *            the bytes that must appear at {@code start}.
	 * @return true if all of {@code that} appears at {@code start}.
	 */
	public boolean regionEquals(int start, Buffer that) {
		if (start < 0 || start + that.size > size)
			return false;
		return Arrays.equals(data, offset + start, offset + start + that.size,
				that.data, that.offset, that.offset + that.size);
	}

	/**
	 * Whether this buffer begins with the bytes of another buffer.
	 *
	 * @param that
	 *            the candidate prefix.
	 * @return true if {@code that} is a prefix of this buffer.
	 */
	public boolean startsWith(Buffer that) {
		return regionEquals(0, that);
	}

	/**
	 * Whether this buffer ends with the bytes of another buffer.
	 *
	 * @param that
	 *            the candidate suffix.
	 * @return true if {@code that} is a suffix of this buffer.
	 */
	public boolean endsWith(Buffer that) {
		return regionEquals(size - that.size, that);
	}

	/**
	 * Find the first occurrence of another buffer.
	 *
	 * @param that
	 *            the bytes to search for.
	 * @param from
	 *            first position to consider.
	 * @return position of the first match at or after {@code from}, -1 if
	 *         there is no match.
	 */
	public int indexOf(Buffer that, int from) {
		if (from < 0)
			from = 0;
		int last = size - that.size;
		if (that.size == 0)
			return from <= size ? from : -1;
		byte first = that.data[that.offset];
		for (int i = from; i <= last; i++) {
			if (data[offset + i] != first)
				continue;
			if (regionEquals(i, that))
				return i;
		}
		return -1;
	}

	/**
	 * Find the first occurrence of another buffer.
	 *
	 * @param that
	 *            the bytes to search for.
	 * @return position of the first match, -1 if there is no match.
	 */
	public int indexOf(Buffer that) {
		return indexOf(that, 0);
	}

	/**
	 * Copy the bytes out into a new array.
	 *
	 * @return a new array holding the bytes of this buffer.
	 */
	public byte[] toByteArray() {
		return Arrays.copyOfRange(data, offset, offset + size);
	}

	/**
	 * Compare two buffers as unsigned byte strings.
	 *
	 * @param that
	 *            the other buffer.
	 * @return negative, zero or positive as this buffer sorts before, equal
	 *         to, or after {@code that}.
	 */
	@Override
	public int compareTo(Buffer that) {
		return Arrays.compareUnsigned(data, offset, offset + size, that.data,
				that.offset, that.offset + that.size);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Buffer))
			return false;
		Buffer b = (Buffer) o;
		return size == b.size && regionEquals(0, b);
	}

	@Override
	public int hashCode() {
		int h = 1;
		for (int i = offset; i < offset + size; i++)
			h = 31 * h + data[i];
		return h;
	}

	/**
	 * Decode the bytes as UTF-8; intended for diagnostics and tests.
	 */
	@Override
	public String toString() {
		return new String(data, offset, size, UTF_8);
	}

	private void ensureOwned(int capacity) {
		if (owned && !shared && offset + capacity <= data.length)
			return;
		byte[] r = new byte[grow(capacity)];
		System.arraycopy(data, offset, r, 0, size);
		data = r;
		offset = 0;
		owned = true;
		shared = false;
	}

	private static int grow(int capacity) {
		return Math.max(16, capacity + (capacity >> 1));
	}
}
