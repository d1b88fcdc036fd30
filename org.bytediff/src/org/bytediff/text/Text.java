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

import java.util.NoSuchElementException;
import java.util.PrimitiveIterator;

/**
 * A character addressable view over a {@link Buffer}.
 * <p>
 * The diff engine only ever looks at characters through this class, so the
 * mapping from bytes to characters is up to the implementation. A character
 * is reported as an {@code int} code; two characters are the same if their
 * codes are the same. Indexes are zero-based and count characters, not bytes.
 * <p>
 * Substring requests that reach outside of the text are clamped.
 */
public abstract class Text {
	/**
	 * Get number of characters in this text.
	 *
	 * @return number of characters in this text.
	 */
	public abstract int size();

	/**
	 * Get the code of a character.
	 *
	 * @param i
	 *            index of the character, in the range [0, {@link #size()}).
	 * @return the character code.
	 * @throws java.lang.IndexOutOfBoundsException
	 *             the index is outside of the text.
	 */
	public abstract int get(int i);

	/**
	 * Get the bytes of the whole text.
	 *
	 * @return the bytes, borrowed from the underlying storage.
	 */
	public abstract Buffer buffer();

	/**
	 * Get the bytes of a range of characters.
	 *
	 * @param begin
	 *            first character, inclusive.
	 * @param end
	 *            last character, exclusive.
	 * @return the bytes, borrowed from the underlying storage.
	 */
	public abstract Buffer buffer(int begin, int end);

	/**
	 * Get a range of characters as a new text of the same encoding.
	 *
	 * @param begin
	 *            first character, inclusive.
	 * @param end
	 *            last character, exclusive.
	 * @return the substring; empty if the range is outside of the text.
	 */
	public abstract Text substring(int begin, int end);

	/**
	 * Interpret other bytes with the encoding of this text.
	 *
	 * @param bytes
	 *            the bytes to interpret.
	 * @return a text of the same kind as this one.
	 */
	public abstract Text newText(Buffer bytes);

	/**
	 * Get the characters from {@code begin} to the end.
	 *
	 * @param begin
	 *            first character, inclusive.
	 * @return the substring.
	 */
	public Text substring(int begin) {
		return substring(begin, size());
	}

	/**
	 * Get the number of bytes used by this text.
	 *
	 * @return number of bytes.
	 */
	public int bytes() {
		return buffer().size();
	}

	/**
	 * Whether the text has no characters.
	 *
	 * @return true if {@link #size()} is 0.
	 */
	public boolean isEmpty() {
		return size() == 0;
	}

	/**
	 * Find the first occurrence of another text, comparing characters.
	 *
	 * @param needle
	 *            the text to search for.
	 * @param from
	 *            first character position to consider.
	 * @return character position of the match, -1 if there is none.
	 */
	public int indexOf(Text needle, int from) {
		int n = needle.size();
		int last = size() - n;
		for (int i = Math.max(0, from); i <= last; i++) {
			int k = 0;
			while (k < n && get(i + k) == needle.get(k))
				k++;
			if (k == n)
				return i;
		}
		return -1;
	}

	/**
	 * Find the first occurrence of another text.
	 *
	 * @param needle
	 *            the text to search for.
	 * @return character position of the match, -1 if there is none.
	 */
	public int indexOf(Text needle) {
		return indexOf(needle, 0);
	}

	/**
	 * Whether both texts consist of the same bytes.
	 *
	 * @param other
	 *            the text to compare with.
	 * @return true if the byte contents are identical.
	 */
	public boolean contentEquals(Text other) {
		return buffer().equals(other.buffer());
	}

	/**
	 * Iterate the characters from the first to the last.
	 *
	 * @return iterator over the character codes.
	 */
	public PrimitiveIterator.OfInt iterator() {
		return new PrimitiveIterator.OfInt() {
			private int next;

			@Override
			public boolean hasNext() {
				return next < size();
			}

			@Override
			public int nextInt() {
				if (!hasNext())
					throw new NoSuchElementException();
				return get(next++);
			}
		};
	}

	/**
	 * Iterate the characters from the last to the first.
	 *
	 * @return iterator over the character codes.
	 */
	public PrimitiveIterator.OfInt reverseIterator() {
		return new PrimitiveIterator.OfInt() {
			private int next = size() - 1;

			@Override
			public boolean hasNext() {
				return next >= 0;
			}

			@Override
			public int nextInt() {
				if (!hasNext())
					throw new NoSuchElementException();
				return get(next--);
			}
		};
	}

	@Override
	public String toString() {
		return buffer().toString();
	}
}
