/*
 * Copyright (C) 2026, The bytediff authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.diff;

import java.util.HashMap;
import java.util.Map;

import org.bytediff.text.Buffer;
import org.bytediff.text.Text;
import org.bytediff.util.IntList;

/**
 * A text whose characters are whole lines.
 * <p>
 * Every line, including its trailing {@code '\n'}, becomes one character. The
 * character code is the number the line got in a {@link Dictionary}, so equal
 * lines of texts sharing a dictionary have equal codes. The bytes reported by
 * {@link #buffer(int, int)} are the bytes of the lines, so diffs computed
 * over line texts carry the real content.
 * <p>
 * Only {@code '\n'} ends a line. In text with {@code "\r\n"} line endings the
 * {@code '\r'} stays part of each line, so such a line never equals the same
 * line ending in a bare {@code '\n'}. Nothing is lost either way, since the
 * bytes are kept as they are.
 */
final class LineText extends Text {
	/** Assigns a number to each distinct line. */
	static final class Dictionary {
		private final Map<Buffer, Integer> ids = new HashMap<>();

		int intern(Buffer line) {
			Integer id = ids.get(line);
			if (id == null) {
				id = Integer.valueOf(ids.size());
				ids.put(line, id);
			}
			return id.intValue();
		}

		/** @return number of distinct lines seen so far. */
		int size() {
			return ids.size();
		}
	}

	private final Dictionary dictionary;

	private final Buffer content;

	private final int[] lines;

	/** Byte offset of each line, plus the end of the last one. */
	private final int[] starts;

	private final int begin;

	private final int end;

	/**
	 * Split bytes into lines.
	 *
	 * @param content
	 *            the bytes.
	 * @param dictionary
	 *            numbers the lines.
	 */
	LineText(Buffer content, Dictionary dictionary) {
		this.dictionary = dictionary;
		this.content = content;

		IntList ids = new IntList();
		IntList offsets = new IntList();
		int n = content.size();
		int ptr = 0;
		while (ptr < n) {
			offsets.add(ptr);
			int eol = ptr;
			while (eol < n && content.byteAt(eol) != '\n')
				eol++;
			if (eol < n)
				eol++;
			ids.add(dictionary.intern(content.slice(ptr, eol - ptr)));
			ptr = eol;
		}
		offsets.add(n);

		lines = ids.toArray();
		starts = offsets.toArray();
		begin = 0;
		end = lines.length;
	}

	private LineText(LineText src, int begin, int end) {
		this.dictionary = src.dictionary;
		this.content = src.content;
		this.lines = src.lines;
		this.starts = src.starts;
		this.begin = begin;
		this.end = end;
	}

	@Override
	public int size() {
		return end - begin;
	}

	@Override
	public int get(int i) {
		if (i < 0 || i >= size())
			throw new IndexOutOfBoundsException(Integer.toString(i));
		return lines[begin + i];
	}

	@Override
	public Buffer buffer() {
		return buffer(0, size());
	}

	@Override
	public Buffer buffer(int b, int e) {
		b = clamp(b);
		e = Math.max(b, clamp(e));
		int from = starts[begin + b];
		return content.slice(from, starts[begin + e] - from);
	}

	@Override
	public LineText substring(int b, int e) {
		b = clamp(b);
		e = Math.max(b, clamp(e));
		return new LineText(this, begin + b, begin + e);
	}

	@Override
	public LineText newText(Buffer bytes) {
		return new LineText(bytes, dictionary);
	}

	private int clamp(int i) {
		return Math.max(0, Math.min(i, size()));
	}
}
