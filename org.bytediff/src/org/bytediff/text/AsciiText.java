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

import static java.nio.charset.StandardCharsets.ISO_8859_1;

/**
 * A text where every byte is one character.
 * <p>
 * Suitable for ASCII and any other single byte encoding, and for binary
 * content. Substrings share the storage of the text they were taken from.
 */
public class AsciiText extends Text {
	private final Buffer content;

	/**
	 * Create a text over a buffer.
	 *
	 * @param content
	 *            the bytes; borrowed buffers are not copied.
	 */
	public AsciiText(Buffer content) {
		this.content = content;
	}

	/**
	 * Create a text over an array, without copying it.
	 *
	 * @param content
	 *            the bytes.
	 */
	public AsciiText(byte[] content) {
		this(Buffer.wrap(content));
	}

	/**
	 * Create a text from a string, encoding each char as one byte.
	 * <p>
	 * Characters outside of ISO-8859-1 are replaced by {@code '?'}.
	 *
	 * @param str
	 *            the string.
	 */
	public AsciiText(String str) {
		this(Buffer.wrap(str.getBytes(ISO_8859_1)));
	}

	@Override
	public int size() {
		return content.size();
	}

	@Override
	public int get(int i) {
		return content.byteAt(i) & 0xff;
	}

	@Override
	public Buffer buffer() {
		return content;
	}

	@Override
	public Buffer buffer(int begin, int end) {
		return content.slice(begin, end - begin);
	}

	@Override
	public AsciiText substring(int begin, int end) {
		return new AsciiText(buffer(begin, end));
	}

	@Override
	public AsciiText substring(int begin) {
		return new AsciiText(content.slice(begin));
	}

	@Override
	public AsciiText newText(Buffer bytes) {
		return new AsciiText(bytes);
	}

	@Override
	public int indexOf(Text needle, int from) {
		if (needle instanceof AsciiText)
			return content.indexOf(needle.buffer(), from);
		return super.indexOf(needle, from);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof AsciiText))
			return false;
		return content.equals(((AsciiText) o).content);
	}

	@Override
	public int hashCode() {
		return content.hashCode();
	}

	@Override
	public String toString() {
		return new String(content.toByteArray(), ISO_8859_1);
	}
}
