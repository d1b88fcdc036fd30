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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.util.PrimitiveIterator;

import org.junit.jupiter.api.Test;

public class AsciiTextTest {
	private static String collect(PrimitiveIterator.OfInt it) {
		StringBuilder r = new StringBuilder();
		while (it.hasNext())
			r.append((char) it.nextInt());
		return r.toString();
	}

	@Test
	void testGetIsUnsigned() {
		AsciiText t = new AsciiText(new byte[] { (byte) 0xff, 'a' });
		assertEquals(2, t.size());
		assertEquals(255, t.get(0));
		assertEquals('a', t.get(1));
		assertThrows(IndexOutOfBoundsException.class, () -> t.get(2));
	}

	@Test
	void testSubstring() {
		AsciiText t = new AsciiText("hello");
		assertEquals("el", t.substring(1, 3).toString());
		assertEquals("llo", t.substring(2).toString());
		assertEquals("he", t.substring(-2, 2).toString());
		assertTrue(t.substring(3, 1).isEmpty());
		assertTrue(t.substring(10).isEmpty());
		assertEquals("hello", t.substring(0, 99).toString());
	}

	@Test
	void testBuffer() {
		AsciiText t = new AsciiText("hello");
		assertEquals(Buffer.of("ell"), t.buffer(1, 4));
		assertEquals(5, t.bytes());
		assertEquals(Buffer.of("hello"), t.buffer());
	}

	@Test
	void testIndexOf() {
		AsciiText t = new AsciiText("hello world");
		assertEquals(4, t.indexOf(new AsciiText("o")));
		assertEquals(7, t.indexOf(new AsciiText("o"), 5));
		assertEquals(-1, t.indexOf(new AsciiText("x")));
		assertEquals(6, t.indexOf(new AsciiText("world")));
	}

	@Test
	void testIterators() {
		AsciiText t = new AsciiText("abc");
		assertEquals("abc", collect(t.iterator()));
		assertEquals("cba", collect(t.reverseIterator()));
		assertEquals("", collect(new AsciiText("").iterator()));
	}

	@Test
	void testContentEquals() {
		AsciiText a = new AsciiText("xabcx").substring(1, 4);
		assertTrue(a.contentEquals(new AsciiText("abc")));
		assertFalse(a.contentEquals(new AsciiText("abd")));
		assertEquals(a, new AsciiText("abc"));
	}

	@Test
	void testNewText() {
		AsciiText t = new AsciiText("abc");
		Text n = t.newText(Buffer.of("xyz"));
		assertTrue(n instanceof AsciiText);
		assertEquals("xyz", n.toString());
	}

	@Test
	void testLatin1() {
		AsciiText t = new AsciiText("été");
		assertEquals(3, t.size());
		assertEquals(0xe9, t.get(0));
		assertEquals("été", t.toString());
	}
}
