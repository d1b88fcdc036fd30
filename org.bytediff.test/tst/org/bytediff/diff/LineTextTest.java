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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

import org.bytediff.text.Buffer;
import org.junit.jupiter.api.Test;

public class LineTextTest {
	@Test
	void testSplitsAfterNewline() {
		LineText.Dictionary dict = new LineText.Dictionary();
		LineText t = new LineText(Buffer.of("a\nb\na\nc"), dict);
		assertEquals(4, t.size());
		assertEquals(t.get(0), t.get(2));
		assertNotEquals(t.get(1), t.get(3));
		assertEquals(3, dict.size());
		assertEquals(Buffer.of("b\na\n"), t.buffer(1, 3));
		assertEquals(Buffer.of("c"), t.buffer(3, 4));
		assertEquals(Buffer.of("a\nb\na\nc"), t.buffer());
	}

	@Test
	void testCarriageReturnStaysInLine() {
		LineText.Dictionary dict = new LineText.Dictionary();
		LineText crlf = new LineText(Buffer.of("a\r\nb\r\n"), dict);
		LineText lf = new LineText(Buffer.of("a\nb\n"), dict);
		assertEquals(2, crlf.size());
		assertEquals(Buffer.of("a\r\n"), crlf.buffer(0, 1));
		assertNotEquals(crlf.get(0), lf.get(0));
		assertEquals(4, dict.size());
		assertEquals(Buffer.of("a\r\nb\r\n"), crlf.buffer());

		LineText bare = new LineText(Buffer.of("a\rb\n"), dict);
		assertEquals(1, bare.size());
	}

	@Test
	void testEmpty() {
		LineText t = new LineText(new Buffer(), new LineText.Dictionary());
		assertEquals(0, t.size());
		assertTrue(t.buffer().isEmpty());
	}

	@Test
	void testTrailingNewline() {
		LineText t = new LineText(Buffer.of("x\n\n"),
				new LineText.Dictionary());
		assertEquals(2, t.size());
		assertEquals(Buffer.of("\n"), t.buffer(1, 2));
	}

	@Test
	void testSharedDictionary() {
		LineText.Dictionary dict = new LineText.Dictionary();
		LineText a = new LineText(Buffer.of("one\ntwo\n"), dict);
		LineText b = new LineText(Buffer.of("two\nthree\n"), dict);
		assertEquals(a.get(1), b.get(0));
		assertEquals(3, dict.size());
	}

	@Test
	void testSubstring() {
		LineText t = new LineText(Buffer.of("a\nb\nc\nd\n"),
				new LineText.Dictionary());
		LineText s = t.substring(1, 3);
		assertEquals(2, s.size());
		assertEquals(t.get(1), s.get(0));
		assertEquals(Buffer.of("b\nc\n"), s.buffer());
		assertEquals(Buffer.of("c\n"), s.substring(1).buffer());
		assertEquals(0, t.substring(3, 1).size());
		assertEquals(1, s.indexOf(t.substring(2, 3)));
	}

	@Test
	void testNewTextUsesSameDictionary() {
		LineText.Dictionary dict = new LineText.Dictionary();
		LineText t = new LineText(Buffer.of("a\nb\n"), dict);
		LineText n = t.newText(Buffer.of("b\n"));
		assertEquals(t.get(1), n.get(0));
	}
}
