/*
 * Copyright (C) 2026, The bytediff authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.lib;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotSame;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.concurrent.atomic.AtomicInteger;

import org.bytediff.errors.ConfigInvalidException;
import org.junit.jupiter.api.Test;

public class ConfigTest {
	@Test
	void testReadSimple() throws ConfigInvalidException {
		Config c = parse("[diff]\n\ttimeout = 0.5\n\teditCost=6\n");
		assertEquals("0.5", c.getString("diff", null, "timeout"));
		assertEquals("6", c.getString("diff", null, "editCost"));
		assertNull(c.getString("diff", null, "maxBits"));
		assertNull(c.getString("merge", null, "timeout"));
	}

	@Test
	void testNamesIgnoreCase() throws ConfigInvalidException {
		Config c = parse("[DIFF]\n\tEditCost = 6\n");
		assertEquals("6", c.getString("diff", null, "editcost"));
		assertEquals("6", c.getString("Diff", null, "EDITCOST"));
	}

	@Test
	void testSubsection() throws ConfigInvalidException {
		Config c = parse("[diff]\n\ttimeout = 1\n" //
				+ "[diff \"Fast\"]\n\ttimeout = 0.1\n" //
				+ "[diff \"a\\\"b\"]\n\ttimeout = 2\n");
		assertEquals("1", c.getString("diff", null, "timeout"));
		assertEquals("0.1", c.getString("diff", "Fast", "timeout"));
		assertNull(c.getString("diff", "fast", "timeout"));
		assertEquals("2", c.getString("diff", "a\"b", "timeout"));
	}

	@Test
	void testLastValueWins() throws ConfigInvalidException {
		Config c = parse("[diff]\n\teditCost = 1\n[other]\n\tx = y\n"
				+ "[diff]\n\teditCost = 2\n");
		assertEquals("2", c.getString("diff", null, "editCost"));
	}

	@Test
	void testBareEntryIsEmpty() throws ConfigInvalidException {
		Config c = parse("[diff]\n\tmaxBits\n");
		assertEquals("", c.getString("diff", null, "maxBits"));
		assertEquals(32, c.getInt("diff", null, "maxBits", 32));
	}

	@Test
	void testCommentsAndBlanks() throws ConfigInvalidException {
		Config c = parse("# leading\n\n; other\n[diff] # header\n"
				+ "\ttimeout = 3 ; trailing\n"
				+ "\tpatchMargin = 5 # trailing\n"
				+ "\tmaxBits = 16   \n");
		assertEquals("3", c.getString("diff", null, "timeout"));
		assertEquals("5", c.getString("diff", null, "patchMargin"));
		assertEquals("16", c.getString("diff", null, "maxBits"));
	}

	@Test
	void testQuotesAndEscapes() throws ConfigInvalidException {
		Config c = parse("[s]\n" //
				+ "\ta = \"  padded # kept \"\n" //
				+ "\tb = x\\ty\\nz\n" //
				+ "\tc = one \\\ntwo\n" //
				+ "\td = in\"side\" out\n" //
				+ "\te = back\\\\slash \\\"q\\\"\n");
		assertEquals("  padded # kept ", c.getString("s", null, "a"));
		assertEquals("x\ty\nz", c.getString("s", null, "b"));
		assertEquals("one two", c.getString("s", null, "c"));
		assertEquals("inside out", c.getString("s", null, "d"));
		assertEquals("back\\slash \"q\"", c.getString("s", null, "e"));
	}

	@Test
	void testCrLf() throws ConfigInvalidException {
		Config c = parse("[diff]\r\n\ttimeout = 2\r\n\teditCost = 3\r\n");
		assertEquals("2", c.getString("diff", null, "timeout"));
		assertEquals("3", c.getString("diff", null, "editCost"));
	}

	@Test
	void testNoFinalNewline() throws ConfigInvalidException {
		Config c = parse("[diff]\n\ttimeout = 2");
		assertEquals("2", c.getString("diff", null, "timeout"));
	}

	@Test
	void testGetInt() throws ConfigInvalidException {
		Config c = parse("[s]\n\ta = 7\n\tb = 2k\n\tc = 1 M\n\td = -3\n"
				+ "\te = 2g\n\tf = ten\n\tg = \n");
		assertEquals(7, c.getInt("s", null, "a", 0));
		assertEquals(2048, c.getInt("s", null, "b", 0));
		assertEquals(1024 * 1024, c.getInt("s", null, "c", 0));
		assertEquals(-3, c.getInt("s", null, "d", 0));
		assertEquals(42, c.getInt("s", null, "g", 42));
		assertEquals(42, c.getInt("s", null, "missing", 42));

		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> c.getInt("s", null, "e", 0));
		assertEquals("Invalid integer value: s.e=2g", e.getMessage());
		e = assertThrows(IllegalArgumentException.class,
				() -> c.getInt("s", null, "f", 0));
		assertEquals("Invalid integer value: s.f=ten", e.getMessage());
	}

	@Test
	void testGetFloat() throws ConfigInvalidException {
		Config c = parse("[s \"x\"]\n\ta = 0.25\n\tb = 3\n\tc = soon\n");
		assertEquals(0.25f, c.getFloat("s", "x", "a", 0), 0.0f);
		assertEquals(3f, c.getFloat("s", "x", "b", 0), 0.0f);
		assertEquals(1.5f, c.getFloat("s", "x", "missing", 1.5f), 0.0f);
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> c.getFloat("s", "x", "c", 0));
		assertEquals("Invalid number value: s.x.c=soon", e.getMessage());
	}

	@Test
	void testMalformedText() {
		assertInvalid(1, "Line 1: Bad section header", "[diff\n");
		assertInvalid(2, "Line 2: Bad section header",
				"[diff]\n[diff \"x\n");
		assertInvalid(1,
				"Line 1: Entry timeout appears before any section header",
				"timeout = 1\n");
		assertInvalid(2, "Line 2: Bad entry name: 1st",
				"[diff]\n1st = x\n");
		assertInvalid(2, "Line 2: Expected '=' after the entry name",
				"[diff]\n\ttime out = 1\n");
		assertInvalid(3, "Line 3: Bad escape: q",
				"[diff]\n\n\ta = \\q\n");
		assertInvalid(2, "Line 2: End of file in escape",
				"[diff]\n\ta = x\\");
		assertInvalid(2, "Line 2: Newline in quotes not allowed",
				"[diff]\n\ta = \"x\n\"\n");
		assertInvalid(2, "Line 2: Unexpected end of config file",
				"[diff]\n\ta = \"x");
	}

	@Test
	void testFailedParseKeepsContent() throws ConfigInvalidException {
		Config c = parse("[diff]\n\ttimeout = 2\n");
		assertThrows(ConfigInvalidException.class, () -> c.fromText("[x"));
		assertEquals("2", c.getString("diff", null, "timeout"));
	}

	@Test
	void testSectionParserIsCached() throws ConfigInvalidException {
		AtomicInteger runs = new AtomicInteger();
		Config.SectionParser<String> parser = cfg -> {
			runs.incrementAndGet();
			return cfg.getString("diff", null, "timeout");
		};
		Config c = parse("[diff]\n\ttimeout = 2\n");
		String first = c.get(parser);
		assertEquals("2", first);
		assertSame(first, c.get(parser));
		assertEquals(1, runs.get());

		c.fromText("[diff]\n\ttimeout = 3\n");
		assertEquals("3", c.get(parser));
		assertEquals(2, runs.get());
	}

	@Test
	void testFailingParserIsNotCached() throws ConfigInvalidException {
		Config c = parse("[diff]\n\ttimeout = soon\n");
		assertThrows(IllegalArgumentException.class, () -> c.get(Limits.KEY));
		c.fromText("[diff]\n\ttimeout = 2\n");
		Limits l = c.get(Limits.KEY);
		assertEquals(2f, l.getTimeout(), 0.0f);
		assertNotSame(Limits.DEFAULT, l);
	}

	private static void assertInvalid(int line, String message, String text) {
		ConfigInvalidException e = assertThrows(ConfigInvalidException.class,
				() -> new Config().fromText(text));
		assertEquals(line, e.getLineNumber());
		assertEquals(message, e.getMessage());
	}

	private static Config parse(String content) throws ConfigInvalidException {
		Config c = new Config();
		c.fromText(content);
		return c;
	}
}
