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
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.charset.StandardCharsets;

import org.bytediff.lib.Limits;
import org.junit.jupiter.api.Test;

public class EditTest {
	@Test
	void testTypeFollowsEmptySides() {
		assertSame(Edit.Type.REPLACE, new Edit(2, 5, 2, 3).getType());
		assertSame(Edit.Type.DELETE, new Edit(2, 5, 2, 2).getType());
		assertSame(Edit.Type.INSERT, new Edit(2, 2, 2, 3).getType());
		assertSame(Edit.Type.EMPTY, new Edit(4, 4, 1, 1).getType());
		assertTrue(new Edit(4, 4, 1, 1).isEmpty());
	}

	@Test
	void testLengthsAreByteCounts() {
		Edit e = new Edit(3, 7, 3, 4);
		assertEquals(3, e.getBeginA());
		assertEquals(7, e.getEndA());
		assertEquals(3, e.getBeginB());
		assertEquals(4, e.getEndB());
		assertEquals(4, e.getLengthA());
		assertEquals(1, e.getLengthB());
	}

	@Test
	void testReversedRangeIsRejected() {
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class, () -> new Edit(5, 4, 0, 0));
		assertEquals("[5,4)->[0,0)", e.getMessage());
		assertThrows(IllegalArgumentException.class,
				() -> new Edit(0, 0, 2, 1));
	}

	@Test
	void testValueSemantics() {
		Edit e = new Edit(1, 2, 3, 4);
		assertEquals(new Edit(1, 2, 3, 4), e);
		assertEquals(new Edit(1, 2, 3, 4).hashCode(), e.hashCode());
		assertNotEquals(new Edit(1, 2, 3, 5), e);
		assertNotEquals(new Edit(3, 4, 1, 2), e);
		assertNotEquals(e, "REPLACE[1,2)->[3,4)");
		assertEquals("REPLACE[1,2)->[3,4)", e.toString());
	}

	@Test
	void testRegionsCoverChangedBytes() {
		byte[] a = "the quick brown fox".getBytes(StandardCharsets.US_ASCII);
		byte[] b = "the quack brown box".getBytes(StandardCharsets.US_ASCII);
		EditList edits = Patch.diff(Limits.DEFAULT.withTimeout(0), a, b)
				.toEditList();
		assertEquals(2, edits.size());
		Edit first = edits.get(0);
		assertSame(Edit.Type.REPLACE, first.getType());
		assertEquals('i', a[first.getBeginA()]);
		assertEquals('a', b[first.getBeginB()]);
		Edit second = edits.get(1);
		assertEquals('f', a[second.getBeginA()]);
		assertEquals('b', b[second.getBeginB()]);
	}
}
