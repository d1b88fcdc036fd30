/*
 * Copyright (C) 2008, Google Inc. and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.util;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;

import org.junit.jupiter.api.Test;

public class IntListTest {
	@Test
	void testEmpty() {
		IntList i = new IntList();
		assertEquals(0, i.size());
		assertArrayEquals(new int[0], i.toArray());
		assertEquals("[]", i.toString());
	}

	@Test
	void testGrowsPastInitialCapacity() {
		IntList i = new IntList();
		int n = 500;
		for (int v = 0; v < n; v++)
			i.add(10 + v);
		assertEquals(n, i.size());
		int[] all = i.toArray();
		assertEquals(n, all.length);
		for (int v = 0; v < n; v++)
			assertEquals(10 + v, all[v]);
	}

	@Test
	void testToArrayIsACopy() {
		IntList i = new IntList();
		i.add(1);
		i.add(13);
		int[] first = i.toArray();
		first[0] = 99;
		i.add(5);
		assertArrayEquals(new int[] { 1, 13, 5 }, i.toArray());
		assertEquals("[1, 13, 5]", i.toString());
	}
}
