/*
 * Copyright (C) 2008, Google Inc.
 * Copyright (C) 2009, Johannes Schindelin <johannes.schindelin@gmx.de> and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.util;

import java.util.Arrays;

/**
 * Append-only list of primitive ints, collected once and then frozen into an
 * array with {@link #toArray()}.
 */
public class IntList {
	private int[] entries = new int[16];

	private int count;

	/**
	 * Get number of entries added so far.
	 *
	 * @return number of entries.
	 */
	public int size() {
		return count;
	}

	/**
	 * Append a number.
	 *
	 * @param n
	 *            the number.
	 */
	public void add(int n) {
		if (count == entries.length)
			entries = Arrays.copyOf(entries, count + (count >> 1));
		entries[count++] = n;
	}

	/**
	 * Copy the entries out.
	 *
	 * @return a new array of exactly {@link #size()} entries.
	 */
	public int[] toArray() {
		return Arrays.copyOf(entries, count);
	}

	@Override
	public String toString() {
		return Arrays.toString(toArray());
	}
}
