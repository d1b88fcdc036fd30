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

import java.util.PrimitiveIterator;

import org.bytediff.text.Buffer;
import org.bytediff.text.Text;

/**
 * The longest run of characters two texts end with.
 */
final class CommonSuffix {
	private final Text a;

	private final int size;

	/**
	 * Compare two texts from the back.
	 *
	 * @param a
	 *            first text; {@link #buffer()} is taken from it.
	 * @param b
	 *            second text.
	 */
	CommonSuffix(Text a, Text b) {
		this.a = a;
		PrimitiveIterator.OfInt ia = a.reverseIterator();
		PrimitiveIterator.OfInt ib = b.reverseIterator();
		int n = 0;
		while (ia.hasNext() && ib.hasNext() && ia.nextInt() == ib.nextInt())
			n++;
		size = n;
	}

	/** @return number of common characters. */
	int size() {
		return size;
	}

	/** @return true if the texts share at least one trailing character. */
	boolean isFound() {
		return size > 0;
	}

	/** @return bytes of the common suffix. */
	Buffer buffer() {
		return a.buffer(a.size() - size, a.size());
	}
}
