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

import org.bytediff.text.Buffer;
import org.bytediff.text.Text;

/**
 * The shorter of two texts found as one contiguous run inside the longer.
 * <p>
 * When found, going from the first text to the second means applying
 * {@link #operation()} to {@link #prefix()} and {@link #suffix()}, while
 * {@link #buffer()} stays.
 */
final class CommonOverlap {
	private final Operation operation;

	private final Text longText;

	private final Text shortText;

	private final int skip;

	CommonOverlap(Text text1, Text text2) {
		if (text1.size() >= text2.size()) {
			longText = text1;
			shortText = text2;
			operation = Operation.DELETE;
		} else {
			longText = text2;
			shortText = text1;
			operation = Operation.INSERT;
		}
		skip = shortText.isEmpty() ? -1 : longText.indexOf(shortText);
	}

	/** @return true if the shorter text occurs inside the longer one. */
	boolean isFound() {
		return skip >= 0;
	}

	/** @return operation for the parts outside of the overlap. */
	Operation operation() {
		return operation;
	}

	/** @return bytes of the longer text before the overlap. */
	Buffer prefix() {
		return longText.buffer(0, skip);
	}

	/** @return bytes of the longer text after the overlap. */
	Buffer suffix() {
		return longText.buffer(skip + shortText.size(), longText.size());
	}

	/** @return bytes of the overlap itself. */
	Buffer buffer() {
		return shortText.buffer();
	}
}
