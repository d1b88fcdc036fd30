/*
 * Copyright (C) 2026, The bytediff authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.junit;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;

import java.util.List;

import org.bytediff.diff.Diff;
import org.bytediff.diff.Operation;
import org.bytediff.diff.Patch;
import org.bytediff.text.Buffer;

/**
 * Assertions on edit scripts.
 */
public class PatchAssert {
	private PatchAssert() {
		// utility class
	}

	/**
	 * Assert that a script turns one text into another.
	 *
	 * @param text1
	 *            expected old text.
	 * @param text2
	 *            expected new text.
	 * @param diffs
	 *            the script.
	 */
	public static void assertReconstructs(byte[] text1, byte[] text2,
			Iterable<Diff> diffs) {
		Buffer a = new Buffer();
		Buffer b = new Buffer();
		for (Diff d : diffs) {
			if (d.getOperation() != Operation.INSERT)
				a.append(d.getBuffer());
			if (d.getOperation() != Operation.DELETE)
				b.append(d.getBuffer());
		}
		assertArrayEquals(text1, a.toByteArray(), "old text"); //$NON-NLS-1$
		assertArrayEquals(text2, b.toByteArray(), "new text"); //$NON-NLS-1$
	}

	/**
	 * Assert that a script has no empty diffs and no neighbours with the
	 * same operation.
	 *
	 * @param diffs
	 *            the script.
	 */
	public static void assertCanonical(List<Diff> diffs) {
		for (int i = 0; i < diffs.size(); i++) {
			Diff d = diffs.get(i);
			assertFalse(d.isEmpty(), "empty diff at " + i); //$NON-NLS-1$
			if (i > 0)
				assertNotEquals(diffs.get(i - 1).getOperation(),
						d.getOperation(), "same operation at " + i); //$NON-NLS-1$
		}
	}

	/**
	 * Assert that a patch is canonical and turns one text into another.
	 *
	 * @param text1
	 *            expected old text.
	 * @param text2
	 *            expected new text.
	 * @param patch
	 *            the patch.
	 */
	public static void assertPatch(byte[] text1, byte[] text2, Patch patch) {
		assertReconstructs(text1, text2, patch);
		assertCanonical(patch.getDiffs());
	}
}
