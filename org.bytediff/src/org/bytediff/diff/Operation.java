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

/**
 * What a {@link Diff} does to get from the first text to the second.
 */
public enum Operation {
	/** The bytes are only present in the first text. */
	DELETE,

	/** The bytes are only present in the second text. */
	INSERT,

	/** The bytes are present in both texts. */
	EQUAL;
}
