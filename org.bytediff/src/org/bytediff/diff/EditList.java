/*
 * Copyright (C) 2009, Google Inc. and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.diff;

import java.util.ArrayList;

/**
 * The changed regions of a {@link Patch}, ordered by position and never
 * adjacent: two edits are always separated by at least one unchanged byte.
 */
public class EditList extends ArrayList<Edit> {
	private static final long serialVersionUID = 1L;

	@Override
	public String toString() {
		return "EditList" + super.toString(); //$NON-NLS-1$
	}
}
