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

/**
 * One element of an edit script: an operation applied to a run of bytes.
 * <p>
 * A diff holds its own view of the bytes. The engine grows and trims that
 * view while it cleans up a script; the bytes of the texts the script was
 * computed from are never modified. The diffs of a finished {@link Patch}
 * own private copies, so later changes to the input arrays do not reach
 * them.
 */
public final class Diff {
	private final Operation operation;

	final Buffer buffer;

	/**
	 * Create a diff.
	 *
	 * @param operation
	 *            what happens to the bytes.
	 * @param bytes
	 *            the bytes; not copied until the diff needs to modify them.
	 */
	public Diff(Operation operation, Buffer bytes) {
		this.operation = operation;
		this.buffer = bytes.slice(0);
	}

	/**
	 * Copy this diff onto storage of its own.
	 *
	 * @return an equal diff that shares no bytes with this one.
	 */
	Diff detach() {
		return new Diff(operation, new Buffer(buffer));
	}

	/**
	 * Get the operation.
	 *
	 * @return what happens to the bytes.
	 */
	public Operation getOperation() {
		return operation;
	}

	/**
	 * Get the bytes.
	 *
	 * @return a view of the bytes this diff applies to. Modifying the view
	 *         does not modify the diff.
	 */
	public Buffer getBuffer() {
		return buffer.slice(0);
	}

	/**
	 * Get the number of bytes.
	 *
	 * @return number of bytes this diff applies to.
	 */
	public int size() {
		return buffer.size();
	}

	/**
	 * Whether the diff covers no bytes at all.
	 *
	 * @return true if {@link #size()} is 0.
	 */
	public boolean isEmpty() {
		return buffer.isEmpty();
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Diff))
			return false;
		Diff d = (Diff) o;
		return operation == d.operation && buffer.equals(d.buffer);
	}

	@Override
	public int hashCode() {
		return operation.hashCode() * 31 + buffer.hashCode();
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return operation + "(\"" + buffer + "\")";
	}
}
