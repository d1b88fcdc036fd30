/*
 * Copyright (C) 2008-2009, Johannes E. Schindelin <johannes.schindelin@gmx.de> and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.diff;

/**
 * One changed region of a {@link Patch}, in byte offsets.
 * <p>
 * The bytes {@code [beginA, endA)} of the old text were replaced by the bytes
 * {@code [beginB, endB)} of the new text. Either range may be empty, making
 * the edit a pure insertion or deletion.
 *
 * @see Patch#toEditList()
 */
public final class Edit {
	/** Kind of change, derived from which side is empty. */
	public enum Type {
		/** Only the new text has bytes. */
		INSERT,

		/** Only the old text has bytes. */
		DELETE,

		/** Both texts have bytes. */
		REPLACE,

		/** Neither text has bytes. */
		EMPTY;
	}

	private final int beginA;

	private final int endA;

	private final int beginB;

	private final int endB;

	/**
	 * Create an edit.
	 *
	 * @param beginA
	 *            first changed byte of the old text.
	 * @param endA
	 *            end of the changed bytes of the old text, exclusive.
	 * @param beginB
	 *            first changed byte of the new text.
	 * @param endB
	 *            end of the changed bytes of the new text, exclusive.
	 * @throws java.lang.IllegalArgumentException
	 *             a range ends before it begins.
	 */
	public Edit(int beginA, int endA, int beginB, int endB) {
		if (endA < beginA || endB < beginB)
			throw new IllegalArgumentException(toString(beginA, endA,
					beginB, endB));
		this.beginA = beginA;
		this.endA = endA;
		this.beginB = beginB;
		this.endB = endB;
	}

	/** @return the kind of change. */
	public Type getType() {
		if (beginA < endA)
			return beginB < endB ? Type.REPLACE : Type.DELETE;
		return beginB < endB ? Type.INSERT : Type.EMPTY;
	}

	/** @return true if neither side has bytes. */
	public boolean isEmpty() {
		return getType() == Type.EMPTY;
	}

	/** @return first changed byte of the old text. */
	public int getBeginA() {
		return beginA;
	}

	/** @return end of the changed bytes of the old text. */
	public int getEndA() {
		return endA;
	}

	/** @return first changed byte of the new text. */
	public int getBeginB() {
		return beginB;
	}

	/** @return end of the changed bytes of the new text. */
	public int getEndB() {
		return endB;
	}

	/** @return number of old bytes removed. */
	public int getLengthA() {
		return endA - beginA;
	}

	/** @return number of new bytes inserted. */
	public int getLengthB() {
		return endB - beginB;
	}

	@Override
	public int hashCode() {
		return ((beginA * 31 + endA) * 31 + beginB) * 31 + endB;
	}

	@Override
	public boolean equals(Object o) {
		if (!(o instanceof Edit))
			return false;
		Edit e = (Edit) o;
		return beginA == e.beginA && endA == e.endA && beginB == e.beginB
				&& endB == e.endB;
	}

	@Override
	public String toString() {
		return getType() + toString(beginA, endA, beginB, endB);
	}

	@SuppressWarnings("nls")
	private static String toString(int beginA, int endA, int beginB,
			int endB) {
		return "[" + beginA + "," + endA + ")->[" + beginB + "," + endB + ")";
	}
}
