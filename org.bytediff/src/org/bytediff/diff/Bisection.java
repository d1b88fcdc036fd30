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

import java.util.Arrays;

import org.bytediff.lib.Deadline;
import org.bytediff.text.Text;

/**
 * Finds the middle of a shortest edit script with Eugene Myers' algorithm.
 * <p>
 * The algorithm is described in "An O(ND) Difference Algorithm and its
 * Variations" by Eugene W. Myers. Think of the two texts as the axes of a
 * grid: a step right deletes a character of text A, a step down inserts a
 * character of text B, and a diagonal step, where both characters agree, is
 * free. A shortest edit script is a path from (0, 0) to (lenA, lenB) with the
 * fewest non-diagonal steps.
 * <p>
 * Two searches run against each other, one forward from (0, 0) and one
 * backward from (lenA, lenB). After {@code d} steps, each remembers for every
 * diagonal {@code k = x - y} the furthest x it reached; a search never stops
 * in the middle of a snake, a run of free diagonal steps. As soon as the
 * forward and the backward search overlap on one diagonal, that point lies
 * on a shortest path and both texts can be split there.
 * <p>
 * The search costs O((lenA + lenB) * D) time and O(lenA + lenB) space, where
 * D is the length of the edit script. It gives up when the deadline passes.
 */
final class Bisection {
	private final Text a;

	private final Text b;

	private final Deadline deadline;

	private int x = -1;

	private int y = -1;

	private int rounds;

	/**
	 * Search for the middle of the edit script.
	 *
	 * @param a
	 *            the first text, not empty.
	 * @param b
	 *            the second text, not empty.
	 * @param deadline
	 *            when to stop looking.
	 */
	Bisection(Text a, Text b, Deadline deadline) {
		this.a = a;
		this.b = b;
		this.deadline = deadline;
		search();
	}

	/** @return true if a split point was found. */
	boolean isFound() {
		return x >= 0;
	}

	/** @return where to split the first text. */
	int getX() {
		return x;
	}

	/** @return where to split the second text. */
	int getY() {
		return y;
	}

	/** @return number of rounds the search took. */
	int getRounds() {
		return rounds;
	}

	private void search() {
		final int lenA = a.size();
		final int lenB = b.size();
		// at least two, so the initial diagonals fit
		final int maxD = Math.max(2, (lenA + lenB + 1) / 2);
		final int offset = maxD;
		final int length = 2 * maxD;

		// furthest x on diagonal k (forward) and distance from the end
		// (backward), indexed by offset + k
		final int[] forward = new int[length];
		final int[] backward = new int[length];
		Arrays.fill(forward, -1);
		Arrays.fill(backward, -1);
		forward[offset + 1] = 0;
		backward[offset + 1] = 0;

		final int delta = lenA - lenB;
		// with an odd delta the fronts can only meet after a forward step
		final boolean front = (delta % 2 != 0);

		// diagonals that ran off the grid need no more updates
		int k1start = 0;
		int k1end = 0;
		int k2start = 0;
		int k2end = 0;

		for (int d = 0; d < maxD; d++) {
			if (deadline.isReached())
				return;
			rounds = d + 1;

			for (int k1 = -d + k1start; k1 <= d - k1end; k1 += 2) {
				int k1Offset = offset + k1;
				int x1;
				if (k1 == -d || (k1 != d
						&& forward[k1Offset - 1] < forward[k1Offset + 1]))
					x1 = forward[k1Offset + 1];
				else
					x1 = forward[k1Offset - 1] + 1;
				int y1 = x1 - k1;
				while (x1 < lenA && y1 < lenB && a.get(x1) == b.get(y1)) {
					x1++;
					y1++;
				}
				forward[k1Offset] = x1;
				if (x1 > lenA) {
					k1end += 2;
				} else if (y1 > lenB) {
					k1start += 2;
				} else if (front) {
					int k2Offset = offset + delta - k1;
					if (k2Offset >= 0 && k2Offset < length
							&& backward[k2Offset] != -1) {
						int x2 = lenA - backward[k2Offset];
						if (x1 >= x2) {
							split(x1, y1);
							return;
						}
					}
				}
			}

			for (int k2 = -d + k2start; k2 <= d - k2end; k2 += 2) {
				int k2Offset = offset + k2;
				int x2;
				if (k2 == -d || (k2 != d
						&& backward[k2Offset - 1] < backward[k2Offset + 1]))
					x2 = backward[k2Offset + 1];
				else
					x2 = backward[k2Offset - 1] + 1;
				int y2 = x2 - k2;
				while (x2 < lenA && y2 < lenB
						&& a.get(lenA - x2 - 1) == b.get(lenB - y2 - 1)) {
					x2++;
					y2++;
				}
				backward[k2Offset] = x2;
				if (x2 > lenA) {
					k2end += 2;
				} else if (y2 > lenB) {
					k2start += 2;
				} else if (!front) {
					int k1Offset = offset + delta - k2;
					if (k1Offset >= 0 && k1Offset < length
							&& forward[k1Offset] != -1) {
						int x1 = forward[k1Offset];
						int y1 = offset + x1 - k1Offset;
						if (x1 >= lenA - x2) {
							split(x1, y1);
							return;
						}
					}
				}
			}
		}
	}

	private void split(int splitX, int splitY) {
		x = splitX;
		y = splitY;
	}
}
