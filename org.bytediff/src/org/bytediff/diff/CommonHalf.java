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

import org.bytediff.text.Text;

/**
 * A long common substring grown from a quarter of the longer text.
 * <p>
 * The seed is the quarter-length substring of the long text starting at a
 * given index. Every occurrence of the seed in the short text is extended in
 * both directions for as long as the texts agree; the occurrence with the
 * longest extension wins, the first one on ties. The match is only good
 * enough to use if it covers at least half of the long text.
 */
final class CommonHalf {
	private final Text longText;

	private final Text shortText;

	private int longBegin;

	private int longEnd;

	private int shortBegin;

	private int shortEnd;

	/**
	 * Search for a match around a seed.
	 *
	 * @param longText
	 *            the longer text.
	 * @param shortText
	 *            the shorter text.
	 * @param i
	 *            start of the seed in {@code longText}.
	 */
	CommonHalf(Text longText, Text shortText, int i) {
		this.longText = longText;
		this.shortText = shortText;

		Text seed = longText.substring(i, i + longText.size() / 4);
		Text longTail = longText.substring(i);
		Text longHead = longText.substring(0, i);
		int best = 0;
		int j = -1;
		while ((j = shortText.indexOf(seed, j + 1)) != -1) {
			int prefix = new CommonPrefix(longTail, shortText.substring(j))
					.size();
			int suffix = new CommonSuffix(longHead, shortText.substring(0, j))
					.size();
			if (best < prefix + suffix) {
				best = prefix + suffix;
				longBegin = i - suffix;
				longEnd = i + prefix;
				shortBegin = j - suffix;
				shortEnd = j + prefix;
			}
		}
	}

	/** @return number of characters the match covers. */
	int characters() {
		return longEnd - longBegin;
	}

	/** @return true if the match covers at least half of the long text. */
	boolean isValid() {
		return characters() > 0 && characters() * 2 >= longText.size();
	}

	Text longPrefix() {
		return longText.substring(0, longBegin);
	}

	Text longSuffix() {
		return longText.substring(longEnd);
	}

	Text shortPrefix() {
		return shortText.substring(0, shortBegin);
	}

	Text shortSuffix() {
		return shortText.substring(shortEnd);
	}

	Text common() {
		return shortText.substring(shortBegin, shortEnd);
	}
}
