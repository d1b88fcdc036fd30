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
 * Do two texts share a substring at least half as long as the longer text?
 * <p>
 * Two seeds are tried, starting at the second and at the third quarter of
 * the longer text. If both find a match the longer one is used, the second
 * quarter on ties. The fragments around the match are reported per side,
 * so {@link #prefix1()} always belongs to the first text.
 */
final class HalfMatch {
	private final boolean swapped;

	private final CommonHalf best;

	HalfMatch(Text text1, Text text2) {
		swapped = text1.size() < text2.size();
		Text longText = swapped ? text2 : text1;
		Text shortText = swapped ? text1 : text2;
		if (longText.size() < 4 || shortText.size() * 2 < longText.size()) {
			best = null;
			return;
		}

		int n = longText.size();
		CommonHalf hm1 = new CommonHalf(longText, shortText, (n + 3) / 4);
		CommonHalf hm2 = new CommonHalf(longText, shortText, (n + 1) / 2);
		if (!hm1.isValid() && !hm2.isValid())
			best = null;
		else if (!hm2.isValid())
			best = hm1;
		else if (!hm1.isValid())
			best = hm2;
		else
			best = hm1.characters() >= hm2.characters() ? hm1 : hm2;
	}

	/** @return true if a long enough common substring was found. */
	boolean isValid() {
		return best != null;
	}

	/** @return number of characters in {@link #common()}. */
	int characters() {
		return best.characters();
	}

	/** @return part of the first text before the common substring. */
	Text prefix1() {
		return swapped ? best.shortPrefix() : best.longPrefix();
	}

	/** @return part of the first text after the common substring. */
	Text suffix1() {
		return swapped ? best.shortSuffix() : best.longSuffix();
	}

	/** @return part of the second text before the common substring. */
	Text prefix2() {
		return swapped ? best.longPrefix() : best.shortPrefix();
	}

	/** @return part of the second text after the common substring. */
	Text suffix2() {
		return swapped ? best.longSuffix() : best.shortSuffix();
	}

	/** @return the common substring. */
	Text common() {
		return best.common();
	}
}
