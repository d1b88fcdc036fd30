/*
 * Copyright (C) 2026, The bytediff authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.lib;

import static org.bytediff.lib.ConfigConstants.CONFIG_DIFF_SECTION;
import static org.bytediff.lib.ConfigConstants.CONFIG_KEY_DELETE_THRESHOLD;
import static org.bytediff.lib.ConfigConstants.CONFIG_KEY_EDIT_COST;
import static org.bytediff.lib.ConfigConstants.CONFIG_KEY_MATCH_DISTANCE;
import static org.bytediff.lib.ConfigConstants.CONFIG_KEY_MATCH_THRESHOLD;
import static org.bytediff.lib.ConfigConstants.CONFIG_KEY_MAX_BITS;
import static org.bytediff.lib.ConfigConstants.CONFIG_KEY_PATCH_MARGIN;
import static org.bytediff.lib.ConfigConstants.CONFIG_KEY_TIMEOUT;

import java.io.IOException;
import java.text.MessageFormat;
import java.util.Objects;

import org.bytediff.errors.ConfigInvalidException;
import org.bytediff.internal.DiffText;
import org.bytediff.util.SystemReader;

/**
 * Tuning parameters of a diff request, read from the {@code [diff]} section.
 * <p>
 * Only {@link #getTimeout()} affects the diff computation. The remaining
 * fields are validated and carried for approximate matching and patch
 * application, which consume them.
 */
public final class Limits {
	/** Key for {@link Config#get(Config.SectionParser)}. */
	public static final Config.SectionParser<Limits> KEY = Limits::new;

	/** Parameters used when nothing is configured. */
	public static final Limits DEFAULT = new Limits(1.0f, 4, 0.5f, 1000, 0.5f,
			4, 32);

	private final float timeout;

	private final int editCost;

	private final float matchThreshold;

	private final int matchDistance;

	private final float deleteThreshold;

	private final int patchMargin;

	private final int maxBits;

	/**
	 * Create a set of limits.
	 *
	 * @param timeout
	 *            seconds a diff may take before it settles for a coarser
	 *            result; 0 means unbounded.
	 * @param editCost
	 *            cost of an empty edit in characters.
	 * @param matchThreshold
	 *            fuzzy match threshold, in [0, 1].
	 * @param matchDistance
	 *            how far a fuzzy match may be from its expected location.
	 * @param deleteThreshold
	 *            how closely deleted text must match when patching, in [0, 1].
	 * @param patchMargin
	 *            context size around a patch, in characters.
	 * @param maxBits
	 *            number of bits in a match bitmask.
	 * @throws java.lang.IllegalArgumentException
	 *             a value is out of range.
	 */
	public Limits(float timeout, int editCost, float matchThreshold,
			int matchDistance, float deleteThreshold, int patchMargin,
			int maxBits) {
		checkTimeout(timeout);
		checkRange(CONFIG_KEY_EDIT_COST, editCost, 0, Integer.MAX_VALUE);
		checkRange(CONFIG_KEY_MATCH_THRESHOLD, matchThreshold, 0, 1);
		checkRange(CONFIG_KEY_MATCH_DISTANCE, matchDistance, 0,
				Integer.MAX_VALUE);
		checkRange(CONFIG_KEY_DELETE_THRESHOLD, deleteThreshold, 0, 1);
		checkRange(CONFIG_KEY_PATCH_MARGIN, patchMargin, 0, Integer.MAX_VALUE);
		checkRange(CONFIG_KEY_MAX_BITS, maxBits, 1, Integer.MAX_VALUE);
		this.timeout = timeout;
		this.editCost = editCost;
		this.matchThreshold = matchThreshold;
		this.matchDistance = matchDistance;
		this.deleteThreshold = deleteThreshold;
		this.patchMargin = patchMargin;
		this.maxBits = maxBits;
	}

	private Limits(Config rc) {
		this(rc.getFloat(CONFIG_DIFF_SECTION, null, CONFIG_KEY_TIMEOUT,
				DEFAULT.timeout),
				rc.getInt(CONFIG_DIFF_SECTION, null, CONFIG_KEY_EDIT_COST,
						DEFAULT.editCost),
				rc.getFloat(CONFIG_DIFF_SECTION, null,
						CONFIG_KEY_MATCH_THRESHOLD, DEFAULT.matchThreshold),
				rc.getInt(CONFIG_DIFF_SECTION, null, CONFIG_KEY_MATCH_DISTANCE,
						DEFAULT.matchDistance),
				rc.getFloat(CONFIG_DIFF_SECTION, null,
						CONFIG_KEY_DELETE_THRESHOLD, DEFAULT.deleteThreshold),
				rc.getInt(CONFIG_DIFF_SECTION, null, CONFIG_KEY_PATCH_MARGIN,
						DEFAULT.patchMargin),
				rc.getInt(CONFIG_DIFF_SECTION, null, CONFIG_KEY_MAX_BITS,
						DEFAULT.maxBits));
	}

	/**
	 * Read the limits configured for the current user.
	 *
	 * @return limits from the {@code [diff]} section of the user
	 *         configuration; {@link #DEFAULT} values for anything not set.
	 * @throws java.io.IOException
	 *             the configuration file could not be read.
	 * @throws org.bytediff.errors.ConfigInvalidException
	 *             the configuration file is malformed.
	 */
	public static Limits fromUserConfig()
			throws IOException, ConfigInvalidException {
		return SystemReader.getInstance().getUserConfig().get(KEY);
	}

	private static void checkTimeout(float timeout) {
		if (Float.isNaN(timeout) || Float.isInfinite(timeout) || timeout < 0)
			throw new IllegalArgumentException(MessageFormat
					.format(DiffText.get().invalidTimeout,
							Float.valueOf(timeout)));
	}

	private static void checkRange(String name, float value, float min,
			float max) {
		if (Float.isNaN(value) || value < min || value > max)
			throw new IllegalArgumentException(MessageFormat.format(
					DiffText.get().valueNotInRange, CONFIG_DIFF_SECTION, name,
					Float.valueOf(value), Float.valueOf(min),
					Float.valueOf(max)));
	}

	private static void checkRange(String name, int value, int min, int max) {
		if (value < min || value > max)
			throw new IllegalArgumentException(MessageFormat.format(
					DiffText.get().valueNotInRange, CONFIG_DIFF_SECTION, name,
					Integer.valueOf(value), Integer.valueOf(min),
					Integer.valueOf(max)));
	}

	/**
	 * Copy these limits with another timeout.
	 *
	 * @param seconds
	 *            the new timeout, 0 for unbounded.
	 * @return limits identical to these except for the timeout.
	 */
	public Limits withTimeout(float seconds) {
		return new Limits(seconds, editCost, matchThreshold, matchDistance,
				deleteThreshold, patchMargin, maxBits);
	}

	/**
	 * Start the clock for one diff request.
	 * <p>
	 * The timeout is rounded to the nearest millisecond, but never below one,
	 * so any positive timeout yields a deadline that is set.
	 *
	 * @return a deadline {@link #getTimeout()} seconds from now, or
	 *         {@link Deadline#NEVER} if the timeout is 0.
	 */
	public Deadline deadline() {
		if (timeout <= 0)
			return Deadline.NEVER;
		return Deadline.after(Math.max(1, Math.round(timeout * 1000.0)));
	}

	/**
	 * Get the timeout.
	 *
	 * @return seconds a diff may run, 0 if unbounded.
	 */
	public float getTimeout() {
		return timeout;
	}

	/**
	 * Get the edit cost.
	 *
	 * @return cost of an empty edit operation in terms of characters.
	 */
	public int getEditCost() {
		return editCost;
	}

	/**
	 * Get the match threshold.
	 *
	 * @return 0.0 is a perfect match, 1.0 matches anything.
	 */
	public float getMatchThreshold() {
		return matchThreshold;
	}

	/**
	 * Get the match distance.
	 *
	 * @return how far from the expected location a match may be found.
	 */
	public int getMatchDistance() {
		return matchDistance;
	}

	/**
	 * Get the delete threshold.
	 *
	 * @return how closely the content of a large deletion must match.
	 */
	public float getDeleteThreshold() {
		return deleteThreshold;
	}

	/**
	 * Get the patch margin.
	 *
	 * @return chunk size for context length.
	 */
	public int getPatchMargin() {
		return patchMargin;
	}

	/**
	 * Get the maximum number of bits in a match bitmask.
	 *
	 * @return number of bits.
	 */
	public int getMaxBits() {
		return maxBits;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Limits))
			return false;
		Limits l = (Limits) o;
		return Float.compare(timeout, l.timeout) == 0
				&& editCost == l.editCost
				&& Float.compare(matchThreshold, l.matchThreshold) == 0
				&& matchDistance == l.matchDistance
				&& Float.compare(deleteThreshold, l.deleteThreshold) == 0
				&& patchMargin == l.patchMargin && maxBits == l.maxBits;
	}

	@Override
	public int hashCode() {
		return Objects.hash(Float.valueOf(timeout), Integer.valueOf(editCost),
				Float.valueOf(matchThreshold), Integer.valueOf(matchDistance),
				Float.valueOf(deleteThreshold), Integer.valueOf(patchMargin),
				Integer.valueOf(maxBits));
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return "Limits[timeout=" + timeout + ", editCost=" + editCost
				+ ", matchThreshold=" + matchThreshold + ", matchDistance="
				+ matchDistance + ", deleteThreshold=" + deleteThreshold
				+ ", patchMargin=" + patchMargin + ", maxBits=" + maxBits
				+ "]";
	}
}
