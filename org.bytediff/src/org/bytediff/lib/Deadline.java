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

import org.bytediff.util.SystemReader;

/**
 * An absolute point in time after which a computation should give up.
 * <p>
 * The clock is read through {@link SystemReader#getCurrentTime()}. A deadline
 * that is not set never expires.
 */
public final class Deadline {
	/** Deadline that is not set and never expires. */
	public static final Deadline NEVER = new Deadline(0);

	private final long expiration;

	private Deadline(long expiration) {
		this.expiration = expiration;
	}

	/**
	 * Create a deadline a number of milliseconds from now.
	 *
	 * @param millis
	 *            time budget; 0 or less gives {@link #NEVER}.
	 * @return the deadline.
	 */
	public static Deadline after(long millis) {
		if (millis <= 0)
			return NEVER;
		long now = SystemReader.getInstance().getCurrentTime();
		long end = now + millis;
		if (end < now)
			end = Long.MAX_VALUE;
		return new Deadline(end);
	}

	/**
	 * Whether this deadline has a finite bound.
	 *
	 * @return true if the deadline can expire.
	 */
	public boolean isSet() {
		return expiration != 0;
	}

	/**
	 * Whether the deadline has passed.
	 *
	 * @return true if the deadline is set and the current time is past it.
	 */
	public boolean isReached() {
		return isSet()
				&& SystemReader.getInstance().getCurrentTime() > expiration;
	}

	/**
	 * Get the expiry instant.
	 *
	 * @return milliseconds since the epoch, 0 if the deadline is not set.
	 */
	public long getExpiration() {
		return expiration;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return isSet() ? "Deadline[" + expiration + "]" : "Deadline[never]";
	}
}
