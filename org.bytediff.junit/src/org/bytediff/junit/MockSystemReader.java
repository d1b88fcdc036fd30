/*
 * Copyright (C) 2009, Google Inc.
 * Copyright (C) 2009, Robin Rosenberg <robin.rosenberg@dewire.com>
 * Copyright (C) 2009, Yann Simon <yann.simon.fr@gmail.com> and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.junit;

import java.io.IOException;
import java.util.HashMap;
import java.util.Map;

import org.bytediff.errors.ConfigInvalidException;
import org.bytediff.lib.Config;
import org.bytediff.util.SystemReader;

/**
 * Mock {@link org.bytediff.util.SystemReader} for tests.
 * <p>
 * The clock stands still until {@link #tick(int)} moves it. Variables and
 * properties share one map. The user configuration is an in-memory
 * {@link Config} unless {@link #setUserConfig(Config)} is given null, in
 * which case the file located from the mocked variables is read.
 */
public class MockSystemReader extends SystemReader {
	long now = 1250379778668L; // Sat Aug 15 20:12:58 GMT-03:30 2009

	final Map<String, String> values = new HashMap<>();

	private Config userConfig = new Config();

	/**
	 * Set the user configuration
	 *
	 * @param config
	 *            in-memory configuration to hand out, or null to read the
	 *            configuration file.
	 */
	public void setUserConfig(Config config) {
		this.userConfig = config;
	}

	/**
	 * Set a property, which is also returned as environment variable.
	 *
	 * @param key
	 *            name of the property
	 * @param value
	 *            its value, or null to remove it
	 */
	public void setProperty(String key, String value) {
		if (value == null)
			values.remove(key);
		else
			values.put(key, value);
	}

	@Override
	public String getenv(String variable) {
		return values.get(variable);
	}

	@Override
	public String getProperty(String key) {
		return values.get(key);
	}

	@Override
	public Config getUserConfig() throws IOException, ConfigInvalidException {
		if (userConfig != null)
			return userConfig;
		return super.getUserConfig();
	}

	@Override
	public long getCurrentTime() {
		return now;
	}

	/**
	 * Adjust the current time by a number of seconds.
	 *
	 * @param secDelta
	 *            number of seconds to add to the current time.
	 */
	public void tick(int secDelta) {
		now += secDelta * 1000L;
	}

	/**
	 * Adjust the current time by a number of milliseconds.
	 *
	 * @param millis
	 *            number of milliseconds to add to the current time.
	 */
	public void tickMillis(long millis) {
		now += millis;
	}

	@Override
	public String toString() {
		return "MockSystemReader"; //$NON-NLS-1$
	}
}
