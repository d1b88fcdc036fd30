/*
 * Copyright (C) 2009, Google Inc.
 * Copyright (C) 2009, Robin Rosenberg <robin.rosenberg@dewire.com>
 * Copyright (C) 2009, Yann Simon <yann.simon.fr@gmail.com>
 * Copyright (C) 2012, Daniel Megert <daniel_megert@ch.ibm.com> and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.util;

import java.io.IOException;
import java.nio.file.Path;
import java.nio.file.Paths;

import org.bytediff.errors.ConfigInvalidException;
import org.bytediff.lib.Config;
import org.bytediff.lib.ConfigConstants;
import org.bytediff.lib.FileBasedConfig;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Access to the process environment: variables, properties, the clock and
 * the user's diff configuration.
 * <p>
 * Everything that reads the time or the user configuration goes through
 * {@link #getInstance()}, so tests can install a reader with a fixed clock
 * and an in-memory configuration.
 */
public abstract class SystemReader {
	private static final Logger LOG = LoggerFactory
			.getLogger(SystemReader.class);

	private static final SystemReader DEFAULT = new SystemReader() {
		@Override
		public String getenv(String variable) {
			return System.getenv(variable);
		}

		@Override
		public String getProperty(String key) {
			return System.getProperty(key);
		}

		@Override
		public long getCurrentTime() {
			return System.currentTimeMillis();
		}
	};

	private static volatile SystemReader INSTANCE = DEFAULT;

	private FileBasedConfig userConfig;

	/**
	 * Get the reader in use.
	 *
	 * @return the current reader.
	 */
	public static SystemReader getInstance() {
		return INSTANCE;
	}

	/**
	 * Replace the reader in use.
	 *
	 * @param newReader
	 *            the reader to install, or null to restore the one backed by
	 *            the real system.
	 */
	public static void setInstance(SystemReader newReader) {
		INSTANCE = newReader != null ? newReader : DEFAULT;
	}

	/**
	 * Get an environment variable.
	 *
	 * @param variable
	 *            name of the variable.
	 * @return its value, or null if unset.
	 */
	public abstract String getenv(String variable);

	/**
	 * Get a system property.
	 *
	 * @param key
	 *            name of the property.
	 * @return its value, or null if unset.
	 */
	public abstract String getProperty(String key);

	/**
	 * Get the current time.
	 *
	 * @return milliseconds since the epoch.
	 */
	public abstract long getCurrentTime();

	/**
	 * Locate the user configuration: the file named by the
	 * {@code BYTEDIFF_CONFIG} environment variable, else
	 * {@code .bytediffconfig} in the user's home directory.
	 *
	 * @return path of the user configuration file, which need not exist.
	 */
	public Path getUserConfigFile() {
		String path = getenv(ConfigConstants.BYTEDIFF_CONFIG_KEY);
		if (path != null && !path.isEmpty())
			return Paths.get(path);
		String home = getProperty("user.home"); //$NON-NLS-1$
		if (home == null || home.isEmpty())
			home = "."; //$NON-NLS-1$
		return Paths.get(home, ConfigConstants.USER_CONFIG_FILE);
	}

	/**
	 * Get the user configuration, reading the file again if it changed since
	 * the last call.
	 *
	 * @return the user configuration; empty if the file does not exist.
	 * @throws java.io.IOException
	 *             the file could not be read.
	 * @throws org.bytediff.errors.ConfigInvalidException
	 *             the file is malformed.
	 */
	public synchronized Config getUserConfig()
			throws IOException, ConfigInvalidException {
		Path file = getUserConfigFile();
		if (userConfig == null || !userConfig.getFile().equals(file))
			userConfig = new FileBasedConfig(file);
		if (userConfig.isOutdated()) {
			LOG.debug("loading user config {}", file); //$NON-NLS-1$
			userConfig.load();
		}
		return userConfig;
	}
}
