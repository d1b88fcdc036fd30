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

/**
 * Constants for use with the configuration classes: section names and
 * configuration keys
 */
@SuppressWarnings("nls")
public final class ConfigConstants {
	/** The "diff" section */
	public static final String CONFIG_DIFF_SECTION = "diff";

	/** The "timeout" key */
	public static final String CONFIG_KEY_TIMEOUT = "timeout";

	/** The "editCost" key */
	public static final String CONFIG_KEY_EDIT_COST = "editCost";

	/** The "matchThreshold" key */
	public static final String CONFIG_KEY_MATCH_THRESHOLD = "matchThreshold";

	/** The "matchDistance" key */
	public static final String CONFIG_KEY_MATCH_DISTANCE = "matchDistance";

	/** The "deleteThreshold" key */
	public static final String CONFIG_KEY_DELETE_THRESHOLD = "deleteThreshold";

	/** The "patchMargin" key */
	public static final String CONFIG_KEY_PATCH_MARGIN = "patchMargin";

	/** The "maxBits" key */
	public static final String CONFIG_KEY_MAX_BITS = "maxBits";

	/** Environment variable naming the user configuration file */
	public static final String BYTEDIFF_CONFIG_KEY = "BYTEDIFF_CONFIG";

	/** Name of the user configuration file in the home directory */
	public static final String USER_CONFIG_FILE = ".bytediffconfig";

	private ConfigConstants() {
		// Hide the default constructor
	}
}
