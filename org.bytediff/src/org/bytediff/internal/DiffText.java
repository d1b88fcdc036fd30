/*
 * Copyright (C) 2026, The bytediff authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.internal;

import org.bytediff.nls.NLS;
import org.bytediff.nls.TranslationBundle;

/**
 * Translation bundle for bytediff
 */
public class DiffText extends TranslationBundle {

	/**
	 * Get an instance of this translation bundle.
	 *
	 * @return an instance of this translation bundle
	 */
	public static DiffText get() {
		return NLS.getBundleFor(DiffText.class);
	}

	// @formatter:off
	/***/ public String badEntryDelimiter;
	/***/ public String badEntryName;
	/***/ public String badEscape;
	/***/ public String badSectionHeader;
	/***/ public String cannotReadFile;
	/***/ public String endOfFileInEscape;
	/***/ public String entryOutsideSection;
	/***/ public String invalidConfigLine;
	/***/ public String invalidFloatValue;
	/***/ public String invalidIntegerValue;
	/***/ public String invalidTimeout;
	/***/ public String newlineInQuotesNotAllowed;
	/***/ public String unexpectedEndOfConfigFile;
	/***/ public String valueNotInRange;
}
