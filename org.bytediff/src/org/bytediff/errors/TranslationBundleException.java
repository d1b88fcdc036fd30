/*
 * Copyright (C) 2026, The bytediff authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.errors;

import java.util.Locale;

/**
 * A translation bundle could not be filled: its properties file is missing,
 * or lacks a text for one of the bundle's fields.
 * <p>
 * The message is not translated, since the translations are what failed.
 */
public class TranslationBundleException extends RuntimeException {
	private static final long serialVersionUID = 1L;

	private final Class<?> bundleClass;

	private final transient Locale locale;

	private final String key;

	/**
	 * Report a failure to fill a bundle.
	 *
	 * @param bundleClass
	 *            the bundle being filled.
	 * @param locale
	 *            the requested locale.
	 * @param key
	 *            the field without a text, or null if no properties file
	 *            could be found at all.
	 * @param cause
	 *            the failure reported by {@link java.util.ResourceBundle}.
	 */
	public TranslationBundleException(Class<?> bundleClass, Locale locale,
			String key, Exception cause) {
		super((key == null ? "No translations for " //$NON-NLS-1$
				: "No translation of " + key + " in ") //$NON-NLS-1$ //$NON-NLS-2$
				+ bundleClass.getName() + " [" + locale + "]", cause); //$NON-NLS-1$ //$NON-NLS-2$
		this.bundleClass = bundleClass;
		this.locale = locale;
		this.key = key;
	}

	/**
	 * Get the bundle that failed.
	 *
	 * @return the bundle class.
	 */
	public Class<?> getBundleClass() {
		return bundleClass;
	}

	/**
	 * Get the requested locale.
	 *
	 * @return the locale.
	 */
	public Locale getLocale() {
		return locale;
	}

	/**
	 * Get the field that has no text.
	 *
	 * @return the field name, or null if the whole bundle is missing.
	 */
	public String getKey() {
		return key;
	}
}
