/*
 * Copyright (C) 2010, Sasa Zivkov <sasa.zivkov@sap.com> and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.nls;

import java.lang.reflect.Field;
import java.lang.reflect.Modifier;
import java.util.Locale;
import java.util.MissingResourceException;
import java.util.ResourceBundle;

import org.bytediff.errors.TranslationBundleException;

/**
 * Base class of the message bundles.
 * <p>
 * A bundle declares one public {@code String} field per message. Loading a
 * bundle for a locale fills every such field from the properties file named
 * after the bundle class, found next to it on the class path, with the usual
 * {@link ResourceBundle} fallback to less specific locales. Obtain bundles
 * through {@link NLS#getBundleFor(Class)}, which loads each one once per
 * locale.
 */
public abstract class TranslationBundle {
	private Locale effectiveLocale;

	/**
	 * Get the locale of the properties file the texts came from.
	 *
	 * @return the locale after fallback, e.g. {@link Locale#ROOT}.
	 */
	public Locale effectiveLocale() {
		return effectiveLocale;
	}

	void load(Locale locale) {
		Class<?> type = getClass();
		ResourceBundle texts;
		try {
			texts = ResourceBundle.getBundle(type.getName(), locale,
					type.getClassLoader());
		} catch (MissingResourceException e) {
			throw new TranslationBundleException(type, locale, null, e);
		}
		for (Field f : type.getFields()) {
			if (f.getType() != String.class
					|| Modifier.isStatic(f.getModifiers()))
				continue;
			try {
				f.set(this, texts.getString(f.getName()));
			} catch (MissingResourceException e) {
				throw new TranslationBundleException(type, locale,
						f.getName(), e);
			} catch (IllegalAccessException e) {
				throw new IllegalStateException(e);
			}
		}
		effectiveLocale = texts.getLocale();
	}
}
