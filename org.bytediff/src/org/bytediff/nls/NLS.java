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

import java.lang.reflect.InvocationTargetException;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Hands out translation bundles for the locale of the calling thread.
 * <p>
 * The locale is inherited by threads started afterwards and defaults to the
 * JVM default locale. Bundles are loaded once per locale and shared by all
 * threads.
 */
public final class NLS {
	private static final InheritableThreadLocal<Locale> LOCALE = new InheritableThreadLocal<>();

	private static final Map<Locale, Map<Class<?>, TranslationBundle>> BUNDLES = new ConcurrentHashMap<>();

	private NLS() {
		// Static access only
	}

	/**
	 * Set the locale of the calling thread.
	 *
	 * @param locale
	 *            the preferred locale.
	 */
	public static void setLocale(Locale locale) {
		LOCALE.set(locale);
	}

	/**
	 * Let the calling thread follow the JVM default locale again.
	 */
	public static void useJVMDefaultLocale() {
		LOCALE.remove();
	}

	/**
	 * Get a bundle in the locale of the calling thread.
	 *
	 * @param type
	 *            the bundle class.
	 * @return the filled bundle.
	 * @throws org.bytediff.errors.TranslationBundleException
	 *             the bundle has no properties file, or a field has no text.
	 */
	public static <T extends TranslationBundle> T getBundleFor(Class<T> type) {
		Locale locale = LOCALE.get();
		if (locale == null)
			locale = Locale.getDefault();
		Map<Class<?>, TranslationBundle> bundles = BUNDLES
				.computeIfAbsent(locale, l -> new ConcurrentHashMap<>());
		final Locale l = locale;
		return type.cast(bundles.computeIfAbsent(type, t -> create(type, l)));
	}

	private static <T extends TranslationBundle> T create(Class<T> type,
			Locale locale) {
		T bundle;
		try {
			bundle = type.getDeclaredConstructor().newInstance();
		} catch (InstantiationException | IllegalAccessException
				| InvocationTargetException | NoSuchMethodException e) {
			throw new IllegalStateException(e);
		}
		bundle.load(locale);
		return bundle;
	}
}
