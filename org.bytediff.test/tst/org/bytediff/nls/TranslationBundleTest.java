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

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;

import java.util.Locale;

import org.bytediff.errors.TranslationBundleException;
import org.junit.jupiter.api.Test;

public class TranslationBundleTest {

	@Test
	void testMissingPropertiesFile() {
		TranslationBundleException e = assertThrows(
				TranslationBundleException.class,
				() -> new NoPropertiesBundle().load(Locale.ROOT));
		assertEquals(NoPropertiesBundle.class, e.getBundleClass());
		assertEquals(Locale.ROOT, e.getLocale());
		assertNull(e.getKey());
	}

	@Test
	void testMissingString() {
		TranslationBundleException e = assertThrows(
				TranslationBundleException.class,
				() -> new MissingPropertyBundle().load(Locale.ROOT));
		assertEquals("nonTranslatedKey", e.getKey());
		assertEquals(MissingPropertyBundle.class, e.getBundleClass());
		assertEquals(Locale.ROOT, e.getLocale());
	}

	@Test
	void testNonTranslatedBundle() {
		NonTranslatedBundle bundle = new NonTranslatedBundle();

		bundle.load(Locale.ROOT);
		assertEquals(Locale.ROOT, bundle.effectiveLocale());
		assertEquals("Good morning {0}", bundle.goodMorning);

		bundle.load(Locale.GERMAN);
		assertEquals(Locale.ROOT, bundle.effectiveLocale());
		assertEquals("Good morning {0}", bundle.goodMorning);
	}

	@Test
	void testBundleIsSharedPerLocale() {
		NLS.setLocale(Locale.ROOT);
		NonTranslatedBundle a = NonTranslatedBundle.get();
		NonTranslatedBundle b = NonTranslatedBundle.get();
		assertSame(a, b);
		assertEquals("Good morning {0}", a.goodMorning);
		NLS.useJVMDefaultLocale();
	}

	@Test
	void testMissingBundleThroughNLS() {
		NLS.setLocale(Locale.ROOT);
		try {
			TranslationBundleException e = assertThrows(
					TranslationBundleException.class,
					NoPropertiesBundle::get);
			assertEquals("No translations for "
					+ NoPropertiesBundle.class.getName() + " []",
					e.getMessage());
		} finally {
			NLS.useJVMDefaultLocale();
		}
	}
}
