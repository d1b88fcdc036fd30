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

import static java.nio.charset.StandardCharsets.UTF_8;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;

import org.bytediff.errors.ConfigInvalidException;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

public class FileBasedConfigTest {
	private static final String CONTENT = "[diff]\n\ttimeout = 2\n";

	private static final byte[] BOM = { (byte) 0xEF, (byte) 0xBB,
			(byte) 0xBF };

	@TempDir
	Path trash;

	@Test
	void testLoadMissingFile() throws Exception {
		FileBasedConfig config = new FileBasedConfig(
				trash.resolve("missing"));
		config.fromText(CONTENT);
		config.load();
		assertNull(config.getString("diff", null, "timeout"));
		assertEquals(Limits.DEFAULT, config.get(Limits.KEY));
		assertFalse(config.isOutdated());
	}

	@Test
	void testLoad() throws Exception {
		Path file = write(CONTENT.getBytes(UTF_8));
		FileBasedConfig config = new FileBasedConfig(file);
		assertEquals(file, config.getFile());
		config.load();
		assertEquals("2", config.getString("diff", null, "timeout"));
		assertEquals(2f, config.get(Limits.KEY).getTimeout(), 0.0f);
	}

	@Test
	void testUTF8withBOM() throws Exception {
		ByteArrayOutputStream bos = new ByteArrayOutputStream();
		bos.write(BOM);
		bos.write("[diff \"caf\u00e9\"]\n\ttimeout = 2\n".getBytes(UTF_8));
		Path file = write(bos.toByteArray());

		FileBasedConfig config = new FileBasedConfig(file);
		config.load();
		assertEquals("2", config.getString("diff", "caf\u00e9", "timeout"));
	}

	@Test
	void testInvalidFile() throws Exception {
		Path file = write("[diff]\n\ttimeout = 1\n[diff\n".getBytes(UTF_8));
		FileBasedConfig config = new FileBasedConfig(file);
		ConfigInvalidException e = assertThrows(ConfigInvalidException.class,
				config::load);
		assertEquals("Cannot read file " + file, e.getMessage());
		assertEquals(3, e.getLineNumber());
		assertTrue(e.getCause() instanceof ConfigInvalidException);
		assertTrue(config.isOutdated());
	}

	@Test
	void testIsOutdated() throws Exception {
		Path file = write(CONTENT.getBytes(UTF_8));
		FileBasedConfig config = new FileBasedConfig(file);
		assertTrue(config.isOutdated());
		config.load();
		assertFalse(config.isOutdated());

		Files.write(file, "[diff]\n\ttimeout = 2.5\n".getBytes(UTF_8));
		assertTrue(config.isOutdated());
		config.load();
		assertEquals("2.5", config.getString("diff", null, "timeout"));
		assertFalse(config.isOutdated());

		Files.delete(file);
		assertTrue(config.isOutdated());
		config.load();
		assertNull(config.getString("diff", null, "timeout"));
		assertFalse(config.isOutdated());
	}

	@Test
	void testReloadDropsCachedLimits() throws Exception {
		Path file = write(CONTENT.getBytes(UTF_8));
		FileBasedConfig config = new FileBasedConfig(file);
		config.load();
		Limits first = config.get(Limits.KEY);
		assertSame(first, config.get(Limits.KEY));

		Files.write(file, "[diff]\n\ttimeout = 0.5\n".getBytes(UTF_8));
		config.load();
		assertEquals(0.5f, config.get(Limits.KEY).getTimeout(), 0.0f);
	}

	@Test
	void testToString() {
		Path file = trash.resolve("config");
		assertEquals("FileBasedConfig[" + file + "]",
				new FileBasedConfig(file).toString());
	}

	private Path write(byte[] content) throws IOException {
		Path file = trash.resolve("config");
		Files.write(file, content);
		return file;
	}
}
