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

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.NoSuchFileException;
import java.nio.file.Path;
import java.nio.file.attribute.FileTime;
import java.text.MessageFormat;
import java.util.Objects;

import org.bytediff.errors.ConfigInvalidException;
import org.bytediff.internal.DiffText;

/**
 * A {@link Config} read from a file, which may be reloaded when the file
 * changes.
 */
public class FileBasedConfig extends Config {
	private final Path file;

	private volatile Stamp loaded;

	/**
	 * Create a configuration backed by a file. Nothing is read until
	 * {@link #load()}.
	 *
	 * @param file
	 *            location of the configuration file.
	 */
	public FileBasedConfig(Path file) {
		this.file = file;
	}

	/**
	 * Get the file this configuration is read from.
	 *
	 * @return location of the configuration file.
	 */
	public final Path getFile() {
		return file;
	}

	/**
	 * (Re)read the file. A missing file reads as an empty configuration, and a
	 * leading UTF-8 byte order mark is skipped.
	 *
	 * @throws java.io.IOException
	 *             the file exists but could not be read.
	 * @throws org.bytediff.errors.ConfigInvalidException
	 *             the file is not a valid configuration; the previous content
	 *             is kept.
	 */
	public void load() throws IOException, ConfigInvalidException {
		Stamp stamp = Stamp.of(file);
		byte[] in;
		try {
			in = Files.readAllBytes(file);
		} catch (NoSuchFileException notFound) {
			clear();
			loaded = Stamp.MISSING;
			return;
		}
		int start = hasBom(in) ? 3 : 0;
		try {
			fromText(new String(in, start, in.length - start, UTF_8));
		} catch (ConfigInvalidException e) {
			throw new ConfigInvalidException(
					MessageFormat.format(DiffText.get().cannotReadFile, file),
					e);
		}
		loaded = stamp;
	}

	/**
	 * Whether {@link #load()} would read something new.
	 *
	 * @return true if the file was never loaded, or was created, changed or
	 *         removed since it was last loaded.
	 */
	public boolean isOutdated() {
		Stamp last = loaded;
		return last == null || !last.equals(Stamp.of(file));
	}

	private static boolean hasBom(byte[] in) {
		return in.length >= 3 && in[0] == (byte) 0xEF
				&& in[1] == (byte) 0xBB && in[2] == (byte) 0xBF;
	}

	@SuppressWarnings("nls")
	@Override
	public String toString() {
		return "FileBasedConfig[" + file + "]";
	}

	/** Modification time and size of the file, or the absence of it. */
	private static final class Stamp {
		static final Stamp MISSING = new Stamp(null, -1);

		final FileTime modified;

		final long size;

		private Stamp(FileTime modified, long size) {
			this.modified = modified;
			this.size = size;
		}

		static Stamp of(Path file) {
			try {
				return new Stamp(Files.getLastModifiedTime(file),
						Files.size(file));
			} catch (IOException e) {
				return MISSING;
			}
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Stamp))
				return false;
			Stamp s = (Stamp) o;
			return Objects.equals(modified, s.modified) && size == s.size;
		}

		@Override
		public int hashCode() {
			return Objects.hashCode(modified) * 31 + Long.hashCode(size);
		}
	}
}
