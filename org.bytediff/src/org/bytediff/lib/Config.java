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

import java.text.MessageFormat;
import java.util.Collections;
import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.concurrent.ConcurrentHashMap;

import org.bytediff.errors.ConfigInvalidException;
import org.bytediff.internal.DiffText;

/**
 * Read-only view of a git-style configuration text.
 * <p>
 * The accepted syntax is the part of git's that tuning files use:
 * {@code [section]} and {@code [section "subsection"]} headers,
 * {@code name = value} entries, {@code #} and {@code ;} comments, double
 * quotes, the escapes {@code \\ \" \n \t \b} and backslash line
 * continuations. Section and entry names are case-insensitive, subsection
 * names are not. An entry without {@code =} reads as an empty value, and when
 * an entry appears more than once the last value wins.
 * <p>
 * Typed objects built from a configuration are cached per
 * {@link SectionParser} until the text is replaced.
 */
public class Config {
	private static final long KiB = 1024;

	private static final long MiB = 1024 * KiB;

	private static final long GiB = 1024 * MiB;

	private volatile State state = new State(Collections.emptyMap());

	/**
	 * Replace the content of this configuration.
	 * <p>
	 * On failure the previous content is kept.
	 *
	 * @param text
	 *            configuration text in git syntax.
	 * @throws org.bytediff.errors.ConfigInvalidException
	 *             the text is not well formed.
	 */
	public void fromText(String text) throws ConfigInvalidException {
		state = new State(new Parser(text).parse());
	}

	/**
	 * Drop all entries, as though an empty text had been read.
	 */
	protected void clear() {
		state = new State(Collections.emptyMap());
	}

	/**
	 * Get a value as it was written, after unquoting.
	 *
	 * @param section
	 *            section name, e.g. "diff".
	 * @param subsection
	 *            subsection name, or null for the section itself.
	 * @param name
	 *            entry name.
	 * @return the last value given for the entry, "" for an entry without
	 *         {@code =}, or null if the entry is not set.
	 */
	public String getString(String section, String subsection, String name) {
		return state.values.get(key(section, subsection, name));
	}

	/**
	 * Get an integer value. The suffixes {@code k}, {@code m} and {@code g}
	 * scale the number by 1024, 1024^2 and 1024^3.
	 *
	 * @param section
	 *            section name.
	 * @param subsection
	 *            subsection name, or null.
	 * @param name
	 *            entry name.
	 * @param defaultValue
	 *            returned when the entry is not set or empty.
	 * @return the value.
	 * @throws java.lang.IllegalArgumentException
	 *             the value is not an integer, or does not fit into an int.
	 */
	public int getInt(String section, String subsection, String name,
			int defaultValue) {
		String str = getString(section, subsection, name);
		if (str == null || str.trim().isEmpty())
			return defaultValue;
		String n = str.trim();
		long mul = 1;
		switch (Character.toLowerCase(n.charAt(n.length() - 1))) {
		case 'g':
			mul = GiB;
			break;
		case 'm':
			mul = MiB;
			break;
		case 'k':
			mul = KiB;
			break;
		default:
			break;
		}
		if (mul > 1)
			n = n.substring(0, n.length() - 1).trim();
		try {
			long v = Math.multiplyExact(Long.parseLong(n), mul);
			if (v < Integer.MIN_VALUE || v > Integer.MAX_VALUE)
				throw new NumberFormatException(str);
			return (int) v;
		} catch (NumberFormatException | ArithmeticException e) {
			throw new IllegalArgumentException(MessageFormat.format(
					DiffText.get().invalidIntegerValue,
					qualified(section, subsection), name, str), e);
		}
	}

	/**
	 * Get a floating point value.
	 *
	 * @param section
	 *            section name.
	 * @param subsection
	 *            subsection name, or null.
	 * @param name
	 *            entry name.
	 * @param defaultValue
	 *            returned when the entry is not set or empty.
	 * @return the value.
	 * @throws java.lang.IllegalArgumentException
	 *             the value is not a number.
	 */
	public float getFloat(String section, String subsection, String name,
			float defaultValue) {
		String str = getString(section, subsection, name);
		if (str == null || str.trim().isEmpty())
			return defaultValue;
		try {
			return Float.parseFloat(str.trim());
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(MessageFormat.format(
					DiffText.get().invalidFloatValue,
					qualified(section, subsection), name, str), e);
		}
	}

	/**
	 * Obtain an object built from this configuration.
	 * <p>
	 * The first call with a given parser runs it; later calls return the same
	 * object until the content is replaced. A parser that throws leaves
	 * nothing cached.
	 *
	 * @param parser
	 *            builds the object; used as the cache key.
	 * @return the object.
	 */
	@SuppressWarnings("unchecked")
	public <T> T get(SectionParser<T> parser) {
		return (T) state.parsed.computeIfAbsent(parser, p -> p.parse(this));
	}

	private static String key(String section, String subsection,
			String name) {
		StringBuilder b = new StringBuilder();
		b.append(section.toLowerCase(Locale.ROOT));
		if (subsection != null)
			b.append(" \"").append(subsection).append('"');
		b.append('\n').append(name.toLowerCase(Locale.ROOT));
		return b.toString();
	}

	private static String qualified(String section, String subsection) {
		return subsection != null ? section + '.' + subsection : section;
	}

	/**
	 * Parses an object from a configuration.
	 *
	 * @param <T>
	 *            type of the object
	 */
	public interface SectionParser<T> {
		/**
		 * Create the object from the configuration.
		 *
		 * @param cfg
		 *            the configuration to read from.
		 * @return the object; never null.
		 */
		T parse(Config cfg);
	}

	private static final class State {
		final Map<String, String> values;

		final Map<SectionParser<?>, Object> parsed = new ConcurrentHashMap<>();

		State(Map<String, String> values) {
			this.values = values;
		}
	}

	private static final class Parser {
		private final String text;

		private int pos;

		private String section;

		private String subsection;

		Parser(String text) {
			this.text = text;
		}

		Map<String, String> parse() throws ConfigInvalidException {
			Map<String, String> values = new HashMap<>();
			for (;;) {
				skipSpace(true);
				int c = peek();
				if (c < 0)
					return values;
				if (c == '#' || c == ';') {
					skipComment();
				} else if (c == '[') {
					next();
					readHeader();
				} else {
					String name = readName();
					if (section == null)
						throw error(MessageFormat.format(
								DiffText.get().entryOutsideSection, name));
					values.put(key(section, subsection, name), readValue());
				}
			}
		}

		private void readHeader() throws ConfigInvalidException {
			StringBuilder name = new StringBuilder();
			for (;;) {
				int c = peek();
				if (c < 0 || !(isNameChar(c) || c == '.'))
					break;
				name.append((char) next());
			}
			skipSpace(false);
			int c = next();
			if (name.length() == 0 || (c != ']' && c != '"'))
				throw error(DiffText.get().badSectionHeader);
			section = name.toString();
			subsection = null;
			if (c == ']')
				return;
			StringBuilder sub = new StringBuilder();
			for (;;) {
				c = next();
				if (c < 0 || c == '\n')
					throw error(DiffText.get().badSectionHeader);
				if (c == '"')
					break;
				if (c == '\\') {
					c = next();
					if (c < 0 || c == '\n')
						throw error(DiffText.get().badSectionHeader);
				}
				sub.append((char) c);
			}
			if (next() != ']')
				throw error(DiffText.get().badSectionHeader);
			subsection = sub.toString();
		}

		private String readName() throws ConfigInvalidException {
			StringBuilder name = new StringBuilder();
			for (;;) {
				int c = peek();
				if (c < 0 || !isNameChar(c))
					break;
				name.append((char) next());
			}
			if (name.length() == 0)
				name.append((char) peek());
			if (!Character.isLetter(name.charAt(0)))
				throw error(MessageFormat.format(DiffText.get().badEntryName,
						name));
			return name.toString();
		}

		private String readValue() throws ConfigInvalidException {
			skipSpace(false);
			int c = peek();
			if (c < 0 || c == '\n' || c == '\r' || c == '#' || c == ';')
				return ""; //$NON-NLS-1$
			if (c != '=')
				throw error(DiffText.get().badEntryDelimiter);
			next();
			skipSpace(false);

			StringBuilder value = new StringBuilder();
			StringBuilder blanks = new StringBuilder();
			boolean quoted = false;
			for (;;) {
				c = next();
				if (c < 0) {
					if (quoted)
						throw error(DiffText.get().unexpectedEndOfConfigFile);
					break;
				}
				if (c == '\n') {
					if (quoted)
						throw error(DiffText.get().newlineInQuotesNotAllowed);
					break;
				}
				if (c == '\r' && peek() == '\n')
					continue;
				if (!quoted && (c == ' ' || c == '\t')) {
					blanks.append((char) c);
					continue;
				}
				if (!quoted && (c == '#' || c == ';')) {
					skipComment();
					break;
				}
				if (value.length() > 0)
					value.append(blanks);
				blanks.setLength(0);
				if (c == '"') {
					quoted = !quoted;
				} else if (c == '\\') {
					if (!readEscape(value))
						continue;
				} else {
					value.append((char) c);
				}
			}
			return value.toString();
		}

		/** @return false on a line continuation. */
		private boolean readEscape(StringBuilder value)
				throws ConfigInvalidException {
			int c = next();
			switch (c) {
			case -1:
				throw error(DiffText.get().endOfFileInEscape);
			case '\r':
				if (next() != '\n')
					throw error(MessageFormat
							.format(DiffText.get().badEscape, "\\r")); //$NON-NLS-1$
				return false;
			case '\n':
				return false;
			case 'n':
				value.append('\n');
				return true;
			case 't':
				value.append('\t');
				return true;
			case 'b':
				value.append('\b');
				return true;
			case '\\':
			case '"':
				value.append((char) c);
				return true;
			default:
				throw error(MessageFormat.format(DiffText.get().badEscape,
						Character.valueOf((char) c)));
			}
		}

		private void skipSpace(boolean newlines) {
			for (;;) {
				int c = peek();
				if (c == ' ' || c == '\t' || c == '\r'
						|| (newlines && c == '\n'))
					next();
				else
					return;
			}
		}

		private void skipComment() {
			for (;;) {
				int c = next();
				if (c < 0 || c == '\n')
					return;
			}
		}

		private static boolean isNameChar(int c) {
			return Character.isLetterOrDigit(c) || c == '-';
		}

		private int peek() {
			return pos < text.length() ? text.charAt(pos) : -1;
		}

		private int next() {
			int c = peek();
			if (c >= 0)
				pos++;
			return c;
		}

		/** Fails at the line of the last character read. */
		private ConfigInvalidException error(String reason) {
			int line = 1;
			for (int i = 0; i < pos - 1; i++) {
				if (text.charAt(i) == '\n')
					line++;
			}
			return new ConfigInvalidException(line, reason);
		}
	}
}
