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

import java.text.MessageFormat;

import org.bytediff.internal.DiffText;

/**
 * Configuration text that could not be parsed, with the line where parsing
 * stopped.
 */
public class ConfigInvalidException extends Exception {
	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	/**
	 * Report a malformed line.
	 *
	 * @param lineNumber
	 *            1-based line of the text.
	 * @param reason
	 *            what is wrong with the line.
	 */
	public ConfigInvalidException(int lineNumber, String reason) {
		super(MessageFormat.format(DiffText.get().invalidConfigLine,
				Integer.valueOf(lineNumber), reason));
		this.lineNumber = lineNumber;
	}

	/**
	 * Report a malformed text read from some source.
	 *
	 * @param message
	 *            names the source.
	 * @param cause
	 *            the parse failure.
	 */
	public ConfigInvalidException(String message,
			ConfigInvalidException cause) {
		super(message, cause);
		this.lineNumber = cause.lineNumber;
	}

	/**
	 * Get the line where parsing stopped.
	 *
	 * @return 1-based line number.
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
