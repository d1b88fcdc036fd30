/*
 * Copyright (C) 2026, The bytediff authors and others
 *
 * This program and the accompanying materials are made available under the
 * terms of the Eclipse Distribution License v. 1.0 which is available at
 * https://www.eclipse.org/org/documents/edl-v10.php.
 *
 * SPDX-License-Identifier: BSD-3-Clause
 */

package org.bytediff.diff;

import java.util.ArrayList;
import java.util.LinkedList;
import java.util.List;

import org.bytediff.lib.Deadline;
import org.bytediff.text.Buffer;
import org.bytediff.text.Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Diffs two long texts line by line first, then refines replaced lines.
 * <p>
 * Both texts are split into lines which are numbered through one shared
 * {@link LineText.Dictionary}, and the engine runs over the line numbers.
 * Unchanged lines are kept as they are. Every block of changed lines that
 * both deletes and inserts is diffed again, character by character.
 */
final class LineMode {
	private static final Logger LOG = LoggerFactory.getLogger(LineMode.class);

	private final Text text1;

	private final Text text2;

	private final Deadline deadline;

	private final LinkedList<Diff> result = new LinkedList<>();

	private final List<Diff> pending = new ArrayList<>();

	private Buffer deleted = new Buffer();

	private Buffer inserted = new Buffer();

	private LineMode(Text text1, Text text2, Deadline deadline) {
		this.text1 = text1;
		this.text2 = text2;
		this.deadline = deadline;
	}

	/**
	 * Diff two texts line by line.
	 *
	 * @param text1
	 *            old text.
	 * @param text2
	 *            new text.
	 * @param deadline
	 *            bounds the line diff and every refinement.
	 * @return the edit script.
	 */
	static LinkedList<Diff> diff(Text text1, Text text2, Deadline deadline) {
		return new LineMode(text1, text2, deadline).run();
	}

	private LinkedList<Diff> run() {
		LineText.Dictionary dictionary = new LineText.Dictionary();
		LineText lines1 = new LineText(text1.buffer(), dictionary);
		LineText lines2 = new LineText(text2.buffer(), dictionary);
		if (LOG.isDebugEnabled()) {
			LOG.debug("line mode on {} and {} lines, {} distinct", //$NON-NLS-1$
					Integer.valueOf(lines1.size()),
					Integer.valueOf(lines2.size()),
					Integer.valueOf(dictionary.size()));
		}

		for (Diff d : Patch.diffMain(lines1, lines2, false, deadline)) {
			switch (d.getOperation()) {
			case DELETE:
				deleted.append(d.buffer);
				pending.add(d);
				break;
			case INSERT:
				inserted.append(d.buffer);
				pending.add(d);
				break;
			case EQUAL:
				flush();
				result.add(d);
				break;
			}
		}
		flush();
		return result;
	}

	private void flush() {
		if (!deleted.isEmpty() && !inserted.isEmpty()) {
			result.addAll(Patch.diffMain(text1.newText(deleted),
					text2.newText(inserted), false, deadline));
		} else {
			result.addAll(pending);
		}
		pending.clear();
		deleted = new Buffer();
		inserted = new Buffer();
	}
}
