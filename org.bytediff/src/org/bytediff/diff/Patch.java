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

import static org.bytediff.diff.Operation.DELETE;
import static org.bytediff.diff.Operation.EQUAL;
import static org.bytediff.diff.Operation.INSERT;

import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.LinkedList;
import java.util.List;
import java.util.ListIterator;

import org.bytediff.lib.Deadline;
import org.bytediff.lib.Limits;
import org.bytediff.text.AsciiText;
import org.bytediff.text.Buffer;
import org.bytediff.text.Text;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * An edit script that turns one text into another.
 * <p>
 * Use {@link #diff(Limits, Text, Text)} to compute one. The script is a list
 * of {@link Diff}s; concatenating the bytes of the {@link Operation#EQUAL}
 * and {@link Operation#DELETE} diffs gives the first text, concatenating the
 * bytes of the {@link Operation#EQUAL} and {@link Operation#INSERT} diffs
 * gives the second. No diff is empty, and no two neighbours have the same
 * operation.
 * <p>
 * The script is minimal unless the timeout of the {@link Limits} expires
 * first, in which case the parts not yet examined are reported as replaced.
 * Computing a script:
 * <ol>
 * <li>strips the common prefix and suffix,</li>
 * <li>uses the shorter text if it occurs inside the longer one,</li>
 * <li>splits both texts around a long common substring, when one exists and
 * a timeout is set,</li>
 * <li>diffs long texts line by line first, refining replaced lines,</li>
 * <li>else splits both texts at the middle of a shortest edit script found
 * by {@link Bisection}, and recurses on the halves.</li>
 * </ol>
 * Finally the script is brought into a canonical form.
 */
public final class Patch implements Iterable<Diff> {
	private static final Logger LOG = LoggerFactory.getLogger(Patch.class);

	/** Texts longer than this, in characters, are diffed line by line. */
	static final int LINE_MODE_THRESHOLD = 100;

	/**
	 * Compute the edit script between two byte arrays.
	 *
	 * @param limits
	 *            bounds the time spent.
	 * @param text1
	 *            old content; must not change during the call.
	 * @param text2
	 *            new content; must not change during the call.
	 * @return the edit script, one byte per character. It holds copies of
	 *         the bytes and is not affected by later changes to the arrays.
	 */
	public static Patch diff(Limits limits, byte[] text1, byte[] text2) {
		return diff(limits, new AsciiText(text1), new AsciiText(text2));
	}

	/**
	 * Compute the edit script between two texts, diffing long texts line by
	 * line first.
	 *
	 * @param limits
	 *            bounds the time spent.
	 * @param text1
	 *            old text.
	 * @param text2
	 *            new text.
	 * @return the edit script.
	 */
	public static Patch diff(Limits limits, Text text1, Text text2) {
		return diff(limits, text1, text2, true);
	}

	/**
	 * Compute the edit script between two texts.
	 *
	 * @param limits
	 *            bounds the time spent.
	 * @param text1
	 *            old text.
	 * @param text2
	 *            new text.
	 * @param checklines
	 *            if true, texts of more than 100 characters are diffed line by
	 *            line before the changed lines are diffed in detail. Faster,
	 *            but the result may not be minimal.
	 * @return the edit script.
	 */
	public static Patch diff(Limits limits, Text text1, Text text2,
			boolean checklines) {
		Deadline deadline = limits.deadline();
		LinkedList<Diff> diffs = diffMain(text1, text2, checklines, deadline);
		optimize(text1, diffs);
		return new Patch(text1, diffs);
	}

	/**
	 * Diff two texts, without bringing the result into canonical form.
	 * <p>
	 * Equal texts give a single {@link Operation#EQUAL}, or nothing if they
	 * are empty. Otherwise the common prefix and suffix are split off and
	 * the rest goes through {@link #compute(Text, Text, boolean, Deadline)}.
	 */
	static LinkedList<Diff> diffMain(Text text1, Text text2,
			boolean checklines, Deadline deadline) {
		LinkedList<Diff> diffs = new LinkedList<>();
		if (text1.contentEquals(text2)) {
			if (!text1.isEmpty())
				diffs.add(new Diff(EQUAL, text1.buffer()));
			return diffs;
		}

		CommonPrefix prefix = new CommonPrefix(text1, text2);
		Text a = text1.substring(prefix.size());
		Text b = text2.substring(prefix.size());
		CommonSuffix suffix = new CommonSuffix(a, b);
		a = a.substring(0, a.size() - suffix.size());
		b = b.substring(0, b.size() - suffix.size());

		if (prefix.isFound())
			diffs.add(new Diff(EQUAL, prefix.buffer()));
		diffs.addAll(compute(a, b, checklines, deadline));
		if (suffix.isFound())
			diffs.add(new Diff(EQUAL, suffix.buffer()));
		return diffs;
	}

	/**
	 * Diff two texts that share neither a first nor a last character.
	 */
	static LinkedList<Diff> compute(Text text1, Text text2,
			boolean checklines, Deadline deadline) {
		LinkedList<Diff> diffs = new LinkedList<>();
		if (text1.isEmpty()) {
			diffs.add(new Diff(INSERT, text2.buffer()));
			return diffs;
		}
		if (text2.isEmpty()) {
			diffs.add(new Diff(DELETE, text1.buffer()));
			return diffs;
		}

		CommonOverlap overlap = new CommonOverlap(text1, text2);
		if (overlap.isFound()) {
			add(diffs, overlap.operation(), overlap.prefix());
			diffs.add(new Diff(EQUAL, overlap.buffer()));
			add(diffs, overlap.operation(), overlap.suffix());
			return diffs;
		}

		if (text1.size() == 1 || text2.size() == 1)
			return replace(text1, text2);

		if (deadline.isSet()) {
			HalfMatch hm = new HalfMatch(text1, text2);
			if (hm.isValid()) {
				diffs.addAll(diffMain(hm.prefix1(), hm.prefix2(), checklines,
						deadline));
				diffs.add(new Diff(EQUAL, hm.common().buffer()));
				diffs.addAll(diffMain(hm.suffix1(), hm.suffix2(), checklines,
						deadline));
				return diffs;
			}
		}

		if (checklines && text1.size() > LINE_MODE_THRESHOLD
				&& text2.size() > LINE_MODE_THRESHOLD)
			return LineMode.diff(text1, text2, deadline);

		return bisect(text1, text2, deadline);
	}

	/**
	 * Split two texts at the middle of their shortest edit script and diff
	 * both halves; replace everything if the deadline does not allow that.
	 */
	static LinkedList<Diff> bisect(Text text1, Text text2, Deadline deadline) {
		Bisection middle = new Bisection(text1, text2, deadline);
		if (!middle.isFound()) {
			if (LOG.isDebugEnabled()) {
				LOG.debug(
						"no split found after {} rounds, replacing {} by {} characters", //$NON-NLS-1$
						Integer.valueOf(middle.getRounds()),
						Integer.valueOf(text1.size()),
						Integer.valueOf(text2.size()));
			}
			return replace(text1, text2);
		}

		int x = middle.getX();
		int y = middle.getY();
		LinkedList<Diff> diffs = diffMain(text1.substring(0, x),
				text2.substring(0, y), false, deadline);
		diffs.addAll(diffMain(text1.substring(x), text2.substring(y), false,
				deadline));
		return diffs;
	}

	private static LinkedList<Diff> replace(Text text1, Text text2) {
		LinkedList<Diff> diffs = new LinkedList<>();
		diffs.add(new Diff(DELETE, text1.buffer()));
		diffs.add(new Diff(INSERT, text2.buffer()));
		return diffs;
	}

	private static void add(List<Diff> diffs, Operation op, Buffer bytes) {
		if (!bytes.isEmpty())
			diffs.add(new Diff(op, bytes));
	}

	/**
	 * Bring an edit script into canonical form.
	 * <p>
	 * Merges and shifts until shifting changes nothing anymore.
	 *
	 * @param text
	 *            tells how bytes map to characters.
	 * @param diffs
	 *            the script, modified in place.
	 */
	static void optimize(Text text, LinkedList<Diff> diffs) {
		do {
			mergeUpdates(text, diffs);
			mergeEquals(diffs);
		} while (shift(diffs));
	}

	/**
	 * Combine every run of inserts and deletes between two equalities into
	 * at most one delete followed by one insert. A common prefix or suffix of
	 * the deleted and inserted bytes becomes an equality.
	 */
	static void mergeUpdates(Text text, LinkedList<Diff> diffs) {
		ListIterator<Diff> it = diffs.listIterator();
		Buffer deleted = new Buffer();
		Buffer inserted = new Buffer();
		int updates = 0;
		for (;;) {
			Diff d = it.hasNext() ? it.next() : null;
			if (d != null && d.getOperation() != EQUAL) {
				if (d.getOperation() == DELETE)
					deleted.append(d.buffer);
				else
					inserted.append(d.buffer);
				it.remove();
				updates++;
				continue;
			}

			if (updates > 0) {
				if (d != null)
					it.previous();
				emitUpdates(text, it, deleted, inserted);
				if (d != null)
					it.next();
				deleted = new Buffer();
				inserted = new Buffer();
				updates = 0;
			}
			if (d == null)
				return;
		}
	}

	private static void emitUpdates(Text text, ListIterator<Diff> it,
			Buffer deleted, Buffer inserted) {
		Buffer prefix = null;
		Buffer suffix = null;
		if (!deleted.isEmpty() && !inserted.isEmpty()) {
			CommonPrefix p = new CommonPrefix(text.newText(deleted),
					text.newText(inserted));
			if (p.isFound()) {
				prefix = p.buffer();
				deleted.skip(prefix.size());
				inserted.skip(prefix.size());
			}
			CommonSuffix s = new CommonSuffix(text.newText(deleted),
					text.newText(inserted));
			if (s.isFound()) {
				suffix = s.buffer();
				deleted.shrink(suffix.size());
				inserted.shrink(suffix.size());
			}
		}
		if (prefix != null)
			it.add(new Diff(EQUAL, prefix));
		if (!deleted.isEmpty())
			it.add(new Diff(DELETE, deleted));
		if (!inserted.isEmpty())
			it.add(new Diff(INSERT, inserted));
		if (suffix != null)
			it.add(new Diff(EQUAL, suffix));
	}

	/**
	 * Join neighbouring equalities, and drop empty ones.
	 */
	static void mergeEquals(LinkedList<Diff> diffs) {
		ListIterator<Diff> it = diffs.listIterator();
		Diff prev = null;
		while (it.hasNext()) {
			Diff d = it.next();
			if (d.getOperation() != EQUAL) {
				prev = null;
			} else if (d.isEmpty()) {
				it.remove();
			} else if (prev != null) {
				prev.buffer.append(d.buffer);
				it.remove();
			} else {
				prev = d;
			}
		}
	}

	/**
	 * Slide single edits surrounded by equalities sideways to eliminate an
	 * equality.
	 * <p>
	 * {@code EQUAL("a"), INSERT("ba"), EQUAL("c")} becomes
	 * {@code INSERT("ab"), EQUAL("ac")}, and
	 * {@code EQUAL("a"), INSERT("ca"), EQUAL("c")} becomes
	 * {@code EQUAL("ac"), INSERT("ac")}.
	 *
	 * @return true if anything moved.
	 */
	static boolean shift(LinkedList<Diff> diffs) {
		if (diffs.size() < 3)
			return false;

		boolean changed = false;
		ListIterator<Diff> it = diffs.listIterator();
		Diff prev = it.next();
		Diff cur = it.next();
		while (it.hasNext()) {
			Diff next = it.next();
			if (prev.getOperation() == EQUAL && next.getOperation() == EQUAL
					&& cur.getOperation() != EQUAL) {
				Buffer p = prev.buffer;
				Buffer c = cur.buffer;
				Buffer n = next.buffer;
				if (!p.isEmpty() && c.endsWith(p)) {
					c.shrink(p.size());
					c.prepend(p);
					n.prepend(p);
					// drop prev, then return to after next
					it.previous();
					it.previous();
					it.previous();
					it.remove();
					it.next();
					it.next();
					changed = true;
					prev = cur;
					cur = next;
					continue;
				} else if (!n.isEmpty() && c.startsWith(n)) {
					p.append(n);
					c.skip(n.size());
					c.append(n);
					it.remove();
					changed = true;
					if (!it.hasNext())
						break;
					prev = cur;
					cur = it.next();
					continue;
				}
			}
			prev = cur;
			cur = next;
		}
		return changed;
	}

	private final Text encoding;

	private final List<Diff> diffs;

	private Patch(Text encoding, List<Diff> diffs) {
		this.encoding = encoding.newText(new Buffer());
		List<Diff> frozen = new ArrayList<>(diffs.size());
		for (Diff d : diffs)
			frozen.add(d.detach());
		this.diffs = Collections.unmodifiableList(frozen);
	}

	/**
	 * Get the number of diffs.
	 *
	 * @return number of diffs in the script.
	 */
	public int size() {
		return diffs.size();
	}

	/**
	 * Whether the script is empty, which only happens for two empty texts.
	 *
	 * @return true if there are no diffs.
	 */
	public boolean isEmpty() {
		return diffs.isEmpty();
	}

	/**
	 * Get a diff.
	 *
	 * @param i
	 *            index of the diff.
	 * @return the diff.
	 */
	public Diff get(int i) {
		return diffs.get(i);
	}

	/**
	 * Get all diffs.
	 *
	 * @return unmodifiable list of the diffs, in order.
	 */
	public List<Diff> getDiffs() {
		return diffs;
	}

	@Override
	public Iterator<Diff> iterator() {
		return diffs.iterator();
	}

	/**
	 * Rebuild the old text.
	 *
	 * @return bytes of all {@link Operation#EQUAL} and
	 *         {@link Operation#DELETE} diffs.
	 */
	public Buffer text1() {
		return concat(INSERT);
	}

	/**
	 * Rebuild the new text.
	 *
	 * @return bytes of all {@link Operation#EQUAL} and
	 *         {@link Operation#INSERT} diffs.
	 */
	public Buffer text2() {
		return concat(DELETE);
	}

	private Buffer concat(Operation skip) {
		Buffer r = new Buffer();
		for (Diff d : diffs) {
			if (d.getOperation() != skip)
				r.append(d.buffer);
		}
		return r;
	}

	/**
	 * Compute the Levenshtein distance: the number of inserted, deleted or
	 * substituted characters.
	 *
	 * @return edit distance in characters.
	 */
	public int levenshtein() {
		int distance = 0;
		int insertions = 0;
		int deletions = 0;
		for (Diff d : diffs) {
			switch (d.getOperation()) {
			case INSERT:
				insertions += encoding.newText(d.buffer).size();
				break;
			case DELETE:
				deletions += encoding.newText(d.buffer).size();
				break;
			case EQUAL:
				distance += Math.max(insertions, deletions);
				insertions = 0;
				deletions = 0;
				break;
			}
		}
		return distance + Math.max(insertions, deletions);
	}

	/**
	 * Convert the script into regions of changed bytes.
	 *
	 * @return one edit per run of changes between two equalities, with byte
	 *         offsets into the old (A) and the new (B) text.
	 */
	public EditList toEditList() {
		EditList edits = new EditList();
		int a = 0;
		int b = 0;
		int deleted = 0;
		int inserted = 0;
		for (Diff d : diffs) {
			switch (d.getOperation()) {
			case DELETE:
				deleted += d.size();
				break;
			case INSERT:
				inserted += d.size();
				break;
			case EQUAL:
				if (deleted > 0 || inserted > 0) {
					edits.add(new Edit(a, a + deleted, b, b + inserted));
					a += deleted;
					b += inserted;
					deleted = 0;
					inserted = 0;
				}
				a += d.size();
				b += d.size();
				break;
			}
		}
		if (deleted > 0 || inserted > 0)
			edits.add(new Edit(a, a + deleted, b, b + inserted));
		return edits;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o)
			return true;
		if (!(o instanceof Patch))
			return false;
		return diffs.equals(((Patch) o).diffs);
	}

	@Override
	public int hashCode() {
		return diffs.hashCode();
	}

	@Override
	public String toString() {
		return diffs.toString();
	}
}
