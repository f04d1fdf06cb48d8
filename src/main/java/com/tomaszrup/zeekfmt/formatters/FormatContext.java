////////////////////////////////////////////////////////////////////////////////
// Copyright 2026 Tomasz Rup
//
// Licensed under the Apache License, Version 2.0 (the "License");
// you may not use this file except in compliance with the License.
// You may obtain a copy of the License at
//
// http://www.apache.org/licenses/LICENSE-2.0
//
// Unless required by applicable law or agreed to in writing, software
// distributed under the License is distributed on an "AS IS" BASIS,
// WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
// See the License for the specific language governing permissions and
// limitations under the License
//
// Author: Tomasz Rup
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.zeekfmt.formatters;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.zeekfmt.output.HintSet;
import com.tomaszrup.zeekfmt.output.LineEngine;
import com.tomaszrup.zeekfmt.tree.SyntaxNode;

/**
 * Per-visit state of a layout rule: the node being laid out, its indentation
 * level, the hints it inherited, and a cursor over its grammar children.
 *
 * <p>Rules consume children strictly in order through the
 * {@code formatChild*} family, and look ahead with the {@code peek*}
 * methods, which never move the cursor. Each consumed child's attached
 * extras (comments and blank-line markers) are visited around it at the
 * child's indentation.</p>
 */
public final class FormatContext {
	private static final Logger logger = LoggerFactory.getLogger(FormatContext.class);
	private static final String NL = "\n";

	private final FormattingSession session;
	private final SyntaxNode node;
	private final int indent;
	private final HintSet hints;
	private int cursor;

	FormatContext(FormattingSession session, SyntaxNode node, int indent, HintSet hints) {
		this.session = session;
		this.node = node;
		this.indent = indent;
		this.hints = hints;
	}

	public SyntaxNode node() {
		return node;
	}

	public int indent() {
		return indent;
	}

	public HintSet hints() {
		return hints;
	}

	public FormattingSession session() {
		return session;
	}

	public LineEngine engine() {
		return session.getEngine();
	}

	// --- Consuming children ---

	public void formatChild() {
		formatChild(false, HintSet.NONE);
	}

	public void formatChild(boolean indented) {
		formatChild(indented, HintSet.NONE);
	}

	public void formatChild(HintSet childHints) {
		formatChild(false, childHints);
	}

	/**
	 * Visits the next grammar child, optionally one level deeper, together
	 * with the extras attached to it. Does nothing if all children have
	 * been consumed.
	 */
	public void formatChild(boolean indented, HintSet childHints) {
		SyntaxNode child = node.child(cursor);
		if (child == null) {
			logger.debug("No child left at position {} of {}", cursor, node);
			return;
		}
		cursor++;

		int childIndent = indent + (indented ? 1 : 0);
		for (SyntaxNode extra : child.prevExtras()) {
			session.visit(extra, childIndent, HintSet.NONE);
		}
		session.visit(child, childIndent, childHints);
		for (SyntaxNode extra : child.nextExtras()) {
			session.visit(extra, childIndent, HintSet.NONE);
		}
	}

	public void formatChildRange(int count) {
		formatChildRange(count, HintSet.NONE, HintSet.NONE);
	}

	/**
	 * Visits the next {@code count} children such that no line break can
	 * fall between any two of them. {@code rangeHints} go to every child,
	 * {@code firstHints} to the first one only.
	 */
	public void formatChildRange(int count, HintSet rangeHints, HintSet firstHints) {
		if (count <= 0) {
			return;
		}
		if (count == 1) {
			formatChild(rangeHints.union(firstHints));
			return;
		}
		formatChild(rangeHints.union(firstHints).union(Formatter.NO_BREAK_AFTER));
		for (int i = 0; i < count - 2; i++) {
			formatChild(rangeHints.union(Formatter.NO_BREAK_AFTER));
		}
		formatChild(rangeHints);
	}

	/**
	 * Visits all remaining children, writing the separator between any two
	 * unless the previous child ended its line. The first child inherits this
	 * visit's hints.
	 */
	public void formatChildren(String separator) {
		if (hasNextChild()) {
			formatChild(hints);
		}
		while (hasNextChild()) {
			if (separator != null && engine().getColumn() != 0) {
				write(separator);
			}
			formatChild();
		}
	}

	/**
	 * Visits the concrete children of a node that has no grammar children,
	 * which can only be extras.
	 */
	public void formatExtrasOnly() {
		for (SyntaxNode extra : node.cstChildren()) {
			session.visit(extra, indent, HintSet.NONE);
		}
	}

	/** Writes the node's source text verbatim. */
	public void formatToken() {
		write(node.text());
	}

	// --- Writing ---

	/**
	 * Writes data, first indenting if the output sits at the start of a
	 * line and the data isn't a line terminator itself.
	 */
	public void write(String data) {
		String text = data;
		if (!text.startsWith(NL) && writeIndent()) {
			text = text.stripLeading();
		}
		engine().write(text, hints);
	}

	/**
	 * Writes this visit's indentation if the output sits at the start of a
	 * line.
	 *
	 * @return whether indentation was written
	 */
	public boolean writeIndent() {
		LineEngine engine = engine();
		if (engine.getColumn() != 0) {
			return false;
		}
		engine.writeTabIndent(indent, hints);
		engine.writeSpaceAlign(hints);
		return true;
	}

	public void writeSpace() {
		write(" ");
	}

	/**
	 * Writes spaces as they are, even at the start of a line where
	 * {@link #write(String)} would drop them.
	 */
	public void writePadding(int count) {
		if (count > 0) {
			engine().write(" ".repeat(count), hints);
		}
	}

	public void writeNewline() {
		writeNewline(false, false);
	}

	/**
	 * Ends the current line. A line that is already empty is left alone
	 * unless {@code force} is set. {@code midline} asks for the next line to
	 * be aligned as a continuation of this one.
	 */
	public void writeNewline(boolean force, boolean midline) {
		LineEngine engine = engine();
		if (engine.getColumn() == 0 && !force) {
			engine.useSpaceAlign(midline);
			return;
		}
		write(NL);
		engine.useSpaceAlign(midline);
	}

	/** Writes a space if {@code space} holds, otherwise ends the line. */
	public void writeSpaceOrNewline(boolean space) {
		if (space) {
			writeSpace();
		} else {
			writeNewline();
		}
	}

	// --- Looking ahead ---

	public int childrenRemaining() {
		return Math.max(0, node.childCount() - cursor);
	}

	public boolean hasNextChild() {
		return cursor < node.childCount();
	}

	/**
	 * Returns the child {@code offset} positions after the cursor, or
	 * {@code null}.
	 */
	public SyntaxNode peekChild(int offset) {
		int position = cursor + offset;
		return position < 0 ? null : node.child(position);
	}

	public SyntaxNode peekChild() {
		return peekChild(0);
	}

	/** Name of the child at the given offset, if it's a named node. */
	public String peekName(int offset) {
		SyntaxNode child = peekChild(offset);
		return child != null ? child.name() : null;
	}

	public String peekName() {
		return peekName(0);
	}

	/** Text of the child at the given offset, if it's an anonymous token. */
	public String peekToken(int offset) {
		SyntaxNode child = peekChild(offset);
		return child != null ? child.token() : null;
	}

	public String peekToken() {
		return peekToken(0);
	}

	/** Whether the child at the cursor has the given name. */
	public boolean nextIs(String name) {
		return name.equals(peekName(0));
	}

	/** Whether the child at the cursor is the given token. */
	public boolean nextIsToken(String token) {
		return token.equals(peekToken(0));
	}
}
