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
package com.tomaszrup.zeekfmt.output;

import java.util.ArrayList;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.zeekfmt.config.FormatterOptions;

/**
 * Turns one logical line, given as a sequence of hinted chunks, into one or
 * more physical lines.
 *
 * <p>This is a pure function of its inputs: the chunks are walked once, and
 * wrap decisions are taken at every non-whitespace chunk:</p>
 * <ul>
 *   <li>Whitespace chunks are held back in the pending group, so that a
 *       later break can drop them instead of leaving trailing whitespace.</li>
 *   <li>No decision is taken where a {@link Hint#NO_LINEBREAK_AFTER} or
 *       {@link Hint#NO_LINEBREAK_BEFORE} hint protects the join point.</li>
 *   <li>A chunk hinted {@link Hint#GOOD_AFTER_LINEBREAK} on an overlong line
 *       gets a break before it, and from then on only such hints break the
 *       rest of the line.</li>
 *   <li>Otherwise, the line breaks before the pending group when the group
 *       would cross the width budget and the line has enough items.</li>
 * </ul>
 *
 * <p>Continuation lines are indented with the line's tab indentation plus a
 * fixed run of alignment spaces. Trailing whitespace is stripped from every
 * physical line.</p>
 */
public final class LineWrapper {
	private static final Logger logger = LoggerFactory.getLogger(LineWrapper.class);

	private final FormatterOptions options;

	public LineWrapper(FormatterOptions options) {
		this.options = options;
	}

	/**
	 * Lays out one logical line.
	 *
	 * @param line      the buffered chunks, in source order
	 * @param tabIndent number of tabs the line is indented by
	 * @param wrap      whether automatic and hinted wrapping may happen at all
	 * @return the physical line(s), including the final terminator if the
	 *         last chunk carried one
	 */
	public String layout(List<Chunk> line, int tabIndent, boolean wrap) {
		LineBuilder out = new LineBuilder();
		if (!wrap) {
			for (Chunk chunk : line) {
				out.append(chunk.getText());
			}
			return out.finish();
		}

		int maxLineLength = options.getMaxLineLength();
		int lineWidth = 0;
		int lineItems = 0;
		for (Chunk chunk : line) {
			if (!chunk.has(Hint.ZERO_WIDTH)) {
				lineWidth += chunk.width(options.getTabSize());
			}
			if (!chunk.isBlank()) {
				lineItems++;
			}
		}

		List<Chunk> pending = new ArrayList<>();
		int pendingWidth = 0;
		int flushedColumn = 0;
		boolean usingBreakHints = false;

		for (int i = 0; i < line.size(); i++) {
			Chunk chunk = line.get(i);
			Chunk next = i + 1 < line.size() ? line.get(i + 1) : null;

			pending.add(chunk);
			pendingWidth += widthOf(chunk);

			if (chunk.isBlank()) {
				continue;
			}
			if (chunk.has(Hint.NO_LINEBREAK_AFTER)) {
				continue;
			}
			if (next != null && next.has(Hint.NO_LINEBREAK_BEFORE)) {
				continue;
			}
			if (chunk.has(Hint.NO_LINEBREAK_BEFORE) && allBlank(pending, pending.size() - 1)) {
				// The break would land right before this chunk.
				continue;
			}

			boolean doBreak = false;
			if (chunk.has(Hint.GOOD_AFTER_LINEBREAK) && lineWidth > maxLineLength) {
				doBreak = true;
				usingBreakHints = true;
			} else if (!usingBreakHints
					&& flushedColumn + pendingWidth > maxLineLength
					&& lineItems >= options.getMinLineItems()) {
				doBreak = true;
			}

			if (doBreak) {
				logger.trace("Breaking line before {} at column {}", chunk, flushedColumn);
				out.append("\n");
				out.append(continuationIndent(tabIndent));
				flushedColumn = tabIndent * options.getTabSize() + options.getSpaceIndent();
				while (!pending.isEmpty() && pending.get(0).isBlank()) {
					pendingWidth -= widthOf(pending.remove(0));
				}
			}

			for (Chunk pendingChunk : pending) {
				out.append(pendingChunk.getText());
				flushedColumn += widthOf(pendingChunk);
			}
			pending.clear();
			pendingWidth = 0;
		}

		for (Chunk pendingChunk : pending) {
			out.append(pendingChunk.getText());
		}
		return out.finish();
	}

	private int widthOf(Chunk chunk) {
		return chunk.has(Hint.ZERO_WIDTH) ? 0 : chunk.width(options.getTabSize());
	}

	private String continuationIndent(int tabIndent) {
		return "\t".repeat(Math.max(0, tabIndent)) + " ".repeat(options.getSpaceIndent());
	}

	private static boolean allBlank(List<Chunk> chunks, int count) {
		for (int i = 0; i < count; i++) {
			if (!chunks.get(i).isBlank()) {
				return false;
			}
		}
		return true;
	}

	/**
	 * Accumulates physical lines and strips trailing whitespace before every
	 * line terminator and at the very end.
	 */
	private static final class LineBuilder {
		private final StringBuilder sb = new StringBuilder();

		void append(String text) {
			int start = 0;
			int newline = text.indexOf('\n');
			while (newline >= 0) {
				sb.append(text, start, newline);
				stripTrailingWhitespace();
				sb.append('\n');
				start = newline + 1;
				newline = text.indexOf('\n', start);
			}
			sb.append(text, start, text.length());
		}

		String finish() {
			stripTrailingWhitespace();
			return sb.toString();
		}

		private void stripTrailingWhitespace() {
			int end = sb.length();
			while (end > 0 && (sb.charAt(end - 1) == ' ' || sb.charAt(end - 1) == '\t')) {
				end--;
			}
			sb.setLength(end);
		}
	}
}
