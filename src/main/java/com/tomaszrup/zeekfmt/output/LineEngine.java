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

import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

import com.tomaszrup.zeekfmt.FormatterException;
import com.tomaszrup.zeekfmt.config.FormatterOptions;

/**
 * An indenting, column-aware, line-buffered, line-wrapping output stage.
 *
 * <p>Writes are buffered as {@link Chunk}s until a line terminator arrives,
 * at which point the whole logical line goes through the {@link LineWrapper}
 * and the resulting bytes are written to the sink. The column counter always
 * reflects the display columns written since the last line terminator, with
 * tabs charged at the configured tab size.</p>
 *
 * <p>Not thread-safe; one engine serves exactly one formatting pass.</p>
 */
public final class LineEngine {
	private static final String NL = "\n";

	private final OutputStream sink;
	private final FormatterOptions options;
	private final LineWrapper wrapper;
	private final List<Chunk> lineBuffer = new ArrayList<>();

	private int column;
	private int tabIndent;
	private int linesWritten;

	private boolean spaceAlign;
	private boolean tabIndentEnabled = true;
	private boolean linebreaksEnabled = true;

	public LineEngine(OutputStream sink, FormatterOptions options) {
		this.sink = sink;
		this.options = options;
		this.wrapper = new LineWrapper(options);
	}

	/**
	 * Buffers the given data, flushing a line whenever a terminator is
	 * written. Whitespace preceding a terminator within the same write is
	 * dropped.
	 */
	public void write(String data, HintSet hints) {
		int start = 0;
		while (start < data.length()) {
			int newline = data.indexOf('\n', start);
			int end = newline < 0 ? data.length() : newline + 1;
			String chunk = data.substring(start, end);
			if (chunk.endsWith(NL)) {
				chunk = chunk.stripTrailing() + NL;
			}

			lineBuffer.add(new Chunk(chunk, hints));
			column += Chunk.width(chunk, options.getTabSize());

			if (chunk.endsWith(NL)) {
				flushLine();
			}
			start = end;
		}
	}

	/**
	 * Writes the tab indentation for a line and remembers it as the base
	 * indentation for continuation lines.
	 */
	public void writeTabIndent(int indent, HintSet hints) {
		if (!tabIndentEnabled) {
			return;
		}
		tabIndent = indent;
		write("\t".repeat(Math.max(0, indent)), hints);
	}

	/**
	 * Writes the alignment space run if space alignment is currently active.
	 */
	public void writeSpaceAlign(HintSet hints) {
		if (spaceAlign) {
			write(" ".repeat(options.getSpaceIndent()), hints);
		}
	}

	/** Activates space alignment for the next indentation written. */
	public void useSpaceAlign(boolean enable) {
		spaceAlign = enable;
	}

	public void useTabIndent(boolean enable) {
		tabIndentEnabled = enable;
	}

	public void useLinebreaks(boolean enable) {
		linebreaksEnabled = enable;
	}

	/** Whether the buffered part of the current line ends in whitespace. */
	public boolean endsWithWhitespace() {
		for (int i = lineBuffer.size() - 1; i >= 0; i--) {
			String text = lineBuffer.get(i).getText();
			if (!text.isEmpty()) {
				return Character.isWhitespace(text.charAt(text.length() - 1));
			}
		}
		return false;
	}

	public int getColumn() {
		return column;
	}

	public int getLinesWritten() {
		return linesWritten;
	}

	public FormatterOptions getOptions() {
		return options;
	}

	/**
	 * Flushes any unterminated line left in the buffer and flushes the sink.
	 */
	public void finish() {
		if (!lineBuffer.isEmpty()) {
			flushLine();
		}
		try {
			sink.flush();
		} catch (IOException e) {
			throw new FormatterException("Failed to flush formatted output", e);
		}
	}

	private void flushLine() {
		String text = wrapper.layout(lineBuffer, tabIndent, linebreaksEnabled);
		lineBuffer.clear();
		column = 0;
		if (text.isEmpty()) {
			return;
		}
		try {
			sink.write(text.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new FormatterException("Failed to write formatted output", e);
		}
		for (int i = 0; i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				linesWritten++;
			}
		}
	}
}
