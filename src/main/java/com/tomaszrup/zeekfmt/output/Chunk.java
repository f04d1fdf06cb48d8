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

import java.util.Objects;

/**
 * An immutable piece of one logical output line together with the hints of
 * the layout rule that wrote it.
 */
public final class Chunk {
	private final String text;
	private final HintSet hints;

	public Chunk(String text, HintSet hints) {
		this.text = Objects.requireNonNull(text, "text");
		this.hints = hints != null ? hints : HintSet.NONE;
	}

	public String getText() {
		return text;
	}

	public HintSet getHints() {
		return hints;
	}

	public boolean has(Hint hint) {
		return hints.contains(hint);
	}

	/** Whether this chunk consists of whitespace only (including the empty chunk). */
	public boolean isBlank() {
		return text.isBlank();
	}

	/**
	 * Display width of the text, counting each tab as {@code tabSize}
	 * columns and line terminators as nothing.
	 */
	public int width(int tabSize) {
		return width(text, tabSize);
	}

	static int width(String text, int tabSize) {
		int width = 0;
		for (int i = 0; i < text.length(); i++) {
			char c = text.charAt(i);
			if (c == '\t') {
				width += tabSize;
			} else if (c != '\n' && c != '\r' && !Character.isLowSurrogate(c)) {
				width++;
			}
		}
		return width;
	}

	@Override
	public String toString() {
		return "Chunk[" + text.replace("\n", "\\n").replace("\t", "\\t") + ", " + hints + "]";
	}
}
