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
package com.tomaszrup.zeekfmt.config;

/**
 * Immutable layout settings for one formatting run.
 */
public final class FormatterOptions {
	public static final int DEFAULT_MAX_LINE_LENGTH = 80;
	public static final int DEFAULT_MIN_LINE_ITEMS = 5;
	public static final int DEFAULT_TAB_SIZE = 8;
	public static final int DEFAULT_SPACE_INDENT = 4;

	private static final FormatterOptions DEFAULTS = new FormatterOptions(DEFAULT_MAX_LINE_LENGTH,
			DEFAULT_MIN_LINE_ITEMS, DEFAULT_TAB_SIZE, DEFAULT_SPACE_INDENT);

	private final int maxLineLength;
	private final int minLineItems;
	private final int tabSize;
	private final int spaceIndent;

	/**
	 * @param maxLineLength column beyond which the engine considers wrapping
	 * @param minLineItems  non-whitespace items a line needs before automatic wrapping applies
	 * @param tabSize       visible width charged for a tab
	 * @param spaceIndent   spaces added after the tab indentation of continuation lines
	 */
	public FormatterOptions(int maxLineLength, int minLineItems, int tabSize, int spaceIndent) {
		if (maxLineLength <= 0) {
			throw new IllegalArgumentException("maxLineLength must be positive: " + maxLineLength);
		}
		if (minLineItems < 0 || tabSize < 0 || spaceIndent < 0) {
			throw new IllegalArgumentException("minLineItems, tabSize and spaceIndent must not be negative");
		}
		this.maxLineLength = maxLineLength;
		this.minLineItems = minLineItems;
		this.tabSize = tabSize;
		this.spaceIndent = spaceIndent;
	}

	public static FormatterOptions defaults() {
		return DEFAULTS;
	}

	public int getMaxLineLength() {
		return maxLineLength;
	}

	public int getMinLineItems() {
		return minLineItems;
	}

	public int getTabSize() {
		return tabSize;
	}

	public int getSpaceIndent() {
		return spaceIndent;
	}

	public FormatterOptions withMaxLineLength(int value) {
		return new FormatterOptions(value, minLineItems, tabSize, spaceIndent);
	}

	@Override
	public String toString() {
		return "FormatterOptions{maxLineLength=" + maxLineLength + ", minLineItems=" + minLineItems
				+ ", tabSize=" + tabSize + ", spaceIndent=" + spaceIndent + "}";
	}
}
