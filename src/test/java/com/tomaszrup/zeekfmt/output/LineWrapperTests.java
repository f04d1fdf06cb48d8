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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.zeekfmt.config.FormatterOptions;

class LineWrapperTests {
	private static final HintSet GOOD = HintSet.of(Hint.GOOD_AFTER_LINEBREAK);
	private static final HintSet NO_BEFORE = HintSet.of(Hint.NO_LINEBREAK_BEFORE);
	private static final HintSet NO_AFTER = HintSet.of(Hint.NO_LINEBREAK_AFTER);
	private static final HintSet ZERO_WIDTH = HintSet.of(Hint.ZERO_WIDTH);

	private LineWrapper wrapper;
	private List<Chunk> line;

	@BeforeEach
	void setup() {
		wrapper = new LineWrapper(new FormatterOptions(20, 3, 8, 4));
		line = new ArrayList<>();
	}

	private void add(String text) {
		add(text, HintSet.NONE);
	}

	private void add(String text, HintSet hints) {
		line.add(new Chunk(text, hints));
	}

	private void addWords(String... words) {
		for (int i = 0; i < words.length; i++) {
			if (i > 0) {
				add(" ");
			}
			add(words[i]);
		}
	}

	// --- Short lines ---

	@Test
	void testShortLineIsUnchanged() {
		addWords("a", "=", "b;");
		add("\n");
		Assertions.assertEquals("a = b;\n", wrapper.layout(line, 0, true));
	}

	@Test
	void testEmptyLine() {
		Assertions.assertEquals("", wrapper.layout(line, 0, true));
	}

	// --- Automatic breaks ---

	@Test
	void testBreaksBeforeItemCrossingTheBudget() {
		addWords("aaaaaaaa", "bbbbbbbb", "cccccccc");
		add("\n");
		Assertions.assertEquals("aaaaaaaa bbbbbbbb\n    cccccccc\n", wrapper.layout(line, 0, true));
	}

	@Test
	void testContinuationKeepsTabIndent() {
		add("\t");
		addWords("aaaaaa", "bbbbbb", "cccccc");
		add("\n");
		Assertions.assertEquals("\taaaaaa\n\t    bbbbbb\n\t    cccccc\n", wrapper.layout(line, 1, true));
	}

	@Test
	void testTooFewItemsNeverBreak() {
		addWords("aaaaaaaaaaaaaaa", "bbbbbbbbbbbbbbb");
		add("\n");
		Assertions.assertEquals("aaaaaaaaaaaaaaa bbbbbbbbbbbbbbb\n", wrapper.layout(line, 0, true));
	}

	@Test
	void testWrappingDisabled() {
		addWords("aaaaaaaa", "bbbbbbbb", "cccccccc");
		add("\n");
		Assertions.assertEquals("aaaaaaaa bbbbbbbb cccccccc\n", wrapper.layout(line, 0, false));
	}

	// --- Hints ---

	@Test
	void testNoBreakBeforeKeepsTokenWithPredecessor() {
		addWords("aa", "bbbbbbbb", "cccccccc");
		add(";", NO_BEFORE);
		add("\n");
		Assertions.assertEquals("aa bbbbbbbb\n    cccccccc;\n", wrapper.layout(line, 0, true));
	}

	@Test
	void testNoBreakAfterIsRespected() {
		add("aaaaaaaa");
		add(" ");
		add("bbbbbbbbbbbb", NO_AFTER);
		add(" ");
		add("cc");
		add(" ");
		add("dd");
		add("\n");
		Assertions.assertEquals("aaaaaaaa\n    bbbbbbbbbbbb cc\n    dd\n", wrapper.layout(line, 0, true));
	}

	@Test
	void testGoodBreaksLockOutAutomaticBreaks() {
		addWords("aaaa", "bbbb", "cccc");
		add(" ");
		add("&&", GOOD);
		add(" ");
		addWords("dddd", "eeee", "ffff", "gggg", "hhhh");
		add("\n");
		Assertions.assertEquals("aaaa bbbb cccc\n    && dddd eeee ffff gggg hhhh\n",
				wrapper.layout(line, 0, true));
	}

	@Test
	void testGoodHintIgnoredWhenLineFits() {
		addWords("a", "b");
		add(" ");
		add("&&", GOOD);
		add(" ");
		add("c");
		add("\n");
		Assertions.assertEquals("a b && c\n", wrapper.layout(line, 0, true));
	}

	@Test
	void testZeroWidthChunksDoNotCountTowardWidth() {
		addWords("aaaa", "=", "bbbb;");
		add(" ", ZERO_WIDTH);
		add("# a rather long trailing comment", ZERO_WIDTH);
		add("\n", ZERO_WIDTH);
		Assertions.assertEquals("aaaa = bbbb; # a rather long trailing comment\n", wrapper.layout(line, 0, true));
	}

	// --- Whitespace ---

	@Test
	void testNoTrailingWhitespaceAtBreaks() {
		addWords("aaaaaaaa", "bbbbbbbb");
		add("   ");
		add("cccccccc");
		add("\n");
		String result = wrapper.layout(line, 0, true);
		Assertions.assertEquals("aaaaaaaa bbbbbbbb\n    cccccccc\n", result);
	}

	@Test
	void testTrailingWhitespaceStrippedAtEnd() {
		add("a");
		add(" ");
		add("\t");
		Assertions.assertEquals("a", wrapper.layout(line, 0, true));
	}
}
