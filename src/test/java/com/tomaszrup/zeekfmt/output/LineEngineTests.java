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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.zeekfmt.FormatterException;
import com.tomaszrup.zeekfmt.config.FormatterOptions;

class LineEngineTests {
	private ByteArrayOutputStream sink;
	private LineEngine engine;

	@BeforeEach
	void setup() {
		sink = new ByteArrayOutputStream();
		engine = new LineEngine(sink, FormatterOptions.defaults());
	}

	private String output() {
		return new String(sink.toByteArray(), StandardCharsets.UTF_8);
	}

	// --- Columns ---

	@Test
	void testColumnTracksWrites() {
		engine.write("global", HintSet.NONE);
		engine.write(" x", HintSet.NONE);
		Assertions.assertEquals(8, engine.getColumn());
		Assertions.assertEquals("", output(), "Nothing is written before the line ends");
	}

	@Test
	void testTabsCountAsTabSize() {
		engine.writeTabIndent(2, HintSet.NONE);
		Assertions.assertEquals(16, engine.getColumn());
	}

	@Test
	void testNewlineResetsColumnAndFlushes() {
		engine.write("a;\n", HintSet.NONE);
		Assertions.assertEquals(0, engine.getColumn());
		Assertions.assertEquals("a;\n", output());
		Assertions.assertEquals(1, engine.getLinesWritten());
	}

	@Test
	void testMultipleLinesInOneWrite() {
		engine.write("a;  \nb;\n", HintSet.NONE);
		Assertions.assertEquals("a;\nb;\n", output());
		Assertions.assertEquals(2, engine.getLinesWritten());
	}

	@Test
	void testEndsWithWhitespaceLooksAtLastNonEmptyWrite() {
		Assertions.assertFalse(engine.endsWithWhitespace(), "Empty line");
		engine.write("a,", HintSet.NONE);
		Assertions.assertFalse(engine.endsWithWhitespace());
		engine.write(" ", HintSet.NONE);
		engine.write("", HintSet.NONE);
		Assertions.assertTrue(engine.endsWithWhitespace());
		engine.write("# c\n", HintSet.NONE);
		Assertions.assertFalse(engine.endsWithWhitespace(), "A flushed line leaves nothing behind");
	}

	// --- Indentation ---

	@Test
	void testSpaceAlignOnlyWhenActive() {
		engine.writeSpaceAlign(HintSet.NONE);
		Assertions.assertEquals(0, engine.getColumn());
		engine.useSpaceAlign(true);
		engine.writeSpaceAlign(HintSet.NONE);
		Assertions.assertEquals(4, engine.getColumn());
	}

	@Test
	void testTabIndentCanBeDisabled() {
		engine.useTabIndent(false);
		engine.writeTabIndent(3, HintSet.NONE);
		engine.write("@if ( x )\n", HintSet.NONE);
		Assertions.assertEquals("@if ( x )\n", output());
	}

	@Test
	void testLinebreaksCanBeDisabled() {
		engine = new LineEngine(sink, new FormatterOptions(10, 1, 8, 4));
		engine.useLinebreaks(false);
		engine.write("@load", HintSet.NONE);
		engine.write(" ", HintSet.NONE);
		engine.write("some/long/package/path", HintSet.NONE);
		engine.write("\n", HintSet.NONE);
		Assertions.assertEquals("@load some/long/package/path\n", output());
	}

	@Test
	void testContinuationUsesCurrentTabIndent() {
		engine = new LineEngine(sink, new FormatterOptions(20, 1, 8, 4));
		engine.writeTabIndent(1, HintSet.NONE);
		engine.write("aaaaaa", HintSet.NONE);
		engine.write(" ", HintSet.NONE);
		engine.write("bbbbbb", HintSet.NONE);
		engine.write("\n", HintSet.NONE);
		Assertions.assertEquals("\taaaaaa\n\t    bbbbbb\n", output());
	}

	// --- Finishing ---

	@Test
	void testFinishFlushesUnterminatedLine() {
		engine.write("x", HintSet.NONE);
		engine.finish();
		Assertions.assertEquals("x", output());
	}

	@Test
	void testSinkFailureRaisesFormatterException() {
		OutputStream failing = new OutputStream() {
			@Override
			public void write(int b) throws IOException {
				throw new IOException("disk full");
			}
		};
		LineEngine failingEngine = new LineEngine(failing, FormatterOptions.defaults());
		FormatterException e = Assertions.assertThrows(FormatterException.class,
				() -> failingEngine.write("x;\n", HintSet.NONE));
		Assertions.assertEquals("disk full", e.getCause().getMessage());
	}
}
