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

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.slf4j.LoggerFactory;

import ch.qos.logback.classic.Level;
import ch.qos.logback.classic.Logger;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

class FormatterOptionsParserTests {
	private final Logger root = (Logger) LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
	private final Level originalLevel = root.getLevel();

	@AfterEach
	void restoreLogLevel() {
		root.setLevel(originalLevel);
	}

	private static JsonObject json(String text) {
		return JsonParser.parseString(text).getAsJsonObject();
	}

	// --- Defaults ---

	@Test
	void testEmptyObjectGivesDefaults() {
		FormatterOptions options = FormatterOptionsParser.parse(new JsonObject());
		Assertions.assertEquals(80, options.getMaxLineLength());
		Assertions.assertEquals(5, options.getMinLineItems());
		Assertions.assertEquals(8, options.getTabSize());
		Assertions.assertEquals(4, options.getSpaceIndent());
	}

	@Test
	void testNullGivesDefaults() {
		Assertions.assertSame(FormatterOptions.defaults(), FormatterOptionsParser.parse((JsonObject) null));
	}

	// --- Values ---

	@Test
	void testReadsAllOptionsFromClasspath() throws Exception {
		try (InputStream in = getClass().getResourceAsStream("/config/options.json");
				Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
			FormatterOptions options = FormatterOptionsParser.parse(reader);
			Assertions.assertEquals(100, options.getMaxLineLength());
			Assertions.assertEquals(3, options.getMinLineItems());
			Assertions.assertEquals(4, options.getTabSize());
			Assertions.assertEquals(2, options.getSpaceIndent());
		}
	}

	@Test
	void testInvalidValuesAreSkipped() {
		FormatterOptions options = FormatterOptionsParser.parse(
				json("{\"maxLineLength\": 0, \"tabSize\": \"wide\", \"spaceIndent\": -2, \"unknown\": 1}"));
		Assertions.assertEquals(FormatterOptions.DEFAULT_MAX_LINE_LENGTH, options.getMaxLineLength());
		Assertions.assertEquals(FormatterOptions.DEFAULT_TAB_SIZE, options.getTabSize());
		Assertions.assertEquals(FormatterOptions.DEFAULT_SPACE_INDENT, options.getSpaceIndent());
	}

	@Test
	void testNonObjectDocumentGivesDefaults() {
		Assertions.assertSame(FormatterOptions.defaults(), FormatterOptionsParser.parse(new StringReader("42")));
	}

	@Test
	void testConstructorRejectsNonPositiveWidth() {
		Assertions.assertThrows(IllegalArgumentException.class, () -> new FormatterOptions(0, 5, 8, 4));
		Assertions.assertThrows(IllegalArgumentException.class, () -> new FormatterOptions(80, -1, 8, 4));
	}

	// --- Log level ---

	@Test
	void testLogLevelOptionChangesRootLevel() {
		FormatterOptionsParser.parse(json("{\"logLevel\": \"debug\"}"));
		Assertions.assertEquals(Level.DEBUG, root.getLevel());
	}

	@Test
	void testUnknownLogLevelIsIgnored() {
		root.setLevel(Level.WARN);
		FormatterOptionsParser.applyLogLevel("chatty");
		Assertions.assertEquals(Level.WARN, root.getLevel());
	}
}
