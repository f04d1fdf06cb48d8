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

import java.io.Reader;

import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Parses formatter options from a JSON object such as
 * {@code {"maxLineLength": 100, "logLevel": "debug"}}.
 *
 * <p>Missing keys keep their defaults; values that are not numbers or are out
 * of range are logged and skipped. The {@code logLevel} option changes the
 * Logback root level as a side effect.</p>
 */
public final class FormatterOptionsParser {

	private static final Logger logger = LoggerFactory.getLogger(FormatterOptionsParser.class);

	private static final String MAX_LINE_LENGTH_OPTION = "maxLineLength";
	private static final String MIN_LINE_ITEMS_OPTION = "minLineItems";
	private static final String TAB_SIZE_OPTION = "tabSize";
	private static final String SPACE_INDENT_OPTION = "spaceIndent";
	private static final String LOG_LEVEL_OPTION = "logLevel";

	private FormatterOptionsParser() {
		// utility class
	}

	public static FormatterOptions parse(Reader reader) {
		JsonElement element = JsonParser.parseReader(reader);
		if (!element.isJsonObject()) {
			logger.warn("Formatter options must be a JSON object, using defaults");
			return FormatterOptions.defaults();
		}
		return parse(element.getAsJsonObject());
	}

	public static FormatterOptions parse(JsonObject opts) {
		if (opts == null) {
			return FormatterOptions.defaults();
		}
		applyLogLevelOption(opts);

		int maxLineLength = parseIntOption(opts, MAX_LINE_LENGTH_OPTION,
				FormatterOptions.DEFAULT_MAX_LINE_LENGTH, 1);
		int minLineItems = parseIntOption(opts, MIN_LINE_ITEMS_OPTION,
				FormatterOptions.DEFAULT_MIN_LINE_ITEMS, 0);
		int tabSize = parseIntOption(opts, TAB_SIZE_OPTION, FormatterOptions.DEFAULT_TAB_SIZE, 0);
		int spaceIndent = parseIntOption(opts, SPACE_INDENT_OPTION, FormatterOptions.DEFAULT_SPACE_INDENT, 0);

		FormatterOptions options = new FormatterOptions(maxLineLength, minLineItems, tabSize, spaceIndent);
		logger.debug("Parsed {}", options);
		return options;
	}

	private static int parseIntOption(JsonObject opts, String name, int defaultValue, int minimum) {
		if (!opts.has(name)) {
			return defaultValue;
		}
		JsonElement value = opts.get(name);
		if (!value.isJsonPrimitive() || !value.getAsJsonPrimitive().isNumber()) {
			logger.warn("Ignoring non-numeric option {}={}", name, value);
			return defaultValue;
		}
		int parsed = value.getAsInt();
		if (parsed < minimum) {
			logger.warn("Ignoring option {}={}, must be at least {}", name, parsed, minimum);
			return defaultValue;
		}
		return parsed;
	}

	private static void applyLogLevelOption(JsonObject opts) {
		if (opts.has(LOG_LEVEL_OPTION) && opts.get(LOG_LEVEL_OPTION).isJsonPrimitive()) {
			applyLogLevel(opts.get(LOG_LEVEL_OPTION).getAsString());
		}
	}

	/**
	 * Dynamically set the Logback root logger level from a string value.
	 * Accepted values (case-insensitive): ERROR, WARN, INFO, DEBUG, TRACE.
	 * Invalid values are ignored and a warning is logged.
	 */
	static void applyLogLevel(String levelName) {
		ch.qos.logback.classic.Level level = ch.qos.logback.classic.Level.toLevel(levelName, null);
		if (level == null) {
			logger.warn("Unknown log level '{}', keeping current level", levelName);
			return;
		}
		org.slf4j.Logger root = LoggerFactory.getLogger(org.slf4j.Logger.ROOT_LOGGER_NAME);
		if (!(root instanceof ch.qos.logback.classic.Logger)) {
			logger.warn("Root logger is not backed by Logback, cannot set level to '{}'", levelName);
			return;
		}
		ch.qos.logback.classic.Logger logbackRoot = (ch.qos.logback.classic.Logger) root;
		ch.qos.logback.classic.Level previous = logbackRoot.getLevel();
		logbackRoot.setLevel(level);
		logger.info("Log level changed from {} to {}", previous, level);
	}
}
