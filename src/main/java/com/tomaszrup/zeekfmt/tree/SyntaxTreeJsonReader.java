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
package com.tomaszrup.zeekfmt.tree;

import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Reads a syntax tree dumped by an external parser as JSON.
 *
 * <p>The expected shape mirrors tree-sitter's node API:</p>
 * <pre>{@code
 * {
 *   "source": "module Foo;\n",
 *   "tree": {
 *     "type": "source_file", "named": true, "extra": false,
 *     "startByte": 0, "endByte": 12,
 *     "children": [ ... ]
 *   }
 * }
 * }</pre>
 *
 * <p>{@code named} defaults to {@code true}, {@code extra} to {@code false}
 * and {@code children} to an empty list.</p>
 */
public final class SyntaxTreeJsonReader {
	private static final Logger logger = LoggerFactory.getLogger(SyntaxTreeJsonReader.class);

	private static final String SOURCE_FIELD = "source";
	private static final String TREE_FIELD = "tree";
	private static final String TYPE_FIELD = "type";
	private static final String NAMED_FIELD = "named";
	private static final String EXTRA_FIELD = "extra";
	private static final String START_FIELD = "startByte";
	private static final String END_FIELD = "endByte";
	private static final String CHILDREN_FIELD = "children";

	private SyntaxTreeJsonReader() {
		// utility class
	}

	/**
	 * Reads a document holding both the source text and its tree.
	 */
	public static SyntaxTree read(Reader reader) {
		JsonElement document = JsonParser.parseReader(reader);
		if (!document.isJsonObject()) {
			throw new IllegalArgumentException("Syntax tree document must be a JSON object");
		}
		JsonObject root = document.getAsJsonObject();
		String source = requireString(root, SOURCE_FIELD);
		JsonObject tree = requireObject(root, TREE_FIELD);
		return read(source, tree);
	}

	/**
	 * Reads a bare tree object for the given source text.
	 */
	public static SyntaxTree read(String source, JsonObject tree) {
		byte[] bytes = source.getBytes(StandardCharsets.UTF_8);
		SyntaxTreeBuilder.Element root = toElement(tree);
		SyntaxTree result = SyntaxTreeBuilder.build(bytes, root);
		logger.debug("Read syntax tree with {} nodes over {} source bytes", result.size(), bytes.length);
		return result;
	}

	private static SyntaxTreeBuilder.Element toElement(JsonObject node) {
		String type = requireString(node, TYPE_FIELD);
		boolean named = !node.has(NAMED_FIELD) || node.get(NAMED_FIELD).getAsBoolean();
		boolean extra = node.has(EXTRA_FIELD) && node.get(EXTRA_FIELD).getAsBoolean();
		int start = requireInt(node, START_FIELD, type);
		int end = requireInt(node, END_FIELD, type);

		List<SyntaxTreeBuilder.Element> children = Collections.emptyList();
		if (node.has(CHILDREN_FIELD) && node.get(CHILDREN_FIELD).isJsonArray()) {
			JsonArray array = node.getAsJsonArray(CHILDREN_FIELD);
			children = new ArrayList<>(array.size());
			for (JsonElement child : array) {
				if (!child.isJsonObject()) {
					throw new IllegalArgumentException("Child of '" + type + "' is not a JSON object: " + child);
				}
				children.add(toElement(child.getAsJsonObject()));
			}
		}
		return SyntaxTreeBuilder.element(type, named, extra, start, end, children);
	}

	private static String requireString(JsonObject object, String field) {
		if (!object.has(field) || !object.get(field).isJsonPrimitive()) {
			throw new IllegalArgumentException("Missing string field '" + field + "'");
		}
		return object.get(field).getAsString();
	}

	private static JsonObject requireObject(JsonObject object, String field) {
		if (!object.has(field) || !object.get(field).isJsonObject()) {
			throw new IllegalArgumentException("Missing object field '" + field + "'");
		}
		return object.getAsJsonObject(field);
	}

	private static int requireInt(JsonObject object, String field, String type) {
		if (!object.has(field) || !object.get(field).isJsonPrimitive()
				|| !object.get(field).getAsJsonPrimitive().isNumber()) {
			throw new IllegalArgumentException("Node '" + type + "' lacks numeric field '" + field + "'");
		}
		return object.get(field).getAsInt();
	}
}
