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

import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.google.gson.JsonParser;

class SyntaxTreeJsonReaderTests {

	@Test
	void testReadsDocumentFromClasspath() throws Exception {
		try (InputStream in = getClass().getResourceAsStream("/trees/module_decl.json");
				Reader reader = new InputStreamReader(in, StandardCharsets.UTF_8)) {
			SyntaxTree tree = SyntaxTreeJsonReader.read(reader);

			SyntaxNode root = tree.root();
			Assertions.assertEquals("source_file", root.kind());
			SyntaxNode moduleDecl = root.child(0).child(0);
			Assertions.assertEquals("module_decl", moduleDecl.kind());
			Assertions.assertEquals("module", moduleDecl.child(0).token());
			Assertions.assertEquals("Foo", moduleDecl.child(1).text());
			Assertions.assertTrue(root.child(0).nextExtras().get(0).isNewline());
		}
	}

	@Test
	void testDefaultsForOptionalFields() {
		JsonObject tree = JsonParser.parseString(
				"{\"type\": \"id\", \"startByte\": 0, \"endByte\": 3}").getAsJsonObject();
		SyntaxNode node = SyntaxTreeJsonReader.read("foo", tree).root();
		Assertions.assertTrue(node.isNamed());
		Assertions.assertFalse(node.isExtra());
		Assertions.assertFalse(node.hasChildren());
	}

	@Test
	void testMissingSpanIsRejected() {
		JsonObject tree = JsonParser.parseString("{\"type\": \"id\", \"startByte\": 0}").getAsJsonObject();
		Assertions.assertThrows(IllegalArgumentException.class, () -> SyntaxTreeJsonReader.read("foo", tree));
	}

	@Test
	void testDocumentMustBeObject() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> SyntaxTreeJsonReader.read(new StringReader("[1, 2]")));
	}

	@Test
	void testMissingSourceIsRejected() {
		Assertions.assertThrows(IllegalArgumentException.class,
				() -> SyntaxTreeJsonReader.read(new StringReader("{\"tree\": {}}")));
	}
}
