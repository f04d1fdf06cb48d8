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

import java.util.Collections;
import java.util.List;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class SyntaxTreeBuilderTests {

	// --- Arena layout ---

	@Test
	void testRootIsIndexZeroAndSpansAreLocated() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("module Foo;\n");
		SyntaxTree tree = b.build(b.node("source_file",
				b.node("module_decl", b.token("module"), b.leaf("id", "Foo"), b.token(";")),
				b.nl()));

		SyntaxNode root = tree.root();
		Assertions.assertEquals(0, root.index());
		Assertions.assertEquals("source_file", root.kind());
		Assertions.assertNull(root.parent());
		Assertions.assertEquals(1, root.childCount(), "Extras are not grammar children");
		Assertions.assertEquals(2, root.cstChildren().size());

		SyntaxNode decl = root.child(0);
		Assertions.assertEquals("module Foo;", decl.text());
		Assertions.assertEquals(root, decl.parent());
		Assertions.assertEquals("Foo", decl.child(1).text());
		Assertions.assertEquals(7, decl.child(1).startByte());
		Assertions.assertNull(decl.child(3));
	}

	@Test
	void testNamesAndTokens() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("x;");
		SyntaxTree tree = b.build(b.node("stmt", b.leaf("id", "x"), b.token(";")));
		SyntaxNode stmt = tree.root();

		Assertions.assertEquals("id", stmt.child(0).name());
		Assertions.assertNull(stmt.child(0).token());
		Assertions.assertEquals(";", stmt.child(1).token());
		Assertions.assertNull(stmt.child(1).name());
		Assertions.assertNull(stmt.firstChildToken());
	}

	@Test
	void testByteOffsetsOfMultiByteText() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("print \"été\";");
		SyntaxTree tree = b.build(b.node("stmt", b.token("print"), b.leaf("constant", "\"été\""),
				b.token(";")));
		SyntaxNode constant = tree.root().child(1);
		Assertions.assertEquals(6, constant.startByte());
		Assertions.assertEquals(13, constant.endByte());
		Assertions.assertEquals("\"été\"", constant.text());
	}

	// --- Extras ---

	@Test
	void testExtrasAttachToFollowingChild() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("# one\nx;\n");
		SyntaxTree tree = b.build(b.node("source_file",
				b.comment("minor_comment", "# one"), b.nl(),
				b.node("stmt", b.leaf("id", "x"), b.token(";")),
				b.nl()));

		SyntaxNode stmt = tree.root().child(0);
		List<SyntaxNode> before = stmt.prevExtras();
		Assertions.assertEquals(2, before.size());
		Assertions.assertTrue(before.get(0).isComment());
		Assertions.assertTrue(before.get(1).isNewline());
		Assertions.assertEquals(1, stmt.nextExtras().size(), "Trailing extras attach to the last child");
		Assertions.assertTrue(stmt.nextExtras().get(0).isExtra());
	}

	@Test
	void testCstSiblingNavigation() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("x;\n\n\ny;\n");
		SyntaxTree tree = b.build(b.node("source_file",
				b.node("stmt", b.leaf("id", "x"), b.token(";")),
				b.nl(), b.nl(), b.nl(),
				b.node("stmt", b.leaf("id", "y"), b.token(";")),
				b.nl()));

		SyntaxNode second = tree.root().child(1);
		SyntaxNode lastNl = second.prevCstSibling();
		Assertions.assertTrue(lastNl.isNewline());
		Assertions.assertEquals(second, lastNl.nextCstSibling());
		Assertions.assertEquals(tree.root().child(0), second.findPrevCstSibling(n -> !n.isNewline()));
		Assertions.assertNull(tree.root().child(0).prevCstSibling());
	}

	// --- Trailing comment hoisting ---

	@Test
	void testTrailingCommentMovesIntoConstruct() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("x; # note\ny;\n");
		SyntaxTree tree = b.build(b.node("source_file",
				b.node("stmt", b.leaf("id", "x"), b.token(";")),
				b.comment("minor_comment", "# note"),
				b.nl(),
				b.node("stmt", b.leaf("id", "y"), b.token(";")),
				b.nl()));

		SyntaxNode first = tree.root().child(0);
		SyntaxNode semicolon = first.child(1);
		Assertions.assertEquals(1, semicolon.nextExtras().size());
		Assertions.assertEquals("# note", semicolon.nextExtras().get(0).text());
		Assertions.assertEquals(semicolon, semicolon.nextExtras().get(0).prevCstSibling());
		Assertions.assertEquals(1, tree.root().child(1).prevExtras().size(), "Only the newline stays behind");
	}

	@Test
	void testCommentOnNextLineStays() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("x;\n# note\n");
		SyntaxTree tree = b.build(b.node("source_file",
				b.node("stmt", b.leaf("id", "x"), b.token(";")),
				b.nl(),
				b.comment("minor_comment", "# note"),
				b.nl()));

		Assertions.assertEquals(3, tree.root().child(0).nextExtras().size());
		Assertions.assertTrue(tree.root().child(0).child(1).nextExtras().isEmpty());
	}

	@Test
	void testCommentAfterTokenOnSameLineFollowsToken() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("{ # why\nx;\n}");
		SyntaxTree tree = b.build(b.node("stmt",
				b.token("{"), b.comment("minor_comment", "# why"), b.nl(),
				b.node("stmt_list", b.node("stmt", b.leaf("id", "x"), b.token(";"))),
				b.nl(),
				b.token("}")));

		SyntaxNode brace = tree.root().child(0);
		Assertions.assertEquals(1, brace.nextExtras().size());
		Assertions.assertEquals("# why", brace.nextExtras().get(0).text());
		List<SyntaxNode> beforeList = tree.root().child(1).prevExtras();
		Assertions.assertEquals(1, beforeList.size(), "The newline still precedes the statements");
		Assertions.assertTrue(beforeList.get(0).isNewline());
	}

	@Test
	void testCommentOnOwnLineBetweenTokensPrecedesNextChild() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("{\n# why\nx;\n}");
		SyntaxTree tree = b.build(b.node("stmt",
				b.token("{"), b.nl(), b.comment("minor_comment", "# why"), b.nl(),
				b.node("stmt_list", b.node("stmt", b.leaf("id", "x"), b.token(";"))),
				b.nl(),
				b.token("}")));

		Assertions.assertTrue(tree.root().child(0).nextExtras().isEmpty());
		Assertions.assertEquals(3, tree.root().child(1).prevExtras().size());
	}

	@Test
	void testBackwardDocCommentRunMovesTogether() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("global a: count; ##< one\n##< two\n");
		SyntaxTree tree = b.build(b.node("source_file",
				b.node("global_decl", b.token("global"), b.leaf("id", "a"), b.token(":"),
						b.node("type", b.token("count")), b.token(";")),
				b.comment("zeekygen_prev_comment", "##< one"),
				b.nl(),
				b.comment("zeekygen_prev_comment", "##< two"),
				b.nl()));

		SyntaxNode semicolon = tree.root().child(0).child(4);
		List<SyntaxNode> moved = semicolon.nextExtras();
		Assertions.assertEquals(3, moved.size());
		Assertions.assertTrue(moved.get(0).isBackwardDocComment());
		Assertions.assertTrue(moved.get(1).isNewline());
		Assertions.assertTrue(moved.get(2).isBackwardDocComment());
		Assertions.assertEquals(1, tree.root().child(0).nextExtras().size());
	}

	// --- Predicates ---

	@Test
	void testHasPropertyFollowsLeadingEdge() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("{ x; }");
		SyntaxTree tree = b.build(b.node("stmt", b.token("{"),
				b.node("stmt_list", b.node("stmt", b.leaf("id", "x"), b.token(";"))),
				b.token("}")));

		SyntaxNode block = tree.root();
		Assertions.assertTrue(block.hasProperty(n -> "{".equals(n.firstChildToken())));
		Assertions.assertFalse(block.hasProperty(n -> ";".equals(n.firstChildToken())));
		Assertions.assertTrue(block.anyDescendant(n -> ";".equals(n.token())));
	}

	// --- Validation ---

	@Test
	void testTokenNotInSourceIsRejected() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("x;");
		Assertions.assertThrows(IllegalArgumentException.class, () -> b.token("while"));
	}

	@Test
	void testSpanOutsideSourceIsRejected() {
		SyntaxTreeBuilder.Element root = SyntaxTreeBuilder.element("source_file", true, false, 0, 10,
				Collections.emptyList());
		Assertions.assertThrows(IllegalArgumentException.class, () -> SyntaxTreeBuilder.build(new byte[4], root));
	}

	@Test
	void testOverlappingChildrenAreRejected() {
		SyntaxTreeBuilder.Element first = SyntaxTreeBuilder.element("id", true, false, 0, 3, Collections.emptyList());
		SyntaxTreeBuilder.Element second = SyntaxTreeBuilder.element("id", true, false, 2, 4, Collections.emptyList());
		SyntaxTreeBuilder.Element root = SyntaxTreeBuilder.element("expr", true, false, 0, 4, List.of(first, second));
		Assertions.assertThrows(IllegalArgumentException.class, () -> SyntaxTreeBuilder.build(new byte[4], root));
	}
}
