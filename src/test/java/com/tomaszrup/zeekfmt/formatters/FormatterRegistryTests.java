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
package com.tomaszrup.zeekfmt.formatters;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.tomaszrup.zeekfmt.formatters.decls.GlobalDeclFormatter;
import com.tomaszrup.zeekfmt.formatters.decls.ModuleDeclFormatter;
import com.tomaszrup.zeekfmt.formatters.expressions.ExprFormatter;
import com.tomaszrup.zeekfmt.formatters.extras.CommentFormatter;
import com.tomaszrup.zeekfmt.formatters.extras.ZeekygenCommentFormatter;
import com.tomaszrup.zeekfmt.formatters.functions.FuncHdrVariantFormatter;
import com.tomaszrup.zeekfmt.output.Hint;
import com.tomaszrup.zeekfmt.output.HintSet;
import com.tomaszrup.zeekfmt.tree.SyntaxNode;
import com.tomaszrup.zeekfmt.tree.SyntaxTree;
import com.tomaszrup.zeekfmt.tree.SyntaxTreeBuilder;

class FormatterRegistryTests {
	private FormatterRegistry registry;

	@BeforeEach
	void setup() {
		registry = FormatterRegistry.defaultRegistry();
	}

	// --- Lookup ---

	@Test
	void testConventionalNames() {
		Assertions.assertTrue(registry.resolve("module_decl") instanceof ModuleDeclFormatter);
		Assertions.assertTrue(registry.resolve("expr") instanceof ExprFormatter);
	}

	@Test
	void testSharedRules() {
		Formatter global = registry.resolve("global_decl");
		Assertions.assertTrue(global instanceof GlobalDeclFormatter);
		Assertions.assertSame(global, registry.resolve("const_decl"));
		Assertions.assertSame(global, registry.resolve("option_decl"));
		Assertions.assertSame(global, registry.resolve("redef_decl"));

		Assertions.assertTrue(registry.resolve("event") instanceof FuncHdrVariantFormatter);
		Assertions.assertSame(registry.resolve("func"), registry.resolve("hook"));

		Assertions.assertSame(registry.resolve("capture"), registry.resolve("attr_list"));
		Assertions.assertTrue(registry.resolve("interval") instanceof SpaceSeparatedFormatter);

		Assertions.assertTrue(registry.resolve("zeekygen_head_comment") instanceof ZeekygenCommentFormatter);
		Assertions.assertTrue(registry.resolve("nullnode") instanceof NullFormatter);
	}

	@Test
	void testUnknownKindFallsBackToGenericRule() {
		Assertions.assertSame(registry.getFallback(), registry.resolve("stmt_list"));
		Assertions.assertSame(registry.getFallback(), registry.resolve("no_such_symbol"));
		Assertions.assertSame(registry.getFallback(), registry.resolve("_"));
	}

	@Test
	void testLookupIsMemoized() {
		Assertions.assertSame(registry.resolve("type_spec"), registry.resolve("type_spec"));
	}

	@Test
	void testTokensAlwaysUseGenericRule() {
		SyntaxTreeBuilder b = new SyntaxTreeBuilder("event expr;");
		SyntaxTree tree = b.build(b.node("stmt", b.token("event"), b.token("expr"), b.token(";")));
		SyntaxNode root = tree.root();
		Assertions.assertSame(registry.getFallback(), registry.resolve(root.child(0)));
		Assertions.assertSame(registry.getFallback(), registry.resolve(root.child(1)));
	}

	@Test
	void testExplicitRegistrationWins() {
		Formatter custom = new LineFormatter();
		registry.register("module_decl", custom);
		Assertions.assertSame(custom, registry.resolve("module_decl"));
	}

	// --- Hints ---

	@Test
	void testCommentsAreZeroWidth() {
		Formatter comment = registry.resolve("minor_comment");
		Assertions.assertTrue(comment instanceof CommentFormatter);
		Assertions.assertTrue(comment.adjustHints(HintSet.NONE).contains(Hint.ZERO_WIDTH));
		Assertions.assertFalse(registry.resolve("expr").adjustHints(HintSet.NONE).contains(Hint.ZERO_WIDTH));
	}
}
