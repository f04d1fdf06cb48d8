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
package com.tomaszrup.zeekfmt.formatters.expressions;

import java.util.function.Predicate;

import com.tomaszrup.zeekfmt.formatters.FormatContext;
import com.tomaszrup.zeekfmt.formatters.FormattingSession;
import com.tomaszrup.zeekfmt.formatters.SpaceSeparatedFormatter;
import com.tomaszrup.zeekfmt.output.HintSet;
import com.tomaszrup.zeekfmt.tree.SyntaxNode;

/**
 * Expressions, dispatched on their {@link ExpressionShape}.
 *
 * <p>Chains of {@code &&}/{@code ||} or of {@code +} that reach all the way
 * up to a non-expression mark their operators as good break points, so
 * overlong conditions and string concatenations wrap before an operator
 * instead of at arbitrary positions.</p>
 */
public class ExprFormatter extends SpaceSeparatedFormatter {
	@Override
	public void format(FormatContext ctx) {
		switch (ExpressionShape.classify(ctx.node())) {
			case INDEXING:
				ctx.formatChild(); // <expr>
				ctx.formatChild(NO_BREAK_AROUND); // '['
				ctx.formatChild(); // <expr_list>
				ctx.formatChild(NO_BREAK_BEFORE); // ']'
				break;
			case FIELD_ACCESS:
				ctx.formatChild(); // <expr>
				ctx.formatChild(NO_BREAK_AROUND); // '$'
				formatRemaining(ctx);
				break;
			case INDEX_SLICE:
				formatRemaining(ctx);
				break;
			case UNARY:
				ctx.formatChild(NO_BREAK_AFTER); // operator, tight to its operand
				formatRemaining(ctx);
				break;
			case NEGATION:
				ctx.formatChild(NO_BREAK_AFTER); // '!'
				ctx.writeSpace();
				ctx.formatChild();
				break;
			case NOT_IN:
				ctx.formatChild(); // <expr>
				ctx.writeSpace();
				ctx.formatChild(NO_BREAK_AFTER); // '!'
				ctx.formatChild(); // 'in'
				ctx.writeSpace();
				ctx.formatChild(); // <expr>
				break;
			case LIST_CONSTRUCTOR:
				ctx.formatChild(NO_BREAK_BEFORE); // '['
				if (ctx.nextIs("expr_list")) {
					ctx.formatChild();
				} else {
					ctx.writeSpace();
				}
				ctx.formatChild(NO_BREAK_BEFORE); // ']'
				break;
			case FIELD_ASSIGNMENT:
				ctx.formatChildRange(4, HintSet.NONE, GOOD_AFTER_BREAK); // '$' <id> '=' <expr>
				break;
			case FIELD_LAMBDA:
				ctx.formatChildRange(2, HintSet.NONE, GOOD_AFTER_BREAK); // '$' <id>
				ctx.writeSpace();
				ctx.formatChild(NO_BREAK_AROUND); // <begin_lambda>
				ctx.writeSpace();
				ctx.formatChild(NO_BREAK_BEFORE); // '='
				ctx.writeSpace();
				ctx.formatChild(); // <func_body>
				break;
			case PARENTHESIZED:
				ctx.formatChild(NO_BREAK_BEFORE); // '('
				ctx.writeSpace();
				ctx.formatChild(NO_BREAK_AFTER); // <expr>
				ctx.writeSpace();
				ctx.formatChild(); // ')'
				break;
			case COPY:
				ctx.formatChild(); // 'copy'
				ctx.formatChild(NO_BREAK_BEFORE); // '('
				ctx.formatChildRange(2); // <expr> ')'
				break;
			case FIELD_PRESENCE:
				ctx.formatChildRange(3); // <expr> '?$' <id>
				break;
			case LAMBDA:
				ctx.formatChildRange(2); // 'function' <begin_lambda>
				ctx.writeSpace();
				ctx.formatChild(); // <func_body>
				break;
			case CALL:
				ctx.formatChild(); // callee
				ctx.formatChild(NO_BREAK_BEFORE); // '('
				if (ctx.nextIs("expr_list")) {
					ctx.formatChild();
				}
				ctx.formatChild(NO_BREAK_BEFORE); // ')'
				if (ctx.nextIs("attr_list")) {
					ctx.writeSpace();
					ctx.formatChild();
				}
				break;
			case BOOLEAN:
				formatBinary(ctx, ExpressionShape::isBinaryBoolean);
				break;
			case ADDITION:
				formatBinary(ctx, ExpressionShape::isBinaryAddition);
				break;
			default:
				super.format(ctx);
				break;
		}
	}

	private void formatBinary(FormatContext ctx, Predicate<SyntaxNode> sameOperator) {
		HintSet operatorHints = isTopLevelChain(ctx, sameOperator) ? GOOD_AFTER_BREAK : HintSet.NONE;
		ctx.formatChild(); // <expr>
		ctx.writeSpace();
		ctx.formatChild(operatorHints);
		ctx.writeSpace();
		ctx.formatChild(); // <expr>
	}

	/**
	 * Whether this expression and all its expression ancestors satisfy the
	 * predicate, up to the first ancestor that isn't an expression.
	 */
	private static boolean isTopLevelChain(FormatContext ctx, Predicate<SyntaxNode> predicate) {
		FormattingSession session = ctx.session();
		SyntaxNode node = ctx.node();
		while (node != null && session.isFormattedBy(node, ExprFormatter.class) && predicate.test(node)) {
			node = node.parent();
		}
		return node != null && !session.isFormattedBy(node, ExprFormatter.class);
	}

	private static void formatRemaining(FormatContext ctx) {
		while (ctx.hasNextChild()) {
			ctx.formatChild();
		}
	}
}
