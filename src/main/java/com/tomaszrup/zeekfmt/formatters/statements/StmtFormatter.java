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
package com.tomaszrup.zeekfmt.formatters.statements;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.zeekfmt.formatters.FormatContext;
import com.tomaszrup.zeekfmt.formatters.decls.TypedInitializerFormatter;
import com.tomaszrup.zeekfmt.tree.SyntaxNode;

/**
 * Statements. The construct is identified once from the leading child (see
 * {@link StatementShape}) and then laid out by a dedicated method.
 *
 * <p>Controlled statements of {@code if}, {@code for}, {@code while} and
 * {@code when} follow one of two layouts. A braced block stays on the
 * keyword's line:</p>
 * <pre>
 * if ( foo ) {
 * 	bar();
 * }
 * </pre>
 * <p>Any other statement moves to the next line, one level deeper:</p>
 * <pre>
 * if ( foo )
 * 	bar();
 * </pre>
 */
public class StmtFormatter extends TypedInitializerFormatter {
	private static final Logger logger = LoggerFactory.getLogger(StmtFormatter.class);

	@Override
	public void format(FormatContext ctx) {
		StatementShape shape = StatementShape.classify(ctx.peekToken(), ctx.peekName());
		switch (shape) {
			case BLOCK:
				formatBlockStatement(ctx);
				break;
			case PRINT_OR_EVENT:
			case SET_MANAGEMENT:
				ctx.formatChild(); // keyword
				ctx.writeSpace();
				ctx.formatChildRange(2); // <expr_list>, <event_hdr> or <expr>, then ';'
				ctx.writeNewline();
				break;
			case IF:
				formatIf(ctx);
				break;
			case SWITCH:
				formatSwitch(ctx);
				break;
			case FOR:
				formatFor(ctx);
				break;
			case WHILE:
				ctx.formatChild(); // 'while'
				ctx.writeSpace();
				formatCondition(ctx);
				formatControlledStatement(ctx);
				break;
			case LOOP_CONTROL:
				ctx.formatChildRange(2); // keyword ';'
				ctx.writeNewline();
				break;
			case RETURN:
				formatReturn(ctx);
				break;
			case LOCAL_OR_CONST:
				ctx.formatChild(); // 'local' or 'const'
				ctx.writeSpace();
				ctx.formatChild(); // <id>
				formatTypedInitializer(ctx);
				ctx.formatChild(NO_BREAK_BEFORE); // ';'
				ctx.writeNewline();
				break;
			case WHEN:
				formatWhen(ctx);
				break;
			case INDEX_SLICE_ASSIGNMENT:
				ctx.formatChild(); // <index_slice>
				ctx.writeSpace();
				ctx.formatChild(); // '='
				ctx.writeSpace();
				ctx.formatChildRange(2); // <expr> ';'
				ctx.writeNewline();
				break;
			case EXPRESSION:
				ctx.formatChildRange(2); // <expr> ';'
				ctx.writeNewline();
				break;
			case PREPROC_DIRECTIVE:
			case EMPTY:
				ctx.formatChild();
				ctx.writeNewline();
				break;
			default:
				logger.debug("Unrecognized statement {}, laying it out generically", ctx.node());
				super.format(ctx);
				break;
		}
	}

	private void formatBlockStatement(FormatContext ctx) {
		ctx.formatChild(NO_BREAK_BEFORE); // '{'
		if (ctx.nextIs("stmt_list")) {
			ctx.writeNewline();
			ctx.formatChild(true);
		} else {
			ctx.writeSpace();
		}
		ctx.formatChild(); // '}'
	}

	private void formatIf(FormatContext ctx) {
		ctx.formatChild(); // 'if'
		ctx.writeSpace();
		formatCondition(ctx);

		boolean curly = nextIsBlock(ctx);
		ctx.writeSpaceOrNewline(curly);
		ctx.formatChild(!curly); // <stmt>

		if (!ctx.nextIsToken("else")) {
			if (curly) {
				ctx.writeNewline();
			}
			return;
		}

		if (curly) {
			ctx.writeSpace();
		}
		ctx.formatChild(); // 'else'

		// "else if" stays on the else line so that cascades don't drift right.
		SyntaxNode elseBody = ctx.peekChild();
		if (elseBody != null && elseBody.hasProperty(n -> "if".equals(n.firstChildToken()))) {
			ctx.writeSpace();
			ctx.formatChild();
		} else {
			formatControlledStatement(ctx);
		}
	}

	private void formatSwitch(FormatContext ctx) {
		ctx.formatChild(); // 'switch'
		ctx.writeSpace();
		ctx.formatChild(); // <expr>
		ctx.writeSpace();
		ctx.formatChild(NO_BREAK_BEFORE); // '{'
		if (ctx.nextIs("case_list")) {
			ctx.writeNewline();
			ctx.formatChild(true);
		} else {
			ctx.writeSpace();
		}
		ctx.formatChild(); // '}'
		ctx.writeNewline();
	}

	private void formatFor(FormatContext ctx) {
		ctx.formatChild(); // 'for'
		ctx.writeSpace();
		ctx.formatChild(NO_BREAK_BEFORE); // '('
		ctx.writeSpace();
		if (ctx.nextIsToken("[")) {
			ctx.formatChild(NO_BREAK_BEFORE);
			while (ctx.hasNextChild() && !ctx.nextIsToken("]")) {
				ctx.formatChild(); // <id>
				if (ctx.nextIsToken(",")) {
					ctx.formatChild(NO_BREAK_BEFORE);
					ctx.writeSpace();
				}
			}
			ctx.formatChild(NO_BREAK_BEFORE); // ']'
		} else {
			ctx.formatChild(); // <id>
		}

		// Value variables, as in "for ( k, v in t )"
		while (ctx.nextIsToken(",")) {
			ctx.formatChild(NO_BREAK_BEFORE);
			ctx.writeSpace();
			ctx.formatChild(); // <id>
		}
		ctx.writeSpace();
		ctx.formatChild(); // 'in'
		ctx.writeSpace();
		ctx.formatChild(); // <expr>
		ctx.writeSpace();
		ctx.formatChild(NO_BREAK_BEFORE); // ')'
		formatControlledStatement(ctx);
	}

	private void formatReturn(FormatContext ctx) {
		ctx.formatChild(); // 'return'
		if (ctx.nextIsToken("when")) {
			ctx.writeSpace();
			formatWhen(ctx);
			return;
		}
		if (ctx.nextIs("expr")) {
			ctx.writeSpace();
			ctx.formatChild();
		}
		ctx.formatChild(NO_BREAK_BEFORE); // ';'
		ctx.writeNewline();
	}

	private void formatWhen(FormatContext ctx) {
		ctx.formatChild(); // 'when'
		ctx.writeSpace();
		if (ctx.nextIs("capture_list")) {
			ctx.formatChild();
			ctx.writeSpace();
		}
		formatCondition(ctx);

		boolean curly = nextIsBlock(ctx);
		ctx.writeSpaceOrNewline(curly);
		ctx.formatChild(!curly); // <stmt>

		if (ctx.nextIsToken("timeout")) {
			if (curly) {
				ctx.writeSpace();
			}
			ctx.formatChild(); // 'timeout'
			ctx.writeSpace();
			ctx.formatChild(); // <expr>
			ctx.writeSpace();
			ctx.formatChild(NO_BREAK_BEFORE); // '{'
			ctx.writeNewline();
			if (ctx.nextIs("stmt_list")) {
				ctx.formatChild(true);
			}
			ctx.formatChild(); // '}'
			ctx.writeNewline();
		} else if (curly) {
			ctx.writeNewline();
		}
	}

	/** {@code ( <expr> )} with the parentheses kept off line starts. */
	private void formatCondition(FormatContext ctx) {
		ctx.formatChild(NO_BREAK_BEFORE); // '('
		ctx.writeSpace();
		ctx.formatChild(); // <expr>
		ctx.writeSpace();
		ctx.formatChild(NO_BREAK_BEFORE); // ')'
	}

	private void formatControlledStatement(FormatContext ctx) {
		boolean curly = nextIsBlock(ctx);
		ctx.writeSpaceOrNewline(curly);
		ctx.formatChild(!curly); // <stmt>
		if (curly) {
			ctx.writeNewline();
		}
	}

	private static boolean nextIsBlock(FormatContext ctx) {
		SyntaxNode next = ctx.peekChild();
		return next != null && next.hasProperty(n -> "{".equals(n.firstChildToken()));
	}
}
