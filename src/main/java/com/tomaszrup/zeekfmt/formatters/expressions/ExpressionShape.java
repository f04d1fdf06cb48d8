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

import java.util.Arrays;
import java.util.List;

import com.tomaszrup.zeekfmt.tree.SyntaxNode;

/**
 * The expression constructs the grammar lumps together under {@code expr}.
 * The first matching shape, in declaration order, wins.
 */
enum ExpressionShape {
	/** {@code a[i]} */
	INDEXING,
	/** {@code r$field} */
	FIELD_ACCESS,
	/** {@code v[1:2]} */
	INDEX_SLICE,
	/** {@code ! x} */
	NEGATION,
	/** {@code |s|}, {@code ++i}, {@code -x} and other prefix operators */
	UNARY,
	/** {@code a !in b} */
	NOT_IN,
	/** {@code [a, b]} */
	LIST_CONSTRUCTOR,
	/** {@code $field = value} */
	FIELD_ASSIGNMENT,
	/** {@code $field(args) = body} */
	FIELD_LAMBDA,
	/** {@code ( x )} */
	PARENTHESIZED,
	/** {@code copy(x)} */
	COPY,
	/** {@code r?$field} */
	FIELD_PRESENCE,
	/** {@code function(args) body} */
	LAMBDA,
	/** {@code table(...)} and other calls and constructors */
	CALL,
	/** {@code a && b}, {@code a || b} */
	BOOLEAN,
	/** {@code a + b} */
	ADDITION,
	OTHER;

	private static final List<String> UNARY_OPERATORS = Arrays.asList("|", "++", "--", "~", "-", "+");

	/**
	 * Derives the shape from the names and tokens of the first three
	 * children and the child count, computed once per node.
	 */
	static ExpressionShape classify(SyntaxNode expr) {
		String n1 = nameAt(expr, 0);
		String n2 = nameAt(expr, 1);
		String t1 = tokenAt(expr, 0);
		String t2 = tokenAt(expr, 1);
		String t3 = tokenAt(expr, 2);
		boolean leadingExpr = "expr".equals(n1);

		if (leadingExpr && "[".equals(t2)) {
			return INDEXING;
		}
		if (leadingExpr && "$".equals(t2)) {
			return FIELD_ACCESS;
		}
		if (leadingExpr && "index_slice".equals(n2)) {
			return INDEX_SLICE;
		}
		if ("!".equals(t1)) {
			return NEGATION;
		}
		if (t1 != null && UNARY_OPERATORS.contains(t1)) {
			return UNARY;
		}
		if (leadingExpr && "!".equals(t2) && "in".equals(t3)) {
			return NOT_IN;
		}
		if ("[".equals(t1)) {
			return LIST_CONSTRUCTOR;
		}
		if ("$".equals(t1)) {
			return "=".equals(t3) ? FIELD_ASSIGNMENT : FIELD_LAMBDA;
		}
		if ("(".equals(t1)) {
			return PARENTHESIZED;
		}
		if ("copy".equals(t1)) {
			return COPY;
		}
		if ("?$".equals(t2)) {
			return FIELD_PRESENCE;
		}
		if ("function".equals(t1)) {
			return LAMBDA;
		}
		if ("(".equals(t2)) {
			return CALL;
		}
		if (isBinaryBoolean(expr)) {
			return BOOLEAN;
		}
		if (isBinaryAddition(expr)) {
			return ADDITION;
		}
		return OTHER;
	}

	static boolean isBinaryBoolean(SyntaxNode expr) {
		String operator = tokenAt(expr, 1);
		return expr.childCount() == 3 && ("||".equals(operator) || "&&".equals(operator));
	}

	static boolean isBinaryAddition(SyntaxNode expr) {
		SyntaxNode operator = expr.child(1);
		return expr.childCount() == 3 && operator != null && "+".equals(operator.kind());
	}

	private static String nameAt(SyntaxNode node, int position) {
		SyntaxNode child = node.child(position);
		return child != null ? child.name() : null;
	}

	private static String tokenAt(SyntaxNode node, int position) {
		SyntaxNode child = node.child(position);
		return child != null ? child.token() : null;
	}
}
