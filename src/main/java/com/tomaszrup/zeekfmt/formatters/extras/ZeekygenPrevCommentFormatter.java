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
package com.tomaszrup.zeekfmt.formatters.extras;

import com.tomaszrup.zeekfmt.formatters.FormatContext;
import com.tomaszrup.zeekfmt.formatters.FormattingSession;
import com.tomaszrup.zeekfmt.tree.SyntaxNode;

/**
 * {@code ##<} documentation comments, which refer to the item before them.
 *
 * <p>Consecutive such comments, newlines aside, are aligned to the column
 * of the first one:</p>
 * <pre>
 * global foo: count; ##&lt; first line
 *                    ##&lt; second line
 * </pre>
 */
public class ZeekygenPrevCommentFormatter extends CommentFormatter {
	@Override
	public void format(FormatContext ctx) {
		FormattingSession session = ctx.session();
		SyntaxNode node = ctx.node();

		// Nothing else forces indentation when the comment is alone on its line.
		ctx.writeIndent();

		SyntaxNode previous = node.findPrevCstSibling(n -> !n.isNewline());
		Integer alignTo = previous != null && previous.isBackwardDocComment()
				? session.getDocCommentColumn(previous) : null;
		if (alignTo != null) {
			ctx.writePadding(alignTo - ctx.engine().getColumn());
		} else {
			ctx.writeSpace();
		}
		session.recordDocCommentColumn(node, ctx.engine().getColumn());

		ctx.formatToken();

		SyntaxNode next = node.nextCstSibling();
		if (next != null && next.isNewline()) {
			SyntaxNode afterNext = next.nextCstSibling();
			if (afterNext != null && afterNext.isBackwardDocComment()) {
				ctx.writeNewline();
			}
		}
	}
}
