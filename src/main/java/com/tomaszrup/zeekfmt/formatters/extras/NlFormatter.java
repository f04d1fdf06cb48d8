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
import com.tomaszrup.zeekfmt.formatters.Formatter;
import com.tomaszrup.zeekfmt.tree.SyntaxNode;

/**
 * Blank lines. Runs of them at the start or end of a child sequence are
 * dropped, runs in between collapse to a single blank line.
 */
public class NlFormatter extends Formatter {
	@Override
	public void format(FormatContext ctx) {
		SyntaxNode node = ctx.node();
		SyntaxNode next = node.nextCstSibling();
		if (next != null && next.isNewline()) {
			// Only the last marker of a run does anything.
			return;
		}
		if (next == null || "}".equals(next.token())) {
			return;
		}

		SyntaxNode previous = node.prevCstSibling();
		if (previous == null || !previous.isNewline()) {
			return;
		}
		SyntaxNode runStart = previous;
		while (runStart.prevCstSibling() != null && runStart.prevCstSibling().isNewline()) {
			runStart = runStart.prevCstSibling();
		}
		SyntaxNode beforeRun = runStart.prevCstSibling();
		if (beforeRun != null && !"{".equals(beforeRun.token())) {
			ctx.writeNewline(true, false);
		}
	}
}
