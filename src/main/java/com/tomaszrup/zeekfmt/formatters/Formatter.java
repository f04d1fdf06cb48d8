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

import com.tomaszrup.zeekfmt.output.Hint;
import com.tomaszrup.zeekfmt.output.HintSet;

/**
 * Layout rule for one kind of syntax tree node, and the generic rule used
 * for every node kind without a rule of its own.
 *
 * <p>Rules are stateless and shared; all per-visit state (the node, its
 * indentation, the inherited hints and the child cursor) lives in the
 * {@link FormatContext} handed to {@link #format(FormatContext)}.</p>
 *
 * <p>The generic rule separates children by a single space, and copies the
 * source text of leaves verbatim.</p>
 */
public class Formatter {
	protected static final HintSet NO_BREAK_BEFORE = HintSet.of(Hint.NO_LINEBREAK_BEFORE);
	protected static final HintSet NO_BREAK_AFTER = HintSet.of(Hint.NO_LINEBREAK_AFTER);
	protected static final HintSet NO_BREAK_AROUND = HintSet.of(Hint.NO_LINEBREAK_BEFORE, Hint.NO_LINEBREAK_AFTER);
	protected static final HintSet GOOD_AFTER_BREAK = HintSet.of(Hint.GOOD_AFTER_LINEBREAK);

	public void format(FormatContext ctx) {
		if (ctx.node().hasChildren()) {
			ctx.formatChildren(" ");
		} else if (!ctx.node().cstChildren().isEmpty()) {
			ctx.formatExtrasOnly();
		} else {
			ctx.formatToken();
		}
	}

	/**
	 * Lets a rule amend the hints it inherits from its parent before any of
	 * its output is written.
	 */
	public HintSet adjustHints(HintSet inherited) {
		return inherited;
	}
}
