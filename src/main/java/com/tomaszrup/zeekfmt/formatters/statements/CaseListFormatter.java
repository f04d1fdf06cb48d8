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

import com.tomaszrup.zeekfmt.formatters.FormatContext;
import com.tomaszrup.zeekfmt.formatters.Formatter;

/**
 * The labels of a {@code switch}, each followed by its indented statements.
 */
public class CaseListFormatter extends Formatter {
	@Override
	public void format(FormatContext ctx) {
		while (ctx.hasNextChild()) {
			if (ctx.nextIsToken("case")) {
				ctx.formatChild();
				ctx.writeSpace();
				ctx.formatChildRange(2); // <expr_list> or <case_type_list>, then ':'
			} else {
				ctx.formatChildRange(2); // 'default' ':'
			}
			ctx.writeNewline();
			if (ctx.nextIs("stmt_list")) {
				ctx.formatChild(true);
			}
		}
	}
}
