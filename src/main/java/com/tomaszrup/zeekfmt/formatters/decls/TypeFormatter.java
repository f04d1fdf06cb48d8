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
package com.tomaszrup.zeekfmt.formatters.decls;

import com.tomaszrup.zeekfmt.formatters.FormatContext;
import com.tomaszrup.zeekfmt.formatters.SpaceSeparatedFormatter;

/**
 * Type expressions. Container and compound types get their punctuation
 * tight; anything else, e.g. {@code vector of count}, is space-separated.
 */
public class TypeFormatter extends SpaceSeparatedFormatter {
	@Override
	public void format(FormatContext ctx) {
		String token = ctx.peekToken();
		if ("set".equals(token)) {
			ctx.formatChild();
			formatTypeList(ctx);
		} else if ("table".equals(token)) {
			ctx.formatChild();
			formatTypeList(ctx);
			ctx.writeSpace();
			ctx.formatChild(); // 'of'
			ctx.writeSpace();
			ctx.formatChild(); // <type>
		} else if ("record".equals(token)) {
			ctx.formatChild();
			ctx.writeSpace();
			ctx.formatChild(); // '{'
			if (ctx.nextIs("type_spec")) {
				ctx.writeNewline();
				while (ctx.nextIs("type_spec")) {
					ctx.formatChild(true);
				}
			} else {
				ctx.writeSpace();
			}
			ctx.formatChild(); // '}'
		} else if ("enum".equals(token)) {
			ctx.formatChild();
			ctx.writeSpace();
			ctx.formatChild(); // '{'
			ctx.writeNewline();
			ctx.formatChild(true); // <enum_body>
			ctx.formatChild(); // '}'
		} else if ("function".equals(token)) {
			ctx.formatChildRange(2); // 'function' <func_params>
		} else if ("event".equals(token) || "hook".equals(token)) {
			ctx.formatChild();
			ctx.formatChild(NO_BREAK_BEFORE); // '('
			if (ctx.nextIs("formal_args")) {
				ctx.formatChild();
			}
			ctx.formatChild(NO_BREAK_BEFORE); // ')'
		} else {
			super.format(ctx);
		}
	}

	private void formatTypeList(FormatContext ctx) {
		ctx.formatChild(NO_BREAK_BEFORE); // '['
		while (ctx.nextIs("type")) {
			ctx.formatChild();
			if (ctx.nextIsToken(",")) {
				ctx.formatChild(NO_BREAK_BEFORE);
				ctx.writeSpace();
			}
		}
		ctx.formatChild(NO_BREAK_BEFORE); // ']'
	}
}
