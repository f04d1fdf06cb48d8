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

import java.util.HashMap;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Closed enumeration of the grammar symbols that have a layout rule of
 * their own. Symbols not listed here use the generic rule.
 */
public enum NodeKind {
	MODULE_DECL,
	EXPORT_DECL,
	GLOBAL_DECL,
	CONST_DECL,
	OPTION_DECL,
	REDEF_DECL,
	REDEF_ENUM_DECL,
	REDEF_RECORD_DECL,
	TYPE_DECL,
	TYPE,
	TYPE_SPEC,
	ENUM_BODY,
	INITIALIZER,
	INIT,
	FUNC_DECL,
	FUNC_HDR,
	FUNC,
	HOOK,
	EVENT,
	FUNC_PARAMS,
	FUNC_BODY,
	FORMAL_ARGS,
	FORMAL_ARG,
	CAPTURE_LIST,
	CAPTURE,
	EVENT_HDR,
	STMT,
	CASE_LIST,
	CASE_TYPE_LIST,
	EXPR_LIST,
	EXPR,
	ATTR,
	ATTR_LIST,
	INTERVAL,
	PREPROC_DIRECTIVE,
	NL,
	MINOR_COMMENT,
	ZEEKYGEN_HEAD_COMMENT,
	ZEEKYGEN_NEXT_COMMENT,
	ZEEKYGEN_PREV_COMMENT,
	NULLNODE;

	private static final Map<String, NodeKind> BY_CONSTANT_NAME = new HashMap<>();
	private static final Map<String, Optional<NodeKind>> RESOLVED = new ConcurrentHashMap<>();

	static {
		for (NodeKind kind : values()) {
			BY_CONSTANT_NAME.put(kind.name(), kind);
		}
	}

	/** The grammar's spelling of this symbol, e.g. {@code module_decl}. */
	public String grammarName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Maps a grammar symbol name onto a constant by naming convention:
	 * {@code "module_decl"} splits into {@code module} and {@code decl},
	 * which upper-cased and rejoined give {@link #MODULE_DECL}. Results,
	 * including misses, are memoized.
	 */
	public static Optional<NodeKind> fromGrammarName(String symbolName) {
		if (symbolName == null || symbolName.isEmpty()) {
			return Optional.empty();
		}
		return RESOLVED.computeIfAbsent(symbolName, NodeKind::deriveByConvention);
	}

	private static Optional<NodeKind> deriveByConvention(String symbolName) {
		String[] parts = symbolName.split("_");
		StringBuilder constant = new StringBuilder();
		for (String part : parts) {
			if (part.isEmpty()) {
				return Optional.empty();
			}
			if (constant.length() > 0) {
				constant.append('_');
			}
			constant.append(part.toUpperCase(Locale.ROOT));
		}
		return Optional.ofNullable(BY_CONSTANT_NAME.get(constant.toString()));
	}
}
