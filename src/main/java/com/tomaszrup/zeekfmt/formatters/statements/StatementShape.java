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

/**
 * The statement constructs the grammar lumps together under {@code stmt},
 * told apart by their leading child.
 */
enum StatementShape {
	BLOCK,
	PRINT_OR_EVENT,
	IF,
	SWITCH,
	FOR,
	WHILE,
	LOOP_CONTROL,
	RETURN,
	SET_MANAGEMENT,
	LOCAL_OR_CONST,
	WHEN,
	INDEX_SLICE_ASSIGNMENT,
	EXPRESSION,
	PREPROC_DIRECTIVE,
	EMPTY,
	UNKNOWN;

	/**
	 * Classifies a statement by the token or symbol name of its first
	 * grammar child. Either argument may be {@code null}.
	 */
	static StatementShape classify(String leadingToken, String leadingName) {
		if (leadingToken != null) {
			switch (leadingToken) {
				case "{":
					return BLOCK;
				case "print":
				case "event":
					return PRINT_OR_EVENT;
				case "if":
					return IF;
				case "switch":
					return SWITCH;
				case "for":
					return FOR;
				case "while":
					return WHILE;
				case "next":
				case "break":
				case "fallthrough":
					return LOOP_CONTROL;
				case "return":
					return RETURN;
				case "add":
				case "delete":
					return SET_MANAGEMENT;
				case "local":
				case "const":
					return LOCAL_OR_CONST;
				case "when":
					return WHEN;
				case ";":
					return EMPTY;
				default:
					return UNKNOWN;
			}
		}
		if (leadingName != null) {
			switch (leadingName) {
				case "index_slice":
					return INDEX_SLICE_ASSIGNMENT;
				case "expr":
					return EXPRESSION;
				case "preproc_directive":
					return PREPROC_DIRECTIVE;
				default:
					return UNKNOWN;
			}
		}
		return UNKNOWN;
	}
}
