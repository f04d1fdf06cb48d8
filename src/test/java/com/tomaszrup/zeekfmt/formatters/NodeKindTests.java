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

import java.util.Optional;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class NodeKindTests {

	@Test
	void testFromGrammarName() {
		Assertions.assertEquals(Optional.of(NodeKind.MODULE_DECL), NodeKind.fromGrammarName("module_decl"));
		Assertions.assertEquals(Optional.of(NodeKind.ZEEKYGEN_PREV_COMMENT),
				NodeKind.fromGrammarName("zeekygen_prev_comment"));
		Assertions.assertEquals(Optional.of(NodeKind.NL), NodeKind.fromGrammarName("nl"));
	}

	@Test
	void testUnknownNames() {
		Assertions.assertEquals(Optional.empty(), NodeKind.fromGrammarName("stmt_list"));
		Assertions.assertEquals(Optional.empty(), NodeKind.fromGrammarName("module__decl"));
		Assertions.assertEquals(Optional.empty(), NodeKind.fromGrammarName(""));
		Assertions.assertEquals(Optional.empty(), NodeKind.fromGrammarName(null));
	}

	@Test
	void testGrammarNameRoundTrip() {
		for (NodeKind kind : NodeKind.values()) {
			Assertions.assertEquals(Optional.of(kind), NodeKind.fromGrammarName(kind.grammarName()));
		}
	}
}
