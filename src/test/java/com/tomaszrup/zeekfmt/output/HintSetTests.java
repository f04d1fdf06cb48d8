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
package com.tomaszrup.zeekfmt.output;

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

class HintSetTests {
	@Test
	void testNoneContainsNothing() {
		for (Hint hint : Hint.values()) {
			Assertions.assertFalse(HintSet.NONE.contains(hint));
		}
		Assertions.assertTrue(HintSet.NONE.isEmpty());
	}

	@Test
	void testUnionAndWith() {
		HintSet set = HintSet.of(Hint.NO_LINEBREAK_BEFORE).union(HintSet.of(Hint.NO_LINEBREAK_AFTER));
		Assertions.assertTrue(set.contains(Hint.NO_LINEBREAK_BEFORE));
		Assertions.assertTrue(set.contains(Hint.NO_LINEBREAK_AFTER));
		Assertions.assertFalse(set.contains(Hint.ZERO_WIDTH));
		Assertions.assertTrue(set.with(Hint.ZERO_WIDTH).contains(Hint.ZERO_WIDTH));
		Assertions.assertFalse(set.contains(Hint.ZERO_WIDTH), "Sets are immutable");
	}

	@Test
	void testEquality() {
		Assertions.assertEquals(HintSet.of(Hint.ZERO_WIDTH, Hint.GOOD_AFTER_LINEBREAK),
				HintSet.of(Hint.GOOD_AFTER_LINEBREAK).with(Hint.ZERO_WIDTH));
		Assertions.assertEquals(HintSet.NONE, HintSet.of());
	}
}
