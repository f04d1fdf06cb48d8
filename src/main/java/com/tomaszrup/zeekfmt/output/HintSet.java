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

import java.util.ArrayList;
import java.util.List;

/**
 * Immutable bit set of {@link Hint}s.
 */
public final class HintSet {
	public static final HintSet NONE = new HintSet(0);

	private final int bits;

	private HintSet(int bits) {
		this.bits = bits;
	}

	public static HintSet of(Hint... hints) {
		int bits = 0;
		for (Hint hint : hints) {
			bits |= mask(hint);
		}
		return bits == 0 ? NONE : new HintSet(bits);
	}

	public boolean contains(Hint hint) {
		return (bits & mask(hint)) != 0;
	}

	public HintSet with(Hint hint) {
		return union(bits | mask(hint));
	}

	public HintSet union(HintSet other) {
		return other == null ? this : union(bits | other.bits);
	}

	public boolean isEmpty() {
		return bits == 0;
	}

	private HintSet union(int combined) {
		return combined == bits ? this : new HintSet(combined);
	}

	private static int mask(Hint hint) {
		return 1 << hint.ordinal();
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof HintSet && ((HintSet) obj).bits == bits;
	}

	@Override
	public int hashCode() {
		return bits;
	}

	@Override
	public String toString() {
		List<Hint> hints = new ArrayList<>();
		for (Hint hint : Hint.values()) {
			if (contains(hint)) {
				hints.add(hint);
			}
		}
		return hints.toString();
	}
}
