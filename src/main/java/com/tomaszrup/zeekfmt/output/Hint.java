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

/**
 * Line-breaking hints attached to written chunks.
 *
 * <p>Layout rules attach hints based on their surrounding context; only the
 * {@link LineWrapper} interprets them.</p>
 */
public enum Hint {
	/** A line break right before this item is encouraged once the line is too long. */
	GOOD_AFTER_LINEBREAK,
	/** Never break the line before this item. */
	NO_LINEBREAK_BEFORE,
	/** Never break the line after this item. */
	NO_LINEBREAK_AFTER,
	/** This item does not count toward the line length. */
	ZERO_WIDTH
}
