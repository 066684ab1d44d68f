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
package com.tomaszrup.phpls.format;

/**
 * Current indentation during a format pass. The text is always the indent
 * unit repeated {@link #getDepth()} times.
 */
public final class IndentationContext {
	private final String unit;
	private String text = "";
	private int depth;

	public IndentationContext(String unit) {
		if (unit == null || unit.isEmpty()) {
			throw new IllegalArgumentException("Indent unit must not be empty");
		}
		this.unit = unit;
	}

	public String getUnit() {
		return unit;
	}

	public String getText() {
		return text;
	}

	public int getDepth() {
		return depth;
	}

	public void increment() {
		text += unit;
		depth++;
	}

	/**
	 * @throws IllegalStateException when already at depth zero
	 */
	public void decrement() {
		if (depth == 0) {
			throw new IllegalStateException("Indentation is already at depth zero");
		}
		text = text.substring(0, text.length() - unit.length());
		depth--;
	}

	public void reset(int newDepth) {
		if (newDepth < 0) {
			throw new IllegalArgumentException("Negative indentation depth: " + newDepth);
		}
		depth = newDepth;
		text = Whitespace.createWhitespace(newDepth, unit);
	}
}
