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
 * Whitespace helpers shared by the format rules.
 */
public final class Whitespace {

	private Whitespace() {
		// utility class
	}

	/**
	 * Counts line breaks. {@code \r\n}, a lone {@code \r} and a lone
	 * {@code \n} each count once.
	 */
	public static int countNewlines(String text) {
		int count = 0;
		int length = text.length();
		int n = 0;
		while (n < length) {
			char c = text.charAt(n);
			++n;
			if (c == '\r') {
				++count;
				if (n < length && text.charAt(n) == '\n') {
					++n;
				}
			} else if (c == '\n') {
				++count;
			}
		}
		return count;
	}

	/**
	 * {@code unit} repeated {@code n} times; empty for {@code n <= 0}.
	 */
	public static String createWhitespace(int n, String unit) {
		return n > 0 ? unit.repeat(n) : "";
	}

	/**
	 * Indent unit for the client's options: {@code tabSize} spaces, or a tab.
	 * Sizes below one are treated as one.
	 */
	public static String indentUnit(boolean insertSpaces, int tabSize) {
		return insertSpaces ? createWhitespace(Math.max(1, tabSize), " ") : "\t";
	}
}
