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

import java.util.ArrayDeque;
import java.util.Deque;

import com.tomaszrup.phpls.parser.Token;

/**
 * Traversal state carried from one token to the next: the token last seen,
 * the rule chosen for the whitespace in front of the next token, and one
 * multi-line flag per open comma-delimited list.
 */
final class FormatState {
	private Token previousToken;
	private FormatRule pendingRule;
	private final Deque<Boolean> multilineLists = new ArrayDeque<>();

	Token getPreviousToken() {
		return previousToken;
	}

	/**
	 * Records {@code token} as the previous token and returns the one it
	 * replaces ({@code null} at the start of the document).
	 */
	Token advance(Token token) {
		Token previous = previousToken;
		previousToken = token;
		return previous;
	}

	FormatRule getPendingRule() {
		return pendingRule;
	}

	void setPendingRule(FormatRule rule) {
		pendingRule = rule;
	}

	/**
	 * Returns the pending rule and clears it.
	 */
	FormatRule takePendingRule() {
		FormatRule rule = pendingRule;
		pendingRule = null;
		return rule;
	}

	void pushList(boolean multiline) {
		multilineLists.push(multiline);
	}

	/**
	 * @return whether the list being closed was multi-line; {@code false}
	 *         when no list is open
	 */
	boolean popList() {
		Boolean multiline = multilineLists.poll();
		return multiline != null && multiline;
	}

	boolean isInMultilineList() {
		Boolean multiline = multilineLists.peek();
		return multiline != null && multiline;
	}
}
