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

import com.tomaszrup.phpls.parser.Token;

/**
 * Gate restricting edit emission to an offset interval of the document.
 *
 * <p>A bounded window starts closed, opens at the token containing its start
 * offset and closes for good at the token containing its end offset. An
 * unbounded window is open for the whole document.</p>
 */
public final class ActiveWindow {
	private final int startOffset;
	private final int endOffset;
	private boolean active;
	private boolean closed;

	private ActiveWindow(int startOffset, int endOffset, boolean active) {
		this.startOffset = startOffset;
		this.endOffset = endOffset;
		this.active = active;
	}

	public static ActiveWindow unbounded() {
		return new ActiveWindow(-1, -1, true);
	}

	/**
	 * @throws IllegalArgumentException when an offset is negative or the
	 *                                  end precedes the start
	 */
	public static ActiveWindow between(int startOffset, int endOffset) {
		if (startOffset < 0 || endOffset < startOffset) {
			throw new IllegalArgumentException("Invalid window [" + startOffset + ", " + endOffset + ")");
		}
		return new ActiveWindow(startOffset, endOffset, false);
	}

	public boolean isBounded() {
		return startOffset > -1;
	}

	public boolean isActive() {
		return active;
	}

	public boolean isClosed() {
		return closed;
	}

	/**
	 * Opens the window when {@code token} reaches the start offset.
	 */
	public void openIfStarted(Token token) {
		if (!active && !closed && isBounded()
				&& (token.containsOffset(startOffset) || token.getOffset() >= startOffset)) {
			active = true;
		}
	}

	/**
	 * Closes the window when {@code token} contains the end offset or lies
	 * past it. The second case covers an end offset inside the first token,
	 * which is passed before the window can open.
	 *
	 * @return whether the window closed on this call
	 */
	public boolean closeIfEnded(Token token) {
		if (active && isBounded() && (token.containsOffset(endOffset) || token.getOffset() > endOffset)) {
			active = false;
			closed = true;
			return true;
		}
		return false;
	}

	/**
	 * Whether an edit spanning {@code [from, to]} may be emitted.
	 */
	public boolean admits(int from, int to) {
		if (!active) {
			return false;
		}
		return !isBounded() || (from >= startOffset && to <= endOffset);
	}
}
