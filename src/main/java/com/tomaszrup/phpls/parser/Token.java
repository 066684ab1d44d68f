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
package com.tomaszrup.phpls.parser;

/**
 * Leaf of the syntax tree. Offsets and lengths are in UTF-16 code units,
 * matching {@link String} indexing and LSP character positions.
 */
public final class Token extends Node {
	private final TokenType tokenType;
	private final int offset;
	private final int length;

	public Token(TokenType tokenType, int offset, int length) {
		if (tokenType == null) {
			throw new IllegalArgumentException("tokenType must not be null");
		}
		if (offset < 0 || length < 0) {
			throw new IllegalArgumentException("Negative offset or length: " + offset + ", " + length);
		}
		this.tokenType = tokenType;
		this.offset = offset;
		this.length = length;
	}

	public TokenType getTokenType() {
		return tokenType;
	}

	public int getOffset() {
		return offset;
	}

	public int getLength() {
		return length;
	}

	/** Exclusive end offset. */
	public int getEnd() {
		return offset + length;
	}

	public boolean is(TokenType type) {
		return tokenType == type;
	}

	/**
	 * Whether {@code offset} falls on one of this token's characters.
	 * Empty tokens contain no offset.
	 */
	public boolean containsOffset(int offset) {
		return offset > -1 && this.offset <= offset && this.offset + length - 1 >= offset;
	}

	@Override
	public boolean isToken() {
		return true;
	}

	@Override
	public String toString() {
		return tokenType + "@" + offset + "+" + length;
	}
}
