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
 * A node of the PHP concrete syntax tree: either a {@link Token} (leaf) or a
 * {@link Phrase} (non-leaf). The constructor is package-private so those are
 * the only two kinds.
 */
public abstract class Node {

	Node() {
	}

	public abstract boolean isToken();

	public boolean isPhrase() {
		return !isToken();
	}

	/**
	 * @throws IllegalStateException if this node is a phrase
	 */
	public Token asToken() {
		if (!isToken()) {
			throw new IllegalStateException("Not a token: " + this);
		}
		return (Token) this;
	}

	/**
	 * @throws IllegalStateException if this node is a token
	 */
	public Phrase asPhrase() {
		if (!isPhrase()) {
			throw new IllegalStateException("Not a phrase: " + this);
		}
		return (Phrase) this;
	}
}
