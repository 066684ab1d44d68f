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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Non-leaf node of the syntax tree. Children are kept in source order and
 * cannot be modified after construction.
 */
public final class Phrase extends Node {
	private final PhraseType phraseType;
	private final List<Node> children;

	public Phrase(PhraseType phraseType, List<? extends Node> children) {
		if (phraseType == null) {
			throw new IllegalArgumentException("phraseType must not be null");
		}
		this.phraseType = phraseType;
		this.children = children == null
				? Collections.emptyList()
				: Collections.unmodifiableList(new ArrayList<>(children));
	}

	public PhraseType getPhraseType() {
		return phraseType;
	}

	public List<Node> getChildren() {
		return children;
	}

	public boolean is(PhraseType type) {
		return phraseType == type;
	}

	/**
	 * Whether any direct child is a token of the given type.
	 */
	public boolean hasTokenChild(TokenType type) {
		for (Node child : children) {
			if (child.isToken() && ((Token) child).is(type)) {
				return true;
			}
		}
		return false;
	}

	/**
	 * Index of {@code child} by identity, or -1.
	 */
	public int indexOfChild(Node child) {
		for (int i = 0; i < children.size(); i++) {
			if (children.get(i) == child) {
				return i;
			}
		}
		return -1;
	}

	@Override
	public boolean isToken() {
		return false;
	}

	@Override
	public String toString() {
		return phraseType + "(" + children.size() + ")";
	}
}
