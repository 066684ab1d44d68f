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
package com.tomaszrup.phpls;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Map;

import com.tomaszrup.phpls.document.ParsedDocument;
import com.tomaszrup.phpls.parser.Node;
import com.tomaszrup.phpls.parser.Phrase;
import com.tomaszrup.phpls.parser.PhraseType;
import com.tomaszrup.phpls.parser.Token;
import com.tomaszrup.phpls.parser.TokenType;

/**
 * Builds syntax trees for tests. Tokens take their offsets from the order
 * in which they are created, so nested calls such as
 * {@code phrase(T, token(A, "a"), ws(" "), token(B, "b"))} produce a tree
 * that covers {@link #text()} contiguously.
 */
public final class PhpTreeBuilder {
	private final StringBuilder text = new StringBuilder();

	public Token token(TokenType type, String tokenText) {
		Token token = new Token(type, text.length(), tokenText.length());
		text.append(tokenText);
		return token;
	}

	public Token ws(String whitespace) {
		return token(TokenType.WHITESPACE, whitespace);
	}

	public Token openTag() {
		return token(TokenType.OPEN_TAG, "<?php\n");
	}

	public Phrase phrase(PhraseType type, Node... children) {
		return new Phrase(type, Arrays.asList(children));
	}

	public Phrase variable(String name) {
		return phrase(PhraseType.SIMPLE_VARIABLE, token(TokenType.VARIABLE_NAME, name));
	}

	public Phrase name(String name) {
		return phrase(PhraseType.QUALIFIED_NAME,
				phrase(PhraseType.NAMESPACE_NAME, token(TokenType.NAME, name)));
	}

	public String text() {
		return text.toString();
	}

	public ParsedDocument document(String uri, Phrase root) {
		return new ParsedDocument(uri, text(), root);
	}

	/**
	 * Re-tokenises {@code original} against {@code newText}, which must
	 * differ from the original text only in whitespace and in the alignment
	 * of block comments.
	 *
	 * <p>Existing whitespace tokens keep their place in the tree. Whitespace
	 * that appears where there was none is attached to the highest phrase
	 * whose child starts with the token that follows it.</p>
	 */
	public static ParsedDocument relocate(ParsedDocument original, String newText) {
		List<Token> leaves = new ArrayList<>();
		collectLeaves(original.getTree(), leaves);

		Map<Token, Token> relocated = new IdentityHashMap<>();
		Map<Token, String> gapBefore = new IdentityHashMap<>();
		Map<Token, Boolean> hadWhitespaceBefore = new IdentityHashMap<>();
		int cursor = 0;
		boolean whitespaceSeen = false;
		for (Token leaf : leaves) {
			if (leaf.is(TokenType.WHITESPACE)) {
				whitespaceSeen = true;
				continue;
			}
			String oldText = original.tokenText(leaf);
			int start = findTokenStart(newText, cursor, oldText);
			int end = start + oldText.length();
			if (isBlockComment(leaf, oldText)) {
				end = newText.indexOf("*/", start + 2) + 2;
			}
			relocated.put(leaf, new Token(leaf.getTokenType(), start, end - start));
			gapBefore.put(leaf, newText.substring(cursor, start));
			hadWhitespaceBefore.put(leaf, whitespaceSeen);
			whitespaceSeen = false;
			cursor = end;
		}

		Relocation relocation = new Relocation(newText, relocated, gapBefore, hadWhitespaceBefore, cursor);
		Phrase tree = (Phrase) relocation.rebuild(original.getTree(), leaves);
		return new ParsedDocument(original.getUri(), newText, tree);
	}

	private static boolean isBlockComment(Token leaf, String oldText) {
		return (leaf.is(TokenType.COMMENT) || leaf.is(TokenType.DOCUMENT_COMMENT)) && oldText.startsWith("/*");
	}

	private static int findTokenStart(String newText, int cursor, String tokenText) {
		String probe = tokenText.startsWith("/*") ? "/*" : tokenText;
		int k = cursor;
		while (!newText.startsWith(probe, k)) {
			if (k >= newText.length() || " \t\r\n".indexOf(newText.charAt(k)) < 0) {
				throw new IllegalStateException("Token '" + tokenText + "' not found at " + cursor);
			}
			k++;
		}
		return k;
	}

	private static void collectLeaves(Node node, List<Token> leaves) {
		if (node.isToken()) {
			leaves.add((Token) node);
			return;
		}
		for (Node child : ((Phrase) node).getChildren()) {
			collectLeaves(child, leaves);
		}
	}

	private static Token firstSolidLeaf(Node node) {
		if (node.isToken()) {
			return ((Token) node).is(TokenType.WHITESPACE) ? null : (Token) node;
		}
		for (Node child : ((Phrase) node).getChildren()) {
			Token leaf = firstSolidLeaf(child);
			if (leaf != null) {
				return leaf;
			}
		}
		return null;
	}

	private static final class Relocation {
		private final String newText;
		private final Map<Token, Token> relocated;
		private final Map<Token, String> gapBefore;
		private final Map<Token, Boolean> hadWhitespaceBefore;
		private final Map<Token, Boolean> consumed = new IdentityHashMap<>();
		private final int trailingStart;
		private boolean trailingConsumed;

		Relocation(String newText, Map<Token, Token> relocated, Map<Token, String> gapBefore,
				Map<Token, Boolean> hadWhitespaceBefore, int trailingStart) {
			this.newText = newText;
			this.relocated = relocated;
			this.gapBefore = gapBefore;
			this.hadWhitespaceBefore = hadWhitespaceBefore;
			this.trailingStart = trailingStart;
		}

		Node rebuild(Node node, List<Token> leaves) {
			if (node.isToken()) {
				return relocated.get(node);
			}
			List<Node> children = new ArrayList<>();
			for (Node child : ((Phrase) node).getChildren()) {
				if (child.isToken() && ((Token) child).is(TokenType.WHITESPACE)) {
					Token whitespace = whitespaceFor((Token) child, leaves);
					if (whitespace != null) {
						children.add(whitespace);
					}
					continue;
				}
				Token first = firstSolidLeaf(child);
				if (first != null && !hadWhitespaceBefore.get(first) && isPending(first)) {
					children.add(consume(first));
				}
				children.add(rebuild(child, leaves));
			}
			return new Phrase(((Phrase) node).getPhraseType(), children);
		}

		private Token whitespaceFor(Token oldWhitespace, List<Token> leaves) {
			Token next = null;
			for (int i = leaves.indexOf(oldWhitespace) + 1; i < leaves.size(); i++) {
				if (!leaves.get(i).is(TokenType.WHITESPACE)) {
					next = leaves.get(i);
					break;
				}
			}
			if (next == null) {
				if (trailingConsumed || trailingStart >= newText.length()) {
					return null;
				}
				trailingConsumed = true;
				return new Token(TokenType.WHITESPACE, trailingStart, newText.length() - trailingStart);
			}
			return isPending(next) ? consume(next) : null;
		}

		private boolean isPending(Token leaf) {
			return !consumed.containsKey(leaf) && !gapBefore.get(leaf).isEmpty();
		}

		private Token consume(Token leaf) {
			consumed.put(leaf, Boolean.TRUE);
			String gap = gapBefore.get(leaf);
			int start = relocated.get(leaf).getOffset() - gap.length();
			return new Token(TokenType.WHITESPACE, start, gap.length());
		}
	}
}
