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
package com.tomaszrup.phpls.document;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.phpls.parser.Node;
import com.tomaszrup.phpls.parser.Phrase;
import com.tomaszrup.phpls.parser.Token;

/**
 * Immutable snapshot of a PHP document: its text and the syntax tree the
 * parser produced for that text. A change to the document creates a new
 * instance.
 */
public class ParsedDocument {
	private final String uri;
	private final String text;
	private final Phrase tree;
	private final int[] lineStarts;

	public ParsedDocument(String uri, String text, Phrase tree) {
		if (uri == null || text == null || tree == null) {
			throw new IllegalArgumentException("uri, text and tree are required");
		}
		this.uri = uri;
		this.text = text;
		this.tree = tree;
		this.lineStarts = Positions.lineStartOffsets(text);
	}

	public String getUri() {
		return uri;
	}

	public String getText() {
		return text;
	}

	public Phrase getTree() {
		return tree;
	}

	public String tokenText(Token token) {
		int start = Math.min(token.getOffset(), text.length());
		int end = Math.min(token.getEnd(), text.length());
		return text.substring(start, end);
	}

	public Range tokenRange(Token token) {
		return new Range(positionAtOffset(token.getOffset()), positionAtOffset(token.getEnd()));
	}

	public Position positionAtOffset(int offset) {
		return Positions.positionAt(text, lineStarts, offset);
	}

	public int offsetAtPosition(Position position) {
		return Positions.offsetAt(text, lineStarts, position);
	}

	/**
	 * Text of the line containing {@code offset}, from the line start up to
	 * (excluding) {@code offset}.
	 */
	public String lineSubstring(int offset) {
		int clamped = Math.max(0, Math.min(offset, text.length()));
		int lineStart = lineStarts[positionAtOffset(clamped).getLine()];
		return text.substring(lineStart, clamped);
	}

	/**
	 * Walks the tree depth-first in document order, calling
	 * {@link TreeVisitor#preorder} before a node's children and
	 * {@link TreeVisitor#postorder} after them. Returns early once a callback
	 * answers {@link VisitResult#STOP}.
	 */
	public void traverse(TreeVisitor visitor) {
		List<Phrase> spine = new ArrayList<>();
		traverse(tree, visitor, spine, Collections.unmodifiableList(spine));
	}

	private static boolean traverse(Node node, TreeVisitor visitor, List<Phrase> spine, List<Phrase> spineView) {
		VisitResult result = visitor.preorder(node, spineView);
		if (result == VisitResult.STOP) {
			return false;
		}
		if (result == VisitResult.CONTINUE && node.isPhrase()) {
			Phrase phrase = (Phrase) node;
			spine.add(phrase);
			for (Node child : phrase.getChildren()) {
				if (!traverse(child, visitor, spine, spineView)) {
					return false;
				}
			}
			spine.remove(spine.size() - 1);
		}
		return visitor.postorder(node, spineView) != VisitResult.STOP;
	}
}
