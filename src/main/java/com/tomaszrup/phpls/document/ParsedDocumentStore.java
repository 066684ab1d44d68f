////////////////////////////////////////////////////////////////////////////////
// Copyright 2022 Prominic.NET, Inc.
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
// Author: Tomasz Rup (originally Prominic.NET, Inc.)
// No warranty of merchantability or fitness of any kind.
// Use this software at your own risk.
////////////////////////////////////////////////////////////////////////////////
package com.tomaszrup.phpls.document;

import java.net.URI;
import java.net.URISyntaxException;
import java.util.Collections;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;

import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.lsp.utils.Positions;
import com.tomaszrup.phpls.parser.PhpParser;
import com.tomaszrup.phpls.parser.Phrase;

/**
 * Thread-safe store of the parsed documents that are open in the editor.
 *
 * <p>Uses {@link ConcurrentHashMap} internally so formatting requests can
 * read documents while change notifications replace them. Documents are
 * immutable snapshots: a change re-parses the new text through the
 * {@link PhpParser} and swaps the entry atomically.</p>
 */
public class ParsedDocumentStore {
	private static final Logger logger = LoggerFactory.getLogger(ParsedDocumentStore.class);

	private final ConcurrentHashMap<URI, ParsedDocument> documents = new ConcurrentHashMap<>();
	private final PhpParser parser;

	public ParsedDocumentStore(PhpParser parser) {
		this.parser = parser;
	}

	public Set<URI> getOpenURIs() {
		return Collections.unmodifiableSet(documents.keySet());
	}

	public int size() {
		return documents.size();
	}

	public boolean has(String uri) {
		URI key = toKey(uri);
		return key != null && documents.containsKey(key);
	}

	/**
	 * Returns the document for {@code uri}, or {@code null} when the URI is
	 * unknown or malformed.
	 */
	public ParsedDocument find(String uri) {
		URI key = toKey(uri);
		return key != null ? documents.get(key) : null;
	}

	public void add(ParsedDocument document) {
		URI key = toKey(document.getUri());
		if (key == null) {
			throw new IllegalArgumentException("Malformed document URI: " + document.getUri());
		}
		documents.put(key, document);
	}

	public void remove(String uri) {
		URI key = toKey(uri);
		if (key != null) {
			documents.remove(key);
		}
	}

	public void didOpen(DidOpenTextDocumentParams params) {
		String uri = params.getTextDocument().getUri();
		URI key = toKey(uri);
		if (key == null) {
			return;
		}
		ParsedDocument document = parse(uri, params.getTextDocument().getText());
		if (document != null) {
			documents.put(key, document);
		} else {
			documents.remove(key);
		}
	}

	/**
	 * Applies incremental or full-content changes and re-parses, atomically
	 * per document using {@link ConcurrentHashMap#compute}.
	 */
	public void didChange(DidChangeTextDocumentParams params) {
		String uri = params.getTextDocument().getUri();
		URI key = toKey(uri);
		if (key == null) {
			return;
		}
		documents.compute(key, (k, current) -> {
			String currentText = current != null ? current.getText() : null;
			for (TextDocumentContentChangeEvent change : params.getContentChanges()) {
				currentText = applyChange(currentText, change);
			}
			return currentText != null ? parse(uri, currentText) : null;
		});
	}

	public void didClose(DidCloseTextDocumentParams params) {
		remove(params.getTextDocument().getUri());
	}

	private static String applyChange(String currentText, TextDocumentContentChangeEvent change) {
		Range range = change.getRange();
		if (range == null) {
			// full content replacement
			return change.getText();
		}
		if (currentText == null) {
			logger.debug("Ignoring ranged change {} for a document that is not open", range);
			return null;
		}
		int offsetStart = Positions.getOffset(currentText, range.getStart());
		int offsetEnd = Positions.getOffset(currentText, range.getEnd());
		if (offsetStart < 0 || offsetEnd < 0 || offsetStart > offsetEnd) {
			logger.debug("Invalid change range {}, treating the change as full content", range);
			return change.getText();
		}
		StringBuilder builder = new StringBuilder();
		builder.append(currentText, 0, offsetStart);
		builder.append(change.getText());
		builder.append(currentText.substring(offsetEnd));
		return builder.toString();
	}

	private ParsedDocument parse(String uri, String text) {
		long start = System.nanoTime();
		try {
			Phrase tree = parser.parse(text);
			if (tree == null) {
				logger.warn("Parser returned no tree for {}", uri);
				return null;
			}
			logger.debug("Parsed {} ({} chars) in {}ms", uri, text.length(), (System.nanoTime() - start) / 1_000_000);
			return new ParsedDocument(uri, text, tree);
		} catch (RuntimeException e) {
			logger.warn("Failed to parse {}: {}", uri, e.getMessage());
			logger.debug("Parse failure details", e);
			return null;
		}
	}

	private static URI toKey(String uri) {
		if (uri == null) {
			return null;
		}
		try {
			return new URI(uri);
		} catch (URISyntaxException e) {
			logger.debug("Ignoring malformed document URI {}: {}", uri, e.getMessage());
			return null;
		}
	}
}
