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
package com.tomaszrup.phpls.providers;

import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.phpls.document.ParsedDocument;
import com.tomaszrup.phpls.document.ParsedDocumentStore;
import com.tomaszrup.phpls.format.ActiveWindow;
import com.tomaszrup.phpls.format.FormatVisitor;
import com.tomaszrup.phpls.format.Whitespace;

/**
 * Provides textDocument/formatting and textDocument/rangeFormatting for PHP
 * documents held by a {@link ParsedDocumentStore}.
 *
 * <p>Edits only touch whitespace and the alignment of block comments. They
 * are returned last-in-document first, so a client can apply them one after
 * another against the original offsets.</p>
 */
public class FormatProvider {
	private static final Logger logger = LoggerFactory.getLogger(FormatProvider.class);

	private final ParsedDocumentStore documentStore;

	public FormatProvider(ParsedDocumentStore documentStore) {
		this.documentStore = documentStore;
	}

	public List<TextEdit> formatDocument(String uri, FormattingOptions options) {
		ParsedDocument doc = documentStore.find(uri);
		if (doc == null) {
			logger.debug("No parsed document for {}, nothing to format", uri);
			return Collections.emptyList();
		}
		return format(doc, options, ActiveWindow.unbounded());
	}

	/**
	 * Formats the tokens between the start and end of {@code range}. Positions
	 * outside the document are clamped; a range ending before it starts
	 * produces no edits.
	 */
	public List<TextEdit> formatRange(String uri, Range range, FormattingOptions options) {
		ParsedDocument doc = documentStore.find(uri);
		if (doc == null) {
			logger.debug("No parsed document for {}, nothing to format", uri);
			return Collections.emptyList();
		}
		int startOffset = doc.offsetAtPosition(range.getStart());
		int endOffset = doc.offsetAtPosition(range.getEnd());
		if (endOffset < startOffset) {
			logger.debug("Ignoring reversed range {} for {}", range, uri);
			return Collections.emptyList();
		}
		return format(doc, options, ActiveWindow.between(startOffset, endOffset));
	}

	private List<TextEdit> format(ParsedDocument doc, FormattingOptions options, ActiveWindow window) {
		long start = System.nanoTime();
		if (options.isInsertSpaces() && options.getTabSize() < 1) {
			logger.debug("tabSize {} is below 1, using 1", options.getTabSize());
		}
		String indentUnit = Whitespace.indentUnit(options.isInsertSpaces(), options.getTabSize());
		FormatVisitor visitor = new FormatVisitor(doc, indentUnit, window);
		doc.traverse(visitor);
		List<TextEdit> edits = visitor.getEdits();
		logger.debug("Formatted {} with {} edits in {}ms", doc.getUri(), edits.size(),
				(System.nanoTime() - start) / 1_000_000);
		return edits;
	}
}
