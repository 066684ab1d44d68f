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

import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextEdit;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import com.tomaszrup.phpls.document.ParsedDocumentStore;
import com.tomaszrup.phpls.providers.FormatProvider;

class FormattingHandlerTests {
	private static final String URI_FILE = "file:///workspace/a.php";

	/** Provider whose every request fails. */
	private static final class FailingFormatProvider extends FormatProvider {
		FailingFormatProvider() {
			super(new ParsedDocumentStore(text -> {
				throw new UnsupportedOperationException();
			}));
		}

		@Override
		public List<TextEdit> formatDocument(String uri, FormattingOptions options) {
			throw new IllegalStateException("broken tree");
		}

		@Override
		public List<TextEdit> formatRange(String uri, Range range, FormattingOptions options) {
			throw new IllegalStateException("broken tree");
		}
	}

	@Test
	void testFormattingFailureReturnsNoEdits() throws Exception {
		FormattingHandler handler = new FormattingHandler(new FailingFormatProvider());
		DocumentFormattingParams params = new DocumentFormattingParams();
		params.setTextDocument(new TextDocumentIdentifier(URI_FILE));
		params.setOptions(new FormattingOptions(4, true));

		Assertions.assertEquals(Collections.emptyList(), handler.formatting(params).get());
	}

	@Test
	void testRangeFormattingFailureReturnsNoEdits() throws Exception {
		FormattingHandler handler = new FormattingHandler(new FailingFormatProvider());
		DocumentRangeFormattingParams params = new DocumentRangeFormattingParams();
		params.setTextDocument(new TextDocumentIdentifier(URI_FILE));
		params.setRange(new Range(new Position(0, 0), new Position(0, 1)));
		params.setOptions(new FormattingOptions(4, true));

		Assertions.assertEquals(Collections.emptyList(), handler.rangeFormatting(params).get());
	}
}
