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

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.FormattingOptions;
import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextDocumentContentChangeEvent;
import org.eclipse.lsp4j.TextDocumentIdentifier;
import org.eclipse.lsp4j.TextDocumentItem;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.VersionedTextDocumentIdentifier;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import com.google.gson.JsonObject;
import com.tomaszrup.phpls.parser.PhpParser;
import com.tomaszrup.phpls.parser.Phrase;
import com.tomaszrup.phpls.parser.PhraseType;
import com.tomaszrup.phpls.parser.TokenType;

class PhpServicesTests {
	private static final String LANGUAGE_PHP = "php";
	private static final String URI_FILE = "file:///workspace/src/call.php";

	/** {@code f($a,$b);} */
	private String compactText;
	/** {@code f($a, $b);} */
	private String formattedText;

	private PhpServices services;

	/**
	 * Parser that only knows the fixture texts registered in
	 * {@link #setup()}.
	 */
	private static final class FixtureParser implements PhpParser {
		private final Map<String, Phrase> trees = new HashMap<>();

		String register(PhpTreeBuilder builder, Phrase root) {
			trees.put(builder.text(), root);
			return builder.text();
		}

		@Override
		public Phrase parse(String text) {
			Phrase tree = trees.get(text);
			if (tree == null) {
				throw new IllegalArgumentException("No fixture tree for text: " + text);
			}
			return tree;
		}
	}

	/** Tokens take their offsets in creation order, so the argument list is built in place. */
	private static Phrase call(PhpTreeBuilder b, boolean spaced) {
		return b.phrase(PhraseType.STATEMENT_LIST,
				b.openTag(),
				b.phrase(PhraseType.EXPRESSION_STATEMENT,
						b.phrase(PhraseType.FUNCTION_CALL_EXPRESSION,
								b.name("f"),
								b.token(TokenType.OPEN_PARENTHESIS, "("),
								arguments(b, spaced),
								b.token(TokenType.CLOSE_PARENTHESIS, ")")),
						b.token(TokenType.SEMICOLON, ";")));
	}

	private static Phrase arguments(PhpTreeBuilder b, boolean spaced) {
		if (spaced) {
			return b.phrase(PhraseType.ARGUMENT_EXPRESSION_LIST,
					b.variable("$a"), b.token(TokenType.COMMA, ","), b.ws(" "), b.variable("$b"));
		}
		return b.phrase(PhraseType.ARGUMENT_EXPRESSION_LIST,
				b.variable("$a"), b.token(TokenType.COMMA, ","), b.variable("$b"));
	}

	@BeforeEach
	void setup() {
		FixtureParser parser = new FixtureParser();
		PhpTreeBuilder compact = new PhpTreeBuilder();
		compactText = parser.register(compact, call(compact, false));
		PhpTreeBuilder formatted = new PhpTreeBuilder();
		formattedText = parser.register(formatted, call(formatted, true));

		services = new PhpServices(parser);
		services.connect(new TestLanguageClient());
	}

	@AfterEach
	void tearDown() {
		services = null;
	}

	private void open(String text) {
		DidOpenTextDocumentParams params = new DidOpenTextDocumentParams();
		params.setTextDocument(new TextDocumentItem(URI_FILE, LANGUAGE_PHP, 1, text));
		services.didOpen(params);
	}

	private List<? extends TextEdit> format() throws Exception {
		DocumentFormattingParams params = new DocumentFormattingParams();
		params.setTextDocument(new TextDocumentIdentifier(URI_FILE));
		params.setOptions(new FormattingOptions(4, true));
		return services.formatting(params).get();
	}

	private static JsonObject formatSettings(boolean enable) {
		JsonObject format = new JsonObject();
		format.addProperty("enable", enable);
		JsonObject php = new JsonObject();
		php.add("format", format);
		JsonObject settings = new JsonObject();
		settings.add("php", php);
		return settings;
	}

	// --- formatting ---

	@Test
	void testFixtureTextsFollowDocumentOrder() {
		Assertions.assertEquals("<?php\nf($a,$b);", compactText);
		Assertions.assertEquals("<?php\nf($a, $b);", formattedText);
	}

	@Test
	void testFormattingOpenDocument() throws Exception {
		open(compactText);
		List<? extends TextEdit> edits = format();
		Assertions.assertEquals(formattedText, TestEdits.apply(compactText, edits));
	}

	@Test
	void testFormattingFormattedDocumentReturnsNoEdits() throws Exception {
		open(formattedText);
		Assertions.assertTrue(format().isEmpty());
	}

	@Test
	void testFormattingUnknownDocumentReturnsNoEdits() throws Exception {
		Assertions.assertTrue(format().isEmpty());
	}

	@Test
	void testRangeFormatting() throws Exception {
		open(compactText);
		DocumentRangeFormattingParams params = new DocumentRangeFormattingParams();
		params.setTextDocument(new TextDocumentIdentifier(URI_FILE));
		params.setRange(new Range(new Position(1, 0), new Position(1, 9)));
		params.setOptions(new FormattingOptions(4, true));

		List<? extends TextEdit> edits = services.rangeFormatting(params).get();

		Assertions.assertEquals(formattedText, TestEdits.apply(compactText, edits));
	}

	@Test
	void testUnparseableDocumentIsNotFormatted() throws Exception {
		open("<?php f(");
		Assertions.assertFalse(services.getDocumentStore().has(URI_FILE));
		Assertions.assertTrue(format().isEmpty());
	}

	// --- document sync ---

	@Test
	void testDidChangeReparsesDocument() throws Exception {
		open(compactText);
		DidChangeTextDocumentParams params = new DidChangeTextDocumentParams();
		params.setTextDocument(new VersionedTextDocumentIdentifier(URI_FILE, 2));
		TextDocumentContentChangeEvent change = new TextDocumentContentChangeEvent();
		change.setText(" ");
		change.setRange(new Range(new Position(1, 5), new Position(1, 5)));
		params.setContentChanges(List.of(change));
		services.didChange(params);

		Assertions.assertEquals(formattedText, services.getDocumentStore().find(URI_FILE).getText());
		Assertions.assertTrue(format().isEmpty());
	}

	@Test
	void testDidCloseForgetsDocument() throws Exception {
		open(compactText);
		DidCloseTextDocumentParams params = new DidCloseTextDocumentParams();
		params.setTextDocument(new TextDocumentIdentifier(URI_FILE));
		services.didClose(params);

		Assertions.assertFalse(services.getDocumentStore().has(URI_FILE));
		Assertions.assertTrue(format().isEmpty());
	}

	// --- configuration ---

	@Test
	void testFormattingCanBeDisabledByConfiguration() throws Exception {
		open(compactText);
		services.didChangeConfiguration(new DidChangeConfigurationParams(formatSettings(false)));
		Assertions.assertFalse(services.isFormattingEnabled());
		Assertions.assertTrue(format().isEmpty());

		services.didChangeConfiguration(new DidChangeConfigurationParams(formatSettings(true)));
		Assertions.assertTrue(services.isFormattingEnabled());
		Assertions.assertEquals(1, format().size());
	}

	@Test
	void testMalformedConfigurationIsIgnored() {
		JsonObject settings = new JsonObject();
		settings.addProperty("php", "not an object");
		services.didChangeConfiguration(new DidChangeConfigurationParams(settings));
		Assertions.assertTrue(services.isFormattingEnabled());
	}

	@Test
	void testConnectStoresClient() {
		TestLanguageClient client = new TestLanguageClient();
		services.connect(client);
		Assertions.assertSame(client, services.getLanguageClient());
	}
}
