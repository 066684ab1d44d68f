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
package com.tomaszrup.phpls;

import java.util.Collections;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicReference;

import org.eclipse.lsp4j.DidChangeConfigurationParams;
import org.eclipse.lsp4j.DidChangeTextDocumentParams;
import org.eclipse.lsp4j.DidChangeWatchedFilesParams;
import org.eclipse.lsp4j.DidCloseTextDocumentParams;
import org.eclipse.lsp4j.DidOpenTextDocumentParams;
import org.eclipse.lsp4j.DidSaveTextDocumentParams;
import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.TextEdit;
import org.eclipse.lsp4j.services.LanguageClient;
import org.eclipse.lsp4j.services.LanguageClientAware;
import org.eclipse.lsp4j.services.TextDocumentService;
import org.eclipse.lsp4j.services.WorkspaceService;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.phpls.document.ParsedDocumentStore;
import com.tomaszrup.phpls.parser.PhpParser;
import com.tomaszrup.phpls.providers.FormatProvider;

/**
 * Thin facade implementing the LSP {@link TextDocumentService},
 * {@link WorkspaceService}, and {@link LanguageClientAware} interfaces.
 * Document synchronisation goes to {@link ParsedDocumentStore}, formatting
 * requests to {@link FormattingHandler}.
 */
public class PhpServices implements TextDocumentService, WorkspaceService, LanguageClientAware {
	private static final Logger logger = LoggerFactory.getLogger(PhpServices.class);

	private final ParsedDocumentStore documentStore;
	private final FormattingHandler formattingHandler;
	private final ConfigurationChangeHandler configChangeHandler = new ConfigurationChangeHandler();

	private final AtomicReference<LanguageClient> languageClient = new AtomicReference<>();

	public PhpServices(PhpParser parser) {
		this(new ParsedDocumentStore(parser));
	}

	PhpServices(ParsedDocumentStore documentStore) {
		this.documentStore = documentStore;
		this.formattingHandler = new FormattingHandler(new FormatProvider(documentStore));
	}

	// --- Lifecycle / wiring ---

	@Override
	public void connect(LanguageClient client) {
		this.languageClient.set(client);
	}

	LanguageClient getLanguageClient() {
		return languageClient.get();
	}

	public ParsedDocumentStore getDocumentStore() {
		return documentStore;
	}

	public boolean isFormattingEnabled() {
		return configChangeHandler.isFormattingEnabled();
	}

	public void setFormattingEnabled(boolean enabled) {
		configChangeHandler.setFormattingEnabled(enabled);
	}

	// --- TextDocumentService notifications ---

	@Override
	public void didOpen(DidOpenTextDocumentParams params) {
		try {
			documentStore.didOpen(params);
		} catch (RuntimeException e) {
			// keep the connection alive, the document just stays unknown
			logger.warn("Unexpected exception during didOpen for {}: {}",
					params.getTextDocument().getUri(), e.getMessage());
			logger.debug("didOpen exception details", e);
		}
	}

	@Override
	public void didChange(DidChangeTextDocumentParams params) {
		try {
			documentStore.didChange(params);
		} catch (RuntimeException e) {
			logger.warn("Unexpected exception during didChange for {}: {}",
					params.getTextDocument().getUri(), e.getMessage());
			logger.debug("didChange exception details", e);
		}
	}

	@Override
	public void didClose(DidCloseTextDocumentParams params) {
		documentStore.didClose(params);
	}

	@Override
	public void didSave(DidSaveTextDocumentParams params) {
		// nothing to handle on save at this time
	}

	// --- WorkspaceService notifications ---

	@Override
	public void didChangeWatchedFiles(DidChangeWatchedFilesParams params) {
		// only open documents are formatted, files on disk are not tracked
	}

	@Override
	public void didChangeConfiguration(DidChangeConfigurationParams params) {
		configChangeHandler.handleConfigurationChange(params.getSettings());
	}

	// --- TextDocumentService requests ---

	@Override
	public CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		if (!configChangeHandler.isFormattingEnabled()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		return formattingHandler.formatting(params);
	}

	@Override
	public CompletableFuture<List<? extends TextEdit>> rangeFormatting(DocumentRangeFormattingParams params) {
		if (!configChangeHandler.isFormattingEnabled()) {
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
		return formattingHandler.rangeFormatting(params);
	}
}
