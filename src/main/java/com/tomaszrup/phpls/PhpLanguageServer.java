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

import org.eclipse.lsp4j.*;
import org.eclipse.lsp4j.jsonrpc.Launcher;
import org.eclipse.lsp4j.services.*;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.phpls.parser.PhpParser;

import java.io.*;
import java.util.concurrent.*;
import java.util.concurrent.Future;

/**
 * Language server exposing PHP document and range formatting. The PHP
 * parser is supplied by the host application.
 */
public class PhpLanguageServer implements LanguageServer, LanguageClientAware {

    private static final Logger logger = LoggerFactory.getLogger(PhpLanguageServer.class);

    /**
     * Runs a server for {@code parser} over the given streams and blocks
     * until the connection ends.
     */
    public static void startServer(PhpParser parser, InputStream in, OutputStream out) {
        PhpLanguageServer server = new PhpLanguageServer(parser);
        Launcher<LanguageClient> launcher = Launcher.createLauncher(server, LanguageClient.class, in, out);
        server.connect(launcher.getRemoteProxy());

        Future<Void> future = launcher.startListening();
        try {
            future.get();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            logger.info("Language server listener interrupted");
        } catch (ExecutionException e) {
            logger.error("Language server listener terminated with error: {}",
                    e.getCause() != null ? e.getCause().getMessage() : e.getMessage(), e);
        }
    }

    private final PhpServices phpServices;

    public PhpLanguageServer(PhpParser parser) {
        this.phpServices = new PhpServices(parser);
    }

    @Override
    public CompletableFuture<InitializeResult> initialize(InitializeParams params) {
        InitializationOptionsParser.ParsedOptions options =
                InitializationOptionsParser.parse(params.getInitializationOptions());
        if (options != null && options.formatEnabled != null) {
            phpServices.setFormattingEnabled(options.formatEnabled);
        }

        ServerCapabilities serverCapabilities = new ServerCapabilities();
        serverCapabilities.setTextDocumentSync(TextDocumentSyncKind.Incremental);
        serverCapabilities.setDocumentFormattingProvider(true);
        serverCapabilities.setDocumentRangeFormattingProvider(true);

        logger.info("PHP formatting server initialized");
        return CompletableFuture.completedFuture(new InitializeResult(serverCapabilities));
    }

    @Override
    public CompletableFuture<Object> shutdown() {
        logger.info("PHP formatting server shutting down, {} documents open",
                phpServices.getDocumentStore().size());
        return CompletableFuture.completedFuture(new Object());
    }

    @Override
    public void exit() {
        System.exit(0);
    }

    @Override
    public TextDocumentService getTextDocumentService() {
        return phpServices;
    }

    @Override
    public WorkspaceService getWorkspaceService() {
        return phpServices;
    }

    @Override
    public void connect(LanguageClient client) {
        phpServices.connect(client);
    }
}
