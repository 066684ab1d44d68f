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

import org.eclipse.lsp4j.DocumentFormattingParams;
import org.eclipse.lsp4j.DocumentRangeFormattingParams;
import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.phpls.providers.FormatProvider;

/**
 * Handles LSP document and range formatting requests.
 * Extracted from {@link PhpServices} for single-responsibility.
 */
class FormattingHandler {
	private static final Logger logger = LoggerFactory.getLogger(FormattingHandler.class);

	private final FormatProvider formatProvider;

	FormattingHandler(FormatProvider formatProvider) {
		this.formatProvider = formatProvider;
	}

	@SuppressWarnings("java:S1452")
	CompletableFuture<List<? extends TextEdit>> formatting(DocumentFormattingParams params) {
		String uri = params.getTextDocument().getUri();
		try {
			return CompletableFuture.completedFuture(formatProvider.formatDocument(uri, params.getOptions()));
		} catch (RuntimeException e) {
			logger.warn("Formatting failed for {}: {}", uri, e.getMessage());
			logger.debug("Formatting failure details", e);
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
	}

	@SuppressWarnings("java:S1452")
	CompletableFuture<List<? extends TextEdit>> rangeFormatting(DocumentRangeFormattingParams params) {
		String uri = params.getTextDocument().getUri();
		try {
			return CompletableFuture.completedFuture(
					formatProvider.formatRange(uri, params.getRange(), params.getOptions()));
		} catch (RuntimeException e) {
			logger.warn("Range formatting failed for {}: {}", uri, e.getMessage());
			logger.debug("Range formatting failure details", e);
			return CompletableFuture.completedFuture(Collections.emptyList());
		}
	}
}
