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

/**
 * Produces a concrete syntax tree for PHP source text. Implementations are
 * supplied by the host process.
 *
 * <p>The returned tree must cover the text contiguously: every character
 * belongs to exactly one token, including whitespace and comments.</p>
 */
@FunctionalInterface
public interface PhpParser {

	/**
	 * @param text full document text
	 * @return the root phrase, never {@code null}
	 */
	Phrase parse(String text);
}
