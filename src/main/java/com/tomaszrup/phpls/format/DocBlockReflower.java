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
package com.tomaszrup.phpls.format;

import java.util.regex.Matcher;
import java.util.regex.Pattern;

import org.eclipse.lsp4j.TextEdit;

import com.tomaszrup.phpls.document.ParsedDocument;
import com.tomaszrup.phpls.parser.Token;

/**
 * Re-aligns the {@code *} continuation lines of block and doc comments to
 * the surrounding indentation:
 *
 * <pre>
 * /**
 *  * Text
 *  *&#47;
 * </pre>
 *
 * Only the whitespace in front of each {@code *} changes.
 */
public final class DocBlockReflower {

	private static final Pattern CONTINUATION_LINE = Pattern.compile("(?:\\r\\n|\\r|\\n)[ \\t]*\\*");

	private DocBlockReflower() {
	}

	/**
	 * Rewrites {@code text} so that every line starting with {@code *} is
	 * indented by {@code indentText} plus one space.
	 */
	public static String reflow(String text, String indentText) {
		Matcher matcher = CONTINUATION_LINE.matcher(text);
		return matcher.replaceAll(Matcher.quoteReplacement("\n" + indentText + " *"));
	}

	/**
	 * @return a replace edit over the whole comment, or {@code null} when the
	 *         comment is already aligned
	 */
	public static TextEdit reflow(Token comment, ParsedDocument doc, String indentText) {
		String text = doc.tokenText(comment);
		String formatted = reflow(text, indentText);
		if (formatted.equals(text)) {
			return null;
		}
		return new TextEdit(doc.tokenRange(comment), formatted);
	}
}
