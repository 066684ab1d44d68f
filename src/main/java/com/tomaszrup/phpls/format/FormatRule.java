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

import org.eclipse.lsp4j.Position;
import org.eclipse.lsp4j.Range;
import org.eclipse.lsp4j.TextEdit;

import com.tomaszrup.phpls.document.ParsedDocument;
import com.tomaszrup.phpls.parser.Token;
import com.tomaszrup.phpls.parser.TokenType;

/**
 * Whitespace rules applied to the gap before a token.
 *
 * <p>Each rule looks at {@code previous}, the token immediately before the
 * one being formatted. When it is whitespace the rule replaces or deletes
 * it; otherwise the rule inserts after it. A rule returns {@code null} when
 * the existing whitespace already has the expected form, so applying a rule
 * twice never produces a second edit.</p>
 *
 * <p>The {@code _OR_NEWLINE_} rules keep the number of line breaks the user
 * wrote and only normalise the indentation that follows them.</p>
 */
public enum FormatRule {

	NO_SPACE_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			if (!isWhitespace(previous)) {
				return null;
			}
			return delete(doc, previous);
		}
	},

	SINGLE_SPACE_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			if (!isWhitespace(previous)) {
				return insert(doc, previous, " ");
			}
			return replaceIfDifferent(doc, previous, " ");
		}
	},

	/** Indentation only, without touching line breaks that precede it. */
	INDENT_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			if (!isWhitespace(previous)) {
				return indentText.isEmpty() ? null : insert(doc, previous, indentText);
			}
			if (indentText.isEmpty()) {
				return delete(doc, previous);
			}
			return replaceIfDifferent(doc, previous, indentText);
		}
	},

	/** At least one line break, then the indent. */
	NEWLINE_INDENT_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			if (!isWhitespace(previous)) {
				return insert(doc, previous, "\n" + indentText);
			}
			String actual = doc.tokenText(previous);
			String expected = Whitespace.createWhitespace(
					Math.max(1, Whitespace.countNewlines(actual)), "\n") + indentText;
			return replaceIfDifferent(doc, previous, actual, expected);
		}
	},

	/** At least two line breaks (one blank line), then the indent. */
	DOUBLE_NEWLINE_INDENT_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			if (!isWhitespace(previous)) {
				return insert(doc, previous, "\n\n" + indentText);
			}
			String actual = doc.tokenText(previous);
			String expected = Whitespace.createWhitespace(
					Math.max(2, Whitespace.countNewlines(actual)), "\n") + indentText;
			return replaceIfDifferent(doc, previous, actual, expected);
		}
	},

	INDENT_OR_NEWLINE_INDENT_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			if (!isWhitespace(previous)) {
				return indentText.isEmpty() ? null : insert(doc, previous, indentText);
			}
			String actual = doc.tokenText(previous);
			int newlines = Whitespace.countNewlines(actual);
			if (newlines > 0) {
				return replaceIfDifferent(doc, previous, actual,
						Whitespace.createWhitespace(newlines, "\n") + indentText);
			}
			if (indentText.isEmpty()) {
				return delete(doc, previous);
			}
			return replaceIfDifferent(doc, previous, actual, indentText);
		}
	},

	NO_SPACE_OR_NEWLINE_INDENT_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			return noSpaceOrNewlineIndent(previous, doc, indentText);
		}
	},

	NO_SPACE_OR_NEWLINE_INDENT_PLUS_ONE_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			return noSpaceOrNewlineIndent(previous, doc, indentText + indentUnit);
		}
	},

	SINGLE_SPACE_OR_NEWLINE_INDENT_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			return singleSpaceOrNewlineIndent(previous, doc, indentText);
		}
	},

	/** The fallback rule: continuation lines sit one level deeper. */
	SINGLE_SPACE_OR_NEWLINE_INDENT_PLUS_ONE_BEFORE {
		@Override
		public TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit) {
			return singleSpaceOrNewlineIndent(previous, doc, indentText + indentUnit);
		}
	};

	/**
	 * @param previous    the token before the one being formatted
	 * @param doc         document owning {@code previous}
	 * @param indentText  indentation of the current nesting level
	 * @param indentUnit  one level of indentation
	 * @return the edit, or {@code null} when the whitespace is already right
	 */
	public abstract TextEdit apply(Token previous, ParsedDocument doc, String indentText, String indentUnit);

	private static TextEdit noSpaceOrNewlineIndent(Token previous, ParsedDocument doc, String indent) {
		if (!isWhitespace(previous)) {
			return null;
		}
		String actual = doc.tokenText(previous);
		int newlines = Whitespace.countNewlines(actual);
		if (newlines == 0) {
			return delete(doc, previous);
		}
		return replaceIfDifferent(doc, previous, actual, Whitespace.createWhitespace(newlines, "\n") + indent);
	}

	private static TextEdit singleSpaceOrNewlineIndent(Token previous, ParsedDocument doc, String indent) {
		if (!isWhitespace(previous)) {
			return insert(doc, previous, " ");
		}
		String actual = doc.tokenText(previous);
		int newlines = Whitespace.countNewlines(actual);
		if (newlines == 0) {
			return replaceIfDifferent(doc, previous, actual, " ");
		}
		return replaceIfDifferent(doc, previous, actual, Whitespace.createWhitespace(newlines, "\n") + indent);
	}

	private static boolean isWhitespace(Token token) {
		return token.is(TokenType.WHITESPACE);
	}

	private static TextEdit insert(ParsedDocument doc, Token previous, String text) {
		Position at = doc.positionAtOffset(previous.getEnd());
		return new TextEdit(new Range(at, at), text);
	}

	private static TextEdit delete(ParsedDocument doc, Token previous) {
		return new TextEdit(doc.tokenRange(previous), "");
	}

	private static TextEdit replaceIfDifferent(ParsedDocument doc, Token previous, String expected) {
		return replaceIfDifferent(doc, previous, doc.tokenText(previous), expected);
	}

	private static TextEdit replaceIfDifferent(ParsedDocument doc, Token previous, String actual, String expected) {
		if (actual.equals(expected)) {
			return null;
		}
		return new TextEdit(doc.tokenRange(previous), expected);
	}
}
