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
 * Lexical categories produced by the PHP lexer. Whitespace and comments are
 * real tokens in the tree, so the formatter can see and rewrite them.
 */
public enum TokenType {
	UNDEFINED,

	// keywords
	ABSTRACT,
	ARRAY,
	AS,
	BREAK,
	CALLABLE,
	CASE,
	CATCH,
	CLASS,
	CLASS_CONSTANT,
	CLONE,
	CONST,
	CONTINUE,
	DECLARE,
	DEFAULT,
	DO,
	ECHO,
	ELSE,
	ELSE_IF,
	EMPTY,
	END_DECLARE,
	END_FOR,
	END_FOREACH,
	END_IF,
	END_SWITCH,
	END_WHILE,
	END_OF_FILE,
	EVAL,
	EXIT,
	EXTENDS,
	FINAL,
	FINALLY,
	FOR,
	FOREACH,
	FUNCTION,
	GLOBAL,
	GOTO,
	HALT_COMPILER,
	IF,
	IMPLEMENTS,
	INCLUDE,
	INCLUDE_ONCE,
	INSTANCE_OF,
	INSTEAD_OF,
	INTERFACE,
	ISSET,
	LIST,
	AND,
	OR,
	XOR,
	NAMESPACE,
	NEW,
	PRINT,
	PRIVATE,
	PUBLIC,
	PROTECTED,
	REQUIRE,
	REQUIRE_ONCE,
	RETURN,
	STATIC,
	SWITCH,
	THROW,
	TRAIT,
	TRY,
	UNSET,
	USE,
	VAR,
	WHILE,
	YIELD,
	YIELD_FROM,

	// magic constants
	DIRECTORY_CONSTANT,
	FILE_CONSTANT,
	LINE_CONSTANT,
	FUNCTION_CONSTANT,
	METHOD_CONSTANT,
	NAMESPACE_CONSTANT,
	TRAIT_CONSTANT,

	// literals and names
	STRING_LITERAL,
	FLOATING_LITERAL,
	INTEGER_LITERAL,
	VARIABLE_NAME,
	NAME,
	ENCAPSULATED_AND_WHITESPACE,
	HEREDOC_START,
	HEREDOC_END,
	DOUBLE_QUOTE,
	BACKTICK,

	// casts
	ARRAY_CAST,
	BOOLEAN_CAST,
	FLOAT_CAST,
	INTEGER_CAST,
	OBJECT_CAST,
	STRING_CAST,
	UNSET_CAST,

	// punctuation and operators
	OPEN_BRACE,
	CLOSE_BRACE,
	OPEN_BRACKET,
	CLOSE_BRACKET,
	OPEN_PARENTHESIS,
	CLOSE_PARENTHESIS,
	CURLY_OPEN,
	DOLLAR_CURLY_OPEN,
	SEMICOLON,
	COLON,
	COLON_COLON,
	COMMA,
	DOT,
	ARROW,
	FAT_ARROW,
	ELLIPSIS,
	QUESTION,
	COALESCE,
	SPACESHIP,
	TILDE,
	EXCLAMATION,
	AT_SYMBOL,
	BACKSLASH,
	DOLLAR,
	PLUS,
	MINUS,
	ASTERISK,
	ASTERISK_ASTERISK,
	FORWARD_SLASH,
	PERCENT,
	AMPERSAND,
	AMPERSAND_AMPERSAND,
	BAR,
	BAR_BAR,
	CARET,
	LESS_THAN,
	LESS_THAN_EQUALS,
	LESS_THAN_LESS_THAN,
	GREATER_THAN,
	GREATER_THAN_EQUALS,
	GREATER_THAN_GREATER_THAN,
	EQUALS,
	EQUALS_EQUALS,
	EQUALS_EQUALS_EQUALS,
	EXCLAMATION_EQUALS,
	EXCLAMATION_EQUALS_EQUALS,
	PLUS_PLUS,
	MINUS_MINUS,
	PLUS_EQUALS,
	MINUS_EQUALS,
	ASTERISK_EQUALS,
	ASTERISK_ASTERISK_EQUALS,
	FORWARD_SLASH_EQUALS,
	DOT_EQUALS,
	PERCENT_EQUALS,
	AMPERSAND_EQUALS,
	BAR_EQUALS,
	CARET_EQUALS,
	LESS_THAN_LESS_THAN_EQUALS,
	GREATER_THAN_GREATER_THAN_EQUALS,
	COALESCE_EQUALS,

	// hidden and inline
	COMMENT,
	DOCUMENT_COMMENT,
	WHITESPACE,
	OPEN_TAG,
	OPEN_TAG_ECHO,
	CLOSE_TAG,
	TEXT
}
