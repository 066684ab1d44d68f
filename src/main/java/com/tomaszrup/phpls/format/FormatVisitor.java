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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import org.eclipse.lsp4j.TextEdit;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tomaszrup.phpls.document.ParsedDocument;
import com.tomaszrup.phpls.document.TreeVisitor;
import com.tomaszrup.phpls.document.VisitResult;
import com.tomaszrup.phpls.parser.Node;
import com.tomaszrup.phpls.parser.Phrase;
import com.tomaszrup.phpls.parser.PhraseType;
import com.tomaszrup.phpls.parser.Token;
import com.tomaszrup.phpls.parser.TokenType;

/**
 * Single-pass formatter over a {@link ParsedDocument}.
 *
 * <p>Phrases set up context on the way down (pending rules, multi-line list
 * state, indentation). Every token then picks a {@link FormatRule} for the
 * gap between itself and the previous token, and on the way back up decides
 * the rule for the gap after it. Edits accumulate in document order; use
 * {@link #getEdits()} to get them in the order they can be applied.</p>
 *
 * <p>A visitor is good for one traversal.</p>
 */
public class FormatVisitor implements TreeVisitor {
	private static final Logger logger = LoggerFactory.getLogger(FormatVisitor.class);

	private static final Phrase ROOT_PARENT = new Phrase(PhraseType.UNKNOWN, Collections.<Node>emptyList());

	private final ParsedDocument doc;
	private final IndentationContext indent;
	private final ActiveWindow window;
	private final FormatState state = new FormatState();
	private final List<TextEdit> edits = new ArrayList<>();

	public FormatVisitor(ParsedDocument doc, String indentUnit) {
		this(doc, indentUnit, ActiveWindow.unbounded());
	}

	public FormatVisitor(ParsedDocument doc, String indentUnit, ActiveWindow window) {
		this.doc = doc;
		this.indent = new IndentationContext(indentUnit);
		this.window = window;
	}

	/**
	 * @return the collected edits, last edit in the document first
	 */
	public List<TextEdit> getEdits() {
		List<TextEdit> reversed = new ArrayList<>(edits);
		Collections.reverse(reversed);
		return reversed;
	}

	@Override
	public VisitResult preorder(Node node, List<Phrase> spine) {
		Phrase parent = parentOf(spine);
		if (node.isPhrase()) {
			preorderPhrase((Phrase) node, parent);
			return VisitResult.CONTINUE;
		}

		Token token = (Token) node;
		FormatRule rule = state.takePendingRule();
		Token previous = state.advance(token);
		if (previous == null) {
			return VisitResult.CONTINUE;
		}

		window.openIfStarted(token);

		switch (token.getTokenType()) {
			case WHITESPACE:
				state.setPendingRule(rule);
				return VisitResult.CONTINUE;

			case COMMENT:
				return VisitResult.CONTINUE;

			case DOCUMENT_COMMENT:
				rule = FormatRule.NEWLINE_INDENT_BEFORE;
				break;

			case PLUS_PLUS:
				if (parent.is(PhraseType.POSTFIX_INCREMENT_EXPRESSION)) {
					rule = FormatRule.NO_SPACE_BEFORE;
				}
				break;

			case MINUS_MINUS:
				if (parent.is(PhraseType.POSTFIX_DECREMENT_EXPRESSION)) {
					rule = FormatRule.NO_SPACE_BEFORE;
				}
				break;

			case BACKSLASH:
				if (parent.is(PhraseType.NAMESPACE_NAME)) {
					rule = FormatRule.NO_SPACE_BEFORE;
				}
				break;

			case SEMICOLON:
			case COMMA:
			case TEXT:
			case ENCAPSULATED_AND_WHITESPACE:
			case DOLLAR_CURLY_OPEN:
			case CURLY_OPEN:
				rule = FormatRule.NO_SPACE_BEFORE;
				break;

			case OPEN_TAG:
			case OPEN_TAG_ECHO:
				rule = FormatRule.NO_SPACE_BEFORE;
				indent.reset(openTagDepth(token));
				break;

			case ELSE:
			case ELSE_IF:
				if (parent.hasTokenChild(TokenType.COLON)) {
					rule = FormatRule.SINGLE_SPACE_BEFORE;
				}
				break;

			case WHILE:
				if (parent.is(PhraseType.DO_STATEMENT)) {
					rule = FormatRule.SINGLE_SPACE_BEFORE;
				}
				break;

			case CATCH:
				rule = FormatRule.SINGLE_SPACE_BEFORE;
				break;

			case ARROW:
			case COLON_COLON:
				rule = FormatRule.NO_SPACE_OR_NEWLINE_INDENT_PLUS_ONE_BEFORE;
				break;

			case OPEN_PARENTHESIS:
				rule = isCallLikeParenthesis(parent) ? FormatRule.NO_SPACE_BEFORE : FormatRule.SINGLE_SPACE_BEFORE;
				break;

			case OPEN_BRACKET:
				if (parent.is(PhraseType.SUBSCRIPT_EXPRESSION)) {
					rule = FormatRule.NO_SPACE_BEFORE;
				}
				break;

			case CLOSE_BRACE:
				decrementIndent(token);
				if (isInlineBraceParent(parent)) {
					rule = FormatRule.NO_SPACE_BEFORE;
				} else {
					rule = FormatRule.NEWLINE_INDENT_BEFORE;
				}
				break;

			case CLOSE_BRACKET:
			case CLOSE_PARENTHESIS:
				if (rule == null) {
					rule = FormatRule.NO_SPACE_BEFORE;
				}
				break;

			case CLOSE_TAG:
				if (previous.is(TokenType.COMMENT) && !isBlockComment(previous)) {
					rule = FormatRule.NO_SPACE_BEFORE;
				} else if (rule != FormatRule.INDENT_OR_NEWLINE_INDENT_BEFORE) {
					rule = FormatRule.SINGLE_SPACE_OR_NEWLINE_INDENT_BEFORE;
				}
				break;

			default:
				break;
		}

		if (rule == null) {
			rule = FormatRule.SINGLE_SPACE_OR_NEWLINE_INDENT_PLUS_ONE_BEFORE;
		}

		if (window.isActive()) {
			TextEdit edit = rule.apply(previous, doc, indent.getText(), indent.getUnit());
			if (edit != null) {
				int from = previous.is(TokenType.WHITESPACE) ? previous.getOffset() : previous.getEnd();
				addEdit(edit, from, previous.getEnd());
			}
		}
		return VisitResult.CONTINUE;
	}

	private void preorderPhrase(Phrase phrase, Phrase parent) {
		switch (phrase.getPhraseType()) {
			case FUNCTION_DECLARATION_BODY:
				if (!parent.is(PhraseType.ANONYMOUS_FUNCTION_CREATION_EXPRESSION)) {
					state.setPendingRule(FormatRule.SINGLE_SPACE_BEFORE);
				}
				break;

			case METHOD_DECLARATION_BODY:
			case CLASS_DECLARATION_BODY:
			case TRAIT_DECLARATION_BODY:
			case INTERFACE_DECLARATION_BODY:
				state.setPendingRule(FormatRule.NEWLINE_INDENT_BEFORE);
				break;

			case PARAMETER_DECLARATION_LIST:
			case ARGUMENT_EXPRESSION_LIST:
			case CLOSURE_USE_LIST:
			case ARRAY_INITIALISER_LIST:
			case QUALIFIED_NAME_LIST:
				if (isMultiline(phrase)) {
					state.setPendingRule(FormatRule.NEWLINE_INDENT_BEFORE);
					state.pushList(true);
					indent.increment();
				} else {
					state.pushList(false);
					if (!phrase.is(PhraseType.QUALIFIED_NAME_LIST)) {
						state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
					}
				}
				break;

			case CONST_ELEMENT_LIST:
			case CLASS_CONST_ELEMENT_LIST:
			case PROPERTY_ELEMENT_LIST:
			case STATIC_VARIABLE_DECLARATION_LIST:
			case VARIABLE_NAME_LIST:
				if (isMultiline(phrase)) {
					state.pushList(true);
					indent.increment();
				} else {
					state.pushList(false);
				}
				state.setPendingRule(FormatRule.SINGLE_SPACE_OR_NEWLINE_INDENT_BEFORE);
				break;

			case ENCAPSULATED_VARIABLE_LIST:
				state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				break;

			case SIMPLE_VARIABLE:
				if (parent.is(PhraseType.ENCAPSULATED_VARIABLE_LIST)) {
					state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				}
				break;

			default:
				break;
		}
	}

	@Override
	public VisitResult postorder(Node node, List<Phrase> spine) {
		Phrase parent = parentOf(spine);
		if (node.isPhrase()) {
			postorderPhrase((Phrase) node, parent);
			return VisitResult.CONTINUE;
		}

		Token token = (Token) node;
		switch (token.getTokenType()) {
			case COMMENT:
				if (isBlockComment(token)) {
					state.setPendingRule(FormatRule.SINGLE_SPACE_OR_NEWLINE_INDENT_BEFORE);
					reflowIfActive(token);
				} else {
					state.setPendingRule(FormatRule.INDENT_OR_NEWLINE_INDENT_BEFORE);
				}
				break;

			case DOCUMENT_COMMENT:
				state.setPendingRule(FormatRule.NEWLINE_INDENT_BEFORE);
				reflowIfActive(token);
				break;

			case OPEN_BRACE:
				if (parent.is(PhraseType.ENCAPSULATED_EXPRESSION)) {
					state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				} else {
					state.setPendingRule(FormatRule.NEWLINE_INDENT_BEFORE);
				}
				indent.increment();
				break;

			case CLOSE_BRACE:
				if (!isInlineBraceParent(parent)) {
					state.setPendingRule(FormatRule.NEWLINE_INDENT_BEFORE);
				}
				break;

			case SEMICOLON:
				if (parent.is(PhraseType.FOR_STATEMENT)) {
					state.setPendingRule(FormatRule.SINGLE_SPACE_BEFORE);
				} else {
					state.setPendingRule(FormatRule.NEWLINE_INDENT_BEFORE);
				}
				break;

			case COLON:
				if (parent.is(PhraseType.CASE_STATEMENT) || parent.is(PhraseType.DEFAULT_STATEMENT)) {
					indent.increment();
					state.setPendingRule(FormatRule.NEWLINE_INDENT_BEFORE);
				}
				break;

			case AMPERSAND:
				if (!parent.is(PhraseType.BITWISE_EXPRESSION)) {
					state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				}
				break;

			case PLUS:
			case MINUS:
				if (parent.is(PhraseType.UNARY_OP_EXPRESSION)) {
					state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				}
				break;

			case PLUS_PLUS:
				if (parent.is(PhraseType.PREFIX_INCREMENT_EXPRESSION)) {
					state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				}
				break;

			case MINUS_MINUS:
				if (parent.is(PhraseType.PREFIX_DECREMENT_EXPRESSION)) {
					state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				}
				break;

			case ELLIPSIS:
			case EXCLAMATION:
			case AT_SYMBOL:
			case ARRAY_CAST:
			case BOOLEAN_CAST:
			case FLOAT_CAST:
			case INTEGER_CAST:
			case OBJECT_CAST:
			case STRING_CAST:
			case UNSET_CAST:
			case TILDE:
			case BACKSLASH:
			case OPEN_PARENTHESIS:
			case OPEN_BRACKET:
				state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				break;

			case CURLY_OPEN:
			case DOLLAR_CURLY_OPEN:
				indent.increment();
				state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				break;

			case COMMA:
				if (isDeclarationListOrArray(parent)) {
					state.setPendingRule(FormatRule.SINGLE_SPACE_OR_NEWLINE_INDENT_BEFORE);
				} else if (state.isInMultilineList()) {
					state.setPendingRule(FormatRule.NEWLINE_INDENT_BEFORE);
				}
				break;

			case ARROW:
			case COLON_COLON:
				state.setPendingRule(FormatRule.NO_SPACE_OR_NEWLINE_INDENT_PLUS_ONE_BEFORE);
				break;

			case OPEN_TAG: {
				String tagText = doc.tokenText(token);
				if (tagText.length() > 2) {
					if (Whitespace.countNewlines(tagText) > 0) {
						state.setPendingRule(FormatRule.INDENT_BEFORE);
					} else {
						state.setPendingRule(FormatRule.NO_SPACE_OR_NEWLINE_INDENT_BEFORE);
					}
				} else {
					state.setPendingRule(FormatRule.SINGLE_SPACE_OR_NEWLINE_INDENT_BEFORE);
				}
				break;
			}

			case OPEN_TAG_ECHO:
				state.setPendingRule(FormatRule.SINGLE_SPACE_OR_NEWLINE_INDENT_BEFORE);
				break;

			default:
				break;
		}

		if (window.isActive() && window.closeIfEnded(token)) {
			return VisitResult.STOP;
		}
		return VisitResult.CONTINUE;
	}

	private void postorderPhrase(Phrase phrase, Phrase parent) {
		switch (phrase.getPhraseType()) {
			case CASE_STATEMENT:
			case DEFAULT_STATEMENT:
				decrementIndent(phrase);
				break;

			case NAMESPACE_DEFINITION:
				state.setPendingRule(FormatRule.DOUBLE_NEWLINE_INDENT_BEFORE);
				break;

			case NAMESPACE_USE_DECLARATION:
				if (isLastNamespaceUseDeclaration(parent, phrase)) {
					state.setPendingRule(FormatRule.DOUBLE_NEWLINE_INDENT_BEFORE);
				}
				break;

			case PARAMETER_DECLARATION_LIST:
			case ARGUMENT_EXPRESSION_LIST:
			case CLOSURE_USE_LIST:
			case QUALIFIED_NAME_LIST:
			case ARRAY_INITIALISER_LIST:
				if (state.popList()) {
					state.setPendingRule(FormatRule.NEWLINE_INDENT_BEFORE);
					decrementIndent(phrase);
				}
				break;

			case CONST_ELEMENT_LIST:
			case PROPERTY_ELEMENT_LIST:
			case CLASS_CONST_ELEMENT_LIST:
			case STATIC_VARIABLE_DECLARATION_LIST:
			case VARIABLE_NAME_LIST:
				if (state.popList()) {
					decrementIndent(phrase);
				}
				break;

			case ENCAPSULATED_VARIABLE_LIST:
				state.setPendingRule(FormatRule.NO_SPACE_BEFORE);
				break;

			case ANONYMOUS_FUNCTION_CREATION_EXPRESSION:
				state.setPendingRule(null);
				break;

			default:
				break;
		}
	}

	private static Phrase parentOf(List<Phrase> spine) {
		return spine.isEmpty() ? ROOT_PARENT : spine.get(spine.size() - 1);
	}

	private void addEdit(TextEdit edit, int from, int to) {
		if (window.admits(from, to)) {
			edits.add(edit);
		}
	}

	private void reflowIfActive(Token comment) {
		if (!window.isActive()) {
			return;
		}
		TextEdit edit = DocBlockReflower.reflow(comment, doc, indent.getText());
		if (edit != null) {
			addEdit(edit, comment.getOffset(), comment.getEnd());
		}
	}

	// unbalanced input can close more blocks than it opened
	private void decrementIndent(Node at) {
		if (indent.getDepth() == 0) {
			logger.debug("Ignoring indent decrement below zero at {} in {}", at, doc.getUri());
			return;
		}
		indent.decrement();
	}

	/**
	 * Depth matching the column of an open tag that is not the first token,
	 * rounded up to whole indent units.
	 */
	private int openTagDepth(Token openTag) {
		int columns = doc.lineSubstring(openTag.getOffset()).length() - 1;
		if (columns <= 0) {
			return 0;
		}
		int unitLength = indent.getUnit().length();
		return (columns + unitLength - 1) / unitLength;
	}

	private boolean isMultiline(Phrase list) {
		Token previous = state.getPreviousToken();
		if (previous != null && previous.is(TokenType.WHITESPACE)
				&& Whitespace.countNewlines(doc.tokenText(previous)) > 0) {
			return true;
		}
		return hasNewlineWhitespaceChild(list);
	}

	private boolean hasNewlineWhitespaceChild(Phrase phrase) {
		for (Node child : phrase.getChildren()) {
			if (child.isToken() && ((Token) child).is(TokenType.WHITESPACE)
					&& Whitespace.countNewlines(doc.tokenText((Token) child)) > 0) {
				return true;
			}
		}
		return false;
	}

	private boolean isBlockComment(Token comment) {
		return doc.tokenText(comment).startsWith("/*");
	}

	/**
	 * True when no phrase follows {@code declaration} among its siblings, or
	 * the next phrase is not another use declaration.
	 */
	private static boolean isLastNamespaceUseDeclaration(Phrase parent, Phrase declaration) {
		List<Node> siblings = parent.getChildren();
		int index = parent.indexOfChild(declaration);
		if (index < 0) {
			return true;
		}
		for (int i = index + 1; i < siblings.size(); i++) {
			Node sibling = siblings.get(i);
			if (sibling.isPhrase()) {
				return !((Phrase) sibling).is(PhraseType.NAMESPACE_USE_DECLARATION);
			}
		}
		return true;
	}

	private static boolean isInlineBraceParent(Phrase parent) {
		switch (parent.getPhraseType()) {
			case SUBSCRIPT_EXPRESSION:
			case ENCAPSULATED_EXPRESSION:
			case ENCAPSULATED_VARIABLE:
				return true;
			default:
				return false;
		}
	}

	private static boolean isDeclarationListOrArray(Phrase parent) {
		switch (parent.getPhraseType()) {
			case ARRAY_INITIALISER_LIST:
			case CONST_ELEMENT_LIST:
			case CLASS_CONST_ELEMENT_LIST:
			case PROPERTY_ELEMENT_LIST:
			case STATIC_VARIABLE_DECLARATION_LIST:
			case VARIABLE_NAME_LIST:
				return true;
			default:
				return false;
		}
	}

	private static boolean isCallLikeParenthesis(Phrase parent) {
		switch (parent.getPhraseType()) {
			case FUNCTION_CALL_EXPRESSION:
			case METHOD_CALL_EXPRESSION:
			case SCOPED_CALL_EXPRESSION:
			case ECHO_INTRINSIC:
			case EMPTY_INTRINSIC:
			case EVAL_INTRINSIC:
			case EXIT_INTRINSIC:
			case ISSET_INTRINSIC:
			case LIST_INTRINSIC:
			case PRINT_INTRINSIC:
			case UNSET_INTRINSIC:
			case ARRAY_CREATION_EXPRESSION:
			case FUNCTION_DECLARATION_HEADER:
			case METHOD_DECLARATION_HEADER:
			case OBJECT_CREATION_EXPRESSION:
				return true;
			default:
				return false;
		}
	}
}
