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
 * Syntactic constructs of the PHP concrete syntax tree.
 */
public enum PhraseType {
	UNKNOWN,
	ADDITIVE_EXPRESSION,
	ANONYMOUS_CLASS_DECLARATION,
	ANONYMOUS_CLASS_DECLARATION_HEADER,
	ANONYMOUS_FUNCTION_CREATION_EXPRESSION,
	ANONYMOUS_FUNCTION_HEADER,
	ANONYMOUS_FUNCTION_USE_CLAUSE,
	ANONYMOUS_FUNCTION_USE_VARIABLE,
	ARGUMENT_EXPRESSION_LIST,
	ARRAY_CREATION_EXPRESSION,
	ARRAY_ELEMENT,
	ARRAY_INITIALISER_LIST,
	ARRAY_KEY,
	ARRAY_VALUE,
	BITWISE_EXPRESSION,
	BREAK_STATEMENT,
	BYREF_ASSIGNMENT_EXPRESSION,
	CASE_STATEMENT,
	CASE_STATEMENT_LIST,
	CAST_EXPRESSION,
	CATCH_CLAUSE,
	CATCH_CLAUSE_LIST,
	CATCH_NAME_LIST,
	CLASS_BASE_CLAUSE,
	CLASS_CONSTANT_ACCESS_EXPRESSION,
	CLASS_CONST_DECLARATION,
	CLASS_CONST_ELEMENT,
	CLASS_CONST_ELEMENT_LIST,
	CLASS_DECLARATION,
	CLASS_DECLARATION_BODY,
	CLASS_DECLARATION_HEADER,
	CLASS_INTERFACE_CLAUSE,
	CLASS_MEMBER_DECLARATION_LIST,
	CLASS_MODIFIERS,
	CLASS_TYPE_DESIGNATOR,
	CLONE_EXPRESSION,
	CLOSURE_USE_LIST,
	COALESCE_EXPRESSION,
	COMPOUND_ASSIGNMENT_EXPRESSION,
	COMPOUND_STATEMENT,
	CONDITIONAL_EXPRESSION,
	CONST_DECLARATION,
	CONST_ELEMENT,
	CONST_ELEMENT_LIST,
	CONTINUE_STATEMENT,
	DECLARE_DIRECTIVE,
	DECLARE_STATEMENT,
	DEFAULT_STATEMENT,
	DO_STATEMENT,
	DOUBLE_QUOTED_STRING_LITERAL,
	ECHO_INTRINSIC,
	ELSE_CLAUSE,
	ELSE_IF_CLAUSE,
	ELSE_IF_CLAUSE_LIST,
	EMPTY_INTRINSIC,
	ENCAPSULATED_EXPRESSION,
	ENCAPSULATED_VARIABLE,
	ENCAPSULATED_VARIABLE_LIST,
	EQUALITY_EXPRESSION,
	ERROR,
	EVAL_INTRINSIC,
	EXIT_INTRINSIC,
	EXPONENTIATION_EXPRESSION,
	EXPRESSION_LIST,
	EXPRESSION_STATEMENT,
	FINALLY_CLAUSE,
	FOR_CONTROL,
	FOR_END_OF_LOOP,
	FOR_EXPRESSION_GROUP,
	FOR_INITIALISER,
	FOR_STATEMENT,
	FOREACH_COLLECTION,
	FOREACH_KEY,
	FOREACH_STATEMENT,
	FOREACH_VALUE,
	FULLY_QUALIFIED_NAME,
	FUNCTION_CALL_EXPRESSION,
	FUNCTION_DECLARATION,
	FUNCTION_DECLARATION_BODY,
	FUNCTION_DECLARATION_HEADER,
	FUNCTION_STATIC_DECLARATION,
	FUNCTION_STATIC_INITIALISER,
	GLOBAL_DECLARATION,
	GOTO_STATEMENT,
	HALT_COMPILER_STATEMENT,
	HEREDOC_STRING_LITERAL,
	IDENTIFIER,
	IF_STATEMENT,
	INCLUDE_EXPRESSION,
	INCLUDE_ONCE_EXPRESSION,
	INLINE_TEXT,
	INSTANCE_OF_EXPRESSION,
	INSTANCE_OF_TYPE_DESIGNATOR,
	INTERFACE_BASE_CLAUSE,
	INTERFACE_DECLARATION,
	INTERFACE_DECLARATION_BODY,
	INTERFACE_DECLARATION_HEADER,
	INTERFACE_MEMBER_DECLARATION_LIST,
	ISSET_INTRINSIC,
	LIST_INTRINSIC,
	LOGICAL_EXPRESSION,
	MEMBER_MODIFIER_LIST,
	MEMBER_NAME,
	METHOD_CALL_EXPRESSION,
	METHOD_DECLARATION,
	METHOD_DECLARATION_BODY,
	METHOD_DECLARATION_HEADER,
	METHOD_REFERENCE,
	MULTIPLICATIVE_EXPRESSION,
	NAMED_LABEL_STATEMENT,
	NAMESPACE_ALIASING_CLAUSE,
	NAMESPACE_DEFINITION,
	NAMESPACE_NAME,
	NAMESPACE_USE_CLAUSE,
	NAMESPACE_USE_CLAUSE_LIST,
	NAMESPACE_USE_DECLARATION,
	NAMESPACE_USE_GROUP_CLAUSE,
	NAMESPACE_USE_GROUP_CLAUSE_LIST,
	NULL_STATEMENT,
	OBJECT_CREATION_EXPRESSION,
	PARAMETER_DECLARATION,
	PARAMETER_DECLARATION_LIST,
	POSTFIX_DECREMENT_EXPRESSION,
	POSTFIX_INCREMENT_EXPRESSION,
	PREFIX_DECREMENT_EXPRESSION,
	PREFIX_INCREMENT_EXPRESSION,
	PRINT_INTRINSIC,
	PROPERTY_ACCESS_EXPRESSION,
	PROPERTY_DECLARATION,
	PROPERTY_ELEMENT,
	PROPERTY_ELEMENT_LIST,
	PROPERTY_INITIALISER,
	QUALIFIED_NAME,
	QUALIFIED_NAME_LIST,
	RELATIONAL_EXPRESSION,
	RELATIVE_QUALIFIED_NAME,
	RELATIVE_SCOPE,
	REQUIRE_EXPRESSION,
	REQUIRE_ONCE_EXPRESSION,
	RETURN_STATEMENT,
	RETURN_TYPE,
	SCOPED_CALL_EXPRESSION,
	SCOPED_MEMBER_NAME,
	SCOPED_PROPERTY_ACCESS_EXPRESSION,
	SHELL_COMMAND_EXPRESSION,
	SHIFT_EXPRESSION,
	SIMPLE_ASSIGNMENT_EXPRESSION,
	SIMPLE_VARIABLE,
	STATEMENT_LIST,
	STATIC_VARIABLE_DECLARATION,
	STATIC_VARIABLE_DECLARATION_LIST,
	SUBSCRIPT_EXPRESSION,
	SWITCH_STATEMENT,
	THROW_STATEMENT,
	TRAIT_ADAPTATION_LIST,
	TRAIT_ALIAS,
	TRAIT_DECLARATION,
	TRAIT_DECLARATION_BODY,
	TRAIT_DECLARATION_HEADER,
	TRAIT_MEMBER_DECLARATION_LIST,
	TRAIT_PRECEDENCE,
	TRAIT_USE_CLAUSE,
	TRAIT_USE_SPECIFICATION,
	TRY_STATEMENT,
	TYPE_DECLARATION,
	UNARY_OP_EXPRESSION,
	UNSET_INTRINSIC,
	VARIABLE_LIST,
	VARIABLE_NAME_LIST,
	VARIABLE_VARIABLE,
	WHILE_STATEMENT,
	YIELD_EXPRESSION,
	YIELD_FROM_EXPRESSION
}
