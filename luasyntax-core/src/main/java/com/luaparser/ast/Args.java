package com.luaparser.ast;

/**
 * The argument part of a function call: {@code (exps)}, {@code {fields}} or a string literal.
 */
public sealed interface Args extends SyntaxNode permits TableConstructorArg, ParenArg, StringArg {
}
