package com.luaparser.ast;

/**
 * An assignable prefix expression.
 */
public sealed interface Var extends PrefixExpression permits NameVar, SquareBracketVar, DotVar {
}
