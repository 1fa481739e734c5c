package com.luaparser.ast;

public sealed interface PrefixExpression extends Expression permits Var, FunctionCallPrefixExpression, ParenPrefixExpression {
}
