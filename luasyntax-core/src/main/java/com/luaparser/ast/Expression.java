package com.luaparser.ast;

public sealed interface Expression extends SyntaxNode permits
    SimpleExpression,
    BinaryOperatorExpression,
    UnaryOperatorExpression,
    TableConstructorExpression,
    FunctionDefinition,
    Field,
    PrefixExpression {
}
