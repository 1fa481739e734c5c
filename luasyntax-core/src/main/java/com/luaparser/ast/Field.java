package com.luaparser.ast;

/**
 * An entry of a table constructor's field list.
 */
public sealed interface Field extends Expression permits BracketField, AssignmentField, ExpressionField {
}
