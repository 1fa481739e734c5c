package com.luaparser.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.luaparser.ast.SyntaxKind.*;
import static com.luaparser.ast.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class ExpressionChildrenTest {

    @Test
    void simpleExpressionWrapsOneToken() {
        SimpleExpression one = number("1", 0);

        assertEquals(List.of(NUMBER), kinds(one.children()));
        assertFalse(one.isLeaf());
    }

    @Test
    void binaryAndUnaryOperators() {
        BinaryOperatorExpression sum = BinaryOperatorExpression.builder()
            .span(0, 5)
            .exp1(number("1", 0))
            .binaryOperator(token(PLUS_OPERATOR, 2))
            .exp2(number("2", 4))
            .build();
        UnaryOperatorExpression negated = UnaryOperatorExpression.builder()
            .span(0, 4)
            .unaryOperator(token(NOT_KEYWORD, 0))
            .exp(nameVar("x", 4))
            .build();

        assertEquals(List.of(SIMPLE_EXPRESSION, PLUS_OPERATOR, SIMPLE_EXPRESSION), kinds(sum.children()));
        assertEquals(List.of(NOT_KEYWORD, NAME_VAR), kinds(negated.children()));
    }

    @Test
    void tableConstructorExpressionWithFields() {
        AssignmentField named = AssignmentField.builder()
            .span(1, 3)
            .name(name("a", 1))
            .assignmentOperator(token(ASSIGNMENT_OPERATOR, 2))
            .exp(number("1", 3))
            .build();
        BracketField bracketed = BracketField.builder()
            .span(5, 7)
            .openBracket(token(OPEN_BRACKET, 5))
            .identifierExp(number("2", 6))
            .closeBracket(token(CLOSE_BRACKET, 7))
            .assignmentOperator(token(ASSIGNMENT_OPERATOR, 8))
            .assignedExp(nameVar("b", 9))
            .build();
        ExpressionField positional = ExpressionField.builder()
            .span(11, 1)
            .exp(nameVar("c", 11))
            .build();
        TableConstructorExpression table = TableConstructorExpression.builder()
            .span(0, 13)
            .openCurly(token(OPEN_CURLY_BRACE, 0))
            .fieldList(SeparatedList.of(List.of(named, bracketed, positional),
                List.of(token(COMMA, 4), token(COMMA, 10))))
            .closeCurly(token(CLOSE_CURLY_BRACE, 12))
            .build();

        assertEquals(List.of(OPEN_CURLY_BRACE, SEPARATED_LIST, CLOSE_CURLY_BRACE), kinds(table.children()));
        assertEquals(List.of(ASSIGNMENT_FIELD, COMMA, BRACKET_FIELD, COMMA, EXPRESSION_FIELD),
            kinds(table.fieldList().children()));
        assertEquals(List.of(IDENTIFIER, ASSIGNMENT_OPERATOR, SIMPLE_EXPRESSION), kinds(named.children()));
        assertEquals(List.of(OPEN_BRACKET, SIMPLE_EXPRESSION, CLOSE_BRACKET, ASSIGNMENT_OPERATOR, NAME_VAR),
            kinds(bracketed.children()));
        assertEquals(List.of(NAME_VAR), kinds(positional.children()));
    }

    @Test
    void vars() {
        SquareBracketVar indexed = SquareBracketVar.builder()
            .span(0, 4)
            .prefixExp(nameVar("t", 0))
            .openBracket(token(OPEN_BRACKET, 1))
            .exp(number("1", 2))
            .closeBracket(token(CLOSE_BRACKET, 3))
            .build();
        DotVar member = DotVar.builder()
            .span(0, 3)
            .prefixExp(nameVar("t", 0))
            .dotOperator(token(DOT, 1))
            .nameIdentifier(name("k", 2))
            .build();

        assertEquals(List.of(IDENTIFIER), kinds(nameVar("t", 0).children()));
        assertEquals(List.of(NAME_VAR, OPEN_BRACKET, SIMPLE_EXPRESSION, CLOSE_BRACKET), kinds(indexed.children()));
        assertEquals(List.of(NAME_VAR, DOT, IDENTIFIER), kinds(member.children()));
    }

    @Test
    void callPrefixExpressionWithAndWithoutMethodName() {
        FunctionCallPrefixExpression plain = call("f", "x", 0);
        FunctionCallPrefixExpression method = plain.toBuilder()
            .colon(token(COLON, 1))
            .name(name("m", 2))
            .build();

        assertEquals(List.of(NAME_VAR, PAREN_ARG), kinds(plain.children()));
        assertEquals(List.of(NAME_VAR, COLON, IDENTIFIER, PAREN_ARG), kinds(method.children()));
    }

    @Test
    void parenthesizedPrefixExpression() {
        ParenPrefixExpression paren = ParenPrefixExpression.builder()
            .span(0, 3)
            .openParen(token(OPEN_PAREN, 0))
            .exp(nameVar("x", 1))
            .closeParen(token(CLOSE_PAREN, 2))
            .build();

        assertEquals(List.of(OPEN_PAREN, NAME_VAR, CLOSE_PAREN), kinds(paren.children()));
    }

    @Test
    void callArguments() {
        ParenArg parenArg = (ParenArg) call("f", "x", 0).args();
        TableConstructorArg tableArg = TableConstructorArg.builder()
            .span(1, 2)
            .openCurly(token(OPEN_CURLY_BRACE, 1))
            .fieldList(SeparatedList.empty(2))
            .closeCurly(token(CLOSE_CURLY_BRACE, 2))
            .build();
        StringArg stringArg = StringArg.builder()
            .span(1, 4)
            .stringLiteral(Token.of(STRING, 1, "\"hi\""))
            .build();

        assertEquals(List.of(OPEN_PAREN, SEPARATED_LIST, CLOSE_PAREN), kinds(parenArg.children()));
        assertEquals(List.of(OPEN_CURLY_BRACE, SEPARATED_LIST, CLOSE_CURLY_BRACE), kinds(tableArg.children()));
        assertEquals(List.of(STRING), kinds(stringArg.children()));
    }

    @Test
    void categoriesAreAssignable() {
        Expression expression = nameVar("x", 0);

        assertTrue(expression instanceof PrefixExpression);
        assertTrue(expression instanceof Var);
        assertEquals(NAME_VAR, expression.kind());
    }
}
