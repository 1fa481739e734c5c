package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * Factories for hand-assembled trees. Positions are plausible but these tests
 * only care about shape.
 */
final class TestTrees {

    private TestTrees() {
    }

    static Token token(SyntaxKind kind, int start) {
        return Token.of(kind, start);
    }

    static Token name(String text, int start) {
        return Token.of(SyntaxKind.IDENTIFIER, start, text);
    }

    static SimpleExpression number(String text, int start) {
        Token value = Token.of(SyntaxKind.NUMBER, start, text);
        return SimpleExpression.builder()
            .span(start, value.length())
            .expressionValue(value)
            .build();
    }

    static NameVar nameVar(String text, int start) {
        Token name = name(text, start);
        return NameVar.builder()
            .span(start, name.length())
            .name(name)
            .build();
    }

    static SeparatedList listOf(SyntaxNodeOrToken item) {
        return SeparatedList.of(List.of(item), List.of());
    }

    static Block emptyBlock(int position) {
        return Block.builder()
            .span(position, 0)
            .statements(List.of())
            .build();
    }

    static Block block(Statement... statements) {
        Statement first = statements[0];
        Statement last = statements[statements.length - 1];
        return Block.builder()
            .span(first.start(), last.end() - first.start())
            .statements(List.of(statements))
            .build();
    }

    static BreakStatement breakAt(int start) {
        return BreakStatement.builder()
            .span(start, 5)
            .breakKeyword(token(SyntaxKind.BREAK_KEYWORD, start))
            .build();
    }

    /**
     * {@code return x}
     */
    static ReturnStatement returnName(String name, int start) {
        return ReturnStatement.builder()
            .span(start, 7 + name.length())
            .returnKeyword(token(SyntaxKind.RETURN_KEYWORD, start))
            .expList(listOf(nameVar(name, start + 7)))
            .build();
    }

    /**
     * {@code f(arg)} as a call prefix expression.
     */
    static FunctionCallPrefixExpression call(String function, String arg, int start) {
        int open = start + function.length();
        ParenArg args = ParenArg.builder()
            .span(open, arg.length() + 2)
            .openParen(token(SyntaxKind.OPEN_PAREN, open))
            .expList(listOf(nameVar(arg, open + 1)))
            .closeParen(token(SyntaxKind.CLOSE_PAREN, open + 1 + arg.length()))
            .build();
        return FunctionCallPrefixExpression.builder()
            .span(start, function.length() + args.length())
            .prefixExp(nameVar(function, start))
            .args(args)
            .build();
    }

    static List<SyntaxKind> kinds(Iterable<? extends SyntaxNodeOrToken> elements) {
        List<SyntaxKind> kinds = new ArrayList<>();
        for (SyntaxNodeOrToken element : elements) {
            kinds.add(element.kind());
        }
        return kinds;
    }
}
