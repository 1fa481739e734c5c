package com.luaparser.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.luaparser.ast.SyntaxKind.*;
import static com.luaparser.ast.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class FunctionSyntaxTest {

    /**
     * {@code (a, b, ...) return a end} starting at {@code start}.
     */
    private static FunctionBody body(int start) {
        NameListParList params = NameListParList.builder()
            .span(start + 1, 9)
            .namesList(SeparatedList.of(List.of(name("a", start + 1), name("b", start + 4)),
                List.of(token(COMMA, start + 2))))
            .comma(token(COMMA, start + 5))
            .vararg(token(VAR_ARG_OPERATOR, start + 7))
            .build();
        return FunctionBody.builder()
            .span(start, 24)
            .openParen(token(OPEN_PAREN, start))
            .parameterList(params)
            .closeParen(token(CLOSE_PAREN, start + 10))
            .block(block(returnName("a", start + 12)))
            .endKeyword(token(END_KEYWORD, start + 21))
            .build();
    }

    @Test
    void functionBodyChildren() {
        FunctionBody body = body(0);

        assertEquals(List.of(OPEN_PAREN, NAME_LIST_PAR_LIST, CLOSE_PAREN, BLOCK, END_KEYWORD),
            kinds(body.children()));
        assertEquals(List.of(SEPARATED_LIST, COMMA, VAR_ARG_OPERATOR), kinds(body.parameterList().children()));
    }

    @Test
    void parameterListsWithoutVarArgs() {
        NameListParList names = NameListParList.builder()
            .span(1, 1)
            .namesList(listOf(name("a", 1)))
            .build();
        NameListParList none = NameListParList.builder()
            .span(1, 0)
            .namesList(SeparatedList.empty(1))
            .build();
        VarArgParList varArgs = VarArgParList.builder()
            .span(1, 3)
            .varargOperator(token(VAR_ARG_OPERATOR, 1))
            .build();

        assertEquals(List.of(SEPARATED_LIST), kinds(names.children()));
        assertEquals(List.of(SEPARATED_LIST), kinds(none.children()));
        assertEquals(List.of(VAR_ARG_OPERATOR), kinds(varArgs.children()));
    }

    @Test
    void functionDefinition() {
        FunctionDefinition definition = FunctionDefinition.builder()
            .span(0, 32)
            .functionKeyword(token(FUNCTION_KEYWORD, 0))
            .functionBody(body(8))
            .build();

        assertEquals(List.of(FUNCTION_KEYWORD, FUNCTION_BODY), kinds(definition.children()));
    }

    @Test
    void globalFunctionWithMethodName() {
        FunctionName plain = FunctionName.builder()
            .span(9, 5)
            .name(name("a", 9))
            .funcNameList(SeparatedList.builder()
                .span(10, 2)
                .add(token(DOT, 10))
                .add(name("b", 11))
                .build())
            .build();
        FunctionName method = plain.toBuilder()
            .length(7)
            .optionalColon(token(COLON, 12))
            .optionalName(name("m", 13))
            .build();
        GlobalFunctionStatement stmt = GlobalFunctionStatement.builder()
            .span(0, 38)
            .functionKeyword(token(FUNCTION_KEYWORD, 0))
            .funcName(method)
            .funcBody(body(14))
            .build();

        assertEquals(List.of(IDENTIFIER, SEPARATED_LIST), kinds(plain.children()));
        assertEquals(List.of(IDENTIFIER, SEPARATED_LIST, COLON, IDENTIFIER), kinds(method.children()));
        assertEquals(List.of(FUNCTION_KEYWORD, FUNCTION_NAME, FUNCTION_BODY), kinds(stmt.children()));
    }

    @Test
    void localFunction() {
        LocalFunctionStatement stmt = LocalFunctionStatement.builder()
            .span(0, 41)
            .localKeyword(token(LOCAL_KEYWORD, 0))
            .functionKeyword(token(FUNCTION_KEYWORD, 6))
            .name(name("f", 15))
            .funcBody(body(16))
            .build();

        assertEquals(List.of(LOCAL_KEYWORD, FUNCTION_KEYWORD, IDENTIFIER, FUNCTION_BODY), kinds(stmt.children()));
    }

    @Test
    void tableConstructor() {
        TableConstructor table = TableConstructor.builder()
            .span(0, 2)
            .openCurly(token(OPEN_CURLY_BRACE, 0))
            .fieldList(SeparatedList.empty(1))
            .closeCurly(token(CLOSE_CURLY_BRACE, 1))
            .build();

        assertEquals(List.of(OPEN_CURLY_BRACE, SEPARATED_LIST, CLOSE_CURLY_BRACE), kinds(table.children()));
    }

    @Test
    void chunkChildren() {
        Block program = block(breakAt(0));
        Chunk chunk = Chunk.builder()
            .span(0, 5)
            .programBlock(program)
            .endOfFile(token(END_OF_FILE, 5))
            .build();

        assertEquals(List.of(BLOCK, END_OF_FILE), kinds(chunk.children()));
        assertSame(program, chunk.programBlock());
    }
}
