package com.luaparser.ast;

import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static com.luaparser.ast.SyntaxKind.*;
import static com.luaparser.ast.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class BuilderTest {

    @Test
    void emptyBlockIsLeaf() {
        Block block = Block.builder()
            .start(0)
            .length(0)
            .statements(List.of())
            .build();

        assertTrue(block.children().isEmpty());
        assertTrue(block.isLeaf());
    }

    @Test
    void missingStatements() {
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
            () -> Block.builder().span(0, 0).build());

        assertEquals("statements", e.fieldName());
        assertEquals(BLOCK, e.kind());
        assertTrue(e.getMessage().contains("statements"), e.getMessage());
    }

    @Test
    void missingSpan() {
        MissingRequiredFieldException noStart = assertThrows(MissingRequiredFieldException.class,
            () -> Block.builder().length(0).statements(List.of()).build());
        MissingRequiredFieldException noLength = assertThrows(MissingRequiredFieldException.class,
            () -> Block.builder().start(0).statements(List.of()).build());

        assertEquals("start", noStart.fieldName());
        assertEquals("length", noLength.fieldName());
    }

    @Test
    void startIsReportedBeforeOtherFields() {
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
            () -> WhileStatement.builder().build());

        assertEquals("start", e.fieldName());
        assertEquals(WHILE_STATEMENT, e.kind());
    }

    @Test
    void firstMissingFieldInDeclarationOrderIsReported() {
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
            () -> WhileStatement.builder()
                .span(0, 10)
                .whileKeyword(token(WHILE_KEYWORD, 0))
                .endKeyword(token(END_KEYWORD, 7))
                .build());

        assertEquals("exp", e.fieldName());
    }

    @Test
    void optionalFieldsMayBeOmitted() {
        ReturnStatement ret = returnName("x", 0);

        assertNull(ret.semicolon());
    }

    @Test
    void ifStatementRequiresElseIfList() {
        MissingRequiredFieldException e = assertThrows(MissingRequiredFieldException.class,
            () -> IfStatement.builder()
                .span(0, 13)
                .ifKeyword(token(IF_KEYWORD, 0))
                .exp(nameVar("c", 3))
                .thenKeyword(token(THEN_KEYWORD, 5))
                .ifBlock(emptyBlock(9))
                .endKeyword(token(END_KEYWORD, 10))
                .build());

        assertEquals("elseIfList", e.fieldName());
    }

    @Test
    void rejectsHalfOfAnOptionalPair() {
        FunctionCallPrefixExpression call = call("f", "x", 0);

        UnpairedOptionalFieldException colonOnly = assertThrows(UnpairedOptionalFieldException.class,
            () -> call.toBuilder().colon(token(COLON, 1)).build());
        UnpairedOptionalFieldException nameOnly = assertThrows(UnpairedOptionalFieldException.class,
            () -> call.toBuilder().name(name("m", 2)).build());

        assertEquals("colon", colonOnly.firstField());
        assertEquals("name", colonOnly.secondField());
        assertEquals(FUNCTION_CALL_PREFIX_EXPRESSION, nameOnly.kind());
    }

    @Test
    void rejectsUnpairedFieldsOnEveryPairedNode() {
        SeparatedList names = listOf(name("x", 6));

        assertThrows(UnpairedOptionalFieldException.class, () -> LocalAssignmentStatement.builder()
            .span(0, 9)
            .localKeyword(token(LOCAL_KEYWORD, 0))
            .nameList(names)
            .assignmentOperator(token(ASSIGNMENT_OPERATOR, 8))
            .build());
        assertThrows(UnpairedOptionalFieldException.class, () -> NameListParList.builder()
            .span(0, 5)
            .namesList(names)
            .vararg(token(VAR_ARG_OPERATOR, 2))
            .build());
        assertThrows(UnpairedOptionalFieldException.class, () -> FunctionName.builder()
            .span(0, 3)
            .name(name("a", 0))
            .funcNameList(SeparatedList.empty(1))
            .optionalName(name("m", 2))
            .build());
        assertThrows(UnpairedOptionalFieldException.class, () -> FunctionCallStatement.builder()
            .span(0, 4)
            .prefixExp(nameVar("f", 0))
            .colon(token(COLON, 1))
            .args(call("f", "x", 0).args())
            .build());
        assertThrows(UnpairedOptionalFieldException.class, () -> NumericForStatement.builder()
            .span(0, 20)
            .forKeyword(token(FOR_KEYWORD, 0))
            .name(name("i", 4))
            .assignmentOperator(token(ASSIGNMENT_OPERATOR, 6))
            .exp1(number("1", 8))
            .comma(token(COMMA, 9))
            .exp2(number("10", 11))
            .optionalExp3(number("2", 13))
            .doKeyword(token(DO_KEYWORD, 14))
            .block(emptyBlock(16))
            .endKeyword(token(END_KEYWORD, 17))
            .build());
    }

    @Test
    void rejectsNegativeSpan() {
        assertThrows(IllegalArgumentException.class, () -> emptyBlock(0).toBuilder().length(-1).build());
        assertThrows(IllegalArgumentException.class, () -> breakAt(0).toBuilder().start(-3).build());
    }

    @Test
    void toBuilderRoundTripsToAnEqualNode() {
        ReturnStatement ret = returnName("x", 0);

        ReturnStatement copy = ret.toBuilder().build();

        assertEquals(ret, copy);
        assertEquals(ret.hashCode(), copy.hashCode());
    }

    @Test
    void derivationSharesUnchangedFields() {
        ReturnStatement original = returnName("x", 0);
        Token semicolon = token(SEMICOLON, 8);

        ReturnStatement derived = original.toBuilder().length(9).semicolon(semicolon).build();

        assertSame(original.returnKeyword(), derived.returnKeyword());
        assertSame(original.expList(), derived.expList());
        assertSame(semicolon, derived.semicolon());
        assertNull(original.semicolon());
        assertEquals(8, original.length());
    }

    @Test
    void derivationSharesListInstances() {
        Block original = block(breakAt(0), breakAt(6));

        Block derived = original.toBuilder().start(0).build();

        assertSame(original.statements(), derived.statements());
    }

    @Test
    void addingToDerivedBuilderLeavesOriginalUntouched() {
        Block original = block(breakAt(0));

        Block derived = original.toBuilder()
            .length(11)
            .addStatement(breakAt(6))
            .build();

        assertEquals(1, original.statements().size());
        assertEquals(2, derived.statements().size());
        assertSame(original.statements().get(0), derived.statements().get(0));
    }

    @Test
    void builtListsAreImmutableCopies() {
        List<Statement> statements = new ArrayList<>();
        statements.add(breakAt(0));
        Block block = Block.builder().span(0, 5).statements(statements).build();

        statements.add(breakAt(6));

        assertEquals(1, block.statements().size());
        assertThrows(UnsupportedOperationException.class, () -> block.statements().add(breakAt(6)));
    }

    @Test
    void nodesCompareByValue() {
        assertEquals(returnName("x", 0), returnName("x", 0));
        assertNotEquals(returnName("x", 0), returnName("y", 0));
        assertNotEquals(returnName("x", 0), returnName("x", 1));
    }

    @Test
    void subtreesCanBeSharedBetweenParents() {
        Block shared = block(breakAt(4));
        DoStatement first = DoStatement.builder()
            .span(0, 13)
            .doKeyword(token(DO_KEYWORD, 0))
            .block(shared)
            .endKeyword(token(END_KEYWORD, 10))
            .build();
        WhileStatement second = WhileStatement.builder()
            .span(0, 20)
            .whileKeyword(token(WHILE_KEYWORD, 0))
            .exp(nameVar("c", 6))
            .doKeyword(token(DO_KEYWORD, 8))
            .block(shared)
            .endKeyword(token(END_KEYWORD, 17))
            .build();

        assertSame(first.block(), second.block());
    }
}
