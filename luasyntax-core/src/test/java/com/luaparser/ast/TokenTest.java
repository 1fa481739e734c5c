package com.luaparser.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class TokenTest {

    @Test
    void fixedSpellingComesFromKind() {
        Token token = Token.of(SyntaxKind.RETURN_KEYWORD, 4);

        assertEquals("return", token.text());
        assertEquals(6, token.length());
        assertEquals(10, token.end());
    }

    @Test
    void tokenIsLeafWithoutChildren() {
        Token token = Token.of(SyntaxKind.IDENTIFIER, 0, "foo");

        assertTrue(token.isLeaf());
        assertTrue(token.isToken());
        assertTrue(token.children().isEmpty());
    }

    @Test
    void endOfFileMayBeEmpty() {
        Token eof = Token.of(SyntaxKind.END_OF_FILE, 42);

        assertEquals(0, eof.length());
        assertEquals(42, eof.end());
    }

    @Test
    void rejectsEmptyTextForOtherKinds() {
        assertThrows(IllegalArgumentException.class, () -> Token.of(SyntaxKind.IDENTIFIER, 0, ""));
    }

    @Test
    void rejectsNodeKind() {
        assertThrows(IllegalArgumentException.class, () -> Token.of(SyntaxKind.BLOCK, 0, "x"));
    }

    @Test
    void rejectsLengthThatDisagreesWithText() {
        assertThrows(IllegalArgumentException.class, () -> new Token(SyntaxKind.IDENTIFIER, 0, 3, "ab"));
    }

    @Test
    void rejectsNegativeStart() {
        assertThrows(IllegalArgumentException.class, () -> Token.of(SyntaxKind.COMMA, -1));
    }

    @Test
    void variableSpellingNeedsText() {
        IllegalArgumentException e = assertThrows(IllegalArgumentException.class,
            () -> Token.of(SyntaxKind.NUMBER, 0));
        assertTrue(e.getMessage().contains("NUMBER"), e.getMessage());
    }

    @Test
    void tokensCompareByValue() {
        assertEquals(Token.of(SyntaxKind.IDENTIFIER, 3, "x"), Token.of(SyntaxKind.IDENTIFIER, 3, "x"));
        assertNotEquals(Token.of(SyntaxKind.IDENTIFIER, 3, "x"), Token.of(SyntaxKind.IDENTIFIER, 4, "x"));
    }
}
