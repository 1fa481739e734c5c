package com.luaparser.ast;

import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class SyntaxKindTest {

    @Test
    void nodeAndTokenKindsArePartitioned() {
        for (SyntaxKind kind : SyntaxKind.values()) {
            assertNotEquals(kind.isNode(), kind.isToken(), kind.name());
        }
    }

    @Test
    void nodeKindsHaveNoSpelling() {
        for (SyntaxKind kind : SyntaxKind.values()) {
            if (kind.isNode()) {
                assertNull(kind.text(), kind.name());
            }
        }
    }

    @Test
    void keywordsSpellThemselves() {
        assertTrue(SyntaxKind.ELSE_IF_KEYWORD.isKeyword());
        assertEquals("elseif", SyntaxKind.ELSE_IF_KEYWORD.text());
        assertEquals("~=", SyntaxKind.NOT_EQUAL_OPERATOR.text());
        assertEquals("...", SyntaxKind.VAR_ARG_OPERATOR.text());
        assertFalse(SyntaxKind.IDENTIFIER.isKeyword());
        assertNull(SyntaxKind.STRING.text());
    }

    @Test
    void categoriesMatchTokenGroups() {
        assertEquals(SyntaxKind.Category.OPERATOR, SyntaxKind.STRING_CONCAT_OPERATOR.category());
        assertEquals(SyntaxKind.Category.PUNCTUATION, SyntaxKind.DOUBLE_COLON.category());
        assertEquals(SyntaxKind.Category.LITERAL, SyntaxKind.NUMBER.category());
        assertEquals(SyntaxKind.Category.NAME, SyntaxKind.IDENTIFIER.category());
        assertEquals(SyntaxKind.Category.NODE, SyntaxKind.CHUNK.category());
    }
}
