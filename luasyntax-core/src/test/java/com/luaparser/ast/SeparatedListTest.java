package com.luaparser.ast;

import org.junit.jupiter.api.Test;

import java.util.List;

import static com.luaparser.ast.SyntaxKind.*;
import static com.luaparser.ast.TestTrees.*;
import static org.junit.jupiter.api.Assertions.*;

public class SeparatedListTest {

    private final NameVar a = nameVar("a", 0);
    private final NameVar b = nameVar("b", 3);
    private final NameVar c = nameVar("c", 6);
    private final Token comma1 = token(COMMA, 1);
    private final Token comma2 = token(COMMA, 4);

    @Test
    void childrenInterleaveItemsAndSeparators() {
        SeparatedList list = SeparatedList.of(List.of(a, b, c), List.of(comma1, comma2));

        assertEquals(List.of(a, comma1, b, comma2, c), list.children());
        assertEquals(List.of(a, b, c), list.items());
        assertEquals(List.of(comma1, comma2), list.separators());
        assertEquals(3, list.elements().size());
        assertNull(list.elements().get(2).separator());
    }

    @Test
    void spanCoversFirstItemThroughLastElement() {
        SeparatedList list = SeparatedList.of(List.of(a, b, c), List.of(comma1, comma2));

        assertEquals(0, list.start());
        assertEquals(7, list.end());
    }

    @Test
    void elementSpanIncludesItsSeparator() {
        SeparatedListElement element = SeparatedListElement.of(a, comma1);

        assertEquals(0, element.start());
        assertEquals(2, element.length());
        assertEquals(List.of(NAME_VAR, COMMA), kinds(element.children()));
    }

    @Test
    void trailingSeparatorIsKept() {
        Token trailing = token(COMMA, 7);
        SeparatedList list = SeparatedList.of(List.of(a, b, c), List.of(comma1, comma2, trailing));

        assertEquals(List.of(a, comma1, b, comma2, c, trailing), list.children());
        assertEquals(8, list.end());
    }

    @Test
    void rejectsSeparatorCountThatCannotSeparate() {
        assertThrows(IllegalArgumentException.class, () -> SeparatedList.of(List.of(a, b, c), List.of(comma1)));
        assertThrows(IllegalArgumentException.class, () -> SeparatedList.of(List.of(), List.of()));
    }

    @Test
    void emptyListIsLeaf() {
        SeparatedList empty = SeparatedList.empty(5);

        assertTrue(empty.isLeaf());
        assertTrue(empty.children().isEmpty());
        assertEquals(5, empty.start());
        assertEquals(0, empty.length());
    }

    @Test
    void builderAppendsElements() {
        SeparatedList list = SeparatedList.builder()
            .span(0, 4)
            .add(a, comma1)
            .add(b)
            .build();

        assertEquals(List.of(a, comma1, b), list.children());
        assertEquals(SeparatedList.of(List.of(a, b), List.of(comma1)).elements(), list.elements());
    }

    @Test
    void tokensCanBeItems() {
        SeparatedList names = SeparatedList.of(List.of(name("x", 0), name("y", 2)), List.of(comma1));

        assertEquals(List.of(IDENTIFIER, COMMA, IDENTIFIER), kinds(names.children()));
    }
}
