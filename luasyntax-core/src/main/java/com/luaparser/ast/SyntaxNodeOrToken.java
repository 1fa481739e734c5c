package com.luaparser.ast;

import java.util.List;

/**
 * Base interface for every element of a syntax tree: a terminal {@link Token}
 * or a composite {@link SyntaxNode}.
 */
public sealed interface SyntaxNodeOrToken permits Token, SyntaxNode {

    SyntaxKind kind();
    int start();
    int length();

    default int end() {
        return start() + length();
    }

    boolean isLeaf();
    boolean isToken();

    /**
     * The elements of this production in source order. Never null; unmodifiable.
     */
    List<SyntaxNodeOrToken> children();
}
