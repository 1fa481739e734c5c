package com.luaparser.ast;

import java.util.List;
import java.util.Objects;

public record Token(
    SyntaxKind kind,
    int start,
    int length,
    String text
) implements SyntaxNodeOrToken {
    public Token {
        Objects.requireNonNull(kind, "kind");
        Objects.requireNonNull(text, "text");
        if (!kind.isToken()) {
            throw new IllegalArgumentException(kind + " is not a token kind");
        }
        if (start < 0) {
            throw new IllegalArgumentException("Token start must be non-negative: " + start);
        }
        if (length != text.length()) {
            throw new IllegalArgumentException(
                "Token length " + length + " does not match text '" + text + "'");
        }
        if (length == 0 && kind != SyntaxKind.END_OF_FILE) {
            throw new IllegalArgumentException("Only END_OF_FILE may be empty, got " + kind);
        }
    }

    public static Token of(SyntaxKind kind, int start, String text) {
        return new Token(kind, start, text == null ? 0 : text.length(), text);
    }

    /**
     * Creates a token whose text is the fixed spelling of {@code kind}.
     *
     * @throws IllegalArgumentException if the kind has no fixed spelling
     */
    public static Token of(SyntaxKind kind, int start) {
        Objects.requireNonNull(kind, "kind");
        if (kind.text() == null) {
            throw new IllegalArgumentException(kind + " has no fixed spelling; supply the text");
        }
        return of(kind, start, kind.text());
    }

    @Override
    public boolean isLeaf() {
        return true;
    }

    @Override
    public boolean isToken() {
        return true;
    }

    @Override
    public List<SyntaxNodeOrToken> children() {
        return List.of();
    }
}
