package com.luaparser.ast;

/**
 * Thrown when a node cannot be built from the supplied fields. No node is
 * produced when this is thrown.
 */
public abstract class SyntaxConstructionException extends RuntimeException {

    private final SyntaxKind kind;

    protected SyntaxConstructionException(String message, SyntaxKind kind) {
        super(message);
        this.kind = kind;
    }

    /**
     * The kind of the node whose construction failed.
     */
    public SyntaxKind kind() {
        return kind;
    }
}
