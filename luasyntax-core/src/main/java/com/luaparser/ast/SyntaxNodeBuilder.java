package com.luaparser.ast;

/**
 * Common state of the per-node builders: the node's span.
 *
 * <p>A builder belongs to a single caller until {@link #build()} returns; it
 * is not safe to fill from several threads. The node it returns is immutable
 * and can be shared freely.</p>
 *
 * @param <N> the node type produced
 * @param <B> the concrete builder type, for chaining
 */
public abstract class SyntaxNodeBuilder<N extends SyntaxNode, B extends SyntaxNodeBuilder<N, B>> {

    private final SyntaxKind kind;
    private Integer start;
    private Integer length;

    protected SyntaxNodeBuilder(SyntaxKind kind) {
        this.kind = kind;
    }

    protected SyntaxNodeBuilder(SyntaxKind kind, int start, int length) {
        this(kind);
        this.start = start;
        this.length = length;
    }

    @SuppressWarnings("unchecked")
    private B self() {
        return (B) this;
    }

    public B start(int start) {
        this.start = start;
        return self();
    }

    public B length(int length) {
        this.length = length;
        return self();
    }

    public B span(int start, int length) {
        return start(start).length(length);
    }

    protected int start() {
        if (start == null) {
            throw new MissingRequiredFieldException("start", kind);
        }
        return start;
    }

    protected int length() {
        if (length == null) {
            throw new MissingRequiredFieldException("length", kind);
        }
        return length;
    }

    /**
     * Validates the accumulated fields and seals them into a node.
     *
     * @throws MissingRequiredFieldException if a required field was never set
     * @throws UnpairedOptionalFieldException if only half of an optional pair was set
     */
    public abstract N build();
}
