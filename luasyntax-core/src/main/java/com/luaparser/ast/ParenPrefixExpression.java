package com.luaparser.ast;

import java.util.List;

public record ParenPrefixExpression(
    int start,
    int length,
    Token openParen,
    Expression exp,
    Token closeParen
) implements PrefixExpression {
    private static final SyntaxKind KIND = SyntaxKind.PAREN_PREFIX_EXPRESSION;

    public ParenPrefixExpression {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(openParen, "openParen", KIND);
        SyntaxPreconditions.required(exp, "exp", KIND);
        SyntaxPreconditions.required(closeParen, "closeParen", KIND);
    }

    public static Builder builder() {
        return new Builder();
    }

    public Builder toBuilder() {
        return new Builder(this);
    }

    @Override
    public SyntaxKind kind() {
        return KIND;
    }

    @Override
    public List<SyntaxNodeOrToken> children() {
        return List.of(openParen, exp, closeParen);
    }

    public static final class Builder extends SyntaxNodeBuilder<ParenPrefixExpression, Builder> {
        private Token openParen;
        private Expression exp;
        private Token closeParen;

        private Builder() {
            super(KIND);
        }

        private Builder(ParenPrefixExpression node) {
            super(KIND, node.start(), node.length());
            this.openParen = node.openParen();
            this.exp = node.exp();
            this.closeParen = node.closeParen();
        }

        public Builder openParen(Token openParen) {
            this.openParen = openParen;
            return this;
        }

        public Builder exp(Expression exp) {
            this.exp = exp;
            return this;
        }

        public Builder closeParen(Token closeParen) {
            this.closeParen = closeParen;
            return this;
        }

        @Override
        public ParenPrefixExpression build() {
            return new ParenPrefixExpression(start(), length(), openParen, exp, closeParen);
        }
    }
}
