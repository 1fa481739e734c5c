package com.luaparser.ast;

import java.util.List;

public record ParenArg(
    int start,
    int length,
    Token openParen,
    SeparatedList expList,
    Token closeParen
) implements Args {
    private static final SyntaxKind KIND = SyntaxKind.PAREN_ARG;

    public ParenArg {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(openParen, "openParen", KIND);
        SyntaxPreconditions.required(expList, "expList", KIND);
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
        return List.of(openParen, expList, closeParen);
    }

    public static final class Builder extends SyntaxNodeBuilder<ParenArg, Builder> {
        private Token openParen;
        private SeparatedList expList;
        private Token closeParen;

        private Builder() {
            super(KIND);
        }

        private Builder(ParenArg node) {
            super(KIND, node.start(), node.length());
            this.openParen = node.openParen();
            this.expList = node.expList();
            this.closeParen = node.closeParen();
        }

        public Builder openParen(Token openParen) {
            this.openParen = openParen;
            return this;
        }

        public Builder expList(SeparatedList expList) {
            this.expList = expList;
            return this;
        }

        public Builder closeParen(Token closeParen) {
            this.closeParen = closeParen;
            return this;
        }

        @Override
        public ParenArg build() {
            return new ParenArg(start(), length(), openParen, expList, closeParen);
        }
    }
}
