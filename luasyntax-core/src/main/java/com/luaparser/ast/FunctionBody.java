package com.luaparser.ast;

import java.util.List;

public record FunctionBody(
    int start,
    int length,
    Token openParen,
    ParList parameterList,
    Token closeParen,
    Block block,
    Token endKeyword
) implements SyntaxNode {
    private static final SyntaxKind KIND = SyntaxKind.FUNCTION_BODY;

    public FunctionBody {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(openParen, "openParen", KIND);
        SyntaxPreconditions.required(parameterList, "parameterList", KIND);
        SyntaxPreconditions.required(closeParen, "closeParen", KIND);
        SyntaxPreconditions.required(block, "block", KIND);
        SyntaxPreconditions.required(endKeyword, "endKeyword", KIND);
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
        return List.of(openParen, parameterList, closeParen, block, endKeyword);
    }

    public static final class Builder extends SyntaxNodeBuilder<FunctionBody, Builder> {
        private Token openParen;
        private ParList parameterList;
        private Token closeParen;
        private Block block;
        private Token endKeyword;

        private Builder() {
            super(KIND);
        }

        private Builder(FunctionBody node) {
            super(KIND, node.start(), node.length());
            this.openParen = node.openParen();
            this.parameterList = node.parameterList();
            this.closeParen = node.closeParen();
            this.block = node.block();
            this.endKeyword = node.endKeyword();
        }

        public Builder openParen(Token openParen) {
            this.openParen = openParen;
            return this;
        }

        public Builder parameterList(ParList parameterList) {
            this.parameterList = parameterList;
            return this;
        }

        public Builder closeParen(Token closeParen) {
            this.closeParen = closeParen;
            return this;
        }

        public Builder block(Block block) {
            this.block = block;
            return this;
        }

        public Builder endKeyword(Token endKeyword) {
            this.endKeyword = endKeyword;
            return this;
        }

        @Override
        public FunctionBody build() {
            return new FunctionBody(
                start(),
                length(),
                openParen,
                parameterList,
                closeParen,
                block,
                endKeyword);
        }
    }
}
