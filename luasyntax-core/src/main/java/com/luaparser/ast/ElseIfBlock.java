package com.luaparser.ast;

import java.util.List;

public record ElseIfBlock(
    int start,
    int length,
    Token elseIfKeyword,
    Expression exp,
    Token thenKeyword,
    Block block
) implements SyntaxNode {
    private static final SyntaxKind KIND = SyntaxKind.ELSE_IF_BLOCK;

    public ElseIfBlock {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(elseIfKeyword, "elseIfKeyword", KIND);
        SyntaxPreconditions.required(exp, "exp", KIND);
        SyntaxPreconditions.required(thenKeyword, "thenKeyword", KIND);
        SyntaxPreconditions.required(block, "block", KIND);
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
        return List.of(elseIfKeyword, exp, thenKeyword, block);
    }

    public static final class Builder extends SyntaxNodeBuilder<ElseIfBlock, Builder> {
        private Token elseIfKeyword;
        private Expression exp;
        private Token thenKeyword;
        private Block block;

        private Builder() {
            super(KIND);
        }

        private Builder(ElseIfBlock node) {
            super(KIND, node.start(), node.length());
            this.elseIfKeyword = node.elseIfKeyword();
            this.exp = node.exp();
            this.thenKeyword = node.thenKeyword();
            this.block = node.block();
        }

        public Builder elseIfKeyword(Token elseIfKeyword) {
            this.elseIfKeyword = elseIfKeyword;
            return this;
        }

        public Builder exp(Expression exp) {
            this.exp = exp;
            return this;
        }

        public Builder thenKeyword(Token thenKeyword) {
            this.thenKeyword = thenKeyword;
            return this;
        }

        public Builder block(Block block) {
            this.block = block;
            return this;
        }

        @Override
        public ElseIfBlock build() {
            return new ElseIfBlock(start(), length(), elseIfKeyword, exp, thenKeyword, block);
        }
    }
}
