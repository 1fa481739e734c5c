package com.luaparser.ast;

import java.util.List;

public record DoStatement(
    int start,
    int length,
    Token doKeyword,
    Block block,
    Token endKeyword
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.DO_STATEMENT;

    public DoStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(doKeyword, "doKeyword", KIND);
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
        return List.of(doKeyword, block, endKeyword);
    }

    public static final class Builder extends SyntaxNodeBuilder<DoStatement, Builder> {
        private Token doKeyword;
        private Block block;
        private Token endKeyword;

        private Builder() {
            super(KIND);
        }

        private Builder(DoStatement node) {
            super(KIND, node.start(), node.length());
            this.doKeyword = node.doKeyword();
            this.block = node.block();
            this.endKeyword = node.endKeyword();
        }

        public Builder doKeyword(Token doKeyword) {
            this.doKeyword = doKeyword;
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
        public DoStatement build() {
            return new DoStatement(start(), length(), doKeyword, block, endKeyword);
        }
    }
}
