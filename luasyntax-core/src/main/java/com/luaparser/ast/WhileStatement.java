package com.luaparser.ast;

import java.util.List;

public record WhileStatement(
    int start,
    int length,
    Token whileKeyword,
    Expression exp,
    Token doKeyword,
    Block block,
    Token endKeyword
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.WHILE_STATEMENT;

    public WhileStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(whileKeyword, "whileKeyword", KIND);
        SyntaxPreconditions.required(exp, "exp", KIND);
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
        return List.of(whileKeyword, exp, doKeyword, block, endKeyword);
    }

    public static final class Builder extends SyntaxNodeBuilder<WhileStatement, Builder> {
        private Token whileKeyword;
        private Expression exp;
        private Token doKeyword;
        private Block block;
        private Token endKeyword;

        private Builder() {
            super(KIND);
        }

        private Builder(WhileStatement node) {
            super(KIND, node.start(), node.length());
            this.whileKeyword = node.whileKeyword();
            this.exp = node.exp();
            this.doKeyword = node.doKeyword();
            this.block = node.block();
            this.endKeyword = node.endKeyword();
        }

        public Builder whileKeyword(Token whileKeyword) {
            this.whileKeyword = whileKeyword;
            return this;
        }

        public Builder exp(Expression exp) {
            this.exp = exp;
            return this;
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
        public WhileStatement build() {
            return new WhileStatement(start(), length(), whileKeyword, exp, doKeyword, block, endKeyword);
        }
    }
}
