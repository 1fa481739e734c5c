package com.luaparser.ast;

import java.util.List;

public record RepeatStatement(
    int start,
    int length,
    Token repeatKeyword,
    Block block,
    Token untilKeyword,
    Expression exp
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.REPEAT_STATEMENT;

    public RepeatStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(repeatKeyword, "repeatKeyword", KIND);
        SyntaxPreconditions.required(block, "block", KIND);
        SyntaxPreconditions.required(untilKeyword, "untilKeyword", KIND);
        SyntaxPreconditions.required(exp, "exp", KIND);
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
        return List.of(repeatKeyword, block, untilKeyword, exp);
    }

    public static final class Builder extends SyntaxNodeBuilder<RepeatStatement, Builder> {
        private Token repeatKeyword;
        private Block block;
        private Token untilKeyword;
        private Expression exp;

        private Builder() {
            super(KIND);
        }

        private Builder(RepeatStatement node) {
            super(KIND, node.start(), node.length());
            this.repeatKeyword = node.repeatKeyword();
            this.block = node.block();
            this.untilKeyword = node.untilKeyword();
            this.exp = node.exp();
        }

        public Builder repeatKeyword(Token repeatKeyword) {
            this.repeatKeyword = repeatKeyword;
            return this;
        }

        public Builder block(Block block) {
            this.block = block;
            return this;
        }

        public Builder untilKeyword(Token untilKeyword) {
            this.untilKeyword = untilKeyword;
            return this;
        }

        public Builder exp(Expression exp) {
            this.exp = exp;
            return this;
        }

        @Override
        public RepeatStatement build() {
            return new RepeatStatement(start(), length(), repeatKeyword, block, untilKeyword, exp);
        }
    }
}
