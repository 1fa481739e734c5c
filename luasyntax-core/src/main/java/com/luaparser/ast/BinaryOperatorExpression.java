package com.luaparser.ast;

import java.util.List;

public record BinaryOperatorExpression(
    int start,
    int length,
    Expression exp1,
    Token binaryOperator,
    Expression exp2
) implements Expression {
    private static final SyntaxKind KIND = SyntaxKind.BINARY_OPERATOR_EXPRESSION;

    public BinaryOperatorExpression {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(exp1, "exp1", KIND);
        SyntaxPreconditions.required(binaryOperator, "binaryOperator", KIND);
        SyntaxPreconditions.required(exp2, "exp2", KIND);
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
        return List.of(exp1, binaryOperator, exp2);
    }

    public static final class Builder extends SyntaxNodeBuilder<BinaryOperatorExpression, Builder> {
        private Expression exp1;
        private Token binaryOperator;
        private Expression exp2;

        private Builder() {
            super(KIND);
        }

        private Builder(BinaryOperatorExpression node) {
            super(KIND, node.start(), node.length());
            this.exp1 = node.exp1();
            this.binaryOperator = node.binaryOperator();
            this.exp2 = node.exp2();
        }

        public Builder exp1(Expression exp1) {
            this.exp1 = exp1;
            return this;
        }

        public Builder binaryOperator(Token binaryOperator) {
            this.binaryOperator = binaryOperator;
            return this;
        }

        public Builder exp2(Expression exp2) {
            this.exp2 = exp2;
            return this;
        }

        @Override
        public BinaryOperatorExpression build() {
            return new BinaryOperatorExpression(start(), length(), exp1, binaryOperator, exp2);
        }
    }
}
