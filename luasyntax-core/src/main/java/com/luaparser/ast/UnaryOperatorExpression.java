package com.luaparser.ast;

import java.util.List;

public record UnaryOperatorExpression(
    int start,
    int length,
    Token unaryOperator,
    Expression exp
) implements Expression {
    private static final SyntaxKind KIND = SyntaxKind.UNARY_OPERATOR_EXPRESSION;

    public UnaryOperatorExpression {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(unaryOperator, "unaryOperator", KIND);
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
        return List.of(unaryOperator, exp);
    }

    public static final class Builder extends SyntaxNodeBuilder<UnaryOperatorExpression, Builder> {
        private Token unaryOperator;
        private Expression exp;

        private Builder() {
            super(KIND);
        }

        private Builder(UnaryOperatorExpression node) {
            super(KIND, node.start(), node.length());
            this.unaryOperator = node.unaryOperator();
            this.exp = node.exp();
        }

        public Builder unaryOperator(Token unaryOperator) {
            this.unaryOperator = unaryOperator;
            return this;
        }

        public Builder exp(Expression exp) {
            this.exp = exp;
            return this;
        }

        @Override
        public UnaryOperatorExpression build() {
            return new UnaryOperatorExpression(start(), length(), unaryOperator, exp);
        }
    }
}
