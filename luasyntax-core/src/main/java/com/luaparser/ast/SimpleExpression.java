package com.luaparser.ast;

import java.util.List;

/**
 * A single-token expression: {@code nil}, {@code true}, {@code false}, a number, a string or {@code ...}.
 */
public record SimpleExpression(
    int start,
    int length,
    Token expressionValue
) implements Expression {
    private static final SyntaxKind KIND = SyntaxKind.SIMPLE_EXPRESSION;

    public SimpleExpression {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(expressionValue, "expressionValue", KIND);
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
        return List.of(expressionValue);
    }

    public static final class Builder extends SyntaxNodeBuilder<SimpleExpression, Builder> {
        private Token expressionValue;

        private Builder() {
            super(KIND);
        }

        private Builder(SimpleExpression node) {
            super(KIND, node.start(), node.length());
            this.expressionValue = node.expressionValue();
        }

        public Builder expressionValue(Token expressionValue) {
            this.expressionValue = expressionValue;
            return this;
        }

        @Override
        public SimpleExpression build() {
            return new SimpleExpression(start(), length(), expressionValue);
        }
    }
}
