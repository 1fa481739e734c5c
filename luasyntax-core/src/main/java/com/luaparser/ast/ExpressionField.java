package com.luaparser.ast;

import java.util.List;

public record ExpressionField(
    int start,
    int length,
    Expression exp
) implements Field {
    private static final SyntaxKind KIND = SyntaxKind.EXPRESSION_FIELD;

    public ExpressionField {
        SyntaxPreconditions.checkSpan(start, length, KIND);
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
        return List.of(exp);
    }

    public static final class Builder extends SyntaxNodeBuilder<ExpressionField, Builder> {
        private Expression exp;

        private Builder() {
            super(KIND);
        }

        private Builder(ExpressionField node) {
            super(KIND, node.start(), node.length());
            this.exp = node.exp();
        }

        public Builder exp(Expression exp) {
            this.exp = exp;
            return this;
        }

        @Override
        public ExpressionField build() {
            return new ExpressionField(start(), length(), exp);
        }
    }
}
