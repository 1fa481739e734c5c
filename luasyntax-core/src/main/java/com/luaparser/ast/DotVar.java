package com.luaparser.ast;

import java.util.List;

public record DotVar(
    int start,
    int length,
    PrefixExpression prefixExp,
    Token dotOperator,
    Token nameIdentifier
) implements Var {
    private static final SyntaxKind KIND = SyntaxKind.DOT_VAR;

    public DotVar {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(prefixExp, "prefixExp", KIND);
        SyntaxPreconditions.required(dotOperator, "dotOperator", KIND);
        SyntaxPreconditions.required(nameIdentifier, "nameIdentifier", KIND);
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
        return List.of(prefixExp, dotOperator, nameIdentifier);
    }

    public static final class Builder extends SyntaxNodeBuilder<DotVar, Builder> {
        private PrefixExpression prefixExp;
        private Token dotOperator;
        private Token nameIdentifier;

        private Builder() {
            super(KIND);
        }

        private Builder(DotVar node) {
            super(KIND, node.start(), node.length());
            this.prefixExp = node.prefixExp();
            this.dotOperator = node.dotOperator();
            this.nameIdentifier = node.nameIdentifier();
        }

        public Builder prefixExp(PrefixExpression prefixExp) {
            this.prefixExp = prefixExp;
            return this;
        }

        public Builder dotOperator(Token dotOperator) {
            this.dotOperator = dotOperator;
            return this;
        }

        public Builder nameIdentifier(Token nameIdentifier) {
            this.nameIdentifier = nameIdentifier;
            return this;
        }

        @Override
        public DotVar build() {
            return new DotVar(start(), length(), prefixExp, dotOperator, nameIdentifier);
        }
    }
}
