package com.luaparser.ast;

import java.util.List;

public record SquareBracketVar(
    int start,
    int length,
    PrefixExpression prefixExp,
    Token openBracket,
    Expression exp,
    Token closeBracket
) implements Var {
    private static final SyntaxKind KIND = SyntaxKind.SQUARE_BRACKET_VAR;

    public SquareBracketVar {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(prefixExp, "prefixExp", KIND);
        SyntaxPreconditions.required(openBracket, "openBracket", KIND);
        SyntaxPreconditions.required(exp, "exp", KIND);
        SyntaxPreconditions.required(closeBracket, "closeBracket", KIND);
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
        return List.of(prefixExp, openBracket, exp, closeBracket);
    }

    public static final class Builder extends SyntaxNodeBuilder<SquareBracketVar, Builder> {
        private PrefixExpression prefixExp;
        private Token openBracket;
        private Expression exp;
        private Token closeBracket;

        private Builder() {
            super(KIND);
        }

        private Builder(SquareBracketVar node) {
            super(KIND, node.start(), node.length());
            this.prefixExp = node.prefixExp();
            this.openBracket = node.openBracket();
            this.exp = node.exp();
            this.closeBracket = node.closeBracket();
        }

        public Builder prefixExp(PrefixExpression prefixExp) {
            this.prefixExp = prefixExp;
            return this;
        }

        public Builder openBracket(Token openBracket) {
            this.openBracket = openBracket;
            return this;
        }

        public Builder exp(Expression exp) {
            this.exp = exp;
            return this;
        }

        public Builder closeBracket(Token closeBracket) {
            this.closeBracket = closeBracket;
            return this;
        }

        @Override
        public SquareBracketVar build() {
            return new SquareBracketVar(start(), length(), prefixExp, openBracket, exp, closeBracket);
        }
    }
}
