package com.luaparser.ast;

import java.util.List;

public record BracketField(
    int start,
    int length,
    Token openBracket,
    Expression identifierExp,
    Token closeBracket,
    Token assignmentOperator,
    Expression assignedExp
) implements Field {
    private static final SyntaxKind KIND = SyntaxKind.BRACKET_FIELD;

    public BracketField {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(openBracket, "openBracket", KIND);
        SyntaxPreconditions.required(identifierExp, "identifierExp", KIND);
        SyntaxPreconditions.required(closeBracket, "closeBracket", KIND);
        SyntaxPreconditions.required(assignmentOperator, "assignmentOperator", KIND);
        SyntaxPreconditions.required(assignedExp, "assignedExp", KIND);
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
        return List.of(openBracket, identifierExp, closeBracket, assignmentOperator, assignedExp);
    }

    public static final class Builder extends SyntaxNodeBuilder<BracketField, Builder> {
        private Token openBracket;
        private Expression identifierExp;
        private Token closeBracket;
        private Token assignmentOperator;
        private Expression assignedExp;

        private Builder() {
            super(KIND);
        }

        private Builder(BracketField node) {
            super(KIND, node.start(), node.length());
            this.openBracket = node.openBracket();
            this.identifierExp = node.identifierExp();
            this.closeBracket = node.closeBracket();
            this.assignmentOperator = node.assignmentOperator();
            this.assignedExp = node.assignedExp();
        }

        public Builder openBracket(Token openBracket) {
            this.openBracket = openBracket;
            return this;
        }

        public Builder identifierExp(Expression identifierExp) {
            this.identifierExp = identifierExp;
            return this;
        }

        public Builder closeBracket(Token closeBracket) {
            this.closeBracket = closeBracket;
            return this;
        }

        public Builder assignmentOperator(Token assignmentOperator) {
            this.assignmentOperator = assignmentOperator;
            return this;
        }

        public Builder assignedExp(Expression assignedExp) {
            this.assignedExp = assignedExp;
            return this;
        }

        @Override
        public BracketField build() {
            return new BracketField(
                start(),
                length(),
                openBracket,
                identifierExp,
                closeBracket,
                assignmentOperator,
                assignedExp);
        }
    }
}
