package com.luaparser.ast;

import java.util.List;

public record AssignmentField(
    int start,
    int length,
    Token name,
    Token assignmentOperator,
    Expression exp
) implements Field {
    private static final SyntaxKind KIND = SyntaxKind.ASSIGNMENT_FIELD;

    public AssignmentField {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(name, "name", KIND);
        SyntaxPreconditions.required(assignmentOperator, "assignmentOperator", KIND);
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
        return List.of(name, assignmentOperator, exp);
    }

    public static final class Builder extends SyntaxNodeBuilder<AssignmentField, Builder> {
        private Token name;
        private Token assignmentOperator;
        private Expression exp;

        private Builder() {
            super(KIND);
        }

        private Builder(AssignmentField node) {
            super(KIND, node.start(), node.length());
            this.name = node.name();
            this.assignmentOperator = node.assignmentOperator();
            this.exp = node.exp();
        }

        public Builder name(Token name) {
            this.name = name;
            return this;
        }

        public Builder assignmentOperator(Token assignmentOperator) {
            this.assignmentOperator = assignmentOperator;
            return this;
        }

        public Builder exp(Expression exp) {
            this.exp = exp;
            return this;
        }

        @Override
        public AssignmentField build() {
            return new AssignmentField(start(), length(), name, assignmentOperator, exp);
        }
    }
}
