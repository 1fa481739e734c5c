package com.luaparser.ast;

import java.util.List;

public record AssignmentStatement(
    int start,
    int length,
    SeparatedList varList,
    Token assignmentOperator,
    SeparatedList expList
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.ASSIGNMENT_STATEMENT;

    public AssignmentStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(varList, "varList", KIND);
        SyntaxPreconditions.required(assignmentOperator, "assignmentOperator", KIND);
        SyntaxPreconditions.required(expList, "expList", KIND);
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
        return List.of(varList, assignmentOperator, expList);
    }

    public static final class Builder extends SyntaxNodeBuilder<AssignmentStatement, Builder> {
        private SeparatedList varList;
        private Token assignmentOperator;
        private SeparatedList expList;

        private Builder() {
            super(KIND);
        }

        private Builder(AssignmentStatement node) {
            super(KIND, node.start(), node.length());
            this.varList = node.varList();
            this.assignmentOperator = node.assignmentOperator();
            this.expList = node.expList();
        }

        public Builder varList(SeparatedList varList) {
            this.varList = varList;
            return this;
        }

        public Builder assignmentOperator(Token assignmentOperator) {
            this.assignmentOperator = assignmentOperator;
            return this;
        }

        public Builder expList(SeparatedList expList) {
            this.expList = expList;
            return this;
        }

        @Override
        public AssignmentStatement build() {
            return new AssignmentStatement(start(), length(), varList, assignmentOperator, expList);
        }
    }
}
