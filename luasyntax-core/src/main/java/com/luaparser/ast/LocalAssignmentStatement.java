package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

public record LocalAssignmentStatement(
    int start,
    int length,
    Token localKeyword,
    SeparatedList nameList,
    Token assignmentOperator,  // Can be null, together with expList
    SeparatedList expList  // Can be null, together with assignmentOperator
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.LOCAL_ASSIGNMENT_STATEMENT;

    public LocalAssignmentStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(localKeyword, "localKeyword", KIND);
        SyntaxPreconditions.required(nameList, "nameList", KIND);
        SyntaxPreconditions.paired(assignmentOperator, "assignmentOperator", expList, "expList", KIND);
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
        List<SyntaxNodeOrToken> children = new ArrayList<>();
        children.add(localKeyword);
        children.add(nameList);
        if (assignmentOperator != null) {
            children.add(assignmentOperator);
            children.add(expList);
        }
        return List.copyOf(children);
    }

    public static final class Builder extends SyntaxNodeBuilder<LocalAssignmentStatement, Builder> {
        private Token localKeyword;
        private SeparatedList nameList;
        private Token assignmentOperator;
        private SeparatedList expList;

        private Builder() {
            super(KIND);
        }

        private Builder(LocalAssignmentStatement node) {
            super(KIND, node.start(), node.length());
            this.localKeyword = node.localKeyword();
            this.nameList = node.nameList();
            this.assignmentOperator = node.assignmentOperator();
            this.expList = node.expList();
        }

        public Builder localKeyword(Token localKeyword) {
            this.localKeyword = localKeyword;
            return this;
        }

        public Builder nameList(SeparatedList nameList) {
            this.nameList = nameList;
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
        public LocalAssignmentStatement build() {
            return new LocalAssignmentStatement(
                start(),
                length(),
                localKeyword,
                nameList,
                assignmentOperator,
                expList);
        }
    }
}
