package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

public record ReturnStatement(
    int start,
    int length,
    Token returnKeyword,
    SeparatedList expList,
    Token semicolon  // Can be null
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.RETURN_STATEMENT;

    public ReturnStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(returnKeyword, "returnKeyword", KIND);
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
        List<SyntaxNodeOrToken> children = new ArrayList<>();
        children.add(returnKeyword);
        children.add(expList);
        if (semicolon != null) {
            children.add(semicolon);
        }
        return List.copyOf(children);
    }

    public static final class Builder extends SyntaxNodeBuilder<ReturnStatement, Builder> {
        private Token returnKeyword;
        private SeparatedList expList;
        private Token semicolon;

        private Builder() {
            super(KIND);
        }

        private Builder(ReturnStatement node) {
            super(KIND, node.start(), node.length());
            this.returnKeyword = node.returnKeyword();
            this.expList = node.expList();
            this.semicolon = node.semicolon();
        }

        public Builder returnKeyword(Token returnKeyword) {
            this.returnKeyword = returnKeyword;
            return this;
        }

        public Builder expList(SeparatedList expList) {
            this.expList = expList;
            return this;
        }

        public Builder semicolon(Token semicolon) {
            this.semicolon = semicolon;
            return this;
        }

        @Override
        public ReturnStatement build() {
            return new ReturnStatement(start(), length(), returnKeyword, expList, semicolon);
        }
    }
}
