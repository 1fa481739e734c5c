package com.luaparser.ast;

import java.util.List;

public record TableConstructorArg(
    int start,
    int length,
    Token openCurly,
    SeparatedList fieldList,
    Token closeCurly
) implements Args {
    private static final SyntaxKind KIND = SyntaxKind.TABLE_CONSTRUCTOR_ARG;

    public TableConstructorArg {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(openCurly, "openCurly", KIND);
        SyntaxPreconditions.required(fieldList, "fieldList", KIND);
        SyntaxPreconditions.required(closeCurly, "closeCurly", KIND);
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
        return List.of(openCurly, fieldList, closeCurly);
    }

    public static final class Builder extends SyntaxNodeBuilder<TableConstructorArg, Builder> {
        private Token openCurly;
        private SeparatedList fieldList;
        private Token closeCurly;

        private Builder() {
            super(KIND);
        }

        private Builder(TableConstructorArg node) {
            super(KIND, node.start(), node.length());
            this.openCurly = node.openCurly();
            this.fieldList = node.fieldList();
            this.closeCurly = node.closeCurly();
        }

        public Builder openCurly(Token openCurly) {
            this.openCurly = openCurly;
            return this;
        }

        public Builder fieldList(SeparatedList fieldList) {
            this.fieldList = fieldList;
            return this;
        }

        public Builder closeCurly(Token closeCurly) {
            this.closeCurly = closeCurly;
            return this;
        }

        @Override
        public TableConstructorArg build() {
            return new TableConstructorArg(start(), length(), openCurly, fieldList, closeCurly);
        }
    }
}
