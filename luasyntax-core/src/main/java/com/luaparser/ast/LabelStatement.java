package com.luaparser.ast;

import java.util.List;

public record LabelStatement(
    int start,
    int length,
    Token doubleColon1,
    Token name,
    Token doubleColon2
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.LABEL_STATEMENT;

    public LabelStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(doubleColon1, "doubleColon1", KIND);
        SyntaxPreconditions.required(name, "name", KIND);
        SyntaxPreconditions.required(doubleColon2, "doubleColon2", KIND);
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
        return List.of(doubleColon1, name, doubleColon2);
    }

    public static final class Builder extends SyntaxNodeBuilder<LabelStatement, Builder> {
        private Token doubleColon1;
        private Token name;
        private Token doubleColon2;

        private Builder() {
            super(KIND);
        }

        private Builder(LabelStatement node) {
            super(KIND, node.start(), node.length());
            this.doubleColon1 = node.doubleColon1();
            this.name = node.name();
            this.doubleColon2 = node.doubleColon2();
        }

        public Builder doubleColon1(Token doubleColon1) {
            this.doubleColon1 = doubleColon1;
            return this;
        }

        public Builder name(Token name) {
            this.name = name;
            return this;
        }

        public Builder doubleColon2(Token doubleColon2) {
            this.doubleColon2 = doubleColon2;
            return this;
        }

        @Override
        public LabelStatement build() {
            return new LabelStatement(start(), length(), doubleColon1, name, doubleColon2);
        }
    }
}
