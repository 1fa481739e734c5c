package com.luaparser.ast;

import java.util.List;

public record GotoStatement(
    int start,
    int length,
    Token gotoKeyword,
    Token name
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.GOTO_STATEMENT;

    public GotoStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(gotoKeyword, "gotoKeyword", KIND);
        SyntaxPreconditions.required(name, "name", KIND);
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
        return List.of(gotoKeyword, name);
    }

    public static final class Builder extends SyntaxNodeBuilder<GotoStatement, Builder> {
        private Token gotoKeyword;
        private Token name;

        private Builder() {
            super(KIND);
        }

        private Builder(GotoStatement node) {
            super(KIND, node.start(), node.length());
            this.gotoKeyword = node.gotoKeyword();
            this.name = node.name();
        }

        public Builder gotoKeyword(Token gotoKeyword) {
            this.gotoKeyword = gotoKeyword;
            return this;
        }

        public Builder name(Token name) {
            this.name = name;
            return this;
        }

        @Override
        public GotoStatement build() {
            return new GotoStatement(start(), length(), gotoKeyword, name);
        }
    }
}
