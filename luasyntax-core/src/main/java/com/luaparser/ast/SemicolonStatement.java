package com.luaparser.ast;

import java.util.List;

public record SemicolonStatement(
    int start,
    int length,
    Token semicolon
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.SEMICOLON_STATEMENT;

    public SemicolonStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(semicolon, "semicolon", KIND);
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
        return List.of(semicolon);
    }

    public static final class Builder extends SyntaxNodeBuilder<SemicolonStatement, Builder> {
        private Token semicolon;

        private Builder() {
            super(KIND);
        }

        private Builder(SemicolonStatement node) {
            super(KIND, node.start(), node.length());
            this.semicolon = node.semicolon();
        }

        public Builder semicolon(Token semicolon) {
            this.semicolon = semicolon;
            return this;
        }

        @Override
        public SemicolonStatement build() {
            return new SemicolonStatement(start(), length(), semicolon);
        }
    }
}
