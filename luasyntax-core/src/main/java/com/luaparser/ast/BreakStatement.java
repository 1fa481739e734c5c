package com.luaparser.ast;

import java.util.List;

public record BreakStatement(
    int start,
    int length,
    Token breakKeyword
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.BREAK_STATEMENT;

    public BreakStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(breakKeyword, "breakKeyword", KIND);
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
        return List.of(breakKeyword);
    }

    public static final class Builder extends SyntaxNodeBuilder<BreakStatement, Builder> {
        private Token breakKeyword;

        private Builder() {
            super(KIND);
        }

        private Builder(BreakStatement node) {
            super(KIND, node.start(), node.length());
            this.breakKeyword = node.breakKeyword();
        }

        public Builder breakKeyword(Token breakKeyword) {
            this.breakKeyword = breakKeyword;
            return this;
        }

        @Override
        public BreakStatement build() {
            return new BreakStatement(start(), length(), breakKeyword);
        }
    }
}
