package com.luaparser.ast;

import java.util.List;

public record NameVar(
    int start,
    int length,
    Token name
) implements Var {
    private static final SyntaxKind KIND = SyntaxKind.NAME_VAR;

    public NameVar {
        SyntaxPreconditions.checkSpan(start, length, KIND);
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
        return List.of(name);
    }

    public static final class Builder extends SyntaxNodeBuilder<NameVar, Builder> {
        private Token name;

        private Builder() {
            super(KIND);
        }

        private Builder(NameVar node) {
            super(KIND, node.start(), node.length());
            this.name = node.name();
        }

        public Builder name(Token name) {
            this.name = name;
            return this;
        }

        @Override
        public NameVar build() {
            return new NameVar(start(), length(), name);
        }
    }
}
