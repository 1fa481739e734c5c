package com.luaparser.ast;

import java.util.List;

public record StringArg(
    int start,
    int length,
    Token stringLiteral
) implements Args {
    private static final SyntaxKind KIND = SyntaxKind.STRING_ARG;

    public StringArg {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(stringLiteral, "stringLiteral", KIND);
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
        return List.of(stringLiteral);
    }

    public static final class Builder extends SyntaxNodeBuilder<StringArg, Builder> {
        private Token stringLiteral;

        private Builder() {
            super(KIND);
        }

        private Builder(StringArg node) {
            super(KIND, node.start(), node.length());
            this.stringLiteral = node.stringLiteral();
        }

        public Builder stringLiteral(Token stringLiteral) {
            this.stringLiteral = stringLiteral;
            return this;
        }

        @Override
        public StringArg build() {
            return new StringArg(start(), length(), stringLiteral);
        }
    }
}
