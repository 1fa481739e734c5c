package com.luaparser.ast;

import java.util.List;

public record FunctionDefinition(
    int start,
    int length,
    Token functionKeyword,
    FunctionBody functionBody
) implements Expression {
    private static final SyntaxKind KIND = SyntaxKind.FUNCTION_DEFINITION;

    public FunctionDefinition {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(functionKeyword, "functionKeyword", KIND);
        SyntaxPreconditions.required(functionBody, "functionBody", KIND);
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
        return List.of(functionKeyword, functionBody);
    }

    public static final class Builder extends SyntaxNodeBuilder<FunctionDefinition, Builder> {
        private Token functionKeyword;
        private FunctionBody functionBody;

        private Builder() {
            super(KIND);
        }

        private Builder(FunctionDefinition node) {
            super(KIND, node.start(), node.length());
            this.functionKeyword = node.functionKeyword();
            this.functionBody = node.functionBody();
        }

        public Builder functionKeyword(Token functionKeyword) {
            this.functionKeyword = functionKeyword;
            return this;
        }

        public Builder functionBody(FunctionBody functionBody) {
            this.functionBody = functionBody;
            return this;
        }

        @Override
        public FunctionDefinition build() {
            return new FunctionDefinition(start(), length(), functionKeyword, functionBody);
        }
    }
}
