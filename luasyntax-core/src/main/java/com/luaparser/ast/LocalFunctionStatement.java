package com.luaparser.ast;

import java.util.List;

public record LocalFunctionStatement(
    int start,
    int length,
    Token localKeyword,
    Token functionKeyword,
    Token name,
    FunctionBody funcBody
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.LOCAL_FUNCTION_STATEMENT;

    public LocalFunctionStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(localKeyword, "localKeyword", KIND);
        SyntaxPreconditions.required(functionKeyword, "functionKeyword", KIND);
        SyntaxPreconditions.required(name, "name", KIND);
        SyntaxPreconditions.required(funcBody, "funcBody", KIND);
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
        return List.of(localKeyword, functionKeyword, name, funcBody);
    }

    public static final class Builder extends SyntaxNodeBuilder<LocalFunctionStatement, Builder> {
        private Token localKeyword;
        private Token functionKeyword;
        private Token name;
        private FunctionBody funcBody;

        private Builder() {
            super(KIND);
        }

        private Builder(LocalFunctionStatement node) {
            super(KIND, node.start(), node.length());
            this.localKeyword = node.localKeyword();
            this.functionKeyword = node.functionKeyword();
            this.name = node.name();
            this.funcBody = node.funcBody();
        }

        public Builder localKeyword(Token localKeyword) {
            this.localKeyword = localKeyword;
            return this;
        }

        public Builder functionKeyword(Token functionKeyword) {
            this.functionKeyword = functionKeyword;
            return this;
        }

        public Builder name(Token name) {
            this.name = name;
            return this;
        }

        public Builder funcBody(FunctionBody funcBody) {
            this.funcBody = funcBody;
            return this;
        }

        @Override
        public LocalFunctionStatement build() {
            return new LocalFunctionStatement(
                start(),
                length(),
                localKeyword,
                functionKeyword,
                name,
                funcBody);
        }
    }
}
