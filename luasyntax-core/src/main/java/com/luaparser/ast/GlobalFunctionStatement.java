package com.luaparser.ast;

import java.util.List;

public record GlobalFunctionStatement(
    int start,
    int length,
    Token functionKeyword,
    FunctionName funcName,
    FunctionBody funcBody
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.GLOBAL_FUNCTION_STATEMENT;

    public GlobalFunctionStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(functionKeyword, "functionKeyword", KIND);
        SyntaxPreconditions.required(funcName, "funcName", KIND);
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
        return List.of(functionKeyword, funcName, funcBody);
    }

    public static final class Builder extends SyntaxNodeBuilder<GlobalFunctionStatement, Builder> {
        private Token functionKeyword;
        private FunctionName funcName;
        private FunctionBody funcBody;

        private Builder() {
            super(KIND);
        }

        private Builder(GlobalFunctionStatement node) {
            super(KIND, node.start(), node.length());
            this.functionKeyword = node.functionKeyword();
            this.funcName = node.funcName();
            this.funcBody = node.funcBody();
        }

        public Builder functionKeyword(Token functionKeyword) {
            this.functionKeyword = functionKeyword;
            return this;
        }

        public Builder funcName(FunctionName funcName) {
            this.funcName = funcName;
            return this;
        }

        public Builder funcBody(FunctionBody funcBody) {
            this.funcBody = funcBody;
            return this;
        }

        @Override
        public GlobalFunctionStatement build() {
            return new GlobalFunctionStatement(start(), length(), functionKeyword, funcName, funcBody);
        }
    }
}
