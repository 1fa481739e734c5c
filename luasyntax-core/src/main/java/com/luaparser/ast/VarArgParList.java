package com.luaparser.ast;

import java.util.List;

public record VarArgParList(
    int start,
    int length,
    Token varargOperator
) implements ParList {
    private static final SyntaxKind KIND = SyntaxKind.VAR_ARG_PAR_LIST;

    public VarArgParList {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(varargOperator, "varargOperator", KIND);
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
        return List.of(varargOperator);
    }

    public static final class Builder extends SyntaxNodeBuilder<VarArgParList, Builder> {
        private Token varargOperator;

        private Builder() {
            super(KIND);
        }

        private Builder(VarArgParList node) {
            super(KIND, node.start(), node.length());
            this.varargOperator = node.varargOperator();
        }

        public Builder varargOperator(Token varargOperator) {
            this.varargOperator = varargOperator;
            return this;
        }

        @Override
        public VarArgParList build() {
            return new VarArgParList(start(), length(), varargOperator);
        }
    }
}
