package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code Name {. Name} [: Name]}, the name of a global function statement.
 */
public record FunctionName(
    int start,
    int length,
    Token name,
    SeparatedList funcNameList,
    Token optionalColon,  // Can be null, together with optionalName
    Token optionalName  // Can be null, together with optionalColon
) implements SyntaxNode {
    private static final SyntaxKind KIND = SyntaxKind.FUNCTION_NAME;

    public FunctionName {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(name, "name", KIND);
        SyntaxPreconditions.required(funcNameList, "funcNameList", KIND);
        SyntaxPreconditions.paired(optionalColon, "optionalColon", optionalName, "optionalName", KIND);
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
        List<SyntaxNodeOrToken> children = new ArrayList<>();
        children.add(name);
        children.add(funcNameList);
        if (optionalColon != null) {
            children.add(optionalColon);
            children.add(optionalName);
        }
        return List.copyOf(children);
    }

    public static final class Builder extends SyntaxNodeBuilder<FunctionName, Builder> {
        private Token name;
        private SeparatedList funcNameList;
        private Token optionalColon;
        private Token optionalName;

        private Builder() {
            super(KIND);
        }

        private Builder(FunctionName node) {
            super(KIND, node.start(), node.length());
            this.name = node.name();
            this.funcNameList = node.funcNameList();
            this.optionalColon = node.optionalColon();
            this.optionalName = node.optionalName();
        }

        public Builder name(Token name) {
            this.name = name;
            return this;
        }

        public Builder funcNameList(SeparatedList funcNameList) {
            this.funcNameList = funcNameList;
            return this;
        }

        public Builder optionalColon(Token optionalColon) {
            this.optionalColon = optionalColon;
            return this;
        }

        public Builder optionalName(Token optionalName) {
            this.optionalName = optionalName;
            return this;
        }

        @Override
        public FunctionName build() {
            return new FunctionName(start(), length(), name, funcNameList, optionalColon, optionalName);
        }
    }
}
