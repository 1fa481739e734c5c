package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

public record FunctionCallStatement(
    int start,
    int length,
    PrefixExpression prefixExp,
    Token colon,  // Can be null, together with name
    Token name,  // Can be null, together with colon
    Args args
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.FUNCTION_CALL_STATEMENT;

    public FunctionCallStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(prefixExp, "prefixExp", KIND);
        SyntaxPreconditions.required(args, "args", KIND);
        SyntaxPreconditions.paired(colon, "colon", name, "name", KIND);
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
        children.add(prefixExp);
        if (colon != null) {
            children.add(colon);
            children.add(name);
        }
        children.add(args);
        return List.copyOf(children);
    }

    public static final class Builder extends SyntaxNodeBuilder<FunctionCallStatement, Builder> {
        private PrefixExpression prefixExp;
        private Token colon;
        private Token name;
        private Args args;

        private Builder() {
            super(KIND);
        }

        private Builder(FunctionCallStatement node) {
            super(KIND, node.start(), node.length());
            this.prefixExp = node.prefixExp();
            this.colon = node.colon();
            this.name = node.name();
            this.args = node.args();
        }

        public Builder prefixExp(PrefixExpression prefixExp) {
            this.prefixExp = prefixExp;
            return this;
        }

        public Builder colon(Token colon) {
            this.colon = colon;
            return this;
        }

        public Builder name(Token name) {
            this.name = name;
            return this;
        }

        public Builder args(Args args) {
            this.args = args;
            return this;
        }

        @Override
        public FunctionCallStatement build() {
            return new FunctionCallStatement(start(), length(), prefixExp, colon, name, args);
        }
    }
}
