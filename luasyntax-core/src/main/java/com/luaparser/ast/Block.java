package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

public record Block(
    int start,
    int length,
    List<Statement> statements
) implements SyntaxNode {
    private static final SyntaxKind KIND = SyntaxKind.BLOCK;

    public Block {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        statements = SyntaxPreconditions.requiredList(statements, "statements", KIND);
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
        return List.copyOf(statements);
    }

    public static final class Builder extends SyntaxNodeBuilder<Block, Builder> {
        private List<Statement> statements;
        private boolean statementsOwned;

        private Builder() {
            super(KIND);
        }

        private Builder(Block node) {
            super(KIND, node.start(), node.length());
            this.statements = node.statements();
        }

        public Builder statements(List<Statement> statements) {
            this.statements = statements;
            this.statementsOwned = false;
            return this;
        }

        public Builder addStatement(Statement statement) {
            if (!statementsOwned) {
                statements = statements == null ? new ArrayList<>() : new ArrayList<>(statements);
                statementsOwned = true;
            }
            statements.add(statement);
            return this;
        }

        @Override
        public Block build() {
            return new Block(start(), length(), statements);
        }
    }
}
