package com.luaparser.ast;

import java.util.List;

public record ElseBlock(
    int start,
    int length,
    Token elseKeyword,
    Block block
) implements SyntaxNode {
    private static final SyntaxKind KIND = SyntaxKind.ELSE_BLOCK;

    public ElseBlock {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(elseKeyword, "elseKeyword", KIND);
        SyntaxPreconditions.required(block, "block", KIND);
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
        return List.of(elseKeyword, block);
    }

    public static final class Builder extends SyntaxNodeBuilder<ElseBlock, Builder> {
        private Token elseKeyword;
        private Block block;

        private Builder() {
            super(KIND);
        }

        private Builder(ElseBlock node) {
            super(KIND, node.start(), node.length());
            this.elseKeyword = node.elseKeyword();
            this.block = node.block();
        }

        public Builder elseKeyword(Token elseKeyword) {
            this.elseKeyword = elseKeyword;
            return this;
        }

        public Builder block(Block block) {
            this.block = block;
            return this;
        }

        @Override
        public ElseBlock build() {
            return new ElseBlock(start(), length(), elseKeyword, block);
        }
    }
}
