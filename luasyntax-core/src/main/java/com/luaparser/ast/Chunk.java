package com.luaparser.ast;

import java.util.List;

/**
 * Root of a syntax tree: one compilation unit.
 */
public record Chunk(
    int start,
    int length,
    Block programBlock,
    Token endOfFile
) implements SyntaxNode {
    private static final SyntaxKind KIND = SyntaxKind.CHUNK;

    public Chunk {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(programBlock, "programBlock", KIND);
        SyntaxPreconditions.required(endOfFile, "endOfFile", KIND);
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
        return List.of(programBlock, endOfFile);
    }

    public static final class Builder extends SyntaxNodeBuilder<Chunk, Builder> {
        private Block programBlock;
        private Token endOfFile;

        private Builder() {
            super(KIND);
        }

        private Builder(Chunk node) {
            super(KIND, node.start(), node.length());
            this.programBlock = node.programBlock();
            this.endOfFile = node.endOfFile();
        }

        public Builder programBlock(Block programBlock) {
            this.programBlock = programBlock;
            return this;
        }

        public Builder endOfFile(Token endOfFile) {
            this.endOfFile = endOfFile;
            return this;
        }

        @Override
        public Chunk build() {
            return new Chunk(start(), length(), programBlock, endOfFile);
        }
    }
}
