package com.luaparser.ast;

import java.util.List;

/**
 * {@code for namelist in explist do block end}
 */
public record GenericForStatement(
    int start,
    int length,
    Token forKeyword,
    SeparatedList nameList,
    Token inKeyword,
    SeparatedList expList,
    Token doKeyword,
    Block block,
    Token endKeyword
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.GENERIC_FOR_STATEMENT;

    public GenericForStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(forKeyword, "forKeyword", KIND);
        SyntaxPreconditions.required(nameList, "nameList", KIND);
        SyntaxPreconditions.required(inKeyword, "inKeyword", KIND);
        SyntaxPreconditions.required(expList, "expList", KIND);
        SyntaxPreconditions.required(doKeyword, "doKeyword", KIND);
        SyntaxPreconditions.required(block, "block", KIND);
        SyntaxPreconditions.required(endKeyword, "endKeyword", KIND);
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
        return List.of(forKeyword, nameList, inKeyword, expList, doKeyword, block, endKeyword);
    }

    public static final class Builder extends SyntaxNodeBuilder<GenericForStatement, Builder> {
        private Token forKeyword;
        private SeparatedList nameList;
        private Token inKeyword;
        private SeparatedList expList;
        private Token doKeyword;
        private Block block;
        private Token endKeyword;

        private Builder() {
            super(KIND);
        }

        private Builder(GenericForStatement node) {
            super(KIND, node.start(), node.length());
            this.forKeyword = node.forKeyword();
            this.nameList = node.nameList();
            this.inKeyword = node.inKeyword();
            this.expList = node.expList();
            this.doKeyword = node.doKeyword();
            this.block = node.block();
            this.endKeyword = node.endKeyword();
        }

        public Builder forKeyword(Token forKeyword) {
            this.forKeyword = forKeyword;
            return this;
        }

        public Builder nameList(SeparatedList nameList) {
            this.nameList = nameList;
            return this;
        }

        public Builder inKeyword(Token inKeyword) {
            this.inKeyword = inKeyword;
            return this;
        }

        public Builder expList(SeparatedList expList) {
            this.expList = expList;
            return this;
        }

        public Builder doKeyword(Token doKeyword) {
            this.doKeyword = doKeyword;
            return this;
        }

        public Builder block(Block block) {
            this.block = block;
            return this;
        }

        public Builder endKeyword(Token endKeyword) {
            this.endKeyword = endKeyword;
            return this;
        }

        @Override
        public GenericForStatement build() {
            return new GenericForStatement(
                start(),
                length(),
                forKeyword,
                nameList,
                inKeyword,
                expList,
                doKeyword,
                block,
                endKeyword);
        }
    }
}
