package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

public record IfStatement(
    int start,
    int length,
    Token ifKeyword,
    Expression exp,
    Token thenKeyword,
    Block ifBlock,
    List<ElseIfBlock> elseIfList,
    ElseBlock elseBlock,  // Can be null
    Token endKeyword  // Always last, after the else-if and else blocks
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.IF_STATEMENT;

    public IfStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(ifKeyword, "ifKeyword", KIND);
        SyntaxPreconditions.required(exp, "exp", KIND);
        SyntaxPreconditions.required(thenKeyword, "thenKeyword", KIND);
        SyntaxPreconditions.required(ifBlock, "ifBlock", KIND);
        elseIfList = SyntaxPreconditions.requiredList(elseIfList, "elseIfList", KIND);
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
        List<SyntaxNodeOrToken> children = new ArrayList<>();
        children.add(ifKeyword);
        children.add(exp);
        children.add(thenKeyword);
        children.add(ifBlock);
        children.addAll(elseIfList);
        if (elseBlock != null) {
            children.add(elseBlock);
        }
        children.add(endKeyword);
        return List.copyOf(children);
    }

    public static final class Builder extends SyntaxNodeBuilder<IfStatement, Builder> {
        private Token ifKeyword;
        private Expression exp;
        private Token thenKeyword;
        private Block ifBlock;
        private List<ElseIfBlock> elseIfList;
        private boolean elseIfListOwned;
        private ElseBlock elseBlock;
        private Token endKeyword;

        private Builder() {
            super(KIND);
        }

        private Builder(IfStatement node) {
            super(KIND, node.start(), node.length());
            this.ifKeyword = node.ifKeyword();
            this.exp = node.exp();
            this.thenKeyword = node.thenKeyword();
            this.ifBlock = node.ifBlock();
            this.elseIfList = node.elseIfList();
            this.elseBlock = node.elseBlock();
            this.endKeyword = node.endKeyword();
        }

        public Builder ifKeyword(Token ifKeyword) {
            this.ifKeyword = ifKeyword;
            return this;
        }

        public Builder exp(Expression exp) {
            this.exp = exp;
            return this;
        }

        public Builder thenKeyword(Token thenKeyword) {
            this.thenKeyword = thenKeyword;
            return this;
        }

        public Builder ifBlock(Block ifBlock) {
            this.ifBlock = ifBlock;
            return this;
        }

        public Builder elseIfList(List<ElseIfBlock> elseIfList) {
            this.elseIfList = elseIfList;
            this.elseIfListOwned = false;
            return this;
        }

        public Builder addElseIf(ElseIfBlock elseIf) {
            if (!elseIfListOwned) {
                elseIfList = elseIfList == null ? new ArrayList<>() : new ArrayList<>(elseIfList);
                elseIfListOwned = true;
            }
            elseIfList.add(elseIf);
            return this;
        }

        public Builder elseBlock(ElseBlock elseBlock) {
            this.elseBlock = elseBlock;
            return this;
        }

        public Builder endKeyword(Token endKeyword) {
            this.endKeyword = endKeyword;
            return this;
        }

        @Override
        public IfStatement build() {
            return new IfStatement(
                start(),
                length(),
                ifKeyword,
                exp,
                thenKeyword,
                ifBlock,
                elseIfList,
                elseBlock,
                endKeyword);
        }
    }
}
