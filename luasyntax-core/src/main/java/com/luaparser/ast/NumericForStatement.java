package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * {@code for name = exp1, exp2 [, exp3] do block end}
 */
public record NumericForStatement(
    int start,
    int length,
    Token forKeyword,
    Token name,
    Token assignmentOperator,
    Expression exp1,
    Token comma,
    Expression exp2,
    Token optionalComma,  // Can be null, together with optionalExp3
    Expression optionalExp3,  // Can be null, together with optionalComma
    Token doKeyword,
    Block block,
    Token endKeyword
) implements Statement {
    private static final SyntaxKind KIND = SyntaxKind.NUMERIC_FOR_STATEMENT;

    public NumericForStatement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(forKeyword, "forKeyword", KIND);
        SyntaxPreconditions.required(name, "name", KIND);
        SyntaxPreconditions.required(assignmentOperator, "assignmentOperator", KIND);
        SyntaxPreconditions.required(exp1, "exp1", KIND);
        SyntaxPreconditions.required(comma, "comma", KIND);
        SyntaxPreconditions.required(exp2, "exp2", KIND);
        SyntaxPreconditions.required(doKeyword, "doKeyword", KIND);
        SyntaxPreconditions.required(block, "block", KIND);
        SyntaxPreconditions.required(endKeyword, "endKeyword", KIND);
        SyntaxPreconditions.paired(optionalComma, "optionalComma", optionalExp3, "optionalExp3", KIND);
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
        children.add(forKeyword);
        children.add(name);
        children.add(assignmentOperator);
        children.add(exp1);
        children.add(comma);
        children.add(exp2);
        if (optionalComma != null) {
            children.add(optionalComma);
            children.add(optionalExp3);
        }
        children.add(doKeyword);
        children.add(block);
        children.add(endKeyword);
        return List.copyOf(children);
    }

    public static final class Builder extends SyntaxNodeBuilder<NumericForStatement, Builder> {
        private Token forKeyword;
        private Token name;
        private Token assignmentOperator;
        private Expression exp1;
        private Token comma;
        private Expression exp2;
        private Token optionalComma;
        private Expression optionalExp3;
        private Token doKeyword;
        private Block block;
        private Token endKeyword;

        private Builder() {
            super(KIND);
        }

        private Builder(NumericForStatement node) {
            super(KIND, node.start(), node.length());
            this.forKeyword = node.forKeyword();
            this.name = node.name();
            this.assignmentOperator = node.assignmentOperator();
            this.exp1 = node.exp1();
            this.comma = node.comma();
            this.exp2 = node.exp2();
            this.optionalComma = node.optionalComma();
            this.optionalExp3 = node.optionalExp3();
            this.doKeyword = node.doKeyword();
            this.block = node.block();
            this.endKeyword = node.endKeyword();
        }

        public Builder forKeyword(Token forKeyword) {
            this.forKeyword = forKeyword;
            return this;
        }

        public Builder name(Token name) {
            this.name = name;
            return this;
        }

        public Builder assignmentOperator(Token assignmentOperator) {
            this.assignmentOperator = assignmentOperator;
            return this;
        }

        public Builder exp1(Expression exp1) {
            this.exp1 = exp1;
            return this;
        }

        public Builder comma(Token comma) {
            this.comma = comma;
            return this;
        }

        public Builder exp2(Expression exp2) {
            this.exp2 = exp2;
            return this;
        }

        public Builder optionalComma(Token optionalComma) {
            this.optionalComma = optionalComma;
            return this;
        }

        public Builder optionalExp3(Expression optionalExp3) {
            this.optionalExp3 = optionalExp3;
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
        public NumericForStatement build() {
            return new NumericForStatement(
                start(),
                length(),
                forKeyword,
                name,
                assignmentOperator,
                exp1,
                comma,
                exp2,
                optionalComma,
                optionalExp3,
                doKeyword,
                block,
                endKeyword);
        }
    }
}
