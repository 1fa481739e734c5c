package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

public record NameListParList(
    int start,
    int length,
    SeparatedList namesList,
    Token comma,  // Can be null, together with vararg
    Token vararg  // Can be null, together with comma
) implements ParList {
    private static final SyntaxKind KIND = SyntaxKind.NAME_LIST_PAR_LIST;

    public NameListParList {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(namesList, "namesList", KIND);
        SyntaxPreconditions.paired(comma, "comma", vararg, "vararg", KIND);
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
        children.add(namesList);
        if (comma != null) {
            children.add(comma);
            children.add(vararg);
        }
        return List.copyOf(children);
    }

    public static final class Builder extends SyntaxNodeBuilder<NameListParList, Builder> {
        private SeparatedList namesList;
        private Token comma;
        private Token vararg;

        private Builder() {
            super(KIND);
        }

        private Builder(NameListParList node) {
            super(KIND, node.start(), node.length());
            this.namesList = node.namesList();
            this.comma = node.comma();
            this.vararg = node.vararg();
        }

        public Builder namesList(SeparatedList namesList) {
            this.namesList = namesList;
            return this;
        }

        public Builder comma(Token comma) {
            this.comma = comma;
            return this;
        }

        public Builder vararg(Token vararg) {
            this.vararg = vararg;
            return this;
        }

        @Override
        public NameListParList build() {
            return new NameListParList(start(), length(), namesList, comma, vararg);
        }
    }
}
