package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

public record SeparatedListElement(
    int start,
    int length,
    SyntaxNodeOrToken item,
    Token separator  // Can be null
) implements SyntaxNode {
    private static final SyntaxKind KIND = SyntaxKind.SEPARATED_LIST_ELEMENT;

    public SeparatedListElement {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        SyntaxPreconditions.required(item, "item", KIND);
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
        children.add(item);
        if (separator != null) {
            children.add(separator);
        }
        return List.copyOf(children);
    }

    /**
     * Creates an element spanning from the item through its separator, if any.
     */
    public static SeparatedListElement of(SyntaxNodeOrToken item, Token separator) {
        SyntaxPreconditions.required(item, "item", KIND);
        int end = separator != null ? separator.end() : item.end();
        return new SeparatedListElement(item.start(), end - item.start(), item, separator);
    }

    public static final class Builder extends SyntaxNodeBuilder<SeparatedListElement, Builder> {
        private SyntaxNodeOrToken item;
        private Token separator;

        private Builder() {
            super(KIND);
        }

        private Builder(SeparatedListElement node) {
            super(KIND, node.start(), node.length());
            this.item = node.item();
            this.separator = node.separator();
        }

        public Builder item(SyntaxNodeOrToken item) {
            this.item = item;
            return this;
        }

        public Builder separator(Token separator) {
            this.separator = separator;
            return this;
        }

        @Override
        public SeparatedListElement build() {
            return new SeparatedListElement(start(), length(), item, separator);
        }
    }
}
