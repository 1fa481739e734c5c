package com.luaparser.ast;

import java.util.ArrayList;
import java.util.List;

/**
 * The recurring {@code item {separator item}} production: expression lists, name lists, field lists.
 */
public record SeparatedList(
    int start,
    int length,
    List<SeparatedListElement> elements
) implements SyntaxNode {
    private static final SyntaxKind KIND = SyntaxKind.SEPARATED_LIST;

    public SeparatedList {
        SyntaxPreconditions.checkSpan(start, length, KIND);
        elements = SyntaxPreconditions.requiredList(elements, "elements", KIND);
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
        for (SeparatedListElement element : elements) {
            children.addAll(element.children());
        }
        return List.copyOf(children);
    }

    public List<SyntaxNodeOrToken> items() {
        List<SyntaxNodeOrToken> items = new ArrayList<>(elements.size());
        for (SeparatedListElement element : elements) {
            items.add(element.item());
        }
        return List.copyOf(items);
    }

    public List<Token> separators() {
        List<Token> separators = new ArrayList<>(elements.size());
        for (SeparatedListElement element : elements) {
            if (element.separator() != null) {
                separators.add(element.separator());
            }
        }
        return List.copyOf(separators);
    }

    /**
     * An empty list anchored at {@code position}, as in {@code f()} or {@code {}}.
     */
    public static SeparatedList empty(int position) {
        return new SeparatedList(position, 0, List.of());
    }

    /**
     * Pairs each item with the separator at the same index. There may be one
     * separator fewer than items, or as many when the list ends in a separator.
     * The span runs from the first item to the last element.
     */
    public static SeparatedList of(List<? extends SyntaxNodeOrToken> items, List<Token> separators) {
        if (items.isEmpty()) {
            throw new IllegalArgumentException("items must not be empty; use SeparatedList.empty(position)");
        }
        if (separators.size() != items.size() && separators.size() != items.size() - 1) {
            throw new IllegalArgumentException(
                separators.size() + " separators cannot separate " + items.size() + " items");
        }
        List<SeparatedListElement> elements = new ArrayList<>(items.size());
        for (int i = 0; i < items.size(); i++) {
            Token separator = i < separators.size() ? separators.get(i) : null;
            elements.add(SeparatedListElement.of(items.get(i), separator));
        }
        int start = elements.get(0).start();
        return new SeparatedList(start, elements.get(elements.size() - 1).end() - start, elements);
    }

    public static final class Builder extends SyntaxNodeBuilder<SeparatedList, Builder> {
        private List<SeparatedListElement> elements;
        private boolean elementsOwned;

        private Builder() {
            super(KIND);
        }

        private Builder(SeparatedList node) {
            super(KIND, node.start(), node.length());
            this.elements = node.elements();
        }

        public Builder elements(List<SeparatedListElement> elements) {
            this.elements = elements;
            this.elementsOwned = false;
            return this;
        }

        public Builder addElement(SeparatedListElement element) {
            if (!elementsOwned) {
                elements = elements == null ? new ArrayList<>() : new ArrayList<>(elements);
                elementsOwned = true;
            }
            elements.add(element);
            return this;
        }

        /**
         * Appends an element spanning from {@code item} through {@code separator}.
         */
        public Builder add(SyntaxNodeOrToken item, Token separator) {
            return addElement(SeparatedListElement.of(item, separator));
        }

        public Builder add(SyntaxNodeOrToken item) {
            return add(item, null);
        }

        @Override
        public SeparatedList build() {
            return new SeparatedList(start(), length(), elements);
        }
    }
}
