package com.luaparser.ast;

import java.util.ArrayDeque;
import java.util.Deque;
import java.util.Iterator;
import java.util.NoSuchElementException;
import java.util.Spliterator;
import java.util.Spliterators;
import java.util.stream.Stream;
import java.util.stream.StreamSupport;

/**
 * Pre-order, depth-first enumeration of a subtree.
 *
 * <p>A {@link Chunk} root is yielded first; then every child in source order,
 * each followed by its own descendants when it is a non-leaf node. Tokens and
 * leaf nodes are yielded but never expanded. Every call to {@link #iterator()}
 * starts a new walk, so the sequence can be enumerated any number of times and
 * from several threads at once.</p>
 */
public final class Descendants implements Iterable<SyntaxNodeOrToken> {

    private final SyntaxNode root;

    Descendants(SyntaxNode root) {
        this.root = root;
    }

    @Override
    public Iterator<SyntaxNodeOrToken> iterator() {
        return new PreOrderIterator(root);
    }

    public Stream<SyntaxNodeOrToken> stream() {
        return StreamSupport.stream(
            Spliterators.spliteratorUnknownSize(iterator(), Spliterator.ORDERED | Spliterator.NONNULL),
            false);
    }

    private static final class PreOrderIterator implements Iterator<SyntaxNodeOrToken> {
        // Explicit stack of child iterators so deep trees do not recurse on the call stack
        private final Deque<Iterator<SyntaxNodeOrToken>> stack = new ArrayDeque<>();
        private SyntaxNode pendingRoot;

        PreOrderIterator(SyntaxNode root) {
            if (root.kind() == SyntaxKind.CHUNK) {
                pendingRoot = root;
            }
            stack.push(root.children().iterator());
        }

        @Override
        public boolean hasNext() {
            if (pendingRoot != null) {
                return true;
            }
            while (!stack.isEmpty() && !stack.peek().hasNext()) {
                stack.pop();
            }
            return !stack.isEmpty();
        }

        @Override
        public SyntaxNodeOrToken next() {
            if (!hasNext()) {
                throw new NoSuchElementException();
            }
            if (pendingRoot != null) {
                SyntaxNode root = pendingRoot;
                pendingRoot = null;
                return root;
            }
            SyntaxNodeOrToken next = stack.peek().next();
            if (!next.isLeaf()) {
                stack.push(next.children().iterator());
            }
            return next;
        }
    }
}
