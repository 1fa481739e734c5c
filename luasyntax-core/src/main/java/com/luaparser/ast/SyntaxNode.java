package com.luaparser.ast;

/**
 * Base interface for all composite nodes of the Lua syntax tree.
 */
public sealed interface SyntaxNode extends SyntaxNodeOrToken permits
    Chunk,
    Block,
    Statement,
    Expression,
    ElseIfBlock,
    ElseBlock,
    Args,
    SeparatedList,
    SeparatedListElement,
    ParList,
    TableConstructor,
    FunctionBody,
    FunctionName {

    @Override
    default boolean isLeaf() {
        return children().isEmpty();
    }

    @Override
    default boolean isToken() {
        return false;
    }

    /**
     * Pre-order walk of everything beneath this node. A {@link Chunk} also
     * yields itself first.
     */
    default Descendants descendants() {
        return new Descendants(this);
    }
}
