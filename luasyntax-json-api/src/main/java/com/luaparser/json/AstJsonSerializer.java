package com.luaparser.json;

import com.luaparser.ast.SyntaxNodeOrToken;

/**
 * Interface for serializing syntax trees to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node or token, with everything beneath it, to a JSON string.
     *
     * @param element the tree element to serialize
     * @return the JSON representation of the element
     * @throws AstJsonException if serialization fails
     */
    String serialize(SyntaxNodeOrToken element) throws AstJsonException;

    /**
     * Serializes a node or token to a pretty-printed JSON string.
     *
     * @param element the tree element to serialize
     * @return the pretty-printed JSON representation of the element
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(SyntaxNodeOrToken element) throws AstJsonException;
}
