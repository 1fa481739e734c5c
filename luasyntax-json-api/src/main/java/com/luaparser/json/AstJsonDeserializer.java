package com.luaparser.json;

import com.luaparser.ast.Chunk;
import com.luaparser.ast.SyntaxNodeOrToken;

/**
 * Interface for rebuilding syntax trees from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON string to a Chunk (root of a syntax tree).
     *
     * @param json the JSON string to deserialize
     * @return the deserialized Chunk
     * @throws AstJsonException if the JSON is malformed or describes an invalid node
     */
    Chunk deserializeChunk(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific tree element type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected element type, a record or one of the category interfaces
     * @param <T> the element type
     * @return the deserialized element
     * @throws AstJsonException if the JSON is malformed or describes an invalid node
     */
    <T extends SyntaxNodeOrToken> T deserialize(String json, Class<T> type) throws AstJsonException;
}
