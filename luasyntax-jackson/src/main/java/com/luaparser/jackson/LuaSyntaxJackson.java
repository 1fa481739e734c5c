package com.luaparser.jackson;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.module.paramnames.ParameterNamesModule;

/**
 * Factory for creating properly configured ObjectMapper instances for syntax trees.
 *
 * Usage:
 * <pre>
 * ObjectMapper mapper = LuaSyntaxJackson.createObjectMapper();
 * String json = mapper.writeValueAsString(chunk);
 * Chunk chunk = mapper.readValue(json, Chunk.class);
 * </pre>
 */
public final class LuaSyntaxJackson {

    private LuaSyntaxJackson() {
        // Utility class
    }

    /**
     * Creates a new ObjectMapper configured for syntax tree serialization/deserialization.
     *
     * The returned mapper:
     * - Tags every element with "type" (record name) and "kind"
     * - Omits absent optional fields, so a missing pair leaves no trace in the output
     * - Rebuilds nodes through their validating constructors on input
     *
     * @return A new configured ObjectMapper instance
     */
    public static ObjectMapper createObjectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new ParameterNamesModule());

        // Optional fields are null when absent; leave them out
        mapper.setSerializationInclusion(JsonInclude.Include.NON_NULL);

        // "kind" on a node is derived from "type" and has no constructor parameter
        mapper.configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false);

        mapper.registerModule(new AstModule());

        return mapper;
    }
}
