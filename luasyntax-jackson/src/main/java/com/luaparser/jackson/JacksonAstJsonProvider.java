package com.luaparser.jackson;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.luaparser.ast.Chunk;
import com.luaparser.ast.SyntaxNodeOrToken;
import com.luaparser.json.AstJsonDeserializer;
import com.luaparser.json.AstJsonException;
import com.luaparser.json.AstJsonProvider;
import com.luaparser.json.AstJsonSerializer;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    public static final String NAME = "Jackson";

    private final ObjectMapper mapper;
    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(LuaSyntaxJackson.createObjectMapper());
    }

    /**
     * Uses a caller-supplied mapper, which must have {@link AstModule} registered.
     */
    public JacksonAstJsonProvider(ObjectMapper mapper) {
        this.mapper = mapper;
        this.serializer = new JacksonSerializer(mapper);
        this.deserializer = new JacksonDeserializer(mapper);
    }

    @Override
    public AstJsonSerializer getSerializer() {
        return serializer;
    }

    @Override
    public AstJsonDeserializer getDeserializer() {
        return deserializer;
    }

    @Override
    public String getName() {
        return NAME;
    }

    /**
     * Returns the underlying ObjectMapper for advanced usage.
     */
    public ObjectMapper getObjectMapper() {
        return mapper;
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(SyntaxNodeOrToken element) throws AstJsonException {
            try {
                return mapper.writeValueAsString(element);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + describe(element), typeName(element), e);
            }
        }

        @Override
        public String serializePretty(SyntaxNodeOrToken element) throws AstJsonException {
            try {
                return mapper.writerWithDefaultPrettyPrinter().writeValueAsString(element);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize " + describe(element), typeName(element), e);
            }
        }

        private static String describe(SyntaxNodeOrToken element) {
            return element == null ? "null" : element.kind() + " at " + element.start();
        }

        private static String typeName(SyntaxNodeOrToken element) {
            return element == null ? null : element.getClass().getSimpleName();
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public Chunk deserializeChunk(String json) throws AstJsonException {
            return deserialize(json, Chunk.class);
        }

        @Override
        public <T extends SyntaxNodeOrToken> T deserialize(String json, Class<T> type) throws AstJsonException {
            try {
                return mapper.readValue(json, type);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), type.getSimpleName(), e);
            }
        }
    }
}
