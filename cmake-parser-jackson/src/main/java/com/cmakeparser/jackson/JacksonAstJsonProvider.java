package com.cmakeparser.jackson;

import com.cmakeparser.Token;
import com.cmakeparser.ast.Node;
import com.cmakeparser.json.AstJsonDeserializer;
import com.cmakeparser.json.AstJsonException;
import com.cmakeparser.json.AstJsonProvider;
import com.cmakeparser.json.AstJsonSerializer;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.util.List;

/**
 * Jackson-based implementation of AstJsonProvider.
 */
public class JacksonAstJsonProvider implements AstJsonProvider {

    private static final TypeReference<List<Node>> NODE_LIST = new TypeReference<>() {};
    private static final TypeReference<List<Token>> TOKEN_LIST = new TypeReference<>() {};

    private final AstJsonSerializer serializer;
    private final AstJsonDeserializer deserializer;

    public JacksonAstJsonProvider() {
        this(CMakeJackson.createObjectMapper());
    }

    /**
     * Uses {@code mapper} as configured by the caller. It needs {@link AstModule}
     * registered to read back what it writes.
     */
    public JacksonAstJsonProvider(ObjectMapper mapper) {
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
        return "Jackson";
    }

    // ==================== Inner Classes ====================

    private static class JacksonSerializer implements AstJsonSerializer {
        private final ObjectMapper mapper;

        JacksonSerializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public String serialize(Node node) throws AstJsonException {
            try {
                return mapper.writerFor(Node.class).writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public String serializePretty(Node node) throws AstJsonException {
            try {
                return mapper.writerFor(Node.class).withDefaultPrettyPrinter().writeValueAsString(node);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST node", e);
            }
        }

        @Override
        public String serializeNodes(List<Node> nodes) throws AstJsonException {
            try {
                return mapper.writerFor(NODE_LIST).writeValueAsString(nodes);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize AST nodes", e);
            }
        }

        @Override
        public String serializeTokens(List<Token> tokens) throws AstJsonException {
            try {
                return mapper.writerFor(TOKEN_LIST).writeValueAsString(tokens);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to serialize tokens", e);
            }
        }
    }

    private static class JacksonDeserializer implements AstJsonDeserializer {
        private final ObjectMapper mapper;

        JacksonDeserializer(ObjectMapper mapper) {
            this.mapper = mapper;
        }

        @Override
        public List<Node> deserializeNodes(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, NODE_LIST);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize AST nodes", e);
            }
        }

        @Override
        public <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException {
            Node node;
            try {
                node = mapper.readValue(json, Node.class);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize " + type.getSimpleName(), e);
            }
            if (!type.isInstance(node)) {
                throw new AstJsonException("Expected " + type.getSimpleName() + " but found " + node.type());
            }
            return type.cast(node);
        }

        @Override
        public List<Token> deserializeTokens(String json) throws AstJsonException {
            try {
                return mapper.readValue(json, TOKEN_LIST);
            } catch (JsonProcessingException e) {
                throw new AstJsonException("Failed to deserialize tokens", e);
            }
        }
    }
}
