package com.cmakeparser.json;

import com.cmakeparser.Token;
import com.cmakeparser.ast.Node;

import java.util.List;

/**
 * Interface for deserializing AST nodes and tokens from JSON.
 */
public interface AstJsonDeserializer {

    /**
     * Deserializes a JSON array of top-level nodes.
     *
     * @throws AstJsonException if deserialization fails
     */
    List<Node> deserializeNodes(String json) throws AstJsonException;

    /**
     * Deserializes a JSON string to a specific AST node type.
     *
     * @param json the JSON string to deserialize
     * @param type the expected node type
     * @param <T> the node type
     * @return the deserialized node
     * @throws AstJsonException if deserialization fails or the JSON holds another node type
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;

    /**
     * Deserializes a JSON array of tokens.
     *
     * @throws AstJsonException if deserialization fails
     */
    List<Token> deserializeTokens(String json) throws AstJsonException;
}
