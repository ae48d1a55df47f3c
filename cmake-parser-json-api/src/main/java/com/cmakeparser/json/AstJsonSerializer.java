package com.cmakeparser.json;

import com.cmakeparser.Token;
import com.cmakeparser.ast.Node;

import java.util.List;

/**
 * Interface for serializing AST nodes and tokens to JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes an AST node, including its nested bodies, to a JSON object.
     *
     * @throws AstJsonException if serialization fails
     */
    String serialize(Node node) throws AstJsonException;

    /**
     * Serializes an AST node to a pretty-printed JSON string.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes a sequence of top-level nodes, as produced by the parser, to a JSON array.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializeNodes(List<Node> nodes) throws AstJsonException;

    /**
     * Serializes a token list, for instance the result of variable resolution, to a JSON array.
     *
     * @throws AstJsonException if serialization fails
     */
    String serializeTokens(List<Token> tokens) throws AstJsonException;
}
