package com.hbsparser.json;

import com.hbsparser.ast.Node;
import com.hbsparser.tokens.TokenOccurrence;

import java.util.List;

/**
 * Writes template trees and extracted tokens as JSON.
 */
public interface AstJsonSerializer {

    /**
     * Serializes a node, and everything below it, to compact JSON. Each node object
     * carries a {@code "type"} discriminator and a {@code "loc"} object.
     *
     * @throws AstJsonException if the node cannot be serialized
     */
    String serialize(Node node) throws AstJsonException;

    String serializePretty(Node node) throws AstJsonException;

    /**
     * Serializes located token occurrences as a JSON array of
     * {@code {"name", "kind", "loc"}} objects, in the order given.
     *
     * @throws AstJsonException if the list cannot be serialized
     */
    String serializeTokens(List<TokenOccurrence> occurrences) throws AstJsonException;
}
