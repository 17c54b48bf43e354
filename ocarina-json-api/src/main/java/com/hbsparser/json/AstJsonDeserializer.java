package com.hbsparser.json;

import com.hbsparser.ast.Node;
import com.hbsparser.ast.Template;

/**
 * Reads template trees back from the JSON written by {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    /**
     * @throws AstJsonException if the JSON is malformed or is not a template
     */
    Template deserializeTemplate(String json) throws AstJsonException;

    /**
     * Deserializes a single node of a known type.
     *
     * @param json the JSON object for the node
     * @param type the expected node class
     * @throws AstJsonException if the JSON does not describe a node of {@code type}
     */
    <T extends Node> T deserialize(String json, Class<T> type) throws AstJsonException;
}
