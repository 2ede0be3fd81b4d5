package com.solparser.json;

import com.solparser.ast.Node;
import com.solparser.ast.SourceUnit;

/**
 * Reads AST nodes back from the JSON written by an {@link AstJsonSerializer}.
 */
public interface AstJsonDeserializer {

    SourceUnit readSourceUnit(String json);

    /**
     * Reads a node of the given kind. The {@code type} discriminator of the JSON object must
     * name {@code type} or one of its subtypes.
     *
     * @throws AstJsonException if the text is not JSON, names an unknown node type, or holds a
     *                          value a node field cannot take
     */
    <T extends Node> T read(String json, Class<T> type);
}
