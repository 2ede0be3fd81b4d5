package com.solparser.json;

import com.solparser.SourceToken;
import com.solparser.ast.Node;

import java.util.List;

/**
 * Writes AST nodes as JSON. Every node carries a {@code type} discriminator and every field is
 * written, absent ones as {@code null}.
 */
public interface AstJsonSerializer {

    /**
     * Writes {@code node} and its subtree.
     *
     * @param pretty indent the output over several lines
     * @throws AstJsonException if the node cannot be written
     */
    String serialize(Node node, boolean pretty);

    /**
     * Writes a token list as returned by {@code Parser.tokenize}: an array of objects with
     * {@code type}, {@code value} and {@code loc}.
     */
    String serializeTokens(List<SourceToken> tokens, boolean pretty);
}
