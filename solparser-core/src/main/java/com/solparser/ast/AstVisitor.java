package com.solparser.ast;

/**
 * Callbacks for {@link AstWalker}. {@code parent} is {@code null} for the root.
 */
public interface AstVisitor {

    /**
     * @return false to skip the children of {@code node}; {@link #exit} is still called
     */
    default boolean enter(Node node, Node parent) {
        return true;
    }

    default void exit(Node node, Node parent) {
    }
}
