package com.solparser.json;

/**
 * Thrown when AST JSON cannot be written or read.
 */
public class AstJsonException extends RuntimeException {

    private final String nodeType;

    public AstJsonException(String message) {
        this(message, null, null);
    }

    public AstJsonException(String message, Throwable cause) {
        this(message, null, cause);
    }

    public AstJsonException(String message, String nodeType, Throwable cause) {
        super(message, cause);
        this.nodeType = nodeType;
    }

    /**
     * The {@code type} discriminator that could not be resolved, or null when the failure
     * was of another kind.
     */
    public String getNodeType() {
        return nodeType;
    }
}
