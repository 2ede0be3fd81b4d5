package com.solparser;

/**
 * Thrown when lowering cannot start or cannot be trusted at all: an absent parse tree or
 * source, or a parse tree rule the dispatch table does not know.
 */
public class InvalidInputException extends RuntimeException {

    public InvalidInputException(String message) {
        super(message);
    }

    public InvalidInputException(String message, Throwable cause) {
        super(message, cause);
    }
}
