package com.solparser;

/**
 * @param tolerant when false, syntax errors raise {@link ParseException} instead of being
 *                 returned as diagnostics
 * @param tokens   also collect the token list of the source
 */
public record ParseOptions(boolean tolerant, boolean tokens) {

    public static ParseOptions defaults() {
        return new ParseOptions(true, false);
    }

    public ParseOptions withTolerant(boolean tolerant) {
        return new ParseOptions(tolerant, tokens);
    }

    public ParseOptions withTokens(boolean tokens) {
        return new ParseOptions(tolerant, tokens);
    }
}
