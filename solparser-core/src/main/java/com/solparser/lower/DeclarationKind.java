package com.solparser.lower;

public enum DeclarationKind {
    FUNCTION,
    CONSTRUCTOR,
    FALLBACK,
    RECEIVE,
    STATE_VARIABLE,
    FILE_CONSTANT,
    FUNCTION_TYPE
}
