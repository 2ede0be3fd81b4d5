package com.solparser.ast;

/**
 * A type name. Type names are also expressions, as in {@code uint(x)} or {@code address(this)}.
 */
public sealed interface TypeName extends Expression permits
    ElementaryTypeName,
    UserDefinedTypeName,
    Mapping,
    ArrayTypeName,
    FunctionTypeName,
    Unrecognized {
}
