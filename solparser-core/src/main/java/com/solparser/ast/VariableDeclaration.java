package com.solparser.ast;

import java.util.List;

/**
 * A declared variable: state variable, parameter, return parameter, struct member,
 * event parameter or local.
 *
 * <p>{@code visibility} is only set for state variables. {@code typeName} is {@code null} for
 * untyped {@code var} declarations, {@code name} for unnamed parameters.</p>
 */
public record VariableDeclaration(
    SourceRange loc,
    TypeName typeName,
    String name,
    Identifier identifier,
    Visibility visibility,
    StateMutability stateMutability,
    StorageLocation storageLocation,
    boolean stateVar,
    boolean declaredConst,
    boolean indexed,
    boolean immutable,
    List<UserDefinedTypeName> override
) implements Node {
    @Override
    public String type() {
        return "VariableDeclaration";
    }
}
