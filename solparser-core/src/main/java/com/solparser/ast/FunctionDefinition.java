package com.solparser.ast;

import java.util.List;

/**
 * A function, constructor, fallback or receive function.
 *
 * <p>{@code visibility} and {@code stateMutability} are always resolved, either from the written
 * keywords or from the defaults of the enclosing declaration. {@code returnParameters} is
 * {@code null} without a {@code returns} clause and {@code body} is {@code null} for
 * declarations ending in {@code ;}.</p>
 */
public record FunctionDefinition(
    SourceRange loc,
    String name,
    List<VariableDeclaration> parameters,
    List<VariableDeclaration> returnParameters,
    Block body,
    Visibility visibility,
    StateMutability stateMutability,
    List<ModifierInvocation> modifiers,
    List<UserDefinedTypeName> override,
    boolean constructor,
    boolean receiveEther,
    boolean fallback,
    boolean virtual
) implements SourceUnitPart, ContractPart {
    @Override
    public String type() {
        return "FunctionDefinition";
    }
}
