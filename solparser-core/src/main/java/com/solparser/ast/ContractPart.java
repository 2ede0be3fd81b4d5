package com.solparser.ast;

/** A member of a contract, interface or library body. */
public sealed interface ContractPart extends Node permits
    StateVariableDeclaration,
    UsingForDeclaration,
    StructDefinition,
    EnumDefinition,
    EventDefinition,
    ModifierDefinition,
    FunctionDefinition,
    CustomErrorDefinition,
    TypeDefinition,
    Unrecognized {
}
