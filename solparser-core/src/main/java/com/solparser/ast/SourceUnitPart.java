package com.solparser.ast;

/** A declaration allowed at file level. */
public sealed interface SourceUnitPart extends Node permits
    PragmaDirective,
    ImportDirective,
    ContractDefinition,
    FileLevelConstant,
    UsingForDeclaration,
    StructDefinition,
    EnumDefinition,
    EventDefinition,
    FunctionDefinition,
    CustomErrorDefinition,
    TypeDefinition,
    Unrecognized {
}
