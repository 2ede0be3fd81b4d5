package com.solparser.ast;

/**
 * Base interface for all Solidity AST nodes.
 */
public sealed interface Node permits
    SourceUnitPart,
    ContractPart,
    Statement,
    Expression,
    AssemblyItem,
    SourceUnit,
    InheritanceSpecifier,
    VariableDeclaration,
    EnumValue,
    ModifierInvocation,
    CatchClause,
    NameValueList,
    AssemblyCase {

    String type();
    SourceRange loc();
}
