package com.solparser.ast;

/** An item of an inline assembly block. */
public sealed interface AssemblyItem extends Node permits
    AssemblyExpression,
    Identifier,
    NumberLiteral,
    AssemblyBlock,
    AssemblyLocalDefinition,
    AssemblyAssignment,
    AssemblyStackAssignment,
    LabelDefinition,
    AssemblySwitch,
    AssemblyFunctionDefinition,
    AssemblyFor,
    AssemblyIf,
    Break,
    Continue,
    Leave {
}
