package com.solparser.ast;

public sealed interface Statement extends Node permits
    Block,
    ExpressionStatement,
    IfStatement,
    WhileStatement,
    DoWhileStatement,
    ForStatement,
    TryStatement,
    UncheckedStatement,
    InlineAssemblyStatement,
    ContinueStatement,
    BreakStatement,
    ThrowStatement,
    ReturnStatement,
    EmitStatement,
    RevertStatement,
    VariableDeclarationStatement,
    Unrecognized {
}
