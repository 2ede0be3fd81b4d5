package com.solparser.ast;

public sealed interface Expression extends Node permits
    TypeName,
    Identifier,
    BooleanLiteral,
    NumberLiteral,
    HexLiteral,
    StringLiteral,
    TupleExpression,
    NewExpression,
    UnaryOperation,
    BinaryOperation,
    Conditional,
    IndexAccess,
    IndexRangeAccess,
    MemberAccess,
    FunctionCall,
    NameValueExpression {
}
