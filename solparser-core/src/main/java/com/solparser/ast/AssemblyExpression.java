package com.solparser.ast;

public sealed interface AssemblyExpression extends AssemblyItem permits
    BooleanLiteral,
    HexLiteral,
    StringLiteral,
    AssemblyCall,
    AssemblyMemberAccess,
    DecimalNumber,
    HexNumber,
    Unrecognized {
}
