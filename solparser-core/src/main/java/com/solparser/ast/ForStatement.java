package com.solparser.ast;

/** Each of the three header clauses is {@code null} when left empty. */
public record ForStatement(
    SourceRange loc,
    Statement initExpression,
    Expression conditionExpression,
    ExpressionStatement loopExpression,
    Statement body
) implements Statement {
    @Override
    public String type() {
        return "ForStatement";
    }
}
