package com.solparser.lower;

import org.antlr.v4.runtime.ParserRuleContext;

/**
 * Lowers one kind of rule context into a node or, for list rules, a list of nodes.
 */
@FunctionalInterface
public interface RuleHandler<C extends ParserRuleContext> {
    Object lower(LoweringVisitor visitor, C ctx);
}
