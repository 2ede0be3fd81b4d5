package com.solparser.lower;

import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.function.Function;

/**
 * Small helpers over concrete tree children shared by the lowering handlers.
 */
final class Trees {

    private Trees() {
    }

    static List<ParseTree> children(ParserRuleContext ctx) {
        return ctx.children == null ? List.of() : ctx.children;
    }

    static boolean isToken(ParseTree tree, String text) {
        return tree instanceof TerminalNode && !(tree instanceof ErrorNode) && text.equals(tree.getText());
    }

    static boolean isToken(ParseTree tree, int tokenType) {
        return tree instanceof TerminalNode terminal && !(tree instanceof ErrorNode)
            && terminal.getSymbol().getType() == tokenType;
    }

    static boolean hasToken(ParserRuleContext ctx, String text) {
        for (ParseTree child : children(ctx)) {
            if (isToken(child, text)) {
                return true;
            }
        }
        return false;
    }

    static ParserRuleContext onlyRuleChild(ParserRuleContext ctx) {
        ParserRuleContext only = null;
        for (ParseTree child : children(ctx)) {
            if (child instanceof ParserRuleContext rule) {
                if (only != null) {
                    return null;
                }
                only = rule;
            }
        }
        return only;
    }

    static String unquote(String text) {
        if (text.length() >= 2) {
            return text.substring(1, text.length() - 1);
        }
        return text;
    }

    /**
     * Lowers a comma separated sequence whose elements may be left out, keeping each left out
     * element as {@code null}: {@code a, , b} gives {@code [a, null, b]} and {@code a,} gives
     * {@code [a, null]}.
     */
    static <T> List<T> withHoles(List<ParseTree> items, Function<ParserRuleContext, T> lower) {
        if (items.isEmpty()) {
            return List.of();
        }
        List<T> values = new ArrayList<>();
        boolean afterComma = true;
        for (ParseTree item : items) {
            if (isToken(item, ",")) {
                if (afterComma) {
                    values.add(null);
                }
                afterComma = true;
            } else if (item instanceof ParserRuleContext rule) {
                values.add(lower.apply(rule));
                afterComma = false;
            }
        }
        if (afterComma) {
            values.add(null);
        }
        return Collections.unmodifiableList(values);
    }

    /**
     * Children between the first and the last child, used to drop enclosing brackets.
     */
    static List<ParseTree> inner(ParserRuleContext ctx) {
        List<ParseTree> children = children(ctx);
        if (children.size() < 2) {
            return List.of();
        }
        return children.subList(1, children.size() - 1);
    }
}
