package com.solparser.lower;

import com.solparser.ast.SourceRange;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.misc.Interval;
import org.antlr.v4.runtime.tree.TerminalNode;

/**
 * Derives source ranges from the first and last token of concrete tree nodes.
 */
public final class RangeTracker {

    public SourceRange of(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (start == null) {
            return SourceRange.at(1, 0, 0);
        }
        // Contexts that matched nothing during error recovery stop before they start.
        if (stop == null || stop.getTokenIndex() < start.getTokenIndex()) {
            return SourceRange.at(start.getLine(), start.getCharPositionInLine(), Math.max(start.getStartIndex(), 0));
        }
        return span(start, stop);
    }

    public SourceRange of(TerminalNode node) {
        return of(node.getSymbol());
    }

    public SourceRange of(Token token) {
        return span(token, token);
    }

    /**
     * Returns the range from the start of {@code start} to the end of {@code stop}.
     */
    public SourceRange of(Token start, Token stop) {
        if (stop.getTokenIndex() < start.getTokenIndex()) {
            return of(start);
        }
        return span(start, stop);
    }

    /**
     * Returns the source text a context covers, whitespace and comments included.
     */
    public String textOf(ParserRuleContext ctx) {
        Token start = ctx.getStart();
        Token stop = ctx.getStop();
        if (start == null || stop == null || stop.getTokenIndex() < start.getTokenIndex()
            || start.getInputStream() == null || stop.getType() == Token.EOF) {
            return ctx.getText();
        }
        return start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
    }

    public String textOf(Token start, Token stop) {
        if (start.getInputStream() == null || stop.getTokenIndex() < start.getTokenIndex()) {
            return start.getText();
        }
        return start.getInputStream().getText(Interval.of(start.getStartIndex(), stop.getStopIndex()));
    }

    private static SourceRange span(Token start, Token stop) {
        int line = stop.getLine();
        int column = stop.getCharPositionInLine();
        int endOffset = Math.max(stop.getStartIndex(), 0);
        if (stop.getType() != Token.EOF) {
            String text = stop.getText();
            if (text != null) {
                for (int i = 0; i < text.length(); i++) {
                    if (text.charAt(i) == '\n') {
                        line++;
                        column = 0;
                    } else {
                        column++;
                    }
                }
            }
            endOffset = stop.getStopIndex() + 1;
        }
        return new SourceRange(
            start.getLine(),
            start.getCharPositionInLine(),
            line,
            column,
            Math.max(start.getStartIndex(), 0),
            endOffset);
    }
}
