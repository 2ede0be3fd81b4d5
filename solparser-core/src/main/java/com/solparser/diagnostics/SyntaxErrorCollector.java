package com.solparser.diagnostics;

import com.solparser.ast.SourceRange;
import com.solparser.lower.RangeTracker;
import org.antlr.v4.runtime.BaseErrorListener;
import org.antlr.v4.runtime.Lexer;
import org.antlr.v4.runtime.RecognitionException;
import org.antlr.v4.runtime.Recognizer;
import org.antlr.v4.runtime.Token;

/**
 * Routes lexer and parser syntax errors into a {@link Diagnostics} sink as
 * {@link DiagnosticKind#SYNTAX_ERROR} entries.
 */
public class SyntaxErrorCollector extends BaseErrorListener {

    private final Diagnostics diagnostics;
    private final RangeTracker ranges = new RangeTracker();

    public SyntaxErrorCollector(Diagnostics diagnostics) {
        this.diagnostics = diagnostics;
    }

    @Override
    public void syntaxError(Recognizer<?, ?> recognizer, Object offendingSymbol, int line, int charPositionInLine,
                            String msg, RecognitionException e) {
        SourceRange range;
        if (offendingSymbol instanceof Token token) {
            range = ranges.of(token);
        } else {
            int offset = recognizer instanceof Lexer lexer ? lexer._tokenStartCharIndex : 0;
            range = SourceRange.at(line, charPositionInLine, Math.max(offset, 0));
        }
        diagnostics.add(Diagnostic.error(DiagnosticKind.SYNTAX_ERROR, msg, range, null));
    }
}
