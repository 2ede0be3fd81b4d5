package com.solparser;

import com.solparser.ast.SourceRange;
import com.solparser.diagnostics.Diagnostics;
import com.solparser.diagnostics.SyntaxErrorCollector;
import com.solparser.grammar.SolidityLexer;
import com.solparser.grammar.SolidityParser;
import com.solparser.lower.DispatchTable;
import com.solparser.lower.LoweringVisitor;
import com.solparser.lower.RangeTracker;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.Vocabulary;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Entry points for recognizing Solidity source and lowering it into the typed AST.
 *
 * <p>All methods are stateless and may be called from several threads at once; every call
 * builds its own lexer, parser and visitor.</p>
 */
public final class Parser {

    private static final Logger LOG = LoggerFactory.getLogger(Parser.class);

    private static final DispatchTable STANDARD_TABLE = DispatchTable.standard();

    private Parser() {
    }

    public static LoweringResult parse(String source) {
        return parse(source, ParseOptions.defaults());
    }

    /**
     * Recognizes and lowers {@code source}. Syntax errors come first in the returned
     * diagnostics, followed by those reported while lowering.
     *
     * @throws InvalidInputException if {@code source} is null
     * @throws ParseException        if syntax errors were found and {@code options} is not tolerant
     */
    public static LoweringResult parse(String source, ParseOptions options) {
        if (source == null) {
            throw new InvalidInputException("Source text is required");
        }
        ParseOptions effective = options == null ? ParseOptions.defaults() : options;

        Diagnostics diagnostics = new Diagnostics();
        SyntaxErrorCollector errors = new SyntaxErrorCollector(diagnostics);
        SolidityLexer lexer = new SolidityLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        lexer.addErrorListener(errors);
        CommonTokenStream stream = new CommonTokenStream(lexer);
        SolidityParser parser = new SolidityParser(stream);
        parser.removeErrorListeners();
        parser.addErrorListener(errors);

        SolidityParser.SourceUnitContext tree = parser.sourceUnit();
        if (diagnostics.size() > 0) {
            LOG.debug("Recognizer reported {} syntax errors", diagnostics.size());
            if (!effective.tolerant()) {
                throw new ParseException(diagnostics.snapshot());
            }
        }

        LoweringResult lowered = new LoweringVisitor(STANDARD_TABLE, diagnostics).lower(tree);
        if (!effective.tokens()) {
            return lowered;
        }
        return new LoweringResult(lowered.sourceUnit(), lowered.diagnostics(), tokens(stream, parser.getVocabulary()));
    }

    /**
     * Like {@link #parse(String)} but rejects any source with syntax errors.
     *
     * @throws ParseException carrying every syntax error
     */
    public static LoweringResult parseStrict(String source) {
        return parse(source, ParseOptions.defaults().withTolerant(false));
    }

    /**
     * Returns the default channel tokens of {@code source}, without the end of file token.
     * Lexer errors are skipped silently.
     */
    public static List<SourceToken> tokenize(String source) {
        if (source == null) {
            throw new InvalidInputException("Source text is required");
        }
        SolidityLexer lexer = new SolidityLexer(CharStreams.fromString(source));
        lexer.removeErrorListeners();
        CommonTokenStream stream = new CommonTokenStream(lexer);
        stream.fill();
        return tokens(stream, lexer.getVocabulary());
    }

    /**
     * Lowers a tree produced by a caller owned {@link SolidityParser}.
     */
    public static LoweringResult lower(SolidityParser.SourceUnitContext tree) {
        return lower(tree, STANDARD_TABLE);
    }

    public static LoweringResult lower(SolidityParser.SourceUnitContext tree, DispatchTable table) {
        return new LoweringVisitor(table).lower(tree);
    }

    private static List<SourceToken> tokens(CommonTokenStream stream, Vocabulary vocabulary) {
        RangeTracker ranges = new RangeTracker();
        List<SourceToken> tokens = new ArrayList<>();
        for (Token token : stream.getTokens()) {
            if (token.getType() == Token.EOF || token.getChannel() != Token.DEFAULT_CHANNEL) {
                continue;
            }
            String type = vocabulary.getSymbolicName(token.getType());
            if (type == null) {
                type = vocabulary.getLiteralName(token.getType());
            }
            SourceRange loc = ranges.of(token);
            tokens.add(new SourceToken(type, token.getText(), loc));
        }
        return Collections.unmodifiableList(tokens);
    }
}
