package com.solparser.lower;

import com.solparser.InvalidInputException;
import com.solparser.LoweringResult;
import com.solparser.ast.Node;
import com.solparser.ast.SourceRange;
import com.solparser.ast.SourceUnit;
import com.solparser.ast.Unrecognized;
import com.solparser.diagnostics.Diagnostic;
import com.solparser.diagnostics.DiagnosticKind;
import com.solparser.diagnostics.Diagnostics;
import com.solparser.grammar.SolidityParser;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.Token;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.IdentityHashMap;
import java.util.List;
import java.util.Set;
import java.util.function.Supplier;

/**
 * Walks a Solidity concrete parse tree and produces the typed AST.
 *
 * <p>Each context is looked up in the {@link DispatchTable}; its handler lowers the children
 * first and then builds the node. A handler that meets a context it cannot make sense of
 * throws {@link MalformedConstructException}, which the nearest dispatch turns into an
 * {@link Unrecognized} node plus a single diagnostic, so the rest of the unit is still lowered.</p>
 *
 * <p>A visitor holds the state of one run and must not be shared between threads or reused.</p>
 */
public final class LoweringVisitor {

    private static final Logger LOG = LoggerFactory.getLogger(LoweringVisitor.class);

    private final DispatchTable table;
    private final Diagnostics diagnostics;
    private final RangeTracker ranges = new RangeTracker();
    private final Deque<Enclosing> enclosing = new ArrayDeque<>();
    private int depth;

    public LoweringVisitor(DispatchTable table) {
        this(table, new Diagnostics());
    }

    public LoweringVisitor(DispatchTable table, Diagnostics diagnostics) {
        if (table == null) {
            throw new InvalidInputException("A dispatch table is required");
        }
        this.table = table;
        this.diagnostics = diagnostics;
    }

    private record Enclosing(EnclosingKind kind, String contractName) {
    }

    // ==================== Entry point ====================

    public LoweringResult lower(SolidityParser.SourceUnitContext tree) {
        if (tree == null) {
            throw new InvalidInputException("Cannot lower an absent parse tree");
        }
        DispatchTable.Entry entry = table.lookup(tree);
        LOG.debug("Lowering source unit ({} top-level children)", tree.getChildCount());

        // The root is always lowered, even when the recognizer gave up on part of it.
        Object result;
        try {
            result = enclosed(EnclosingKind.FILE, null, () -> entry.handler().lower(this, tree));
        } catch (MalformedConstructException e) {
            Diagnostic diagnostic = e.reported() ? e.diagnostic() : diagnostics.add(e.diagnostic());
            result = new SourceUnit(range(tree), List.of(placeholder(tree, entry.ruleName(), diagnostic)));
        }
        if (!(result instanceof SourceUnit unit)) {
            throw new InvalidInputException("Rule '" + entry.ruleName() + "' did not produce a SourceUnit");
        }
        List<Diagnostic> reported = diagnostics.snapshot();
        LOG.debug("Lowered source unit into {} top-level nodes with {} diagnostics",
            unit.children().size(), reported.size());
        return new LoweringResult(unit, reported);
    }

    // ==================== Dispatch ====================

    /**
     * Lowers a context through its dispatch table entry. Returns a node, a list for list
     * rules, or an {@link Unrecognized} placeholder when the context is malformed.
     */
    public Object dispatch(ParserRuleContext ctx) {
        DispatchTable.Entry entry = table.lookup(ctx);
        if (LOG.isTraceEnabled()) {
            LOG.trace("{}> {}", "  ".repeat(depth), entry.ruleName());
        }
        if (isItem(ctx) && damaged(ctx)) {
            Diagnostic diagnostic = diagnostics.add(Diagnostic.error(DiagnosticKind.MALFORMED_CONSTRUCT,
                "Could not recognize " + entry.ruleName(), range(ctx), entry.ruleName()));
            return placeholder(ctx, entry.ruleName(), diagnostic);
        }
        depth++;
        try {
            if (entry.kind() == DispatchTable.EntryKind.PASS_THROUGH) {
                return dispatch(singleRuleChild(ctx, entry.ruleName()));
            }
            return entry.handler().lower(this, ctx);
        } catch (MalformedConstructException e) {
            Diagnostic diagnostic = e.reported() ? e.diagnostic() : diagnostics.add(e.diagnostic());
            return placeholder(ctx, entry.ruleName(), diagnostic);
        } finally {
            depth--;
        }
    }

    private ParserRuleContext singleRuleChild(ParserRuleContext ctx, String ruleName) {
        ParserRuleContext only = null;
        for (int i = 0; i < ctx.getChildCount(); i++) {
            ParseTree child = ctx.getChild(i);
            if (child instanceof ErrorNode) {
                throw malformed(ctx, "Unexpected token '" + child.getText() + "' in " + ruleName);
            }
            if (child instanceof ParserRuleContext rule) {
                if (only != null) {
                    throw malformed(ctx, "Expected a single child in " + ruleName);
                }
                only = rule;
            }
        }
        if (only == null) {
            throw malformed(ctx, "Expected a child in " + ruleName);
        }
        return only;
    }

    private Unrecognized placeholder(ParserRuleContext ctx, String ruleName, Diagnostic diagnostic) {
        return new Unrecognized(range(ctx), ruleName, ranges.textOf(ctx), diagnostic);
    }

    // ==================== Recovery ====================

    /**
     * Lowers the items of a repeated rule, such as the statements of a block or the parts of a
     * contract. Items the recognizer had to repair are not lowered: each run of adjacent repaired
     * items, together with the stray tokens among them, becomes a single {@link Unrecognized}
     * node with one diagnostic.
     */
    public <T> List<T> items(ParserRuleContext container, List<? extends ParserRuleContext> items, Class<T> type) {
        Set<ParserRuleContext> members = Collections.newSetFromMap(new IdentityHashMap<>());
        members.addAll(items);
        List<T> nodes = new ArrayList<>(items.size());
        List<ParseTree> run = new ArrayList<>();
        List<ParseTree> children = Trees.children(container);
        for (int i = bodyStart(container); i < children.size(); i++) {
            ParseTree child = children.get(i);
            if (child instanceof ErrorNode) {
                run.add(child);
            } else if (child instanceof ParserRuleContext rule && members.contains(rule)) {
                if (damaged(rule)) {
                    run.add(rule);
                } else {
                    flush(container, run, type, nodes);
                    nodes.add(lower(rule, type));
                }
            }
        }
        flush(container, run, type, nodes);
        return Collections.unmodifiableList(nodes);
    }

    private <T> void flush(ParserRuleContext container, List<ParseTree> run, Class<T> type, List<T> nodes) {
        if (run.isEmpty()) {
            return;
        }
        Token first = null;
        Token last = null;
        String rule = null;
        for (ParseTree element : run) {
            Token start;
            Token stop;
            if (element instanceof ParserRuleContext ctx) {
                if (rule == null) {
                    rule = ruleName(ctx);
                }
                start = ctx.getStart();
                stop = ctx.getStop();
            } else {
                start = ((ErrorNode) element).getSymbol();
                stop = start;
            }
            // Tokens conjured by the recognizer have no place in the input.
            if (start == null || stop == null || start.getTokenIndex() < 0
                || stop.getTokenIndex() < start.getTokenIndex()) {
                continue;
            }
            if (first == null) {
                first = start;
            }
            last = stop;
        }
        if (rule == null) {
            rule = ruleName(container);
        }
        SourceRange range;
        String text;
        if (first == null) {
            SourceRange enclosing = range(container);
            range = SourceRange.at(enclosing.endLine(), enclosing.endColumn(), enclosing.endOffset());
            text = "";
        } else {
            range = ranges.of(first, last);
            text = ranges.textOf(first, last);
        }
        Diagnostic diagnostic = diagnostics.add(Diagnostic.error(DiagnosticKind.MALFORMED_CONSTRUCT,
            "Could not recognize " + rule, range, rule));
        LOG.debug("Replaced {} repaired element(s) of {} at {} with a placeholder", run.size(), ruleName(container), range);
        nodes.add(expect(container, new Unrecognized(range, rule, text, diagnostic), type));
        run.clear();
    }

    /**
     * Items are the units recovery replaces as a whole: statements, contract parts, assembly
     * items and the top-level parts of a source unit.
     */
    private static boolean isItem(ParserRuleContext ctx) {
        return ctx instanceof SolidityParser.StatementContext
            || ctx instanceof SolidityParser.ContractPartContext
            || ctx instanceof SolidityParser.AssemblyItemContext
            || ctx.getParent() instanceof SolidityParser.SourceUnitContext;
    }

    private static boolean isContainer(ParserRuleContext ctx) {
        return ctx instanceof SolidityParser.SourceUnitContext
            || ctx instanceof SolidityParser.ContractDefinitionContext
            || ctx instanceof SolidityParser.BlockContext
            || ctx instanceof SolidityParser.AssemblyBlockContext;
    }

    /**
     * Index of the first child of a container's item list. Stray tokens from there on belong to
     * the list; earlier ones damage the container itself.
     */
    private static int bodyStart(ParserRuleContext container) {
        List<ParseTree> children = Trees.children(container);
        if (container instanceof SolidityParser.SourceUnitContext) {
            return 0;
        }
        for (int i = 0; i < children.size(); i++) {
            if (Trees.isToken(children.get(i), "{")) {
                return i + 1;
            }
        }
        return children.size();
    }

    /**
     * Returns true if the recognizer reported an error inside {@code ctx}, leaving out nested
     * items and the item lists of nested containers, which are judged on their own.
     */
    static boolean damaged(ParserRuleContext ctx) {
        if (ctx.exception != null) {
            return true;
        }
        List<ParseTree> children = Trees.children(ctx);
        int body = isContainer(ctx) ? bodyStart(ctx) : children.size();
        for (int i = 0; i < children.size(); i++) {
            ParseTree child = children.get(i);
            if (child instanceof ErrorNode) {
                if (i < body) {
                    return true;
                }
            } else if (child instanceof ParserRuleContext rule && !isItem(rule) && damaged(rule)) {
                return true;
            }
        }
        return false;
    }

    // ==================== Typed lowering ====================

    /**
     * Lowers a child the grammar requires. A missing child makes {@code owner} malformed.
     */
    public <T> T child(ParserRuleContext owner, ParserRuleContext ctx, Class<T> type) {
        return lower(require(owner, ctx, type.getSimpleName()), type);
    }

    public <T> T optional(ParserRuleContext ctx, Class<T> type) {
        return ctx == null ? null : lower(ctx, type);
    }

    public <T> T lower(ParserRuleContext ctx, Class<T> type) {
        return expect(ctx, dispatch(ctx), type);
    }

    public <T> List<T> each(List<? extends ParserRuleContext> contexts, Class<T> type) {
        List<T> nodes = new ArrayList<>(contexts.size());
        for (ParserRuleContext ctx : contexts) {
            nodes.add(lower(ctx, type));
        }
        return Collections.unmodifiableList(nodes);
    }

    /**
     * Lowers a list rule, such as a parameter or expression list, into its elements.
     */
    public <T> List<T> list(ParserRuleContext ctx, Class<T> elementType) {
        Object result = dispatch(ctx);
        if (result instanceof Unrecognized unrecognized) {
            throw new MalformedConstructException(unrecognized.diagnostic(), true);
        }
        if (!(result instanceof List<?> elements)) {
            throw malformed(ctx, "Expected a list from " + ruleName(ctx) + " but got " + describe(result));
        }
        List<T> typed = new ArrayList<>(elements.size());
        for (Object element : elements) {
            typed.add(element == null ? null : expect(ctx, element, elementType));
        }
        return Collections.unmodifiableList(typed);
    }

    public <T> List<T> optionalList(ParserRuleContext ctx, Class<T> elementType) {
        return ctx == null ? null : list(ctx, elementType);
    }

    private <T> T expect(ParserRuleContext ctx, Object result, Class<T> type) {
        if (type.isInstance(result)) {
            return type.cast(result);
        }
        if (result instanceof Unrecognized unrecognized) {
            throw new MalformedConstructException(unrecognized.diagnostic(), true);
        }
        throw malformed(ctx, "Expected " + type.getSimpleName() + " from " + ruleName(ctx)
            + " but got " + describe(result));
    }

    public <C extends ParserRuleContext> C require(ParserRuleContext owner, C child, String what) {
        if (child == null) {
            throw malformed(owner, "Missing " + what + " in " + ruleName(owner));
        }
        return child;
    }

    public TerminalNode require(ParserRuleContext owner, TerminalNode token, String what) {
        if (token == null || token.getSymbol().getTokenIndex() < 0) {
            throw malformed(owner, "Missing " + what + " in " + ruleName(owner));
        }
        return token;
    }

    // ==================== Diagnostics ====================

    /**
     * Creates the exception a handler throws when its context does not have the expected shape.
     */
    MalformedConstructException malformed(ParserRuleContext ctx, String message) {
        return new MalformedConstructException(
            Diagnostic.error(DiagnosticKind.MALFORMED_CONSTRUCT, message, range(ctx), ruleName(ctx)), false);
    }

    public void ambiguous(ParserRuleContext ctx, String message) {
        diagnostics.add(Diagnostic.warning(DiagnosticKind.AMBIGUOUS_ATTRIBUTE, message, range(ctx), ruleName(ctx)));
    }

    public void warn(ParserRuleContext ctx, DiagnosticKind kind, String message) {
        diagnostics.add(Diagnostic.warning(kind, message, range(ctx), ruleName(ctx)));
    }

    // ==================== Enclosing declarations ====================

    public <T> T enclosed(EnclosingKind kind, String contractName, Supplier<T> body) {
        enclosing.push(new Enclosing(kind, contractName));
        try {
            return body.get();
        } finally {
            enclosing.pop();
        }
    }

    public EnclosingKind enclosingKind() {
        return enclosing.isEmpty() ? EnclosingKind.FILE : enclosing.peek().kind();
    }

    public String enclosingContractName() {
        return enclosing.isEmpty() ? null : enclosing.peek().contractName();
    }

    // ==================== Ranges and text ====================

    public SourceRange range(ParserRuleContext ctx) {
        return ranges.of(ctx);
    }

    public SourceRange range(TerminalNode node) {
        return ranges.of(node);
    }

    public SourceRange range(Token token) {
        return ranges.of(token);
    }

    public String ruleName(ParserRuleContext ctx) {
        return table.ruleName(ctx.getRuleIndex());
    }

    private static String describe(Object result) {
        if (result == null) {
            return "nothing";
        }
        if (result instanceof Node node) {
            return node.type();
        }
        return result.getClass().getSimpleName();
    }
}
