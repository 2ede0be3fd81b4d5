package com.solparser.lower;

import com.solparser.ast.AssemblyBlock;
import com.solparser.ast.Block;
import com.solparser.ast.BreakStatement;
import com.solparser.ast.CatchClause;
import com.solparser.ast.ContinueStatement;
import com.solparser.ast.DoWhileStatement;
import com.solparser.ast.EmitStatement;
import com.solparser.ast.Expression;
import com.solparser.ast.ExpressionStatement;
import com.solparser.ast.ForStatement;
import com.solparser.ast.Identifier;
import com.solparser.ast.IfStatement;
import com.solparser.ast.InlineAssemblyStatement;
import com.solparser.ast.ReturnStatement;
import com.solparser.ast.RevertStatement;
import com.solparser.ast.StateMutability;
import com.solparser.ast.Statement;
import com.solparser.ast.StorageLocation;
import com.solparser.ast.ThrowStatement;
import com.solparser.ast.TryStatement;
import com.solparser.ast.UncheckedStatement;
import com.solparser.ast.VariableDeclaration;
import com.solparser.ast.VariableDeclarationStatement;
import com.solparser.ast.WhileStatement;
import com.solparser.diagnostics.DiagnosticKind;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static com.solparser.grammar.SolidityParser.*;

final class StatementLowering {

    private StatementLowering() {
    }

    static Block block(LoweringVisitor v, BlockContext ctx) {
        return new Block(v.range(ctx), v.items(ctx, ctx.statement(), Statement.class));
    }

    static ExpressionStatement expressionStatement(LoweringVisitor v, ExpressionStatementContext ctx) {
        return new ExpressionStatement(v.range(ctx), v.child(ctx, ctx.expression(), Expression.class));
    }

    static IfStatement ifStatement(LoweringVisitor v, IfStatementContext ctx) {
        Expression condition = v.child(ctx, ctx.expression(), Expression.class);
        List<StatementContext> bodies = ctx.statement();
        if (bodies.isEmpty()) {
            throw v.malformed(ctx, "Missing body in if statement");
        }
        Statement trueBody = v.lower(bodies.get(0), Statement.class);
        Statement falseBody = bodies.size() > 1 ? v.lower(bodies.get(1), Statement.class) : null;
        return new IfStatement(v.range(ctx), condition, trueBody, falseBody);
    }

    static TryStatement tryStatement(LoweringVisitor v, TryStatementContext ctx) {
        Expression expression = v.child(ctx, ctx.expression(), Expression.class);
        List<VariableDeclaration> returnParameters = v.optionalList(ctx.returnParameters(), VariableDeclaration.class);
        Block body = v.child(ctx, ctx.block(), Block.class);
        return new TryStatement(v.range(ctx), expression, returnParameters, body,
            v.each(ctx.catchClause(), CatchClause.class));
    }

    static CatchClause catchClause(LoweringVisitor v, CatchClauseContext ctx) {
        String kind = ctx.identifier() == null ? null : ctx.identifier().getText();
        if (kind != null && !kind.equals("Error") && !kind.equals("Panic")) {
            v.warn(ctx, DiagnosticKind.MALFORMED_CONSTRUCT,
                "Expected 'Error' or 'Panic' in catch clause but found '" + kind + "'");
        }
        List<VariableDeclaration> parameters = v.optionalList(ctx.parameterList(), VariableDeclaration.class);
        Block body = v.child(ctx, ctx.block(), Block.class);
        return new CatchClause(v.range(ctx), kind, "Error".equals(kind), parameters, body);
    }

    static WhileStatement whileStatement(LoweringVisitor v, WhileStatementContext ctx) {
        Expression condition = v.child(ctx, ctx.expression(), Expression.class);
        Statement body = v.child(ctx, ctx.statement(), Statement.class);
        return new WhileStatement(v.range(ctx), condition, body);
    }

    static UncheckedStatement uncheckedStatement(LoweringVisitor v, UncheckedStatementContext ctx) {
        return new UncheckedStatement(v.range(ctx), v.child(ctx, ctx.block(), Block.class));
    }

    static ForStatement forStatement(LoweringVisitor v, ForStatementContext ctx) {
        Statement init = v.optional(ctx.simpleStatement(), Statement.class);
        Expression condition = null;
        if (ctx.expressionStatement() != null) {
            ExpressionStatementContext conditionStatement = ctx.expressionStatement();
            condition = v.child(conditionStatement, conditionStatement.expression(), Expression.class);
        }
        ExpressionStatement loop = null;
        if (ctx.expression() != null) {
            loop = new ExpressionStatement(v.range(ctx.expression()), v.lower(ctx.expression(), Expression.class));
        }
        Statement body = v.child(ctx, ctx.statement(), Statement.class);
        return new ForStatement(v.range(ctx), init, condition, loop, body);
    }

    static InlineAssemblyStatement inlineAssemblyStatement(LoweringVisitor v, InlineAssemblyStatementContext ctx) {
        String language = ctx.StringLiteralFragment() == null ? null : Trees.unquote(ctx.StringLiteralFragment().getText());
        List<String> flags = new ArrayList<>();
        if (ctx.inlineAssemblyStatementFlag() != null) {
            StringLiteralContext literal =
                v.require(ctx, ctx.inlineAssemblyStatementFlag().stringLiteral(), "assembly flag");
            for (TerminalNode fragment : literal.StringLiteralFragment()) {
                flags.add(Trees.unquote(fragment.getText()));
            }
        }
        AssemblyBlock body = v.child(ctx, ctx.assemblyBlock(), AssemblyBlock.class);
        return new InlineAssemblyStatement(v.range(ctx), language, Collections.unmodifiableList(flags), body);
    }

    static DoWhileStatement doWhileStatement(LoweringVisitor v, DoWhileStatementContext ctx) {
        Statement body = v.child(ctx, ctx.statement(), Statement.class);
        Expression condition = v.child(ctx, ctx.expression(), Expression.class);
        return new DoWhileStatement(v.range(ctx), condition, body);
    }

    static ContinueStatement continueStatement(LoweringVisitor v, ContinueStatementContext ctx) {
        return new ContinueStatement(v.range(ctx));
    }

    static BreakStatement breakStatement(LoweringVisitor v, BreakStatementContext ctx) {
        return new BreakStatement(v.range(ctx));
    }

    static ReturnStatement returnStatement(LoweringVisitor v, ReturnStatementContext ctx) {
        return new ReturnStatement(v.range(ctx), v.optional(ctx.expression(), Expression.class));
    }

    static ThrowStatement throwStatement(LoweringVisitor v, ThrowStatementContext ctx) {
        return new ThrowStatement(v.range(ctx));
    }

    static EmitStatement emitStatement(LoweringVisitor v, EmitStatementContext ctx) {
        return new EmitStatement(v.range(ctx), v.child(ctx, ctx.functionCall(), Expression.class));
    }

    static RevertStatement revertStatement(LoweringVisitor v, RevertStatementContext ctx) {
        return new RevertStatement(v.range(ctx), v.child(ctx, ctx.functionCall(), Expression.class));
    }

    static VariableDeclarationStatement variableDeclarationStatement(LoweringVisitor v,
                                                                     VariableDeclarationStatementContext ctx) {
        List<VariableDeclaration> variables;
        if (ctx.identifierList() != null) {
            variables = v.list(ctx.identifierList(), VariableDeclaration.class);
        } else if (ctx.variableDeclaration() != null) {
            variables = List.of(v.lower(ctx.variableDeclaration(), VariableDeclaration.class));
        } else if (ctx.variableDeclarationList() != null) {
            variables = v.list(ctx.variableDeclarationList(), VariableDeclaration.class);
        } else {
            throw v.malformed(ctx, "Missing declared variables");
        }
        Expression initialValue = v.optional(ctx.expression(), Expression.class);
        return new VariableDeclarationStatement(v.range(ctx), variables, initialValue);
    }

    static List<VariableDeclaration> variableDeclarationList(LoweringVisitor v, VariableDeclarationListContext ctx) {
        return Trees.withHoles(Trees.children(ctx), rule -> v.lower(rule, VariableDeclaration.class));
    }

    /**
     * The untyped {@code var (a, , b)} form. Each name becomes a declaration without a type.
     */
    static List<VariableDeclaration> identifierList(LoweringVisitor v, IdentifierListContext ctx) {
        return Trees.withHoles(Trees.inner(ctx), rule -> {
            Identifier identifier = v.lower(rule, Identifier.class);
            return new VariableDeclaration(
                identifier.loc(),
                null,
                identifier.name(),
                identifier,
                null,
                StateMutability.DEFAULT,
                StorageLocation.DEFAULT,
                false,
                false,
                false,
                false,
                null);
        });
    }
}
