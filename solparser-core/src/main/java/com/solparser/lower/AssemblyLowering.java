package com.solparser.lower;

import com.solparser.ast.AssemblyAssignment;
import com.solparser.ast.AssemblyBlock;
import com.solparser.ast.AssemblyCall;
import com.solparser.ast.AssemblyCase;
import com.solparser.ast.AssemblyExpression;
import com.solparser.ast.AssemblyFor;
import com.solparser.ast.AssemblyFunctionDefinition;
import com.solparser.ast.AssemblyIf;
import com.solparser.ast.AssemblyItem;
import com.solparser.ast.AssemblyLocalDefinition;
import com.solparser.ast.AssemblyMemberAccess;
import com.solparser.ast.AssemblyStackAssignment;
import com.solparser.ast.AssemblySwitch;
import com.solparser.ast.BooleanLiteral;
import com.solparser.ast.Break;
import com.solparser.ast.Continue;
import com.solparser.ast.DecimalNumber;
import com.solparser.ast.HexNumber;
import com.solparser.ast.Identifier;
import com.solparser.ast.LabelDefinition;
import com.solparser.ast.Leave;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ParseTree;

import java.util.List;

import static com.solparser.grammar.SolidityParser.*;

final class AssemblyLowering {

    private AssemblyLowering() {
    }

    static AssemblyBlock assemblyBlock(LoweringVisitor v, AssemblyBlockContext ctx) {
        return new AssemblyBlock(v.range(ctx), v.items(ctx, ctx.assemblyItem(), AssemblyItem.class));
    }

    static AssemblyItem assemblyItem(LoweringVisitor v, AssemblyItemContext ctx) {
        if (ctx.BreakKeyword() != null) {
            return new Break(v.range(ctx));
        }
        if (ctx.ContinueKeyword() != null) {
            return new Continue(v.range(ctx));
        }
        if (ctx.LeaveKeyword() != null) {
            return new Leave(v.range(ctx));
        }
        ParserRuleContext only = Trees.onlyRuleChild(ctx);
        if (only == null) {
            throw v.malformed(ctx, "Unrecognized assembly item '" + ctx.getText() + "'");
        }
        return v.lower(only, AssemblyItem.class);
    }

    static AssemblyMemberAccess assemblyMember(LoweringVisitor v, AssemblyMemberContext ctx) {
        List<IdentifierContext> identifiers = ctx.identifier();
        if (identifiers.size() != 2) {
            throw v.malformed(ctx, "Expected 'object.member' in assembly");
        }
        return new AssemblyMemberAccess(v.range(ctx),
            v.lower(identifiers.get(0), Identifier.class),
            v.lower(identifiers.get(1), Identifier.class));
    }

    static AssemblyCall assemblyCall(LoweringVisitor v, AssemblyCallContext ctx) {
        if (ctx.getChildCount() == 0) {
            throw v.malformed(ctx, "Missing function name in assembly call");
        }
        String functionName = ctx.getChild(0).getText();
        return new AssemblyCall(v.range(ctx), functionName, v.each(ctx.assemblyExpression(), AssemblyExpression.class));
    }

    static AssemblyLocalDefinition assemblyLocalDefinition(LoweringVisitor v, AssemblyLocalDefinitionContext ctx) {
        List<AssemblyItem> names = names(v, v.require(ctx, ctx.assemblyIdentifierOrList(), "assembly names"));
        AssemblyExpression expression = v.optional(ctx.assemblyExpression(), AssemblyExpression.class);
        return new AssemblyLocalDefinition(v.range(ctx), names, expression);
    }

    static AssemblyAssignment assemblyAssignment(LoweringVisitor v, AssemblyAssignmentContext ctx) {
        List<AssemblyItem> names = names(v, v.require(ctx, ctx.assemblyIdentifierOrList(), "assembly names"));
        AssemblyExpression expression = v.child(ctx, ctx.assemblyExpression(), AssemblyExpression.class);
        return new AssemblyAssignment(v.range(ctx), names, expression);
    }

    private static List<AssemblyItem> names(LoweringVisitor v, AssemblyIdentifierOrListContext ctx) {
        if (ctx.identifier() != null) {
            return List.of(v.lower(ctx.identifier(), AssemblyItem.class));
        }
        if (ctx.assemblyMember() != null) {
            return List.of(v.lower(ctx.assemblyMember(), AssemblyItem.class));
        }
        if (ctx.assemblyIdentifierList() != null) {
            return v.list(ctx.assemblyIdentifierList(), AssemblyItem.class);
        }
        throw v.malformed(ctx, "Missing assembly names");
    }

    static List<Identifier> assemblyIdentifierList(LoweringVisitor v, AssemblyIdentifierListContext ctx) {
        return v.each(ctx.identifier(), Identifier.class);
    }

    static AssemblyStackAssignment assemblyStackAssignment(LoweringVisitor v, AssemblyStackAssignmentContext ctx) {
        AssemblyExpression expression = v.child(ctx, ctx.assemblyExpression(), AssemblyExpression.class);
        String name = v.require(ctx, ctx.identifier(), "assembly name").getText();
        return new AssemblyStackAssignment(v.range(ctx), expression, name);
    }

    static LabelDefinition labelDefinition(LoweringVisitor v, LabelDefinitionContext ctx) {
        return new LabelDefinition(v.range(ctx), v.require(ctx, ctx.identifier(), "label").getText());
    }

    static AssemblySwitch assemblySwitch(LoweringVisitor v, AssemblySwitchContext ctx) {
        AssemblyExpression expression = v.child(ctx, ctx.assemblyExpression(), AssemblyExpression.class);
        return new AssemblySwitch(v.range(ctx), expression, v.each(ctx.assemblyCase(), AssemblyCase.class));
    }

    static AssemblyCase assemblyCase(LoweringVisitor v, AssemblyCaseContext ctx) {
        boolean defaultCase = ctx.assemblyLiteral() == null;
        AssemblyExpression value = defaultCase ? null : v.lower(ctx.assemblyLiteral(), AssemblyExpression.class);
        AssemblyBlock block = v.child(ctx, ctx.assemblyBlock(), AssemblyBlock.class);
        return new AssemblyCase(v.range(ctx), value, block, defaultCase);
    }

    static AssemblyFunctionDefinition assemblyFunctionDefinition(LoweringVisitor v,
                                                                 AssemblyFunctionDefinitionContext ctx) {
        String name = v.require(ctx, ctx.identifier(), "function name").getText();
        List<Identifier> arguments = ctx.assemblyIdentifierList() == null
            ? List.of()
            : v.list(ctx.assemblyIdentifierList(), Identifier.class);
        List<Identifier> returnArguments = List.of();
        AssemblyFunctionReturnsContext returns = ctx.assemblyFunctionReturns();
        if (returns != null) {
            returnArguments = v.list(v.require(returns, returns.assemblyIdentifierList(), "return names"), Identifier.class);
        }
        AssemblyBlock body = v.child(ctx, ctx.assemblyBlock(), AssemblyBlock.class);
        return new AssemblyFunctionDefinition(v.range(ctx), name, arguments, returnArguments, body);
    }

    static AssemblyFor assemblyFor(LoweringVisitor v, AssemblyForContext ctx) {
        List<ParseTree> children = Trees.children(ctx);
        if (children.size() != 5) {
            throw v.malformed(ctx, "Expected init, condition, post and body in assembly for");
        }
        AssemblyItem pre = item(v, ctx, children.get(1));
        AssemblyExpression condition = v.lower(rule(v, ctx, children.get(2)), AssemblyExpression.class);
        AssemblyItem post = item(v, ctx, children.get(3));
        AssemblyBlock body = v.lower(rule(v, ctx, children.get(4)), AssemblyBlock.class);
        return new AssemblyFor(v.range(ctx), pre, condition, post, body);
    }

    private static AssemblyItem item(LoweringVisitor v, AssemblyForContext owner, ParseTree child) {
        return v.lower(rule(v, owner, child), AssemblyItem.class);
    }

    private static ParserRuleContext rule(LoweringVisitor v, AssemblyForContext owner, ParseTree child) {
        if (child instanceof ParserRuleContext rule) {
            return rule;
        }
        throw v.malformed(owner, "Unexpected token '" + child.getText() + "' in assembly for");
    }

    static AssemblyIf assemblyIf(LoweringVisitor v, AssemblyIfContext ctx) {
        AssemblyExpression condition = v.child(ctx, ctx.assemblyExpression(), AssemblyExpression.class);
        AssemblyBlock body = v.child(ctx, ctx.assemblyBlock(), AssemblyBlock.class);
        return new AssemblyIf(v.range(ctx), condition, body);
    }

    static AssemblyExpression assemblyLiteral(LoweringVisitor v, AssemblyLiteralContext ctx) {
        if (ctx.DecimalNumber() != null) {
            return new DecimalNumber(v.range(ctx), ctx.DecimalNumber().getText());
        }
        if (ctx.HexNumber() != null) {
            return new HexNumber(v.range(ctx), ctx.HexNumber().getText());
        }
        if (ctx.BooleanLiteral() != null) {
            return new BooleanLiteral(v.range(ctx), "true".equals(ctx.BooleanLiteral().getText()));
        }
        ParserRuleContext only = Trees.onlyRuleChild(ctx);
        if (only == null) {
            throw v.malformed(ctx, "Unrecognized assembly literal '" + ctx.getText() + "'");
        }
        return v.lower(only, AssemblyExpression.class);
    }
}
