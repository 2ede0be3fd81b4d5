package com.solparser.lower;

import com.solparser.ast.ArrayTypeName;
import com.solparser.ast.BinaryOperation;
import com.solparser.ast.BooleanLiteral;
import com.solparser.ast.Conditional;
import com.solparser.ast.Expression;
import com.solparser.ast.FunctionCall;
import com.solparser.ast.HexLiteral;
import com.solparser.ast.Identifier;
import com.solparser.ast.IndexAccess;
import com.solparser.ast.IndexRangeAccess;
import com.solparser.ast.MemberAccess;
import com.solparser.ast.NameValueExpression;
import com.solparser.ast.NameValueList;
import com.solparser.ast.NewExpression;
import com.solparser.ast.NumberLiteral;
import com.solparser.ast.StringLiteral;
import com.solparser.ast.TupleExpression;
import com.solparser.ast.TypeName;
import com.solparser.ast.UnaryOperation;
import com.solparser.ast.UserDefinedTypeName;
import org.antlr.v4.runtime.ParserRuleContext;
import org.antlr.v4.runtime.tree.ErrorNode;
import org.antlr.v4.runtime.tree.ParseTree;
import org.antlr.v4.runtime.tree.TerminalNode;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Set;

import static com.solparser.grammar.SolidityParser.*;

/**
 * Lowering of expressions. The expression rule has unlabeled alternatives, so the node is
 * chosen from the number of children and the operator tokens between them.
 */
final class ExpressionLowering {

    private static final Set<String> PREFIX_OPERATORS = Set.of("++", "--", "+", "-", "after", "delete", "!", "~");

    private static final Set<String> POSTFIX_OPERATORS = Set.of("++", "--");

    private static final Set<String> BINARY_OPERATORS = Set.of(
        "**", "*", "/", "%", "+", "-", "<<", ">>", "&", "^", "|",
        "<", ">", "<=", ">=", "==", "!=", "&&", "||",
        "=", "|=", "^=", "&=", "<<=", ">>=", "+=", "-=", "*=", "/=", "%=");

    private ExpressionLowering() {
    }

    private record CallArguments(List<Expression> arguments, List<String> names, List<Identifier> identifiers) {
    }

    static Expression expression(LoweringVisitor v, ExpressionContext ctx) {
        List<ParseTree> children = Trees.children(ctx);
        for (ParseTree child : children) {
            if (child instanceof ErrorNode) {
                throw v.malformed(ctx, "Unexpected token '" + child.getText() + "' in expression");
            }
        }
        return switch (children.size()) {
            case 1 -> v.child(ctx, ctx.primaryExpression(), Expression.class);
            case 2 -> twoChildren(v, ctx, children);
            case 3 -> threeChildren(v, ctx, children);
            case 4 -> fourChildren(v, ctx, children);
            case 5 -> fiveChildren(v, ctx, children);
            case 6 -> sixChildren(v, ctx, children);
            default -> throw v.malformed(ctx, "Unrecognized expression '" + ctx.getText() + "'");
        };
    }

    private static Expression twoChildren(LoweringVisitor v, ExpressionContext ctx, List<ParseTree> children) {
        ParseTree first = children.get(0);
        ParseTree second = children.get(1);
        if (Trees.isToken(first, "new")) {
            return new NewExpression(v.range(ctx), v.child(ctx, ctx.typeName(), TypeName.class));
        }
        if (first instanceof TerminalNode operator && PREFIX_OPERATORS.contains(operator.getText())) {
            return new UnaryOperation(v.range(ctx), operator.getText(), operand(v, ctx, second), true);
        }
        if (second instanceof TerminalNode operator && POSTFIX_OPERATORS.contains(operator.getText())) {
            return new UnaryOperation(v.range(ctx), operator.getText(), operand(v, ctx, first), false);
        }
        throw v.malformed(ctx, "Unrecognized unary expression '" + ctx.getText() + "'");
    }

    private static Expression threeChildren(LoweringVisitor v, ExpressionContext ctx, List<ParseTree> children) {
        ParseTree first = children.get(0);
        ParseTree middle = children.get(1);
        ParseTree last = children.get(2);
        if (Trees.isToken(first, "(") && Trees.isToken(last, ")")) {
            return new TupleExpression(v.range(ctx), List.of(operand(v, ctx, middle)), false);
        }
        if (Trees.isToken(middle, ".")) {
            return new MemberAccess(v.range(ctx), operand(v, ctx, first), last.getText());
        }
        if (middle instanceof TerminalNode operator && BINARY_OPERATORS.contains(operator.getText())) {
            Expression left = operand(v, ctx, first);
            Expression right = operand(v, ctx, last);
            return new BinaryOperation(v.range(ctx), operator.getText(), left, right);
        }
        throw v.malformed(ctx, "Unrecognized binary expression '" + ctx.getText() + "'");
    }

    private static Expression fourChildren(LoweringVisitor v, ExpressionContext ctx, List<ParseTree> children) {
        ParseTree open = children.get(1);
        ParseTree inner = children.get(2);
        ParseTree close = children.get(3);
        if (Trees.isToken(open, "(") && Trees.isToken(close, ")")) {
            Expression callee = operand(v, ctx, children.get(0));
            CallArguments arguments = callArguments(v, ctx, ctx.functionCallArguments());
            return new FunctionCall(v.range(ctx), callee, arguments.arguments(), arguments.names(), arguments.identifiers());
        }
        if (Trees.isToken(open, "[") && Trees.isToken(close, "]")) {
            Expression base = operand(v, ctx, children.get(0));
            if (Trees.isToken(inner, ":")) {
                return new IndexRangeAccess(v.range(ctx), base, null, null);
            }
            return new IndexAccess(v.range(ctx), base, operand(v, ctx, inner));
        }
        if (Trees.isToken(open, "{") && Trees.isToken(close, "}")) {
            Expression base = operand(v, ctx, children.get(0));
            NameValueList arguments = v.child(ctx, ctx.nameValueList(), NameValueList.class);
            return new NameValueExpression(v.range(ctx), base, arguments);
        }
        throw v.malformed(ctx, "Unrecognized expression '" + ctx.getText() + "'");
    }

    private static Expression fiveChildren(LoweringVisitor v, ExpressionContext ctx, List<ParseTree> children) {
        if (Trees.isToken(children.get(1), "?") && Trees.isToken(children.get(3), ":")) {
            Expression condition = operand(v, ctx, children.get(0));
            Expression whenTrue = operand(v, ctx, children.get(2));
            Expression whenFalse = operand(v, ctx, children.get(4));
            return new Conditional(v.range(ctx), condition, whenTrue, whenFalse);
        }
        if (Trees.isToken(children.get(1), "[") && Trees.isToken(children.get(4), "]")) {
            Expression base = operand(v, ctx, children.get(0));
            if (Trees.isToken(children.get(2), ":")) {
                return new IndexRangeAccess(v.range(ctx), base, null, operand(v, ctx, children.get(3)));
            }
            if (Trees.isToken(children.get(3), ":")) {
                return new IndexRangeAccess(v.range(ctx), base, operand(v, ctx, children.get(2)), null);
            }
        }
        throw v.malformed(ctx, "Unrecognized expression '" + ctx.getText() + "'");
    }

    private static Expression sixChildren(LoweringVisitor v, ExpressionContext ctx, List<ParseTree> children) {
        if (Trees.isToken(children.get(1), "[") && Trees.isToken(children.get(3), ":")
            && Trees.isToken(children.get(5), "]")) {
            Expression base = operand(v, ctx, children.get(0));
            Expression start = operand(v, ctx, children.get(2));
            Expression end = operand(v, ctx, children.get(4));
            return new IndexRangeAccess(v.range(ctx), base, start, end);
        }
        throw v.malformed(ctx, "Unrecognized expression '" + ctx.getText() + "'");
    }

    private static Expression operand(LoweringVisitor v, ExpressionContext owner, ParseTree child) {
        if (child instanceof ExpressionContext expression) {
            return v.lower(expression, Expression.class);
        }
        throw v.malformed(owner, "Expected an operand but found '" + child.getText() + "'");
    }

    private static CallArguments callArguments(LoweringVisitor v, ParserRuleContext owner,
                                               FunctionCallArgumentsContext ctx) {
        if (ctx == null) {
            return new CallArguments(List.of(), List.of(), List.of());
        }
        if (ctx.nameValueList() != null) {
            NameValueList named = v.lower(ctx.nameValueList(), NameValueList.class);
            return new CallArguments(named.arguments(), named.names(), named.identifiers());
        }
        if (ctx.expressionList() != null) {
            return new CallArguments(v.list(ctx.expressionList(), Expression.class), List.of(), List.of());
        }
        return new CallArguments(List.of(), List.of(), List.of());
    }

    static FunctionCall functionCall(LoweringVisitor v, FunctionCallContext ctx) {
        Expression callee = v.child(ctx, ctx.expression(), Expression.class);
        CallArguments arguments = callArguments(v, ctx, ctx.functionCallArguments());
        return new FunctionCall(v.range(ctx), callee, arguments.arguments(), arguments.names(), arguments.identifiers());
    }

    static NameValueList nameValueList(LoweringVisitor v, NameValueListContext ctx) {
        List<String> names = new ArrayList<>();
        List<Identifier> identifiers = new ArrayList<>();
        List<Expression> arguments = new ArrayList<>();
        for (NameValueContext nameValue : ctx.nameValue()) {
            Identifier identifier = v.child(nameValue, nameValue.identifier(), Identifier.class);
            names.add(identifier.name());
            identifiers.add(identifier);
            arguments.add(v.child(nameValue, nameValue.expression(), Expression.class));
        }
        return new NameValueList(v.range(ctx), Collections.unmodifiableList(names),
            Collections.unmodifiableList(identifiers), Collections.unmodifiableList(arguments));
    }

    static Expression primaryExpression(LoweringVisitor v, PrimaryExpressionContext ctx) {
        if (ctx.BooleanLiteral() != null) {
            return new BooleanLiteral(v.range(ctx), "true".equals(ctx.BooleanLiteral().getText()));
        }
        if (ctx.identifier() != null && Trees.hasToken(ctx, "[")) {
            IdentifierContext name = ctx.identifier();
            return new ArrayTypeName(v.range(ctx), new UserDefinedTypeName(v.range(name), name.getText()), null);
        }
        if (ctx.TypeKeyword() != null) {
            return new Identifier(v.range(ctx), "type");
        }
        if (ctx.PayableKeyword() != null) {
            return new Identifier(v.range(ctx), "payable");
        }
        ParserRuleContext only = Trees.onlyRuleChild(ctx);
        if (only == null) {
            throw v.malformed(ctx, "Unrecognized primary expression '" + ctx.getText() + "'");
        }
        return v.lower(only, Expression.class);
    }

    static List<Expression> expressionList(LoweringVisitor v, ExpressionListContext ctx) {
        return v.each(ctx.expression(), Expression.class);
    }

    static TupleExpression tupleExpression(LoweringVisitor v, TupleExpressionContext ctx) {
        boolean array = ctx.getChildCount() > 0 && Trees.isToken(ctx.getChild(0), "[");
        List<Expression> components = array
            ? v.each(ctx.expression(), Expression.class)
            : Trees.withHoles(Trees.inner(ctx), rule -> v.lower(rule, Expression.class));
        return new TupleExpression(v.range(ctx), components, array);
    }

    static NumberLiteral numberLiteral(LoweringVisitor v, NumberLiteralContext ctx) {
        TerminalNode number = ctx.DecimalNumber() != null ? ctx.DecimalNumber() : ctx.HexNumber();
        v.require(ctx, number, "number");
        String unit = ctx.NumberUnit() == null ? null : ctx.NumberUnit().getText();
        return new NumberLiteral(v.range(ctx), number.getText(), unit);
    }

    static HexLiteral hexLiteral(LoweringVisitor v, HexLiteralContext ctx) {
        List<String> parts = new ArrayList<>();
        for (TerminalNode fragment : ctx.HexLiteralFragment()) {
            String text = fragment.getText();
            // hex"..." or hex'...'
            parts.add(text.substring(4, text.length() - 1));
        }
        return new HexLiteral(v.range(ctx), String.join("", parts), Collections.unmodifiableList(parts));
    }

    static StringLiteral stringLiteral(LoweringVisitor v, StringLiteralContext ctx) {
        List<String> parts = new ArrayList<>();
        List<Boolean> unicode = new ArrayList<>();
        for (TerminalNode fragment : ctx.StringLiteralFragment()) {
            String text = fragment.getText();
            boolean isUnicode = text.startsWith("unicode");
            if (isUnicode) {
                text = text.substring("unicode".length());
            }
            char quote = text.charAt(0);
            String content = Trees.unquote(text);
            parts.add(quote == '"' ? content.replace("\\\"", "\"") : content.replace("\\'", "'"));
            unicode.add(isUnicode);
        }
        if (parts.isEmpty()) {
            throw v.malformed(ctx, "Empty string literal");
        }
        return new StringLiteral(v.range(ctx), String.join("", parts),
            Collections.unmodifiableList(parts), Collections.unmodifiableList(unicode));
    }
}
