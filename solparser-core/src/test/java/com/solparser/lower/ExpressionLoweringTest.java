package com.solparser.lower;

import com.solparser.LoweringResult;
import com.solparser.Nodes;
import com.solparser.Parser;
import com.solparser.ast.ArrayTypeName;
import com.solparser.ast.BinaryOperation;
import com.solparser.ast.BooleanLiteral;
import com.solparser.ast.Conditional;
import com.solparser.ast.ElementaryTypeName;
import com.solparser.ast.Expression;
import com.solparser.ast.ExpressionStatement;
import com.solparser.ast.FunctionCall;
import com.solparser.ast.HexLiteral;
import com.solparser.ast.Identifier;
import com.solparser.ast.IndexAccess;
import com.solparser.ast.IndexRangeAccess;
import com.solparser.ast.MemberAccess;
import com.solparser.ast.NameValueExpression;
import com.solparser.ast.NewExpression;
import com.solparser.ast.NumberLiteral;
import com.solparser.ast.StringLiteral;
import com.solparser.ast.TupleExpression;
import com.solparser.ast.UnaryOperation;
import com.solparser.ast.UserDefinedTypeName;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ExpressionLoweringTest {

    private static Expression expr(String source) {
        LoweringResult result = Parser.parse("function f() { " + source + "; }");
        assertEquals(List.of(), result.diagnostics(), source);
        return Nodes.first(result.sourceUnit(), ExpressionStatement.class).expression();
    }

    private static String name(Expression expression) {
        return ((Identifier) expression).name();
    }

    @Test
    void testBinaryPrecedence() throws Exception {
        BinaryOperation sum = (BinaryOperation) expr("a + b * c");
        assertEquals("+", sum.operator());
        assertEquals("a", name(sum.left()));
        BinaryOperation product = (BinaryOperation) sum.right();
        assertEquals("*", product.operator());
        assertEquals("b", name(product.left()));
        assertEquals("c", name(product.right()));
    }

    @Test
    void testAssignmentOfConditional() throws Exception {
        BinaryOperation assignment = (BinaryOperation) expr("x = y ? 1 : 2");
        assertEquals("=", assignment.operator());
        Conditional conditional = (Conditional) assignment.right();
        assertEquals("y", name(conditional.condition()));
        assertEquals("1", ((NumberLiteral) conditional.trueExpression()).number());
        assertEquals("2", ((NumberLiteral) conditional.falseExpression()).number());

        assertEquals("+=", ((BinaryOperation) expr("total += 1")).operator());
    }

    @Test
    void testUnaryOperations() throws Exception {
        UnaryOperation postfix = (UnaryOperation) expr("i++");
        assertEquals("++", postfix.operator());
        assertFalse(postfix.prefix());

        UnaryOperation negation = (UnaryOperation) expr("-x");
        assertEquals("-", negation.operator());
        assertTrue(negation.prefix());

        assertEquals("!", ((UnaryOperation) expr("!done")).operator());

        UnaryOperation delete = (UnaryOperation) expr("delete m[k]");
        assertEquals("delete", delete.operator());
        IndexAccess access = (IndexAccess) delete.subExpression();
        assertEquals("m", name(access.base()));
        assertEquals("k", name(access.index()));
    }

    @Test
    void testCallsAndMembers() throws Exception {
        FunctionCall call = (FunctionCall) expr("a.b.c(1, 2)");
        MemberAccess member = (MemberAccess) call.expression();
        assertEquals("c", member.memberName());
        assertEquals("b", ((MemberAccess) member.expression()).memberName());
        assertEquals(2, call.arguments().size());
        assertEquals(List.of(), call.names());

        FunctionCall named = (FunctionCall) expr("f({to: a, value: 2})");
        assertEquals(List.of("to", "value"), named.names());
        assertEquals(2, named.identifiers().size());
        assertEquals("a", name(named.arguments().get(0)));

        FunctionCall empty = (FunctionCall) expr("g()");
        assertEquals(List.of(), empty.arguments());
    }

    @Test
    void testCallOptions() throws Exception {
        FunctionCall call = (FunctionCall) expr("x.call{value: 1}(\"\")");
        NameValueExpression options = (NameValueExpression) call.expression();
        assertEquals("call", ((MemberAccess) options.expression()).memberName());
        assertEquals(List.of("value"), options.arguments().names());
        assertEquals("", ((StringLiteral) call.arguments().get(0)).value());
    }

    @Test
    void testIndexRanges() throws Exception {
        IndexRangeAccess both = (IndexRangeAccess) expr("arr[1:2]");
        assertEquals("1", ((NumberLiteral) both.indexStart()).number());
        assertEquals("2", ((NumberLiteral) both.indexEnd()).number());

        IndexRangeAccess start = (IndexRangeAccess) expr("arr[1:]");
        assertNotNull(start.indexStart());
        assertNull(start.indexEnd());

        IndexRangeAccess end = (IndexRangeAccess) expr("arr[:2]");
        assertNull(end.indexStart());
        assertNotNull(end.indexEnd());

        IndexRangeAccess neither = (IndexRangeAccess) expr("arr[:]");
        assertEquals("arr", name(neither.base()));
        assertNull(neither.indexStart());
        assertNull(neither.indexEnd());
    }

    @Test
    void testNewExpression() throws Exception {
        FunctionCall call = (FunctionCall) expr("new uint[](3)");
        NewExpression creation = (NewExpression) call.expression();
        ArrayTypeName array = (ArrayTypeName) creation.typeName();
        assertEquals("uint", ((ElementaryTypeName) array.baseTypeName()).name());
        assertNull(array.length());
    }

    @Test
    void testTuples() throws Exception {
        TupleExpression parenthesized = (TupleExpression) expr("(a)");
        assertFalse(parenthesized.array());
        assertEquals(1, parenthesized.components().size());

        BinaryOperation destructuring = (BinaryOperation) expr("(a, , b) = f()");
        TupleExpression target = (TupleExpression) destructuring.left();
        assertEquals(3, target.components().size());
        assertEquals("a", name(target.components().get(0)));
        assertNull(target.components().get(1));
        assertEquals("b", name(target.components().get(2)));

        TupleExpression array = (TupleExpression) expr("[1, 2, 3]");
        assertTrue(array.array());
        assertEquals(3, array.components().size());
    }

    @Test
    void testTypeExpressions() throws Exception {
        MemberAccess max = (MemberAccess) expr("type(uint).max");
        assertEquals("max", max.memberName());
        FunctionCall typeCall = (FunctionCall) max.expression();
        assertEquals("type", name(typeCall.expression()));
        assertEquals("uint", ((ElementaryTypeName) typeCall.arguments().get(0)).name());

        FunctionCall payable = (FunctionCall) expr("payable(x)");
        assertEquals("payable", name(payable.expression()));

        FunctionCall decode = (FunctionCall) expr("abi.decode(data, (Foo[]))");
        TupleExpression types = (TupleExpression) decode.arguments().get(1);
        ArrayTypeName array = (ArrayTypeName) types.components().get(0);
        assertEquals("Foo", ((UserDefinedTypeName) array.baseTypeName()).namePath());
    }

    @Test
    void testLiterals() throws Exception {
        assertTrue(((BooleanLiteral) expr("true")).value());
        assertFalse(((BooleanLiteral) expr("false")).value());

        NumberLiteral ether = (NumberLiteral) expr("1 ether");
        assertEquals("1", ether.number());
        assertEquals("ether", ether.subdenomination());

        NumberLiteral hex = (NumberLiteral) expr("0xff");
        assertEquals("0xff", hex.number());
        assertNull(hex.subdenomination());

        HexLiteral bytes = (HexLiteral) expr("hex\"00ff\" hex'aa'");
        assertEquals("00ffaa", bytes.value());
        assertEquals(List.of("00ff", "aa"), bytes.parts());
    }

    @Test
    void testStringLiterals() throws Exception {
        StringLiteral joined = (StringLiteral) expr("\"a\" \"b\"");
        assertEquals("ab", joined.value());
        assertEquals(List.of("a", "b"), joined.parts());
        assertEquals(List.of(false, false), joined.unicode());

        StringLiteral unicode = (StringLiteral) expr("unicode\"hi\"");
        assertEquals("hi", unicode.value());
        assertEquals(List.of(true), unicode.unicode());

        assertEquals("it's", ((StringLiteral) expr("'it\\'s'")).value());
        assertEquals("say \"x\"", ((StringLiteral) expr("\"say \\\"x\\\"\"")).value());
    }
}
