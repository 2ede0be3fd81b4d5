package com.solparser.lower;

import com.solparser.LoweringResult;
import com.solparser.Nodes;
import com.solparser.Parser;
import com.solparser.ast.AssemblyAssignment;
import com.solparser.ast.AssemblyBlock;
import com.solparser.ast.AssemblyCall;
import com.solparser.ast.AssemblyFor;
import com.solparser.ast.AssemblyFunctionDefinition;
import com.solparser.ast.AssemblyIf;
import com.solparser.ast.AssemblyItem;
import com.solparser.ast.AssemblyLocalDefinition;
import com.solparser.ast.AssemblySwitch;
import com.solparser.ast.DecimalNumber;
import com.solparser.ast.HexNumber;
import com.solparser.ast.Identifier;
import com.solparser.ast.InlineAssemblyStatement;
import com.solparser.ast.Leave;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class AssemblyLoweringTest {

    private static List<AssemblyItem> assembly(String body) {
        LoweringResult result = Parser.parse("function f() { assembly { " + body + " } }");
        assertEquals(List.of(), result.diagnostics(), body);
        return Nodes.first(result.sourceUnit(), InlineAssemblyStatement.class).body().operations();
    }

    @Test
    void testLocalDefinitionAndIf() throws Exception {
        List<AssemblyItem> items = assembly("let x := add(1, 0x2) if x { leave }");
        assertEquals(2, items.size());

        AssemblyLocalDefinition let = (AssemblyLocalDefinition) items.get(0);
        assertEquals("x", ((Identifier) let.names().get(0)).name());
        AssemblyCall add = (AssemblyCall) let.expression();
        assertEquals("add", add.functionName());
        assertEquals("1", ((DecimalNumber) add.arguments().get(0)).value());
        assertEquals("0x2", ((HexNumber) add.arguments().get(1)).value());

        AssemblyIf branch = (AssemblyIf) items.get(1);
        assertEquals("x", ((AssemblyCall) branch.condition()).functionName());
        assertInstanceOf(Leave.class, branch.body().operations().get(0));
    }

    @Test
    void testSwitch() throws Exception {
        AssemblySwitch choice = (AssemblySwitch) assembly("switch x case 0 { y := 1 } default { y := 2 }").get(0);
        assertEquals(2, choice.cases().size());
        assertFalse(choice.cases().get(0).defaultCase());
        assertEquals("0", ((DecimalNumber) choice.cases().get(0).value()).value());
        assertTrue(choice.cases().get(1).defaultCase());
        assertNull(choice.cases().get(1).value());
        assertInstanceOf(AssemblyAssignment.class, choice.cases().get(1).block().operations().get(0));
    }

    @Test
    void testFunctionDefinition() throws Exception {
        AssemblyFunctionDefinition double_ =
            (AssemblyFunctionDefinition) assembly("function double(a, b) -> r { r := mul(a, 2) }").get(0);
        assertEquals("double", double_.name());
        assertEquals(List.of("a", "b"), double_.arguments().stream().map(Identifier::name).toList());
        assertEquals(List.of("r"), double_.returnArguments().stream().map(Identifier::name).toList());
        assertEquals(1, double_.body().operations().size());

        AssemblyFunctionDefinition noop = (AssemblyFunctionDefinition) assembly("function noop() { }").get(0);
        assertEquals(List.of(), noop.arguments());
        assertEquals(List.of(), noop.returnArguments());
    }

    @Test
    void testForLoop() throws Exception {
        AssemblyFor loop = (AssemblyFor) assembly("for { let i := 0 } lt(i, 10) { i := add(i, 1) } { }").get(0);
        assertInstanceOf(AssemblyBlock.class, loop.pre());
        assertEquals("lt", ((AssemblyCall) loop.condition()).functionName());
        AssemblyAssignment step = (AssemblyAssignment) ((AssemblyBlock) loop.post()).operations().get(0);
        assertEquals("i", ((Identifier) step.names().get(0)).name());
        assertEquals(List.of(), loop.body().operations());
    }
}
