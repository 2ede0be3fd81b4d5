package com.solparser.lower;

import com.solparser.LoweringResult;
import com.solparser.Nodes;
import com.solparser.Parser;
import com.solparser.ast.ContractDefinition;
import com.solparser.ast.ContractKind;
import com.solparser.ast.CustomErrorDefinition;
import com.solparser.ast.ElementaryTypeName;
import com.solparser.ast.EnumDefinition;
import com.solparser.ast.EventDefinition;
import com.solparser.ast.FileLevelConstant;
import com.solparser.ast.FunctionDefinition;
import com.solparser.ast.FunctionTypeName;
import com.solparser.ast.Mapping;
import com.solparser.ast.ModifierDefinition;
import com.solparser.ast.ModifierInvocation;
import com.solparser.ast.StateMutability;
import com.solparser.ast.StateVariableDeclaration;
import com.solparser.ast.StorageLocation;
import com.solparser.ast.TypeDefinition;
import com.solparser.ast.UsingForDeclaration;
import com.solparser.ast.VariableDeclaration;
import com.solparser.ast.Visibility;
import com.solparser.diagnostics.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.Arrays;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class DeclarationLoweringTest {

    private static LoweringResult clean(String source) {
        LoweringResult result = Parser.parse(source);
        assertEquals(List.of(), result.diagnostics(), source);
        return result;
    }

    private static FunctionDefinition function(String source) {
        return Nodes.first(clean(source).sourceUnit(), FunctionDefinition.class);
    }

    private static VariableDeclaration stateVariable(LoweringResult result) {
        return Nodes.first(result.sourceUnit(), StateVariableDeclaration.class).variables().get(0);
    }

    @Test
    void testPayableReturnType() throws Exception {
        FunctionDefinition test = function("contract A { function test() public returns(address payable) {} }");
        assertEquals("test", test.name());
        assertEquals(Visibility.PUBLIC, test.visibility());
        assertEquals(StateMutability.DEFAULT, test.stateMutability());
        assertEquals(1, test.returnParameters().size());

        VariableDeclaration returned = test.returnParameters().get(0);
        ElementaryTypeName type = (ElementaryTypeName) returned.typeName();
        assertEquals("address", type.name());
        assertEquals(StateMutability.PAYABLE, type.stateMutability());
        assertEquals(StateMutability.PAYABLE, returned.stateMutability());
        assertNull(returned.name());
        System.out.println("✓ address payable return parameter");
    }

    @Test
    void testConstantStateVariable() throws Exception {
        VariableDeclaration x = stateVariable(clean("contract A { uint constant X = 1; }"));
        assertEquals("X", x.name());
        assertTrue(x.declaredConst());
        assertTrue(x.stateVar());
        assertFalse(x.immutable());
        assertEquals(StateMutability.CONSTANT, x.stateMutability());
        assertEquals(Visibility.INTERNAL, x.visibility());
        assertEquals(StorageLocation.STORAGE, x.storageLocation());
    }

    @Test
    void testConflictingMutabilityIsResolvedWithWarning() throws Exception {
        LoweringResult result = Parser.parse("contract A { function f() view constant {} }");
        FunctionDefinition f = Nodes.first(result.sourceUnit(), FunctionDefinition.class);
        assertEquals(StateMutability.CONSTANT, f.stateMutability());
        assertEquals(1, result.diagnostics().size());
        assertEquals(DiagnosticKind.AMBIGUOUS_ATTRIBUTE, result.diagnostics().get(0).kind());
    }

    @Test
    void testConflictingVisibilityIsResolvedWithWarning() throws Exception {
        LoweringResult result = Parser.parse("contract A { function f() public external {} }");
        FunctionDefinition f = Nodes.first(result.sourceUnit(), FunctionDefinition.class);
        assertEquals(Visibility.EXTERNAL, f.visibility());
        assertEquals(1, result.diagnostics(DiagnosticKind.AMBIGUOUS_ATTRIBUTE).size());

        result = Parser.parse("contract A { uint public private y; }");
        assertEquals(Visibility.PUBLIC, stateVariable(result).visibility());
        assertEquals(1, result.diagnostics(DiagnosticKind.AMBIGUOUS_ATTRIBUTE).size());
    }

    @Test
    void testConstantImmutableConflict() throws Exception {
        LoweringResult result = Parser.parse("contract A { uint constant immutable Z = 1; }");
        VariableDeclaration z = stateVariable(result);
        assertEquals(StateMutability.CONSTANT, z.stateMutability());
        assertTrue(z.immutable());
        assertEquals(1, result.diagnostics(DiagnosticKind.AMBIGUOUS_ATTRIBUTE).size());
    }

    @Test
    void testDefaultVisibilityFollowsEnclosingKind() throws Exception {
        assertEquals(Visibility.PUBLIC, function("contract A { function f() {} }").visibility());
        assertEquals(Visibility.PUBLIC, function("abstract contract A { function f(); }").visibility());
        assertEquals(Visibility.EXTERNAL, function("interface I { function f(); }").visibility());
        assertEquals(Visibility.INTERNAL, function("library L { function f() {} }").visibility());
        assertEquals(Visibility.PUBLIC, function("function f() pure {}").visibility());
    }

    @Test
    void testContractKinds() throws Exception {
        LoweringResult result = clean("contract A {} abstract contract B {} interface C {} library D {}");
        List<ContractKind> kinds = Nodes.all(result.sourceUnit(), ContractDefinition.class).stream()
            .map(ContractDefinition::kind).toList();
        assertEquals(Arrays.asList(ContractKind.values()), kinds);
    }

    @Test
    void testSpecialFunctions() throws Exception {
        FunctionDefinition constructor = function("contract A { constructor(uint a) {} }");
        assertTrue(constructor.constructor());
        assertNull(constructor.name());
        assertEquals(Visibility.PUBLIC, constructor.visibility());
        assertEquals(1, constructor.parameters().size());

        FunctionDefinition receive = function("contract A { receive() external payable {} }");
        assertTrue(receive.receiveEther());
        assertEquals(StateMutability.PAYABLE, receive.stateMutability());
        assertEquals(Visibility.EXTERNAL, receive.visibility());

        FunctionDefinition fallback = function("contract A { fallback() {} }");
        assertTrue(fallback.fallback());
        assertEquals(Visibility.EXTERNAL, fallback.visibility());
    }

    @Test
    void testLegacyConstructorAndFallback() throws Exception {
        FunctionDefinition constructor = function("contract A { function A() public {} }");
        assertEquals("A", constructor.name());
        assertTrue(constructor.constructor());
        assertFalse(constructor.fallback());

        FunctionDefinition fallback = function("contract A { function() {} }");
        assertEquals("", fallback.name());
        assertTrue(fallback.fallback());
        assertEquals(Visibility.EXTERNAL, fallback.visibility());

        FunctionDefinition plain = function("contract A { function B() public {} }");
        assertFalse(plain.constructor());
        assertFalse(plain.fallback());
    }

    @Test
    void testModifiers() throws Exception {
        LoweringResult result = clean("""
            contract A {
                modifier m(uint a) virtual { _; }
                modifier n { _; }
                function f() public m(1) n virtual override(B, C) returns (uint r) { return 1; }
            }
            """);
        List<ModifierDefinition> definitions = Nodes.all(result.sourceUnit(), ModifierDefinition.class);
        assertEquals(2, definitions.size());
        assertEquals(1, definitions.get(0).parameters().size());
        assertTrue(definitions.get(0).virtual());
        assertNull(definitions.get(1).parameters());
        assertFalse(definitions.get(1).virtual());

        FunctionDefinition f = Nodes.first(result.sourceUnit(), FunctionDefinition.class);
        List<ModifierInvocation> modifiers = f.modifiers();
        assertEquals(2, modifiers.size());
        assertEquals("m", modifiers.get(0).name());
        assertEquals(1, modifiers.get(0).arguments().size());
        assertEquals("n", modifiers.get(1).name());
        assertNull(modifiers.get(1).arguments());
        assertTrue(f.virtual());
        assertEquals(List.of("B", "C"), f.override().stream().map(o -> o.namePath()).toList());
        assertEquals("r", f.returnParameters().get(0).name());
    }

    @Test
    void testFunctionWithoutBodyOrReturns() throws Exception {
        FunctionDefinition f = function("interface I { function f(uint a, bytes calldata b) external; }");
        assertNull(f.body());
        assertNull(f.returnParameters());
        assertEquals(StorageLocation.CALLDATA, f.parameters().get(1).storageLocation());
        assertEquals(StorageLocation.DEFAULT, f.parameters().get(0).storageLocation());
    }

    @Test
    void testEventsAndErrors() throws Exception {
        LoweringResult result = clean("""
            contract A {
                event Ev(uint indexed a, bytes b) anonymous;
                error Failed(uint code);
            }
            """);
        EventDefinition event = Nodes.first(result.sourceUnit(), EventDefinition.class);
        assertEquals("Ev", event.name());
        assertTrue(event.anonymous());
        assertTrue(event.parameters().get(0).indexed());
        assertFalse(event.parameters().get(1).indexed());
        assertEquals("b", event.parameters().get(1).name());

        CustomErrorDefinition error = Nodes.first(result.sourceUnit(), CustomErrorDefinition.class);
        assertEquals("Failed", error.name());
        assertEquals(1, error.parameters().size());
    }

    @Test
    void testEnumsAndTypeDefinitions() throws Exception {
        LoweringResult result = clean("enum Color { Red, Green, Blue } type Price is uint128;");
        EnumDefinition color = Nodes.first(result.sourceUnit(), EnumDefinition.class);
        assertEquals(List.of("Red", "Green", "Blue"), color.members().stream().map(m -> m.name()).toList());

        TypeDefinition price = Nodes.first(result.sourceUnit(), TypeDefinition.class);
        assertEquals("Price", price.name());
        assertEquals("uint128", price.definition().name());
    }

    @Test
    void testUsingFor() throws Exception {
        UsingForDeclaration library = Nodes.first(
            clean("contract A { using Math for uint; }").sourceUnit(), UsingForDeclaration.class);
        assertEquals("Math", library.libraryName());
        assertEquals(List.of(), library.functions());
        assertEquals("uint", ((ElementaryTypeName) library.typeName()).name());
        assertFalse(library.global());

        UsingForDeclaration braces = Nodes.first(
            clean("using {add, sub as -} for Money global;").sourceUnit(), UsingForDeclaration.class);
        assertNull(braces.libraryName());
        assertEquals(List.of("add", "sub"), braces.functions());
        assertEquals(Arrays.asList(null, "-"), braces.operators());
        assertTrue(braces.global());

        UsingForDeclaration wildcard = Nodes.first(
            clean("contract A { using Math for *; }").sourceUnit(), UsingForDeclaration.class);
        assertNull(wildcard.typeName());
    }

    @Test
    void testFileLevelConstant() throws Exception {
        FileLevelConstant limit = Nodes.first(clean("uint constant LIMIT = 100;").sourceUnit(), FileLevelConstant.class);
        assertEquals("LIMIT", limit.name());
        assertTrue(limit.declaredConst());
        assertEquals(StateMutability.CONSTANT, limit.stateMutability());
        assertEquals(Visibility.INTERNAL, limit.visibility());
    }

    @Test
    void testFunctionTypeAndMappingNames() throws Exception {
        LoweringResult result = clean("""
            contract A {
                function (uint) external view returns (bool) cb;
                mapping(address owner => uint balance) balances;
            }
            """);
        FunctionTypeName cb = Nodes.first(result.sourceUnit(), FunctionTypeName.class);
        assertEquals(1, cb.parameterTypes().size());
        assertEquals(1, cb.returnTypes().size());
        assertEquals(Visibility.EXTERNAL, cb.visibility());
        assertEquals(StateMutability.VIEW, cb.stateMutability());

        Mapping balances = Nodes.first(result.sourceUnit(), Mapping.class);
        assertEquals("owner", balances.keyName().name());
        assertEquals("balance", balances.valueName().name());
        assertEquals("address", ((ElementaryTypeName) balances.keyType()).name());
    }
}
