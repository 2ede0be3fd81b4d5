package com.solparser;

import com.solparser.ast.ContractDefinition;
import com.solparser.ast.FunctionDefinition;
import com.solparser.ast.ImportDirective;
import com.solparser.ast.PragmaDirective;
import com.solparser.ast.SourceUnit;
import com.solparser.ast.Unrecognized;
import com.solparser.diagnostics.DiagnosticKind;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class ParserTest {

    static final String VAULT = """
        // SPDX-License-Identifier: MIT
        pragma solidity ^0.8.0;
        import "./Base.sol";
        import {Token as T} from "./Token.sol";

        uint constant LIMIT = 100;
        error Unauthorized(address caller);
        type Price is uint128;
        struct Point { uint x; uint y; }
        enum Color { Red, Green }

        function helper(uint a) pure returns (uint) { return a * 2; }

        interface IToken {
            function transfer(address to, uint amount) external returns (bool);
            event Sent(address indexed from, uint amount);
        }

        library Math {
            function max(uint a, uint b) internal pure returns (uint) { return a >= b ? a : b; }
        }

        abstract contract Owned {
            address public owner;
            modifier onlyOwner() { require(msg.sender == owner, "not owner"); _; }
            function kind() public virtual returns (string memory);
        }

        contract Vault is Owned, IToken {
            using Math for uint;
            mapping(address => uint) private balances;
            uint[] public history;
            address payable public treasury;
            uint immutable created;
            event Deposit(address indexed who, uint amount);

            constructor(address payable t) { treasury = t; created = block.timestamp; owner = msg.sender; }

            receive() external payable { balances[msg.sender] += msg.value; }

            fallback() external {}

            function transfer(address to, uint amount) external override returns (bool) {
                if (balances[msg.sender] < amount) { revert Unauthorized(msg.sender); } else { balances[msg.sender] -= amount; }
                balances[to] += amount;
                emit Deposit(to, amount);
                return true;
            }

            function kind() public pure override returns (string memory) { return "vault"; }

            function loop(uint n) external onlyOwner returns (uint total) {
                for (uint i = 0; i < n; i++) { if (i == 3) { continue; } total += i; }
                while (total > 100) { total /= 2; }
                do { total++; } while (total < 10);
                unchecked { total = total * 2; }
                (uint a, , uint b) = (1, 2, 3);
                total += a + b;
                try this.kind() returns (string memory k) { history.push(bytes(k).length); } catch Error(string memory reason) { } catch (bytes memory data) { }
                assembly { let x := add(total, 1) total := x }
                return total;
            }
        }
        """;

    @Test
    void testComprehensiveSourceHasNoDiagnostics() throws Exception {
        LoweringResult result = Parser.parse(VAULT);
        assertEquals(List.of(), result.diagnostics());
        assertTrue(Nodes.all(result.sourceUnit(), Unrecognized.class).isEmpty());

        SourceUnit unit = result.sourceUnit();
        assertEquals(13, unit.children().size());
        ContractDefinition vault = (ContractDefinition) unit.children().get(12);
        assertEquals("Vault", vault.name());
        assertEquals(2, vault.baseContracts().size());
        assertEquals("Owned", vault.baseContracts().get(0).baseName().namePath());
        System.out.println("✓ Comprehensive source lowered without diagnostics");
    }

    @Test
    void testPragma() throws Exception {
        SourceUnit unit = Parser.parse("pragma solidity >=0.4.22 <0.9.0;").sourceUnit();
        PragmaDirective pragma = (PragmaDirective) unit.children().get(0);
        assertEquals("solidity", pragma.name());
        assertEquals(">=0.4.22 <0.9.0", pragma.value());

        pragma = (PragmaDirective) Parser.parse("pragma solidity ^0.8.0;").sourceUnit().children().get(0);
        assertEquals("^0.8.0", pragma.value());
    }

    @Test
    void testImports() throws Exception {
        SourceUnit unit = Parser.parse("""
            import "./a.sol";
            import * as M from "./m.sol";
            import {A as B, C} from "./b.sol";
            """).sourceUnit();

        ImportDirective plain = (ImportDirective) unit.children().get(0);
        assertEquals("./a.sol", plain.path());
        assertEquals("./a.sol", plain.pathLiteral().value());
        assertNull(plain.unitAlias());
        assertNull(plain.symbolAliases());

        ImportDirective star = (ImportDirective) unit.children().get(1);
        assertEquals("M", star.unitAlias());
        assertEquals("M", star.unitAliasIdentifier().name());

        ImportDirective symbols = (ImportDirective) unit.children().get(2);
        assertEquals("./b.sol", symbols.path());
        assertEquals(2, symbols.symbolAliases().size());
        assertEquals("A", symbols.symbolAliases().get(0).symbol().name());
        assertEquals("B", symbols.symbolAliases().get(0).alias().name());
        assertEquals("C", symbols.symbolAliases().get(1).symbol().name());
        assertNull(symbols.symbolAliases().get(1).alias());
    }

    @Test
    void testNullSourceIsRejected() {
        assertThrows(InvalidInputException.class, () -> Parser.parse(null));
        assertThrows(InvalidInputException.class, () -> Parser.tokenize(null));
        assertThrows(InvalidInputException.class, () -> Parser.lower(null));
    }

    @Test
    void testStrictParsingThrowsOnSyntaxErrors() {
        ParseException e = assertThrows(ParseException.class,
            () -> Parser.parseStrict("contract A { function f() public { uint x = ; } }"));
        assertFalse(e.getErrors().isEmpty());
        assertTrue(e.getErrors().stream().allMatch(d -> d.kind() == DiagnosticKind.SYNTAX_ERROR));
        assertTrue(e.getMessage().contains("(1:"), e.getMessage());
    }

    @Test
    void testStrictParsingAcceptsValidSource() throws Exception {
        LoweringResult result = Parser.parseStrict("contract A { function f() public {} }");
        FunctionDefinition f = Nodes.first(result.sourceUnit(), FunctionDefinition.class);
        assertEquals("f", f.name());
    }

    @Test
    void testTokenize() throws Exception {
        List<SourceToken> tokens = Parser.tokenize("uint x; // trailing");
        assertEquals(3, tokens.size());
        assertEquals("Uint", tokens.get(0).type());
        assertEquals("uint", tokens.get(0).value());
        assertEquals("Identifier", tokens.get(1).type());
        assertEquals("x", tokens.get(1).value());
        assertEquals("';'", tokens.get(2).type());
        assertEquals(5, tokens.get(1).loc().startColumn());
        assertEquals(6, tokens.get(1).loc().endColumn());
    }

    @Test
    void testTokensOption() throws Exception {
        LoweringResult withTokens = Parser.parse("contract A {}", ParseOptions.defaults().withTokens(true));
        assertEquals(4, withTokens.tokens().size());
        assertTrue(Parser.parse("contract A {}").tokens().isEmpty());
    }
}
