package com.solparser.lower;

import com.solparser.InvalidInputException;
import com.solparser.grammar.SolidityLexer;
import com.solparser.grammar.SolidityParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.*;

public class DispatchTableTest {

    @Test
    void testStandardTableCoversEveryRule() throws Exception {
        DispatchTable table = DispatchTable.standard();
        assertEquals(SolidityParser.ruleNames.length, table.size());
        for (int i = 0; i < SolidityParser.ruleNames.length; i++) {
            DispatchTable.Entry entry = table.entry(i);
            assertNotNull(entry, SolidityParser.ruleNames[i]);
            assertEquals(SolidityParser.ruleNames[i], entry.ruleName());
            assertEquals(entry.kind() == DispatchTable.EntryKind.LOWERED, entry.handler() != null, entry.ruleName());
        }
        System.out.println("✓ Dispatch table covers all " + table.size() + " rules");
    }

    @Test
    void testBuildRejectsMissingRules() {
        DispatchTable.Builder builder = DispatchTable.builder(SolidityParser.ruleNames)
            .passThrough(SolidityParser.RULE_statement);
        IllegalStateException e = assertThrows(IllegalStateException.class, builder::build);
        assertTrue(e.getMessage().contains("sourceUnit"), e.getMessage());
    }

    @Test
    void testBuildRejectsDuplicates() {
        DispatchTable.Builder builder = DispatchTable.builder(SolidityParser.ruleNames)
            .passThrough(SolidityParser.RULE_statement);
        assertThrows(IllegalStateException.class, () -> builder.fragment(SolidityParser.RULE_statement));
    }

    @Test
    void testLookupOfFragmentRuleFails() {
        DispatchTable table = DispatchTable.standard();
        SolidityParser.PragmaNameContext ctx = new SolidityParser.PragmaNameContext(null, 0);
        assertThrows(InvalidInputException.class, () -> table.lookup(ctx));
    }

    @Test
    void testMissingEntryIsFatalDuringLowering() {
        DispatchTable partial = DispatchTable.builder(SolidityParser.ruleNames)
            .lower(SolidityParser.RULE_sourceUnit, SolidityParser.SourceUnitContext.class, DeclarationLowering::sourceUnit)
            .buildPartial();
        SolidityParser parser = new SolidityParser(new CommonTokenStream(
            new SolidityLexer(CharStreams.fromString("pragma solidity ^0.8.0;"))));
        SolidityParser.SourceUnitContext tree = parser.sourceUnit();

        InvalidInputException e = assertThrows(InvalidInputException.class,
            () -> new LoweringVisitor(partial).lower(tree));
        assertTrue(e.getMessage().contains("pragmaDirective"), e.getMessage());
    }

    @Test
    void testVisitorRequiresTable() {
        assertThrows(InvalidInputException.class, () -> new LoweringVisitor(null));
    }
}
