package com.solparser;

import com.solparser.grammar.SolidityLexer;
import com.solparser.grammar.SolidityParser;
import org.antlr.v4.runtime.CharStreams;
import org.antlr.v4.runtime.CommonTokenStream;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import static org.junit.jupiter.api.Assertions.*;

public class DeterminismTest {

    private static final List<String> SOURCES = List.of(
        ParserTest.VAULT,
        "contract A { function f() public { uint x = ; } function g() public {} }",
        "contract A { function f() view constant public external {} }",
        "function f() { assembly { let x := add(1, 2) if x { leave } } }");

    @Test
    void testRepeatedParsesAreEqual() throws Exception {
        for (String source : SOURCES) {
            LoweringResult first = Parser.parse(source);
            LoweringResult second = Parser.parse(source);
            assertEquals(first, second);
            assertNotSame(first.sourceUnit(), second.sourceUnit());
        }
    }

    @Test
    void testSameTreeLowersToEqualResults() throws Exception {
        SolidityParser parser = new SolidityParser(new CommonTokenStream(
            new SolidityLexer(CharStreams.fromString(ParserTest.VAULT))));
        SolidityParser.SourceUnitContext tree = parser.sourceUnit();

        LoweringResult first = Parser.lower(tree);
        LoweringResult second = Parser.lower(tree);
        assertEquals(first, second);
        assertEquals(Parser.parse(ParserTest.VAULT).sourceUnit(), first.sourceUnit());
    }

    @Test
    void testParallelParsesMatchSequential() throws Exception {
        List<LoweringResult> expected = new ArrayList<>();
        for (String source : SOURCES) {
            expected.add(Parser.parse(source));
        }

        ExecutorService executor = Executors.newFixedThreadPool(4);
        try {
            List<Future<LoweringResult>> futures = new ArrayList<>();
            for (int round = 0; round < 8; round++) {
                for (String source : SOURCES) {
                    futures.add(executor.submit(() -> Parser.parse(source)));
                }
            }
            for (int i = 0; i < futures.size(); i++) {
                assertEquals(expected.get(i % SOURCES.size()), futures.get(i).get());
            }
        } finally {
            executor.shutdownNow();
        }
        System.out.println("✓ Parallel parses match sequential results");
    }
}
