package com.solparser;

import com.solparser.ast.AstVisitor;
import com.solparser.ast.AstWalker;
import com.solparser.ast.ContractDefinition;
import com.solparser.ast.Identifier;
import com.solparser.ast.Node;
import com.solparser.ast.SourceRange;
import com.solparser.ast.StateVariableDeclaration;
import org.junit.jupiter.api.Test;

import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

public class RangeTest {

    @Test
    void testParentsEncloseChildren() throws Exception {
        Node root = Parser.parse(ParserTest.VAULT).sourceUnit();
        List<String> violations = new ArrayList<>();
        int[] visited = {0};
        AstWalker.walk(root, new AstVisitor() {
            @Override
            public boolean enter(Node node, Node parent) {
                visited[0]++;
                SourceRange loc = node.loc();
                if (loc == null) {
                    violations.add(node.type() + " has no range");
                } else if (loc.startOffset() > loc.endOffset()) {
                    violations.add(node.type() + " ends before it starts at " + loc);
                } else if (parent != null && !parent.loc().encloses(loc)) {
                    violations.add(parent.type() + " " + parent.loc() + " does not enclose " + node.type() + " " + loc);
                }
                return true;
            }
        });
        assertEquals(List.of(), violations);
        assertTrue(visited[0] > 100, "visited " + visited[0]);
        System.out.println("✓ Checked ranges of " + visited[0] + " nodes");
    }

    @Test
    void testRangeConventions() throws Exception {
        String source = "contract A {\n    uint public total;\n}";
        Node root = Parser.parse(source).sourceUnit();

        ContractDefinition contract = Nodes.first(root, ContractDefinition.class);
        assertEquals(new SourceRange(1, 0, 3, 1, 0, source.length()), contract.loc());

        StateVariableDeclaration total = Nodes.first(root, StateVariableDeclaration.class);
        assertEquals(2, total.loc().startLine());
        assertEquals(4, total.loc().startColumn());
        assertEquals(22, total.loc().endColumn());
        assertEquals("uint public total;", source.substring(total.loc().startOffset(), total.loc().endOffset()));

        Identifier name = total.variables().get(0).identifier();
        assertEquals("total", source.substring(name.loc().startOffset(), name.loc().endOffset()));
    }

    @Test
    void testUnion() throws Exception {
        String source = "contract A {\n    uint a;\n    uint b;\n}";
        Node root = Parser.parse(source).sourceUnit();
        List<StateVariableDeclaration> variables = Nodes.all(root, StateVariableDeclaration.class);
        SourceRange a = variables.get(0).loc();
        SourceRange b = variables.get(1).loc();

        SourceRange both = a.union(b);
        assertEquals(new SourceRange(2, 4, 3, 11, a.startOffset(), b.endOffset()), both);
        assertEquals(both, b.union(a));
        assertEquals("uint a;\n    uint b;", source.substring(both.startOffset(), both.endOffset()));
        assertTrue(both.encloses(a));
        assertTrue(both.encloses(b));
        assertFalse(a.encloses(both));

        SourceRange contract = Nodes.first(root, ContractDefinition.class).loc();
        assertEquals(contract, contract.union(a));
    }
}
