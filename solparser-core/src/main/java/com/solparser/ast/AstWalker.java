package com.solparser.ast;

import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.ArrayList;
import java.util.List;

/**
 * Depth-first walk over an AST. Children are the {@link Node} values found in a node's record
 * components, in declaration order, including nodes held in lists and in helper records such as
 * {@link ImportDirective.SymbolAlias}. Null components and null list entries are skipped.
 */
public final class AstWalker {

    private AstWalker() {
    }

    public static void walk(Node root, AstVisitor visitor) {
        visit(root, null, visitor);
    }

    private static void visit(Node node, Node parent, AstVisitor visitor) {
        if (visitor.enter(node, parent)) {
            for (Node child : children(node)) {
                visit(child, node, visitor);
            }
        }
        visitor.exit(node, parent);
    }

    public static List<Node> children(Node node) {
        List<Node> children = new ArrayList<>();
        collect((Record) node, children);
        return children;
    }

    private static void collect(Record record, List<Node> children) {
        for (RecordComponent component : record.getClass().getRecordComponents()) {
            Object value;
            try {
                value = component.getAccessor().invoke(record);
            } catch (IllegalAccessException | InvocationTargetException e) {
                throw new IllegalStateException("Cannot read " + record.getClass().getSimpleName()
                    + "." + component.getName(), e);
            }
            add(value, children);
        }
    }

    private static void add(Object value, List<Node> children) {
        if (value instanceof Node node) {
            children.add(node);
        } else if (value instanceof List<?> list) {
            for (Object element : list) {
                add(element, children);
            }
        } else if (value instanceof Record record && !(value instanceof SourceRange)
            && record.getClass().getPackage() == Node.class.getPackage()) {
            collect(record, children);
        }
    }
}
