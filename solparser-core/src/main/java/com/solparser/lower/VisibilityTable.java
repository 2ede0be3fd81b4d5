package com.solparser.lower;

import com.solparser.ast.Visibility;

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;

import static com.solparser.ast.Visibility.EXTERNAL;
import static com.solparser.ast.Visibility.INTERNAL;
import static com.solparser.ast.Visibility.PUBLIC;

/**
 * Default visibility of a declaration written without a visibility keyword, keyed by what is
 * declared and where.
 */
public final class VisibilityTable {

    private static final Map<DeclarationKind, Map<EnclosingKind, Visibility>> DEFAULTS = build();

    private VisibilityTable() {
    }

    public static Visibility defaultFor(DeclarationKind declaration, EnclosingKind enclosing) {
        return DEFAULTS.get(declaration).get(enclosing);
    }

    private static Map<DeclarationKind, Map<EnclosingKind, Visibility>> build() {
        Map<DeclarationKind, Map<EnclosingKind, Visibility>> table = new EnumMap<>(DeclarationKind.class);
        //                                 FILE     CONTRACT  ABSTRACT  INTERFACE  LIBRARY
        row(table, DeclarationKind.FUNCTION, PUBLIC, PUBLIC, PUBLIC, EXTERNAL, INTERNAL);
        row(table, DeclarationKind.CONSTRUCTOR, PUBLIC, PUBLIC, PUBLIC, PUBLIC, PUBLIC);
        row(table, DeclarationKind.FALLBACK, EXTERNAL, EXTERNAL, EXTERNAL, EXTERNAL, EXTERNAL);
        row(table, DeclarationKind.RECEIVE, EXTERNAL, EXTERNAL, EXTERNAL, EXTERNAL, EXTERNAL);
        row(table, DeclarationKind.STATE_VARIABLE, INTERNAL, INTERNAL, INTERNAL, INTERNAL, INTERNAL);
        row(table, DeclarationKind.FILE_CONSTANT, INTERNAL, INTERNAL, INTERNAL, INTERNAL, INTERNAL);
        row(table, DeclarationKind.FUNCTION_TYPE, INTERNAL, INTERNAL, INTERNAL, INTERNAL, INTERNAL);

        for (DeclarationKind kind : DeclarationKind.values()) {
            if (!table.containsKey(kind)) {
                throw new IllegalStateException("No default visibility for " + kind);
            }
        }
        return Collections.unmodifiableMap(table);
    }

    private static void row(Map<DeclarationKind, Map<EnclosingKind, Visibility>> table, DeclarationKind kind,
                            Visibility file, Visibility contract, Visibility abstractContract,
                            Visibility iface, Visibility library) {
        Map<EnclosingKind, Visibility> row = new EnumMap<>(EnclosingKind.class);
        row.put(EnclosingKind.FILE, file);
        row.put(EnclosingKind.CONTRACT, contract);
        row.put(EnclosingKind.ABSTRACT, abstractContract);
        row.put(EnclosingKind.INTERFACE, iface);
        row.put(EnclosingKind.LIBRARY, library);
        table.put(kind, Collections.unmodifiableMap(row));
    }
}
