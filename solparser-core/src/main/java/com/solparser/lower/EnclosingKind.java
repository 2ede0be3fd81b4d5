package com.solparser.lower;

import com.solparser.ast.ContractKind;

/**
 * The declaration a construct is nested in, used to pick default visibilities.
 */
public enum EnclosingKind {
    FILE,
    CONTRACT,
    ABSTRACT,
    INTERFACE,
    LIBRARY;

    public static EnclosingKind of(ContractKind kind) {
        return switch (kind) {
            case CONTRACT -> CONTRACT;
            case ABSTRACT -> ABSTRACT;
            case INTERFACE -> INTERFACE;
            case LIBRARY -> LIBRARY;
        };
    }
}
