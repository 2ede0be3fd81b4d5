package com.solparser.diagnostics;

public enum Severity {
    ERROR,
    WARNING
}
