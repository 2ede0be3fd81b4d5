package com.solparser.diagnostics;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Ordered, append-only collection of diagnostics for one lowering run.
 */
public final class Diagnostics {

    private static final Logger LOG = LoggerFactory.getLogger(Diagnostics.class);

    private final List<Diagnostic> entries = new ArrayList<>();

    public Diagnostic add(Diagnostic diagnostic) {
        if (LOG.isDebugEnabled()) {
            LOG.debug("{}", diagnostic.format());
        }
        entries.add(diagnostic);
        return diagnostic;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Returns an unmodifiable copy of the diagnostics recorded so far.
     */
    public List<Diagnostic> snapshot() {
        return Collections.unmodifiableList(new ArrayList<>(entries));
    }
}
