package com.example.morphan.lattice;

/**
 * Reusable per-caller buffers for analysis: one {@link Lattice} with its node arena and adjacency
 * lists. Passing the same context to consecutive analyses amortises allocation; each analysis resets
 * it, which invalidates everything read from the previous one.
 *
 * <p>A context belongs to a single in-flight analysis. Concurrent analyses need one context each.</p>
 */
public final class AnalysisContext {

    private final Lattice lattice = new Lattice();
    private long analyses;

    public Lattice lattice() {
        return lattice;
    }

    /**
     * @return number of analyses run with this context
     */
    public long analyses() {
        return analyses;
    }

    Lattice begin() {
        analyses++;
        return lattice;
    }
}
