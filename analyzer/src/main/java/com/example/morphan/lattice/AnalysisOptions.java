package com.example.morphan.lattice;

/**
 * Switches for one analysis.
 *
 * @param nBest     run the backward pass so the lattice can feed an {@link NBestEnumerator}
 * @param allMorphs keep every candidate available for inspection, annotated with the cost of the
 *                  best path through it; also runs the backward pass
 */
public record AnalysisOptions(boolean nBest, boolean allMorphs) {

    public static final AnalysisOptions BEST = new AnalysisOptions(false, false);
    public static final AnalysisOptions N_BEST = new AnalysisOptions(true, false);
    public static final AnalysisOptions ALL_MORPHS = new AnalysisOptions(false, true);

    public boolean needsBackwardPass() {
        return nBest || allMorphs;
    }
}
