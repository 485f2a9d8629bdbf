package com.example.morphan.lattice;

/**
 * A candidate of an all-morphs analysis.
 *
 * @param morpheme        the candidate
 * @param bestCostThrough cost of the cheapest complete path using this candidate
 * @param onBestPath      whether the candidate belongs to the reported best path
 */
public record LatticeMorpheme(Morpheme morpheme, long bestCostThrough, boolean onBestPath) {
}
