package com.example.morphan.lattice;

/**
 * Copy of a lattice node, independent of the lattice it was read from.
 *
 * @param surface     text covered by the morpheme
 * @param feature     feature string from the dictionary
 * @param begin       start offset in the input
 * @param length      length in UTF-16 code units
 * @param kind        lexicon or unknown-word node
 * @param morphemeRef lexicon row or unknown-word template the node was made from
 * @param leftId      left context id
 * @param rightId     right context id
 * @param cost        emission cost
 * @param forwardCost minimum cost from BOS to this morpheme inclusive
 */
public record Morpheme(String surface,
                       String feature,
                       int begin,
                       int length,
                       NodeKind kind,
                       int morphemeRef,
                       int leftId,
                       int rightId,
                       int cost,
                       long forwardCost) {

    public int end() {
        return begin + length;
    }
}
