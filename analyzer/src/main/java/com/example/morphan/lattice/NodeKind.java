package com.example.morphan.lattice;

/**
 * Role of a lattice node.
 */
public enum NodeKind {
    /** Zero-length sentence start at position 0. */
    BOS,
    /** Zero-length sentence end at the input length. */
    EOS,
    /** Morpheme found in the lexicon. */
    NORMAL,
    /** Morpheme synthesised by the unknown-word fallback. */
    UNKNOWN
}
