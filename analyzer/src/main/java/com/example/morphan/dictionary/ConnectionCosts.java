package com.example.morphan.dictionary;

/**
 * Context transition table. The cost of placing a morpheme with left context {@code leftId}
 * directly after a morpheme with right context {@code rightId}.
 */
public interface ConnectionCosts {

    /** Context id of the sentence boundaries (BOS and EOS). */
    int BOUNDARY_CONTEXT_ID = 0;

    int cost(int rightId, int leftId);

    /**
     * @return number of context ids; valid ids are {@code 0 .. size() - 1}
     */
    int size();
}
