package com.example.morphan.dictionary;

/**
 * Candidate record returned by a {@link DictionaryService} lookup or synthesised by the unknown-word
 * fallback.
 *
 * @param length     surface length in UTF-16 code units
 * @param leftId     context id used when something connects to the left of this morpheme
 * @param rightId    context id used when this morpheme connects to something on its right
 * @param cost       emission cost of the morpheme in isolation
 * @param featureRef  handle into the feature table, see {@link DictionaryService#feature(int)}; rows
 *                    with equal feature strings share it
 * @param morphemeRef identity of the lexicon row or unknown-word template the entry comes from,
 *                    unique within one dictionary
 */
public record DictionaryEntry(int length, int leftId, int rightId, int cost, int featureRef, int morphemeRef) {

    public DictionaryEntry {
        if (length < 0) {
            throw new IllegalArgumentException("length must not be negative: " + length);
        }
        if (morphemeRef < 0) {
            throw new IllegalArgumentException("morphemeRef must not be negative: " + morphemeRef);
        }
    }

    /**
     * Returns a copy of this entry covering {@code newLength} code units. Unknown-word templates are
     * stored with length zero and stretched to the span chosen by the fallback.
     */
    public DictionaryEntry withLength(int newLength) {
        if (newLength == length) {
            return this;
        }
        return new DictionaryEntry(newLength, leftId, rightId, cost, featureRef, morphemeRef);
    }
}
