package com.example.morphan.dictionary;

import java.util.List;

/**
 * Read-only lexicon lookup. Implementations are immutable once built and may be shared by any
 * number of concurrent analyses without locking.
 */
public interface DictionaryService {

    /**
     * Returns every entry whose surface is a prefix of {@code text} starting at {@code position},
     * shortest surfaces first and, for equal surfaces, in dictionary insertion order. An empty list
     * means no entry matches.
     */
    List<DictionaryEntry> lookup(CharSequence text, int position);

    /**
     * Resolves the feature string of an entry.
     *
     * @throws IllegalArgumentException when the handle is not known to this dictionary
     */
    String feature(int featureRef);
}
