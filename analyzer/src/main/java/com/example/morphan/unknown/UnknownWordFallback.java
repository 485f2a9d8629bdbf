package com.example.morphan.unknown;

import com.example.morphan.dictionary.DictionaryEntry;

import java.util.List;

/**
 * Supplies synthetic candidates for positions the lexicon cannot cover on its own.
 */
public interface UnknownWordFallback {

    /**
     * Returns candidates starting at {@code position}. The list is never empty: the lattice relies
     * on it to stay connected.
     */
    List<DictionaryEntry> synthesize(CharSequence text, int position, CharCategory category);

    /**
     * @return category of the character at {@code position}
     */
    CharCategory categoryAt(CharSequence text, int position);
}
