package com.example.morphan.dictionary;

import java.util.ArrayList;
import java.util.Collections;
import java.util.HashSet;
import java.util.List;
import java.util.Objects;
import java.util.Set;

/**
 * In-memory lexicon answering common-prefix queries through a {@link PrefixTrie}.
 */
public final class TrieDictionary implements DictionaryService {

    private final PrefixTrie trie;
    private final String[] surfaces;
    private final DictionaryEntry[] entries;
    private final FeatureTable features;

    private TrieDictionary(PrefixTrie trie, String[] surfaces, DictionaryEntry[] entries, FeatureTable features) {
        this.trie = trie;
        this.surfaces = surfaces;
        this.entries = entries;
        this.features = features;
    }

    public static Builder builder(FeatureTable.Builder features) {
        return new Builder(features);
    }

    @Override
    public List<DictionaryEntry> lookup(CharSequence text, int position) {
        Objects.requireNonNull(text, "text");
        if (position < 0 || position >= text.length()) {
            return Collections.emptyList();
        }
        List<DictionaryEntry> result = new ArrayList<>(4);
        trie.commonPrefixSearch(text, position, (length, value) -> result.add(entries[value]));
        return result;
    }

    @Override
    public String feature(int featureRef) {
        return features.get(featureRef);
    }

    /**
     * @return number of distinct entries in the lexicon
     */
    public int size() {
        return entries.length;
    }

    public String surface(int index) {
        return surfaces[index];
    }

    public DictionaryEntry entry(int index) {
        return entries[index];
    }

    public static final class Builder {
        private final FeatureTable.Builder features;
        private final List<String> surfaces = new ArrayList<>();
        private final List<DictionaryEntry> entries = new ArrayList<>();
        private final Set<Row> seen = new HashSet<>();

        private Builder(FeatureTable.Builder features) {
            this.features = Objects.requireNonNull(features, "features");
        }

        /**
         * Adds a lexicon row. Rows identical to one already added are ignored; every other row gets
         * its own morpheme handle, homographs included.
         */
        public Builder add(String surface, int leftId, int rightId, int cost, String feature) {
            Objects.requireNonNull(surface, "surface");
            if (surface.isEmpty()) {
                throw new IllegalArgumentException("Dictionary surface must not be empty");
            }
            int featureRef = features.intern(feature);
            if (!seen.add(new Row(surface, leftId, rightId, cost, featureRef))) {
                return this;
            }
            surfaces.add(surface);
            entries.add(new DictionaryEntry(surface.length(), leftId, rightId, cost, featureRef, entries.size()));
            return this;
        }

        public int size() {
            return entries.size();
        }

        /**
         * Freezes the lexicon. The feature table is shared with the unknown-word entries, so it is
         * passed in already built.
         */
        public TrieDictionary build(FeatureTable featureTable) {
            PrefixTrie.Builder trie = new PrefixTrie.Builder();
            for (int i = 0; i < surfaces.size(); i++) {
                trie.put(surfaces.get(i), i);
            }
            return new TrieDictionary(trie.build(),
                    surfaces.toArray(new String[0]),
                    entries.toArray(new DictionaryEntry[0]),
                    featureTable);
        }
    }

    private record Row(String surface, int leftId, int rightId, int cost, int featureRef) {}
}
