package com.example.morphan.dictionary;

import com.example.morphan.MorphologyException;
import com.example.morphan.unknown.CategoryUnknownWordFallback;
import com.example.morphan.unknown.CharCategory;
import com.example.morphan.unknown.CharacterDefinition;
import com.example.morphan.unknown.UnknownWordFallback;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Everything an analysis needs from a loaded dictionary: the lexicon, the context transition table,
 * the character categories and the unknown-word templates. Instances are immutable and shared by
 * all analyses without locking.
 */
public final class SystemDictionary implements DictionaryService {

    private final TrieDictionary lexicon;
    private final ConnectionCostMatrix connections;
    private final CharacterDefinition characters;
    private final Map<String, List<UnknownEntry>> unknownEntries;
    private final Map<String, List<DictionaryEntry>> unknownTemplates;
    private final FeatureTable features;
    private final int defaultConnectionCost;

    private SystemDictionary(Builder builder, FeatureTable features) {
        this.features = features;
        this.lexicon = builder.lexicon.build(features);
        this.connections = builder.connections.build();
        this.characters = builder.characters.build();
        this.defaultConnectionCost = builder.defaultConnectionCost;
        Map<String, List<UnknownEntry>> unknown = new LinkedHashMap<>();
        Map<String, List<DictionaryEntry>> templates = new LinkedHashMap<>();
        // Unknown-word templates are numbered after the lexicon rows.
        int morphemeRef = lexicon.size();
        for (UnknownEntry entry : builder.unknown) {
            unknown.computeIfAbsent(entry.category(), key -> new ArrayList<>()).add(entry);
            templates.computeIfAbsent(entry.category(), key -> new ArrayList<>())
                    .add(new DictionaryEntry(0, entry.leftId(), entry.rightId(), entry.cost(),
                            builder.featureRefs.get(entry), morphemeRef++));
        }
        unknown.replaceAll((key, value) -> List.copyOf(value));
        templates.replaceAll((key, value) -> List.copyOf(value));
        this.unknownEntries = Collections.unmodifiableMap(unknown);
        this.unknownTemplates = Collections.unmodifiableMap(templates);
    }

    public static Builder builder(int contextSize, int defaultConnectionCost) {
        return new Builder(contextSize, defaultConnectionCost);
    }

    @Override
    public List<DictionaryEntry> lookup(CharSequence text, int position) {
        return lexicon.lookup(text, position);
    }

    @Override
    public String feature(int featureRef) {
        return features.get(featureRef);
    }

    public TrieDictionary lexicon() {
        return lexicon;
    }

    public ConnectionCostMatrix connections() {
        return connections;
    }

    public CharacterDefinition characters() {
        return characters;
    }

    public int defaultConnectionCost() {
        return defaultConnectionCost;
    }

    /**
     * @return unknown-word rows keyed by category name, in declaration order
     */
    public Map<String, List<UnknownEntry>> unknownEntries() {
        return unknownEntries;
    }

    /**
     * Creates the category based fallback for this dictionary.
     */
    public UnknownWordFallback unknownWordFallback(int maxGroupingSize) {
        return new CategoryUnknownWordFallback(characters, unknownTemplates, maxGroupingSize);
    }

    /**
     * Unknown-word row as declared in the dictionary source.
     */
    public record UnknownEntry(String category, int leftId, int rightId, int cost, String feature) {
        public UnknownEntry {
            Objects.requireNonNull(category, "category");
            Objects.requireNonNull(feature, "feature");
        }
    }

    public static final class Builder {
        private final int contextSize;
        private final int defaultConnectionCost;
        private final FeatureTable.Builder featureTable = new FeatureTable.Builder();
        private final TrieDictionary.Builder lexicon = TrieDictionary.builder(featureTable);
        private final ConnectionCostMatrix.Builder connections;
        private final CharacterDefinition.Builder characters = CharacterDefinition.builder();
        private final List<UnknownEntry> unknown = new ArrayList<>();
        private final Map<UnknownEntry, Integer> featureRefs = new LinkedHashMap<>();

        private Builder(int contextSize, int defaultConnectionCost) {
            this.contextSize = contextSize;
            this.defaultConnectionCost = defaultConnectionCost;
            this.connections = ConnectionCostMatrix.builder(contextSize, defaultConnectionCost);
        }

        public Builder connection(int rightId, int leftId, int cost) {
            connections.set(rightId, leftId, cost);
            return this;
        }

        public Builder entry(String surface, int leftId, int rightId, int cost, String feature) {
            checkContext(leftId, rightId, surface);
            lexicon.add(surface, leftId, rightId, cost, feature);
            return this;
        }

        public Builder category(String name, boolean invoke, boolean group, int length) {
            characters.category(name, invoke, group, length);
            return this;
        }

        public Builder range(char from, char to, String category) {
            characters.range(from, to, category);
            return this;
        }

        public Builder unknown(String category, int leftId, int rightId, int cost, String feature) {
            checkContext(leftId, rightId, category);
            UnknownEntry entry = new UnknownEntry(category, leftId, rightId, cost, feature);
            if (!featureRefs.containsKey(entry)) {
                featureRefs.put(entry, featureTable.intern(feature));
                unknown.add(entry);
            }
            return this;
        }

        public SystemDictionary build() {
            boolean hasDefault = unknown.stream().anyMatch(entry -> CharCategory.DEFAULT.equals(entry.category()));
            if (!hasDefault) {
                throw new MorphologyException("Dictionary declares no unknown-word entry for category "
                        + CharCategory.DEFAULT);
            }
            SystemDictionary dictionary = new SystemDictionary(this, featureTable.build());
            for (String category : dictionary.unknownEntries.keySet()) {
                if (dictionary.characters.category(category) == null) {
                    throw new MorphologyException("Unknown-word entries refer to undefined category " + category);
                }
            }
            return dictionary;
        }

        private void checkContext(int leftId, int rightId, String owner) {
            if (leftId < 0 || leftId >= contextSize || rightId < 0 || rightId >= contextSize) {
                throw new MorphologyException("Context ids of '" + owner + "' outside [0, " + contextSize
                        + "): left=" + leftId + ", right=" + rightId);
            }
        }
    }
}
