package com.example.morphan.dictionary;

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Interned feature strings shared by the lexicon and the unknown-word entries of one dictionary.
 */
public final class FeatureTable {

    private final String[] features;

    private FeatureTable(String[] features) {
        this.features = features;
    }

    public String get(int featureRef) {
        if (featureRef < 0 || featureRef >= features.length) {
            throw new IllegalArgumentException("Unknown feature handle: " + featureRef);
        }
        return features[featureRef];
    }

    public int size() {
        return features.length;
    }

    public static final class Builder {
        private final List<String> values = new ArrayList<>();
        private final Map<String, Integer> index = new HashMap<>();

        public int intern(String feature) {
            Objects.requireNonNull(feature, "feature");
            Integer existing = index.get(feature);
            if (existing != null) {
                return existing;
            }
            int ref = values.size();
            values.add(feature);
            index.put(feature, ref);
            return ref;
        }

        public FeatureTable build() {
            return new FeatureTable(values.toArray(new String[0]));
        }
    }
}
