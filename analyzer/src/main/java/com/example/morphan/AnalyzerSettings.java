package com.example.morphan;

import com.example.morphan.unknown.CategoryUnknownWordFallback;

import java.io.File;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Analyser configuration. Every value is resolved from a system property first, then from an
 * environment variable, then from its default.
 */
public final class AnalyzerSettings {

    private static final Logger log = Logger.getLogger(AnalyzerSettings.class.getName());

    public static final String DICTIONARY_PROPERTY = "morphan.dictionary.path";
    public static final String DICTIONARY_ENV = "MORPHAN_DICTIONARY";
    public static final String USER_DICTIONARIES_PROPERTY = "morphan.user.dictionaries";
    public static final String USER_DICTIONARIES_ENV = "MORPHAN_USER_DICTIONARIES";
    public static final String MAX_GROUPING_PROPERTY = "morphan.unknown.max-grouping";
    public static final String MAX_GROUPING_ENV = "MORPHAN_UNKNOWN_MAX_GROUPING";
    public static final String GREEDY_THRESHOLD_PROPERTY = "morphan.unknown.greedy-threshold";
    public static final String GREEDY_THRESHOLD_ENV = "MORPHAN_UNKNOWN_GREEDY_THRESHOLD";
    public static final String NBEST_LIMIT_PROPERTY = "morphan.nbest.limit";
    public static final String NBEST_LIMIT_ENV = "MORPHAN_NBEST_LIMIT";

    public static final int DEFAULT_NBEST_LIMIT = 32;

    private final Path dictionaryPath;
    private final List<Path> userDictionaries;
    private final int maxGroupingSize;
    private final int greedyThreshold;
    private final int nBestLimit;

    private AnalyzerSettings(Builder builder) {
        this.dictionaryPath = builder.dictionaryPath;
        this.userDictionaries = Collections.unmodifiableList(new ArrayList<>(builder.userDictionaries));
        this.maxGroupingSize = builder.maxGroupingSize;
        this.greedyThreshold = builder.greedyThreshold;
        this.nBestLimit = builder.nBestLimit;
    }

    public static AnalyzerSettings defaults() {
        return builder().build();
    }

    public static AnalyzerSettings fromEnvironment() {
        return fromEnvironment(System::getProperty, System::getenv);
    }

    static AnalyzerSettings fromEnvironment(Function<String, String> properties, Function<String, String> environment) {
        Builder builder = builder();
        lookup(properties, environment, DICTIONARY_PROPERTY, DICTIONARY_ENV)
                .ifPresent(value -> builder.dictionaryPath(Path.of(value)));
        lookup(properties, environment, USER_DICTIONARIES_PROPERTY, USER_DICTIONARIES_ENV)
                .ifPresent(value -> {
                    for (String part : value.split(File.pathSeparator)) {
                        if (!part.isBlank()) {
                            builder.addUserDictionary(Path.of(part.trim()));
                        }
                    }
                });
        lookup(properties, environment, MAX_GROUPING_PROPERTY, MAX_GROUPING_ENV)
                .ifPresent(value -> builder.maxGroupingSize(parseInt(MAX_GROUPING_PROPERTY, value)));
        lookup(properties, environment, GREEDY_THRESHOLD_PROPERTY, GREEDY_THRESHOLD_ENV)
                .ifPresent(value -> builder.greedyThreshold(parseInt(GREEDY_THRESHOLD_PROPERTY, value)));
        lookup(properties, environment, NBEST_LIMIT_PROPERTY, NBEST_LIMIT_ENV)
                .ifPresent(value -> builder.nBestLimit(parseInt(NBEST_LIMIT_PROPERTY, value)));
        AnalyzerSettings settings = builder.build();
        log.log(Level.FINE, () -> "Resolved analyser settings " + settings);
        return settings;
    }

    public static Builder builder() {
        return new Builder();
    }

    /**
     * @return configured dictionary, empty when the bundled default should be used
     */
    public Optional<Path> dictionaryPath() {
        return Optional.ofNullable(dictionaryPath);
    }

    public List<Path> userDictionaries() {
        return userDictionaries;
    }

    public int maxGroupingSize() {
        return maxGroupingSize;
    }

    public int greedyThreshold() {
        return greedyThreshold;
    }

    public int nBestLimit() {
        return nBestLimit;
    }

    @Override
    public String toString() {
        return "AnalyzerSettings{dictionary=" + (dictionaryPath == null ? "<bundled>" : dictionaryPath)
                + ", userDictionaries=" + userDictionaries
                + ", maxGroupingSize=" + maxGroupingSize
                + ", greedyThreshold=" + greedyThreshold
                + ", nBestLimit=" + nBestLimit + '}';
    }

    private static Optional<String> lookup(Function<String, String> properties,
                                           Function<String, String> environment,
                                           String property,
                                           String variable) {
        String value = properties.apply(property);
        if (value == null || value.isBlank()) {
            value = environment.apply(variable);
        }
        if (value == null || value.isBlank()) {
            return Optional.empty();
        }
        return Optional.of(value.trim());
    }

    private static int parseInt(String name, String value) {
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new MorphologyException("Setting '" + name + "' is not an integer: " + value, ex);
        }
    }

    public static final class Builder {
        private Path dictionaryPath;
        private final List<Path> userDictionaries = new ArrayList<>();
        private int maxGroupingSize = CategoryUnknownWordFallback.DEFAULT_MAX_GROUPING_SIZE;
        private int greedyThreshold;
        private int nBestLimit = DEFAULT_NBEST_LIMIT;

        private Builder() {
        }

        public Builder dictionaryPath(Path path) {
            this.dictionaryPath = path;
            return this;
        }

        public Builder addUserDictionary(Path path) {
            userDictionaries.add(Objects.requireNonNull(path, "path"));
            return this;
        }

        public Builder maxGroupingSize(int value) {
            this.maxGroupingSize = value;
            return this;
        }

        public Builder greedyThreshold(int value) {
            this.greedyThreshold = value;
            return this;
        }

        public Builder nBestLimit(int value) {
            this.nBestLimit = value;
            return this;
        }

        public AnalyzerSettings build() {
            if (maxGroupingSize <= 0) {
                throw new MorphologyException("Maximum grouping size must be positive: " + maxGroupingSize);
            }
            if (greedyThreshold < 0) {
                throw new MorphologyException("Greedy threshold must not be negative: " + greedyThreshold);
            }
            if (nBestLimit <= 0) {
                throw new MorphologyException("N-best limit must be positive: " + nBestLimit);
            }
            return new AnalyzerSettings(this);
        }
    }
}
