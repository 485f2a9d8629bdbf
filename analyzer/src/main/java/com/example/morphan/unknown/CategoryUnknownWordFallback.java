package com.example.morphan.unknown;

import com.example.morphan.dictionary.DictionaryEntry;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Unknown-word fallback driven by character categories. For a category with {@code group} set the
 * maximal run of same-category characters becomes one candidate (unless it is longer than the
 * grouping limit); then candidates of {@code 1..length} characters inside the run are added. If
 * neither rule produced anything a single-character candidate is emitted, so the result is never
 * empty.
 *
 * <p>Every category contributes one candidate per unknown-word template registered for it.
 * Categories without templates borrow those of {@link CharCategory#DEFAULT}.</p>
 */
public final class CategoryUnknownWordFallback implements UnknownWordFallback {

    public static final int DEFAULT_MAX_GROUPING_SIZE = 24;

    private final CharacterDefinition characters;
    private final List<List<DictionaryEntry>> templates;
    private final int maxGroupingSize;

    public CategoryUnknownWordFallback(CharacterDefinition characters,
                                       Map<String, List<DictionaryEntry>> templatesByCategory,
                                       int maxGroupingSize) {
        this.characters = Objects.requireNonNull(characters, "characters");
        Objects.requireNonNull(templatesByCategory, "templatesByCategory");
        if (maxGroupingSize <= 0) {
            throw new IllegalArgumentException("maxGroupingSize must be positive: " + maxGroupingSize);
        }
        List<DictionaryEntry> defaults = templatesByCategory.getOrDefault(CharCategory.DEFAULT, List.of());
        if (defaults.isEmpty()) {
            throw new IllegalArgumentException("The " + CharCategory.DEFAULT + " category needs at least one unknown-word entry");
        }
        List<List<DictionaryEntry>> byId = new ArrayList<>(characters.categories().size());
        for (CharCategory category : characters.categories()) {
            List<DictionaryEntry> own = templatesByCategory.getOrDefault(category.name(), List.of());
            byId.add(own.isEmpty() ? List.copyOf(defaults) : List.copyOf(own));
        }
        for (String name : templatesByCategory.keySet()) {
            if (characters.category(name) == null) {
                throw new IllegalArgumentException("Unknown-word entries refer to undefined category " + name);
            }
        }
        this.templates = Collections.unmodifiableList(byId);
        this.maxGroupingSize = maxGroupingSize;
    }

    @Override
    public CharCategory categoryAt(CharSequence text, int position) {
        return characters.categoryOf(text.charAt(position));
    }

    @Override
    public List<DictionaryEntry> synthesize(CharSequence text, int position, CharCategory category) {
        Objects.requireNonNull(text, "text");
        Objects.requireNonNull(category, "category");
        List<DictionaryEntry> entries = templates.get(category.id());
        int run = sameCategoryRun(text, position, category);
        List<DictionaryEntry> result = new ArrayList<>(entries.size() * (category.length() + 1));

        int grouped = 0;
        if (category.group() && run <= maxGroupingSize) {
            addAll(result, entries, run);
            grouped = run;
        }
        int limit = Math.min(category.length(), run);
        for (int length = 1; length <= limit; length++) {
            if (length != grouped) {
                addAll(result, entries, length);
            }
        }
        if (result.isEmpty()) {
            addAll(result, entries, 1);
        }
        return result;
    }

    /**
     * Length of the run of {@code category} characters starting at {@code position}, counted up to
     * one past the grouping limit.
     */
    private int sameCategoryRun(CharSequence text, int position, CharCategory category) {
        int run = 1;
        int end = text.length();
        while (position + run < end && run <= maxGroupingSize
                && characters.categoryOf(text.charAt(position + run)).id() == category.id()) {
            run++;
        }
        return run;
    }

    private static void addAll(List<DictionaryEntry> result, List<DictionaryEntry> entries, int length) {
        for (DictionaryEntry entry : entries) {
            result.add(entry.withLength(length));
        }
    }
}
