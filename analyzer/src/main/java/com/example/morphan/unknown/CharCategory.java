package com.example.morphan.unknown;

/**
 * Character class used by the unknown-word fallback.
 *
 * @param id     dense index of the category inside its {@link CharacterDefinition}
 * @param name   category name, e.g. {@code KATAKANA}
 * @param invoke whether unknown-word processing runs even when the lexicon matched
 * @param group  whether a maximal run of same-category characters becomes one candidate
 * @param length number of fixed-length candidates ({@code 1..length} characters) to add
 */
public record CharCategory(int id, String name, boolean invoke, boolean group, int length) {

    public static final String DEFAULT = "DEFAULT";

    public CharCategory {
        if (length < 0) {
            throw new IllegalArgumentException("Category length must not be negative: " + length);
        }
    }
}
