package com.example.morphan.unknown;

import com.example.morphan.dictionary.DictionaryEntry;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.util.List;
import java.util.Map;
import java.util.stream.Collectors;

class CategoryUnknownWordFallbackTest {

    private static final DictionaryEntry DEFAULT_TEMPLATE = new DictionaryEntry(0, 1, 1, 1000, 0, 0);
    private static final DictionaryEntry NUMERIC_TEMPLATE = new DictionaryEntry(0, 2, 2, 200, 1, 1);
    private static final DictionaryEntry ALPHA_TEMPLATE = new DictionaryEntry(0, 3, 3, 300, 2, 2);

    private final CharacterDefinition characters = CharacterDefinition.builder()
            .category("NUMERIC", true, true, 0)
            .category("ALPHA", false, true, 2)
            .category("KANJI", false, false, 2)
            .range('0', '9', "NUMERIC")
            .range('a', 'z', "ALPHA")
            .range('一', '鿿', "KANJI")
            .build();

    private CategoryUnknownWordFallback fallback(int maxGroupingSize) {
        return new CategoryUnknownWordFallback(characters, Map.of(
                CharCategory.DEFAULT, List.of(DEFAULT_TEMPLATE),
                "NUMERIC", List.of(NUMERIC_TEMPLATE),
                "ALPHA", List.of(ALPHA_TEMPLATE)), maxGroupingSize);
    }

    private static List<Integer> lengths(List<DictionaryEntry> entries) {
        return entries.stream().map(DictionaryEntry::length).collect(Collectors.toList());
    }

    @Test
    void groupsTheWholeRun() {
        CategoryUnknownWordFallback fallback = fallback(24);
        String text = "2024年";

        List<DictionaryEntry> entries = fallback.synthesize(text, 0, fallback.categoryAt(text, 0));

        Assertions.assertEquals(List.of(4), lengths(entries));
        Assertions.assertEquals(200, entries.get(0).cost());
    }

    @Test
    void addsFixedLengthsBesidesTheGroup() {
        CategoryUnknownWordFallback fallback = fallback(24);
        String text = "abc1";

        Assertions.assertEquals(List.of(3, 1, 2), lengths(fallback.synthesize(text, 0, fallback.categoryAt(text, 0))));
        Assertions.assertEquals(List.of(2, 1), lengths(fallback.synthesize(text, 1, fallback.categoryAt(text, 1))));
        Assertions.assertEquals(List.of(1), lengths(fallback.synthesize(text, 2, fallback.categoryAt(text, 2))));
    }

    @Test
    void categoriesWithoutTemplatesBorrowDefault() {
        CategoryUnknownWordFallback fallback = fallback(24);
        String text = "東京都";

        List<DictionaryEntry> entries = fallback.synthesize(text, 0, fallback.categoryAt(text, 0));

        Assertions.assertEquals(List.of(1, 2), lengths(entries));
        Assertions.assertEquals(1000, entries.get(0).cost());
    }

    @Test
    void runsLongerThanTheGroupingLimitAreNotGrouped() {
        CategoryUnknownWordFallback fallback = fallback(3);
        String text = "12345";

        List<DictionaryEntry> entries = fallback.synthesize(text, 0, fallback.categoryAt(text, 0));

        Assertions.assertEquals(List.of(1), lengths(entries));
        Assertions.assertEquals(List.of(3), lengths(fallback.synthesize(text, 2, fallback.categoryAt(text, 2))));
    }

    @Test
    void neverReturnsAnEmptyList() {
        CharacterDefinition quiet = CharacterDefinition.builder()
                .category(CharCategory.DEFAULT, false, false, 0)
                .build();
        CategoryUnknownWordFallback fallback = new CategoryUnknownWordFallback(quiet,
                Map.of(CharCategory.DEFAULT, List.of(DEFAULT_TEMPLATE)), 24);

        List<DictionaryEntry> entries = fallback.synthesize("??", 0, quiet.defaultCategory());

        Assertions.assertEquals(List.of(1), lengths(entries));
    }

    @Test
    void requiresDefaultTemplates() {
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new CategoryUnknownWordFallback(characters, Map.of("ALPHA", List.of(ALPHA_TEMPLATE)), 24));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new CategoryUnknownWordFallback(characters, Map.of(
                        CharCategory.DEFAULT, List.of(DEFAULT_TEMPLATE),
                        "HIRAGANA", List.of(ALPHA_TEMPLATE)), 24));
        Assertions.assertThrows(IllegalArgumentException.class,
                () -> new CategoryUnknownWordFallback(characters, Map.of(
                        CharCategory.DEFAULT, List.of(DEFAULT_TEMPLATE)), 0));
    }
}
