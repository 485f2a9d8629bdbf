package com.example.morphan.unknown;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * Maps every UTF-16 code unit to a {@link CharCategory}. Characters not covered by any range belong
 * to {@link CharCategory#DEFAULT}, which is always present. When ranges overlap the one declared
 * last wins.
 */
public final class CharacterDefinition {

    private static final int TABLE_SIZE = Character.MAX_VALUE + 1;

    private final List<CharCategory> categories;
    private final List<Range> ranges;
    private final short[] table;

    private CharacterDefinition(List<CharCategory> categories, List<Range> ranges, short[] table) {
        this.categories = categories;
        this.ranges = ranges;
        this.table = table;
    }

    public static Builder builder() {
        return new Builder();
    }

    public CharCategory categoryOf(char c) {
        return categories.get(table[c]);
    }

    public CharCategory category(String name) {
        for (CharCategory category : categories) {
            if (category.name().equals(name)) {
                return category;
            }
        }
        return null;
    }

    public CharCategory defaultCategory() {
        return category(CharCategory.DEFAULT);
    }

    public List<CharCategory> categories() {
        return categories;
    }

    public List<Range> ranges() {
        return ranges;
    }

    /**
     * Inclusive code unit range assigned to a category.
     */
    public record Range(char from, char to, String category) {
        public Range {
            Objects.requireNonNull(category, "category");
            if (from > to) {
                throw new IllegalArgumentException(String.format("Invalid range 0x%04X..0x%04X", (int) from, (int) to));
            }
        }
    }

    public static final class Builder {
        private final Map<String, CharCategory> categories = new LinkedHashMap<>();
        private final List<Range> ranges = new ArrayList<>();

        private Builder() {
        }

        public Builder category(String name, boolean invoke, boolean group, int length) {
            Objects.requireNonNull(name, "name");
            CharCategory existing = categories.get(name);
            int id = existing != null ? existing.id() : categories.size();
            categories.put(name, new CharCategory(id, name, invoke, group, length));
            return this;
        }

        public Builder range(char from, char to, String category) {
            ranges.add(new Range(from, to, category));
            return this;
        }

        public CharacterDefinition build() {
            if (!categories.containsKey(CharCategory.DEFAULT)) {
                category(CharCategory.DEFAULT, false, true, 0);
            }
            if (categories.size() > Short.MAX_VALUE) {
                throw new IllegalStateException("Too many character categories: " + categories.size());
            }
            List<CharCategory> ordered = new ArrayList<>(categories.values());
            short defaultId = (short) categories.get(CharCategory.DEFAULT).id();
            short[] table = new short[TABLE_SIZE];
            Arrays.fill(table, defaultId);
            for (Range range : ranges) {
                CharCategory category = categories.get(range.category());
                if (category == null) {
                    throw new IllegalStateException("Range refers to undefined category " + range.category());
                }
                for (int c = range.from(); c <= range.to(); c++) {
                    table[c] = (short) category.id();
                }
            }
            return new CharacterDefinition(Collections.unmodifiableList(ordered),
                    Collections.unmodifiableList(new ArrayList<>(ranges)),
                    table);
        }
    }
}
