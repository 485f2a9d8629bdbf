package com.example.morphan.dictionary;

import com.example.morphan.MorphologyException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.StringReader;
import java.net.URISyntaxException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

class JsonDictionaryLoaderTest {

    private final JsonDictionaryLoader loader = new JsonDictionaryLoader();

    static Path resource(String name) throws URISyntaxException {
        return Paths.get(JsonDictionaryLoaderTest.class.getResource(name).toURI());
    }

    @Test
    void readsTheToyDictionary() {
        SystemDictionary dictionary = loader.readResource("/dictionary/toy-dictionary.json").build();

        Assertions.assertEquals(3, dictionary.lexicon().size());
        Assertions.assertEquals(3, dictionary.connections().size());
        Assertions.assertEquals(100, dictionary.connections().cost(2, 2));
        Assertions.assertEquals(10000, dictionary.connections().cost(0, 0));
        Assertions.assertEquals("DIGIT", dictionary.characters().categoryOf('5').name());
        Assertions.assertEquals(List.of("DEFAULT", "DIGIT"), List.copyOf(dictionary.unknownEntries().keySet()));
        List<DictionaryEntry> entries = dictionary.lookup("ab", 0);
        Assertions.assertEquals(2, entries.size());
        Assertions.assertEquals("ab-feature", dictionary.feature(entries.get(1).featureRef()));
    }

    @Test
    void readsTheBundledDictionary() {
        SystemDictionary dictionary = loader.readResource(JsonDictionaryLoader.DEFAULT_RESOURCE).build();

        Assertions.assertEquals(6, dictionary.connections().size());
        Assertions.assertFalse(dictionary.lookup("学生です", 0).isEmpty());
        Assertions.assertEquals("KATAKANA", dictionary.characters().categoryOf('テ').name());
        Assertions.assertTrue(dictionary.unknownEntries().containsKey("DEFAULT"));
    }

    @Test
    void appendsUserDictionaryEntries() throws URISyntaxException {
        SystemDictionary.Builder builder = loader.readResource("/dictionary/toy-dictionary.json");

        loader.appendUserDictionary(builder, resource("/dictionary/user-dictionary.json"));
        SystemDictionary dictionary = builder.build();

        Assertions.assertEquals(4, dictionary.lexicon().size());
        List<DictionaryEntry> entries = dictionary.lookup("abc", 0);
        Assertions.assertEquals(3, entries.get(entries.size() - 1).length());
        Assertions.assertEquals("abc-feature", dictionary.feature(entries.get(entries.size() - 1).featureRef()));
    }

    @Test
    void readsHexadecimalAndSingleCharacterRanges() {
        String json = "{\"contextSize\": 2,"
                + " \"categories\": [{\"name\": \"KATAKANA\", \"invoke\": true, \"group\": true, \"length\": 2,"
                + " \"ranges\": [[\"0x30A1\", \"0x30FA\"], [\"ー\"]]}],"
                + " \"unknown\": [{\"category\": \"DEFAULT\", \"left\": 1, \"right\": 1, \"cost\": 10, \"feature\": \"U\"}]}";

        SystemDictionary dictionary = loader.read(new StringReader(json), "inline").build();

        Assertions.assertEquals("KATAKANA", dictionary.characters().categoryOf('ア').name());
        Assertions.assertEquals("KATAKANA", dictionary.characters().categoryOf('ー').name());
        Assertions.assertEquals("DEFAULT", dictionary.characters().categoryOf('あ').name());
        Assertions.assertEquals(0, dictionary.connections().cost(1, 1));
    }

    @Test
    void malformedDocumentsAreReported() {
        Assertions.assertThrows(MorphologyException.class,
                () -> loader.readResource("/dictionary/malformed-dictionary.json"));
        Assertions.assertThrows(MorphologyException.class,
                () -> loader.read(new StringReader("[1, 2]"), "array"));
        Assertions.assertThrows(MorphologyException.class,
                () -> loader.read(new StringReader("{\"entries\": []}"), "no-context-size"));
        Assertions.assertThrows(MorphologyException.class,
                () -> loader.read(new StringReader("{\"contextSize\": 2, \"connections\": [[0, 1]]}"), "short-row"));
        Assertions.assertThrows(MorphologyException.class,
                () -> loader.readResource("/dictionary/does-not-exist.json"));
    }

    @Test
    void rowsWithoutARequiredMemberAreReported(@TempDir Path directory) throws Exception {
        String noFeature = "{\"contextSize\": 2, \"entries\": [{\"surface\": \"a\", \"left\": 1, \"right\": 1,"
                + " \"cost\": 1}]}";
        MorphologyException e = Assertions.assertThrows(MorphologyException.class,
                () -> loader.read(new StringReader(noFeature), "no-feature"));
        Assertions.assertTrue(e.getMessage().contains("'feature'"), e.getMessage());

        String nullCategory = "{\"contextSize\": 2, \"unknown\": [{\"category\": null, \"left\": 1, \"right\": 1,"
                + " \"cost\": 1, \"feature\": \"U\"}]}";
        e = Assertions.assertThrows(MorphologyException.class,
                () -> loader.read(new StringReader(nullCategory), "null-category"));
        Assertions.assertTrue(e.getMessage().contains("'category'"), e.getMessage());

        Path user = directory.resolve("user.json");
        Files.writeString(user, "{\"entries\": [{\"left\": 1, \"right\": 1, \"cost\": 1, \"feature\": \"f\"}]}",
                StandardCharsets.UTF_8);
        SystemDictionary.Builder builder = loader.readResource("/dictionary/toy-dictionary.json");
        e = Assertions.assertThrows(MorphologyException.class, () -> loader.appendUserDictionary(builder, user));
        Assertions.assertTrue(e.getMessage().contains("'surface'"), e.getMessage());
    }

    @Test
    void contextIdsOutsideTheMatrixAreRejected() {
        String json = "{\"contextSize\": 2, \"entries\": [{\"surface\": \"a\", \"left\": 2, \"right\": 0,"
                + " \"cost\": 1, \"feature\": \"f\"}]}";

        Assertions.assertThrows(MorphologyException.class, () -> loader.read(new StringReader(json), "ids"));
    }

    @Test
    void missingDefaultUnknownEntryFailsOnBuild() {
        SystemDictionary.Builder builder = loader.read(new StringReader("{\"contextSize\": 1}"), "bare");

        Assertions.assertThrows(MorphologyException.class, builder::build);
    }

    @Test
    void missingFileIsReported(@TempDir Path directory) throws Exception {
        Assertions.assertThrows(MorphologyException.class, () -> loader.read(directory.resolve("missing.json")));

        Path broken = directory.resolve("broken.json");
        Files.writeString(broken, "{\"contextSize\": ", StandardCharsets.UTF_8);
        Assertions.assertThrows(MorphologyException.class, () -> loader.read(broken));
    }
}
