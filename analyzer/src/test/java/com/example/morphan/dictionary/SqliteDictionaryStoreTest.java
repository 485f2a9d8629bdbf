package com.example.morphan.dictionary;

import com.example.morphan.AnalyzerSettings;
import com.example.morphan.MorphologyException;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.util.List;
import java.util.stream.Collectors;

class SqliteDictionaryStoreTest {

    private final SqliteDictionaryStore store = new SqliteDictionaryStore();

    @Test
    void storedDictionaryReadsBackUnchanged(@TempDir Path directory) {
        SystemDictionary original = new JsonDictionaryLoader().readResource("/dictionary/toy-dictionary.json").build();
        Path database = directory.resolve("toy.db");

        int rows = store.write(database, original);
        SystemDictionary restored = store.read(database);

        Assertions.assertEquals(3, rows);
        Assertions.assertEquals(original.lexicon().size(), restored.lexicon().size());
        for (int i = 0; i < original.lexicon().size(); i++) {
            Assertions.assertEquals(original.lexicon().surface(i), restored.lexicon().surface(i));
            Assertions.assertEquals(original.lexicon().entry(i).cost(), restored.lexicon().entry(i).cost());
        }
        for (int right = 0; right < original.connections().size(); right++) {
            for (int left = 0; left < original.connections().size(); left++) {
                Assertions.assertEquals(original.connections().cost(right, left),
                        restored.connections().cost(right, left));
            }
        }
        Assertions.assertEquals(original.defaultConnectionCost(), restored.defaultConnectionCost());
        Assertions.assertEquals(original.unknownEntries(), restored.unknownEntries());
        Assertions.assertEquals("DIGIT", restored.characters().categoryOf('3').name());
        Assertions.assertEquals(original.characters().categories(), restored.characters().categories());
    }

    @Test
    void writingTwiceReplacesTheStoredDictionary(@TempDir Path directory) {
        Path database = directory.resolve("nested").resolve("dictionary.sqlite");
        store.write(database, new JsonDictionaryLoader().readResource("/dictionary/toy-dictionary.json").build());

        store.write(database, Dictionaries.loadDefault());

        SystemDictionary restored = store.read(database);
        Assertions.assertEquals(Dictionaries.loadDefault().lexicon().size(), restored.lexicon().size());
        Assertions.assertTrue(restored.lookup("ab", 0).isEmpty());
    }

    @Test
    void settingsPointingAtADatabaseLoadIt(@TempDir Path directory) throws Exception {
        Path database = directory.resolve("toy.db");
        store.write(database, new JsonDictionaryLoader().readResource("/dictionary/toy-dictionary.json").build());
        AnalyzerSettings settings = AnalyzerSettings.builder()
                .dictionaryPath(database)
                .addUserDictionary(JsonDictionaryLoaderTest.resource("/dictionary/user-dictionary.json"))
                .build();

        SystemDictionary dictionary = Dictionaries.load(settings);

        Assertions.assertEquals(4, dictionary.lexicon().size());
        Assertions.assertEquals(List.of(1, 2, 3),
                dictionary.lookup("abc", 0).stream().map(DictionaryEntry::length).collect(Collectors.toList()));
    }

    @Test
    void missingDatabaseIsReported(@TempDir Path directory) {
        Assertions.assertThrows(MorphologyException.class, () -> store.read(directory.resolve("absent.db")));
    }

    @Test
    void recognisesDatabaseFileNames() {
        Assertions.assertTrue(Dictionaries.isDatabase(Path.of("data", "dictionary.db")));
        Assertions.assertTrue(Dictionaries.isDatabase(Path.of("DICT.SQLITE")));
        Assertions.assertFalse(Dictionaries.isDatabase(Path.of("dictionary.json")));
    }
}
