package com.example.morphan.dictionary;

import com.example.morphan.AnalyzerSettings;

import java.nio.file.Path;
import java.util.Locale;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Loads the dictionary named by {@link AnalyzerSettings}: a SQLite database when the path ends in
 * {@code .db} or {@code .sqlite}, a JSON document otherwise, or the bundled sample dictionary when no
 * path is configured. User dictionaries are JSON documents appended to the lexicon.
 */
public final class Dictionaries {

    private static final Logger log = Logger.getLogger(Dictionaries.class.getName());

    private Dictionaries() {
    }

    public static SystemDictionary load(AnalyzerSettings settings) {
        JsonDictionaryLoader json = new JsonDictionaryLoader();
        SystemDictionary.Builder builder = settings.dictionaryPath()
                .map(path -> isDatabase(path) ? new SqliteDictionaryStore().readBuilder(path) : json.read(path))
                .orElseGet(() -> json.readResource(JsonDictionaryLoader.DEFAULT_RESOURCE));
        for (Path user : settings.userDictionaries()) {
            json.appendUserDictionary(builder, user);
        }
        SystemDictionary dictionary = builder.build();
        log.log(Level.FINE, () -> "Loaded dictionary with " + dictionary.lexicon().size() + " entries, "
                + dictionary.connections().size() + " context ids and "
                + dictionary.characters().categories().size() + " character categories");
        return dictionary;
    }

    public static SystemDictionary loadDefault() {
        return new JsonDictionaryLoader().readResource(JsonDictionaryLoader.DEFAULT_RESOURCE).build();
    }

    static boolean isDatabase(Path path) {
        String name = path.getFileName() == null ? "" : path.getFileName().toString().toLowerCase(Locale.ROOT);
        return name.endsWith(".db") || name.endsWith(".sqlite");
    }
}
