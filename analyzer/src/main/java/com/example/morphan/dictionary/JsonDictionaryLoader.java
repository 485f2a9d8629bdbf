package com.example.morphan.dictionary;

import com.example.morphan.MorphologyException;
import com.google.gson.JsonArray;
import com.google.gson.JsonElement;
import com.google.gson.JsonObject;
import com.google.gson.JsonParseException;
import com.google.gson.JsonParser;

import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Locale;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Reads dictionaries stored as JSON documents:
 *
 * <pre>
 * {
 *   "contextSize": 3,
 *   "defaultConnectionCost": 10000,
 *   "connections": [[0, 1, 0], ...],                  // [rightId, leftId, cost]
 *   "entries": [{"surface": "ab", "left": 1, "right": 1, "cost": 1, "feature": "..."}],
 *   "categories": [{"name": "KATAKANA", "invoke": true, "group": true, "length": 2,
 *                   "ranges": [["0x30A1", "0x30FF"]]}],
 *   "unknown": [{"category": "DEFAULT", "left": 1, "right": 1, "cost": 3000, "feature": "..."}]
 * }
 * </pre>
 *
 * A user dictionary is a document with an {@code entries} array only.
 */
public final class JsonDictionaryLoader {

    private static final Logger log = Logger.getLogger(JsonDictionaryLoader.class.getName());

    public static final String DEFAULT_RESOURCE = "/dictionary/default-dictionary.json";

    public SystemDictionary.Builder read(Path path) {
        Objects.requireNonNull(path, "path");
        if (!Files.isRegularFile(path)) {
            throw new MorphologyException("Dictionary not found: " + path.toAbsolutePath());
        }
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            return read(reader, path.toString());
        } catch (IOException ex) {
            throw new MorphologyException("Failed to read dictionary " + path.toAbsolutePath(), ex);
        }
    }

    public SystemDictionary.Builder readResource(String resource) {
        Objects.requireNonNull(resource, "resource");
        try (InputStream stream = JsonDictionaryLoader.class.getResourceAsStream(resource)) {
            if (stream == null) {
                throw new MorphologyException("Missing dictionary resource: " + resource);
            }
            return read(new InputStreamReader(stream, StandardCharsets.UTF_8), resource);
        } catch (IOException ex) {
            throw new MorphologyException("Failed to read dictionary resource " + resource, ex);
        }
    }

    public SystemDictionary.Builder read(Reader reader, String origin) {
        JsonObject document = parse(reader, origin);
        int contextSize = requireInt(document, "contextSize", origin);
        SystemDictionary.Builder builder;
        try {
            int defaultCost = document.has("defaultConnectionCost")
                    ? document.get("defaultConnectionCost").getAsInt()
                    : 0;
            builder = SystemDictionary.builder(contextSize, defaultCost);
            for (JsonElement element : array(document, "connections")) {
                JsonArray triple = element.getAsJsonArray();
                if (triple.size() != 3) {
                    throw new MorphologyException("Connection rows need [right, left, cost] in " + origin);
                }
                builder.connection(triple.get(0).getAsInt(), triple.get(1).getAsInt(), triple.get(2).getAsInt());
            }
            for (JsonElement element : array(document, "categories")) {
                JsonObject category = element.getAsJsonObject();
                String name = member(category, "name", origin).getAsString();
                builder.category(name,
                        category.has("invoke") && category.get("invoke").getAsBoolean(),
                        category.has("group") && category.get("group").getAsBoolean(),
                        category.has("length") ? category.get("length").getAsInt() : 0);
                for (JsonElement range : array(category, "ranges")) {
                    JsonArray bounds = range.getAsJsonArray();
                    if (bounds.size() == 0) {
                        throw new MorphologyException("Empty range of category " + name + " in " + origin);
                    }
                    char from = parseChar(bounds.get(0).getAsString(), origin);
                    char to = bounds.size() > 1 ? parseChar(bounds.get(1).getAsString(), origin) : from;
                    builder.range(from, to, name);
                }
            }
            for (JsonElement element : array(document, "unknown")) {
                JsonObject row = element.getAsJsonObject();
                builder.unknown(member(row, "category", origin).getAsString(),
                        member(row, "left", origin).getAsInt(),
                        member(row, "right", origin).getAsInt(),
                        member(row, "cost", origin).getAsInt(),
                        member(row, "feature", origin).getAsString());
            }
            int entries = appendEntries(builder, document, origin);
            log.log(Level.FINE, () -> "Read " + entries + " lexicon rows from " + origin);
        } catch (IllegalStateException | IllegalArgumentException | UnsupportedOperationException ex) {
            throw new MorphologyException("Malformed dictionary document " + origin, ex);
        }
        return builder;
    }

    /**
     * Appends the {@code entries} of a user dictionary to {@code builder}.
     */
    public void appendUserDictionary(SystemDictionary.Builder builder, Path path) {
        Objects.requireNonNull(builder, "builder");
        Objects.requireNonNull(path, "path");
        try (Reader reader = Files.newBufferedReader(path, StandardCharsets.UTF_8)) {
            JsonObject document = parse(reader, path.toString());
            int entries = appendEntries(builder, document, path.toString());
            log.log(Level.FINE, () -> "Appended " + entries + " user dictionary rows from " + path);
        } catch (IOException ex) {
            throw new MorphologyException("Failed to read user dictionary " + path.toAbsolutePath(), ex);
        } catch (IllegalStateException | IllegalArgumentException | UnsupportedOperationException ex) {
            throw new MorphologyException("Malformed user dictionary " + path.toAbsolutePath(), ex);
        }
    }

    private int appendEntries(SystemDictionary.Builder builder, JsonObject document, String origin) {
        int count = 0;
        for (JsonElement element : array(document, "entries")) {
            JsonObject row = element.getAsJsonObject();
            builder.entry(member(row, "surface", origin).getAsString(),
                    member(row, "left", origin).getAsInt(),
                    member(row, "right", origin).getAsInt(),
                    member(row, "cost", origin).getAsInt(),
                    member(row, "feature", origin).getAsString());
            count++;
        }
        return count;
    }

    private static JsonObject parse(Reader reader, String origin) {
        try {
            JsonElement root = JsonParser.parseReader(reader);
            if (!root.isJsonObject()) {
                throw new MorphologyException("Dictionary document must be a JSON object: " + origin);
            }
            return root.getAsJsonObject();
        } catch (JsonParseException ex) {
            throw new MorphologyException("Invalid JSON in dictionary " + origin, ex);
        }
    }

    private static JsonArray array(JsonObject object, String member) {
        JsonElement element = object.get(member);
        if (element == null || element.isJsonNull()) {
            return new JsonArray();
        }
        return element.getAsJsonArray();
    }

    private static JsonElement member(JsonObject object, String name, String origin) {
        JsonElement element = object.get(name);
        if (element == null || element.isJsonNull()) {
            throw new MorphologyException("Row without '" + name + "' in dictionary " + origin + ": " + object);
        }
        return element;
    }

    private static int requireInt(JsonObject object, String member, String origin) {
        JsonElement element = object.get(member);
        if (element == null || !element.isJsonPrimitive()) {
            throw new MorphologyException("Dictionary " + origin + " lacks '" + member + "'");
        }
        return element.getAsInt();
    }

    static char parseChar(String value, String origin) {
        String trimmed = value.trim();
        if (trimmed.length() == 1) {
            return trimmed.charAt(0);
        }
        String lower = trimmed.toLowerCase(Locale.ROOT);
        if (lower.startsWith("0x")) {
            int code = Integer.parseInt(lower.substring(2), 16);
            if (code > Character.MAX_VALUE) {
                throw new MorphologyException("Code unit outside the BMP in " + origin + ": " + value);
            }
            return (char) code;
        }
        throw new MorphologyException("Cannot read character '" + value + "' in " + origin);
    }
}
