package com.example.morphan.dictionary;

import com.example.morphan.MorphologyException;
import com.example.morphan.unknown.CharCategory;
import com.example.morphan.unknown.CharacterDefinition;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Stores a {@link SystemDictionary} in a SQLite database and reads it back. Only connection costs
 * that differ from the default are written.
 */
public final class SqliteDictionaryStore {

    private static final Logger log = Logger.getLogger(SqliteDictionaryStore.class.getName());

    private static final String CONTEXT_SIZE = "context_size";
    private static final String DEFAULT_CONNECTION_COST = "default_connection_cost";

    /**
     * Writes {@code dictionary} into {@code databasePath}, replacing any dictionary stored there.
     *
     * @return number of lexicon rows written
     */
    public int write(Path databasePath, SystemDictionary dictionary) {
        Objects.requireNonNull(databasePath, "databasePath");
        Objects.requireNonNull(dictionary, "dictionary");
        try {
            Path parent = databasePath.toAbsolutePath().getParent();
            if (parent != null) {
                Files.createDirectories(parent);
            }
            try (Connection connection = open(databasePath)) {
                initialiseDatabase(connection);
                connection.setAutoCommit(false);
                try {
                    clear(connection);
                    writeMeta(connection, dictionary);
                    int rows = writeLexicon(connection, dictionary.lexicon());
                    writeConnections(connection, dictionary.connections(), dictionary.defaultConnectionCost());
                    writeCategories(connection, dictionary.characters());
                    writeUnknown(connection, dictionary.unknownEntries());
                    connection.commit();
                    log.log(Level.FINE, () -> "Stored " + rows + " lexicon rows in " + databasePath);
                    return rows;
                } catch (SQLException ex) {
                    connection.rollback();
                    throw ex;
                }
            }
        } catch (IOException | SQLException ex) {
            throw new MorphologyException("Failed to write dictionary to " + databasePath.toAbsolutePath(), ex);
        }
    }

    public SystemDictionary read(Path databasePath) {
        return readBuilder(databasePath).build();
    }

    /**
     * Reads a stored dictionary without freezing it, so user dictionaries can still be appended.
     */
    public SystemDictionary.Builder readBuilder(Path databasePath) {
        Objects.requireNonNull(databasePath, "databasePath");
        if (!Files.isRegularFile(databasePath)) {
            throw new MorphologyException("Dictionary database not found: " + databasePath.toAbsolutePath());
        }
        try (Connection connection = open(databasePath)) {
            Map<String, String> meta = readMeta(connection);
            int contextSize = metaInt(meta, CONTEXT_SIZE, databasePath);
            int defaultCost = metaInt(meta, DEFAULT_CONNECTION_COST, databasePath);
            SystemDictionary.Builder builder = SystemDictionary.builder(contextSize, defaultCost);
            try (Statement statement = connection.createStatement()) {
                try (ResultSet rows = statement.executeQuery(
                        "SELECT right_id, left_id, cost FROM connection ORDER BY right_id, left_id")) {
                    while (rows.next()) {
                        builder.connection(rows.getInt(1), rows.getInt(2), rows.getInt(3));
                    }
                }
                try (ResultSet rows = statement.executeQuery(
                        "SELECT name, invoke, grp, length FROM category ORDER BY id")) {
                    while (rows.next()) {
                        builder.category(rows.getString(1), rows.getInt(2) != 0, rows.getInt(3) != 0, rows.getInt(4));
                    }
                }
                try (ResultSet rows = statement.executeQuery(
                        "SELECT range_from, range_to, category FROM category_range ORDER BY seq")) {
                    while (rows.next()) {
                        builder.range((char) rows.getInt(1), (char) rows.getInt(2), rows.getString(3));
                    }
                }
                try (ResultSet rows = statement.executeQuery(
                        "SELECT category, left_id, right_id, cost, feature FROM unknown ORDER BY seq")) {
                    while (rows.next()) {
                        builder.unknown(rows.getString(1), rows.getInt(2), rows.getInt(3), rows.getInt(4),
                                rows.getString(5));
                    }
                }
                int count = 0;
                try (ResultSet rows = statement.executeQuery(
                        "SELECT surface, left_id, right_id, cost, feature FROM lexicon ORDER BY id")) {
                    while (rows.next()) {
                        builder.entry(rows.getString(1), rows.getInt(2), rows.getInt(3), rows.getInt(4),
                                rows.getString(5));
                        count++;
                    }
                }
                int entries = count;
                log.log(Level.FINE, () -> "Read " + entries + " lexicon rows from " + databasePath);
            }
            return builder;
        } catch (SQLException ex) {
            throw new MorphologyException("Failed to read dictionary from " + databasePath.toAbsolutePath(), ex);
        }
    }

    private static Connection open(Path databasePath) throws SQLException {
        return DriverManager.getConnection("jdbc:sqlite:" + databasePath.toAbsolutePath());
    }

    private void initialiseDatabase(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS meta ("
                    + "key TEXT PRIMARY KEY,"
                    + "value TEXT NOT NULL"
                    + ")");
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS lexicon ("
                    + "id INTEGER PRIMARY KEY,"
                    + "surface TEXT NOT NULL,"
                    + "left_id INTEGER NOT NULL,"
                    + "right_id INTEGER NOT NULL,"
                    + "cost INTEGER NOT NULL,"
                    + "feature TEXT NOT NULL"
                    + ")");
            statement.executeUpdate("CREATE INDEX IF NOT EXISTS idx_lexicon_surface ON lexicon(surface)");
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS connection ("
                    + "right_id INTEGER NOT NULL,"
                    + "left_id INTEGER NOT NULL,"
                    + "cost INTEGER NOT NULL,"
                    + "PRIMARY KEY (right_id, left_id)"
                    + ")");
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS category ("
                    + "id INTEGER PRIMARY KEY,"
                    + "name TEXT NOT NULL UNIQUE,"
                    + "invoke INTEGER NOT NULL,"
                    + "grp INTEGER NOT NULL,"
                    + "length INTEGER NOT NULL"
                    + ")");
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS category_range ("
                    + "seq INTEGER PRIMARY KEY,"
                    + "range_from INTEGER NOT NULL,"
                    + "range_to INTEGER NOT NULL,"
                    + "category TEXT NOT NULL"
                    + ")");
            statement.executeUpdate("CREATE TABLE IF NOT EXISTS unknown ("
                    + "seq INTEGER PRIMARY KEY,"
                    + "category TEXT NOT NULL,"
                    + "left_id INTEGER NOT NULL,"
                    + "right_id INTEGER NOT NULL,"
                    + "cost INTEGER NOT NULL,"
                    + "feature TEXT NOT NULL"
                    + ")");
        }
    }

    private void clear(Connection connection) throws SQLException {
        try (Statement statement = connection.createStatement()) {
            for (String table : List.of("meta", "lexicon", "connection", "category", "category_range", "unknown")) {
                statement.executeUpdate("DELETE FROM " + table);
            }
        }
    }

    private void writeMeta(Connection connection, SystemDictionary dictionary) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement("INSERT INTO meta (key, value) VALUES (?,?)")) {
            statement.setString(1, CONTEXT_SIZE);
            statement.setString(2, Integer.toString(dictionary.connections().size()));
            statement.addBatch();
            statement.setString(1, DEFAULT_CONNECTION_COST);
            statement.setString(2, Integer.toString(dictionary.defaultConnectionCost()));
            statement.addBatch();
            statement.executeBatch();
        }
    }

    private int writeLexicon(Connection connection, TrieDictionary lexicon) throws SQLException {
        String sql = "INSERT INTO lexicon (id, surface, left_id, right_id, cost, feature) VALUES (?,?,?,?,?,?)";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int i = 0; i < lexicon.size(); i++) {
                DictionaryEntry entry = lexicon.entry(i);
                statement.setInt(1, i);
                statement.setString(2, lexicon.surface(i));
                statement.setInt(3, entry.leftId());
                statement.setInt(4, entry.rightId());
                statement.setInt(5, entry.cost());
                statement.setString(6, lexicon.feature(entry.featureRef()));
                statement.addBatch();
            }
            statement.executeBatch();
        }
        return lexicon.size();
    }

    private void writeConnections(Connection connection, ConnectionCostMatrix matrix, int defaultCost)
            throws SQLException {
        String sql = "INSERT INTO connection (right_id, left_id, cost) VALUES (?,?,?)";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (int right = 0; right < matrix.size(); right++) {
                for (int left = 0; left < matrix.size(); left++) {
                    int cost = matrix.cost(right, left);
                    if (cost == defaultCost) {
                        continue;
                    }
                    statement.setInt(1, right);
                    statement.setInt(2, left);
                    statement.setInt(3, cost);
                    statement.addBatch();
                }
            }
            statement.executeBatch();
        }
    }

    private void writeCategories(Connection connection, CharacterDefinition characters) throws SQLException {
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO category (id, name, invoke, grp, length) VALUES (?,?,?,?,?)")) {
            for (CharCategory category : characters.categories()) {
                statement.setInt(1, category.id());
                statement.setString(2, category.name());
                statement.setInt(3, category.invoke() ? 1 : 0);
                statement.setInt(4, category.group() ? 1 : 0);
                statement.setInt(5, category.length());
                statement.addBatch();
            }
            statement.executeBatch();
        }
        try (PreparedStatement statement = connection.prepareStatement(
                "INSERT INTO category_range (seq, range_from, range_to, category) VALUES (?,?,?,?)")) {
            int seq = 0;
            for (CharacterDefinition.Range range : characters.ranges()) {
                statement.setInt(1, seq++);
                statement.setInt(2, range.from());
                statement.setInt(3, range.to());
                statement.setString(4, range.category());
                statement.addBatch();
            }
            statement.executeBatch();
        }
    }

    private void writeUnknown(Connection connection, Map<String, List<SystemDictionary.UnknownEntry>> unknown)
            throws SQLException {
        String sql = "INSERT INTO unknown (seq, category, left_id, right_id, cost, feature) VALUES (?,?,?,?,?,?)";
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            int seq = 0;
            for (List<SystemDictionary.UnknownEntry> entries : unknown.values()) {
                for (SystemDictionary.UnknownEntry entry : entries) {
                    statement.setInt(1, seq++);
                    statement.setString(2, entry.category());
                    statement.setInt(3, entry.leftId());
                    statement.setInt(4, entry.rightId());
                    statement.setInt(5, entry.cost());
                    statement.setString(6, entry.feature());
                    statement.addBatch();
                }
            }
            statement.executeBatch();
        }
    }

    private static Map<String, String> readMeta(Connection connection) throws SQLException {
        Map<String, String> meta = new HashMap<>();
        try (Statement statement = connection.createStatement();
             ResultSet rows = statement.executeQuery("SELECT key, value FROM meta")) {
            while (rows.next()) {
                meta.put(rows.getString(1), rows.getString(2));
            }
        }
        return meta;
    }

    private static int metaInt(Map<String, String> meta, String key, Path databasePath) {
        String value = meta.get(key);
        if (value == null) {
            throw new MorphologyException("Dictionary database " + databasePath + " lacks meta value " + key);
        }
        try {
            return Integer.parseInt(value);
        } catch (NumberFormatException ex) {
            throw new MorphologyException("Meta value " + key + " is not an integer: " + value, ex);
        }
    }
}
