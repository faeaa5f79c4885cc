package me.cogbot.adapter.outbound.sqlite;

import me.cogbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class SqliteDatabaseAdapterTest {

    @TempDir
    Path tempDir;

    private SqliteDatabaseAdapter adapter;

    @BeforeEach
    void setUp() {
        adapter = new SqliteDatabaseAdapter(new BotProperties());
    }

    @Test
    void open_createsFileWithManualCommit() throws SQLException {
        Path file = tempDir.resolve("test.db");

        try (Connection connection = adapter.open(file)) {
            assertFalse(connection.getAutoCommit());
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE t (id INTEGER)");
            }
            connection.commit();
        }

        assertTrue(Files.exists(file));
    }

    @Test
    void listTablesAndColumns() throws SQLException {
        try (Connection connection = adapter.open(tempDir.resolve("meta.db"))) {
            try (Statement statement = connection.createStatement()) {
                statement.execute("CREATE TABLE users (user_id INTEGER PRIMARY KEY AUTOINCREMENT, name TEXT)");
                statement.execute("CREATE TABLE logs (id INTEGER)");
            }

            List<String> tables = adapter.listTables(connection);

            assertEquals(2, tables.size());
            assertTrue(tables.containsAll(List.of("users", "logs")));
            assertEquals(List.of("user_id", "name"), adapter.listColumns(connection, "users"));
            assertTrue(adapter.listColumns(connection, "unknown").isEmpty());
        }
    }

    @Test
    void listColumns_rejectsInvalidTableName() throws SQLException {
        try (Connection connection = adapter.open(tempDir.resolve("bad.db"))) {
            assertThrows(IllegalArgumentException.class, () -> adapter.listColumns(connection, "x); DROP"));
        }
    }

    @Test
    void insertStatements() {
        assertEquals("INSERT OR IGNORE INTO settings (key, value) VALUES (?, ?)",
                adapter.insertOrIgnore("settings", List.of("key", "value")));
        assertEquals("INSERT OR REPLACE INTO settings (key, value) VALUES (?, ?)",
                adapter.insertOrReplace("settings", List.of("key", "value")));
    }

    @Test
    void fileExtension_comesFromProperties() {
        BotProperties properties = new BotProperties();
        properties.getStorage().getSqlite().setFileExtension("sqlite");

        assertEquals("sqlite", new SqliteDatabaseAdapter(properties).getFileExtension());
        assertEquals("db", adapter.getFileExtension());
    }
}
