/*
 * Copyright 2026 Aleksei Kuleshov
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 *
 * Contact: alex@kuleshov.tech
 */

package me.cogbot.adapter.outbound.sqlite;

import me.cogbot.domain.model.TableSchema;
import me.cogbot.infrastructure.config.BotProperties;
import me.cogbot.port.outbound.EmbeddedDatabasePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;
import org.sqlite.SQLiteConfig;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.DriverManager;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.SQLException;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

/**
 * SQLite implementation of {@link EmbeddedDatabasePort}, one file per scope.
 *
 * <p>
 * Engine settings come from {@code bot.storage.sqlite.*}: busy timeout,
 * journal mode, foreign-key enforcement and the database file extension.
 *
 * @see me.cogbot.port.outbound.EmbeddedDatabasePort
 */
@Component
@Slf4j
public class SqliteDatabaseAdapter implements EmbeddedDatabasePort {

    private static final String JDBC_PREFIX = "jdbc:sqlite:";
    private static final String LIST_TABLES = "SELECT name FROM sqlite_master WHERE type = 'table' "
            + "AND name NOT LIKE 'sqlite_%' ORDER BY name";

    private final BotProperties.SqliteProperties settings;

    public SqliteDatabaseAdapter(BotProperties properties) {
        this.settings = properties.getStorage().getSqlite();
    }

    @Override
    public Connection open(Path file) throws SQLException {
        SQLiteConfig config = new SQLiteConfig();
        config.setBusyTimeout(settings.getBusyTimeoutMs());
        config.setJournalMode(SQLiteConfig.JournalMode.valueOf(settings.getJournalMode().toUpperCase(Locale.ROOT)));
        config.enforceForeignKeys(settings.isForeignKeys());

        Connection connection = DriverManager.getConnection(JDBC_PREFIX + file.toAbsolutePath(),
                config.toProperties());
        try {
            connection.setAutoCommit(false);
        } catch (SQLException e) {
            connection.close();
            throw e;
        }
        log.debug("[SQLite] Opened {}", file);
        return connection;
    }

    @Override
    public String getFileExtension() {
        return settings.getFileExtension();
    }

    @Override
    public List<String> listTables(Connection connection) throws SQLException {
        List<String> tables = new ArrayList<>();
        try (Statement statement = connection.createStatement();
                ResultSet rs = statement.executeQuery(LIST_TABLES)) {
            while (rs.next()) {
                tables.add(rs.getString(1));
            }
        }
        return tables;
    }

    @Override
    public List<String> listColumns(Connection connection, String table) throws SQLException {
        if (!TableSchema.isIdentifier(table)) {
            throw new IllegalArgumentException("Invalid table name: " + table);
        }
        List<String> columns = new ArrayList<>();
        try (PreparedStatement statement = connection.prepareStatement("PRAGMA table_info(" + table + ")");
                ResultSet rs = statement.executeQuery()) {
            while (rs.next()) {
                columns.add(rs.getString("name"));
            }
        }
        return columns;
    }

    @Override
    public String insertOrIgnore(String table, List<String> columns) {
        return insert("INSERT OR IGNORE", table, columns);
    }

    @Override
    public String insertOrReplace(String table, List<String> columns) {
        return insert("INSERT OR REPLACE", table, columns);
    }

    private static String insert(String verb, String table, List<String> columns) {
        if (columns.isEmpty()) {
            throw new IllegalArgumentException("No columns to insert into " + table);
        }
        StringBuilder sql = new StringBuilder(verb).append(" INTO ").append(table).append(" (");
        sql.append(String.join(", ", columns)).append(") VALUES (");
        for (int i = 0; i < columns.size(); i++) {
            sql.append(i == 0 ? "?" : ", ?");
        }
        return sql.append(')').toString();
    }
}
