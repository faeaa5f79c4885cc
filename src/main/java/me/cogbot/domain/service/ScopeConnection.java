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

package me.cogbot.domain.service;

import me.cogbot.domain.exception.ContractViolationException;
import me.cogbot.domain.exception.StorageAccessException;
import me.cogbot.domain.model.KeyValueTableSchema;
import me.cogbot.domain.model.ReseedPolicy;
import me.cogbot.domain.model.Row;
import me.cogbot.domain.model.Scope;
import me.cogbot.domain.model.TableSchema;
import me.cogbot.port.outbound.EmbeddedDatabasePort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.sql.Statement;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Live database of one scope inside one domain. Owns exactly one engine
 * connection, opened in the constructor.
 *
 * <p>
 * Opening bootstraps the registered schemas in a single transaction:
 * <ol>
 * <li>tables missing from the file are created and seeded with their
 * defaults</li>
 * <li>schemas with {@link ReseedPolicy#ALWAYS} get their defaults inserted
 * again, skipping keys that already exist</li>
 * <li>the transaction is committed</li>
 * </ol>
 * Reopening the same file is idempotent.
 *
 * <p>
 * Writes made with {@code commit = false} stay pending until {@link #commit()}
 * or {@link #rollback()}. A failed call leaves no partial effect behind. Reads
 * end the engine transaction when no write is pending, so an idle connection
 * holds no lock on its file.
 *
 * <p>
 * All calls run synchronously on the caller's thread. Instances do no
 * internal locking and must not be shared between threads without external
 * synchronization. Every call after {@link #close()} fails with
 * {@link IllegalStateException}.
 */
@Slf4j
public class ScopeConnection implements AutoCloseable {

    private static final Pattern TABLE_CHANGE = Pattern.compile(
            "^\\s*(?:DROP|ALTER)\\s+TABLE\\s+(?:IF\\s+EXISTS\\s+)?[`\"\\[]?([A-Za-z_][A-Za-z0-9_]*)",
            Pattern.CASE_INSENSITIVE);
    private static final Set<String> KEY_VALUE_COLUMNS = Set.of(KeyValueTableSchema.KEY_COLUMN,
            KeyValueTableSchema.VALUE_COLUMN);

    @Getter
    private final String domain;
    @Getter
    private final Scope scope;
    @Getter
    private final Path file;
    private final List<TableSchema> schemas;
    private final EmbeddedDatabasePort database;
    private final ValueCodec valueCodec;
    private final Connection connection;
    /** Lower-cased names of tables verified to have exactly key/value columns. */
    private final Set<String> keyValueTables = new HashSet<>();
    private boolean pending;
    private boolean closed;

    public ScopeConnection(String domain, Scope scope, Path file, List<TableSchema> schemas,
            EmbeddedDatabasePort database, ValueCodec valueCodec) {
        this.domain = domain;
        this.scope = scope;
        this.file = file;
        this.schemas = List.copyOf(schemas);
        this.database = database;
        this.valueCodec = valueCodec;
        try {
            this.connection = database.open(file);
        } catch (SQLException e) {
            throw failure("open " + file, e);
        }
        try {
            bootstrap();
        } catch (SQLException | RuntimeException e) {
            discardAfterFailedBootstrap(e);
            if (e instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw failure("bootstrap schemas", (SQLException) e);
        }
    }

    // ==================== Bootstrap ====================

    private void bootstrap() throws SQLException {
        Set<String> existing = new HashSet<>();
        for (String table : database.listTables(connection)) {
            existing.add(normalize(table));
        }

        for (TableSchema schema : schemas) {
            String table = schema.getTableName();
            boolean created = false;
            if (!existing.contains(normalize(table))) {
                log.info("[Storage] Initializing table {}:{}:{}", domain, scope.label(), table);
                try (Statement statement = connection.createStatement()) {
                    statement.execute(schema.getCreationStatement());
                }
                insertDefaults(schema);
                existing.add(normalize(table));
                created = true;
            }
            // a table created above already holds every default row
            if (!created && schema.getReseedPolicy() == ReseedPolicy.ALWAYS && insertDefaults(schema) > 0) {
                log.debug("[Storage] Reseeded missing defaults of {}:{}:{}", domain, scope.label(), table);
            }
            if (schema.isKeyValue()) {
                cacheKeyValueShape(table);
            }
        }
        // ends the transaction even when nothing was written, releasing the read lock
        connection.commit();
    }

    private int insertDefaults(TableSchema schema) throws SQLException {
        if (!schema.hasDefaultRows()) {
            return 0;
        }
        List<String> columns = schema.getDefaultColumns();
        String sql = database.insertOrIgnore(schema.getTableName(), columns);
        try (PreparedStatement statement = connection.prepareStatement(sql)) {
            for (Map<String, Object> row : schema.getDefaultRows()) {
                List<Object> values = new ArrayList<>(columns.size());
                for (String column : columns) {
                    values.add(row.get(column));
                }
                bind(statement, values);
                statement.addBatch();
            }
            int inserted = 0;
            for (int count : statement.executeBatch()) {
                inserted += count == Statement.SUCCESS_NO_INFO ? 1 : Math.max(count, 0);
            }
            return inserted;
        }
    }

    private void cacheKeyValueShape(String table) throws SQLException {
        List<String> columns = database.listColumns(connection, table);
        if (hasKeyValueShape(columns)) {
            keyValueTables.add(normalize(table));
        } else {
            // Left uncached: key-value calls on this table fail with a contract violation.
            log.warn("[Storage] Table {}:{}:{} does not have the key/value layout, found columns {}",
                    domain, scope.label(), table, columns);
        }
    }

    private void discardAfterFailedBootstrap(Exception cause) {
        try {
            connection.rollback();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
        try {
            connection.close();
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
        closed = true;
    }

    // ==================== Generic statements ====================

    /**
     * Execute one statement and commit.
     */
    public void execute(String statement, Object... args) {
        execute(statement, Arrays.asList(args), true);
    }

    /**
     * Execute one statement.
     *
     * @param commit
     *            if {@code true}, commit right away; otherwise the write stays
     *            pending until {@link #commit()}
     */
    public void execute(String statement, List<?> args, boolean commit) {
        ensureOpen();
        write("execute " + statement, commit, () -> {
            try (PreparedStatement ps = connection.prepareStatement(statement)) {
                bind(ps, args);
                ps.execute();
            }
            return null;
        });
        forgetChangedTable(statement);
    }

    /**
     * Execute one statement for every argument row, as a batch, and commit.
     */
    public void executeMany(String statement, Collection<? extends List<?>> rows) {
        executeMany(statement, rows, true);
    }

    /**
     * Execute one statement for every argument row, as a batch. Either every row
     * is written or none is.
     */
    public void executeMany(String statement, Collection<? extends List<?>> rows, boolean commit) {
        ensureOpen();
        write("execute batch " + statement, commit, () -> {
            try (PreparedStatement ps = connection.prepareStatement(statement)) {
                for (List<?> row : rows) {
                    bind(ps, row);
                    ps.addBatch();
                }
                if (!rows.isEmpty()) {
                    ps.executeBatch();
                }
            }
            return null;
        });
        forgetChangedTable(statement);
    }

    /**
     * First row returned by a query, or empty.
     */
    public Optional<Row> fetch(String statement, Object... args) {
        ensureOpen();
        return read("fetch " + statement, () -> {
            try (PreparedStatement ps = connection.prepareStatement(statement)) {
                bind(ps, Arrays.asList(args));
                try (ResultSet rs = ps.executeQuery()) {
                    return rs.next() ? Optional.of(readRow(rs)) : Optional.<Row>empty();
                }
            }
        });
    }

    /**
     * All rows returned by a query, in the order the statement defines.
     */
    public List<Row> fetchAll(String statement, Object... args) {
        ensureOpen();
        return read("fetch " + statement, () -> {
            try (PreparedStatement ps = connection.prepareStatement(statement)) {
                bind(ps, Arrays.asList(args));
                try (ResultSet rs = ps.executeQuery()) {
                    List<Row> rows = new ArrayList<>();
                    while (rs.next()) {
                        rows.add(readRow(rs));
                    }
                    return rows;
                }
            }
        });
    }

    /**
     * Execute a write that may return data ({@code RETURNING}), fetch its first
     * row and commit.
     */
    public Optional<Row> evaluate(String statement, Object... args) {
        return evaluate(statement, Arrays.asList(args), true, true);
    }

    /**
     * Execute a statement, optionally returning its first result row.
     *
     * @param fetchBack
     *            if {@code true}, return the first row produced by the statement
     * @param commit
     *            if {@code true}, commit after execution
     */
    public Optional<Row> evaluate(String statement, List<?> args, boolean fetchBack, boolean commit) {
        ensureOpen();
        Optional<Row> result = write("evaluate " + statement, commit, () -> {
            try (PreparedStatement ps = connection.prepareStatement(statement)) {
                bind(ps, args);
                if (ps.execute() && fetchBack) {
                    try (ResultSet rs = ps.getResultSet()) {
                        if (rs.next()) {
                            return Optional.of(readRow(rs));
                        }
                    }
                }
                return Optional.<Row>empty();
            }
        });
        forgetChangedTable(statement);
        return result;
    }

    /**
     * Commit the writes made with {@code commit = false}.
     */
    public void commit() {
        ensureOpen();
        try {
            connection.commit();
            pending = false;
        } catch (SQLException e) {
            throw failure("commit", e);
        }
    }

    /**
     * Discard writes made with {@code commit = false} since the last commit.
     */
    public void rollback() {
        ensureOpen();
        try {
            connection.rollback();
        } catch (SQLException e) {
            throw failure("rollback", e);
        } finally {
            pending = false;
            keyValueTables.clear();
        }
    }

    /**
     * Release the engine connection. Uncommitted writes are lost. Calling it again
     * has no effect.
     */
    @Override
    public void close() {
        if (closed) {
            return;
        }
        closed = true;
        try {
            connection.close();
            log.debug("[Storage] Closed {}:{}", domain, scope.label());
        } catch (SQLException e) {
            throw failure("close", e);
        }
    }

    public boolean isClosed() {
        return closed;
    }

    /**
     * Whether writes made with {@code commit = false} wait for {@link #commit()}.
     */
    public boolean hasPendingWrites() {
        return pending;
    }

    // ==================== Introspection ====================

    public List<String> getTables() {
        ensureOpen();
        return read("list tables", () -> database.listTables(connection));
    }

    public List<String> getColumnNames(String table) {
        ensureOpen();
        return read("list columns of " + table, () -> database.listColumns(connection, table));
    }

    public List<TableSchema> getSchemas() {
        return schemas;
    }

    // ==================== Transactions ====================

    /**
     * Run a write. A failed write that was to stay pending is undone back to the
     * state before the call; a failed committing write rolls back the whole
     * transaction, pending writes included.
     */
    private <T> T write(String action, boolean commit, SqlWork<T> work) {
        Savepoint savepoint = null;
        try {
            if (pending && !commit) {
                savepoint = connection.setSavepoint();
            }
            T result = work.run();
            if (commit) {
                connection.commit();
                pending = false;
            } else {
                if (savepoint != null) {
                    connection.releaseSavepoint(savepoint);
                }
                pending = true;
            }
            return result;
        } catch (SQLException e) {
            undo(savepoint, e);
            throw failure(action, e);
        }
    }

    private void undo(Savepoint savepoint, SQLException cause) {
        try {
            if (savepoint != null) {
                connection.rollback(savepoint);
                connection.releaseSavepoint(savepoint);
            } else {
                connection.rollback();
                pending = false;
                keyValueTables.clear();
            }
        } catch (SQLException e) {
            cause.addSuppressed(e);
        }
    }

    /**
     * Run a read. Without pending writes the transaction is ended right after, so
     * the file is not kept locked between calls.
     */
    private <T> T read(String action, SqlWork<T> work) {
        try {
            T result = work.run();
            if (!pending) {
                connection.commit();
            }
            return result;
        } catch (SQLException e) {
            if (!pending) {
                try {
                    connection.rollback();
                } catch (SQLException rollbackFailure) {
                    e.addSuppressed(rollbackFailure);
                }
            }
            throw failure(action, e);
        }
    }

    @FunctionalInterface
    private interface SqlWork<T> {
        T run() throws SQLException;
    }

    // ==================== Key-value tables ====================

    /**
     * Text stored under {@code key}, or empty if the key is absent.
     */
    public Optional<String> getValue(String table, String key) {
        requireKeyValueTable(table);
        return fetch("SELECT " + KeyValueTableSchema.VALUE_COLUMN + " FROM " + table + " WHERE "
                + KeyValueTableSchema.KEY_COLUMN + " = ?", requireKey(key))
                .map(row -> row.getString(KeyValueTableSchema.VALUE_COLUMN));
    }

    /**
     * Value stored under {@code key} read back as {@code type}, or empty if the key
     * is absent. Booleans are read from the {@code "1"}/{@code "0"} written by
     * {@link #setValue}.
     */
    public <T> Optional<T> getValue(String table, String key, Class<T> type) {
        return getValue(table, key).map(text -> valueCodec.parse(text, type));
    }

    public Map<String, String> getAllValues(String table) {
        requireKeyValueTable(table);
        Map<String, String> values = new LinkedHashMap<>();
        for (Row row : fetchAll("SELECT " + KeyValueTableSchema.KEY_COLUMN + ", "
                + KeyValueTableSchema.VALUE_COLUMN + " FROM " + table)) {
            values.put(row.getString(KeyValueTableSchema.KEY_COLUMN),
                    row.getString(KeyValueTableSchema.VALUE_COLUMN));
        }
        return values;
    }

    /**
     * Store {@code value} under {@code key}, replacing any previous value, and
     * commit.
     *
     * @throws me.cogbot.domain.exception.ValueConversionException
     *             if the value is null or cannot be rendered to text
     */
    public void setValue(String table, String key, Object value) {
        requireKeyValueTable(table);
        String text = valueCodec.render(value);
        execute(database.insertOrReplace(table,
                List.of(KeyValueTableSchema.KEY_COLUMN, KeyValueTableSchema.VALUE_COLUMN)),
                requireKey(key), text);
    }

    /**
     * Remove {@code key}; no error if it is absent.
     */
    public void deleteValue(String table, String key) {
        requireKeyValueTable(table);
        execute("DELETE FROM " + table + " WHERE " + KeyValueTableSchema.KEY_COLUMN + " = ?", requireKey(key));
    }

    private void requireKeyValueTable(String table) {
        ensureOpen();
        if (!TableSchema.isIdentifier(table)) {
            throw new ContractViolationException("Invalid table name: " + table);
        }
        if (keyValueTables.contains(normalize(table))) {
            return;
        }
        List<String> columns = getColumnNames(table);
        if (columns.isEmpty()) {
            throw new ContractViolationException(
                    "Table " + table + " does not exist in " + domain + ":" + scope.label());
        }
        if (!hasKeyValueShape(columns)) {
            throw new ContractViolationException("Table " + table + " is not a key/value table, columns are "
                    + columns);
        }
        keyValueTables.add(normalize(table));
    }

    private static boolean hasKeyValueShape(List<String> columns) {
        if (columns.size() != KEY_VALUE_COLUMNS.size()) {
            return false;
        }
        for (String column : columns) {
            if (!KEY_VALUE_COLUMNS.contains(column.toLowerCase(Locale.ROOT))) {
                return false;
            }
        }
        return true;
    }

    private static String requireKey(String key) {
        if (key == null) {
            throw new IllegalArgumentException("Key must not be null");
        }
        return key;
    }

    // ==================== Helpers ====================

    private void ensureOpen() {
        if (closed) {
            throw new IllegalStateException("Connection " + domain + ":" + scope.label() + " is closed");
        }
    }

    private void forgetChangedTable(String statement) {
        Matcher matcher = TABLE_CHANGE.matcher(statement);
        if (matcher.find()) {
            keyValueTables.remove(normalize(matcher.group(1)));
        }
    }

    private static void bind(PreparedStatement statement, List<?> args) throws SQLException {
        for (int i = 0; i < args.size(); i++) {
            Object arg = args.get(i);
            if (arg instanceof Boolean bool) {
                statement.setInt(i + 1, bool ? 1 : 0);
            } else if (arg instanceof Enum<?> constant) {
                statement.setString(i + 1, constant.name());
            } else if (arg instanceof Character character) {
                statement.setString(i + 1, character.toString());
            } else {
                statement.setObject(i + 1, arg);
            }
        }
    }

    private static Row readRow(ResultSet rs) throws SQLException {
        ResultSetMetaData meta = rs.getMetaData();
        Map<String, Object> values = new LinkedHashMap<>();
        for (int i = 1; i <= meta.getColumnCount(); i++) {
            values.put(meta.getColumnLabel(i), rs.getObject(i));
        }
        return new Row(values);
    }

    private static String normalize(String table) {
        return table.toLowerCase(Locale.ROOT);
    }

    private StorageAccessException failure(String action, SQLException cause) {
        return new StorageAccessException(
                "Failed to " + action + " in " + domain + ":" + scope.label() + ": " + cause.getMessage(), cause);
    }

    @Override
    public String toString() {
        return "ScopeConnection{domain=" + domain + ", scope=" + scope.label() + ", file=" + file + "}";
    }
}
