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

package me.cogbot.domain.model;

import me.cogbot.domain.exception.SchemaDefinitionException;
import lombok.Getter;

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Immutable declaration of one table: its {@code CREATE TABLE} statement, the
 * default rows seeded into it and the {@link ReseedPolicy} that decides when
 * those rows are written.
 *
 * <p>
 * Schemas are declared by feature modules at startup and materialized lazily
 * into every scope database the first time that scope is opened. Validation
 * happens here, at declaration time: a statement that is not a table creation,
 * an unreadable table name or default rows with differing columns fail with
 * {@link SchemaDefinitionException} before any file is created.
 *
 * <p>
 * Schema drift is not handled: if an existing table no longer matches its
 * statement, the table is left as is.
 */
@Getter
public class TableSchema {

    private static final Pattern CREATE_PREFIX = Pattern.compile("^\\s*CREATE\\s+TABLE\\s",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern TABLE_NAME = Pattern.compile(
            "^\\s*CREATE\\s+TABLE\\s+(?:IF\\s+NOT\\s+EXISTS\\s+)?[`\"\\[]?([A-Za-z_][A-Za-z0-9_]*)[`\"\\]]?\\s*\\(",
            Pattern.CASE_INSENSITIVE);
    private static final Pattern IDENTIFIER = Pattern.compile("^[A-Za-z_][A-Za-z0-9_]*$");

    private final String creationStatement;
    private final String tableName;
    private final List<Map<String, Object>> defaultRows;
    private final List<String> defaultColumns;
    private final ReseedPolicy reseedPolicy;

    protected TableSchema(String creationStatement, List<? extends Map<String, ?>> defaultRows,
            ReseedPolicy reseedPolicy) {
        Objects.requireNonNull(creationStatement, "creationStatement");
        this.reseedPolicy = Objects.requireNonNull(reseedPolicy, "reseedPolicy");
        if (!CREATE_PREFIX.matcher(creationStatement).find()) {
            throw new SchemaDefinitionException(
                    "Creation statement must begin with CREATE TABLE: " + abbreviate(creationStatement));
        }
        Matcher matcher = TABLE_NAME.matcher(creationStatement);
        if (!matcher.find()) {
            throw new SchemaDefinitionException(
                    "Cannot find table name in creation statement: " + abbreviate(creationStatement));
        }
        this.creationStatement = creationStatement.trim();
        this.tableName = matcher.group(1);
        this.defaultRows = copyRows(tableName, defaultRows);
        this.defaultColumns = this.defaultRows.isEmpty()
                ? List.of()
                : List.copyOf(this.defaultRows.get(0).keySet());
    }

    /**
     * Schema without default rows, reseed policy {@link ReseedPolicy#ONCE}.
     */
    public static TableSchema of(String creationStatement) {
        return new TableSchema(creationStatement, List.of(), ReseedPolicy.ONCE);
    }

    /**
     * Schema with default rows inserted when the table is created
     * ({@link ReseedPolicy#ONCE}).
     */
    public static TableSchema of(String creationStatement, List<? extends Map<String, ?>> defaultRows) {
        return new TableSchema(creationStatement, defaultRows, ReseedPolicy.ONCE);
    }

    public static TableSchema of(String creationStatement, List<? extends Map<String, ?>> defaultRows,
            ReseedPolicy reseedPolicy) {
        return new TableSchema(creationStatement, defaultRows, reseedPolicy);
    }

    public boolean hasDefaultRows() {
        return !defaultRows.isEmpty();
    }

    /**
     * Whether this table follows the two-column {@code key}/{@code value} layout
     * used by the key-value helpers.
     */
    public boolean isKeyValue() {
        return false;
    }

    /**
     * Returns true if {@code name} can be spliced into SQL as a bare identifier.
     */
    public static boolean isIdentifier(String name) {
        return name != null && IDENTIFIER.matcher(name).matches();
    }

    @Override
    public String toString() {
        return getClass().getSimpleName() + "{table=" + tableName + ", defaults=" + defaultRows.size()
                + ", reseed=" + reseedPolicy + "}";
    }

    private static List<Map<String, Object>> copyRows(String tableName, List<? extends Map<String, ?>> rows) {
        if (rows == null || rows.isEmpty()) {
            return List.of();
        }
        Set<String> columns = null;
        List<Map<String, Object>> copy = new ArrayList<>(rows.size());
        for (Map<String, ?> row : rows) {
            if (row == null || row.isEmpty()) {
                throw new SchemaDefinitionException("Default rows of " + tableName + " must not be empty");
            }
            if (columns == null) {
                columns = row.keySet();
                for (String column : columns) {
                    if (!isIdentifier(column)) {
                        throw new SchemaDefinitionException(
                                "Invalid column name in default rows of " + tableName + ": " + column);
                    }
                }
            } else if (!columns.equals(row.keySet())) {
                throw new SchemaDefinitionException(
                        "Default rows of " + tableName + " must all have the same columns, expected " + columns
                                + " but got " + row.keySet());
            }
            copy.add(Collections.unmodifiableMap(new LinkedHashMap<>(row)));
        }
        return Collections.unmodifiableList(copy);
    }

    private static String abbreviate(String statement) {
        String flat = statement.strip().replaceAll("\\s+", " ");
        return flat.length() > 60 ? flat.substring(0, 60) + "..." : flat;
    }
}
