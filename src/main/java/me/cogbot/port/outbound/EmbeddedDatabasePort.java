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

package me.cogbot.port.outbound;

import java.nio.file.Path;
import java.sql.Connection;
import java.sql.SQLException;
import java.util.List;

/**
 * Port to the embedded, file-based SQL engine backing every scope database.
 * Provides the handle factory plus the few engine-specific statements the
 * broker needs (catalog queries and conflict-aware inserts).
 */
public interface EmbeddedDatabasePort {

    /**
     * Open (creating if needed) the database file at {@code file}. The returned
     * connection has auto-commit disabled.
     */
    Connection open(Path file) throws SQLException;

    /**
     * File extension of database files, without the dot (e.g. {@code "db"}).
     */
    String getFileExtension();

    /**
     * Names of all user tables in the database.
     */
    List<String> listTables(Connection connection) throws SQLException;

    /**
     * Column names of {@code table} in declaration order, empty if the table does
     * not exist.
     */
    List<String> listColumns(Connection connection, String table) throws SQLException;

    /**
     * Parameterized insert that silently skips rows conflicting with an existing
     * key.
     */
    String insertOrIgnore(String table, List<String> columns);

    /**
     * Parameterized insert that replaces the row holding the same key.
     */
    String insertOrReplace(String table, List<String> columns);
}
