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
import me.cogbot.domain.exception.ValueConversionException;
import me.cogbot.domain.service.ValueCodec;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Two-column {@code key}/{@code value} table, both {@code TEXT}. Typically holds
 * the settings of a module for one scope.
 *
 * <p>
 * Defaults to {@link ReseedPolicy#ALWAYS}: a settings key added in a later
 * release shows up in every existing scope database on its next open, while
 * values already edited by users stay untouched.
 */
public final class KeyValueTableSchema extends TableSchema {

    public static final String KEY_COLUMN = "key";
    public static final String VALUE_COLUMN = "value";

    private KeyValueTableSchema(String tableName, List<Map<String, Object>> rows, ReseedPolicy reseedPolicy) {
        super(creationStatementFor(tableName), rows, reseedPolicy);
    }

    public static KeyValueTableSchema named(String tableName) {
        return named(tableName, Map.of(), ReseedPolicy.ALWAYS);
    }

    /**
     * Key-value table seeded with {@code defaults}. Values are stored as text
     * with the same rules as
     * {@link me.cogbot.domain.service.ScopeConnection#setValue}.
     */
    public static KeyValueTableSchema named(String tableName, Map<String, ?> defaults) {
        return named(tableName, defaults, ReseedPolicy.ALWAYS);
    }

    public static KeyValueTableSchema named(String tableName, Map<String, ?> defaults, ReseedPolicy reseedPolicy) {
        if (!isIdentifier(tableName)) {
            throw new SchemaDefinitionException("Invalid key-value table name: " + tableName);
        }
        if (defaults == null) {
            throw new SchemaDefinitionException("Defaults of " + tableName + " must be a map, not null");
        }
        List<Map<String, Object>> rows = new ArrayList<>(defaults.size());
        for (Map.Entry<String, ?> entry : defaults.entrySet()) {
            if (entry.getKey() == null) {
                throw new SchemaDefinitionException("Null key in defaults of " + tableName);
            }
            Map<String, Object> row = new LinkedHashMap<>();
            row.put(KEY_COLUMN, entry.getKey());
            row.put(VALUE_COLUMN, render(tableName, entry.getKey(), entry.getValue()));
            rows.add(row);
        }
        return new KeyValueTableSchema(tableName, rows, reseedPolicy);
    }

    /**
     * Default values as stored, in declaration order.
     */
    public Map<String, String> getDefaultValues() {
        Map<String, String> values = new LinkedHashMap<>();
        for (Map<String, Object> row : getDefaultRows()) {
            values.put((String) row.get(KEY_COLUMN), (String) row.get(VALUE_COLUMN));
        }
        return values;
    }

    @Override
    public boolean isKeyValue() {
        return true;
    }

    static String creationStatementFor(String tableName) {
        return "CREATE TABLE IF NOT EXISTS " + tableName + " (" + KEY_COLUMN + " TEXT PRIMARY KEY, "
                + VALUE_COLUMN + " TEXT)";
    }

    private static String render(String tableName, String key, Object value) {
        try {
            return ValueCodec.standard().render(value);
        } catch (ValueConversionException e) {
            throw new SchemaDefinitionException(
                    "Default value of " + tableName + "." + key + " cannot be stored: " + e.getMessage());
        }
    }
}
