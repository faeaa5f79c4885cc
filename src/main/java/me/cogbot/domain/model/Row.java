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

import lombok.EqualsAndHashCode;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;

/**
 * One result row, columns in statement order. Values are the objects returned
 * by the engine ({@code Long}/{@code Integer}, {@code Double}, {@code String},
 * {@code byte[]} or {@code null}); the typed getters coerce between them.
 */
@EqualsAndHashCode
public final class Row {

    private final Map<String, Object> values;

    public Row(Map<String, ?> values) {
        Objects.requireNonNull(values, "values");
        this.values = Collections.unmodifiableMap(new LinkedHashMap<>(values));
    }

    public List<String> columns() {
        return List.copyOf(values.keySet());
    }

    public boolean has(String column) {
        return values.containsKey(column) || findIgnoreCase(column) != null;
    }

    /**
     * Raw value of {@code column}.
     *
     * @throws IllegalArgumentException
     *             if the row has no such column
     */
    public Object get(String column) {
        if (values.containsKey(column)) {
            return values.get(column);
        }
        String actual = findIgnoreCase(column);
        if (actual == null) {
            throw new IllegalArgumentException("No column '" + column + "' in row " + values.keySet());
        }
        return values.get(actual);
    }

    public String getString(String column) {
        Object value = get(column);
        return value == null ? null : String.valueOf(value);
    }

    public Long getLong(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.longValue();
        }
        return Long.parseLong(value.toString().trim());
    }

    public Integer getInt(String column) {
        Long value = getLong(column);
        return value == null ? null : Math.toIntExact(value);
    }

    public Double getDouble(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Number number) {
            return number.doubleValue();
        }
        return Double.parseDouble(value.toString().trim());
    }

    /**
     * Boolean view of an integer or text column: non-zero numbers, {@code "1"}
     * and {@code "true"} are true.
     */
    public Boolean getBoolean(String column) {
        Object value = get(column);
        if (value == null) {
            return null;
        }
        if (value instanceof Boolean bool) {
            return bool;
        }
        if (value instanceof Number number) {
            return number.longValue() != 0;
        }
        String text = value.toString().trim();
        if ("true".equalsIgnoreCase(text)) {
            return true;
        }
        if ("false".equalsIgnoreCase(text) || text.isEmpty()) {
            return false;
        }
        return Long.parseLong(text) != 0;
    }

    public Map<String, Object> asMap() {
        return values;
    }

    @Override
    public String toString() {
        return "Row" + values;
    }

    private String findIgnoreCase(String column) {
        for (String key : values.keySet()) {
            if (key.equalsIgnoreCase(column)) {
                return key;
            }
        }
        return null;
    }
}
