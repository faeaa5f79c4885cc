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

import java.util.Locale;
import java.util.Objects;

/**
 * Scope identified by a free-form name, typically {@link #GLOBAL}.
 *
 * @param name
 *            scope name, trimmed and lower-cased on construction
 */
public record NamedScope(String name) implements Scope {

    public static final String GLOBAL_NAME = "global";
    public static final NamedScope GLOBAL = new NamedScope(GLOBAL_NAME);

    public NamedScope {
        Objects.requireNonNull(name, "name");
        name = name.trim().toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Scope name is blank");
        }
    }

    public static NamedScope of(String name) {
        return new NamedScope(name);
    }

    @Override
    public ScopeType type() {
        return ScopeType.named(name);
    }

    @Override
    public String label() {
        return name;
    }
}
