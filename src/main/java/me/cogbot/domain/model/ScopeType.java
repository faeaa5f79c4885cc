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
 * Key under which a domain registers its table schemas. Every
 * {@link TypedScope} of a given kind shares one typed scope type; a
 * {@link NamedScope} is its own type.
 *
 * @param name
 *            kind or scope name, lower-cased
 * @param typed
 *            {@code true} for a typed-identity kind, {@code false} for a named
 *            scope
 */
public record ScopeType(String name, boolean typed) {

    public ScopeType {
        Objects.requireNonNull(name, "name");
        name = name.trim().toLowerCase(Locale.ROOT);
        if (name.isEmpty()) {
            throw new IllegalArgumentException("Scope type name is blank");
        }
    }

    public static ScopeType typed(String kind) {
        return new ScopeType(kind, true);
    }

    public static ScopeType named(String name) {
        return new ScopeType(name, false);
    }

    public static ScopeType global() {
        return named(NamedScope.GLOBAL_NAME);
    }

    @Override
    public String toString() {
        return (typed ? "typed:" : "named:") + name;
    }
}
