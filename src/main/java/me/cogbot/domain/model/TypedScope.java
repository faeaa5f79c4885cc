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
 * Scope identified by an entity kind and its numeric id, e.g. guild #123.
 *
 * @param kind
 *            entity kind, lower-cased on construction
 * @param id
 *            entity id
 */
public record TypedScope(String kind, long id) implements Scope {

    public TypedScope {
        Objects.requireNonNull(kind, "kind");
        kind = kind.trim().toLowerCase(Locale.ROOT);
        if (kind.isEmpty()) {
            throw new IllegalArgumentException("Scope kind is blank");
        }
    }

    public static TypedScope of(String kind, long id) {
        return new TypedScope(kind, id);
    }

    @Override
    public ScopeType type() {
        return ScopeType.typed(kind);
    }

    @Override
    public String label() {
        return kind + "#" + id;
    }
}
