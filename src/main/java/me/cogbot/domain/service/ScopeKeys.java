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

import me.cogbot.domain.model.NamedScope;
import me.cogbot.domain.model.Scope;
import me.cogbot.domain.model.TypedScope;

import java.util.Locale;
import java.util.Objects;
import java.util.regex.Pattern;

/**
 * Derives the file-system key of a scope database. The key is stable across
 * restarts: the same scope always maps to the same file name.
 */
public final class ScopeKeys {

    private static final Pattern UNSAFE_CHARS = Pattern.compile("[^a-z0-9_]");

    private ScopeKeys() {
    }

    /**
     * {@code "{kind}_{id}"} for a typed scope, the sanitized name for a named one.
     */
    public static String storageKey(Scope scope) {
        Objects.requireNonNull(scope, "scope");
        if (scope instanceof TypedScope typed) {
            return sanitize(typed.kind() + "_" + typed.id());
        }
        if (scope instanceof NamedScope named) {
            return sanitize(named.name());
        }
        throw new IllegalArgumentException("Unsupported scope type: " + scope.getClass().getName());
    }

    static String sanitize(String raw) {
        return UNSAFE_CHARS.matcher(raw.toLowerCase(Locale.ROOT)).replaceAll("_");
    }
}
