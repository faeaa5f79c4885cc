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

/**
 * Unit of storage isolation inside a domain. A scope is either a
 * {@link TypedScope} (a kind plus a numeric id, such as a guild or a user) or a
 * {@link NamedScope} (an arbitrary name such as {@code global}).
 *
 * <p>
 * Both variants are normalized on construction, so two scopes that denote the
 * same tenant are {@code equals} and share one cached connection.
 */
public interface Scope {

    /**
     * Schema registration key of this scope. Schemas registered against this
     * type are materialized into the scope's database on open.
     */
    ScopeType type();

    /**
     * Human-readable label used in logs and error messages.
     */
    String label();
}
