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

package me.cogbot.domain.exception;

/**
 * Thrown when a table schema is declared with an invalid creation statement,
 * non-uniform default rows or an identifier that cannot be used in SQL.
 * Raised at declaration time, before any database is touched.
 */
public class SchemaDefinitionException extends IllegalArgumentException {

    private static final long serialVersionUID = 1L;

    public SchemaDefinitionException(String message) {
        super(message);
    }
}
