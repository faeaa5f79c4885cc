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

package me.cogbot.domain.component;

/**
 * Base interface for all components of the bot. Components provide modular,
 * pluggable functionality with a consistent lifecycle contract.
 */
public interface Component {

    /**
     * Returns the type identifier for this component.
     *
     * @return the component type (e.g., "storage")
     */
    String getComponentType();

    /**
     * Called once after the component's storage is registered. Default
     * implementation does nothing.
     */
    default void initialize() {
        // Default no-op
    }

    /**
     * Cleans up component resources on shutdown. Default implementation does
     * nothing.
     */
    default void destroy() {
        // Default no-op
    }

    /**
     * Disabled components are skipped at startup.
     *
     * @return true if the component is enabled, false otherwise
     */
    default boolean isEnabled() {
        return true;
    }
}
