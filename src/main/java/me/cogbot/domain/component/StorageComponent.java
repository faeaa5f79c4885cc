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

import me.cogbot.domain.service.DomainRegistry;

/**
 * Feature module keeping its state in the storage broker. At startup every
 * enabled storage component gets the registry of its domain and declares the
 * tables it needs for each scope type.
 */
public interface StorageComponent extends Component {

    @Override
    default String getComponentType() {
        return "storage";
    }

    /**
     * Domain (module) name; also the name of the module's storage folder.
     */
    String getDomainName();

    /**
     * Declare the table schemas of this module.
     *
     * @param registry
     *            registry of {@link #getDomainName()}
     */
    void registerSchemas(DomainRegistry registry);
}
