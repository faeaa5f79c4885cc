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

package me.cogbot;

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for CogBot storage.
 *
 * <p>
 * Every feature module of the bot keeps its state through the storage broker:
 * one folder per module, one embedded SQLite database per scope (guild, user
 * or a named scope such as {@code global}), with tables declared by the module
 * and created on first use.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Modules            → MessageBoardStorage, ChatbotStorage (StorageComponent)
 * Domain Layer       → DomainRegistryStore, DomainRegistry, ScopeConnection
 * Infrastructure     → SqliteDatabaseAdapter (EmbeddedDatabasePort)
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under
 * {@code bot.storage.*}.
 *
 * @version 1.0
 * @since 1.0
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class CogBotApplication {

    public static void main(String[] args) {
        SpringApplication.run(CogBotApplication.class, args);
    }

}
