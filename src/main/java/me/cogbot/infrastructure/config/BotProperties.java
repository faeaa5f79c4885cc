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

package me.cogbot.infrastructure.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Centralized configuration properties for the bot, bound from
 * application.properties.
 *
 * <p>
 * All bot configuration is organized under the {@code bot.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - where module databases live and how they are
 * laid out</li>
 * <li>{@link SqliteProperties} - settings of the embedded SQLite engine</li>
 * </ul>
 *
 * <p>
 * Uses Spring Boot's {@link ConfigurationProperties} for type-safe property
 * binding.
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "bot")
@Data
public class BotProperties {

    private StorageProperties storage = new StorageProperties();

    @Data
    public static class StorageProperties {
        /** Root directory; each module gets {@code <basePath>/<module>}. */
        private String basePath = "${user.home}/.cogbot/cogs";
        /** Subdirectory of a module folder holding one database per scope. */
        private String dataDirectory = "data";
        private String assetsDirectory = "assets";
        /** Resources shared by all modules (fonts, images...). */
        private String resourcesPath = "common/resources";
        private SqliteProperties sqlite = new SqliteProperties();

        /**
         * Base path with {@code ${user.home}} expanded, absolute and normalized.
         */
        public Path resolveBasePath() {
            return expand(basePath);
        }

        public Path resolveResourcesPath() {
            return expand(resourcesPath);
        }

        private static Path expand(String path) {
            return Paths.get(path.replace("${user.home}", System.getProperty("user.home")))
                    .toAbsolutePath().normalize();
        }
    }

    @Data
    public static class SqliteProperties {
        private String fileExtension = "db";
        private int busyTimeoutMs = 5000;
        /** One of DELETE, TRUNCATE, PERSIST, MEMORY, WAL, OFF. */
        private String journalMode = "DELETE";
        private boolean foreignKeys = true;
    }
}
