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

import me.cogbot.infrastructure.config.BotProperties;
import me.cogbot.port.outbound.EmbeddedDatabasePort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.nio.file.Path;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TreeSet;
import java.util.concurrent.ConcurrentHashMap;
import java.util.regex.Pattern;

/**
 * Application-wide map from domain name to {@link DomainRegistry}. Modules that
 * ask for the same name get the same registry, so independently initialized
 * components share storage without explicit wiring.
 *
 * <p>
 * Owned by the Spring context; {@link #reset()} drops every registry for test
 * isolation.
 */
@Service
@Slf4j
public class DomainRegistryStore {

    private static final Pattern DOMAIN_NAME = Pattern.compile("^[a-z0-9][a-z0-9_-]{0,63}$");

    @Getter
    private final Path basePath;
    private final Path resourcesPath;
    private final String dataDirectory;
    private final String assetsDirectory;
    private final EmbeddedDatabasePort database;
    private final ValueCodec valueCodec;

    private final Map<String, DomainRegistry> registries = new ConcurrentHashMap<>();

    public DomainRegistryStore(BotProperties properties, EmbeddedDatabasePort database, ValueCodec valueCodec) {
        BotProperties.StorageProperties storage = properties.getStorage();
        this.basePath = storage.resolveBasePath();
        this.resourcesPath = storage.resolveResourcesPath();
        this.dataDirectory = storage.getDataDirectory();
        this.assetsDirectory = storage.getAssetsDirectory();
        this.database = Objects.requireNonNull(database, "database");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
    }

    /**
     * Registry of {@code domainName} (case-insensitive), created on first use.
     */
    public DomainRegistry get(String domainName) {
        String name = normalizeName(domainName);
        return registries.computeIfAbsent(name, this::createRegistry);
    }

    public Set<String> getDomainNames() {
        return new TreeSet<>(registries.keySet());
    }

    /**
     * Path of a resource shared by every module (fonts, images...).
     */
    public Path getResourcePath(String relativePath) {
        Objects.requireNonNull(relativePath, "relativePath");
        Path resolved = resourcesPath.resolve(relativePath).normalize();
        if (!resolved.startsWith(resourcesPath)) {
            throw new IllegalArgumentException("Path traversal blocked: " + relativePath);
        }
        return resolved;
    }

    /**
     * Close every connection of every domain. Registries and their schema
     * registrations are kept.
     */
    public void closeAll() {
        RuntimeException failure = null;
        for (DomainRegistry registry : registries.values()) {
            try {
                registry.closeAll();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Close everything and forget all registries; the next {@link #get(String)}
     * starts from an empty registry.
     */
    public void reset() {
        try {
            closeAll();
        } finally {
            registries.clear();
        }
    }

    private DomainRegistry createRegistry(String name) {
        log.info("[Storage] Creating registry for module: {}", name);
        return new DomainRegistry(name, basePath.resolve(name), dataDirectory, assetsDirectory, database,
                valueCodec);
    }

    private static String normalizeName(String domainName) {
        Objects.requireNonNull(domainName, "domainName");
        String name = domainName.trim().toLowerCase(Locale.ROOT);
        if (!DOMAIN_NAME.matcher(name).matches()) {
            throw new IllegalArgumentException("Invalid module name: '" + domainName + "'");
        }
        return name;
    }
}
