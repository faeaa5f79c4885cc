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

import me.cogbot.domain.exception.ContractViolationException;
import me.cogbot.domain.exception.SchemaDefinitionException;
import me.cogbot.domain.exception.StorageAccessException;
import me.cogbot.domain.model.NamedScope;
import me.cogbot.domain.model.Scope;
import me.cogbot.domain.model.ScopeType;
import me.cogbot.domain.model.TableSchema;
import me.cogbot.domain.model.TypedScope;
import me.cogbot.port.outbound.EmbeddedDatabasePort;
import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.stream.Stream;

/**
 * Storage namespace of one feature module (a domain).
 *
 * <p>
 * Holds the table schemas the module registered per {@link ScopeType} and
 * caches one {@link ScopeConnection} per scope. Databases live in
 * {@code <folder>/data/<scope key>.<ext>}; the connection of a scope is created,
 * and its file bootstrapped, on the first {@link #get(Scope)}.
 *
 * <p>
 * Methods are synchronized so at most one connection exists per scope. The
 * connections themselves are not thread-safe.
 */
@Slf4j
public class DomainRegistry {

    private static final String[] SIDECAR_SUFFIXES = { "", "-journal", "-wal", "-shm" };

    @Getter
    private final String name;
    @Getter
    private final Path folder;
    @Getter
    private final Path dataFolder;
    private final String assetsDirectory;
    private final EmbeddedDatabasePort database;
    private final ValueCodec valueCodec;

    private final Map<Scope, ScopeConnection> connections = new LinkedHashMap<>();
    private final Map<ScopeType, List<TableSchema>> schemas = new HashMap<>();
    /** Storage key to the scope that first resolved to it. */
    private final Map<String, Scope> claimedKeys = new HashMap<>();

    public DomainRegistry(String name, Path folder, String dataDirectory, String assetsDirectory,
            EmbeddedDatabasePort database, ValueCodec valueCodec) {
        this.name = Objects.requireNonNull(name, "name");
        this.folder = Objects.requireNonNull(folder, "folder");
        this.dataFolder = folder.resolve(dataDirectory);
        this.assetsDirectory = assetsDirectory;
        this.database = Objects.requireNonNull(database, "database");
        this.valueCodec = Objects.requireNonNull(valueCodec, "valueCodec");
        createDirectories(folder);
    }

    // ==================== Schemas ====================

    /**
     * Associate schemas with a scope type, replacing any previous registration.
     * Meant for module startup; already open connections keep the schemas they
     * were opened with.
     */
    public synchronized void registerSchemas(ScopeType scopeType, TableSchema... tableSchemas) {
        Objects.requireNonNull(scopeType, "scopeType");
        Set<String> tables = new HashSet<>();
        for (TableSchema schema : tableSchemas) {
            Objects.requireNonNull(schema, "schema");
            if (!tables.add(schema.getTableName().toLowerCase(Locale.ROOT))) {
                throw new SchemaDefinitionException(
                        "Table " + schema.getTableName() + " registered twice for " + scopeType + " in " + name);
            }
        }
        schemas.put(scopeType, List.of(tableSchemas));
        log.debug("[Storage] {} registered {} schema(s) for {}", name, tableSchemas.length, scopeType);
    }

    public synchronized List<TableSchema> getRegisteredSchemas(ScopeType scopeType) {
        return schemas.getOrDefault(scopeType, List.of());
    }

    // ==================== Connections ====================

    /**
     * Connection of {@code scope}, opened and bootstrapped on first call. Later
     * calls return the same instance until it is closed or deleted.
     *
     * @throws ContractViolationException
     *             if another scope already resolved to the same storage file
     */
    public synchronized ScopeConnection get(Scope scope) {
        Objects.requireNonNull(scope, "scope");
        ScopeConnection existing = connections.get(scope);
        if (existing != null) {
            return existing;
        }
        Path file = claimFile(scope);
        createDirectories(dataFolder);
        ScopeConnection connection = new ScopeConnection(name, scope, file, getRegisteredSchemas(scope.type()),
                database, valueCodec);
        connections.put(scope, connection);
        return connection;
    }

    /**
     * Connection of the named scope {@code scopeName}, e.g. {@code "global"}.
     */
    public ScopeConnection get(String scopeName) {
        return get(NamedScope.of(scopeName));
    }

    public ScopeConnection get(String kind, long id) {
        return get(TypedScope.of(kind, id));
    }

    public synchronized List<ScopeConnection> getAll() {
        return List.copyOf(connections.values());
    }

    public synchronized boolean isOpen(Scope scope) {
        return connections.containsKey(scope);
    }

    /**
     * Database file backing {@code scope}, whether or not it exists yet.
     */
    public Path getFile(Scope scope) {
        return dataFolder.resolve(ScopeKeys.storageKey(scope) + "." + database.getFileExtension());
    }

    public synchronized void close(Scope scope) {
        ScopeConnection connection = connections.remove(Objects.requireNonNull(scope, "scope"));
        if (connection != null) {
            connection.close();
        }
    }

    /**
     * Close every open connection of this domain. All connections are released
     * even if one fails; the first failure is rethrown.
     */
    public synchronized void closeAll() {
        RuntimeException failure = null;
        for (ScopeConnection connection : connections.values()) {
            try {
                connection.close();
            } catch (RuntimeException e) {
                if (failure == null) {
                    failure = e;
                } else {
                    failure.addSuppressed(e);
                }
            }
        }
        int closed = connections.size();
        connections.clear();
        if (closed > 0) {
            log.info("[Storage] Closed {} connection(s) of {}", closed, name);
        }
        if (failure != null) {
            throw failure;
        }
    }

    /**
     * Close the connection of {@code scope} if open and delete its database file.
     * The next {@link #get(Scope)} recreates it with fresh defaults.
     */
    public synchronized void delete(Scope scope) {
        close(scope);
        Path file = getFile(scope);
        deleteWithSidecars(file);
        log.info("[Storage] Deleted {}:{} ({})", name, scope.label(), file.getFileName());
    }

    /**
     * Close every connection and delete every database file of this domain.
     */
    public synchronized void deleteAll() {
        closeAll();
        if (!Files.isDirectory(dataFolder)) {
            return;
        }
        String suffix = "." + database.getFileExtension();
        List<Path> files = new ArrayList<>();
        try (Stream<Path> paths = Files.list(dataFolder)) {
            paths.filter(Files::isRegularFile)
                    .filter(p -> p.getFileName().toString().endsWith(suffix))
                    .forEach(files::add);
        } catch (IOException e) {
            throw new StorageAccessException("Failed to list " + dataFolder, e);
        }
        for (Path file : files) {
            deleteWithSidecars(file);
        }
        log.info("[Storage] Deleted {} database(s) of {}", files.size(), name);
    }

    // ==================== Folders ====================

    /**
     * Subfolder {@code subfolderName} of this domain's folder.
     *
     * @param create
     *            if {@code true}, create it when missing
     */
    public Path getSubfolder(String subfolderName, boolean create) {
        Objects.requireNonNull(subfolderName, "subfolderName");
        Path subfolder = folder.resolve(subfolderName).normalize();
        if (!subfolder.startsWith(folder) || subfolder.equals(folder)) {
            throw new IllegalArgumentException("Path traversal blocked: " + subfolderName);
        }
        if (create) {
            createDirectories(subfolder);
        }
        return subfolder;
    }

    public Path getAssetsPath() {
        return getSubfolder(assetsDirectory, false);
    }

    // ==================== Internals ====================

    private Path claimFile(Scope scope) {
        String key = ScopeKeys.storageKey(scope);
        Scope owner = claimedKeys.putIfAbsent(key, scope);
        if (owner != null && !owner.equals(scope)) {
            throw new ContractViolationException("Scopes " + owner.label() + " and " + scope.label()
                    + " both resolve to storage key '" + key + "' in " + name);
        }
        return getFile(scope);
    }

    private static void deleteWithSidecars(Path file) {
        for (String sidecar : SIDECAR_SUFFIXES) {
            Path path = file.resolveSibling(file.getFileName() + sidecar);
            try {
                Files.deleteIfExists(path);
            } catch (IOException e) {
                throw new StorageAccessException("Failed to delete " + path, e);
            }
        }
    }

    private static void createDirectories(Path path) {
        try {
            Files.createDirectories(path);
        } catch (IOException e) {
            throw new StorageAccessException("Failed to create directory " + path, e);
        }
    }

    @Override
    public String toString() {
        return "DomainRegistry{name=" + name + ", folder=" + folder + "}";
    }
}
