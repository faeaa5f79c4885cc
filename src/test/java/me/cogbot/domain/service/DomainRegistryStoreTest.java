package me.cogbot.domain.service;

import me.cogbot.adapter.outbound.sqlite.SqliteDatabaseAdapter;
import me.cogbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.*;

class DomainRegistryStoreTest {

    @TempDir
    Path tempDir;

    private DomainRegistryStore store;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().setBasePath(tempDir.resolve("cogs").toString());
        properties.getStorage().setResourcesPath(tempDir.resolve("resources").toString());
        store = new DomainRegistryStore(properties, new SqliteDatabaseAdapter(properties), ValueCodec.standard());
    }

    @Test
    void get_returnsSameRegistryForSameName() {
        DomainRegistry registry = store.get("msgboard");

        assertSame(registry, store.get("MsgBoard"));
        assertEquals("msgboard", registry.getName());
        assertTrue(Files.isDirectory(tempDir.resolve("cogs/msgboard")));
    }

    @Test
    void get_rejectsInvalidNames() {
        assertThrows(IllegalArgumentException.class, () -> store.get("../escape"));
        assertThrows(IllegalArgumentException.class, () -> store.get(""));
        assertThrows(IllegalArgumentException.class, () -> store.get("with space"));
    }

    @Test
    void getDomainNames_isSorted() {
        store.get("gpt");
        store.get("colors");

        assertEquals(Set.of("colors", "gpt"), store.getDomainNames());
        assertEquals("colors", store.getDomainNames().iterator().next());
    }

    @Test
    void getResourcePath_resolvesInsideResources() {
        assertEquals(tempDir.resolve("resources/fonts/a.ttf"), store.getResourcePath("fonts/a.ttf"));
        assertThrows(IllegalArgumentException.class, () -> store.getResourcePath("../secret"));
    }

    @Test
    void closeAll_keepsRegistries() {
        DomainRegistry registry = store.get("gpt");
        ScopeConnection connection = registry.get("global");

        store.closeAll();

        assertTrue(connection.isClosed());
        assertSame(registry, store.get("gpt"));
    }

    @Test
    void reset_forgetsRegistries() {
        DomainRegistry registry = store.get("gpt");
        ScopeConnection connection = registry.get("global");

        store.reset();

        assertTrue(connection.isClosed());
        assertTrue(store.getDomainNames().isEmpty());
        assertNotSame(registry, store.get("gpt"));
    }
}
