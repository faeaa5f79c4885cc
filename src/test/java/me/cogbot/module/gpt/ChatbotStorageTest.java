package me.cogbot.module.gpt;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.cogbot.adapter.outbound.sqlite.SqliteDatabaseAdapter;
import me.cogbot.domain.exception.StorageAccessException;
import me.cogbot.domain.service.DomainRegistryStore;
import me.cogbot.domain.service.ValueCodec;
import me.cogbot.infrastructure.config.AutoConfiguration;
import me.cogbot.infrastructure.config.BotProperties;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import static org.junit.jupiter.api.Assertions.*;

class ChatbotStorageTest {

    private static final Instant NOW = Instant.parse("2026-03-15T12:00:00Z");
    private static final long GUILD = 77L;

    @TempDir
    Path tempDir;

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();
    private DomainRegistryStore registryStore;
    private ChatbotStorage storage;

    @BeforeEach
    void setUp() {
        BotProperties properties = new BotProperties();
        properties.getStorage().setBasePath(tempDir.toString());
        registryStore = new DomainRegistryStore(properties, new SqliteDatabaseAdapter(properties),
                ValueCodec.standard());
        storage = storageAt(NOW);
        storage.registerSchemas(registryStore.get(ChatbotStorage.DOMAIN));
    }

    @AfterEach
    void tearDown() {
        registryStore.reset();
    }

    private ChatbotStorage storageAt(Instant instant) {
        return new ChatbotStorage(registryStore, objectMapper, Clock.fixed(instant, ZoneOffset.UTC));
    }

    private Chatbot create(String name, long authorId) {
        return storage.createChatbot(Chatbot.builder()
                .name(name)
                .systemPrompt("You are " + name)
                .authorId(authorId)
                .guildId(GUILD)
                .build()).orElseThrow();
    }

    private HistoryEntry entry(double timestamp, String text) throws Exception {
        return new HistoryEntry(timestamp, objectMapper.readTree("{\"role\":\"user\",\"content\":\"" + text + "\"}"));
    }

    @Test
    void createChatbot_assignsIdAndDefaults() {
        Chatbot chatbot = create("Ada", 1L);

        assertTrue(chatbot.getId() > 0);
        assertEquals(0.9, chatbot.getTemperature());
        assertEquals(512, chatbot.getMaxCompletion());
        assertEquals(4096, chatbot.getContextSize());
        assertEquals("auto", chatbot.getVisionDetail());
        assertEquals(Optional.of(chatbot), storage.getChatbot(chatbot.getId()));
    }

    @Test
    void createChatbot_rejectsDuplicateNameIgnoringCase() {
        create("Ada", 1L);

        assertTrue(storage.createChatbot(Chatbot.builder().name("ADA").systemPrompt("x").build()).isEmpty());
        assertEquals(1, storage.getChatbots().size());
    }

    @Test
    void getChatbots_filtersByAuthor() {
        create("Ada", 1L);
        create("Bob", 2L);
        create("Cy", 1L);

        assertEquals(List.of("Ada", "Cy"), storage.getChatbots(1L).stream().map(Chatbot::getName).toList());
        assertEquals(3, storage.getChatbots().size());
    }

    @Test
    void updateChatbot_returnsUpdatedRow() {
        Chatbot chatbot = create("Ada", 1L);

        Chatbot updated = storage.updateChatbot(chatbot.getId(), Map.of("temperature", 0.2, "context_size", 2048))
                .orElseThrow();

        assertEquals(0.2, updated.getTemperature());
        assertEquals(2048, updated.getContextSize());
        assertEquals(chatbot.getName(), updated.getName());
    }

    @Test
    void updateChatbot_unknownIdIsEmpty() {
        assertTrue(storage.updateChatbot(999L, Map.of("name", "x")).isEmpty());
    }

    @Test
    void updateChatbot_rejectsUnknownColumn() {
        Chatbot chatbot = create("Ada", 1L);

        assertThrows(IllegalArgumentException.class,
                () -> storage.updateChatbot(chatbot.getId(), Map.of("id = 0; --", 1)));
    }

    @Test
    void deleteChatbot_removesIt() {
        Chatbot chatbot = create("Ada", 1L);

        storage.deleteChatbot(chatbot.getId());

        assertTrue(storage.getChatbot(chatbot.getId()).isEmpty());
    }

    @Test
    void updateUsage_accumulatesTokens() {
        storage.updateUsage(5L, 100, 20);
        storage.updateUsage(5L, 50, 5);

        ChatUsage usage = storage.getUser(5L).orElseThrow();

        assertEquals(150, usage.promptTokens());
        assertEquals(25, usage.completionTokens());
        assertEquals(20263, usage.trackingMonth());
        assertFalse(usage.banned());
        assertTrue(storage.getUser(6L).isEmpty());
    }

    @Test
    void getUser_resetsCountersOnNewMonth() {
        storage.updateUsage(5L, 100, 20);

        ChatUsage usage = storageAt(NOW.plus(Duration.ofDays(30))).getUser(5L).orElseThrow();

        assertEquals(20264, usage.trackingMonth());
        assertEquals(0, usage.promptTokens());
        assertEquals(0, usage.completionTokens());
    }

    @Test
    void banAndUnbanUser() {
        storage.banUser(9L);
        assertTrue(storage.getUser(9L).orElseThrow().banned());

        storage.unbanUser(9L);
        assertFalse(storage.getUser(9L).orElseThrow().banned());
        assertEquals(1, storage.getUsers().size());
    }

    @Test
    void saveHistory_dropsExpiredMessages() throws Exception {
        Chatbot chatbot = create("Ada", 1L);
        double now = NOW.getEpochSecond();
        HistoryEntry recent = entry(now - 60.5, "recent");

        storage.saveHistory(GUILD, chatbot.getId(), List.of(entry(now - 2 * 86400, "old"), recent));

        assertEquals(List.of(recent), storage.loadHistory(GUILD, chatbot.getId()));
        assertTrue(storage.loadHistory(GUILD + 1, chatbot.getId()).isEmpty());
    }

    @Test
    void saveHistory_replacesPreviousHistory() throws Exception {
        Chatbot chatbot = create("Ada", 1L);
        double now = NOW.getEpochSecond();
        storage.saveHistory(GUILD, chatbot.getId(), List.of(entry(now - 10, "a"), entry(now - 5, "b")));

        storage.saveHistory(GUILD, chatbot.getId(), List.of(entry(now - 1, "c")));

        assertEquals(List.of(entry(now - 1, "c")), storage.loadHistory(GUILD, chatbot.getId()));
    }

    @Test
    void saveHistory_keepsPreviousHistoryWhenWriteFails() throws Exception {
        Chatbot chatbot = create("Ada", 1L);
        double now = NOW.getEpochSecond();
        List<HistoryEntry> previous = List.of(entry(now - 10, "a"));
        storage.saveHistory(GUILD, chatbot.getId(), previous);
        List<HistoryEntry> clashing = List.of(entry(now - 5, "x"), entry(now - 5, "x"));

        assertThrows(StorageAccessException.class, () -> storage.saveHistory(GUILD, chatbot.getId(), clashing));
        storage.clearHistory(GUILD, chatbot.getId() + 1);

        assertEquals(previous, storage.loadHistory(GUILD, chatbot.getId()));
    }

    @Test
    void getLastChatbotUsed_followsLatestMessage() throws Exception {
        Chatbot ada = create("Ada", 1L);
        Chatbot bob = create("Bob", 1L);
        double now = NOW.getEpochSecond();

        assertTrue(storage.getLastChatbotUsed(GUILD).isEmpty());

        storage.saveHistory(GUILD, ada.getId(), List.of(entry(now - 100, "a")));
        storage.saveHistory(GUILD, bob.getId(), List.of(entry(now - 10, "b")));

        assertEquals(Optional.of(bob), storage.getLastChatbotUsed(GUILD));
    }

    @Test
    void clearHistory_removesSessionMessages() throws Exception {
        Chatbot chatbot = create("Ada", 1L);
        storage.saveHistory(GUILD, chatbot.getId(), List.of(entry(NOW.getEpochSecond(), "a")));

        storage.clearHistory(GUILD, chatbot.getId());

        assertTrue(storage.loadHistory(GUILD, chatbot.getId()).isEmpty());
    }
}
