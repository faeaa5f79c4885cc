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

package me.cogbot.module.gpt;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.cogbot.domain.component.StorageComponent;
import me.cogbot.domain.exception.StorageAccessException;
import me.cogbot.domain.exception.ValueConversionException;
import me.cogbot.domain.model.NamedScope;
import me.cogbot.domain.model.Row;
import me.cogbot.domain.model.ScopeType;
import me.cogbot.domain.model.TableSchema;
import me.cogbot.domain.service.DomainRegistry;
import me.cogbot.domain.service.DomainRegistryStore;
import me.cogbot.domain.service.ScopeConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Storage of the chatbot module.
 *
 * <p>
 * Chatbots and user usage live in the global database; every guild keeps the
 * history of its chat sessions in its own database.
 */
@Component
@Slf4j
public class ChatbotStorage implements StorageComponent {

    public static final String DOMAIN = "gpt";
    public static final String GUILD_KIND = "guild";

    static final Duration HISTORY_COMPLETION_EXPIRATION = Duration.ofHours(24);

    private static final Set<String> UPDATABLE_COLUMNS = Set.of("name", "system_prompt", "temperature",
            "max_completion", "context_size", "vision_detail", "author_id", "guild_id");

    private final DomainRegistryStore registryStore;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    public ChatbotStorage(DomainRegistryStore registryStore, ObjectMapper objectMapper, Clock clock) {
        this.registryStore = registryStore;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    @Override
    public String getDomainName() {
        return DOMAIN;
    }

    @Override
    public void registerSchemas(DomainRegistry registry) {
        registry.registerSchemas(ScopeType.global(),
                TableSchema.of("""
                        CREATE TABLE IF NOT EXISTS chatbots (
                            id INTEGER PRIMARY KEY,
                            name TEXT,
                            system_prompt TEXT,
                            temperature REAL DEFAULT 0.9,
                            max_completion INTEGER DEFAULT 512,
                            context_size INTEGER DEFAULT 4096,
                            vision_detail TEXT DEFAULT 'auto',
                            author_id INTEGER,
                            guild_id INTEGER
                        )"""),
                TableSchema.of("""
                        CREATE TABLE IF NOT EXISTS users (
                            user_id INTEGER PRIMARY KEY,
                            tracking_month INTEGER,
                            prompt_tokens INTEGER DEFAULT 0,
                            completion_tokens INTEGER DEFAULT 0,
                            banned BOOLEAN DEFAULT FALSE
                        )"""));
        registry.registerSchemas(ScopeType.typed(GUILD_KIND),
                TableSchema.of("""
                        CREATE TABLE IF NOT EXISTS sessions (
                            chatbot_id INTEGER,
                            timestamp REAL,
                            payload TEXT,
                            PRIMARY KEY (chatbot_id, timestamp)
                        )"""));
    }

    @Override
    public void destroy() {
        data().closeAll();
    }

    // ==================== Chatbots ====================

    public Optional<Chatbot> getChatbot(long chatbotId) {
        return global().fetch("SELECT * FROM chatbots WHERE id = ?", chatbotId).map(Chatbot::fromRow);
    }

    public List<Chatbot> getChatbots() {
        return toChatbots(global().fetchAll("SELECT * FROM chatbots ORDER BY id"));
    }

    public List<Chatbot> getChatbots(long authorId) {
        return toChatbots(global().fetchAll("SELECT * FROM chatbots WHERE author_id = ? ORDER BY id", authorId));
    }

    /**
     * Create a chatbot.
     *
     * @return the stored chatbot with its assigned id, or empty if a chatbot
     *         with the same name (ignoring case) already exists
     */
    public Optional<Chatbot> createChatbot(Chatbot chatbot) {
        String name = chatbot.getName().toLowerCase(Locale.ROOT);
        boolean taken = getChatbots().stream()
                .anyMatch(existing -> existing.getName() != null
                        && existing.getName().toLowerCase(Locale.ROOT).equals(name));
        if (taken) {
            log.debug("[Chatbot] Name already used: {}", chatbot.getName());
            return Optional.empty();
        }
        return global().evaluate("INSERT INTO chatbots VALUES (NULL, ?, ?, ?, ?, ?, ?, ?, ?) RETURNING *",
                chatbot.getName(), chatbot.getSystemPrompt(), chatbot.getTemperature(), chatbot.getMaxCompletion(),
                chatbot.getContextSize(), chatbot.getVisionDetail(), chatbot.getAuthorId(), chatbot.getGuildId())
                .map(Chatbot::fromRow);
    }

    /**
     * Update some columns of a chatbot.
     *
     * @param changes
     *            column name to new value
     * @return the updated chatbot, or empty if no chatbot has this id
     * @throws IllegalArgumentException
     *             if a column cannot be updated
     */
    public Optional<Chatbot> updateChatbot(long chatbotId, Map<String, ?> changes) {
        if (changes.isEmpty()) {
            return getChatbot(chatbotId);
        }
        StringBuilder statement = new StringBuilder("UPDATE chatbots SET ");
        List<Object> args = new ArrayList<>();
        for (Map.Entry<String, ?> change : changes.entrySet()) {
            if (!UPDATABLE_COLUMNS.contains(change.getKey())) {
                throw new IllegalArgumentException("Column cannot be updated: " + change.getKey());
            }
            if (!args.isEmpty()) {
                statement.append(", ");
            }
            statement.append(change.getKey()).append(" = ?");
            args.add(change.getValue());
        }
        statement.append(" WHERE id = ? RETURNING *");
        args.add(chatbotId);
        return global().evaluate(statement.toString(), args, true, true).map(Chatbot::fromRow);
    }

    public void deleteChatbot(long chatbotId) {
        global().execute("DELETE FROM chatbots WHERE id = ?", chatbotId);
    }

    // ==================== Users ====================

    /**
     * Usage of a user. Counters of a previous month are reset first.
     */
    public Optional<ChatUsage> getUser(long userId) {
        ScopeConnection global = global();
        Optional<Row> row = global.fetch("SELECT * FROM users WHERE user_id = ?", userId);
        if (row.isEmpty()) {
            return Optional.empty();
        }
        int month = currentTrackingMonth();
        Integer tracked = row.get().getInt("tracking_month");
        if (tracked == null || tracked != month) {
            global.execute("UPDATE users SET tracking_month = ?, prompt_tokens = 0, completion_tokens = 0 "
                    + "WHERE user_id = ?", month, userId);
            row = global.fetch("SELECT * FROM users WHERE user_id = ?", userId);
        }
        return row.map(ChatbotStorage::toUsage);
    }

    public List<ChatUsage> getUsers() {
        List<ChatUsage> users = new ArrayList<>();
        for (Row row : global().fetchAll("SELECT * FROM users ORDER BY user_id")) {
            users.add(toUsage(row));
        }
        return users;
    }

    public void updateUsage(long userId, long promptTokens, long completionTokens) {
        ScopeConnection global = global();
        global.execute("INSERT OR IGNORE INTO users VALUES (?, ?, 0, 0, FALSE)", userId, currentTrackingMonth());
        global.execute("UPDATE users SET prompt_tokens = prompt_tokens + ?, "
                + "completion_tokens = completion_tokens + ? WHERE user_id = ?",
                promptTokens, completionTokens, userId);
    }

    public void banUser(long userId) {
        setBanned(userId, true);
    }

    public void unbanUser(long userId) {
        setBanned(userId, false);
    }

    private void setBanned(long userId, boolean banned) {
        ScopeConnection global = global();
        global.execute("INSERT OR IGNORE INTO users VALUES (?, ?, 0, 0, FALSE)", userId, currentTrackingMonth());
        global.execute("UPDATE users SET banned = ? WHERE user_id = ?", banned, userId);
    }

    int currentTrackingMonth() {
        LocalDate today = LocalDate.now(clock);
        return Integer.parseInt(today.getYear() + "" + today.getMonthValue());
    }

    // ==================== Sessions ====================

    public List<HistoryEntry> loadHistory(long guildId, long chatbotId) {
        List<HistoryEntry> history = new ArrayList<>();
        for (Row row : guild(guildId).fetchAll(
                "SELECT * FROM sessions WHERE chatbot_id = ? ORDER BY timestamp", chatbotId)) {
            try {
                history.add(new HistoryEntry(row.getDouble("timestamp"),
                        objectMapper.readTree(row.getString("payload"))));
            } catch (JsonProcessingException e) {
                throw new ValueConversionException("Invalid session payload in guild " + guildId, e);
            }
        }
        return history;
    }

    /**
     * Replace the stored history of a session, without the expired messages. If
     * the new history cannot be written, the previous one is kept.
     */
    public void saveHistory(long guildId, long chatbotId, List<HistoryEntry> history) {
        double cutoff = clock.millis() / 1000.0 - HISTORY_COMPLETION_EXPIRATION.toSeconds();
        List<List<?>> rows = new ArrayList<>();
        for (HistoryEntry entry : history) {
            if (entry.timestamp() > cutoff) {
                rows.add(Arrays.asList(chatbotId, entry.timestamp(), writePayload(entry)));
            }
        }
        ScopeConnection connection = guild(guildId);
        try {
            connection.execute("DELETE FROM sessions WHERE chatbot_id = ?", List.of(chatbotId), false);
            connection.executeMany("INSERT INTO sessions VALUES (?, ?, ?)", rows, false);
            connection.commit();
        } catch (StorageAccessException e) {
            try {
                connection.rollback();
            } catch (StorageAccessException rollbackFailure) {
                e.addSuppressed(rollbackFailure);
            }
            throw e;
        }
        log.debug("[Chatbot] Saved {} history messages for guild {}", rows.size(), guildId);
    }

    public void clearHistory(long guildId, long chatbotId) {
        guild(guildId).execute("DELETE FROM sessions WHERE chatbot_id = ?", chatbotId);
    }

    /**
     * Chatbot of the most recent stored message in a guild.
     */
    public Optional<Chatbot> getLastChatbotUsed(long guildId) {
        return guild(guildId).fetch("SELECT chatbot_id FROM sessions ORDER BY timestamp DESC LIMIT 1")
                .flatMap(row -> getChatbot(row.getLong("chatbot_id")));
    }

    private String writePayload(HistoryEntry entry) {
        try {
            return objectMapper.writeValueAsString(entry.payload());
        } catch (JsonProcessingException e) {
            throw new ValueConversionException("Cannot serialize session payload", e);
        }
    }

    private static List<Chatbot> toChatbots(List<Row> rows) {
        List<Chatbot> chatbots = new ArrayList<>();
        for (Row row : rows) {
            chatbots.add(Chatbot.fromRow(row));
        }
        return chatbots;
    }

    private static ChatUsage toUsage(Row row) {
        Integer month = row.getInt("tracking_month");
        return new ChatUsage(row.getLong("user_id"), month == null ? 0 : month, row.getLong("prompt_tokens"),
                row.getLong("completion_tokens"), Boolean.TRUE.equals(row.getBoolean("banned")));
    }

    private ScopeConnection guild(long guildId) {
        return data().get(GUILD_KIND, guildId);
    }

    private ScopeConnection global() {
        return data().get(NamedScope.GLOBAL);
    }

    private DomainRegistry data() {
        return registryStore.get(DOMAIN);
    }
}
