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

package me.cogbot.module.msgboard;

import me.cogbot.domain.component.StorageComponent;
import me.cogbot.domain.model.KeyValueTableSchema;
import me.cogbot.domain.model.NamedScope;
import me.cogbot.domain.model.Row;
import me.cogbot.domain.model.ScopeType;
import me.cogbot.domain.model.TableSchema;
import me.cogbot.domain.model.TypedScope;
import me.cogbot.domain.service.DomainRegistry;
import me.cogbot.domain.service.DomainRegistryStore;
import me.cogbot.domain.service.ScopeConnection;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Storage of the message board module: per-guild board settings and a global
 * log of the messages already copied to a board.
 */
@Component
@Slf4j
public class MessageBoardStorage implements StorageComponent {

    public static final String DOMAIN = "msgboard";
    public static final String GUILD_KIND = "guild";
    public static final String SETTINGS_TABLE = "settings";
    public static final String LOGS_TABLE = "msgboard_logs";

    public static final String BOARD_CHANNEL_ID = "BoardChannelID";
    public static final String THRESHOLD = "Threshold";
    public static final String VOTE_EMOJI = "VoteEmoji";
    public static final String MAX_MESSAGE_AGE = "MaxMessageAge";

    static final Duration LOGS_EXPIRATION = Duration.ofDays(7);

    private final DomainRegistryStore registryStore;
    private final Clock clock;

    public MessageBoardStorage(DomainRegistryStore registryStore, Clock clock) {
        this.registryStore = registryStore;
        this.clock = clock;
    }

    @Override
    public String getDomainName() {
        return DOMAIN;
    }

    @Override
    public void registerSchemas(DomainRegistry registry) {
        Map<String, Object> settings = new LinkedHashMap<>();
        settings.put(BOARD_CHANNEL_ID, 0);
        settings.put(THRESHOLD, 3);
        settings.put(VOTE_EMOJI, "⭐");
        settings.put(MAX_MESSAGE_AGE, Duration.ofHours(24).toSeconds());
        registry.registerSchemas(ScopeType.typed(GUILD_KIND), KeyValueTableSchema.named(SETTINGS_TABLE, settings));

        registry.registerSchemas(ScopeType.global(), TableSchema.of("""
                CREATE TABLE IF NOT EXISTS msgboard_logs (
                    message_id INTEGER PRIMARY KEY,
                    copied_message_id INTEGER DEFAULT NULL,
                    timestamp INTEGER
                )"""));
    }

    @Override
    public void destroy() {
        data().closeAll();
    }

    // ==================== Settings ====================

    public long getBoardChannelId(long guildId) {
        return guild(guildId).getValue(SETTINGS_TABLE, BOARD_CHANNEL_ID, Long.class).orElse(0L);
    }

    public void setBoardChannelId(long guildId, long channelId) {
        guild(guildId).setValue(SETTINGS_TABLE, BOARD_CHANNEL_ID, channelId);
    }

    public int getThreshold(long guildId) {
        return guild(guildId).getValue(SETTINGS_TABLE, THRESHOLD, Integer.class).orElse(3);
    }

    public void setThreshold(long guildId, int threshold) {
        if (threshold < 1) {
            throw new IllegalArgumentException("Threshold must be at least 1");
        }
        guild(guildId).setValue(SETTINGS_TABLE, THRESHOLD, threshold);
    }

    public String getVoteEmoji(long guildId) {
        return guild(guildId).getValue(SETTINGS_TABLE, VOTE_EMOJI).orElse("⭐");
    }

    public void setVoteEmoji(long guildId, String emoji) {
        guild(guildId).setValue(SETTINGS_TABLE, VOTE_EMOJI, emoji);
    }

    public Duration getMaxMessageAge(long guildId) {
        return Duration.ofSeconds(guild(guildId).getValue(SETTINGS_TABLE, MAX_MESSAGE_AGE, Long.class)
                .orElse(Duration.ofHours(24).toSeconds()));
    }

    public void setMaxMessageAge(long guildId, Duration maxAge) {
        guild(guildId).setValue(SETTINGS_TABLE, MAX_MESSAGE_AGE, maxAge.toSeconds());
    }

    /**
     * Forget the settings of a guild, e.g. when the bot leaves it.
     */
    public void resetGuild(long guildId) {
        data().delete(TypedScope.of(GUILD_KIND, guildId));
    }

    // ==================== Logs ====================

    /**
     * Persist board entries, dropping the expired ones.
     */
    public void saveLogs(Collection<BoardLogEntry> entries) {
        long cutoff = cutoff();
        List<List<?>> rows = new ArrayList<>();
        for (BoardLogEntry entry : entries) {
            if (entry.timestamp() > cutoff) {
                rows.add(Arrays.asList(entry.messageId(), entry.copiedMessageId(), entry.timestamp()));
            }
        }
        global().executeMany("INSERT OR REPLACE INTO " + LOGS_TABLE + " VALUES (?, ?, ?)", rows);
        log.debug("[MsgBoard] Saved {} log entries", rows.size());
    }

    /**
     * Purge expired entries, then return the remaining ones.
     */
    public List<BoardLogEntry> loadLogs() {
        ScopeConnection global = global();
        global.execute("DELETE FROM " + LOGS_TABLE + " WHERE timestamp < ?", cutoff());
        List<BoardLogEntry> entries = new ArrayList<>();
        for (Row row : global.fetchAll("SELECT * FROM " + LOGS_TABLE + " ORDER BY timestamp")) {
            entries.add(new BoardLogEntry(row.getLong("message_id"), row.getLong("copied_message_id"),
                    row.getLong("timestamp")));
        }
        return entries;
    }

    private long cutoff() {
        return clock.instant().getEpochSecond() - LOGS_EXPIRATION.toSeconds();
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
