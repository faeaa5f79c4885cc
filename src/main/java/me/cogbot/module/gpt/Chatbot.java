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

import me.cogbot.domain.model.Row;
import lombok.Builder;
import lombok.Value;

/**
 * A chatbot persona shared across guilds.
 */
@Value
@Builder(toBuilder = true)
public class Chatbot {

    long id;
    String name;
    String systemPrompt;
    @Builder.Default
    double temperature = 0.9;
    @Builder.Default
    int maxCompletion = 512;
    @Builder.Default
    int contextSize = 4096;
    @Builder.Default
    String visionDetail = "auto";
    long authorId;
    long guildId;

    static Chatbot fromRow(Row row) {
        return Chatbot.builder()
                .id(row.getLong("id"))
                .name(row.getString("name"))
                .systemPrompt(row.getString("system_prompt"))
                .temperature(row.getDouble("temperature"))
                .maxCompletion(row.getInt("max_completion"))
                .contextSize(row.getInt("context_size"))
                .visionDetail(row.getString("vision_detail"))
                .authorId(orZero(row.getLong("author_id")))
                .guildId(orZero(row.getLong("guild_id")))
                .build();
    }

    private static long orZero(Long value) {
        return value == null ? 0L : value;
    }
}
