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

import me.cogbot.domain.component.StorageComponent;
import me.cogbot.domain.service.DomainRegistry;
import me.cogbot.domain.service.DomainRegistryStore;
import me.cogbot.domain.service.ValueCodec;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.ObjectMapper;

import java.time.Clock;
import java.util.List;

/**
 * Composition root of the storage broker.
 *
 * <p>
 * This configuration:
 * <ul>
 * <li>Provides the shared {@link ObjectMapper}, {@link ValueCodec} and
 * {@link Clock}</li>
 * <li>Registers the schemas of every enabled {@link StorageComponent} on
 * startup</li>
 * <li>Closes every module database on shutdown</li>
 * </ul>
 *
 * @since 1.0
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class AutoConfiguration {

    private final BotProperties properties;
    private final DomainRegistryStore registryStore;
    private final List<StorageComponent> storageComponents;

    @Bean
    public static ObjectMapper objectMapper() {
        return ValueCodec.defaultObjectMapper();
    }

    @Bean
    public static ValueCodec valueCodec(ObjectMapper objectMapper) {
        return new ValueCodec(objectMapper);
    }

    @Bean
    public static Clock clock() {
        return Clock.systemUTC();
    }

    @PostConstruct
    public void init() {
        log.info("Storage Path: {}", properties.getStorage().resolveBasePath());

        for (StorageComponent component : storageComponents) {
            if (!component.isEnabled()) {
                log.info("Skipping disabled module: {}", component.getDomainName());
                continue;
            }
            DomainRegistry registry = registryStore.get(component.getDomainName());
            component.registerSchemas(registry);
            component.initialize();
            log.info("Registered storage module: {}", registry.getName());
        }
    }

    @PreDestroy
    public void shutdown() {
        for (StorageComponent component : storageComponents) {
            component.destroy();
        }
        registryStore.closeAll();
        log.info("Storage closed for modules: {}", registryStore.getDomainNames());
    }
}
