package me.golemcore.chime.infrastructure.config;

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

import me.golemcore.chime.domain.service.ElapsedTimeStalenessPolicy;
import me.golemcore.chime.domain.service.StalenessPolicy;
import me.golemcore.chime.domain.service.TimeOfDayStalenessPolicy;
import jakarta.annotation.PostConstruct;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.annotation.Bean;
import org.springframework.context.annotation.Configuration;

import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.time.Clock;
import java.time.Duration;

/**
 * Core beans of the scheduling engine: the wall clock in the configured zone,
 * the JSON mapper shared by the storage adapters and the staleness policy
 * selected by {@code chime.firing.staleness-mode}.
 */
@Configuration
@RequiredArgsConstructor
@Slf4j
public class ChimeConfiguration {

    private final ChimeProperties properties;

    @Bean
    public static Clock clock(ChimeProperties properties) {
        return Clock.system(properties.resolveZone());
    }

    @Bean
    public static ObjectMapper objectMapper() {
        ObjectMapper mapper = new ObjectMapper();
        mapper.registerModule(new JavaTimeModule());
        mapper.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
        mapper.disable(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES);
        return mapper;
    }

    @Bean
    public StalenessPolicy stalenessPolicy() {
        Duration tolerance = properties.getFiring().getStalenessTolerance();
        return switch (properties.getFiring().getStalenessMode()) {
        case ELAPSED -> new ElapsedTimeStalenessPolicy(tolerance);
        case TIME_OF_DAY -> new TimeOfDayStalenessPolicy(tolerance);
        };
    }

    @PostConstruct
    public void init() {
        log.info("GolemCore Chime starting...");
        log.info("Zone: {}", properties.resolveZone());
        log.info("Storage Path: {}", properties.getStorage().getLocal().getBasePath());
        log.info("Staleness: {} (tolerance {})", properties.getFiring().getStalenessMode(),
                properties.getFiring().getStalenessTolerance());
        log.info("Telegram transport: {}", properties.getTelegram().isEnabled() ? "enabled" : "disabled");
    }
}
