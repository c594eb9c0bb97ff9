package me.golemcore.chime.auto;

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

import me.golemcore.chime.domain.service.RecurrenceService;
import me.golemcore.chime.infrastructure.config.ChimeProperties;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

/**
 * Rebuilds the job chain of every enabled recurrence once the application is
 * ready. Runs before the executor re-arms its persisted jobs, so every enabled
 * chain restarts from a freshly computed link and missed occurrences go
 * through the catch-up rules exactly once.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RecurrenceRecoveryRunner {

    private final RecurrenceService recurrenceService;
    private final ChimeProperties properties;

    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.HIGHEST_PRECEDENCE)
    public void onApplicationReady() {
        if (!properties.getRecovery().isEnabled()) {
            log.info("[Recovery] Startup recovery disabled");
            return;
        }
        try {
            int count = recurrenceService.rescheduleAllEnabled();
            log.info("[Recovery] Startup recovery complete, {} chains active", count);
        } catch (RuntimeException e) {
            log.error("[Recovery] Startup recovery failed", e);
        }
    }
}
