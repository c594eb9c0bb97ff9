package me.golemcore.chime;

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

import org.springframework.boot.SpringApplication;
import org.springframework.boot.autoconfigure.SpringBootApplication;
import org.springframework.boot.context.properties.ConfigurationPropertiesScan;

/**
 * Main application class for GolemCore Chime.
 *
 * <p>
 * Chime delivers recurring messages at a fixed local time of day. Each
 * recurrence keeps at most one pending job; every firing computes the next
 * occurrence from the recurrence's anchor, so the schedule never drifts no
 * matter how late a job actually ran.
 *
 * <h2>Architecture</h2>
 * <p>
 * Hexagonal architecture (Ports &amp; Adapters):
 *
 * <pre>
 * Input Layer        → RecurrenceController, RecurrenceRecoveryRunner
 * Domain Layer       → RecurrenceService, JobChainManager, FiringHandler
 * Infrastructure     → Storage/Executor/Telegram/LLM Adapters
 * </pre>
 *
 * <h2>Configuration</h2>
 * <p>
 * All configuration via {@code application.properties} under {@code chime.*}
 * prefix.
 */
@SpringBootApplication
@ConfigurationPropertiesScan
public class ChimeApplication {

    public static void main(String[] args) {
        SpringApplication.run(ChimeApplication.class, args);
    }

}
