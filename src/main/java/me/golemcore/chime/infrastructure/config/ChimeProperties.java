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

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.ZoneId;

/**
 * Centralized configuration properties, bound from application.properties.
 *
 * <p>
 * All configuration is organized under the {@code chime.*} prefix:
 * <ul>
 * <li>{@link StorageProperties} - JSON workspace location</li>
 * <li>{@link FiringProperties} - staleness admission and firing timeouts</li>
 * <li>{@link ExecutorProperties} - delayed-job executor threads</li>
 * <li>{@link RecoveryProperties} - restart recovery</li>
 * <li>{@link TelegramProperties} - message transport</li>
 * <li>{@link ContentProperties} - generated message content</li>
 * </ul>
 *
 * @since 1.0
 */
@Component
@ConfigurationProperties(prefix = "chime")
@Data
public class ChimeProperties {

    /**
     * Wall-clock zone of target times. Blank means the system zone.
     */
    private String zoneId = "";

    private StorageProperties storage = new StorageProperties();
    private FiringProperties firing = new FiringProperties();
    private ExecutorProperties executor = new ExecutorProperties();
    private RecoveryProperties recovery = new RecoveryProperties();
    private TelegramProperties telegram = new TelegramProperties();
    private ContentProperties content = new ContentProperties();

    public ZoneId resolveZone() {
        if (zoneId == null || zoneId.isBlank()) {
            return ZoneId.systemDefault();
        }
        return ZoneId.of(zoneId.trim());
    }

    @Data
    public static class StorageProperties {
        private LocalStorageProperties local = new LocalStorageProperties();
    }

    @Data
    public static class LocalStorageProperties {
        private String basePath = "${user.home}/.golemcore/chime";
    }

    @Data
    public static class FiringProperties {
        private StalenessMode stalenessMode = StalenessMode.ELAPSED;
        private Duration stalenessTolerance = Duration.ofHours(2);
        private Duration contentTimeout = Duration.ofSeconds(60);
        private Duration deliveryTimeout = Duration.ofSeconds(120);
    }

    /**
     * How a late firing is judged stale.
     */
    public enum StalenessMode {
        /** Absolute time elapsed since the intended fire instant. */
        ELAPSED,
        /** Wrap-aware distance between target and actual time of day. */
        TIME_OF_DAY
    }

    @Data
    public static class ExecutorProperties {
        private int threads = 2;
    }

    @Data
    public static class RecoveryProperties {
        private boolean enabled = true;
    }

    @Data
    public static class TelegramProperties {
        private boolean enabled = false;
        private String token;
        private int maxPartLength = 3800;
    }

    @Data
    public static class ContentProperties {
        private String apiKey;
        private String model = "gpt-4o-mini";
        private String baseUrl;
        private int maxLength = 100;
        private double temperature = 0.8;
        private Duration timeout = Duration.ofSeconds(30);
    }
}
