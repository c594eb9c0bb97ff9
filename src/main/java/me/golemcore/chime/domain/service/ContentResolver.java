package me.golemcore.chime.domain.service;

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

import me.golemcore.chime.domain.model.ContentRequest;
import me.golemcore.chime.domain.model.ContentSource;
import me.golemcore.chime.domain.model.MessagePayload;
import me.golemcore.chime.domain.model.MessageTone;
import me.golemcore.chime.infrastructure.config.ChimeProperties;
import me.golemcore.chime.port.outbound.ContentGeneratorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Duration;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Resolves the text to send for a payload. Generated content falls back to the
 * payload's static message whenever generation is unavailable or fails.
 */
@Service
@Slf4j
public class ContentResolver {

    private final ContentGeneratorPort contentGenerator;
    private final ChimeProperties properties;

    public ContentResolver(ContentGeneratorPort contentGenerator, ChimeProperties properties) {
        this.contentGenerator = contentGenerator;
        this.properties = properties;
    }

    /**
     * @return the text to send, possibly blank when neither source has any
     */
    public String resolve(MessagePayload payload) {
        String fallback = payload.getMessage() != null ? payload.getMessage().trim() : "";
        if (payload.getContentSource() != ContentSource.GENERATED) {
            return fallback;
        }

        if (!contentGenerator.isAvailable()) {
            log.warn("[ContentGen] Generator not configured, using static message");
            return fallback;
        }

        ContentRequest request = new ContentRequest(
                payload.getRecipientName(),
                payload.getTone() != null ? payload.getTone() : MessageTone.FRIENDLY,
                payload.getGenerationContext(),
                properties.getContent().getMaxLength());
        Duration timeout = properties.getFiring().getContentTimeout();

        try {
            String generated = contentGenerator.generate(request).get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (generated == null || generated.isBlank()) {
                log.warn("[ContentGen] Empty generated message, using static message");
                return fallback;
            }
            return generated.trim();
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("[ContentGen] Interrupted while generating message, using static message");
            return fallback;
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            log.warn("[ContentGen] Failed to generate message: {}, using static message", cause.getMessage());
            return fallback;
        } catch (TimeoutException e) {
            log.warn("[ContentGen] Generation timed out after {}, using static message", timeout);
            return fallback;
        }
    }
}
