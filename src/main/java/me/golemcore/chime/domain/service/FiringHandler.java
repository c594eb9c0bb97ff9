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

import me.golemcore.chime.domain.model.ContentSource;
import me.golemcore.chime.domain.model.DeliveryResult;
import me.golemcore.chime.domain.model.FailureKind;
import me.golemcore.chime.domain.model.FiringJob;
import me.golemcore.chime.domain.model.FiringJobDueEvent;
import me.golemcore.chime.domain.model.FiringResult;
import me.golemcore.chime.domain.model.MessagePayload;
import me.golemcore.chime.domain.model.RecurrenceDefinition;
import me.golemcore.chime.infrastructure.config.ChimeProperties;
import me.golemcore.chime.port.outbound.MessageTransportPort;
import me.golemcore.chime.port.outbound.RecurrenceStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.context.event.EventListener;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;

/**
 * Runs a due job: admits or skips it against the latest persisted state,
 * performs the send, and always hands over to the rescheduling epilogue.
 *
 * <p>
 * Each firing is an independent invocation keyed by definition id. Nothing is
 * carried over from enqueue time except the intended slot; the definition is
 * re-read at the start of the firing and again by the epilogue.
 *
 * <p>
 * States per firing:
 * <ol>
 * <li>definition deleted or disabled: SKIPPED</li>
 * <li>later than the staleness tolerance: SKIPPED</li>
 * <li>no destination or no content: FAILED (INVALID_PAYLOAD or
 * CONTENT_UNAVAILABLE)</li>
 * <li>send: SUCCESS, or FAILED with the transport's classification</li>
 * </ol>
 * No outcome, and no exception, prevents the epilogue from running.
 */
@Service
@Slf4j
public class FiringHandler {

    private final RecurrenceStorePort store;
    private final RecurrenceService recurrenceService;
    private final StalenessPolicy stalenessPolicy;
    private final ContentResolver contentResolver;
    private final MessageTransportPort transport;
    private final ChimeProperties properties;
    private final Clock clock;

    public FiringHandler(RecurrenceStorePort store, RecurrenceService recurrenceService,
            StalenessPolicy stalenessPolicy, ContentResolver contentResolver, MessageTransportPort transport,
            ChimeProperties properties, Clock clock) {
        this.store = store;
        this.recurrenceService = recurrenceService;
        this.stalenessPolicy = stalenessPolicy;
        this.contentResolver = contentResolver;
        this.transport = transport;
        this.properties = properties;
        this.clock = clock;
    }

    @EventListener
    public void onFiringJobDue(FiringJobDueEvent event) {
        handle(event.job());
    }

    public FiringResult handle(FiringJob job) {
        Attempt attempt = new Attempt(FiringResult.failed(FailureKind.TRANSPORT_ERROR, "Firing aborted"), true);
        Instant attemptedAt = clock.instant();
        try {
            attempt = fire(job);
        } catch (SecurityException e) {
            log.error("[Firing] Permission denied for {}", job.definitionId(), e);
            attempt = new Attempt(FiringResult.failed(FailureKind.PERMISSION_DENIED, e.getMessage()), true);
        } catch (RuntimeException e) {
            log.error("[Firing] Unexpected error firing {}", job.definitionId(), e);
            attempt = new Attempt(FiringResult.failed(FailureKind.TRANSPORT_ERROR, e.getMessage()), true);
        } finally {
            runEpilogue(job, attempt, attemptedAt);
        }

        FiringResult result = attempt.result();
        log.info("[Firing] {} slot {}: {}{}", job.definitionId(), job.intendedFireAt(), result.outcome(),
                result.detail() != null ? " (" + result.detail() + ")" : "");
        return result;
    }

    private Attempt fire(FiringJob job) {
        Optional<RecurrenceDefinition> current = store.get(job.definitionId());
        if (current.isEmpty()) {
            return new Attempt(FiringResult.skipped("Definition deleted"), false);
        }
        RecurrenceDefinition definition = current.get();
        if (!definition.isEnabled()) {
            return new Attempt(FiringResult.skipped("Definition disabled"), false);
        }

        ZonedDateTime now = clock.instant().atZone(clock.getZone());
        if (stalenessPolicy.isStale(job.intendedFireAt(), now)) {
            Duration late = Duration.between(job.intendedFireAt(), now.toInstant());
            log.warn("[Firing] {} is {} late (tolerance {}), skipping", job.definitionId(), late,
                    stalenessPolicy.tolerance());
            return new Attempt(FiringResult.skipped("Stale: " + late.toMinutes() + " minutes late"), true);
        }

        MessagePayload payload = definition.getPayload();
        if (payload == null || payload.getDestination() == null || payload.getDestination().isBlank()
                || !transport.isValidDestination(payload.getDestination())) {
            return new Attempt(FiringResult.failed(FailureKind.INVALID_PAYLOAD, "Invalid destination"), true);
        }

        String content = contentResolver.resolve(payload);
        if (content.isBlank()) {
            FailureKind kind = payload.getContentSource() == ContentSource.GENERATED
                    ? FailureKind.CONTENT_UNAVAILABLE
                    : FailureKind.INVALID_PAYLOAD;
            return new Attempt(FiringResult.failed(kind, "Empty message"), true);
        }

        return new Attempt(deliver(payload.getDestination(), content), true);
    }

    private FiringResult deliver(String destination, String content) {
        Duration timeout = properties.getFiring().getDeliveryTimeout();
        try {
            DeliveryResult delivery = transport.send(destination, content)
                    .get(timeout.toMillis(), TimeUnit.MILLISECONDS);
            if (delivery.delivered()) {
                log.debug("[Firing] Delivered to {} in {} part(s)", destination, delivery.parts());
                return FiringResult.success();
            }
            return FiringResult.failed(delivery.failureKind(), delivery.error());
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return FiringResult.failed(FailureKind.TRANSPORT_ERROR, "Interrupted while sending");
        } catch (ExecutionException e) {
            Throwable cause = e.getCause() != null ? e.getCause() : e;
            if (cause instanceof SecurityException) {
                return FiringResult.failed(FailureKind.PERMISSION_DENIED, cause.getMessage());
            }
            log.error("[Firing] Transport failed for {}", destination, cause);
            return FiringResult.failed(FailureKind.TRANSPORT_ERROR, cause.getMessage());
        } catch (TimeoutException e) {
            log.warn("[Firing] Send to {} still running after {}, treating it as delivered", destination, timeout);
            return FiringResult.failed(FailureKind.DELIVERY_UNCONFIRMED,
                    "Send timed out after " + timeout + ", delivery unconfirmed");
        }
    }

    private void runEpilogue(FiringJob job, Attempt attempt, Instant attemptedAt) {
        try {
            recurrenceService.completeFiring(job, attempt.result(), attemptedAt, attempt.recordable());
        } catch (RuntimeException e) {
            log.error("[Firing] Rescheduling failed for {}; chain resumes on next edit or restart",
                    job.definitionId(), e);
        }
    }

    /**
     * @param recordable
     *            whether the firing reached an enabled definition and its status
     *            should be recorded
     */
    private record Attempt(FiringResult result, boolean recordable) {
    }
}
