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

import me.golemcore.chime.domain.model.FiringJob;
import me.golemcore.chime.domain.model.FiringOutcome;
import me.golemcore.chime.domain.model.FiringRecord;
import me.golemcore.chime.domain.model.FiringResult;
import me.golemcore.chime.domain.model.Frequency;
import me.golemcore.chime.domain.model.RecurrenceDefinition;
import me.golemcore.chime.domain.model.ScheduledLink;
import me.golemcore.chime.port.outbound.RecurrenceStorePort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

/**
 * Single write path for recurrence definitions.
 *
 * <p>
 * Every mutation persists first and then brings the job chain in line with the
 * new state through {@link JobChainManager}. Mutations are serialized on this
 * service, which also covers the firing epilogue in {@link #completeFiring}: a
 * toggle can never interleave between the epilogue's re-read and its
 * re-enqueue.
 */
@Service
@Slf4j
public class RecurrenceService {

    private final RecurrenceStorePort store;
    private final JobChainManager jobChainManager;
    private final Clock clock;

    public RecurrenceService(RecurrenceStorePort store, JobChainManager jobChainManager, Clock clock) {
        this.store = store;
        this.jobChainManager = jobChainManager;
        this.clock = clock;
    }

    public Optional<RecurrenceDefinition> find(String id) {
        return store.get(id);
    }

    public List<RecurrenceDefinition> listAll() {
        return store.listAll();
    }

    /**
     * Create an enabled definition and start its chain with the strict
     * first-start policy.
     */
    public synchronized RecurrenceDefinition create(RecurrenceDefinition draft) {
        validate(draft);

        Instant now = clock.instant();
        RecurrenceDefinition definition = draft.toBuilder()
                .id(null)
                .enabled(true)
                .createdAt(now)
                .updatedAt(now)
                .lastFiredAt(null)
                .lastAttemptAt(null)
                .lastOutcome(null)
                .lastError(null)
                .build();

        String id = store.insert(definition);
        definition.setId(id);
        jobChainManager.scheduleNext(definition, false);

        log.info("[Recurrence] Created {} at {} ({}, recurring={})", id, definition.getDisplayTime(),
                definition.getFrequency(), definition.isRecurring());
        return definition;
    }

    /**
     * Replace the user-editable fields of a definition and re-plan its chain.
     * Creation time and firing status are preserved.
     *
     * <p>
     * An enabled one-shot that was already sent and whose slot (time of day and
     * start date) did not change is disabled rather than rescheduled, so saving
     * it again cannot resend it.
     *
     * @throws IllegalArgumentException
     *             if not found or invalid
     */
    public synchronized RecurrenceDefinition update(RecurrenceDefinition changes) {
        validate(changes);
        RecurrenceDefinition existing = store.get(changes.getId())
                .orElseThrow(() -> notFound(changes.getId()));

        RecurrenceDefinition updated = changes.toBuilder()
                .createdAt(existing.getCreatedAt())
                .updatedAt(clock.instant())
                .lastFiredAt(existing.getLastFiredAt())
                .lastAttemptAt(existing.getLastAttemptAt())
                .lastOutcome(existing.getLastOutcome())
                .lastError(existing.getLastError())
                .build();

        store.update(updated);
        jobChainManager.cancel(updated.getId());

        if (!updated.isEnabled()) {
            log.info("[Recurrence] Updated {} (disabled)", updated.getId());
            return updated;
        }

        if (isCompletedOneShot(existing, updated)) {
            store.setEnabled(updated.getId(), false);
            updated.setEnabled(false);
            log.info("[Recurrence] Updated {}: one-shot already sent for this slot, disabling", updated.getId());
            return updated;
        }

        jobChainManager.scheduleNext(updated, true);
        log.info("[Recurrence] Updated {} at {}", updated.getId(), updated.getDisplayTime());
        return updated;
    }

    /**
     * Delete a definition and cancel its pending job.
     *
     * @throws IllegalArgumentException
     *             if not found
     */
    public synchronized void delete(String id) {
        boolean removed = store.delete(id);
        jobChainManager.cancel(id);
        if (!removed) {
            throw notFound(id);
        }
        log.info("[Recurrence] Deleted {}", id);
    }

    /**
     * Toggle a definition. Enabling resumes the chain in catch-up mode.
     *
     * @throws IllegalArgumentException
     *             if not found
     */
    public synchronized RecurrenceDefinition setEnabled(String id, boolean enabled) {
        if (!store.setEnabled(id, enabled)) {
            throw notFound(id);
        }
        jobChainManager.cancel(id);

        RecurrenceDefinition latest = store.get(id).orElseThrow(() -> notFound(id));
        if (enabled) {
            jobChainManager.scheduleNext(latest, true);
        }
        log.info("[Recurrence] {} {}", enabled ? "Enabled" : "Disabled", id);
        return latest;
    }

    /**
     * Firing epilogue: record the outcome, re-read the freshest state and
     * continue, end or disable the chain accordingly.
     *
     * <ul>
     * <li>enabled and recurring: enqueue the next link in catch-up mode</li>
     * <li>enabled one-shot that succeeded, or whose send outlived the
     * delivery timeout: disable it</li>
     * <li>enabled one-shot that did not send: enqueue its next slot</li>
     * <li>deleted or disabled: nothing, the chain already ended</li>
     * </ul>
     *
     * @param recordable
     *            false when the firing never looked at an enabled definition
     */
    public synchronized void completeFiring(FiringJob job, FiringResult result, Instant attemptedAt,
            boolean recordable) {
        String id = job.definitionId();
        if (recordable) {
            store.recordFiring(id, new FiringRecord(job.intendedFireAt(), attemptedAt, result.outcome(),
                    result.detail()));
        }

        Optional<RecurrenceDefinition> latest = store.get(id);
        if (latest.isEmpty() || !latest.get().isEnabled()) {
            log.debug("[Recurrence] {} deleted or disabled, chain ends", id);
            return;
        }

        RecurrenceDefinition definition = latest.get();
        if (!definition.isRecurring() && result.mayHaveDelivered()) {
            store.setEnabled(id, false);
            jobChainManager.cancel(id);
            log.info("[Recurrence] One-shot {} {}, disabled", id, result.isSuccess() ? "sent" : "possibly sent");
            return;
        }

        jobChainManager.scheduleNext(definition, true);
    }

    /**
     * Rebuild the job chain of every enabled definition after executor state
     * was lost. Failures are logged per definition and do not stop the loop.
     *
     * @return number of definitions rescheduled
     */
    public synchronized int rescheduleAllEnabled() {
        List<RecurrenceDefinition> enabled = store.listEnabled();
        int rescheduled = 0;
        for (RecurrenceDefinition definition : enabled) {
            try {
                Optional<ScheduledLink> link = jobChainManager.scheduleNext(definition, true);
                if (link.isPresent()) {
                    rescheduled++;
                }
            } catch (RuntimeException e) {
                log.error("[Recovery] Failed to reschedule {}", definition.getId(), e);
            }
        }
        log.info("[Recovery] Rescheduled {}/{} enabled recurrences", rescheduled, enabled.size());
        return rescheduled;
    }

    /**
     * Next link the chain would take for a definition, without enqueuing it.
     *
     * @throws IllegalArgumentException
     *             if not found
     */
    public ScheduledLink previewNext(String id) {
        RecurrenceDefinition definition = store.get(id).orElseThrow(() -> notFound(id));
        return jobChainManager.preview(definition, true);
    }

    private static boolean isCompletedOneShot(RecurrenceDefinition existing, RecurrenceDefinition updated) {
        return !updated.isRecurring()
                && existing.getLastOutcome() == FiringOutcome.SUCCESS
                && existing.getTargetHour() == updated.getTargetHour()
                && existing.getTargetMinute() == updated.getTargetMinute()
                && Objects.equals(existing.getStartDate(), updated.getStartDate());
    }

    static void validate(RecurrenceDefinition definition) {
        if (definition.getTargetHour() < 0 || definition.getTargetHour() > 23) {
            throw new IllegalArgumentException("targetHour must be between 0 and 23");
        }
        if (definition.getTargetMinute() < 0 || definition.getTargetMinute() > 59) {
            throw new IllegalArgumentException("targetMinute must be between 0 and 59");
        }
        if (definition.getFrequency() == null) {
            throw new IllegalArgumentException("frequency is required");
        }
        if (definition.getFrequency() == Frequency.CUSTOM && definition.getCustomUnit() == null) {
            throw new IllegalArgumentException("customUnit is required for CUSTOM frequency");
        }
        if (definition.getPayload() == null) {
            throw new IllegalArgumentException("payload is required");
        }
    }

    private static IllegalArgumentException notFound(String id) {
        return new IllegalArgumentException("Recurrence not found: " + id);
    }
}
