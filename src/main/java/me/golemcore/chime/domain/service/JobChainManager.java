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
import me.golemcore.chime.domain.model.Frequency;
import me.golemcore.chime.domain.model.OccurrenceWindow;
import me.golemcore.chime.domain.model.RecurrenceDefinition;
import me.golemcore.chime.domain.model.ScheduledLink;
import me.golemcore.chime.port.outbound.DelayedJobExecutorPort;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;
import java.util.Optional;

/**
 * Maintains the one-shot job chain of each definition on the delayed-job
 * executor.
 *
 * <p>
 * Each call enqueues exactly one job keyed by the definition id with
 * replace-existing semantics, so repeated edits, toggles and firings never
 * leave two pending jobs for the same definition.
 *
 * <p>
 * Two start policies:
 * <ul>
 * <li><b>Strict</b> ({@code catchUpMode = false}, first creation): sub-daily
 * cadences start at the next daily-anchored slot instead of mid-sequence; the
 * firing chain takes over the sub-daily stepping from there.</li>
 * <li><b>Catch-up</b> ({@code catchUpMode = true}, edits, toggles, restarts and
 * chain continuation): a just-missed occurrence that was never handled, lies
 * within the staleness tolerance in absolute time and would still pass the
 * staleness admission check is enqueued for immediate firing; otherwise the
 * next occurrence is enqueued.</li>
 * </ul>
 */
@Service
@Slf4j
public class JobChainManager {

    private final NextOccurrenceCalculator calculator;
    private final DelayedJobExecutorPort executor;
    private final StalenessPolicy stalenessPolicy;
    private final Clock clock;

    public JobChainManager(NextOccurrenceCalculator calculator, DelayedJobExecutorPort executor,
            StalenessPolicy stalenessPolicy, Clock clock) {
        this.calculator = calculator;
        this.executor = executor;
        this.stalenessPolicy = stalenessPolicy;
        this.clock = clock;
    }

    /**
     * Enqueue the next link of the definition's chain, superseding any pending
     * job. A disabled definition gets its pending job cancelled instead.
     *
     * @return the enqueued link, or empty if the definition is disabled
     */
    public Optional<ScheduledLink> scheduleNext(RecurrenceDefinition definition, boolean catchUpMode) {
        if (!definition.isEnabled()) {
            log.debug("[Chain] {} is disabled, cancelling instead of scheduling", definition.getId());
            cancel(definition.getId());
            return Optional.empty();
        }

        ZonedDateTime now = clock.instant().atZone(clock.getZone());
        ScheduledLink link = planNext(definition, catchUpMode, now);

        executor.enqueueReplacing(definition.getId(), link.delay(),
                new FiringJob(definition.getId(), link.intendedFireAt(), now.toInstant()));

        if (link.catchUp()) {
            log.info("[Chain] {} catching up missed occurrence {} immediately",
                    definition.getId(), link.intendedFireAt());
        } else {
            log.info("[Chain] {} next firing at {} (in {})",
                    definition.getId(), link.intendedFireAt(), link.delay());
        }
        return Optional.of(link);
    }

    /**
     * Remove any pending job for the definition. Safe when none exists.
     */
    public void cancel(String id) {
        executor.cancel(id);
        log.debug("[Chain] Cancelled pending job for {}", id);
    }

    /**
     * The link that {@link #scheduleNext} would enqueue, without enqueuing it.
     */
    public ScheduledLink preview(RecurrenceDefinition definition, boolean catchUpMode) {
        return planNext(definition, catchUpMode, clock.instant().atZone(clock.getZone()));
    }

    private ScheduledLink planNext(RecurrenceDefinition definition, boolean catchUpMode, ZonedDateTime now) {
        Frequency cadence = startCadence(definition, catchUpMode);
        OccurrenceWindow window = calculator.occurrencesAround(definition, cadence, reference(definition, now));

        if (catchUpMode && isUnhandledMiss(definition, window.previous(), now)) {
            return new ScheduledLink(definition.getId(), Duration.ZERO, window.previous().toInstant(), true);
        }

        Duration delay = Duration.between(now, window.next());
        return new ScheduledLink(definition.getId(), delay, window.next().toInstant(), false);
    }

    /**
     * The handled slot can lie ahead of the wall clock: the in-process executor
     * waits on a monotonic timer, so a pending job runs early by wall-clock time
     * after the system clock is set back, and an external executor may deliver
     * jobs ahead of this host's clock. The next link must still come after the
     * handled slot.
     */
    private static ZonedDateTime reference(RecurrenceDefinition definition, ZonedDateTime now) {
        Instant lastFiredAt = definition.getLastFiredAt();
        if (lastFiredAt != null && lastFiredAt.isAfter(now.toInstant())) {
            return lastFiredAt.atZone(now.getZone());
        }
        return now;
    }

    private Frequency startCadence(RecurrenceDefinition definition, boolean catchUpMode) {
        if (!catchUpMode && definition.isRecurring() && definition.isSubDaily()) {
            return Frequency.DAILY;
        }
        return calculator.effectiveFrequency(definition);
    }

    private boolean isUnhandledMiss(RecurrenceDefinition definition, ZonedDateTime missed, ZonedDateTime now) {
        if (missed == null) {
            return false;
        }
        Instant slot = missed.toInstant();
        Instant anchorTimestamp = definition.getAnchorTimestamp();
        if (anchorTimestamp != null && slot.isBefore(anchorTimestamp)) {
            return false;
        }
        if (definition.getLastFiredAt() != null && !slot.isAfter(definition.getLastFiredAt())) {
            return false;
        }
        if (Duration.between(slot, now.toInstant()).compareTo(stalenessPolicy.tolerance()) > 0) {
            return false;
        }
        return !stalenessPolicy.isStale(slot, now);
    }
}
