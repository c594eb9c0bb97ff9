package me.golemcore.chime.adapter.outbound.executor;

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
import me.golemcore.chime.domain.model.FiringJobDueEvent;
import me.golemcore.chime.infrastructure.config.ChimeProperties;
import me.golemcore.chime.port.outbound.DelayedJobExecutorPort;
import me.golemcore.chime.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import jakarta.annotation.PostConstruct;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.ApplicationEventPublisher;
import org.springframework.context.event.EventListener;
import org.springframework.core.Ordered;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;

/**
 * In-process {@link DelayedJobExecutorPort} backed by a
 * {@link ScheduledExecutorService}.
 *
 * <p>
 * At most one job is pending per key. Enqueueing under an existing key cancels
 * the previous future; a generation token guards against a superseded future
 * that already started running, so it can never dispatch. The pending index is
 * written to {@code jobs/pending.json} after every change and re-armed once
 * the application is ready, which makes pending jobs survive a restart.
 *
 * <p>
 * Due jobs are dispatched as {@link FiringJobDueEvent} on an executor thread.
 */
@Component
@Slf4j
public class LocalDelayedJobExecutor implements DelayedJobExecutorPort {

    private static final String JOBS_DIR = "jobs";
    private static final String PENDING_FILE = "pending.json";
    private static final TypeReference<List<PersistedJob>> PERSISTED_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ApplicationEventPublisher eventPublisher;
    private final ChimeProperties properties;
    private final Clock clock;

    private final Map<String, PendingJob> pending = new ConcurrentHashMap<>();
    private final AtomicLong generation = new AtomicLong();

    private ScheduledExecutorService scheduler;
    private List<PersistedJob> persistedAtStartup = List.of();

    public LocalDelayedJobExecutor(StoragePort storagePort, ObjectMapper objectMapper,
            ApplicationEventPublisher eventPublisher, ChimeProperties properties, Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.eventPublisher = eventPublisher;
        this.properties = properties;
        this.clock = clock;
    }

    @PostConstruct
    public void init() {
        AtomicInteger threadIndex = new AtomicInteger();
        scheduler = Executors.newScheduledThreadPool(Math.max(1, properties.getExecutor().getThreads()), r -> {
            Thread t = new Thread(r, "chime-job-executor-" + threadIndex.incrementAndGet());
            t.setDaemon(true);
            return t;
        });
        loadPersisted();
    }

    /**
     * Re-arm jobs persisted by a previous process. Runs after startup recovery,
     * so keys that recovery already scheduled keep their fresh job.
     */
    @EventListener(ApplicationReadyEvent.class)
    @Order(Ordered.LOWEST_PRECEDENCE)
    public synchronized void restorePending() {
        Instant now = clock.instant();
        int restored = 0;
        for (PersistedJob job : persistedAtStartup) {
            if (pending.containsKey(job.key())) {
                continue;
            }
            Duration delay = job.fireAt().isAfter(now) ? Duration.between(now, job.fireAt()) : Duration.ZERO;
            arm(job.key(), new FiringJob(job.definitionId(), job.intendedFireAt(), job.enqueuedAt()),
                    job.fireAt(), delay);
            restored++;
        }
        persistedAtStartup = List.of();
        if (restored > 0) {
            persist();
        }
        log.info("[Executor] Restored {} pending jobs", restored);
    }

    @PreDestroy
    public void shutdown() {
        if (scheduler != null) {
            scheduler.shutdown();
            try {
                if (!scheduler.awaitTermination(5, TimeUnit.SECONDS)) {
                    scheduler.shutdownNow();
                }
            } catch (InterruptedException e) {
                scheduler.shutdownNow();
                Thread.currentThread().interrupt();
            }
        }
        log.info("[Executor] Shut down with {} pending jobs", pending.size());
    }

    @Override
    public synchronized void enqueueReplacing(String key, Duration delay, FiringJob job) {
        Duration effectiveDelay = delay.isNegative() ? Duration.ZERO : delay;
        arm(key, job, clock.instant().plus(effectiveDelay), effectiveDelay);
        persist();
    }

    @Override
    public synchronized void cancel(String key) {
        PendingJob removed = pending.remove(key);
        if (removed != null) {
            removed.future().cancel(false);
            persist();
            log.debug("[Executor] Cancelled job {}", key);
        }
    }

    @Override
    public Optional<FiringJob> pending(String key) {
        PendingJob job = pending.get(key);
        return job != null ? Optional.of(job.job()) : Optional.empty();
    }

    @Override
    public Set<String> pendingKeys() {
        return Set.copyOf(pending.keySet());
    }

    private void arm(String key, FiringJob job, Instant fireAt, Duration delay) {
        PendingJob previous = pending.remove(key);
        if (previous != null) {
            previous.future().cancel(false);
            log.debug("[Executor] Replaced pending job {}", key);
        }

        long token = generation.incrementAndGet();
        ScheduledFuture<?> future = scheduler.schedule(() -> dispatch(key, token),
                delay.toMillis(), TimeUnit.MILLISECONDS);
        pending.put(key, new PendingJob(job, fireAt, token, future));
    }

    private void dispatch(String key, long token) {
        PendingJob due;
        synchronized (this) {
            due = pending.get(key);
            if (due == null || due.token() != token) {
                log.debug("[Executor] Job {} was superseded, not dispatching", key);
                return;
            }
            pending.remove(key);
            persist();
        }

        try {
            eventPublisher.publishEvent(new FiringJobDueEvent(due.job()));
        } catch (RuntimeException e) {
            log.error("[Executor] Job {} handler failed", key, e);
        }
    }

    private void persist() {
        List<PersistedJob> snapshot = new ArrayList<>();
        pending.forEach((key, job) -> snapshot.add(new PersistedJob(key, job.job().definitionId(),
                job.job().intendedFireAt(), job.job().enqueuedAt(), job.fireAt())));
        try {
            String json = objectMapper.writeValueAsString(snapshot);
            storagePort.putTextAtomic(JOBS_DIR, PENDING_FILE, json, false).join();
        } catch (IOException | RuntimeException e) { // NOSONAR - in-memory queue stays authoritative
            log.error("[Executor] Failed to persist pending jobs", e);
        }
    }

    private void loadPersisted() {
        try {
            String json = storagePort.getText(JOBS_DIR, PENDING_FILE).join();
            if (json != null && !json.isBlank()) {
                persistedAtStartup = objectMapper.readValue(json, PERSISTED_LIST_TYPE_REF);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - startup recovery rebuilds the chains
            log.warn("[Executor] Failed to read pending jobs: {}", e.getMessage());
        }
    }

    private record PendingJob(FiringJob job, Instant fireAt, long token, ScheduledFuture<?> future) {
    }

    record PersistedJob(String key, String definitionId, Instant intendedFireAt, Instant enqueuedAt,
            Instant fireAt) {
    }
}
