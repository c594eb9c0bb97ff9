package me.golemcore.chime.port.outbound;

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

import java.time.Duration;
import java.util.Optional;
import java.util.Set;

/**
 * Durable one-shot delayed-job executor.
 *
 * <p>
 * Holds at most one pending job per key. A job fires at or after its delay;
 * precision beyond that soft lower bound is not guaranteed.
 */
public interface DelayedJobExecutorPort {

    /**
     * Enqueue a job under {@code key}, atomically superseding any job still
     * pending for the same key.
     */
    void enqueueReplacing(String key, Duration delay, FiringJob job);

    /**
     * Remove the pending job for {@code key}. No-op when none is pending. Does
     * not interrupt a firing already in progress.
     */
    void cancel(String key);

    Optional<FiringJob> pending(String key);

    Set<String> pendingKeys();
}
