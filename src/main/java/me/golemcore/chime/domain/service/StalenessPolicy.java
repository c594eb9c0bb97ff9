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

import java.time.Duration;
import java.time.Instant;
import java.time.ZonedDateTime;

/**
 * Admission check for late firings. A stale firing is skipped rather than
 * acted on; the chain still continues.
 */
public interface StalenessPolicy {

    /**
     * Whether a job intended for {@code intendedFireAt} that runs at
     * {@code now} is too late to act.
     */
    boolean isStale(Instant intendedFireAt, ZonedDateTime now);

    Duration tolerance();
}
