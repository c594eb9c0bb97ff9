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
import java.time.LocalTime;
import java.time.ZonedDateTime;

/**
 * Stale when the wall-clock time of day at firing is further than the
 * tolerance from the intended time of day, measured around the clock so that
 * 23:50 and 00:10 are twenty minutes apart.
 *
 * <p>
 * Only the time of day is compared: a firing that is a whole day late at the
 * right time is admitted.
 */
public class TimeOfDayStalenessPolicy implements StalenessPolicy {

    private static final int MINUTES_PER_DAY = 24 * 60;

    private final Duration tolerance;

    public TimeOfDayStalenessPolicy(Duration tolerance) {
        this.tolerance = tolerance;
    }

    @Override
    public boolean isStale(Instant intendedFireAt, ZonedDateTime now) {
        LocalTime intended = intendedFireAt.atZone(now.getZone()).toLocalTime();
        return circularDistanceMinutes(intended, now.toLocalTime()) > tolerance.toMinutes();
    }

    @Override
    public Duration tolerance() {
        return tolerance;
    }

    static int circularDistanceMinutes(LocalTime a, LocalTime b) {
        int diff = Math.abs(minuteOfDay(a) - minuteOfDay(b));
        return Math.min(diff, MINUTES_PER_DAY - diff);
    }

    private static int minuteOfDay(LocalTime time) {
        return time.getHour() * 60 + time.getMinute();
    }
}
