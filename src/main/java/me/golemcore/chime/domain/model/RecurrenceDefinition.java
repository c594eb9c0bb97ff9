package me.golemcore.chime.domain.model;

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

import com.fasterxml.jackson.annotation.JsonIgnore;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.time.LocalTime;
import java.util.Locale;

/**
 * A schedulable unit: what to send, at which time of day, and on which cadence.
 * Persisted in {@code recurrences/definitions.json} and re-read at every
 * firing, so instances are treated as snapshots and never cached across a
 * suspension point.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class RecurrenceDefinition {

    private String id;
    private int targetHour;
    private int targetMinute;
    private boolean recurring;

    @Builder.Default
    private Frequency frequency = Frequency.DAILY;

    @Builder.Default
    private int customPeriod = 1;

    @Builder.Default
    private PeriodUnit customUnit = PeriodUnit.DAYS;

    private boolean enabled;
    private MessagePayload payload;

    private Instant startDate;
    private Instant createdAt;
    private Instant updatedAt;

    private Instant lastFiredAt;
    private Instant lastAttemptAt;
    private FiringOutcome lastOutcome;
    private String lastError;

    /**
     * Reference instant for recurrence math: the explicit start date when the
     * user chose one, otherwise the creation time.
     */
    @JsonIgnore
    public Instant getAnchorTimestamp() {
        return startDate != null ? startDate : createdAt;
    }

    /**
     * Custom period coerced to at least one.
     */
    @JsonIgnore
    public int getEffectivePeriod() {
        return Math.max(1, customPeriod);
    }

    @JsonIgnore
    public LocalTime getTargetTime() {
        return LocalTime.of(targetHour, targetMinute);
    }

    /**
     * Whether consecutive occurrences are less than a day apart.
     */
    @JsonIgnore
    public boolean isSubDaily() {
        return frequency == Frequency.HOURLY
                || (frequency == Frequency.CUSTOM && customUnit == PeriodUnit.HOURS);
    }

    /**
     * Target time in 12-hour form, e.g. {@code 9:05 AM}.
     */
    @JsonIgnore
    public String getDisplayTime() {
        int hour12 = targetHour % 12 == 0 ? 12 : targetHour % 12;
        String suffix = targetHour < 12 ? "AM" : "PM";
        return String.format(Locale.ROOT, "%d:%02d %s", hour12, targetMinute, suffix);
    }
}
