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

import me.golemcore.chime.domain.model.Frequency;
import me.golemcore.chime.domain.model.OccurrenceWindow;
import me.golemcore.chime.domain.model.PeriodUnit;
import me.golemcore.chime.domain.model.RecurrenceDefinition;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.Duration;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.time.temporal.ChronoUnit;

/**
 * Computes occurrences of a recurrence definition relative to a reference
 * instant.
 *
 * <p>
 * Occurrences are always derived from the anchor instant (the anchor date at
 * the target time of day), never from the last actual firing, so execution lag
 * never accumulates into drift. Day-based cadences re-apply the target time on
 * every step, which keeps the wall-clock time fixed across DST transitions.
 * Monthly steps re-clamp from the anchor's original day of month, so a
 * definition anchored on the 31st lands on the last day of short months and
 * returns to the 31st afterwards.
 *
 * <p>
 * The calculator is pure: no I/O, no clock access, no state.
 */
@Component
@Slf4j
public class NextOccurrenceCalculator {

    /**
     * Delay from {@code now} until the next occurrence. Always positive.
     */
    public Duration delayUntilNext(RecurrenceDefinition definition, ZonedDateTime now) {
        return Duration.between(now, nextOccurrence(definition, now));
    }

    /**
     * First occurrence strictly after {@code now}.
     */
    public ZonedDateTime nextOccurrence(RecurrenceDefinition definition, ZonedDateTime now) {
        return occurrencesAround(definition, now).next();
    }

    public OccurrenceWindow occurrencesAround(RecurrenceDefinition definition, ZonedDateTime now) {
        return occurrencesAround(definition, effectiveFrequency(definition), now);
    }

    /**
     * Occurrences around {@code now} computed with the given cadence instead of
     * the definition's own one.
     */
    public OccurrenceWindow occurrencesAround(RecurrenceDefinition definition, Frequency cadence,
            ZonedDateTime now) {
        ZoneId zone = now.getZone();
        LocalTime targetTime = definition.getTargetTime();
        Instant anchorTimestamp = definition.getAnchorTimestamp() != null
                ? definition.getAnchorTimestamp()
                : now.toInstant();

        LocalDate anchorDate = anchorTimestamp.atZone(zone).toLocalDate();
        int originalDayOfMonth = anchorDate.getDayOfMonth();
        ZonedDateTime cursor = ZonedDateTime.of(anchorDate, targetTime, zone);

        long skipped = cyclesToSkip(definition, cadence, cursor, now);
        if (skipped > 0) {
            cursor = jump(definition, cadence, cursor, skipped, originalDayOfMonth);
        }

        ZonedDateTime previous = null;
        int steps = 0;
        while (!cursor.isAfter(now)) {
            previous = cursor;
            cursor = step(definition, cadence, cursor, originalDayOfMonth);
            steps++;
        }

        log.trace("[Calc] {} {}: skipped {} cycles, stepped {} times, next {}",
                definition.getId(), cadence, skipped, steps, cursor);
        return new OccurrenceWindow(previous, cursor);
    }

    /**
     * The cadence used for occurrence math. A one-shot definition behaves as
     * daily so that it finds the next instance of its time of day.
     */
    public Frequency effectiveFrequency(RecurrenceDefinition definition) {
        if (!definition.isRecurring() || definition.getFrequency() == null) {
            return Frequency.DAILY;
        }
        return definition.getFrequency();
    }

    /**
     * Whole cycles between anchor and now, less one. Under-shooting leaves the
     * exact stepping loop to settle DST gaps, month lengths and leap years.
     */
    private long cyclesToSkip(RecurrenceDefinition definition, Frequency cadence,
            ZonedDateTime anchor, ZonedDateTime now) {
        if (!anchor.isBefore(now)) {
            return 0;
        }
        long cycles = switch (cadence) {
        case HOURLY -> ChronoUnit.HOURS.between(anchor, now);
        case DAILY -> ChronoUnit.DAYS.between(anchor.toLocalDate(), now.toLocalDate());
        case WEEKLY -> ChronoUnit.DAYS.between(anchor.toLocalDate(), now.toLocalDate()) / 7;
        case MONTHLY -> ChronoUnit.MONTHS.between(anchor.toLocalDate(), now.toLocalDate());
        case CUSTOM -> customCycles(definition, anchor, now);
        };
        return Math.max(0, cycles - 1);
    }

    private long customCycles(RecurrenceDefinition definition, ZonedDateTime anchor, ZonedDateTime now) {
        int period = definition.getEffectivePeriod();
        if (definition.getCustomUnit() == PeriodUnit.HOURS) {
            return ChronoUnit.HOURS.between(anchor, now) / period;
        }
        return ChronoUnit.DAYS.between(anchor.toLocalDate(), now.toLocalDate()) / period;
    }

    private ZonedDateTime jump(RecurrenceDefinition definition, Frequency cadence, ZonedDateTime anchor,
            long cycles, int originalDayOfMonth) {
        return switch (cadence) {
        case HOURLY -> anchor.plusHours(cycles);
        case DAILY -> atTargetTime(definition, anchor.toLocalDate().plusDays(cycles), anchor.getZone());
        case WEEKLY -> atTargetTime(definition, anchor.toLocalDate().plusWeeks(cycles), anchor.getZone());
        case MONTHLY -> atTargetTime(definition,
                clampDay(anchor.toLocalDate().plusMonths(cycles), originalDayOfMonth), anchor.getZone());
        case CUSTOM -> definition.getCustomUnit() == PeriodUnit.HOURS
                ? anchor.plusHours(cycles * definition.getEffectivePeriod())
                : atTargetTime(definition,
                        anchor.toLocalDate().plusDays(cycles * definition.getEffectivePeriod()),
                        anchor.getZone());
        };
    }

    private ZonedDateTime step(RecurrenceDefinition definition, Frequency cadence, ZonedDateTime cursor,
            int originalDayOfMonth) {
        return jump(definition, cadence, cursor, 1, originalDayOfMonth);
    }

    private static LocalDate clampDay(LocalDate date, int originalDayOfMonth) {
        return date.withDayOfMonth(Math.min(originalDayOfMonth, date.lengthOfMonth()));
    }

    private static ZonedDateTime atTargetTime(RecurrenceDefinition definition, LocalDate date, ZoneId zone) {
        return ZonedDateTime.of(date, definition.getTargetTime(), zone);
    }
}
