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

import java.time.ZonedDateTime;

/**
 * The occurrences surrounding a reference instant.
 *
 * @param previous
 *            latest occurrence at or before the reference instant, or
 *            {@code null} when the anchor itself is still in the future
 * @param next
 *            first occurrence strictly after the reference instant
 */
public record OccurrenceWindow(ZonedDateTime previous, ZonedDateTime next) {
}
