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

import me.golemcore.chime.domain.model.FiringRecord;
import me.golemcore.chime.domain.model.RecurrenceDefinition;

import java.util.List;
import java.util.Optional;

/**
 * Persistent record store for recurrence definitions.
 *
 * <p>
 * Implementations return detached copies: mutating a returned definition never
 * changes stored state. Reads are point-in-time consistent; no isolation
 * stronger than read-committed is assumed by callers.
 */
public interface RecurrenceStorePort {

    Optional<RecurrenceDefinition> get(String id);

    /**
     * Insert a new definition, assigning its id.
     *
     * @return the assigned id
     */
    String insert(RecurrenceDefinition definition);

    /**
     * Replace the stored definition with the same id.
     *
     * @throws IllegalArgumentException
     *             if no definition with that id exists
     */
    void update(RecurrenceDefinition definition);

    /**
     * Delete a definition.
     *
     * @return true if a definition was removed
     */
    boolean delete(String id);

    /**
     * Set only the enabled flag.
     *
     * @return true if the definition exists
     */
    boolean setEnabled(String id, boolean enabled);

    /**
     * Write only the firing status fields, leaving user-editable fields as they
     * are.
     *
     * @return true if the definition exists
     */
    boolean recordFiring(String id, FiringRecord firingRecord);

    List<RecurrenceDefinition> listEnabled();

    /**
     * All definitions ordered by target hour, then minute.
     */
    List<RecurrenceDefinition> listAll();
}
