package me.golemcore.chime.adapter.outbound.storage;

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
import me.golemcore.chime.port.outbound.RecurrenceStorePort;
import me.golemcore.chime.port.outbound.StoragePort;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Optional;
import java.util.UUID;
import java.util.function.UnaryOperator;

/**
 * {@link RecurrenceStorePort} persisted as a JSON array in
 * {@code recurrences/definitions.json}.
 *
 * <p>
 * The file is loaded lazily on first use and kept as a process-wide cache.
 * Every mutation works on a copy of the list and only replaces the cache after
 * the atomic write succeeded, so a failed write leaves both disk and memory at
 * the previous state. Callers always receive detached copies.
 */
@Component
@Slf4j
public class JsonRecurrenceStore implements RecurrenceStorePort {

    private static final String RECURRENCES_DIR = "recurrences";
    private static final String DEFINITIONS_FILE = "definitions.json";
    private static final String ID_PREFIX = "rec-";
    private static final TypeReference<List<RecurrenceDefinition>> DEFINITION_LIST_TYPE_REF = new TypeReference<>() {
    };

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;

    private List<RecurrenceDefinition> definitionsCache;

    public JsonRecurrenceStore(StoragePort storagePort, ObjectMapper objectMapper) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
    }

    @Override
    public synchronized Optional<RecurrenceDefinition> get(String id) {
        return definitions().stream()
                .filter(d -> d.getId().equals(id))
                .findFirst()
                .map(JsonRecurrenceStore::copyOf);
    }

    @Override
    public synchronized String insert(RecurrenceDefinition definition) {
        String id = ID_PREFIX + UUID.randomUUID().toString().substring(0, 8);
        RecurrenceDefinition stored = copyOf(definition);
        stored.setId(id);

        List<RecurrenceDefinition> updated = new ArrayList<>(definitions());
        updated.add(stored);
        save(updated);

        log.debug("[Store] Inserted recurrence {}", id);
        return id;
    }

    @Override
    public synchronized void update(RecurrenceDefinition definition) {
        boolean found = modify(definition.getId(), stored -> copyOf(definition));
        if (!found) {
            throw new IllegalArgumentException("Recurrence not found: " + definition.getId());
        }
    }

    @Override
    public synchronized boolean delete(String id) {
        List<RecurrenceDefinition> updated = new ArrayList<>(definitions());
        boolean removed = updated.removeIf(d -> d.getId().equals(id));
        if (removed) {
            save(updated);
            log.debug("[Store] Deleted recurrence {}", id);
        }
        return removed;
    }

    @Override
    public synchronized boolean setEnabled(String id, boolean enabled) {
        return modify(id, d -> {
            d.setEnabled(enabled);
            return d;
        });
    }

    @Override
    public synchronized boolean recordFiring(String id, FiringRecord firingRecord) {
        return modify(id, d -> {
            d.setLastFiredAt(firingRecord.firedSlot());
            d.setLastAttemptAt(firingRecord.attemptedAt());
            d.setLastOutcome(firingRecord.outcome());
            d.setLastError(firingRecord.error());
            return d;
        });
    }

    @Override
    public synchronized List<RecurrenceDefinition> listEnabled() {
        return definitions().stream()
                .filter(RecurrenceDefinition::isEnabled)
                .map(JsonRecurrenceStore::copyOf)
                .toList();
    }

    @Override
    public synchronized List<RecurrenceDefinition> listAll() {
        return definitions().stream()
                .sorted(Comparator.comparingInt(RecurrenceDefinition::getTargetHour)
                        .thenComparingInt(RecurrenceDefinition::getTargetMinute))
                .map(JsonRecurrenceStore::copyOf)
                .toList();
    }

    /**
     * Replace the stored definition with {@code change} applied to a copy of it,
     * then persist.
     */
    private boolean modify(String id, UnaryOperator<RecurrenceDefinition> change) {
        List<RecurrenceDefinition> updated = new ArrayList<>(definitions());
        for (int i = 0; i < updated.size(); i++) {
            if (updated.get(i).getId().equals(id)) {
                updated.set(i, change.apply(copyOf(updated.get(i))));
                save(updated);
                return true;
            }
        }
        return false;
    }

    private List<RecurrenceDefinition> definitions() {
        if (definitionsCache == null) {
            definitionsCache = load();
        }
        return definitionsCache;
    }

    private void save(List<RecurrenceDefinition> definitions) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(definitions);
            storagePort.putTextAtomic(RECURRENCES_DIR, DEFINITIONS_FILE, json, true).join();
            definitionsCache = definitions;
        } catch (IOException | RuntimeException e) {
            log.error("[Store] Failed to save recurrences", e);
            throw new IllegalStateException("Failed to persist recurrences", e);
        }
    }

    private List<RecurrenceDefinition> load() {
        try {
            String json = storagePort.getText(RECURRENCES_DIR, DEFINITIONS_FILE).join();
            if (json != null && !json.isBlank()) {
                List<RecurrenceDefinition> loaded = new ArrayList<>(objectMapper.readValue(json, DEFINITION_LIST_TYPE_REF));
                log.info("[Store] Loaded {} recurrences", loaded.size());
                return loaded;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - start empty on unreadable file
            log.warn("[Store] No recurrences found or failed to parse: {}", e.getMessage());
        }
        return new ArrayList<>();
    }

    private static RecurrenceDefinition copyOf(RecurrenceDefinition definition) {
        RecurrenceDefinition copy = definition.toBuilder().build();
        if (definition.getPayload() != null) {
            copy.setPayload(definition.getPayload().toBuilder().build());
        }
        return copy;
    }
}
