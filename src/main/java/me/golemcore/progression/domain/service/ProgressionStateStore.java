package me.golemcore.progression.domain.service;

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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.domain.ProgressionCatalog;
import me.golemcore.progression.domain.model.EventCursor;
import me.golemcore.progression.domain.model.Gate;
import me.golemcore.progression.domain.model.ProfileOverlays;
import me.golemcore.progression.domain.model.ProgressionState;
import me.golemcore.progression.domain.model.Rule;
import me.golemcore.progression.domain.model.ToyboxProfile;
import me.golemcore.progression.domain.model.ToyboxState;
import me.golemcore.progression.domain.model.UserProgressionState;
import me.golemcore.progression.port.outbound.StoragePort;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.Map;
import java.util.TreeMap;

/**
 * Persistence of the progression document and the ingestion cursor.
 *
 * <p>
 * Loading merges built-in defaults (amulet gate, default rule, toybox
 * profiles) into whatever is on disk. Both documents are written atomically.
 */
@Component
@Slf4j
public class ProgressionStateStore {

    public static final String PROGRESSION_DIR = "progression";
    public static final String STATE_FILE = "state.json";
    public static final String CURSOR_FILE = "cursor.json";

    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final ProgressionMutator mutator;
    private final Clock clock;

    public ProgressionStateStore(StoragePort storagePort, ObjectMapper objectMapper, ProgressionMutator mutator,
            Clock clock) {
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.mutator = mutator;
        this.clock = clock;
    }

    // ==================== Progression document ====================

    public ProgressionState load() {
        ProgressionState loaded = null;
        try {
            String json = storagePort.getText(PROGRESSION_DIR, STATE_FILE).join();
            if (json != null && !json.isBlank()) {
                loaded = objectMapper.readValue(json, ProgressionState.class);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - intentionally catch all for fallback
            log.warn("[Progression] Failed to parse progression state, starting from defaults: {}",
                    e.getMessage());
        }
        if (loaded == null) {
            log.info("[Progression] No progression state found, initialising defaults");
            ProgressionState state = defaults();
            save(state);
            return state;
        }
        return mergeDefaults(loaded);
    }

    public void save(ProgressionState state) {
        try {
            state.setUpdatedAt(Instant.now(clock));
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(state);
            storagePort.putTextAtomic(PROGRESSION_DIR, STATE_FILE, json, true).join();
        } catch (Exception e) {
            log.error("[Progression] Failed to save progression state", e);
            throw new IllegalStateException("Failed to persist progression state", e);
        }
    }

    public ProgressionState defaults() {
        ProgressionState state = new ProgressionState();
        state.setUpdatedAt(Instant.now(clock));
        return mergeDefaults(state);
    }

    private ProgressionState mergeDefaults(ProgressionState state) {
        if (state.getGates() == null) {
            state.setGates(new TreeMap<>());
        }
        state.getGates().computeIfAbsent(ProgressionCatalog.AMULET_GATE_ID, id -> Gate.builder()
                .id(id)
                .title(ProgressionCatalog.AMULET_GATE_TITLE)
                .lens(ProgressionCatalog.AMULET_GATE_LENS)
                .completed(false)
                .build());
        state.getGates().forEach((id, gate) -> {
            if (gate.getId() == null) {
                gate.setId(id);
            }
        });

        if (state.getRules() == null) {
            state.setRules(new TreeMap<>());
        }
        state.getRules().computeIfAbsent(ProgressionCatalog.DEFAULT_RULE_ID, id -> Rule.builder()
                .id(id)
                .ifExpression(ProgressionCatalog.DEFAULT_RULE_IF)
                .thenExpression(ProgressionCatalog.DEFAULT_RULE_THEN)
                .enabled(true)
                .source(ProgressionCatalog.SOURCE_SYSTEM_DEFAULT)
                .createdAt(Instant.now(clock))
                .updatedAt(Instant.now(clock))
                .build());
        state.getRules().forEach((id, rule) -> {
            if (rule.getId() == null) {
                rule.setId(id);
            }
        });

        if (state.getToybox() == null) {
            state.setToybox(new ToyboxState());
        }
        ToyboxState toybox = state.getToybox();
        if (toybox.getProfiles() == null) {
            toybox.setProfiles(new TreeMap<>());
        }
        for (Map.Entry<String, ToyboxProfile> entry : ProgressionCatalog.defaultToyboxProfiles().entrySet()) {
            toybox.getProfiles().putIfAbsent(entry.getKey(), entry.getValue());
        }
        if (toybox.getActiveProfile() == null || toybox.getActiveProfile().isBlank()) {
            toybox.setActiveProfile(ProgressionCatalog.DEFAULT_TOYBOX);
        }

        if (state.getOverlays() == null) {
            state.setOverlays(new ProfileOverlays());
        }
        if (state.getUsers() == null) {
            state.setUsers(new TreeMap<>());
        }
        for (UserProgressionState user : state.getUsers().values()) {
            mutator.normalizeUser(user);
        }
        state.setVersion(ProgressionState.CURRENT_VERSION);
        return state;
    }

    // ==================== Cursor ====================

    public EventCursor loadCursor() {
        try {
            String json = storagePort.getText(PROGRESSION_DIR, CURSOR_FILE).join();
            if (json != null && !json.isBlank()) {
                EventCursor cursor = objectMapper.readValue(json, EventCursor.class);
                return cursor.offset() >= 0 ? cursor : EventCursor.start();
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - intentionally catch all for fallback
            log.warn("[EventLog] Failed to parse cursor, restarting from offset 0: {}", e.getMessage());
        }
        return EventCursor.start();
    }

    public void saveCursor(EventCursor cursor) {
        try {
            String json = objectMapper.writeValueAsString(cursor);
            storagePort.putTextAtomic(PROGRESSION_DIR, CURSOR_FILE, json, false).join();
        } catch (Exception e) {
            log.error("[EventLog] Failed to save cursor", e);
            throw new IllegalStateException("Failed to persist event cursor", e);
        }
    }
}
