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
import me.golemcore.progression.domain.model.CanonicalEvent;
import me.golemcore.progression.domain.model.CanonicalEventType;
import me.golemcore.progression.domain.model.ErrorKind;
import me.golemcore.progression.domain.model.MapActionResult;
import me.golemcore.progression.domain.model.MapRuntimeState;
import me.golemcore.progression.domain.model.MapRuntimeUserState;
import me.golemcore.progression.domain.model.MapStatus;
import me.golemcore.progression.domain.model.Place;
import me.golemcore.progression.domain.model.PlaceGraph;
import me.golemcore.progression.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Per-user position over the static place graph.
 *
 * <p>
 * Every action except {@link #status(String)} appends exactly one canonical
 * {@code MAP_*} event to the log. The runtime never touches progression
 * state: rewards are realized when the progression engine ingests the event.
 * Traversal between places whose z differs by two or more requires a portal at
 * either endpoint.
 */
@Service
@Slf4j
public class MapRuntimeService {

    public static final String SOURCE = "core:map-runtime";
    public static final String MAP_DIR = "map";
    public static final String STATE_FILE = "runtime_state.json";

    public static final String ACTION_ENTER = "ENTER";
    public static final String ACTION_MOVE = "MOVE";
    public static final String ACTION_INSPECT = "INSPECT";
    public static final String ACTION_INTERACT = "INTERACT";
    public static final String ACTION_COMPLETE = "COMPLETE";
    public static final String ACTION_TICK = "TICK";

    private static final int NPC_PHASES = 8;
    private static final int WORLD_PHASES = 16;
    private static final int PORTAL_Z_DELTA = 2;
    private static final String MODE_WALK = "walk";
    private static final String MODE_PORTAL = "portal";
    private static final String NO_CURRENT_PLACE = "No current place";

    private final PlaceGraph placeGraph;
    private final StoragePort storagePort;
    private final EventLogService eventLog;
    private final ObjectMapper objectMapper;
    private final Clock clock;

    private MapRuntimeState state;

    public MapRuntimeService(PlaceGraph placeGraph, StoragePort storagePort, EventLogService eventLog,
            ObjectMapper objectMapper, Clock clock) {
        this.placeGraph = placeGraph;
        this.storagePort = storagePort;
        this.eventLog = eventLog;
        this.objectMapper = objectMapper;
        this.clock = clock;
    }

    // ==================== Queries ====================

    public MapStatus status(String username) {
        MapRuntimeUserState user = ensureUser(username);
        Optional<Place> current = placeGraph.find(user.getCurrentPlaceId());
        if (current.isEmpty()) {
            return MapStatus.builder()
                    .ok(false)
                    .username(username)
                    .errorKind(ErrorKind.UNAVAILABLE)
                    .error("No map seed places available")
                    .build();
        }
        Place place = current.get();
        return MapStatus.builder()
                .ok(true)
                .username(username)
                .currentPlaceId(place.getPlaceId())
                .place(place)
                .chunk2dId(place.getChunk2dId())
                .tickCounter(user.getTickCounter())
                .npcPhase(user.getNpcPhase())
                .worldPhase(user.getWorldPhase())
                .build();
    }

    // ==================== Actions ====================

    public MapActionResult enter(String username, String placeId) {
        MapRuntimeUserState user = ensureUser(username);
        Optional<Place> target = placeGraph.find(trim(placeId));
        if (target.isEmpty()) {
            return MapActionResult.failure(ACTION_ENTER, ErrorKind.MALFORMED_INPUT, "Unknown place: " + placeId);
        }
        Place place = target.get();
        user.setCurrentPlaceId(place.getPlaceId());
        user.setUpdatedAt(Instant.now(clock));
        save();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", ACTION_ENTER);
        payload.put("place_id", place.getPlaceId());
        payload.put("place_ref", place.getPlaceRef());
        payload.put("chunk2d_id", place.getChunk2dId());
        payload.put("location", location(place));
        CanonicalEvent event = append(username, CanonicalEventType.MAP_ENTER, payload);
        return MapActionResult.builder()
                .ok(true)
                .action(ACTION_ENTER)
                .placeId(place.getPlaceId())
                .place(place)
                .event(event)
                .build();
    }

    /**
     * Move along a link of the current place.
     *
     * <p>
     * Fails with {@code blocked="edge"} when the target is not linked and with
     * {@code blocked="portal"} for a vertical move of two or more levels when
     * neither endpoint has a portal.
     */
    public MapActionResult move(String username, String targetPlaceId) {
        MapRuntimeUserState user = ensureUser(username);
        Optional<Place> currentPlace = placeGraph.find(user.getCurrentPlaceId());
        Optional<Place> targetPlace = placeGraph.find(trim(targetPlaceId));
        if (currentPlace.isEmpty() || targetPlace.isEmpty()) {
            return MapActionResult.failure(ACTION_MOVE, ErrorKind.MALFORMED_INPUT,
                    "Current/target place is unavailable");
        }
        Place current = currentPlace.get();
        Place target = targetPlace.get();

        if (!current.getLinks().contains(target.getPlaceId())) {
            MapActionResult blocked = MapActionResult.failure(ACTION_MOVE, ErrorKind.MALFORMED_INPUT,
                    "Blocked edge: " + current.getPlaceId() + " -> " + target.getPlaceId() + " is not linked");
            blocked.setBlocked(MapActionResult.BLOCKED_EDGE);
            blocked.setFromPlaceId(current.getPlaceId());
            blocked.setPlaceId(target.getPlaceId());
            return blocked;
        }

        int zDelta = Math.abs(target.getZ() - current.getZ());
        boolean requiresPortal = zDelta >= PORTAL_Z_DELTA;
        if (requiresPortal && current.getPortals().isEmpty() && target.getPortals().isEmpty()) {
            MapActionResult blocked = MapActionResult.failure(ACTION_MOVE, ErrorKind.MALFORMED_INPUT,
                    "Blocked traversal: portal transition required for vertical move");
            blocked.setBlocked(MapActionResult.BLOCKED_PORTAL);
            blocked.setFromPlaceId(current.getPlaceId());
            blocked.setPlaceId(target.getPlaceId());
            blocked.setZDelta(zDelta);
            return blocked;
        }

        int terrainCost = 1 + target.getHazards().size() + Math.max(0, zDelta - 1);
        String mode = requiresPortal ? MODE_PORTAL : MODE_WALK;

        user.setCurrentPlaceId(target.getPlaceId());
        user.setUpdatedAt(Instant.now(clock));
        save();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", ACTION_MOVE);
        payload.put("from_place_id", current.getPlaceId());
        payload.put("to_place_id", target.getPlaceId());
        payload.put("from_place_ref", current.getPlaceRef());
        payload.put("to_place_ref", target.getPlaceRef());
        payload.put("terrain_cost", terrainCost);
        payload.put("mode", mode);
        payload.put("z_delta", zDelta);
        payload.put("chunk2d_id", target.getChunk2dId());
        payload.put("location", location(target));
        CanonicalEvent event = append(username, CanonicalEventType.MAP_TRAVERSE, payload);
        log.debug("[MapRuntime] {} moved {} -> {} ({}, cost {})", username, current.getPlaceId(),
                target.getPlaceId(), mode, terrainCost);
        return MapActionResult.builder()
                .ok(true)
                .action(ACTION_MOVE)
                .fromPlaceId(current.getPlaceId())
                .placeId(target.getPlaceId())
                .place(target)
                .mode(mode)
                .terrainCost(terrainCost)
                .zDelta(zDelta)
                .event(event)
                .build();
    }

    public MapActionResult inspect(String username) {
        Optional<Place> current = currentPlace(username);
        if (current.isEmpty()) {
            return MapActionResult.failure(ACTION_INSPECT, ErrorKind.UNAVAILABLE, NO_CURRENT_PLACE);
        }
        Place place = current.get();
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", ACTION_INSPECT);
        payload.put("place_id", place.getPlaceId());
        payload.put("place_ref", place.getPlaceRef());
        payload.put("interaction_points", List.copyOf(place.getInteractionPoints()));
        payload.put("npc_spawn", List.copyOf(place.getNpcSpawn()));
        payload.put("hazards", List.copyOf(place.getHazards()));
        payload.put("location", location(place));
        CanonicalEvent event = append(username, CanonicalEventType.MAP_INSPECT, payload);
        return MapActionResult.builder()
                .ok(true)
                .action(ACTION_INSPECT)
                .placeId(place.getPlaceId())
                .place(place)
                .interactionPoints(List.copyOf(place.getInteractionPoints()))
                .npcSpawn(List.copyOf(place.getNpcSpawn()))
                .hazards(List.copyOf(place.getHazards()))
                .event(event)
                .build();
    }

    public MapActionResult interact(String username, String interactionId) {
        Optional<Place> current = currentPlace(username);
        if (current.isEmpty()) {
            return MapActionResult.failure(ACTION_INTERACT, ErrorKind.UNAVAILABLE, NO_CURRENT_PLACE);
        }
        Place place = current.get();
        String point = trim(interactionId);
        if (point.isEmpty()) {
            return MapActionResult.failure(ACTION_INTERACT, ErrorKind.MALFORMED_INPUT,
                    "Interaction id is required");
        }
        if (!place.getInteractionPoints().contains(point)) {
            return MapActionResult.failure(ACTION_INTERACT, ErrorKind.MALFORMED_INPUT,
                    "Unknown interaction point at " + place.getPlaceId() + ": " + point);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", ACTION_INTERACT);
        payload.put("place_id", place.getPlaceId());
        payload.put("place_ref", place.getPlaceRef());
        payload.put("interaction_id", point);
        payload.put("location", location(place));
        CanonicalEvent event = append(username, CanonicalEventType.MAP_INTERACT, payload);
        return MapActionResult.builder()
                .ok(true)
                .action(ACTION_INTERACT)
                .placeId(place.getPlaceId())
                .place(place)
                .interactionId(point)
                .event(event)
                .build();
    }

    public MapActionResult complete(String username, String objectiveId) {
        Optional<Place> current = currentPlace(username);
        if (current.isEmpty()) {
            return MapActionResult.failure(ACTION_COMPLETE, ErrorKind.UNAVAILABLE, NO_CURRENT_PLACE);
        }
        Place place = current.get();
        String objective = trim(objectiveId);
        if (objective.isEmpty()) {
            return MapActionResult.failure(ACTION_COMPLETE, ErrorKind.MALFORMED_INPUT, "Objective id is required");
        }
        if (!place.getQuestIds().contains(objective)) {
            return MapActionResult.failure(ACTION_COMPLETE, ErrorKind.MALFORMED_INPUT,
                    "Objective not available at " + place.getPlaceId() + ": " + objective);
        }
        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", ACTION_COMPLETE);
        payload.put("place_id", place.getPlaceId());
        payload.put("place_ref", place.getPlaceRef());
        payload.put("objective_id", objective);
        payload.put("location", location(place));
        CanonicalEvent event = append(username, CanonicalEventType.MAP_COMPLETE, payload);
        return MapActionResult.builder()
                .ok(true)
                .action(ACTION_COMPLETE)
                .placeId(place.getPlaceId())
                .place(place)
                .objectiveId(objective)
                .event(event)
                .build();
    }

    /**
     * Advance the per-user counters by {@code steps} (at least one). The
     * phases are reported but carry no gameplay effect.
     */
    public MapActionResult tick(String username, int steps) {
        MapRuntimeUserState user = ensureUser(username);
        Optional<Place> current = placeGraph.find(user.getCurrentPlaceId());
        if (current.isEmpty()) {
            return MapActionResult.failure(ACTION_TICK, ErrorKind.UNAVAILABLE, NO_CURRENT_PLACE);
        }
        Place place = current.get();
        int safeSteps = Math.max(1, steps);
        user.setTickCounter(user.getTickCounter() + safeSteps);
        user.setNpcPhase((user.getNpcPhase() + safeSteps) % NPC_PHASES);
        user.setWorldPhase((user.getWorldPhase() + safeSteps) % WORLD_PHASES);
        user.setUpdatedAt(Instant.now(clock));
        save();

        Map<String, Object> payload = new LinkedHashMap<>();
        payload.put("action", ACTION_TICK);
        payload.put("steps", safeSteps);
        payload.put("tick_counter", user.getTickCounter());
        payload.put("npc_phase", user.getNpcPhase());
        payload.put("world_phase", user.getWorldPhase());
        payload.put("place_id", place.getPlaceId());
        payload.put("place_ref", place.getPlaceRef());
        payload.put("location", location(place));
        CanonicalEvent event = append(username, CanonicalEventType.MAP_TICK, payload);
        return MapActionResult.builder()
                .ok(true)
                .action(ACTION_TICK)
                .placeId(place.getPlaceId())
                .place(place)
                .steps(safeSteps)
                .tickCounter(user.getTickCounter())
                .npcPhase(user.getNpcPhase())
                .worldPhase(user.getWorldPhase())
                .event(event)
                .build();
    }

    // ==================== Internals ====================

    private Optional<Place> currentPlace(String username) {
        return placeGraph.find(ensureUser(username).getCurrentPlaceId());
    }

    private MapRuntimeUserState ensureUser(String username) {
        MapRuntimeUserState user = state().getUsers().computeIfAbsent(username, name -> MapRuntimeUserState.builder()
                .currentPlaceId(placeGraph.defaultPlaceId().orElse(null))
                .updatedAt(Instant.now(clock))
                .build());
        if (user.getCurrentPlaceId() == null) {
            user.setCurrentPlaceId(placeGraph.defaultPlaceId().orElse(null));
        }
        return user;
    }

    private Map<String, Object> location(Place place) {
        Map<String, Object> location = new LinkedHashMap<>();
        location.put("grid_id", place.getPlaceRef() != null ? place.getPlaceRef() : "");
        location.put("x", null);
        location.put("y", null);
        location.put("z", place.getZ());
        return location;
    }

    private CanonicalEvent append(String username, CanonicalEventType type, Map<String, Object> payload) {
        CanonicalEvent event = CanonicalEvent.builder()
                .ts(Instant.now(clock).toString())
                .source(SOURCE)
                .username(username)
                .type(type.name())
                .payload(payload)
                .build();
        eventLog.append(event);
        return event;
    }

    private MapRuntimeState state() {
        if (state == null) {
            state = load();
        }
        return state;
    }

    private MapRuntimeState load() {
        try {
            String json = storagePort.getText(MAP_DIR, STATE_FILE).join();
            if (json != null && !json.isBlank()) {
                MapRuntimeState loaded = objectMapper.readValue(json, MapRuntimeState.class);
                if (loaded.getUsers() == null) {
                    loaded.setUsers(new TreeMap<>());
                }
                return loaded;
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - intentionally catch all for fallback
            log.warn("[MapRuntime] Failed to parse map runtime state, starting fresh: {}", e.getMessage());
        }
        return MapRuntimeState.builder().updatedAt(Instant.now(clock)).build();
    }

    private void save() {
        MapRuntimeState current = state();
        try {
            current.setUpdatedAt(Instant.now(clock));
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(current);
            storagePort.putTextAtomic(MAP_DIR, STATE_FILE, json, false).join();
        } catch (Exception e) {
            log.error("[MapRuntime] Failed to save map runtime state", e);
            throw new IllegalStateException("Failed to persist map runtime state", e);
        }
    }

    private static String trim(String value) {
        return value == null ? "" : value.trim();
    }
}
