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
import me.golemcore.progression.domain.model.LensBlockingReason;
import me.golemcore.progression.domain.model.LensStatus;
import me.golemcore.progression.domain.model.MapStatus;
import me.golemcore.progression.domain.model.Place;
import me.golemcore.progression.domain.model.PlaceGraph;
import me.golemcore.progression.domain.model.SliceContractStatus;
import me.golemcore.progression.domain.model.WorldLensSlice;
import me.golemcore.progression.domain.model.WorldLensState;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import me.golemcore.progression.port.outbound.StoragePort;
import org.springframework.core.env.Environment;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;

/**
 * Feature flag and single-region readiness of the experimental world lens.
 *
 * <p>
 * The lens is ready only when it is enabled, the progression gate allows
 * proceeding, the configured slice is a valid connected subgraph and the user
 * stands inside it. The slice is revalidated against the place graph on every
 * status call. This service reads map and progression snapshots and never
 * mutates them.
 */
@Service
@Slf4j
public class WorldLensService {

    public static final String LENS_DIR = "lens";
    public static final String STATE_FILE = "world_lens_state.json";

    private static final String SOURCE_STATE = "state";
    private static final Set<String> ENV_TRUE = Set.of("1", "true", "yes", "on", "enabled");
    private static final Set<String> ENV_FALSE = Set.of("0", "false", "no", "off", "disabled");

    private final PlaceGraph placeGraph;
    private final StoragePort storagePort;
    private final ObjectMapper objectMapper;
    private final Environment environment;
    private final ProgressionProperties.LensProperties lensProperties;
    private final WorldLensSlice slice;
    private final Clock clock;

    private WorldLensState state;

    public WorldLensService(PlaceGraph placeGraph, StoragePort storagePort, ObjectMapper objectMapper,
            Environment environment, ProgressionProperties properties, Clock clock) {
        this.placeGraph = placeGraph;
        this.storagePort = storagePort;
        this.objectMapper = objectMapper;
        this.environment = environment;
        this.lensProperties = properties.getLens();
        ProgressionProperties.SliceProperties sliceProperties = lensProperties.getSlice();
        this.slice = new WorldLensSlice(
                sliceProperties.getId(),
                sliceProperties.getTitle(),
                sliceProperties.getEntryPlaceId(),
                sliceProperties.getAllowedPlaceIds(),
                sliceProperties.getAnchorPrefix());
        this.clock = clock;
    }

    // ==================== Enablement ====================

    public WorldLensState setEnabled(boolean enabled, String actor) {
        WorldLensState current = state();
        current.setEnabled(enabled);
        current.setUpdatedAt(Instant.now(clock));
        current.setUpdatedBy(actor != null && !actor.isBlank() ? actor : "unknown");
        save(current);
        log.info("[WorldLens] Lens {} by {}", enabled ? "enabled" : "disabled", current.getUpdatedBy());
        return current;
    }

    /**
     * Whether the lens is enabled, honoring the environment override.
     */
    public boolean isEnabled() {
        return effectiveEnabled().enabled();
    }

    // ==================== Status ====================

    /**
     * Evaluate readiness for a user.
     *
     * @param mapStatus
     *            current map runtime status of the user, may be null when the
     *            runtime is unavailable
     * @param progressionReady
     *            whether the progression gate allows proceeding
     */
    public LensStatus status(String username, MapStatus mapStatus, boolean progressionReady) {
        EffectiveFlag flag = effectiveEnabled();
        SliceContractStatus sliceContract = validateSlice();

        LensBlockingReason blockingReason = null;
        boolean inRegion = false;
        String currentPlaceId = mapStatus != null ? mapStatus.getCurrentPlaceId() : null;
        if (!flag.enabled()) {
            blockingReason = LensBlockingReason.FEATURE_FLAG_DISABLED;
        } else if (!progressionReady) {
            blockingReason = LensBlockingReason.PROGRESSION_GATE_BLOCKED;
        } else if (!sliceContract.isValid()) {
            blockingReason = LensBlockingReason.SLICE_CONTRACT_INVALID;
        } else if (mapStatus == null || !mapStatus.isOk()) {
            blockingReason = LensBlockingReason.MAP_RUNTIME_UNAVAILABLE;
        } else {
            inRegion = slice.allows(currentPlaceId);
            if (!inRegion) {
                blockingReason = LensBlockingReason.OUTSIDE_SINGLE_REGION;
            }
        }

        WorldLensState current = state();
        return LensStatus.builder()
                .ok(true)
                .username(username)
                .version(lensProperties.getVersion())
                .enabled(flag.enabled())
                .enabledSource(flag.source())
                .ready(blockingReason == null)
                .blockingReason(blockingReason)
                .regionId(slice.id())
                .regionTitle(slice.title())
                .entryPlaceId(slice.entryPlaceId())
                .allowedPlaceIds(slice.allowedPlaceIds())
                .anchorPrefix(slice.anchorPrefix())
                .currentPlaceId(currentPlaceId)
                .regionActive(inRegion)
                .sliceContract(sliceContract)
                .contracts(new LinkedHashMap<>(lensProperties.getContracts()))
                .updatedAt(current.getUpdatedAt())
                .updatedBy(current.getUpdatedBy())
                .build();
    }

    /**
     * Check the configured slice against the place graph: every allowed place
     * exists, has a parseable PlaceRef under the anchor prefix, and is
     * reachable from the entry place through links inside the slice.
     */
    public SliceContractStatus validateSlice() {
        List<String> allowed = slice.allowedPlaceIds();
        String entry = slice.entryPlaceId() == null ? "" : slice.entryPlaceId().trim();
        String anchorPrefix = slice.anchorPrefix() == null ? "" : slice.anchorPrefix().trim();

        List<String> missing = new ArrayList<>();
        List<String> invalidRefs = new ArrayList<>();
        List<String> prefixMismatch = new ArrayList<>();
        for (String placeId : allowed) {
            Optional<Place> place = placeGraph.find(placeId);
            if (place.isEmpty()) {
                missing.add(placeId);
                continue;
            }
            String placeRef = place.get().getPlaceRef() == null ? "" : place.get().getPlaceRef();
            if (!ChunkContract.isValid(placeRef)) {
                invalidRefs.add(placeRef);
            }
            if (!anchorPrefix.isEmpty() && !placeRef.startsWith(anchorPrefix)) {
                prefixMismatch.add(placeId);
            }
        }

        List<String> disconnected;
        if (!entry.isEmpty() && placeGraph.contains(entry) && slice.allows(entry)) {
            Set<String> reached = reachableWithinSlice(entry);
            disconnected = allowed.stream().filter(placeId -> !reached.contains(placeId)).toList();
        } else {
            disconnected = List.copyOf(allowed);
        }

        boolean valid = !allowed.isEmpty()
                && missing.isEmpty()
                && invalidRefs.isEmpty()
                && prefixMismatch.isEmpty()
                && disconnected.isEmpty();
        if (!valid) {
            log.debug("[WorldLens] Slice {} invalid: missing={}, invalidRefs={}, prefixMismatch={}, disconnected={}",
                    slice.id(), missing, invalidRefs, prefixMismatch, disconnected);
        }
        return SliceContractStatus.builder()
                .valid(valid)
                .entryPlaceId(entry)
                .allowedPlaceIds(allowed)
                .missingPlaceIds(missing)
                .invalidPlaceRefs(invalidRefs)
                .prefixMismatchPlaceIds(prefixMismatch)
                .disconnectedPlaceIds(disconnected)
                .build();
    }

    // ==================== Internals ====================

    private Set<String> reachableWithinSlice(String entry) {
        Set<String> seen = new HashSet<>();
        Deque<String> stack = new ArrayDeque<>();
        stack.push(entry);
        while (!stack.isEmpty()) {
            String current = stack.pop();
            if (!seen.add(current)) {
                continue;
            }
            for (String next : placeGraph.find(current).map(Place::getLinks).orElse(List.of())) {
                String nextId = next == null ? "" : next.trim();
                if (slice.allows(nextId) && !seen.contains(nextId)) {
                    stack.push(nextId);
                }
            }
        }
        return seen;
    }

    private EffectiveFlag effectiveEnabled() {
        String envVar = lensProperties.getFeatureFlag().getEnvVar();
        String raw = envVar != null ? environment.getProperty(envVar) : null;
        if (raw != null) {
            String normalized = raw.trim().toLowerCase(Locale.ROOT);
            if (ENV_TRUE.contains(normalized)) {
                return new EffectiveFlag(true, "env:" + envVar);
            }
            if (ENV_FALSE.contains(normalized)) {
                return new EffectiveFlag(false, "env:" + envVar);
            }
        }
        return new EffectiveFlag(state().isEnabled(), SOURCE_STATE);
    }

    private WorldLensState state() {
        if (state == null) {
            state = load();
        }
        return state;
    }

    private WorldLensState load() {
        try {
            String json = storagePort.getText(LENS_DIR, STATE_FILE).join();
            if (json != null && !json.isBlank()) {
                return objectMapper.readValue(json, WorldLensState.class);
            }
        } catch (IOException | RuntimeException e) { // NOSONAR - intentionally catch all for fallback
            log.warn("[WorldLens] Failed to parse lens state, using defaults: {}", e.getMessage());
        }
        WorldLensState defaults = WorldLensState.builder()
                .enabled(lensProperties.getFeatureFlag().isDefaultEnabled())
                .updatedAt(Instant.now(clock))
                .updatedBy(ProgressionCatalog.SOURCE_SYSTEM_DEFAULT)
                .build();
        save(defaults);
        return defaults;
    }

    private void save(WorldLensState lensState) {
        try {
            String json = objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(lensState);
            storagePort.putTextAtomic(LENS_DIR, STATE_FILE, json, false).join();
        } catch (Exception e) {
            log.error("[WorldLens] Failed to save lens state", e);
            throw new IllegalStateException("Failed to persist world lens state", e);
        }
    }

    private record EffectiveFlag(boolean enabled, String source) {
    }
}
