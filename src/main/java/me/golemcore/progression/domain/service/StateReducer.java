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

import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.domain.ProgressionCatalog;
import me.golemcore.progression.domain.model.CanonicalEvent;
import me.golemcore.progression.domain.model.CanonicalEventType;
import me.golemcore.progression.domain.model.GameplayStats;
import me.golemcore.progression.domain.model.Gate;
import me.golemcore.progression.domain.model.ProgressionState;
import me.golemcore.progression.domain.model.ReduceOutcome;
import me.golemcore.progression.domain.model.Stat;
import me.golemcore.progression.domain.model.UnlockToken;
import me.golemcore.progression.domain.model.UserProgressionState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

/**
 * Applies one canonical event to the progression state.
 *
 * <p>
 * Every known event type carries a fixed reward. On top of that, a payload
 * may carry generic overrides ({@code stats_delta}, {@code progress},
 * {@code location}). Events from untrusted lanes ({@code adapter:*},
 * {@code toybox:*}) never get their stat or progress overrides honored, and
 * their location overrides only for {@code MAP_*} types. Payload keys that
 * name privileged state are ignored for every lane and only noted.
 *
 * <p>
 * All effects are monotonic or grant-if-absent where the event semantics
 * allow it, so the reducer tolerates re-application after a crash between
 * state save and cursor save.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class StateReducer {

    private final ProgressionMutator mutator;
    private final AdapterEventContract adapterEventContract;

    public ReduceOutcome apply(ProgressionState state, CanonicalEvent event, String fallbackUsername) {
        String username = event.username() != null && !event.username().isBlank()
                ? event.username().trim()
                : fallbackUsername;
        CanonicalEventType type = event.eventType();
        String rawType = event.type() == null ? "" : event.type().trim().toUpperCase(Locale.ROOT);
        boolean untrusted = event.fromUntrustedLane();

        ReduceOutcome outcome = ReduceOutcome.builder()
                .eventType(type)
                .rawType(rawType)
                .username(username)
                .build();

        if (untrusted) {
            List<String> missing = adapterEventContract.missingFields(event);
            if (!missing.isEmpty()) {
                missing.forEach(field -> outcome.getNotes().add("contract_violation:missing:" + field));
                log.warn("[Reducer] {} from {} violates adapter contract v{}, missing {}",
                        rawType, event.source(), adapterEventContract.version(), missing);
                return outcome;
            }
        }

        UserProgressionState user = mutator.ensureUser(state, username);
        Map<String, Object> payload = event.payload();
        GameplayStats stats = user.getStats();

        noteBlockedKeys(payload, outcome);
        boolean changed = applyOverrides(user, type, payload, untrusted, outcome);
        changed |= applyReward(user, type, payload, outcome);

        if (type == CanonicalEventType.UNKNOWN) {
            log.debug("[Reducer] Unknown event type '{}' from {}, no reward", rawType, event.source());
        }

        boolean gateChanged = checkAmuletGate(state, user);
        outcome.setGateChanged(gateChanged);

        if (changed) {
            stats.setHp(Math.max(0L, stats.getHp()));
            mutator.touch(user);
            mutator.recomputeProgress(state, user);
            List<UnlockToken> granted = mutator.evaluateUnlockTokens(state, username);
            granted.forEach(token -> outcome.getNotes().add("token:" + token.getId()));
        }
        outcome.setChanged(changed);
        log.debug("[Reducer] {} for {} changed={} notes={}", rawType, username, changed, outcome.getNotes());
        return outcome;
    }

    // ==================== Generic overrides ====================

    private void noteBlockedKeys(Map<String, Object> payload, ReduceOutcome outcome) {
        List<String> blocked = new ArrayList<>();
        for (String key : ProgressionCatalog.BLOCKED_PAYLOAD_KEYS) {
            if (payload.containsKey(key)) {
                blocked.add(key);
            }
        }
        if (!blocked.isEmpty()) {
            blocked.sort(null);
            outcome.getNotes().add("blocked_payload_keys:" + String.join(",", blocked));
            log.debug("[Reducer] Ignored privileged payload keys {}", blocked);
        }
    }

    private boolean applyOverrides(UserProgressionState user, CanonicalEventType type, Map<String, Object> payload,
            boolean untrusted, ReduceOutcome outcome) {
        boolean changed = false;

        Map<String, Object> statsDelta = PayloadValues.object(payload, "stats_delta");
        if (statsDelta != null && untrusted) {
            outcome.getNotes().add("blocked:stats_delta");
        } else if (statsDelta != null) {
            for (Stat stat : Stat.values()) {
                if (!statsDelta.containsKey(stat.id())) {
                    continue;
                }
                Optional<Long> delta = PayloadValues.asLong(statsDelta.get(stat.id()));
                if (delta.isPresent()) {
                    user.getStats().set(stat, user.getStats().get(stat) + delta.get());
                    outcome.getNormalizedFields().add("stats_delta." + stat.id());
                    changed = true;
                }
            }
        }

        Map<String, Object> progress = PayloadValues.object(payload, "progress");
        if (progress != null && untrusted) {
            outcome.getNotes().add("blocked:progress");
        } else if (progress != null) {
            String achievementId = PayloadValues.text(progress, "achievement_id");
            if (!achievementId.isEmpty() && mutator.addAchievement(user, achievementId)) {
                outcome.getNormalizedFields().add("progress.achievement_id");
                changed = true;
            }
            Optional<Long> levelHint = PayloadValues.asLong(progress.get("level"));
            if (levelHint.isPresent()) {
                long current = user.getProgress().getLevel();
                user.getProgress().setLevel(Math.max(current, levelHint.get()));
                outcome.getNormalizedFields().add("progress.level");
                changed = true;
            }
        }

        Map<String, Object> location = PayloadValues.object(payload, "location");
        if (location != null) {
            boolean allowed = !untrusted || type.isMapEvent();
            if (!allowed) {
                outcome.getNotes().add("blocked:location");
            } else if (mutator.setLocation(user, location)) {
                outcome.getNormalizedFields().add("location");
                changed = true;
            }
        }
        return changed;
    }

    // ==================== Rewards ====================

    private boolean applyReward(UserProgressionState user, CanonicalEventType type, Map<String, Object> payload,
            ReduceOutcome outcome) {
        GameplayStats stats = user.getStats();
        List<String> notes = outcome.getNotes();
        switch (type) {
        case HETHACK_LEVEL_REACHED -> {
            long depth = PayloadValues.longOrDefault(payload, "depth", 0L);
            long previousDepth = Math.max(1L, user.flagAsLong(ProgressionCatalog.FLAG_MAX_DEPTH));
            boolean changed = false;
            if (depth > previousDepth) {
                user.getFlags().put(ProgressionCatalog.FLAG_MAX_DEPTH, depth);
                changed = true;
            }
            if (depth > 0) {
                stats.setXp(stats.getXp() + 10);
                notes.add("depth:" + depth);
                mutator.setLocation(user, Map.of("grid_id", "dungeon:main", "z", depth));
                processed(user);
                changed = true;
            }
            return changed;
        }
        case HETHACK_AMULET_RETRIEVED -> {
            user.getFlags().put(ProgressionCatalog.FLAG_AMULET_RETRIEVED, true);
            reward(stats, 500, 1000);
            notes.add("amulet");
            mutator.addAchievement(user, ProgressionCatalog.AMULET_GATE_ID);
            processed(user);
            return true;
        }
        case HETHACK_DEATH -> {
            stats.setHp(Math.max(0L, stats.getHp() - 25));
            notes.add("death");
            mutator.addMetric(user, "deaths", 1);
            processed(user);
            return true;
        }
        case ELITE_HYPERSPACE_JUMP -> {
            reward(stats, 15, 0);
            notes.add("jump");
            mutator.addMetric(user, "elite_jumps", 1);
            processed(user);
            mutator.setLocation(user, Map.of("grid_id", "galaxy:chart1", "z", 0));
            return true;
        }
        case ELITE_DOCKED -> {
            reward(stats, 20, 0);
            notes.add("dock");
            mutator.addMetric(user, "elite_docks", 1);
            processed(user);
            return true;
        }
        case ELITE_MISSION_COMPLETE -> {
            reward(stats, 100, 250);
            notes.add("mission");
            mutator.addAchievement(user, "elite_first_mission");
            mutator.addMetric(user, "missions_completed", 1);
            processed(user);
            return true;
        }
        case ELITE_TRADE_PROFIT -> {
            long profit = PayloadValues.longOrDefault(payload, "profit", 0L);
            if (profit == 0) {
                return false;
            }
            reward(stats, Math.max(1L, Math.floorDiv(profit, 50L)), profit);
            notes.add("profit:" + profit);
            processed(user);
            return true;
        }
        case RPGBBS_SESSION_START -> {
            reward(stats, 5, 0);
            notes.add("rpgbbs:start");
            mutator.addMetric(user, "rpgbbs_sessions", 1);
            processed(user);
            mutator.setLocation(user, Map.of("grid_id", "bbs:lobby", "z", 0));
            return true;
        }
        case RPGBBS_MESSAGE_EVENT -> {
            reward(stats, 3, 0);
            notes.add("rpgbbs:message");
            mutator.addMetric(user, "rpgbbs_messages", 1);
            processed(user);
            return true;
        }
        case RPGBBS_QUEST_COMPLETE -> {
            reward(stats, 40, 25);
            notes.add("rpgbbs:quest");
            mutator.addAchievement(user, "rpgbbs_first_quest");
            mutator.addMetric(user, "rpgbbs_quests", 1);
            processed(user);
            return true;
        }
        case CRAWLER3D_FLOOR_REACHED -> {
            long floor = PayloadValues.longOrDefault(payload, "floor", 0L);
            reward(stats, Math.max(5L, floor * 2), 0);
            notes.add("crawler3d:floor:" + floor);
            mutator.addMetric(user, "crawler3d_floors", Math.max(1L, floor));
            processed(user);
            mutator.setLocation(user, Map.of("grid_id", "crawler3d:zone1", "z", floor));
            if (floor >= 10) {
                mutator.addAchievement(user, "crawler3d_floor_10");
            }
            return true;
        }
        case CRAWLER3D_LOOT_FOUND -> {
            reward(stats, 5, 15);
            notes.add("crawler3d:loot");
            processed(user);
            return true;
        }
        case CRAWLER3D_OBJECTIVE_COMPLETE -> {
            reward(stats, 50, 75);
            notes.add("crawler3d:objective");
            mutator.addAchievement(user, "crawler3d_objective_clear");
            mutator.addMetric(user, "crawler3d_objectives", 1);
            processed(user);
            return true;
        }
        case MAP_ENTER -> {
            reward(stats, 1, 0);
            notes.add("map:enter");
            mutator.addMetric(user, "map_enters", 1);
            processed(user);
            return true;
        }
        case MAP_TRAVERSE -> {
            long terrainCost = PayloadValues.longOrDefault(payload, "terrain_cost", 1L);
            if (terrainCost == 0) {
                terrainCost = 1L;
            }
            String mode = PayloadValues.text(payload, "mode").toLowerCase(Locale.ROOT);
            if (mode.isEmpty()) {
                mode = "walk";
            }
            reward(stats, Math.max(1L, terrainCost), 0);
            notes.add("map:traverse:" + mode + ":" + terrainCost);
            mutator.addMetric(user, "map_moves", 1);
            if ("portal".equals(mode)) {
                mutator.addMetric(user, "map_portal_transitions", 1);
            }
            processed(user);
            return true;
        }
        case MAP_INSPECT -> {
            reward(stats, 2, 0);
            notes.add("map:inspect");
            mutator.addMetric(user, "map_inspects", 1);
            processed(user);
            return true;
        }
        case MAP_INTERACT -> {
            reward(stats, 3, 1);
            notes.add("map:interact");
            mutator.addMetric(user, "map_interactions", 1);
            processed(user);
            return true;
        }
        case MAP_COMPLETE -> {
            String objectiveId = PayloadValues.text(payload, "objective_id");
            reward(stats, 25, 10);
            notes.add("map:complete");
            if (!objectiveId.isEmpty()) {
                mutator.addAchievement(user, "map." + objectiveId);
            }
            mutator.addMetric(user, "map_completions", 1);
            mutator.addMetric(user, "missions_completed", 1);
            processed(user);
            return true;
        }
        case MAP_TICK -> {
            notes.add("map:tick");
            mutator.addMetric(user, "map_ticks", 1);
            processed(user);
            return true;
        }
        default -> {
            return false;
        }
        }
    }

    private void reward(GameplayStats stats, long xp, long gold) {
        stats.setXp(stats.getXp() + xp);
        stats.setGold(stats.getGold() + gold);
    }

    private void processed(UserProgressionState user) {
        mutator.addMetric(user, "events_processed", 1);
    }

    // ==================== Gate check ====================

    private boolean checkAmuletGate(ProgressionState state, UserProgressionState user) {
        Gate gate = state.getGates().get(ProgressionCatalog.AMULET_GATE_ID);
        if (gate == null || gate.isCompleted()) {
            return false;
        }
        long depth = Math.max(1L, user.flagAsLong(ProgressionCatalog.FLAG_MAX_DEPTH));
        boolean amulet = user.flagAsBoolean(ProgressionCatalog.FLAG_AMULET_RETRIEVED);
        if (depth >= ProgressionCatalog.AMULET_GATE_MIN_DEPTH && amulet) {
            return mutator.completeGate(state, ProgressionCatalog.AMULET_GATE_ID,
                    ProgressionCatalog.SOURCE_TOYBOX_EVENT);
        }
        return false;
    }
}
