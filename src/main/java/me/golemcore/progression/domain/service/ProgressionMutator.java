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
import me.golemcore.progression.domain.model.GameplayStats;
import me.golemcore.progression.domain.model.Gate;
import me.golemcore.progression.domain.model.Location;
import me.golemcore.progression.domain.model.PlayOption;
import me.golemcore.progression.domain.model.PlayStartResult;
import me.golemcore.progression.domain.model.ProgressionState;
import me.golemcore.progression.domain.model.RequirementVerdict;
import me.golemcore.progression.domain.model.UnlockRule;
import me.golemcore.progression.domain.model.UnlockToken;
import me.golemcore.progression.domain.model.UserProgress;
import me.golemcore.progression.domain.model.UserProgressionState;
import org.springframework.stereotype.Component;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.TreeMap;

/**
 * Shared state mutations used by the reducer, the rule engine and explicit
 * operations. Every mutation is grant-if-absent or monotonic so that
 * re-applying an already applied event after a crash converges.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class ProgressionMutator {

    private final RequirementEvaluator requirementEvaluator;
    private final Clock clock;

    public UserProgressionState ensureUser(ProgressionState state, String username) {
        return state.getUsers().computeIfAbsent(username, name -> newUser(state));
    }

    public UserProgressionState newUser(ProgressionState state) {
        UserProgressionState user = new UserProgressionState();
        normalizeUser(user);
        user.setLastActiveToybox(requirementEvaluator.activeToybox(state));
        user.setUpdatedAt(now());
        return user;
    }

    /**
     * Fill in anything a hand-edited or older document may lack.
     */
    public void normalizeUser(UserProgressionState user) {
        if (user.getStats() == null) {
            user.setStats(new GameplayStats());
        }
        if (user.getProgress() == null) {
            user.setProgress(new UserProgress());
        }
        UserProgress progress = user.getProgress();
        if (progress.getLocation() == null) {
            progress.setLocation(new Location());
        }
        if (progress.getAchievements() == null) {
            progress.setAchievements(new ArrayList<>());
        }
        progress.getAchievements().removeIf(id -> id == null || id.isBlank());
        if (progress.getMetrics() == null) {
            progress.setMetrics(new TreeMap<>());
        }
        for (String metric : ProgressionCatalog.DEFAULT_METRICS) {
            progress.getMetrics().putIfAbsent(metric, 0L);
        }
        if (user.getUnlockTokens() == null) {
            user.setUnlockTokens(new ArrayList<>());
        }
    }

    public void touch(UserProgressionState user) {
        user.setUpdatedAt(now());
    }

    public boolean addAchievement(UserProgressionState user, String achievementId) {
        String id = achievementId == null ? "" : achievementId.trim();
        if (id.isEmpty() || user.getProgress().getAchievements().contains(id)) {
            return false;
        }
        user.getProgress().getAchievements().add(id);
        touch(user);
        return true;
    }

    public void addMetric(UserProgressionState user, String metric, long delta) {
        user.getProgress().getMetrics().merge(metric, delta, Long::sum);
        touch(user);
    }

    /**
     * Apply location fields present in {@code fields} ({@code grid_id},
     * {@code x}, {@code y}, {@code z}). Coordinates that are not integers are
     * skipped; x and y may be cleared with null.
     *
     * @return whether anything changed
     */
    public boolean setLocation(UserProgressionState user, Map<String, ?> fields) {
        Location location = user.getProgress().getLocation();
        boolean changed = false;
        if (fields.containsKey("grid_id")) {
            Object raw = fields.get("grid_id");
            String gridId = raw != null ? raw.toString() : Location.UNKNOWN_GRID;
            if (!gridId.equals(location.getGridId())) {
                location.setGridId(gridId);
                changed = true;
            }
        }
        for (String axis : List.of("x", "y")) {
            if (!fields.containsKey(axis)) {
                continue;
            }
            Object raw = fields.get(axis);
            Integer value;
            if (raw == null) {
                value = null;
            } else {
                Optional<Long> parsed = PayloadValues.asLong(raw);
                if (parsed.isEmpty()) {
                    continue;
                }
                value = parsed.get().intValue();
            }
            Integer current = "x".equals(axis) ? location.getX() : location.getY();
            if (!Objects.equals(current, value)) {
                if ("x".equals(axis)) {
                    location.setX(value);
                } else {
                    location.setY(value);
                }
                changed = true;
            }
        }
        if (fields.containsKey("z")) {
            Optional<Long> parsed = PayloadValues.asLong(fields.get("z"));
            if (parsed.isPresent() && parsed.get().intValue() != location.getZ()) {
                location.setZ(parsed.get().intValue());
                changed = true;
            }
        }
        if (changed) {
            touch(user);
        }
        return changed;
    }

    /**
     * Complete a gate once. Unknown gates are created on the fly.
     *
     * @return true when the gate transitioned to completed
     */
    public boolean completeGate(ProgressionState state, String gateId, String source) {
        Gate gate = state.getGates().computeIfAbsent(gateId, id -> Gate.builder()
                .id(id)
                .title(id)
                .lens(source)
                .build());
        if (gate.isCompleted()) {
            return false;
        }
        gate.setCompleted(true);
        gate.setCompletedAt(now());
        gate.setCompletedSource(source);
        log.info("[Progression] Gate completed: {} (source: {})", gateId, source);
        return true;
    }

    public boolean canProceed(ProgressionState state) {
        return requirementEvaluator.isGateCompleted(state, ProgressionCatalog.AMULET_GATE_ID);
    }

    /**
     * Raise level and achievement level from the current stats, depth flag,
     * achievements and amulet gate. Both only ever grow.
     */
    public boolean recomputeProgress(ProgressionState state, UserProgressionState user) {
        UserProgress progress = user.getProgress();
        long depth = Math.max(1L, user.flagAsLong(ProgressionCatalog.FLAG_MAX_DEPTH));
        long xpLevel = Math.max(1L, Math.floorDiv(user.getStats().getXp(), 100L) + 1L);
        long depthLevel = Math.max(1L, depth / 4L + 1L);
        long level = Math.max(progress.getLevel(), Math.max(xpLevel, depthLevel));
        long gateBonus = canProceed(state) ? 1L : 0L;
        long achievementLevel = Math.max(progress.getAchievementLevel(),
                progress.getAchievements().size() + gateBonus);

        boolean changed = level != progress.getLevel() || achievementLevel != progress.getAchievementLevel();
        if (changed) {
            progress.setLevel(level);
            progress.setAchievementLevel(achievementLevel);
            touch(user);
        }
        return changed;
    }

    public Optional<UnlockToken> grantToken(UserProgressionState user, String tokenId, String title, String source) {
        String id = tokenId == null ? "" : tokenId.trim();
        if (id.isEmpty() || user.hasToken(id)) {
            return Optional.empty();
        }
        UnlockToken token = UnlockToken.builder()
                .id(id)
                .title(title != null && !title.isBlank() ? title : id)
                .source(source)
                .unlockedAt(now())
                .build();
        user.getUnlockTokens().add(token);
        touch(user);
        return Optional.of(token);
    }

    /**
     * Grant every built-in unlock token whose requirements hold.
     *
     * @return newly granted tokens in table order
     */
    public List<UnlockToken> evaluateUnlockTokens(ProgressionState state, String username) {
        UserProgressionState user = ensureUser(state, username);
        List<UnlockToken> granted = new ArrayList<>();
        for (UnlockRule rule : ProgressionCatalog.UNLOCK_RULES) {
            if (user.hasToken(rule.tokenId())) {
                continue;
            }
            RequirementVerdict verdict = requirementEvaluator.evaluate(state, username, rule.requirements());
            if (verdict.ok()) {
                grantToken(user, rule.tokenId(), rule.title(), ProgressionCatalog.SOURCE_PLAY_RULE)
                        .ifPresent(granted::add);
            }
        }
        return granted;
    }

    /**
     * Start a play option after re-checking its requirements.
     */
    public PlayStartResult startPlayOption(ProgressionState state, String username, String optionId) {
        String id = optionId == null ? "" : optionId.trim().toLowerCase(Locale.ROOT);
        Optional<PlayOption> option = findPlayOption(id);
        if (option.isEmpty()) {
            return new PlayStartResult(id, PlayStartResult.UNKNOWN, List.of());
        }
        RequirementVerdict verdict = requirementEvaluator.evaluate(state, username, option.get().requirements());
        if (!verdict.ok()) {
            return new PlayStartResult(id, PlayStartResult.BLOCKED, verdict.blockedBy());
        }
        UserProgressionState user = ensureUser(state, username);
        user.getProgress().setLastPlayOption(id);
        touch(user);
        evaluateUnlockTokens(state, username);
        log.info("[Progression] Play option started: {} for {}", id, username);
        return new PlayStartResult(id, PlayStartResult.STARTED, List.of());
    }

    public Optional<PlayOption> findPlayOption(String optionId) {
        return ProgressionCatalog.PLAY_OPTIONS.stream()
                .filter(option -> option.id().equals(optionId))
                .findFirst();
    }

    private Instant now() {
        return Instant.now(clock);
    }
}
