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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.domain.ProgressionCatalog;
import me.golemcore.progression.domain.model.CanonicalEvent;
import me.golemcore.progression.domain.model.ErrorKind;
import me.golemcore.progression.domain.model.EventBatch;
import me.golemcore.progression.domain.model.EventCursor;
import me.golemcore.progression.domain.model.GameplayStats;
import me.golemcore.progression.domain.model.Gate;
import me.golemcore.progression.domain.model.LogEntry;
import me.golemcore.progression.domain.model.OperationResult;
import me.golemcore.progression.domain.model.OverlayScope;
import me.golemcore.progression.domain.model.PlayOption;
import me.golemcore.progression.domain.model.PlayOptionStatus;
import me.golemcore.progression.domain.model.PlayStartResult;
import me.golemcore.progression.domain.model.ProfileOverlay;
import me.golemcore.progression.domain.model.ProfileVariables;
import me.golemcore.progression.domain.model.ProgressionSnapshot;
import me.golemcore.progression.domain.model.ProgressionState;
import me.golemcore.progression.domain.model.ReduceOutcome;
import me.golemcore.progression.domain.model.Requirement;
import me.golemcore.progression.domain.model.RequirementVerdict;
import me.golemcore.progression.domain.model.Rule;
import me.golemcore.progression.domain.model.RuleRunResult;
import me.golemcore.progression.domain.model.Stat;
import me.golemcore.progression.domain.model.TickResult;
import me.golemcore.progression.domain.model.ToyboxProfile;
import me.golemcore.progression.domain.model.UnlockToken;
import me.golemcore.progression.domain.model.UserProgress;
import me.golemcore.progression.domain.model.UserProgressionState;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;
import java.util.TreeSet;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Owns the progression document and ingests the canonical event log into it.
 *
 * <p>
 * {@link #tick(String, int)} reads up to {@code maxEvents} complete lines from
 * the persisted cursor, reduces each event, runs the rule engine, saves the
 * state and only then advances the cursor. A crash between the two writes
 * replays already-applied events on the next tick, which the reducer
 * tolerates. {@code tick} is not re-entrant; callers serialize access.
 *
 * <p>
 * Besides ingestion, this service exposes the explicit stat, gate, rule,
 * toybox, play option and profile overlay operations.
 */
@Service
@Slf4j
public class ProgressionService {

    private static final Set<String> OVERLAY_METRIC_PREFIXES = Set.of("metric.", "metrics.");

    private final ProgressionStateStore store;
    private final EventLogService eventLog;
    private final StateReducer reducer;
    private final RuleEngine ruleEngine;
    private final ProgressionMutator mutator;
    private final RequirementEvaluator requirementEvaluator;
    private final ProgressionProperties properties;
    private final Clock clock;
    private final AtomicBoolean ticking = new AtomicBoolean(false);

    private ProgressionState state;

    public ProgressionService(ProgressionStateStore store, EventLogService eventLog, StateReducer reducer,
            RuleEngine ruleEngine, ProgressionMutator mutator, RequirementEvaluator requirementEvaluator,
            ProgressionProperties properties, Clock clock) {
        this.store = store;
        this.eventLog = eventLog;
        this.reducer = reducer;
        this.ruleEngine = ruleEngine;
        this.mutator = mutator;
        this.requirementEvaluator = requirementEvaluator;
        this.properties = properties;
        this.clock = clock;
    }

    // ==================== Ingestion ====================

    public TickResult tick(String username) {
        return tick(username, properties.getEngine().getMaxEventsPerTick());
    }

    /**
     * Ingest the next batch of events and run the rules.
     *
     * @throws IllegalStateException
     *             when called while another tick is in progress
     */
    public TickResult tick(String username, int maxEvents) {
        if (!ticking.compareAndSet(false, true)) {
            throw new IllegalStateException("tick() is not re-entrant");
        }
        try {
            return doTick(normalizeUsername(username), maxEvents);
        } finally {
            ticking.set(false);
        }
    }

    private TickResult doTick(String username, int maxEvents) {
        ProgressionState current = state();
        EventCursor cursor = store.loadCursor();
        EventBatch batch = eventLog.readBatch(cursor.offset(), maxEvents);

        List<ReduceOutcome> outcomes = new ArrayList<>();
        Set<String> touchedUsers = new TreeSet<>();
        int malformed = 0;
        int applied = 0;
        boolean gateChanged = false;
        for (LogEntry entry : batch.entries()) {
            if (entry.isMalformed()) {
                malformed++;
                continue;
            }
            ReduceOutcome outcome = reducer.apply(current, entry.event(), username);
            outcomes.add(outcome);
            if (outcome.isChanged()) {
                applied++;
            }
            gateChanged |= outcome.isGateChanged();
            if (current.getUsers().containsKey(outcome.getUsername())) {
                touchedUsers.add(outcome.getUsername());
            }
        }

        Set<String> ruleUsers = new LinkedHashSet<>();
        ruleUsers.add(username);
        ruleUsers.addAll(touchedUsers);
        List<RuleRunResult> ruleResults = new ArrayList<>();
        boolean rulesChanged = false;
        for (String ruleUser : ruleUsers) {
            RuleRunResult result = ruleEngine.run(current, ruleUser, null);
            rulesChanged |= result.changedState();
            ruleResults.add(result);
        }

        if (batch.advanced() || rulesChanged) {
            store.save(current);
        }
        if (batch.advanced()) {
            store.saveCursor(new EventCursor(batch.endOffset()));
        }

        int processed = batch.entries().size();
        if (processed > 0) {
            log.info("[Progression] Tick for {}: processed={}, applied={}, malformed={}, offset {} -> {}",
                    username, processed, applied, malformed, batch.startOffset(), batch.endOffset());
        }
        return TickResult.builder()
                .username(username)
                .processed(processed)
                .malformed(malformed)
                .applied(applied)
                .linesConsumed(batch.linesConsumed())
                .offsetBefore(batch.startOffset())
                .offsetAfter(batch.endOffset())
                .gateChanged(gateChanged)
                .outcomes(outcomes)
                .rules(ruleResults)
                .build();
    }

    /**
     * Append an event to the canonical log. The reward realizes on the next
     * tick.
     */
    public void submitEvent(CanonicalEvent event) {
        eventLog.append(event);
    }

    // ==================== Users & stats ====================

    /**
     * Create the user row if absent and persist it.
     */
    public UserProgressionState ensureUser(String username) {
        ProgressionState current = state();
        String name = normalizeUsername(username);
        boolean existed = current.getUsers().containsKey(name);
        UserProgressionState user = mutator.ensureUser(current, name);
        if (!existed) {
            store.save(current);
        }
        return user;
    }

    public List<String> listUsers() {
        return new ArrayList<>(state().getUsers().keySet());
    }

    public GameplayStats getUserStats(String username) {
        GameplayStats stats = userView(username).getStats();
        return GameplayStats.builder()
                .xp(stats.getXp())
                .hp(stats.getHp())
                .gold(stats.getGold())
                .build();
    }

    public UserProgress getUserProgress(String username) {
        return userView(username).getProgress();
    }

    public List<UnlockToken> getUnlockTokens(String username) {
        return List.copyOf(userView(username).getUnlockTokens());
    }

    /**
     * Read-only user view; a default view for users that do not exist yet.
     */
    public UserProgressionState userView(String username) {
        return requirementEvaluator.userView(state(), normalizeUsername(username));
    }

    public GameplayStats setUserStat(String username, Stat stat, long value) {
        UserProgressionState user = mutator.ensureUser(state(), normalizeUsername(username));
        user.getStats().set(stat, value);
        mutator.touch(user);
        store.save(state());
        return getUserStats(username);
    }

    public GameplayStats addUserStat(String username, Stat stat, long delta) {
        UserProgressionState user = mutator.ensureUser(state(), normalizeUsername(username));
        return setUserStat(username, stat, user.getStats().get(stat) + delta);
    }

    public OperationResult setUserStat(String username, String statName, long value) {
        Optional<Stat> stat = Stat.fromId(statName);
        if (stat.isEmpty()) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "Unknown stat: " + statName);
        }
        return OperationResult.success(setUserStat(username, stat.get(), value));
    }

    public OperationResult addUserStat(String username, String statName, long delta) {
        Optional<Stat> stat = Stat.fromId(statName);
        if (stat.isEmpty()) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "Unknown stat: " + statName);
        }
        return OperationResult.success(addUserStat(username, stat.get(), delta));
    }

    // ==================== Gates ====================

    public List<Gate> listGates() {
        return new ArrayList<>(state().getGates().values());
    }

    public Optional<Gate> getGate(String gateId) {
        return Optional.ofNullable(state().getGates().get(gateId));
    }

    /**
     * Complete a gate once; unknown ids create an ad-hoc gate.
     */
    public Gate completeGate(String gateId, String source) {
        ProgressionState current = state();
        if (mutator.completeGate(current, gateId, source != null ? source : ProgressionCatalog.SOURCE_MANUAL)) {
            store.save(current);
        }
        return current.getGates().get(gateId);
    }

    public OperationResult resetGate(String gateId) {
        ProgressionState current = state();
        Gate gate = current.getGates().get(gateId);
        if (gate == null) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "Unknown gate: " + gateId);
        }
        gate.setCompleted(false);
        gate.setCompletedAt(null);
        gate.setCompletedSource(null);
        store.save(current);
        log.info("[Progression] Gate reset: {}", gateId);
        return OperationResult.success(gate);
    }

    public boolean canProceed() {
        return mutator.canProceed(state());
    }

    // ==================== Rules ====================

    public List<Rule> listRules() {
        return new ArrayList<>(state().getRules().values());
    }

    public Optional<Rule> getRule(String ruleId) {
        return Optional.ofNullable(state().getRules().get(ruleId));
    }

    public OperationResult setRule(String ruleId, String ifExpression, String thenExpression, boolean enabled,
            String source) {
        String id = ruleId == null ? "" : ruleId.trim();
        if (id.isEmpty()) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "Rule id is required");
        }
        if (ifExpression == null || ifExpression.isBlank()) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "IF expression is required");
        }
        if (thenExpression == null || thenExpression.isBlank()) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "THEN expression is required");
        }
        ProgressionState current = state();
        Rule existing = current.getRules().get(id);
        Instant now = Instant.now(clock);
        Rule rule = Rule.builder()
                .id(id)
                .ifExpression(ifExpression.trim())
                .thenExpression(thenExpression.trim())
                .enabled(enabled)
                .source(source)
                .createdAt(existing != null && existing.getCreatedAt() != null ? existing.getCreatedAt() : now)
                .updatedAt(now)
                .build();
        current.getRules().put(id, rule);
        store.save(current);
        log.info("[Rules] Rule saved: {}", id);
        return OperationResult.success(rule);
    }

    public boolean deleteRule(String ruleId) {
        ProgressionState current = state();
        if (ruleId == null || current.getRules().remove(ruleId.trim()) == null) {
            return false;
        }
        store.save(current);
        log.info("[Rules] Rule deleted: {}", ruleId);
        return true;
    }

    public Optional<Rule> setRuleEnabled(String ruleId, boolean enabled) {
        ProgressionState current = state();
        Rule rule = ruleId != null ? current.getRules().get(ruleId.trim()) : null;
        if (rule == null) {
            return Optional.empty();
        }
        rule.setEnabled(enabled);
        rule.setUpdatedAt(Instant.now(clock));
        store.save(current);
        return Optional.of(rule);
    }

    public RuleRunResult runRules(String username, String ruleId) {
        ProgressionState current = state();
        RuleRunResult result = ruleEngine.run(current, normalizeUsername(username), ruleId);
        if (result.changedState()) {
            store.save(current);
        }
        return result;
    }

    public RequirementVerdict testCondition(String username, String ifExpression) {
        return ruleEngine.test(state(), normalizeUsername(username), ifExpression);
    }

    public RequirementVerdict evaluate(String username, List<Requirement> requirements) {
        return requirementEvaluator.evaluate(state(), normalizeUsername(username), requirements);
    }

    // ==================== Toybox ====================

    public Map<String, ToyboxProfile> getToyboxProfiles() {
        return new TreeMap<>(state().getToybox().getProfiles());
    }

    public String getActiveToybox() {
        return requirementEvaluator.activeToybox(state());
    }

    public OperationResult setActiveToybox(String profileId, String username) {
        String id = profileId == null ? "" : profileId.trim().toLowerCase(Locale.ROOT);
        ProgressionState current = state();
        if (!current.getToybox().getProfiles().containsKey(id)) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "Unknown toybox profile: " + profileId);
        }
        current.getToybox().setActiveProfile(id);
        if (username != null && !username.isBlank()) {
            UserProgressionState user = mutator.ensureUser(current, username.trim());
            user.setLastActiveToybox(id);
            mutator.touch(user);
        }
        store.save(current);
        log.info("[Progression] Active toybox set to {}", id);
        return OperationResult.success(id);
    }

    // ==================== Play options ====================

    public List<PlayOptionStatus> listPlayOptions(String username) {
        List<PlayOptionStatus> options = new ArrayList<>();
        for (PlayOption option : ProgressionCatalog.PLAY_OPTIONS) {
            RequirementVerdict verdict = evaluate(username, option.requirements());
            options.add(new PlayOptionStatus(
                    option.id(),
                    option.title(),
                    option.description(),
                    verdict.ok(),
                    option.requirements().stream().map(Requirement::label).toList(),
                    verdict.blockedBy()));
        }
        return options;
    }

    public PlayStartResult startPlayOption(String username, String optionId) {
        ProgressionState current = state();
        PlayStartResult result = mutator.startPlayOption(current, normalizeUsername(username), optionId);
        if (result.started()) {
            store.save(current);
        }
        return result;
    }

    // ==================== Profile overlays ====================

    /**
     * @throws IllegalArgumentException
     *             for an unknown scope
     */
    public OperationResult setProfileOverlayValue(String scopeId, String overlayId, String key, long value) {
        OverlayScope scope = OverlayScope.fromId(scopeId);
        String id = normalizeOverlayId(overlayId);
        if (id.isEmpty()) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "Overlay id is required");
        }
        Optional<OverlayKey> overlayKey = parseOverlayKey(key);
        if (overlayKey.isEmpty()) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "Unknown profile variable: " + key);
        }
        ProgressionState current = state();
        ProfileOverlay overlay = current.getOverlays().forScope(scope)
                .computeIfAbsent(id, ignored -> new ProfileOverlay());
        if (overlayKey.get().metric()) {
            overlay.getMetrics().put(overlayKey.get().name(), value);
        } else {
            overlay.getVariables().put(overlayKey.get().name(), value);
        }
        overlay.setUpdatedAt(Instant.now(clock));
        store.save(current);
        return OperationResult.success(overlay);
    }

    /**
     * Remove one key, or the whole overlay when {@code key} is null.
     *
     * @throws IllegalArgumentException
     *             for an unknown scope
     */
    public OperationResult clearProfileOverlay(String scopeId, String overlayId, String key) {
        OverlayScope scope = OverlayScope.fromId(scopeId);
        String id = normalizeOverlayId(overlayId);
        ProgressionState current = state();
        Map<String, ProfileOverlay> overlays = current.getOverlays().forScope(scope);
        ProfileOverlay overlay = overlays.get(id);
        if (overlay == null) {
            return OperationResult.failure(ErrorKind.MALFORMED_INPUT,
                    "Unknown " + scope.id() + " overlay: " + overlayId);
        }
        if (key == null) {
            overlays.remove(id);
        } else {
            Optional<OverlayKey> overlayKey = parseOverlayKey(key);
            if (overlayKey.isEmpty()) {
                return OperationResult.failure(ErrorKind.MALFORMED_INPUT, "Unknown profile variable: " + key);
            }
            if (overlayKey.get().metric()) {
                overlay.getMetrics().remove(overlayKey.get().name());
            } else {
                overlay.getVariables().remove(overlayKey.get().name());
            }
            overlay.setUpdatedAt(Instant.now(clock));
            if (overlay.isEmpty()) {
                overlays.remove(id);
            }
        }
        store.save(current);
        return OperationResult.success(overlays.get(id));
    }

    public Optional<ProfileOverlay> getProfileOverlay(String scopeId, String overlayId) {
        OverlayScope scope = OverlayScope.fromId(scopeId);
        return Optional.ofNullable(state().getOverlays().forScope(scope).get(normalizeOverlayId(overlayId)));
    }

    /**
     * Layer user values, then the group overlay, then the session overlay.
     */
    public ProfileVariables resolveProfileVariables(String username, String groupId, String sessionId) {
        UserProgressionState user = userView(username);
        Map<String, Long> variables = new TreeMap<>();
        for (String key : ProgressionCatalog.PROFILE_VARIABLES) {
            variables.put(key, requirementEvaluator.variable(user, key));
        }
        Map<String, Long> metrics = new TreeMap<>(user.getProgress().getMetrics());

        ProfileOverlay group = groupId != null ? getProfileOverlay("group", groupId).orElse(null) : null;
        ProfileOverlay session = sessionId != null ? getProfileOverlay("session", sessionId).orElse(null) : null;

        Map<String, Long> effectiveVariables = new TreeMap<>(variables);
        Map<String, Long> effectiveMetrics = new TreeMap<>(metrics);
        for (ProfileOverlay overlay : new ProfileOverlay[] { group, session }) {
            if (overlay != null) {
                effectiveVariables.putAll(overlay.getVariables());
                effectiveMetrics.putAll(overlay.getMetrics());
            }
        }
        return ProfileVariables.builder()
                .username(normalizeUsername(username))
                .groupId(groupId)
                .sessionId(sessionId)
                .userVariables(variables)
                .userMetrics(metrics)
                .groupOverlay(group)
                .sessionOverlay(session)
                .effectiveVariables(effectiveVariables)
                .effectiveMetrics(effectiveMetrics)
                .build();
    }

    // ==================== Snapshot ====================

    public ProgressionSnapshot snapshot(String username) {
        UserProgressionState user = userView(username);
        List<PlayOptionStatus> options = listPlayOptions(username);
        Set<String> blocked = new LinkedHashSet<>();
        options.forEach(option -> blocked.addAll(option.blockedBy()));
        return ProgressionSnapshot.builder()
                .username(normalizeUsername(username))
                .stats(getUserStats(username))
                .progress(user.getProgress())
                .unlockTokens(List.copyOf(user.getUnlockTokens()))
                .gates(listGates())
                .canProceed(canProceed())
                .toybox(state().getToybox())
                .playOptions(options)
                .blockedRequirements(new ArrayList<>(blocked))
                .rules(listRules())
                .build();
    }

    // ==================== Internals ====================

    private ProgressionState state() {
        if (state == null) {
            state = store.load();
        }
        return state;
    }

    private String normalizeUsername(String username) {
        return username == null || username.isBlank() ? ProgressionCatalog.DEFAULT_USER : username.trim();
    }

    private String normalizeOverlayId(String overlayId) {
        return overlayId == null ? "" : overlayId.trim().toLowerCase(Locale.ROOT);
    }

    private Optional<OverlayKey> parseOverlayKey(String key) {
        String normalized = key == null ? "" : key.trim().toLowerCase(Locale.ROOT);
        if (ProgressionCatalog.PROFILE_VARIABLES.contains(normalized)) {
            return Optional.of(new OverlayKey(normalized, false));
        }
        for (String prefix : OVERLAY_METRIC_PREFIXES) {
            if (normalized.startsWith(prefix) && normalized.length() > prefix.length()) {
                return Optional.of(new OverlayKey(normalized.substring(prefix.length()), true));
            }
        }
        return Optional.empty();
    }

    private record OverlayKey(String name, boolean metric) {
    }
}
