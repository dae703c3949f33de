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
import me.golemcore.progression.domain.model.ActionOutcome;
import me.golemcore.progression.domain.model.CompiledRule;
import me.golemcore.progression.domain.model.PlayStartResult;
import me.golemcore.progression.domain.model.ProgressionState;
import me.golemcore.progression.domain.model.RequirementVerdict;
import me.golemcore.progression.domain.model.Rule;
import me.golemcore.progression.domain.model.RuleAction;
import me.golemcore.progression.domain.model.RuleFiring;
import me.golemcore.progression.domain.model.RuleRunResult;
import me.golemcore.progression.domain.model.Stat;
import me.golemcore.progression.domain.model.UserProgressionState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.TreeMap;
import java.util.concurrent.ConcurrentHashMap;

/**
 * Evaluates IF/THEN rules in rule id order against the live state.
 *
 * <p>
 * Actions of an earlier rule are visible to the conditions of a later rule in
 * the same pass. Rule text is compiled once and cached by its IF/THEN text.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class RuleEngine {

    private static final String DISABLED = "disabled";

    private final ProgressionMutator mutator;
    private final RequirementEvaluator requirementEvaluator;
    private final Map<String, CompiledRule> compiled = new ConcurrentHashMap<>();

    /**
     * Run one rule, or all rules when {@code ruleId} is null.
     */
    public RuleRunResult run(ProgressionState state, String username, String ruleId) {
        Map<String, Rule> candidates = new TreeMap<>(state.getRules());
        if (ruleId != null) {
            Rule rule = state.getRules().get(ruleId);
            candidates = rule != null ? Map.of(ruleId, rule) : Map.of();
        }
        List<RuleFiring> evaluations = new ArrayList<>();
        for (Map.Entry<String, Rule> entry : candidates.entrySet()) {
            evaluations.add(evaluate(state, username, entry.getKey(), entry.getValue()));
        }
        return new RuleRunResult(username, evaluations);
    }

    public RequirementVerdict test(ProgressionState state, String username, String ifExpression) {
        return requirementEvaluator.evaluate(state, username, RuleExpressionParser.parseCondition(ifExpression));
    }

    public CompiledRule compile(Rule rule) {
        String ifText = rule.getIfExpression() == null ? "" : rule.getIfExpression();
        String thenText = rule.getThenExpression() == null ? "" : rule.getThenExpression();
        return compiled.computeIfAbsent(ifText + "\n=>\n" + thenText, key -> new CompiledRule(
                RuleExpressionParser.parseCondition(ifText),
                RuleExpressionParser.parseActions(thenText)));
    }

    private RuleFiring evaluate(ProgressionState state, String username, String ruleId, Rule rule) {
        if (!rule.isEnabled()) {
            return new RuleFiring(ruleId, false, List.of(DISABLED), List.of());
        }
        CompiledRule compiledRule = compile(rule);
        RequirementVerdict verdict = requirementEvaluator.evaluate(state, username, compiledRule.conditions());
        if (!verdict.ok()) {
            log.debug("[Rules] {} blocked for {} by {}", ruleId, username, verdict.blockedBy());
            return new RuleFiring(ruleId, false, verdict.blockedBy(), List.of());
        }
        List<ActionOutcome> outcomes = new ArrayList<>();
        for (RuleAction action : compiledRule.actions()) {
            outcomes.add(execute(state, username, action));
        }
        log.debug("[Rules] {} fired for {}: {}", ruleId, username, outcomes);
        return new RuleFiring(ruleId, true, List.of(), outcomes);
    }

    private ActionOutcome execute(ProgressionState state, String username, RuleAction action) {
        switch (action.kind()) {
        case TOKEN -> {
            UserProgressionState user = mutator.ensureUser(state, username);
            boolean granted = mutator.grantToken(user, action.target(), action.target(),
                    ProgressionCatalog.SOURCE_RULE_ACTION).isPresent();
            return new ActionOutcome(action.kind(), action.target(), granted,
                    granted ? "granted" : "already_granted");
        }
        case PLAY -> {
            PlayStartResult result = mutator.startPlayOption(state, username, action.target());
            String detail = result.blockedBy().isEmpty()
                    ? result.status()
                    : result.status() + ":" + String.join(",", result.blockedBy());
            return new ActionOutcome(action.kind(), action.target(), result.started(), detail);
        }
        case GATE_COMPLETE -> {
            boolean completed = mutator.completeGate(state, action.target(), ProgressionCatalog.SOURCE_RULE_ACTION);
            return new ActionOutcome(action.kind(), action.target(), completed,
                    completed ? "completed" : "already_completed");
        }
        case STAT_ADD -> {
            Optional<Stat> stat = Stat.fromId(action.target());
            if (stat.isEmpty()) {
                return new ActionOutcome(action.kind(), action.target(), false, "invalid_stat");
            }
            UserProgressionState user = mutator.ensureUser(state, username);
            long value = user.getStats().get(stat.get()) + action.delta();
            user.getStats().set(stat.get(), value);
            mutator.touch(user);
            return new ActionOutcome(action.kind(), action.target(), true, stat.get().id() + "=" + value);
        }
        case ACHIEVE -> {
            UserProgressionState user = mutator.ensureUser(state, username);
            boolean added = mutator.addAchievement(user, action.target());
            return new ActionOutcome(action.kind(), action.target(), added, added ? "added" : "already_added");
        }
        default -> {
            return new ActionOutcome(action.kind(), null, false, "unsupported:" + action.raw());
        }
        }
    }
}
