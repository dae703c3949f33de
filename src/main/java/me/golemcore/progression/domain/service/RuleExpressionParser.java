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
import me.golemcore.progression.domain.model.Requirement;
import me.golemcore.progression.domain.model.RuleAction;

import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parser for the rule mini language.
 *
 * <p>
 * IF: clauses joined by {@code and} (or {@code &&}); no OR, no parentheses.
 * Clause forms: {@code key>=N}, {@code key==N}, {@code key=N} for xp, hp,
 * gold, level and achievement_level (all read as "at least N"),
 * {@code metric.<id>>=N}, {@code gate:<id>}, {@code token:<id>},
 * {@code toybox==<id>}. An empty expression has no clauses and always holds.
 * Clauses that match none of these forms are ignored.
 *
 * <p>
 * THEN: semicolon-separated actions {@code TOKEN <id>}, {@code PLAY <option>},
 * {@code GATE COMPLETE <id>}, {@code STAT ADD <stat> <delta>},
 * {@code ACHIEVE <id>}. Anything else becomes an UNSUPPORTED no-op.
 */
@Slf4j
public final class RuleExpressionParser {

    private static final Pattern CLAUSE_SPLIT = Pattern.compile("(?i)\\s+and\\s+|&&");
    private static final Pattern TOYBOX_CLAUSE = Pattern.compile("(?i)^toybox\\s*(==|=)\\s*(\\S+)$");
    private static final Pattern THRESHOLD_CLAUSE = Pattern.compile(
            "(?i)^([a-z_][a-z0-9_.]*)\\s*(>=|==|=)\\s*(-?\\d+)$");

    private RuleExpressionParser() {
    }

    public static List<Requirement> parseCondition(String expression) {
        List<Requirement> requirements = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return requirements;
        }
        for (String rawClause : CLAUSE_SPLIT.split(expression.trim())) {
            String clause = rawClause.trim();
            if (clause.isEmpty()) {
                continue;
            }
            Requirement requirement = parseClause(clause);
            if (requirement != null) {
                requirements.add(requirement);
            } else {
                log.debug("[Rules] Ignoring unrecognized clause: {}", clause);
            }
        }
        return requirements;
    }

    public static List<RuleAction> parseActions(String expression) {
        List<RuleAction> actions = new ArrayList<>();
        if (expression == null || expression.isBlank()) {
            return actions;
        }
        for (String rawChunk : expression.split(";")) {
            String chunk = rawChunk.trim();
            if (!chunk.isEmpty()) {
                actions.add(parseAction(chunk));
            }
        }
        return actions;
    }

    private static Requirement parseClause(String clause) {
        String lower = clause.toLowerCase(Locale.ROOT);
        if (lower.startsWith("gate:")) {
            String gateId = clause.substring("gate:".length()).trim();
            return gateId.isEmpty() ? null : Requirement.gate(gateId);
        }
        if (lower.startsWith("token:")) {
            String tokenId = clause.substring("token:".length()).trim();
            return tokenId.isEmpty() ? null : Requirement.token(tokenId);
        }
        Matcher toybox = TOYBOX_CLAUSE.matcher(clause);
        if (toybox.matches()) {
            return Requirement.toybox(toybox.group(2).toLowerCase(Locale.ROOT));
        }
        Matcher threshold = THRESHOLD_CLAUSE.matcher(clause);
        if (!threshold.matches()) {
            return null;
        }
        String key = threshold.group(1).toLowerCase(Locale.ROOT);
        long value;
        try {
            value = Long.parseLong(threshold.group(3));
        } catch (NumberFormatException e) {
            return null;
        }
        if (ProgressionCatalog.PROFILE_VARIABLES.contains(key)) {
            return Requirement.minStat(key, value);
        }
        for (String prefix : List.of("metric.", "metrics.")) {
            if (key.startsWith(prefix) && key.length() > prefix.length()) {
                return Requirement.minMetric(key.substring(prefix.length()), value);
            }
        }
        return null;
    }

    private static RuleAction parseAction(String chunk) {
        String[] parts = chunk.split("\\s+");
        String head = parts[0].toUpperCase(Locale.ROOT);
        if ("TOKEN".equals(head) && parts.length >= 2) {
            return new RuleAction(RuleAction.Kind.TOKEN, parts[1], 0L, chunk);
        }
        if ("PLAY".equals(head) && parts.length >= 2) {
            return new RuleAction(RuleAction.Kind.PLAY, parts[1].toLowerCase(Locale.ROOT), 0L, chunk);
        }
        if ("GATE".equals(head) && parts.length >= 3 && "COMPLETE".equalsIgnoreCase(parts[1])) {
            return new RuleAction(RuleAction.Kind.GATE_COMPLETE, parts[2], 0L, chunk);
        }
        if ("STAT".equals(head) && parts.length >= 4 && "ADD".equalsIgnoreCase(parts[1])) {
            try {
                long delta = Long.parseLong(parts[3]);
                return new RuleAction(RuleAction.Kind.STAT_ADD, parts[2].toLowerCase(Locale.ROOT), delta, chunk);
            } catch (NumberFormatException e) {
                return RuleAction.unsupported(chunk);
            }
        }
        if ("ACHIEVE".equals(head) && parts.length >= 2) {
            return new RuleAction(RuleAction.Kind.ACHIEVE, parts[1], 0L, chunk);
        }
        return RuleAction.unsupported(chunk);
    }
}
