package me.golemcore.progression.domain.model;

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

import java.util.List;

/**
 * Result of running enabled rules for one user, in rule id order.
 */
public record RuleRunResult(String username, List<RuleFiring> evaluations) {

    public RuleRunResult {
        evaluations = List.copyOf(evaluations);
    }

    public List<RuleFiring> fired() {
        return evaluations.stream().filter(RuleFiring::fired).toList();
    }

    public List<RuleFiring> blocked() {
        return evaluations.stream().filter(firing -> !firing.fired()).toList();
    }

    public boolean changedState() {
        return evaluations.stream()
                .flatMap(firing -> firing.actions().stream())
                .anyMatch(ActionOutcome::applied);
    }
}
