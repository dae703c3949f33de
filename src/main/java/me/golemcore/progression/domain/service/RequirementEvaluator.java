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

import me.golemcore.progression.domain.ProgressionCatalog;
import me.golemcore.progression.domain.model.Gate;
import me.golemcore.progression.domain.model.ProgressionState;
import me.golemcore.progression.domain.model.Requirement;
import me.golemcore.progression.domain.model.RequirementVerdict;
import me.golemcore.progression.domain.model.UserProgressionState;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Evaluates requirement lists against the live progression state.
 *
 * <p>
 * Evaluation never creates a user: an unknown username is evaluated against
 * a default user view.
 */
@Component
public class RequirementEvaluator {

    public RequirementVerdict evaluate(ProgressionState state, String username, List<Requirement> requirements) {
        UserProgressionState user = userView(state, username);
        List<String> blocked = new ArrayList<>();
        for (Requirement requirement : requirements) {
            if (!holds(state, user, requirement)) {
                blocked.add(requirement.label());
            }
        }
        return RequirementVerdict.of(blocked);
    }

    /**
     * Current value of a profile variable (xp, hp, gold, level,
     * achievement_level); 0 for anything else.
     */
    public long variable(UserProgressionState user, String key) {
        return switch (key) {
        case "xp" -> user.getStats().getXp();
        case "hp" -> user.getStats().getHp();
        case "gold" -> user.getStats().getGold();
        case "level" -> user.getProgress().getLevel();
        case "achievement_level" -> user.getProgress().getAchievementLevel();
        default -> 0L;
        };
    }

    public UserProgressionState userView(ProgressionState state, String username) {
        UserProgressionState user = username != null ? state.getUsers().get(username) : null;
        return user != null ? user : new UserProgressionState();
    }

    public boolean isGateCompleted(ProgressionState state, String gateId) {
        Gate gate = state.getGates().get(gateId);
        return gate != null && gate.isCompleted();
    }

    public String activeToybox(ProgressionState state) {
        String active = state.getToybox().getActiveProfile();
        return active != null && !active.isBlank() ? active : ProgressionCatalog.DEFAULT_TOYBOX;
    }

    private boolean holds(ProgressionState state, UserProgressionState user, Requirement requirement) {
        return switch (requirement.kind()) {
        case MIN_STAT -> variable(user, requirement.key()) >= requirement.threshold();
        case MIN_METRIC -> user.getProgress().metric(requirement.key()) >= requirement.threshold();
        case GATE -> isGateCompleted(state, requirement.key());
        case TOKEN -> user.hasToken(requirement.key());
        case TOYBOX -> activeToybox(state).equals(requirement.key());
        };
    }
}
