package me.golemcore.progression.domain.service;

import me.golemcore.progression.domain.model.Requirement;
import me.golemcore.progression.domain.model.RuleAction;
import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class RuleExpressionParserTest {

    // ==================== Conditions ====================

    @Test
    void shouldParseThresholdsJoinedWithAnd() {
        List<Requirement> requirements = RuleExpressionParser.parseCondition("xp>=100 AND achievement_level >= 1");

        assertEquals(List.of(Requirement.minStat("xp", 100), Requirement.minStat("achievement_level", 1)),
                requirements);
    }

    @Test
    void shouldTreatEqualityAsMinimumThreshold() {
        List<Requirement> requirements = RuleExpressionParser.parseCondition("gold==50 && hp=10");

        assertEquals(List.of(Requirement.minStat("gold", 50), Requirement.minStat("hp", 10)), requirements);
    }

    @Test
    void shouldParseMetricGateTokenAndToyboxClauses() {
        List<Requirement> requirements = RuleExpressionParser.parseCondition(
                "metric.map_moves>=3 and metrics.deaths>=1 and gate:dungeon_l32_amulet and token:t1 and toybox==Elite");

        assertEquals(List.of(
                Requirement.minMetric("map_moves", 3),
                Requirement.minMetric("deaths", 1),
                Requirement.gate("dungeon_l32_amulet"),
                Requirement.token("t1"),
                Requirement.toybox("elite")), requirements);
    }

    @Test
    void shouldIgnoreUnrecognizedClauses() {
        List<Requirement> requirements = RuleExpressionParser.parseCondition("mana>=5 and xp<3 and level>=2");

        assertEquals(List.of(Requirement.minStat("level", 2)), requirements);
    }

    @Test
    void shouldReturnNoClausesForBlankCondition() {
        assertTrue(RuleExpressionParser.parseCondition("  ").isEmpty());
        assertTrue(RuleExpressionParser.parseCondition(null).isEmpty());
    }

    @Test
    void shouldLabelRequirements() {
        assertEquals("xp>=100", Requirement.minStat("xp", 100).label());
        assertEquals("gate:g1", Requirement.gate("g1").label());
        assertEquals("toybox:elite", Requirement.toybox("elite").label());
    }

    // ==================== Actions ====================

    @Test
    void shouldParseEveryActionKind() {
        List<RuleAction> actions = RuleExpressionParser.parseActions(
                "TOKEN t1; play Galaxy; GATE COMPLETE g1; STAT ADD XP 25; ACHIEVE explorer");

        assertEquals(5, actions.size());
        assertEquals(new RuleAction(RuleAction.Kind.TOKEN, "t1", 0L, "TOKEN t1"), actions.get(0));
        assertEquals(RuleAction.Kind.PLAY, actions.get(1).kind());
        assertEquals("galaxy", actions.get(1).target());
        assertEquals(RuleAction.Kind.GATE_COMPLETE, actions.get(2).kind());
        assertEquals("g1", actions.get(2).target());
        assertEquals(RuleAction.Kind.STAT_ADD, actions.get(3).kind());
        assertEquals("xp", actions.get(3).target());
        assertEquals(25L, actions.get(3).delta());
        assertEquals(RuleAction.Kind.ACHIEVE, actions.get(4).kind());
    }

    @Test
    void shouldMarkUnknownActionsUnsupported() {
        List<RuleAction> actions = RuleExpressionParser.parseActions("DANCE now; STAT ADD xp lots;;");

        assertEquals(2, actions.size());
        assertEquals(RuleAction.Kind.UNSUPPORTED, actions.get(0).kind());
        assertNull(actions.get(0).target());
        assertEquals("DANCE now", actions.get(0).raw());
        assertEquals(RuleAction.Kind.UNSUPPORTED, actions.get(1).kind());
    }
}
