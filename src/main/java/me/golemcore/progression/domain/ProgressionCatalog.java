package me.golemcore.progression.domain;

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

import me.golemcore.progression.domain.model.LensCheckpoint;
import me.golemcore.progression.domain.model.PlayOption;
import me.golemcore.progression.domain.model.Requirement;
import me.golemcore.progression.domain.model.ToyboxProfile;
import me.golemcore.progression.domain.model.UnlockRule;

import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Built-in progression tables: default gate, toybox profiles, default rule,
 * play options, unlock tokens and per-lens checkpoints and score metrics.
 *
 * @since 1.0
 */
public final class ProgressionCatalog {

    public static final String DEFAULT_USER = "default";

    public static final String AMULET_GATE_ID = "dungeon_l32_amulet";
    public static final String AMULET_GATE_TITLE = "Complete dungeon level 32 and retrieve the Amulet of Yendor";
    public static final String AMULET_GATE_LENS = "hethack";
    public static final int AMULET_GATE_MIN_DEPTH = 32;

    public static final String FLAG_MAX_DEPTH = "hethack.max_depth";
    public static final String FLAG_AMULET_RETRIEVED = "hethack.amulet_retrieved";

    public static final String SOURCE_TOYBOX_EVENT = "toybox-event";
    public static final String SOURCE_RULE_ACTION = "rule-action";
    public static final String SOURCE_PLAY_RULE = "play-rule";
    public static final String SOURCE_SYSTEM_DEFAULT = "system-default";
    public static final String SOURCE_MANUAL = "manual";

    public static final String DEFAULT_TOYBOX = "hethack";
    public static final String TOYBOX_RUNTIME = "upstream-adapter";

    public static final String DEFAULT_RULE_ID = "rule.play.galaxy_unlock";
    public static final String DEFAULT_RULE_IF = "xp>=100 and achievement_level>=1";
    public static final String DEFAULT_RULE_THEN = "TOKEN token.rule.play.galaxy; PLAY galaxy";

    /** Keys that untrusted payloads may never use to reach privileged state. */
    public static final List<String> BLOCKED_PAYLOAD_KEYS = List.of(
            "identity", "permissions", "gates", "toybox", "users", "rules", "state");

    /** Variables exposed to rule conditions and profile overlays. */
    public static final List<String> PROFILE_VARIABLES = List.of("xp", "hp", "gold", "level", "achievement_level");

    public static final List<String> DEFAULT_METRICS = List.of(
            "events_processed",
            "missions_completed",
            "deaths",
            "map_enters",
            "map_moves",
            "map_inspects",
            "map_interactions",
            "map_completions",
            "map_ticks",
            "map_portal_transitions",
            "elite_jumps",
            "elite_docks",
            "rpgbbs_sessions",
            "rpgbbs_messages",
            "rpgbbs_quests",
            "crawler3d_floors",
            "crawler3d_objectives");

    public static final List<PlayOption> PLAY_OPTIONS = List.of(
            new PlayOption("dungeon", "Dungeon Run", "Start dungeon progression lens.", List.of()),
            new PlayOption("galaxy", "Galaxy Run", "Enable galaxy lens mission loop.",
                    List.of(Requirement.minStat("xp", 100))),
            new PlayOption("social", "Social Quest", "Enable RPGBBS social quest loop.",
                    List.of(Requirement.minStat("achievement_level", 1))),
            new PlayOption("ascension", "Ascension Gate", "Proceed after dungeon ascension requirement.",
                    List.of(Requirement.minStat("achievement_level", 1), Requirement.gate(AMULET_GATE_ID))));

    public static final List<UnlockRule> UNLOCK_RULES = List.of(
            new UnlockRule("token.toybox.xp_100", "XP 100 Milestone",
                    List.of(Requirement.minStat("xp", 100))),
            new UnlockRule("token.toybox.achievement_l1", "Achievement Level I",
                    List.of(Requirement.minStat("achievement_level", 1))),
            new UnlockRule("token.toybox.navigator_l1", "Navigator I",
                    List.of(Requirement.minMetric("elite_jumps", 5))),
            new UnlockRule("token.toybox.social_l1", "Social I",
                    List.of(Requirement.minMetric("rpgbbs_quests", 1))),
            new UnlockRule("token.toybox.crawler_l1", "Crawler I",
                    List.of(Requirement.minMetric("crawler3d_floors", 10))),
            new UnlockRule("token.toybox.ascension", "Dungeon Ascension",
                    List.of(Requirement.minStat("achievement_level", 1), Requirement.gate(AMULET_GATE_ID))));

    public static final Map<String, List<String>> LENS_SCORE_METRICS = Map.of(
            "hethack", List.of("events_processed", "map_moves", "map_completions", "deaths"),
            "elite", List.of("events_processed", "elite_jumps", "elite_docks", "missions_completed"),
            "rpgbbs", List.of("events_processed", "rpgbbs_sessions", "rpgbbs_messages", "rpgbbs_quests"),
            "crawler3d", List.of("events_processed", "crawler3d_floors", "crawler3d_objectives",
                    "missions_completed"));

    public static final List<String> FALLBACK_SCORE_METRICS = List.of("events_processed");

    public static final Map<String, List<LensCheckpoint>> LENS_CHECKPOINTS = Map.of(
            "hethack", List.of(
                    new LensCheckpoint("depth_training", "Reach depth level 8", Requirement.minStat("level", 3)),
                    new LensCheckpoint("token_xp_100", "Cross XP 100 milestone", Requirement.minStat("xp", 100)),
                    new LensCheckpoint("ascension_gate", "Complete dungeon L32 amulet gate",
                            Requirement.gate(AMULET_GATE_ID))),
            "elite", List.of(
                    new LensCheckpoint("token_xp_100", "Cross XP 100 milestone", Requirement.minStat("xp", 100)),
                    new LensCheckpoint("navigator_i", "Record 5 elite jumps",
                            Requirement.minMetric("elite_jumps", 5)),
                    new LensCheckpoint("mission_ready", "Complete one mission",
                            Requirement.minMetric("missions_completed", 1))),
            "rpgbbs", List.of(
                    new LensCheckpoint("session_start", "Start one RPGBBS session",
                            Requirement.minMetric("rpgbbs_sessions", 1)),
                    new LensCheckpoint("message_board", "Post ten RPGBBS messages",
                            Requirement.minMetric("rpgbbs_messages", 10)),
                    new LensCheckpoint("quest_complete", "Complete one RPGBBS quest",
                            Requirement.minMetric("rpgbbs_quests", 1))),
            "crawler3d", List.of(
                    new LensCheckpoint("floor_scout", "Reach floor 3", Requirement.minMetric("crawler3d_floors", 3)),
                    new LensCheckpoint("floor_ten", "Reach floor 10", Requirement.minMetric("crawler3d_floors", 10)),
                    new LensCheckpoint("objective_clear", "Complete one crawler objective",
                            Requirement.minMetric("crawler3d_objectives", 1))));

    private ProgressionCatalog() {
    }

    /**
     * Fresh copies of the built-in toybox profiles, keyed by profile id.
     */
    public static Map<String, ToyboxProfile> defaultToyboxProfiles() {
        Map<String, ToyboxProfile> profiles = new TreeMap<>();
        profiles.put("hethack", toyboxProfile("hethack", "Dungeon Lens (hethack)", "EARTH:SUB"));
        profiles.put("elite", toyboxProfile("elite", "Galaxy Lens (elite)", "CATALOG:SUR"));
        profiles.put("rpgbbs", toyboxProfile("rpgbbs", "Social Dungeon Lens (rpgbbs)", "EARTH:SUB"));
        profiles.put("crawler3d", toyboxProfile("crawler3d", "Crawler Lens (crawler3d)", "EARTH:SUB"));
        return profiles;
    }

    private static ToyboxProfile toyboxProfile(String id, String name, String anchor) {
        return ToyboxProfile.builder()
                .id(id)
                .name(name)
                .containerId(id)
                .anchor(anchor)
                .runtime(TOYBOX_RUNTIME)
                .build();
    }
}
