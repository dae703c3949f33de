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

import java.util.Locale;

/**
 * Closed set of canonical gameplay event types understood by the reducer.
 * Anything else on the wire maps to {@link #UNKNOWN}, which carries no reward.
 */
public enum CanonicalEventType {

    HETHACK_LEVEL_REACHED,
    HETHACK_AMULET_RETRIEVED,
    HETHACK_DEATH,
    ELITE_HYPERSPACE_JUMP,
    ELITE_DOCKED,
    ELITE_MISSION_COMPLETE,
    ELITE_TRADE_PROFIT,
    RPGBBS_SESSION_START,
    RPGBBS_MESSAGE_EVENT,
    RPGBBS_QUEST_COMPLETE,
    CRAWLER3D_FLOOR_REACHED,
    CRAWLER3D_LOOT_FOUND,
    CRAWLER3D_OBJECTIVE_COMPLETE,
    MAP_ENTER,
    MAP_TRAVERSE,
    MAP_INSPECT,
    MAP_INTERACT,
    MAP_COMPLETE,
    MAP_TICK,
    UNKNOWN;

    /**
     * Resolve a wire type name, case-insensitively.
     */
    public static CanonicalEventType fromWire(String raw) {
        if (raw == null || raw.isBlank()) {
            return UNKNOWN;
        }
        String normalized = raw.trim().toUpperCase(Locale.ROOT);
        for (CanonicalEventType type : values()) {
            if (type != UNKNOWN && type.name().equals(normalized)) {
                return type;
            }
        }
        return UNKNOWN;
    }

    public boolean isMapEvent() {
        return name().startsWith("MAP_");
    }
}
