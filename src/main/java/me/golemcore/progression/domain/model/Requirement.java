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

/**
 * Single parsed requirement shared by rule conditions, play options, unlock
 * tokens and lens checkpoints.
 *
 * @param kind
 *            requirement variant
 * @param key
 *            stat or metric name for threshold kinds, otherwise the gate,
 *            token or toybox id
 * @param threshold
 *            minimum value for threshold kinds, 0 otherwise
 */
public record Requirement(Kind kind, String key, long threshold) {

    public enum Kind {
        /** xp, hp, gold, level or achievement_level at least threshold. */
        MIN_STAT,
        /** progress metric at least threshold. */
        MIN_METRIC,
        /** gate completed. */
        GATE,
        /** user holds unlock token. */
        TOKEN,
        /** active toybox profile equals key. */
        TOYBOX
    }

    public static Requirement minStat(String key, long threshold) {
        return new Requirement(Kind.MIN_STAT, key, threshold);
    }

    public static Requirement minMetric(String key, long threshold) {
        return new Requirement(Kind.MIN_METRIC, key, threshold);
    }

    public static Requirement gate(String gateId) {
        return new Requirement(Kind.GATE, gateId, 0L);
    }

    public static Requirement token(String tokenId) {
        return new Requirement(Kind.TOKEN, tokenId, 0L);
    }

    public static Requirement toybox(String profile) {
        return new Requirement(Kind.TOYBOX, profile, 0L);
    }

    /**
     * Label reported in {@code blocked_by} lists, e.g. {@code xp>=100} or
     * {@code gate:dungeon_l32_amulet}.
     */
    public String label() {
        return switch (kind) {
        case MIN_STAT, MIN_METRIC -> key + ">=" + threshold;
        case GATE -> "gate:" + key;
        case TOKEN -> "token:" + key;
        case TOYBOX -> "toybox:" + key;
        };
    }
}
