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
 * Parsed THEN action.
 *
 * @param kind
 *            action variant
 * @param target
 *            token, play option, gate, stat or achievement id
 * @param delta
 *            stat delta for {@link Kind#STAT_ADD}, 0 otherwise
 * @param raw
 *            the original text chunk
 */
public record RuleAction(Kind kind, String target, long delta, String raw) {

    public enum Kind {
        TOKEN, PLAY, GATE_COMPLETE, STAT_ADD, ACHIEVE, UNSUPPORTED
    }

    public static RuleAction unsupported(String raw) {
        return new RuleAction(Kind.UNSUPPORTED, null, 0L, raw);
    }
}
