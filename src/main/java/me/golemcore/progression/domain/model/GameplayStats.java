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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Per-user numeric stats.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class GameplayStats {

    public static final long DEFAULT_HP = 100L;

    @Builder.Default
    private long xp = 0L;

    @Builder.Default
    private long hp = DEFAULT_HP;

    @Builder.Default
    private long gold = 0L;

    public long get(Stat stat) {
        return switch (stat) {
        case XP -> xp;
        case HP -> hp;
        case GOLD -> gold;
        };
    }

    public void set(Stat stat, long value) {
        switch (stat) {
        case XP -> xp = value;
        case HP -> hp = value;
        case GOLD -> gold = value;
        default -> throw new IllegalArgumentException("Unknown stat: " + stat);
        }
    }
}
