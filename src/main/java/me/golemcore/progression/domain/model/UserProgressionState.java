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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Progression state of a single user. Created lazily on first touch and never
 * deleted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserProgressionState {

    @Builder.Default
    private GameplayStats stats = new GameplayStats();

    @Builder.Default
    private UserProgress progress = new UserProgress();

    @Builder.Default
    private List<UnlockToken> unlockTokens = new ArrayList<>();

    @Builder.Default
    @JsonDeserialize(as = TreeMap.class)
    private Map<String, Object> flags = new TreeMap<>();

    private String lastActiveToybox;

    private Instant updatedAt;

    public boolean hasToken(String tokenId) {
        return unlockTokens.stream().anyMatch(token -> tokenId.equals(token.getId()));
    }

    /**
     * Numeric view of a flag; booleans read as 1/0, absent or non-numeric as 0.
     */
    public long flagAsLong(String key) {
        Object value = flags.get(key);
        if (value instanceof Number number) {
            return number.longValue();
        }
        if (value instanceof Boolean bool) {
            return bool ? 1L : 0L;
        }
        return 0L;
    }

    public boolean flagAsBoolean(String key) {
        return flagAsLong(key) != 0L;
    }
}
