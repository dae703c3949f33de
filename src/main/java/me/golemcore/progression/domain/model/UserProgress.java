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

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Derived progress of a user: level, achievements, location and open-ended
 * counters.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class UserProgress {

    @Builder.Default
    private long level = 1L;

    @Builder.Default
    private long achievementLevel = 0L;

    // Insertion order is log order, which keeps checksums stable.
    @Builder.Default
    private List<String> achievements = new ArrayList<>();

    @Builder.Default
    private Location location = new Location();

    @Builder.Default
    @JsonDeserialize(as = TreeMap.class)
    private Map<String, Long> metrics = new TreeMap<>();

    private String lastPlayOption;

    public long metric(String key) {
        Long value = metrics.get(key);
        return value != null ? value : 0L;
    }
}
