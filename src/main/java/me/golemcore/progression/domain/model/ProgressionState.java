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
import java.util.Map;
import java.util.TreeMap;

/**
 * The whole persisted progression document: global gates, rules, toybox
 * selection, profile overlays and per-user state.
 *
 * <p>
 * Maps are sorted so that the serialized document, and therefore its
 * checksum, does not depend on insertion history.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ProgressionState {

    public static final int CURRENT_VERSION = 2;

    @Builder.Default
    private int version = CURRENT_VERSION;

    private Instant updatedAt;

    @Builder.Default
    @JsonDeserialize(as = TreeMap.class)
    private Map<String, Gate> gates = new TreeMap<>();

    @Builder.Default
    @JsonDeserialize(as = TreeMap.class)
    private Map<String, Rule> rules = new TreeMap<>();

    @Builder.Default
    private ToyboxState toybox = new ToyboxState();

    @Builder.Default
    private ProfileOverlays overlays = new ProfileOverlays();

    @Builder.Default
    @JsonDeserialize(as = TreeMap.class)
    private Map<String, UserProgressionState> users = new TreeMap<>();
}
