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

import com.fasterxml.jackson.annotation.JsonProperty;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.List;

/**
 * Result of a map action. A successful action carries the canonical event it
 * appended; a failed one carries the reason and, for traversal, the
 * {@code blocked} cause ({@code edge} or {@code portal}).
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MapActionResult {

    public static final String BLOCKED_EDGE = "edge";
    public static final String BLOCKED_PORTAL = "portal";

    private boolean ok;
    private String action;
    private String error;
    private ErrorKind errorKind;
    private String blocked;

    private String fromPlaceId;
    private String placeId;
    private Place place;
    private String mode;
    private Integer terrainCost;
    @JsonProperty("z_delta")
    private Integer zDelta;

    private String interactionId;
    private String objectiveId;

    private List<String> interactionPoints;
    private List<String> npcSpawn;
    private List<String> hazards;

    private Integer steps;
    private Long tickCounter;
    private Integer npcPhase;
    private Integer worldPhase;

    private CanonicalEvent event;

    public static MapActionResult failure(String action, ErrorKind kind, String error) {
        return MapActionResult.builder()
                .ok(false)
                .action(action)
                .errorKind(kind)
                .error(error)
                .build();
    }
}
