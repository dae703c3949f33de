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

import com.fasterxml.jackson.annotation.JsonAlias;
import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Node of the static place graph as read from the seed file. Seed files use
 * {@code placeId}/{@code placeRef}; both spellings are accepted.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class Place {

    @JsonAlias("placeId")
    private String placeId;

    private String label;

    @JsonAlias("placeRef")
    private String placeRef;

    private int z;

    @Builder.Default
    private List<String> links = new ArrayList<>();

    @Builder.Default
    private List<String> portals = new ArrayList<>();

    @Builder.Default
    private List<String> hazards = new ArrayList<>();

    @Builder.Default
    private List<String> questIds = new ArrayList<>();

    @Builder.Default
    private List<String> interactionPoints = new ArrayList<>();

    @Builder.Default
    private List<String> npcSpawn = new ArrayList<>();

    @Builder.Default
    private Map<String, Object> metadata = new LinkedHashMap<>();

    /** Filled by the loader from {@code metadata.chunk} or the PlaceRef. */
    private String chunk2dId;
}
