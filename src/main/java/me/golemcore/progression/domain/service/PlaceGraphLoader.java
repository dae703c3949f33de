package me.golemcore.progression.domain.service;

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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.domain.model.Place;
import me.golemcore.progression.domain.model.PlaceGraph;
import me.golemcore.progression.domain.model.PlaceRef;
import org.springframework.core.io.Resource;
import org.springframework.core.io.ResourceLoader;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Loads the read-only place graph from a seed document of the form
 * {@code {"locations": [{"placeId": ..., "placeRef": ..., "links": [...]}]}}.
 *
 * <p>
 * The 2D chunk id of each place comes from {@code metadata.chunk.chunk2d_id}
 * when the seed provides it, otherwise it is derived from the PlaceRef. Places
 * with an unparseable PlaceRef are kept without a chunk id; the world lens
 * reports them as contract violations.
 */
@Component
@RequiredArgsConstructor
@Slf4j
public class PlaceGraphLoader {

    private final ObjectMapper objectMapper;
    private final ResourceLoader resourceLoader;

    public PlaceGraph load(String location) {
        Resource resource = resourceLoader.getResource(location);
        if (!resource.exists()) {
            log.warn("[MapRuntime] Place seed not found: {}", location);
            return PlaceGraph.empty();
        }
        try (InputStream input = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(input);
            List<Place> places = new ArrayList<>();
            for (JsonNode node : root.path("locations")) {
                Place place = objectMapper.treeToValue(node, Place.class);
                if (place.getPlaceId() == null || place.getPlaceId().isBlank()) {
                    log.warn("[MapRuntime] Skipping seed location without placeId");
                    continue;
                }
                places.add(place.toBuilder().chunk2dId(resolveChunk2dId(place)).build());
            }
            PlaceGraph graph = new PlaceGraph(places);
            log.info("[MapRuntime] Loaded {} places from {}", graph.size(), location);
            return graph;
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read place seed: " + location, e);
        }
    }

    private String resolveChunk2dId(Place place) {
        Object chunk = place.getMetadata() != null ? place.getMetadata().get("chunk") : null;
        if (chunk instanceof Map<?, ?> chunkFields && chunkFields.get("chunk2d_id") instanceof String id
                && !id.isBlank()) {
            return id;
        }
        return ChunkContract.tryParse(place.getPlaceRef()).map(PlaceRef::chunk2dId).orElse(null);
    }
}
