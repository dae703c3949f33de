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

import java.util.Collection;
import java.util.Collections;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.TreeMap;

/**
 * Read-only graph of places keyed by place id, loaded once at startup.
 */
public final class PlaceGraph {

    private final Map<String, Place> places;

    public PlaceGraph(Collection<Place> places) {
        Map<String, Place> indexed = new TreeMap<>();
        for (Place place : places) {
            indexed.put(place.getPlaceId(), place);
        }
        this.places = Collections.unmodifiableMap(indexed);
    }

    public static PlaceGraph empty() {
        return new PlaceGraph(Collections.emptyList());
    }

    public Optional<Place> find(String placeId) {
        if (placeId == null) {
            return Optional.empty();
        }
        return Optional.ofNullable(places.get(placeId));
    }

    public boolean contains(String placeId) {
        return placeId != null && places.containsKey(placeId);
    }

    /**
     * Sorted place ids.
     */
    public Set<String> placeIds() {
        return places.keySet();
    }

    /**
     * First place id in sorted order, used when a user has no position yet.
     */
    public Optional<String> defaultPlaceId() {
        return places.keySet().stream().findFirst();
    }

    public boolean isEmpty() {
        return places.isEmpty();
    }

    public int size() {
        return places.size();
    }
}
