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

import java.util.List;

/**
 * Configured subset of the place graph scoping the world lens.
 */
public record WorldLensSlice(String id, String title, String entryPlaceId, List<String> allowedPlaceIds,
        String anchorPrefix) {

    public WorldLensSlice {
        allowedPlaceIds = allowedPlaceIds.stream()
                .filter(placeId -> placeId != null && !placeId.isBlank())
                .map(String::trim)
                .distinct()
                .toList();
    }

    public boolean allows(String placeId) {
        return placeId != null && allowedPlaceIds.contains(placeId);
    }
}
