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

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * World lens readiness for one user.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class LensStatus {

    public static final String LENS_ID = "world-3d-mvp";

    private boolean ok;
    private String username;
    private String version;

    @Builder.Default
    private String lensId = LENS_ID;

    private boolean enabled;
    private String enabledSource;
    private boolean ready;
    private LensBlockingReason blockingReason;

    private String regionId;
    private String regionTitle;
    private String entryPlaceId;
    private List<String> allowedPlaceIds;
    private String anchorPrefix;
    private String currentPlaceId;
    private boolean regionActive;

    private SliceContractStatus sliceContract;

    @Builder.Default
    private Map<String, String> contracts = new LinkedHashMap<>();

    private Instant updatedAt;
    private String updatedBy;
}
