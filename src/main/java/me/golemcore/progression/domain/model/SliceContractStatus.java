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

import java.util.ArrayList;
import java.util.List;

/**
 * Validation of a slice against the place graph. All id lists are sorted.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class SliceContractStatus {

    private boolean valid;
    private String entryPlaceId;

    @Builder.Default
    private List<String> allowedPlaceIds = new ArrayList<>();

    @Builder.Default
    private List<String> missingPlaceIds = new ArrayList<>();

    @Builder.Default
    private List<String> invalidPlaceRefs = new ArrayList<>();

    @Builder.Default
    private List<String> prefixMismatchPlaceIds = new ArrayList<>();

    @Builder.Default
    private List<String> disconnectedPlaceIds = new ArrayList<>();
}
