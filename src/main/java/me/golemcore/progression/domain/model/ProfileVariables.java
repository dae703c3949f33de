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

import java.util.Map;
import java.util.TreeMap;

/**
 * User variables and metrics with group and session overlays layered on top.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileVariables {

    private String username;
    private String groupId;
    private String sessionId;

    @Builder.Default
    private Map<String, Long> userVariables = new TreeMap<>();

    @Builder.Default
    private Map<String, Long> userMetrics = new TreeMap<>();

    private ProfileOverlay groupOverlay;
    private ProfileOverlay sessionOverlay;

    @Builder.Default
    private Map<String, Long> effectiveVariables = new TreeMap<>();

    @Builder.Default
    private Map<String, Long> effectiveMetrics = new TreeMap<>();
}
