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
 * Read-only view of everything that decides what a user may do next.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProgressionSnapshot {

    private String username;
    private GameplayStats stats;
    private UserProgress progress;

    @Builder.Default
    private List<UnlockToken> unlockTokens = new ArrayList<>();

    @Builder.Default
    private List<Gate> gates = new ArrayList<>();

    private boolean canProceed;
    private ToyboxState toybox;

    @Builder.Default
    private List<PlayOptionStatus> playOptions = new ArrayList<>();

    @Builder.Default
    private List<String> blockedRequirements = new ArrayList<>();

    @Builder.Default
    private List<Rule> rules = new ArrayList<>();
}
