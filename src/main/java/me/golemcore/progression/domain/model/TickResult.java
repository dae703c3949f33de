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
 * Summary of one ingestion pass over the event log.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class TickResult {

    private String username;

    /** Non-blank lines handled, malformed ones included. */
    private int processed;

    private int malformed;

    /** Events whose reduction changed state. */
    private int applied;

    /** Complete lines consumed, blank ones included. */
    private int linesConsumed;

    private long offsetBefore;
    private long offsetAfter;
    private boolean gateChanged;

    @Builder.Default
    private List<ReduceOutcome> outcomes = new ArrayList<>();

    @Builder.Default
    private List<RuleRunResult> rules = new ArrayList<>();
}
