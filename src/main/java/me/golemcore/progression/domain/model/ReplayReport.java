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

import com.fasterxml.jackson.databind.PropertyNamingStrategies;
import com.fasterxml.jackson.databind.annotation.JsonNaming;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Report written by the replay harness.
 *
 * <p>
 * {@code eventsSkipped} folds malformed lines and valid events that changed
 * nothing into one number.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@JsonNaming(PropertyNamingStrategies.SnakeCaseStrategy.class)
public class ReplayReport {

    private boolean ok;
    private String inputEvents;
    private String outputState;
    private int maxEventsPerTick;
    private int ticks;
    private long eventsTotal;
    private long eventsProcessed;
    private long eventsApplied;
    private long eventsSkipped;

    @Builder.Default
    private List<String> unknownEventTypes = new ArrayList<>();

    private long unknownEventsChanged;
    private String checksumBefore;
    private String checksumAfter;
    private Instant generatedAt;
}
