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

import com.fasterxml.jackson.annotation.JsonValue;

/**
 * Why the world lens is not ready. Declaration order is precedence: the first
 * failing condition wins.
 */
public enum LensBlockingReason {

    FEATURE_FLAG_DISABLED("feature_flag_disabled"),
    PROGRESSION_GATE_BLOCKED("progression_gate_blocked"),
    SLICE_CONTRACT_INVALID("slice_contract_invalid"),
    MAP_RUNTIME_UNAVAILABLE("map_runtime_unavailable"),
    OUTSIDE_SINGLE_REGION("outside_single_region");

    private final String id;

    LensBlockingReason(String id) {
        this.id = id;
    }

    @JsonValue
    public String id() {
        return id;
    }
}
