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
 * Outcome of starting a play option.
 *
 * @param optionId
 *            normalized option id
 * @param status
 *            {@link #STARTED}, {@link #BLOCKED} or {@link #UNKNOWN}
 * @param blockedBy
 *            failed requirement labels when blocked
 */
public record PlayStartResult(String optionId, String status, List<String> blockedBy) {

    public static final String STARTED = "started";
    public static final String BLOCKED = "blocked";
    public static final String UNKNOWN = "unknown";

    public PlayStartResult {
        blockedBy = List.copyOf(blockedBy);
    }

    public boolean started() {
        return STARTED.equals(status);
    }
}
