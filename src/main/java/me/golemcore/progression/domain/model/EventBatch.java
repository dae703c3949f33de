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
 * Result of reading the event log from a cursor.
 *
 * @param startOffset
 *            offset the read started from
 * @param endOffset
 *            offset just past the last consumed newline
 * @param linesConsumed
 *            complete lines consumed, blank lines included
 * @param entries
 *            non-blank lines in log order
 */
public record EventBatch(long startOffset, long endOffset, int linesConsumed, List<LogEntry> entries) {

    public EventBatch {
        entries = List.copyOf(entries);
    }

    public static EventBatch empty(long offset) {
        return new EventBatch(offset, offset, 0, List.of());
    }

    public boolean advanced() {
        return endOffset > startOffset;
    }
}
