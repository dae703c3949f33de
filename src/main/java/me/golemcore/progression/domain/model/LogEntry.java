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

/**
 * One complete, non-blank line read from the event log: either a decoded
 * event or the reason it could not be decoded.
 */
public record LogEntry(long offset, CanonicalEvent event, String error) {

    public static LogEntry decoded(long offset, CanonicalEvent event) {
        return new LogEntry(offset, event, null);
    }

    public static LogEntry malformed(long offset, String error) {
        return new LogEntry(offset, null, error);
    }

    public boolean isMalformed() {
        return event == null;
    }
}
