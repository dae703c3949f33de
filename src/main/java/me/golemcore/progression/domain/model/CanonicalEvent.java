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

import lombok.Builder;

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Locale;
import java.util.Map;

/**
 * Normalized, typed log record and the sole input to state reduction.
 *
 * <p>
 * {@code type} keeps the raw wire value so unknown types survive into replay
 * reports; {@link #eventType()} resolves it against the closed enum.
 *
 * @param ts
 *            RFC 3339 timestamp set by the producer
 * @param source
 *            producer lane id, e.g. {@code core:map-runtime} or
 *            {@code adapter:hethack}
 * @param username
 *            user whose state the event affects
 * @param type
 *            upper-snake event type as written on the wire
 * @param payload
 *            type-specific payload, never null
 */
@Builder
public record CanonicalEvent(String ts, String source, String username, String type, Map<String, Object> payload) {

    public static final String ADAPTER_LANE_PREFIX = "adapter:";
    public static final String TOYBOX_LANE_PREFIX = "toybox:";

    public CanonicalEvent {
        payload = payload == null
                ? Map.of()
                : Collections.unmodifiableMap(new LinkedHashMap<>(payload));
    }

    public CanonicalEventType eventType() {
        return CanonicalEventType.fromWire(type);
    }

    /**
     * Events from adapter or toybox lanes are untrusted: their stat and
     * progress overrides are never honored.
     */
    public boolean fromUntrustedLane() {
        if (source == null) {
            return false;
        }
        String lane = source.trim().toLowerCase(Locale.ROOT);
        return lane.startsWith(ADAPTER_LANE_PREFIX) || lane.startsWith(TOYBOX_LANE_PREFIX);
    }
}
