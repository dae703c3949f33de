package me.golemcore.progression.domain.service;

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

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * Lenient reads of loosely typed JSON payload values.
 */
final class PayloadValues {

    private PayloadValues() {
    }

    static Optional<Long> asLong(Object value) {
        if (value instanceof Number number) {
            return Optional.of(number.longValue());
        }
        if (value instanceof String text) {
            try {
                return Optional.of(Long.parseLong(text.trim()));
            } catch (NumberFormatException e) {
                return Optional.empty();
            }
        }
        return Optional.empty();
    }

    static long longOrDefault(Map<String, Object> payload, String key, long fallback) {
        return asLong(payload.get(key)).orElse(fallback);
    }

    static String text(Map<String, Object> payload, String key) {
        Object value = payload.get(key);
        return value != null ? value.toString().trim() : "";
    }

    /**
     * Nested JSON object under {@code key}, or {@code null} when absent or not
     * an object. Entries with non-string keys are dropped.
     */
    static Map<String, Object> object(Map<String, Object> payload, String key) {
        if (!(payload.get(key) instanceof Map<?, ?> nested)) {
            return null;
        }
        Map<String, Object> result = new LinkedHashMap<>();
        for (Map.Entry<?, ?> entry : nested.entrySet()) {
            if (entry.getKey() instanceof String name) {
                result.put(name, entry.getValue());
            }
        }
        return result;
    }
}
