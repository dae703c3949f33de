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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.domain.model.CanonicalEvent;
import org.springframework.core.io.Resource;

import java.io.IOException;
import java.io.InputStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.TreeMap;

/**
 * Versioned list of required payload fields per event type that untrusted
 * producers must honor. Trusted lanes are not checked.
 */
@Slf4j
public class AdapterEventContract {

    private final String version;
    private final Map<String, List<String>> requiredFields;

    public AdapterEventContract(String version, Map<String, List<String>> requiredFields) {
        this.version = version;
        Map<String, List<String>> normalized = new TreeMap<>();
        requiredFields.forEach((type, fields) -> normalized.put(type.toUpperCase(Locale.ROOT), List.copyOf(fields)));
        this.requiredFields = Collections.unmodifiableMap(normalized);
    }

    public static AdapterEventContract empty() {
        return new AdapterEventContract("none", Map.of());
    }

    /**
     * Load a contract document of the form
     * {@code {"version": "...", "required_payload_fields": {"TYPE": ["field"]}}}.
     */
    public static AdapterEventContract load(ObjectMapper objectMapper, Resource resource) {
        if (!resource.exists()) {
            log.warn("[Reducer] Adapter event contract not found at {}, untrusted events are not validated",
                    resource.getDescription());
            return empty();
        }
        try (InputStream input = resource.getInputStream()) {
            JsonNode root = objectMapper.readTree(input);
            String version = root.path("version").asText("unknown");
            Map<String, List<String>> required = new TreeMap<>();
            root.path("required_payload_fields").fields().forEachRemaining(entry -> {
                List<String> fields = new ArrayList<>();
                entry.getValue().forEach(field -> fields.add(field.asText()));
                required.put(entry.getKey(), fields);
            });
            log.info("[Reducer] Loaded adapter event contract v{} ({} event types)", version, required.size());
            return new AdapterEventContract(version, required);
        } catch (IOException e) {
            throw new IllegalStateException("Failed to read adapter event contract: " + resource.getDescription(), e);
        }
    }

    public String version() {
        return version;
    }

    /**
     * Required fields absent (or null/blank) in the event payload, in contract
     * order. Events of types the contract does not list have no requirements.
     */
    public List<String> missingFields(CanonicalEvent event) {
        String type = event.type() == null ? "" : event.type().trim().toUpperCase(Locale.ROOT);
        List<String> required = requiredFields.getOrDefault(type, List.of());
        List<String> missing = new ArrayList<>();
        for (String field : required) {
            Object value = event.payload().get(field);
            if (value == null || value instanceof String text && text.isBlank()) {
                missing.add(field);
            }
        }
        return missing;
    }
}
