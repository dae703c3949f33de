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

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ObjectNode;
import lombok.RequiredArgsConstructor;
import me.golemcore.progression.domain.model.CanonicalEvent;
import org.springframework.stereotype.Component;

import java.util.Map;

/**
 * Wire codec for one NDJSON event line:
 * {@code {"ts","source","username","type","payload"}}.
 */
@Component
@RequiredArgsConstructor
public class CanonicalEventCodec {

    private static final TypeReference<Map<String, Object>> PAYLOAD_TYPE = new TypeReference<>() {
    };

    private final ObjectMapper objectMapper;

    /**
     * Encode an event as a single JSON line without the trailing newline.
     */
    public String encode(CanonicalEvent event) {
        ObjectNode node = objectMapper.createObjectNode();
        node.put("ts", event.ts());
        node.put("source", event.source());
        node.put("username", event.username());
        node.put("type", event.type());
        node.set("payload", objectMapper.valueToTree(event.payload()));
        try {
            return objectMapper.writeValueAsString(node);
        } catch (JsonProcessingException e) {
            throw new IllegalStateException("Failed to encode event " + event.type(), e);
        }
    }

    /**
     * Decode one line. A missing or non-object payload decodes as an empty
     * payload; a line that is not a JSON object is malformed.
     *
     * @throws MalformedEventException
     *             when the line is not a JSON object
     */
    public CanonicalEvent decode(String line) {
        JsonNode root;
        try {
            root = objectMapper.readTree(line);
        } catch (JsonProcessingException e) {
            throw new MalformedEventException("Invalid JSON: " + e.getOriginalMessage());
        }
        if (root == null || !root.isObject()) {
            throw new MalformedEventException("Event line is not a JSON object");
        }
        JsonNode payloadNode = root.get("payload");
        Map<String, Object> payload = payloadNode != null && payloadNode.isObject()
                ? objectMapper.convertValue(payloadNode, PAYLOAD_TYPE)
                : Map.of();
        return CanonicalEvent.builder()
                .ts(text(root, "ts"))
                .source(text(root, "source"))
                .username(text(root, "username"))
                .type(text(root, "type"))
                .payload(payload)
                .build();
    }

    private String text(JsonNode root, String field) {
        JsonNode value = root.get(field);
        if (value == null || value.isNull()) {
            return null;
        }
        return value.isValueNode() ? value.asText() : value.toString();
    }

    /**
     * A log line that cannot be decoded into an event.
     */
    public static class MalformedEventException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public MalformedEventException(String message) {
            super(message);
        }
    }
}
