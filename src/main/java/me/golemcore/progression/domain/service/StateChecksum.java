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
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.node.ArrayNode;
import com.fasterxml.jackson.databind.node.ObjectNode;

import java.nio.charset.StandardCharsets;
import java.security.MessageDigest;
import java.security.NoSuchAlgorithmException;
import java.util.ArrayList;
import java.util.HexFormat;
import java.util.Iterator;
import java.util.List;
import java.util.Set;

/**
 * SHA-256 over a canonical projection of a state document: keys sorted
 * recursively, timestamp-bearing keys removed, compact separators. Two
 * documents with the same semantic content hash identically regardless of
 * when they were written.
 */
public final class StateChecksum {

    static final Set<String> TIMESTAMP_KEYS = Set.of(
            "updated_at", "completed_at", "created_at", "generated_at", "ts", "unlocked_at");

    private StateChecksum() {
    }

    /**
     * Checksum of a JSON document. Content that is not JSON is hashed as raw
     * bytes; {@code null} (absent document) hashes the empty input.
     */
    public static String of(ObjectMapper objectMapper, String json) {
        if (json == null) {
            return sha256(new byte[0]);
        }
        try {
            JsonNode canonical = canonicalize(objectMapper, objectMapper.readTree(json));
            return sha256(objectMapper.writeValueAsString(canonical).getBytes(StandardCharsets.UTF_8));
        } catch (JsonProcessingException e) {
            return sha256(json.getBytes(StandardCharsets.UTF_8));
        }
    }

    static JsonNode canonicalize(ObjectMapper objectMapper, JsonNode node) {
        if (node == null) {
            return objectMapper.nullNode();
        }
        if (node.isObject()) {
            List<String> keys = new ArrayList<>();
            Iterator<String> names = node.fieldNames();
            names.forEachRemaining(keys::add);
            keys.sort(null);
            ObjectNode sorted = objectMapper.createObjectNode();
            for (String key : keys) {
                if (!TIMESTAMP_KEYS.contains(key)) {
                    sorted.set(key, canonicalize(objectMapper, node.get(key)));
                }
            }
            return sorted;
        }
        if (node.isArray()) {
            ArrayNode array = objectMapper.createArrayNode();
            node.forEach(element -> array.add(canonicalize(objectMapper, element)));
            return array;
        }
        return node;
    }

    private static String sha256(byte[] bytes) {
        try {
            MessageDigest digest = MessageDigest.getInstance("SHA-256");
            return HexFormat.of().formatHex(digest.digest(bytes));
        } catch (NoSuchAlgorithmException e) {
            throw new IllegalStateException("SHA-256 not available", e);
        }
    }
}
