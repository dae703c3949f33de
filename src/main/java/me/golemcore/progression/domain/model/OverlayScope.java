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

import java.util.Locale;

/**
 * Layer a profile overlay applies to. Resolution order is user, then group,
 * then session.
 */
public enum OverlayScope {

    GROUP("group"), SESSION("session");

    private final String id;

    OverlayScope(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    /**
     * @throws IllegalArgumentException
     *             for anything other than {@code group} or {@code session}
     */
    public static OverlayScope fromId(String raw) {
        String normalized = raw == null ? "" : raw.trim().toLowerCase(Locale.ROOT);
        for (OverlayScope scope : values()) {
            if (scope.id.equals(normalized)) {
                return scope;
            }
        }
        throw new IllegalArgumentException("Unknown overlay scope: " + raw);
    }
}
