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
import java.util.Optional;

/**
 * Numeric user stats that explicit stat operations and rule actions may touch.
 */
public enum Stat {

    XP("xp"), HP("hp"), GOLD("gold");

    private final String id;

    Stat(String id) {
        this.id = id;
    }

    public String id() {
        return id;
    }

    public static Optional<Stat> fromId(String raw) {
        if (raw == null) {
            return Optional.empty();
        }
        String normalized = raw.trim().toLowerCase(Locale.ROOT);
        for (Stat stat : values()) {
            if (stat.id.equals(normalized)) {
                return Optional.of(stat);
            }
        }
        return Optional.empty();
    }
}
