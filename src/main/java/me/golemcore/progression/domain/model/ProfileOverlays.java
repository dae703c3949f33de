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

import com.fasterxml.jackson.databind.annotation.JsonDeserialize;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.Map;
import java.util.TreeMap;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class ProfileOverlays {

    @Builder.Default
    @JsonDeserialize(as = TreeMap.class)
    private Map<String, ProfileOverlay> group = new TreeMap<>();

    @Builder.Default
    @JsonDeserialize(as = TreeMap.class)
    private Map<String, ProfileOverlay> session = new TreeMap<>();

    public Map<String, ProfileOverlay> forScope(OverlayScope scope) {
        return scope == OverlayScope.GROUP ? group : session;
    }
}
