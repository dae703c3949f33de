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

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Current map position of a user. {@code ok=false} when the place graph is
 * empty or the stored position no longer exists in it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MapStatus {

    private boolean ok;
    private String error;
    private ErrorKind errorKind;
    private String username;
    private String currentPlaceId;
    private Place place;
    private String chunk2dId;
    private long tickCounter;
    private int npcPhase;
    private int worldPhase;
}
