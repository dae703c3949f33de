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
 * Parsed form of a place reference such as
 * {@code EARTH:SUB:L340-AA22-Z-3:D4}.
 *
 * @param anchor
 *            anchor prefix, possibly multi-part (e.g. {@code EARTH})
 * @param space
 *            space code (e.g. {@code SUB}, {@code SUR}, {@code ORB})
 * @param layer
 *            three-digit layer number
 * @param cell
 *            two letters and two digits, e.g. {@code AA22}
 * @param col
 *            the letter pair of the cell
 * @param row
 *            the digit pair of the cell
 * @param z
 *            vertical offset, 0 when absent
 * @param suffix
 *            trailing instance parts after the LocId token, empty when absent
 */
public record PlaceRef(String anchor, String space, int layer, String cell, String col, int row, int z,
        String suffix) {

    /**
     * Canonical 2D chunk id, {@code {anchor}-{space}-{layer:03d}-{col}} in lower
     * case. z is never part of it.
     */
    public String chunk2dId() {
        return String.format(Locale.ROOT, "%s-%s-%03d-%s",
                anchor.toLowerCase(Locale.ROOT).replace(':', '-'),
                space.toLowerCase(Locale.ROOT),
                layer,
                col.toLowerCase(Locale.ROOT));
    }
}
