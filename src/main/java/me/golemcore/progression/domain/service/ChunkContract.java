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

import me.golemcore.progression.domain.model.PlaceRef;

import java.util.Arrays;
import java.util.Locale;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Parsing of place references and derivation of spatial chunk ids.
 *
 * <p>
 * A place reference has the shape
 * {@code ANCHOR:SPACE:L###-CC##[-Zz][:suffix...]}. The LocId token
 * ({@code L###-CC##[-Zz]}) is located among the colon-delimited parts rather
 * than at a fixed index, so anchors may span several parts and instance
 * suffixes may trail it. Everything before the space part is the anchor.
 */
public final class ChunkContract {

    private static final Pattern LOC_ID = Pattern.compile(
            "^L(\\d{3})-([A-Z]{2})(\\d{2})(?:-Z(-?\\d+))?$", Pattern.CASE_INSENSITIVE);

    private ChunkContract() {
    }

    /**
     * @throws PlaceRefParseException
     *             when no part is a LocId token or anchor/space are missing
     */
    public static PlaceRef parse(String placeRef) {
        if (placeRef == null || placeRef.isBlank()) {
            throw new PlaceRefParseException("Empty place reference");
        }
        String[] parts = placeRef.trim().split(":", -1);
        for (int index = 2; index < parts.length; index++) {
            Matcher matcher = LOC_ID.matcher(parts[index].trim());
            if (!matcher.matches()) {
                continue;
            }
            String anchor = String.join(":", Arrays.copyOfRange(parts, 0, index - 1)).trim();
            String space = parts[index - 1].trim();
            if (anchor.isEmpty() || space.isEmpty() || Arrays.stream(parts, 0, index).anyMatch(String::isBlank)) {
                throw new PlaceRefParseException("Missing anchor or space in place reference: " + placeRef);
            }
            String col = matcher.group(2).toUpperCase(Locale.ROOT);
            String rowDigits = matcher.group(3);
            String zText = matcher.group(4);
            String suffix = String.join(":", Arrays.copyOfRange(parts, index + 1, parts.length));
            return new PlaceRef(
                    anchor.toUpperCase(Locale.ROOT),
                    space.toUpperCase(Locale.ROOT),
                    Integer.parseInt(matcher.group(1)),
                    col + rowDigits,
                    col,
                    Integer.parseInt(rowDigits),
                    zText != null ? Integer.parseInt(zText) : 0,
                    suffix);
        }
        throw new PlaceRefParseException("No LocId token in place reference: " + placeRef);
    }

    public static Optional<PlaceRef> tryParse(String placeRef) {
        try {
            return Optional.of(parse(placeRef));
        } catch (PlaceRefParseException e) {
            return Optional.empty();
        }
    }

    /**
     * Canonical 2D chunk id of a place reference, e.g.
     * {@code EARTH:SUR:L300-BJ10} gives {@code earth-sur-300-bj}.
     */
    public static String deriveChunk2dId(String placeRef) {
        return parse(placeRef).chunk2dId();
    }

    public static boolean isValid(String placeRef) {
        return tryParse(placeRef).isPresent();
    }

    /**
     * Thrown for place references that do not follow the LocId contract.
     */
    public static class PlaceRefParseException extends IllegalArgumentException {

        private static final long serialVersionUID = 1L;

        public PlaceRefParseException(String message) {
            super(message);
        }
    }
}
