package me.golemcore.progression.port.outbound;

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

import java.util.concurrent.CompletableFuture;

/**
 * Port for persistent storage operations within the engine workspace. Files
 * are organized by directory (events, progression, map, lens) with support
 * for text documents, crash-safe atomic replacement, append-only logs and
 * byte-range reads used by the log cursor.
 */
public interface StoragePort {

    /**
     * Write text content to file.
     *
     * @param directory
     *            subdirectory (e.g., "events", "progression", "map")
     * @param path
     *            relative path within directory
     * @param content
     *            text content
     */
    CompletableFuture<Void> putText(String directory, String path, String content);

    /**
     * Read text content from file, {@code null} when the file is absent.
     */
    CompletableFuture<String> getText(String directory, String path);

    /**
     * Append text to a file (for the NDJSON event log).
     */
    CompletableFuture<Void> appendText(String directory, String path, String content);

    /**
     * Read at most {@code maxBytes} bytes starting at {@code offset}.
     *
     * <p>
     * Returns an empty array when the file is absent or the offset is at or
     * past the end of the file.
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param offset
     *            byte offset to start reading from
     * @param maxBytes
     *            upper bound on returned bytes
     */
    CompletableFuture<byte[]> readRange(String directory, String path, long offset, int maxBytes);

    /**
     * Atomically write text content to file with optional backup.
     *
     * <p>
     * Guarantees crash-safe writes via:
     * <ol>
     * <li>Write to temporary file (.tmp suffix)</li>
     * <li>fsync to ensure data is on disk</li>
     * <li>If backup enabled: copy existing file to .bak</li>
     * <li>Atomic rename of .tmp to target</li>
     * </ol>
     *
     * @param directory
     *            subdirectory
     * @param path
     *            relative path within directory
     * @param content
     *            text content to write
     * @param backup
     *            if true, preserve previous version as .bak
     */
    CompletableFuture<Void> putTextAtomic(String directory, String path, String content, boolean backup);
}
