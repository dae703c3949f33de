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

import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.domain.model.CanonicalEvent;
import me.golemcore.progression.domain.model.EventBatch;
import me.golemcore.progression.domain.model.LogEntry;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import me.golemcore.progression.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.ByteArrayOutputStream;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;

/**
 * Append-only canonical event log stored as NDJSON.
 *
 * <p>
 * Appends are one short write per line and are treated as atomic for a single
 * writer. Reads start at a byte offset and only consume complete lines: a
 * final line without a trailing newline is left for a later read, which
 * bounds the race with a concurrent partial write.
 */
@Service
@Slf4j
public class EventLogService {

    private static final byte NEWLINE = '\n';

    private final StoragePort storagePort;
    private final CanonicalEventCodec codec;
    private final String directory;
    private final String file;
    private final int readChunkBytes;

    public EventLogService(StoragePort storagePort, CanonicalEventCodec codec, ProgressionProperties properties) {
        this.storagePort = storagePort;
        this.codec = codec;
        this.directory = properties.getEvents().getDirectory();
        this.file = properties.getEvents().getFile();
        this.readChunkBytes = Math.max(1, properties.getEngine().getReadChunkBytes());
    }

    public void append(CanonicalEvent event) {
        String line = codec.encode(event) + "\n";
        storagePort.appendText(directory, file, line).join();
        log.debug("[EventLog] Appended {} for {} from {}", event.type(), event.username(), event.source());
    }

    /**
     * Append a line verbatim, adding the newline. Used to carry foreign log
     * content (including malformed lines) into an isolated log.
     */
    public void appendRawLine(String line) {
        storagePort.appendText(directory, file, line + "\n").join();
    }

    /**
     * Read up to {@code maxEvents} complete, non-blank lines starting at
     * {@code offset}.
     *
     * <p>
     * Blank lines are consumed without counting toward {@code maxEvents};
     * malformed lines count and are returned as malformed entries.
     */
    public EventBatch readBatch(long offset, int maxEvents) {
        if (maxEvents <= 0) {
            throw new IllegalArgumentException("maxEvents must be positive: " + maxEvents);
        }
        List<LogEntry> entries = new ArrayList<>();
        ByteArrayOutputStream pending = new ByteArrayOutputStream();
        long readPosition = offset;
        long consumedUpTo = offset;
        long pendingStart = offset;
        int linesConsumed = 0;

        while (entries.size() < maxEvents) {
            byte[] chunk = storagePort.readRange(directory, file, readPosition, readChunkBytes).join();
            if (chunk.length == 0) {
                break;
            }
            readPosition += chunk.length;
            int lineStart = 0;
            for (int i = 0; i < chunk.length && entries.size() < maxEvents; i++) {
                if (chunk[i] != NEWLINE) {
                    continue;
                }
                pending.write(chunk, lineStart, i - lineStart);
                String line = pending.toString(StandardCharsets.UTF_8).trim();
                long lineOffset = pendingStart;
                pending.reset();
                lineStart = i + 1;
                consumedUpTo = readPosition - chunk.length + lineStart;
                pendingStart = consumedUpTo;
                linesConsumed++;
                if (line.isEmpty()) {
                    log.debug("[EventLog] Skipped blank line at offset {}", lineOffset);
                    continue;
                }
                entries.add(decodeLine(lineOffset, line));
            }
            if (entries.size() >= maxEvents) {
                break;
            }
            pending.write(chunk, lineStart, chunk.length - lineStart);
        }

        return new EventBatch(offset, consumedUpTo, linesConsumed, entries);
    }

    private LogEntry decodeLine(long lineOffset, String line) {
        try {
            return LogEntry.decoded(lineOffset, codec.decode(line));
        } catch (CanonicalEventCodec.MalformedEventException e) {
            log.warn("[EventLog] Malformed line at offset {}: {}", lineOffset, e.getMessage());
            return LogEntry.malformed(lineOffset, e.getMessage());
        }
    }
}
