package me.golemcore.progression.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.progression.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.progression.domain.model.CanonicalEvent;
import me.golemcore.progression.domain.model.EventBatch;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

class EventLogServiceTest {

    private static final String EVENTS_DIR = "events";
    private static final String EVENTS_FILE = "gameplay_events.ndjson";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;
    private EventLogService eventLog;

    @BeforeEach
    void setUp() {
        ProgressionProperties properties = new ProgressionProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        // Small chunks force lines to span reads.
        properties.getEngine().setReadChunkBytes(7);

        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
        eventLog = new EventLogService(storageAdapter, new CanonicalEventCodec(new ObjectMapper()), properties);
    }

    private void write(String content) {
        storageAdapter.appendText(EVENTS_DIR, EVENTS_FILE, content).join();
    }

    @Test
    void shouldReturnEmptyBatchWhenLogMissing() {
        EventBatch batch = eventLog.readBatch(0, 10);

        assertTrue(batch.entries().isEmpty());
        assertFalse(batch.advanced());
        assertFalse(Files.exists(tempDir.resolve(EVENTS_DIR).resolve(EVENTS_FILE)));
    }

    @Test
    void shouldReadAppendedEventsInOrder() throws IOException {
        eventLog.append(CanonicalEvent.builder().type("MAP_TICK").username("a").payload(Map.of()).build());
        eventLog.append(CanonicalEvent.builder().type("MAP_INSPECT").username("b").payload(Map.of()).build());

        EventBatch batch = eventLog.readBatch(0, 10);

        assertEquals(2, batch.entries().size());
        assertEquals("MAP_TICK", batch.entries().get(0).event().type());
        assertEquals("MAP_INSPECT", batch.entries().get(1).event().type());
        assertEquals(Files.size(tempDir.resolve(EVENTS_DIR).resolve(EVENTS_FILE)), batch.endOffset());
    }

    @Test
    void shouldLeavePartialTrailingLineUnconsumed() {
        String complete = "{\"type\":\"MAP_TICK\"}\n";
        write(complete + "{\"type\":\"MAP_EN");

        EventBatch batch = eventLog.readBatch(0, 10);

        assertEquals(1, batch.entries().size());
        assertEquals(complete.getBytes(StandardCharsets.UTF_8).length, batch.endOffset());

        write("TER\"}\n");
        EventBatch next = eventLog.readBatch(batch.endOffset(), 10);

        assertEquals(1, next.entries().size());
        assertEquals("MAP_ENTER", next.entries().get(0).event().type());
        assertEquals(batch.endOffset(), next.entries().get(0).offset());
    }

    @Test
    void shouldCountMalformedButNotBlankLinesTowardLimit() {
        write("\n\n{broken\n   \n{\"type\":\"MAP_TICK\"}\n{\"type\":\"MAP_INSPECT\"}\n");

        EventBatch batch = eventLog.readBatch(0, 2);

        assertEquals(2, batch.entries().size());
        assertTrue(batch.entries().get(0).isMalformed());
        assertEquals("MAP_TICK", batch.entries().get(1).event().type());
        assertEquals(5, batch.linesConsumed());

        EventBatch rest = eventLog.readBatch(batch.endOffset(), 2);
        assertEquals(1, rest.entries().size());
        assertEquals("MAP_INSPECT", rest.entries().get(0).event().type());
    }

    @Test
    void shouldRejectNonPositiveLimit() {
        assertThrows(IllegalArgumentException.class, () -> eventLog.readBatch(0, 0));
    }

    @Test
    void shouldAppendRawLineVerbatim() {
        eventLog.appendRawLine("not-json-at-all");

        EventBatch batch = eventLog.readBatch(0, 10);

        assertEquals(1, batch.entries().size());
        assertTrue(batch.entries().get(0).isMalformed());
    }
}
