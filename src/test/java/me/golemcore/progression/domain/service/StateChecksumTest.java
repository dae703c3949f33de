package me.golemcore.progression.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.progression.infrastructure.config.AutoConfiguration;
import org.junit.jupiter.api.Test;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class StateChecksumTest {

    private final ObjectMapper objectMapper = AutoConfiguration.objectMapper();

    @Test
    void shouldIgnoreKeyOrder() {
        String first = "{\"users\":{\"alice\":{\"xp\":10,\"gold\":2}},\"version\":2}";
        String second = "{\"version\":2,\"users\":{\"alice\":{\"gold\":2,\"xp\":10}}}";

        assertEquals(StateChecksum.of(objectMapper, first), StateChecksum.of(objectMapper, second));
    }

    @Test
    void shouldIgnoreTimestampKeysAtAnyDepth() {
        String first = "{\"updated_at\":\"2026-01-01T00:00:00Z\",\"gates\":[{\"id\":\"g\",\"completed_at\":\"a\"}],"
                + "\"users\":{\"alice\":{\"unlock_tokens\":[{\"id\":\"t\",\"unlocked_at\":\"x\"}]}}}";
        String second = "{\"updated_at\":\"2026-09-09T09:09:09Z\",\"gates\":[{\"id\":\"g\",\"completed_at\":\"b\"}],"
                + "\"users\":{\"alice\":{\"unlock_tokens\":[{\"id\":\"t\",\"unlocked_at\":\"y\"}]}}}";

        assertEquals(StateChecksum.of(objectMapper, first), StateChecksum.of(objectMapper, second));
    }

    @Test
    void shouldDetectSemanticChange() {
        String first = "{\"users\":{\"alice\":{\"xp\":10}}}";
        String second = "{\"users\":{\"alice\":{\"xp\":11}}}";

        assertNotEquals(StateChecksum.of(objectMapper, first), StateChecksum.of(objectMapper, second));
    }

    @Test
    void shouldKeepArrayOrderSignificant() {
        assertNotEquals(StateChecksum.of(objectMapper, "{\"a\":[1,2]}"),
                StateChecksum.of(objectMapper, "{\"a\":[2,1]}"));
    }

    @Test
    void shouldHashAbsentDocumentAsEmptyInput() {
        assertEquals("e3b0c44298fc1c149afbf4c8996fb92427ae41e4649b934ca495991b7852b855",
                StateChecksum.of(objectMapper, null));
    }

    @Test
    void shouldHashUnparseableContentAsRawBytes() {
        String checksum = StateChecksum.of(objectMapper, "{not json");

        assertEquals(64, checksum.length());
        assertTrue(checksum.matches("[0-9a-f]+"));
        assertNotEquals(checksum, StateChecksum.of(objectMapper, "{not json either"));
    }
}
