package me.golemcore.progression.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.progression.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.progression.domain.model.CanonicalEvent;
import me.golemcore.progression.domain.model.ErrorKind;
import me.golemcore.progression.domain.model.EventBatch;
import me.golemcore.progression.domain.model.LogEntry;
import me.golemcore.progression.domain.model.MapActionResult;
import me.golemcore.progression.domain.model.MapStatus;
import me.golemcore.progression.domain.model.PlaceGraph;
import me.golemcore.progression.infrastructure.config.AutoConfiguration;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.DefaultResourceLoader;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNull;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MapRuntimeServiceTest {

    private static final String USER = "alice";
    private static final String SEED = "classpath:spatial/locations-seed.default.json";

    @TempDir
    Path tempDir;

    private LocalStorageAdapter storageAdapter;
    private ObjectMapper objectMapper;
    private EventLogService eventLog;
    private PlaceGraph placeGraph;
    private Clock clock;
    private MapRuntimeService mapRuntime;

    @BeforeEach
    void setUp() {
        ProgressionProperties properties = new ProgressionProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
        objectMapper = AutoConfiguration.objectMapper();
        clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

        eventLog = new EventLogService(storageAdapter, new CanonicalEventCodec(objectMapper), properties);
        placeGraph = new PlaceGraphLoader(objectMapper, new DefaultResourceLoader()).load(SEED);
        mapRuntime = new MapRuntimeService(placeGraph, storageAdapter, eventLog, objectMapper, clock);
    }

    private List<CanonicalEvent> loggedEvents() {
        EventBatch batch = eventLog.readBatch(0, 100);
        return batch.entries().stream().map(LogEntry::event).toList();
    }

    // ==================== Seed ====================

    @Test
    void shouldLoadSeedWithChunkIds() {
        assertEquals(5, placeGraph.size());
        assertEquals("earth-sub-340-aa", placeGraph.find("subterra-relay").orElseThrow().getChunk2dId());
        assertEquals("earth-orb-310-ca", placeGraph.find("lunar-gateway").orElseThrow().getChunk2dId());
        assertEquals(List.of("gas"), placeGraph.find("subterra-relay").orElseThrow().getHazards());
    }

    @Test
    void shouldReturnEmptyGraphForMissingSeed() {
        PlaceGraph missing = new PlaceGraphLoader(objectMapper, new DefaultResourceLoader())
                .load("classpath:spatial/does-not-exist.json");

        assertTrue(missing.isEmpty());
    }

    // ==================== Status ====================

    @Test
    void shouldStartAtFirstSortedPlace() {
        MapStatus status = mapRuntime.status(USER);

        assertTrue(status.isOk());
        assertEquals("andes-pass", status.getCurrentPlaceId());
        assertEquals("earth-sur-300-bj", status.getChunk2dId());
        assertEquals(0, status.getTickCounter());
    }

    @Test
    void shouldReportUnavailableWithoutPlaces() {
        MapRuntimeService empty = new MapRuntimeService(PlaceGraph.empty(), storageAdapter, eventLog, objectMapper,
                clock);

        MapStatus status = empty.status(USER);

        assertFalse(status.isOk());
        assertEquals(ErrorKind.UNAVAILABLE, status.getErrorKind());
        assertFalse(empty.inspect(USER).isOk());
    }

    // ==================== Movement ====================

    @Test
    void shouldEnterKnownPlaceAndEmitEvent() {
        MapActionResult result = mapRuntime.enter(USER, "subterra-relay");

        assertTrue(result.isOk());
        CanonicalEvent event = loggedEvents().get(0);
        assertEquals("MAP_ENTER", event.type());
        assertEquals(MapRuntimeService.SOURCE, event.source());
        assertEquals("subterra-relay", event.payload().get("place_id"));
        assertEquals("earth-sub-340-aa", event.payload().get("chunk2d_id"));
    }

    @Test
    void shouldRejectUnknownPlace() {
        MapActionResult result = mapRuntime.enter(USER, "atlantis");

        assertFalse(result.isOk());
        assertEquals(ErrorKind.MALFORMED_INPUT, result.getErrorKind());
        assertTrue(loggedEvents().isEmpty());
    }

    @Test
    void shouldTraverseWithPortalAndTerrainCost() {
        MapActionResult result = mapRuntime.move(USER, "subterra-relay");

        assertTrue(result.isOk());
        assertEquals("portal", result.getMode());
        assertEquals(3, result.getZDelta());
        // base 1 + one hazard + (3 - 1) vertical
        assertEquals(4, result.getTerrainCost());

        Map<String, Object> payload = loggedEvents().get(0).payload();
        assertEquals("andes-pass", payload.get("from_place_id"));
        assertEquals("subterra-relay", payload.get("to_place_id"));
        assertEquals(4, payload.get("terrain_cost"));
        assertEquals("MOVE", payload.get("action"));
        @SuppressWarnings("unchecked")
        Map<String, Object> location = (Map<String, Object>) payload.get("location");
        assertEquals("EARTH:SUB:L340-AA22-Z-3", location.get("grid_id"));
        assertNull(location.get("x"));
        assertEquals(-3, location.get("z"));
    }

    @Test
    void shouldUsePortalForTwoLevelClimb() {
        MapActionResult result = mapRuntime.move(USER, "lunar-gateway");

        assertEquals("portal", result.getMode());
        assertEquals(2, result.getTerrainCost());
    }

    @Test
    void shouldBlockUnlinkedTarget() {
        MapActionResult result = mapRuntime.move(USER, "deep-vault");

        assertFalse(result.isOk());
        assertEquals(MapActionResult.BLOCKED_EDGE, result.getBlocked());
        assertEquals("andes-pass", result.getFromPlaceId());
        assertEquals("andes-pass", mapRuntime.status(USER).getCurrentPlaceId());
        assertTrue(loggedEvents().isEmpty());
    }

    @Test
    void shouldBlockDeepVerticalMoveWithoutPortal() {
        mapRuntime.enter(USER, "subterra-relay");

        MapActionResult result = mapRuntime.move(USER, "deep-vault");

        assertFalse(result.isOk());
        assertEquals(MapActionResult.BLOCKED_PORTAL, result.getBlocked());
        assertEquals(5, result.getZDelta());
        assertEquals("subterra-relay", mapRuntime.status(USER).getCurrentPlaceId());
    }

    // ==================== Interaction ====================

    @Test
    void shouldInteractOnlyWithLocalPoints() {
        mapRuntime.enter(USER, "subterra-relay");

        assertTrue(mapRuntime.interact(USER, "relay-console").isOk());
        assertFalse(mapRuntime.interact(USER, "gateway-console").isOk());
        assertFalse(mapRuntime.interact(USER, " ").isOk());
    }

    @Test
    void shouldCompleteOnlyLocalObjectives() {
        mapRuntime.enter(USER, "subterra-relay");

        MapActionResult result = mapRuntime.complete(USER, "relay-restore");

        assertTrue(result.isOk());
        assertEquals("relay-restore", result.getObjectiveId());
        assertFalse(mapRuntime.complete(USER, "gateway-calibration").isOk());
    }

    @Test
    void shouldInspectCurrentPlace() {
        mapRuntime.enter(USER, "subterra-relay");

        MapActionResult result = mapRuntime.inspect(USER);

        assertEquals(List.of("relay-console"), result.getInteractionPoints());
        assertEquals(List.of("relay-keeper"), result.getNpcSpawn());
        assertEquals("MAP_INSPECT", loggedEvents().get(1).type());
    }

    // ==================== Ticks ====================

    @Test
    void shouldAdvanceCountersModuloPhases() {
        MapActionResult first = mapRuntime.tick(USER, 0);
        MapActionResult second = mapRuntime.tick(USER, 9);

        assertEquals(1, first.getSteps());
        assertEquals(10L, second.getTickCounter());
        assertEquals(2, second.getNpcPhase());
        assertEquals(10, second.getWorldPhase());
    }

    @Test
    void shouldPersistPositionAcrossInstances() {
        mapRuntime.enter(USER, "lunar-gateway");
        mapRuntime.tick(USER, 3);

        MapRuntimeService restarted = new MapRuntimeService(placeGraph, storageAdapter, eventLog, objectMapper,
                clock);
        MapStatus status = restarted.status(USER);

        assertEquals("lunar-gateway", status.getCurrentPlaceId());
        assertEquals(3, status.getTickCounter());
    }
}
