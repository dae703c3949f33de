package me.golemcore.progression.domain.service;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.progression.adapter.outbound.storage.LocalStorageFactory;
import me.golemcore.progression.domain.model.CanonicalEvent;
import me.golemcore.progression.domain.model.LogEntry;
import me.golemcore.progression.domain.model.PlaceGraph;
import me.golemcore.progression.domain.model.ProgressionState;
import me.golemcore.progression.domain.model.ReplayReport;
import me.golemcore.progression.domain.model.UnlockToken;
import me.golemcore.progression.domain.model.UserProgressionState;
import me.golemcore.progression.infrastructure.config.AutoConfiguration;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import me.golemcore.progression.port.outbound.StoragePort;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;
import org.springframework.core.io.ClassPathResource;
import org.springframework.core.io.DefaultResourceLoader;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertNotEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ReplayServiceTest {

    private static final String CORE_SOURCE = "core:map-runtime";
    private static final String ADAPTER_SOURCE = "adapter:godot";

    @TempDir
    Path tempDir;

    private ObjectMapper objectMapper;
    private Clock clock;
    private AdapterEventContract contract;
    private ReplayService replayService;

    @BeforeEach
    void setUp() {
        objectMapper = AutoConfiguration.objectMapper();
        ProgressionProperties properties = new ProgressionProperties();
        clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);
        contract = AdapterEventContract.load(objectMapper,
                new ClassPathResource("contracts/adapter-event-contract.json"));
        replayService = new ReplayService(new LocalStorageFactory(), objectMapper, contract, properties, clock);
    }

    private String event(String source, String type, String payloadJson) {
        return "{\"ts\":\"2026-03-01T12:00:00Z\",\"source\":\"" + source + "\",\"username\":\"alice\","
                + "\"type\":\"" + type + "\",\"payload\":" + payloadJson + "}";
    }

    private List<String> mapSession(String source) {
        return List.of(
                event(source, "MAP_ENTER", "{\"place_id\":\"andes-pass\"}"),
                event(source, "MAP_INSPECT", "{\"place_id\":\"andes-pass\"}"),
                event(source, "MAP_INTERACT", "{\"place_id\":\"andes-pass\",\"interaction_id\":\"pass-beacon\"}"),
                event(source, "MAP_COMPLETE", "{\"place_id\":\"andes-pass\",\"objective_id\":\"pass-survey\"}"));
    }

    private Path writeEvents(String name, List<String> lines) throws IOException {
        Path file = tempDir.resolve(name);
        Files.writeString(file, String.join("\n", lines) + "\n", StandardCharsets.UTF_8);
        return file;
    }

    private ProgressionStateStore stateStore(StoragePort storage) {
        return new ProgressionStateStore(storage, objectMapper,
                new ProgressionMutator(new RequirementEvaluator(), clock), clock);
    }

    private UserProgressionState readUser(Path stateFile, String username) throws IOException {
        ProgressionState state = objectMapper.readValue(stateFile.toFile(), ProgressionState.class);
        return state.getUsers().get(username);
    }

    // ==================== Determinism ====================

    @Test
    void shouldProduceSameChecksumWhenReplayedTwice() throws IOException {
        Path input = writeEvents("events.ndjson", mapSession(CORE_SOURCE));

        ReplayReport first = replayService.replay(input, tempDir.resolve("first.json"), null);
        ReplayReport second = replayService.replay(input, tempDir.resolve("second.json"), null);

        assertTrue(first.isOk());
        assertEquals(first.getChecksumAfter(), second.getChecksumAfter());
        assertEquals(first.getChecksumBefore(), second.getChecksumBefore());
        assertNotEquals(first.getChecksumBefore(), first.getChecksumAfter());
    }

    @Test
    void shouldChecksumDefaultDocumentBeforeFirstTick() throws JsonProcessingException {
        String emptyInputChecksum = StateChecksum.of(objectMapper, null);
        String defaultsChecksum = StateChecksum.of(objectMapper,
                objectMapper.writeValueAsString(stateStore(new LocalStorageFactory().open(tempDir.resolve("defaults")))
                        .defaults()));

        ReplayReport report = replayService.replay(tempDir.resolve("missing.ndjson"),
                tempDir.resolve("state.json"), null);

        assertNotEquals(emptyInputChecksum, report.getChecksumBefore());
        assertEquals(defaultsChecksum, report.getChecksumBefore());
    }

    // ==================== Producer parity ====================

    @Test
    void shouldMatchLocalMapRuntimeWhenAdapterLogIsReplayed() throws IOException {
        ProgressionProperties properties = new ProgressionProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.resolve("local").toString());
        StoragePort storage = new LocalStorageFactory().open(tempDir.resolve("local"));
        CanonicalEventCodec codec = new CanonicalEventCodec(objectMapper);
        EventLogService eventLog = new EventLogService(storage, codec, properties);
        PlaceGraph placeGraph = new PlaceGraphLoader(objectMapper, new DefaultResourceLoader())
                .load("classpath:spatial/locations-seed.default.json");
        MapRuntimeService mapRuntime = new MapRuntimeService(placeGraph, storage, eventLog, objectMapper, clock);
        RequirementEvaluator evaluator = new RequirementEvaluator();
        ProgressionMutator mutator = new ProgressionMutator(evaluator, clock);
        ProgressionService local = new ProgressionService(
                new ProgressionStateStore(storage, objectMapper, mutator, clock), eventLog,
                new StateReducer(mutator, contract), new RuleEngine(mutator, evaluator), mutator, evaluator,
                properties, clock);

        assertTrue(mapRuntime.enter("alice", "subterra-relay").isOk());
        assertTrue(mapRuntime.inspect("alice").isOk());
        assertTrue(mapRuntime.interact("alice", "relay-console").isOk());
        assertTrue(mapRuntime.complete("alice", "relay-restore").isOk());
        local.tick("alice");

        List<String> adapterLines = new ArrayList<>();
        for (LogEntry entry : eventLog.readBatch(0, 100).entries()) {
            CanonicalEvent event = entry.event();
            assertEquals(MapRuntimeService.SOURCE, event.source());
            adapterLines.add(codec.encode(new CanonicalEvent(event.ts(), ADAPTER_SOURCE, event.username(),
                    event.type(), event.payload())));
        }
        assertEquals(4, adapterLines.size());
        Path adapterState = tempDir.resolve("adapter-state.json");
        ReplayReport report = replayService.replay(writeEvents("adapter.ndjson", adapterLines), adapterState, null);

        UserProgressionState expected = local.userView("alice");
        UserProgressionState replayed = readUser(adapterState, "alice");
        assertTrue(report.isOk());
        assertEquals(4, report.getEventsApplied());
        assertTrue(expected.getStats().getXp() > 0);
        assertEquals(expected.getStats().getXp(), replayed.getStats().getXp());
        assertEquals(expected.getStats().getGold(), replayed.getStats().getGold());
        assertEquals(expected.getProgress().getMetrics(), replayed.getProgress().getMetrics());
        assertEquals(expected.getProgress().getAchievements(), replayed.getProgress().getAchievements());
        assertEquals(tokenIds(expected), tokenIds(replayed));
    }

    private List<String> tokenIds(UserProgressionState user) {
        return user.getUnlockTokens().stream().map(UnlockToken::getId).toList();
    }

    @Test
    void shouldMatchStatsAcrossProducers() throws IOException {
        Path coreInput = writeEvents("core.ndjson", mapSession(CORE_SOURCE));
        Path adapterInput = writeEvents("adapter.ndjson", mapSession(ADAPTER_SOURCE));
        Path coreState = tempDir.resolve("core-state.json");
        Path adapterState = tempDir.resolve("adapter-state.json");

        replayService.replay(coreInput, coreState, null);
        replayService.replay(adapterInput, adapterState, null);

        UserProgressionState core = readUser(coreState, "alice");
        UserProgressionState adapter = readUser(adapterState, "alice");
        assertEquals(31, core.getStats().getXp());
        assertEquals(core.getStats(), adapter.getStats());
        assertEquals(core.getFlags(), adapter.getFlags());
        assertEquals(core.getProgress().getAchievements(), adapter.getProgress().getAchievements());
    }

    @Test
    void shouldContinueFromInitialState() throws IOException {
        Path input = writeEvents("events.ndjson", mapSession(CORE_SOURCE));
        Path firstState = tempDir.resolve("first.json");
        ReplayReport first = replayService.replay(input, firstState, null);

        ReplayReport continued = replayService.replay(input, tempDir.resolve("continued.json"), null, firstState, 2);

        assertEquals(first.getChecksumAfter(), continued.getChecksumBefore());
        assertEquals(62, readUser(tempDir.resolve("continued.json"), "alice").getStats().getXp());
        assertEquals(3, continued.getTicks());
    }

    // ==================== Report ====================

    @Test
    void shouldReportUnknownTypesSorted() throws IOException {
        Path input = writeEvents("events.ndjson", List.of(
                event(ADAPTER_SOURCE, "zeta_ping", "{}"),
                event(ADAPTER_SOURCE, "ALPHA_PING", "{}"),
                event(CORE_SOURCE, "MAP_TICK", "{}"),
                event(ADAPTER_SOURCE, "Zeta_Ping", "{}")));

        ReplayReport report = replayService.replay(input, tempDir.resolve("state.json"), null);

        assertEquals(List.of("ALPHA_PING", "ZETA_PING"), report.getUnknownEventTypes());
        assertEquals(0, report.getUnknownEventsChanged());
        assertTrue(report.isOk());
        assertEquals(4, report.getEventsTotal());
        assertEquals(4, report.getEventsProcessed());
        assertEquals(1, report.getEventsApplied());
        assertEquals(3, report.getEventsSkipped());
    }

    @Test
    void shouldFailWhenUnknownEventChangesState() throws IOException {
        Path input = writeEvents("events.ndjson", List.of(
                event(CORE_SOURCE, "CUSTOM_BONUS", "{\"stats_delta\":{\"xp\":5}}")));

        ReplayReport report = replayService.replay(input, tempDir.resolve("state.json"), null);

        assertFalse(report.isOk());
        assertEquals(1, report.getUnknownEventsChanged());
        assertEquals(List.of("CUSTOM_BONUS"), report.getUnknownEventTypes());
    }

    @Test
    void shouldCountMalformedLinesAsSkipped() throws IOException {
        Path input = writeEvents("events.ndjson", List.of(
                "{broken",
                event(CORE_SOURCE, "MAP_ENTER", "{\"place_id\":\"andes-pass\"}")));

        ReplayReport report = replayService.replay(input, tempDir.resolve("state.json"), null);

        assertEquals(2, report.getEventsTotal());
        assertEquals(report.getEventsProcessed() - report.getEventsApplied(), report.getEventsSkipped());
        assertEquals(1, report.getEventsApplied());
    }

    @Test
    void shouldWriteReportFile() throws IOException {
        Path input = writeEvents("events.ndjson", mapSession(CORE_SOURCE));
        Path reportFile = tempDir.resolve("out/report.json");

        ReplayReport report = replayService.replay(input, tempDir.resolve("out/state.json"), reportFile);

        assertTrue(Files.exists(reportFile));
        ReplayReport written = objectMapper.readValue(reportFile.toFile(), ReplayReport.class);
        assertEquals(report.getChecksumAfter(), written.getChecksumAfter());
        assertEquals(report.getEventsApplied(), written.getEventsApplied());
    }

    @Test
    void shouldTreatMissingInputAsEmpty() {
        ReplayReport report = replayService.replay(tempDir.resolve("missing.ndjson"),
                tempDir.resolve("state.json"), null);

        assertEquals(0, report.getEventsTotal());
        assertEquals(0, report.getEventsProcessed());
        assertTrue(report.isOk());
        assertEquals(1, report.getTicks());
    }
}
