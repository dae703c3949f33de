package me.golemcore.progression.domain.service;

import com.fasterxml.jackson.databind.ObjectMapper;
import me.golemcore.progression.adapter.outbound.storage.LocalStorageAdapter;
import me.golemcore.progression.domain.model.CanonicalEvent;
import me.golemcore.progression.domain.model.LensCheckpointReport;
import me.golemcore.progression.domain.model.LensScore;
import me.golemcore.progression.infrastructure.config.AutoConfiguration;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertNull;

class LensProgressServiceTest {

    private static final String USER = "alice";

    @TempDir
    Path tempDir;

    private ProgressionService progressionService;
    private LensProgressService lensProgressService;

    @BeforeEach
    void setUp() {
        ProgressionProperties properties = new ProgressionProperties();
        properties.getStorage().getLocal().setBasePath(tempDir.toString());
        LocalStorageAdapter storageAdapter = new LocalStorageAdapter(properties);
        storageAdapter.init();
        ObjectMapper objectMapper = AutoConfiguration.objectMapper();
        Clock clock = Clock.fixed(Instant.parse("2026-03-01T12:00:00Z"), ZoneOffset.UTC);

        RequirementEvaluator evaluator = new RequirementEvaluator();
        ProgressionMutator mutator = new ProgressionMutator(evaluator, clock);
        progressionService = new ProgressionService(
                new ProgressionStateStore(storageAdapter, objectMapper, mutator, clock),
                new EventLogService(storageAdapter, new CanonicalEventCodec(objectMapper), properties),
                new StateReducer(mutator, AdapterEventContract.empty()),
                new RuleEngine(mutator, evaluator),
                mutator,
                evaluator,
                properties,
                clock);
        lensProgressService = new LensProgressService(progressionService, evaluator);
    }

    @Test
    void shouldDefaultToActiveToyboxLens() {
        LensCheckpointReport report = lensProgressService.listLensCheckpoints(USER, null);

        assertEquals("hethack", report.lens());
        assertEquals(3, report.total());
        assertEquals(0, report.completed());
        assertEquals("depth_training", report.nextCheckpoint().id());
        assertEquals(List.of("level>=3"), report.checkpoints().get(0).blockedBy());
    }

    @Test
    void shouldScoreFreshUser() {
        LensScore score = lensProgressService.lensScoreView(USER, " HETHACK ");

        assertEquals("hethack", score.getLens());
        // level 1 only
        assertEquals(100, score.getTotal());
        assertEquals("initiate", score.getTier());
    }

    @Test
    void shouldAddCheckpointBonus() {
        progressionService.setUserStat(USER, "xp", 1000);

        LensScore score = lensProgressService.lensScoreView(USER, "hethack");

        assertEquals(1, score.getCompletedCheckpoints());
        assertEquals(1000 + 100 + 250, score.getTotal());
        assertEquals("runner", score.getTier());
    }

    @Test
    void shouldWeighLensMetrics() {
        for (int i = 0; i < 5; i++) {
            progressionService.submitEvent(CanonicalEvent.builder()
                    .source("core:test")
                    .username(USER)
                    .type("ELITE_HYPERSPACE_JUMP")
                    .build());
        }
        progressionService.tick(USER);

        LensScore score = lensProgressService.lensScoreView(USER, "elite");

        assertEquals(5L, score.getMetrics().get("elite_jumps"));
        assertEquals(1, score.getCompletedCheckpoints());
        // 75 xp + level 1 + (5 events + 5 jumps) * 10 + one checkpoint
        assertEquals(75 + 100 + 100 + 250, score.getTotal());
    }

    @Test
    void shouldFallBackForLensWithoutCheckpoints() {
        LensScore score = lensProgressService.lensScoreView(USER, "pinball");

        assertEquals(0, score.getTotalCheckpoints());
        assertEquals(List.of("events_processed"), List.copyOf(score.getMetrics().keySet()));
        assertNull(score.getCheckpoints().nextCheckpoint());
    }

    @Test
    void shouldMapScoreToTier() {
        assertEquals("initiate", LensProgressService.tier(999));
        assertEquals("runner", LensProgressService.tier(1000));
        assertEquals("veteran", LensProgressService.tier(2500));
        assertEquals("legend", LensProgressService.tier(5000));
        assertEquals("legend", LensProgressService.tier(Long.MAX_VALUE));
    }
}
