package me.golemcore.progression.adapter.inbound.command;

import me.golemcore.progression.domain.ProgressionCatalog;
import me.golemcore.progression.domain.model.ErrorKind;
import me.golemcore.progression.domain.model.GameplayStats;
import me.golemcore.progression.domain.model.Gate;
import me.golemcore.progression.domain.model.MapActionResult;
import me.golemcore.progression.domain.model.OperationResult;
import me.golemcore.progression.domain.model.PlayStartResult;
import me.golemcore.progression.domain.model.ProgressionSnapshot;
import me.golemcore.progression.domain.model.ReplayReport;
import me.golemcore.progression.domain.model.RequirementVerdict;
import me.golemcore.progression.domain.model.Rule;
import me.golemcore.progression.domain.model.RuleRunResult;
import me.golemcore.progression.domain.model.TickResult;
import me.golemcore.progression.domain.model.UserProgress;
import me.golemcore.progression.domain.service.LensProgressService;
import me.golemcore.progression.domain.service.MapRuntimeService;
import me.golemcore.progression.domain.service.ProgressionService;
import me.golemcore.progression.domain.service.ReplayService;
import me.golemcore.progression.domain.service.WorldLensService;
import me.golemcore.progression.port.inbound.CommandPort;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.atomic.AtomicInteger;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyBoolean;
import static org.mockito.ArgumentMatchers.anyInt;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.mock;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

class CommandRouterTest {

    private static final String USER = "alice";
    private static final String CMD_PLAY = "play";
    private static final String CMD_RULE = "rule";
    private static final Map<String, Object> CTX = Map.of("username", USER);

    private ProgressionService progressionService;
    private MapRuntimeService mapRuntimeService;
    private WorldLensService worldLensService;
    private LensProgressService lensProgressService;
    private ReplayService replayService;
    private CommandRouter router;

    @BeforeEach
    void setUp() {
        progressionService = mock(ProgressionService.class);
        mapRuntimeService = mock(MapRuntimeService.class);
        worldLensService = mock(WorldLensService.class);
        lensProgressService = mock(LensProgressService.class);
        replayService = mock(ReplayService.class);

        router = new CommandRouter(progressionService, mapRuntimeService, worldLensService, lensProgressService,
                replayService);
    }

    @AfterEach
    void tearDown() {
        router.destroy();
    }

    private CommandPort.CommandResult run(String command, String... args) {
        return router.execute(command, List.of(args), CTX).join();
    }

    @Test
    void hasCommand() {
        assertTrue(router.hasCommand(CMD_PLAY));
        assertTrue(router.hasCommand(CMD_RULE));
        assertTrue(router.hasCommand("replay"));
        assertTrue(router.hasCommand("help"));
        assertFalse(router.hasCommand("skills"));
    }

    @Test
    void listCommands() {
        List<CommandPort.CommandDefinition> commands = router.listCommands();

        assertEquals(4, commands.size());
        assertEquals(CMD_PLAY, commands.get(0).name());
        assertEquals(CMD_RULE, commands.get(1).name());
    }

    @Test
    void unknownCommandFails() {
        CommandPort.CommandResult result = run("teleport");

        assertFalse(result.success());
        assertTrue(result.output().contains("Unknown command"));
    }

    @Test
    void helpListsEveryCommand() {
        CommandPort.CommandResult result = run("help");

        assertTrue(result.success());
        assertTrue(result.output().contains("`play`"));
        assertTrue(result.output().contains("`replay`"));
    }

    // ==================== Play ====================

    @Test
    void playStatusRendersSnapshot() {
        ProgressionSnapshot snapshot = ProgressionSnapshot.builder()
                .username(USER)
                .stats(GameplayStats.builder().xp(120).gold(7).build())
                .progress(UserProgress.builder().level(2).build())
                .gates(List.of(Gate.builder().id(ProgressionCatalog.AMULET_GATE_ID).title("Amulet").build()))
                .blockedRequirements(List.of("gate:" + ProgressionCatalog.AMULET_GATE_ID))
                .build();
        when(progressionService.snapshot(USER)).thenReturn(snapshot);
        when(progressionService.getActiveToybox()).thenReturn("hethack");

        CommandPort.CommandResult result = run(CMD_PLAY);

        assertTrue(result.success());
        assertTrue(result.output().contains("XP: 120"));
        assertTrue(result.output().contains("[pending]"));
        assertTrue(result.output().contains("Can proceed: no"));
        assertTrue(result.output().contains("Blocked by: gate:" + ProgressionCatalog.AMULET_GATE_ID));
        assertEquals(snapshot, result.data());
    }

    @Test
    void usernameDefaultsWhenContextMissing() {
        when(progressionService.getUserStats(ProgressionCatalog.DEFAULT_USER)).thenReturn(new GameplayStats());

        CommandPort.CommandResult result = router.execute(CMD_PLAY, List.of("stats"), Map.of()).join();

        assertTrue(result.success());
        verify(progressionService).getUserStats(ProgressionCatalog.DEFAULT_USER);
    }

    @Test
    void statsAddDelegatesToService() {
        GameplayStats updated = GameplayStats.builder().xp(50).build();
        when(progressionService.addUserStat(USER, "xp", 50L)).thenReturn(OperationResult.success(updated));

        CommandPort.CommandResult result = run(CMD_PLAY, "stats", "add", "xp", "50");

        assertTrue(result.success());
        assertTrue(result.output().contains("XP: 50"));
    }

    @Test
    void statsRejectsInvalidNumber() {
        CommandPort.CommandResult result = run(CMD_PLAY, "stats", "set", "xp", "lots");

        assertFalse(result.success());
        assertTrue(result.output().contains("Invalid number"));
        verify(progressionService, never()).setUserStat(anyString(), anyString(), anyLong());
    }

    @Test
    void statsReportsServiceError() {
        when(progressionService.setUserStat(USER, "mana", 3L))
                .thenReturn(OperationResult.failure(ErrorKind.MALFORMED_INPUT, "Unknown stat: mana"));

        CommandPort.CommandResult result = run(CMD_PLAY, "stats", "set", "mana", "3");

        assertFalse(result.success());
        assertEquals("Unknown stat: mana", result.output());
    }

    @Test
    void startBlockedOptionFails() {
        when(progressionService.startPlayOption(USER, "galaxy"))
                .thenReturn(new PlayStartResult("galaxy", PlayStartResult.BLOCKED, List.of("xp>=100")));

        CommandPort.CommandResult result = run(CMD_PLAY, "start", "galaxy");

        assertFalse(result.success());
        assertTrue(result.output().contains("blocked by: xp>=100"));
    }

    @Test
    void proceedReportsGateState() {
        when(progressionService.canProceed()).thenReturn(true);

        CommandPort.CommandResult result = run(CMD_PLAY, "proceed");

        assertTrue(result.success());
        assertEquals(Boolean.TRUE, result.data());
    }

    @Test
    void mapMoveTicksAfterSuccess() {
        when(mapRuntimeService.move(USER, "lunar-gateway")).thenReturn(MapActionResult.builder()
                .ok(true).action(MapRuntimeService.ACTION_MOVE).placeId("lunar-gateway").build());
        when(progressionService.tick(USER)).thenReturn(TickResult.builder().applied(1).build());
        when(progressionService.getUserStats(USER)).thenReturn(GameplayStats.builder().xp(2).build());

        CommandPort.CommandResult result = run(CMD_PLAY, "map", "move", "lunar-gateway");

        assertTrue(result.success());
        assertTrue(result.output().contains("applied 1 event(s)"));
        verify(progressionService).tick(USER);
    }

    @Test
    void blockedMapMoveDoesNotTick() {
        MapActionResult blocked = MapActionResult.failure(MapRuntimeService.ACTION_MOVE, ErrorKind.MALFORMED_INPUT,
                "No link from andes-pass to deep-vault");
        blocked.setBlocked(MapActionResult.BLOCKED_EDGE);
        when(mapRuntimeService.move(USER, "deep-vault")).thenReturn(blocked);

        CommandPort.CommandResult result = run(CMD_PLAY, "map", "move", "deep-vault");

        assertFalse(result.success());
        assertEquals(blocked, result.data());
        verify(progressionService, never()).tick(anyString());
    }

    @Test
    void mapTickRejectsStepsOutsideIntRange() {
        CommandPort.CommandResult overflow = run(CMD_PLAY, "map", "tick", "4294967297");
        CommandPort.CommandResult zero = run(CMD_PLAY, "map", "tick", "0");

        assertFalse(overflow.success());
        assertTrue(overflow.output().startsWith("Usage: play map tick"));
        assertFalse(zero.success());
        assertTrue(zero.output().startsWith("Usage: play map tick"));
        verify(mapRuntimeService, never()).tick(anyString(), anyInt());
    }

    @Test
    void mapTickPassesLargestIntSteps() {
        when(mapRuntimeService.tick(USER, Integer.MAX_VALUE)).thenReturn(MapActionResult.builder()
                .ok(true).action(MapRuntimeService.ACTION_TICK).placeId("andes-pass").build());
        when(progressionService.tick(USER)).thenReturn(TickResult.builder().applied(1).build());
        when(progressionService.getUserStats(USER)).thenReturn(GameplayStats.builder().build());

        CommandPort.CommandResult result = run(CMD_PLAY, "map", "tick", String.valueOf(Integer.MAX_VALUE));

        assertTrue(result.success());
        verify(mapRuntimeService).tick(USER, Integer.MAX_VALUE);
    }

    @Test
    void mapActionWithoutTargetShowsUsage() {
        CommandPort.CommandResult result = run(CMD_PLAY, "map", "enter");

        assertFalse(result.success());
        assertTrue(result.output().startsWith("Usage: play map enter"));
    }

    @Test
    void gateCompleteUsesManualSource() {
        Gate gate = Gate.builder().id("custom").completed(true).build();
        when(progressionService.completeGate("custom", ProgressionCatalog.SOURCE_MANUAL)).thenReturn(gate);

        CommandPort.CommandResult result = run(CMD_PLAY, "gate", "complete", "custom");

        assertTrue(result.success());
        assertTrue(result.output().contains("[done] `custom`"));
    }

    @Test
    void profileSetRejectsBadScope() {
        when(progressionService.setProfileOverlayValue("team", "g1", "xp", 5L))
                .thenThrow(new IllegalArgumentException("Unknown overlay scope: team"));

        CommandPort.CommandResult result = run(CMD_PLAY, "profile", "set", "team", "g1", "xp", "5");

        assertFalse(result.success());
        assertEquals("Unknown overlay scope: team", result.output());
    }

    // ==================== Rules ====================

    @Test
    void ruleAddParsesIfThen() {
        when(progressionService.setRule(eq("rule.bonus"), eq("xp>=10"), eq("STAT ADD gold 5"), eq(true),
                eq(ProgressionCatalog.SOURCE_MANUAL))).thenReturn(OperationResult.success(null));

        CommandPort.CommandResult result = run(CMD_RULE, "add", "rule.bonus", "IF", "xp>=10", "THEN", "STAT", "ADD",
                "gold", "5");

        assertTrue(result.success());
        assertEquals("Rule saved: rule.bonus", result.output());
    }

    @Test
    void ruleAddWithoutThenFails() {
        CommandPort.CommandResult result = run(CMD_RULE, "add", "rule.bonus", "IF", "xp>=10");

        assertFalse(result.success());
        verify(progressionService, never()).setRule(anyString(), anyString(), anyString(), anyBoolean(),
                anyString());
    }

    @Test
    void ruleListEmpty() {
        when(progressionService.listRules()).thenReturn(List.of());

        CommandPort.CommandResult result = run(CMD_RULE);

        assertTrue(result.success());
        assertEquals("No rules defined.", result.output());
    }

    @Test
    void ruleShowRendersRule() {
        Rule rule = Rule.builder().id("rule.a").ifExpression("xp>=1").thenExpression("TOKEN t").enabled(false)
                .build();
        when(progressionService.getRule("rule.a")).thenReturn(Optional.of(rule));

        CommandPort.CommandResult result = run(CMD_RULE, "show", "rule.a");

        assertTrue(result.success());
        assertEquals("[off] `rule.a` IF xp>=1 THEN TOKEN t", result.output());
    }

    @Test
    void ruleRunUnknownIdFails() {
        when(progressionService.getRule("missing")).thenReturn(Optional.empty());

        CommandPort.CommandResult result = run(CMD_RULE, "run", "missing");

        assertFalse(result.success());
        verify(progressionService, never()).runRules(anyString(), anyString());
    }

    @Test
    void ruleRunAllReportsCounts() {
        when(progressionService.runRules(USER, null)).thenReturn(new RuleRunResult(USER, List.of()));

        CommandPort.CommandResult result = run(CMD_RULE, "run");

        assertTrue(result.success());
        assertTrue(result.output().contains("Rules evaluated: 0, fired: 0"));
    }

    @Test
    void ruleTestShowsBlockers() {
        when(progressionService.testCondition(USER, "xp>=100 and gold>=5"))
                .thenReturn(RequirementVerdict.of(List.of("xp>=100")));

        CommandPort.CommandResult result = run(CMD_RULE, "test", "IF", "xp>=100", "and", "gold>=5");

        assertTrue(result.success());
        assertEquals("Condition blocked by: xp>=100", result.output());
    }

    @Test
    void ruleRemoveMissingFails() {
        when(progressionService.deleteRule("ghost")).thenReturn(false);

        CommandPort.CommandResult result = run(CMD_RULE, "remove", "ghost");

        assertFalse(result.success());
        assertEquals("Rule not found: ghost", result.output());
    }

    // ==================== Replay ====================

    @Test
    void replayRequiresInputAndOutput() {
        CommandPort.CommandResult result = run("replay", "events.ndjson");

        assertFalse(result.success());
        verify(replayService, never()).replay(any(Path.class), any(Path.class), any());
    }

    @Test
    void replayFailsWhenUnknownEventsChangedState() {
        ReplayReport report = ReplayReport.builder().ok(false).eventsTotal(3).eventsProcessed(3).eventsApplied(1)
                .eventsSkipped(2).unknownEventsChanged(1).checksumAfter("abc").build();
        when(replayService.replay(Path.of("in.ndjson"), Path.of("out.json"), null)).thenReturn(report);

        CommandPort.CommandResult result = run("replay", "in.ndjson", "out.json");

        assertFalse(result.success());
        assertTrue(result.output().startsWith("Replay FAILED"));
        assertEquals(report, result.data());
    }

    @Test
    void replayRejectsInvalidPath() {
        CommandPort.CommandResult result = run("replay", "bad\0path", "out.json");

        assertFalse(result.success());
        assertTrue(result.output().startsWith("Invalid path:"));
        verify(replayService, never()).replay(any(Path.class), any(Path.class), any());
    }

    @Test
    void replayPassesReportPath() {
        ReplayReport report = ReplayReport.builder().ok(true).checksumAfter("def").build();
        when(replayService.replay(Path.of("in.ndjson"), Path.of("out.json"), Path.of("report.json")))
                .thenReturn(report);

        CommandPort.CommandResult result = run("replay", "in.ndjson", "out.json", "report.json");

        assertTrue(result.success());
        assertTrue(result.output().contains("checksum: def"));
        assertFalse(result.output().contains("FAILED"));
    }

    // ==================== Concurrency ====================

    @Test
    void concurrentCommandsNeverOverlapEngineTicks() {
        AtomicInteger active = new AtomicInteger();
        AtomicInteger maxActive = new AtomicInteger();
        when(mapRuntimeService.move(USER, "lunar-gateway")).thenReturn(MapActionResult.builder()
                .ok(true).action(MapRuntimeService.ACTION_MOVE).placeId("lunar-gateway").build());
        when(progressionService.getUserStats(USER)).thenReturn(GameplayStats.builder().build());
        when(progressionService.tick(USER)).thenAnswer(invocation -> {
            maxActive.accumulateAndGet(active.incrementAndGet(), Math::max);
            Thread.sleep(10);
            active.decrementAndGet();
            return TickResult.builder().applied(1).build();
        });

        List<CompletableFuture<CommandPort.CommandResult>> pending = new ArrayList<>();
        for (int i = 0; i < 8; i++) {
            pending.add(router.execute(CMD_PLAY, List.of("map", "move", "lunar-gateway"), CTX));
        }
        pending.forEach(future -> assertTrue(future.join().success()));

        assertEquals(1, maxActive.get());
        verify(progressionService, times(8)).tick(USER);
    }
}
