package me.golemcore.progression.adapter.inbound.command;

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

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.domain.ProgressionCatalog;
import me.golemcore.progression.domain.model.ActionOutcome;
import me.golemcore.progression.domain.model.GameplayStats;
import me.golemcore.progression.domain.model.Gate;
import me.golemcore.progression.domain.model.LensCheckpointReport;
import me.golemcore.progression.domain.model.LensCheckpointStatus;
import me.golemcore.progression.domain.model.LensScore;
import me.golemcore.progression.domain.model.LensStatus;
import me.golemcore.progression.domain.model.MapActionResult;
import me.golemcore.progression.domain.model.MapStatus;
import me.golemcore.progression.domain.model.OperationResult;
import me.golemcore.progression.domain.model.PlayOptionStatus;
import me.golemcore.progression.domain.model.PlayStartResult;
import me.golemcore.progression.domain.model.ProfileVariables;
import me.golemcore.progression.domain.model.ProgressionSnapshot;
import me.golemcore.progression.domain.model.ReplayReport;
import me.golemcore.progression.domain.model.RequirementVerdict;
import me.golemcore.progression.domain.model.Rule;
import me.golemcore.progression.domain.model.RuleFiring;
import me.golemcore.progression.domain.model.RuleRunResult;
import me.golemcore.progression.domain.model.TickResult;
import me.golemcore.progression.domain.model.ToyboxProfile;
import me.golemcore.progression.domain.service.LensProgressService;
import me.golemcore.progression.domain.service.MapRuntimeService;
import me.golemcore.progression.domain.service.ProgressionService;
import me.golemcore.progression.domain.service.ReplayService;
import me.golemcore.progression.domain.service.WorldLensService;
import me.golemcore.progression.port.inbound.CommandPort;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.TimeUnit;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Routes textual commands to the progression engine.
 *
 * <ul>
 * <li>play - stats, play options, map actions, gates, toybox, lens and profile
 * overlays
 * <li>rule - IF/THEN rule management and evaluation
 * <li>replay - deterministic replay of an event file
 * <li>help - list commands
 * </ul>
 *
 * <p>
 * The {@code username} context key selects the user ({@code default} when
 * absent). A successful map action is followed by an immediate engine tick so
 * its reward is visible in the same command. Commands run one at a time on a
 * router-owned thread, so a tick never overlaps another command.
 *
 * @see me.golemcore.progression.port.inbound.CommandPort
 */
@Component
@Slf4j
public class CommandRouter implements CommandPort {

    private static final String CMD_PLAY = "play";
    private static final String CMD_RULE = "rule";
    private static final String CMD_REPLAY = "replay";
    private static final String CMD_HELP = "help";
    private static final String SUBCMD_STATUS = "status";
    private static final String SUBCMD_LIST = "list";
    private static final String CONTEXT_USERNAME = "username";
    private static final String DOUBLE_NEWLINE = "\n\n";
    private static final int MIN_STAT_ARGS = 3;
    private static final int MIN_OVERLAY_SET_ARGS = 4;
    private static final int MIN_OVERLAY_CLEAR_ARGS = 2;
    private static final int MIN_REPLAY_ARGS = 2;
    private static final long EXECUTOR_TERMINATION_TIMEOUT_SECONDS = 5;

    private static final Pattern RULE_DEFINITION = Pattern.compile("(?is)^IF\\s+(.+?)\\s+THEN\\s+(.+)$");
    private static final Pattern RULE_TEST = Pattern.compile("(?is)^IF\\s+(.*)$");

    private static final List<String> KNOWN_COMMANDS = List.of(CMD_PLAY, CMD_RULE, CMD_REPLAY, CMD_HELP);
    private static final Set<String> KNOWN_COMMAND_SET = Set.copyOf(KNOWN_COMMANDS);

    private final ProgressionService progressionService;
    private final MapRuntimeService mapRuntimeService;
    private final WorldLensService worldLensService;
    private final LensProgressService lensProgressService;
    private final ReplayService replayService;

    private final ExecutorService commandExecutor = Executors.newSingleThreadExecutor(r -> {
        Thread t = new Thread(r, "progression-command");
        t.setDaemon(true);
        return t;
    });

    public CommandRouter(
            ProgressionService progressionService,
            MapRuntimeService mapRuntimeService,
            WorldLensService worldLensService,
            LensProgressService lensProgressService,
            ReplayService replayService) {
        this.progressionService = progressionService;
        this.mapRuntimeService = mapRuntimeService;
        this.worldLensService = worldLensService;
        this.lensProgressService = lensProgressService;
        this.replayService = replayService;
        log.info("CommandRouter initialized with commands: {}", KNOWN_COMMANDS);
    }

    @Override
    public CompletableFuture<CommandResult> execute(String command, List<String> args, Map<String, Object> context) {
        return CompletableFuture.supplyAsync(() -> {
            String username = resolveContextString(context, CONTEXT_USERNAME, ProgressionCatalog.DEFAULT_USER);
            log.debug("Executing command: {} {} (user={})", command, args, username);
            if (!hasCommand(command)) {
                return CommandResult.failure("Unknown command: " + command);
            }

            return switch (command) {
            case CMD_PLAY -> handlePlay(username, args);
            case CMD_RULE -> handleRule(username, args);
            case CMD_REPLAY -> handleReplay(args);
            case CMD_HELP -> handleHelp();
            default -> CommandResult.failure("Unknown command: " + command);
            };
        }, commandExecutor);
    }

    @PreDestroy
    void destroy() {
        commandExecutor.shutdown();
        try {
            if (!commandExecutor.awaitTermination(EXECUTOR_TERMINATION_TIMEOUT_SECONDS, TimeUnit.SECONDS)) {
                log.warn("Command executor did not finish pending commands, forcing shutdown");
                commandExecutor.shutdownNow();
            }
        } catch (InterruptedException e) {
            commandExecutor.shutdownNow();
            Thread.currentThread().interrupt();
        }
    }

    private String resolveContextString(Map<String, Object> context, String key, String fallback) {
        Object value = context != null ? context.get(key) : null;
        if (value instanceof String text && !text.isBlank()) {
            return text.trim();
        }
        return fallback;
    }

    @Override
    public boolean hasCommand(String command) {
        return KNOWN_COMMAND_SET.contains(command);
    }

    @Override
    public List<CommandDefinition> listCommands() {
        return List.of(
                new CommandDefinition(CMD_PLAY, "Progression, map, gates, toybox, lens and profiles",
                        "play [status|stats|options|start|proceed|map|gate|toybox|lens|profile]"),
                new CommandDefinition(CMD_RULE, "Manage IF/THEN progression rules",
                        "rule [list|show|add|remove|enable|disable|run|test]"),
                new CommandDefinition(CMD_REPLAY, "Replay an event file deterministically",
                        "replay <input> <output-state> [report]"),
                new CommandDefinition(CMD_HELP, "Show available commands", CMD_HELP));
    }

    private CommandResult handleHelp() {
        StringBuilder sb = new StringBuilder("**Commands**").append(DOUBLE_NEWLINE);
        for (CommandDefinition definition : listCommands()) {
            sb.append(String.format("`%s` - %s%n  %s%n", definition.name(), definition.description(),
                    definition.usage()));
        }
        return CommandResult.success(sb.toString());
    }

    // ==================== Play Command ====================

    private CommandResult handlePlay(String username, List<String> args) {
        if (args.isEmpty()) {
            return handlePlayStatus(username);
        }

        String subcommand = args.get(0).toLowerCase(Locale.ROOT);
        List<String> subArgs = args.subList(1, args.size());

        return switch (subcommand) {
        case SUBCMD_STATUS -> handlePlayStatus(username);
        case "stats" -> handleStats(username, subArgs);
        case "options" -> handleOptions(username);
        case "start" -> handleStart(username, subArgs);
        case "proceed" -> handleProceed();
        case "map" -> handleMap(username, subArgs);
        case "gate" -> handleGate(subArgs);
        case "toybox" -> handleToybox(username, subArgs);
        case "lens" -> handleLens(username, subArgs);
        case "profile" -> handleProfile(username, subArgs);
        default -> CommandResult.failure("Usage: " + listCommands().get(0).usage());
        };
    }

    private CommandResult handlePlayStatus(String username) {
        ProgressionSnapshot snapshot = progressionService.snapshot(username);
        StringBuilder sb = new StringBuilder();
        sb.append("**Progression: ").append(snapshot.getUsername()).append("**").append(DOUBLE_NEWLINE);
        sb.append(formatStats(snapshot.getStats())).append("\n");
        sb.append(String.format("Level: %d | Achievement level: %d%n",
                snapshot.getProgress().getLevel(), snapshot.getProgress().getAchievementLevel()));
        sb.append("Toybox: ").append(progressionService.getActiveToybox()).append("\n");
        sb.append("Tokens: ").append(snapshot.getUnlockTokens().size()).append("\n");
        for (Gate gate : snapshot.getGates()) {
            sb.append(formatGate(gate)).append("\n");
        }
        sb.append("Can proceed: ").append(snapshot.isCanProceed() ? "yes" : "no").append("\n");
        if (!snapshot.getBlockedRequirements().isEmpty()) {
            sb.append("Blocked by: ").append(String.join(", ", snapshot.getBlockedRequirements())).append("\n");
        }
        return CommandResult.success(sb.toString(), snapshot);
    }

    private CommandResult handleStats(String username, List<String> args) {
        if (args.isEmpty()) {
            GameplayStats stats = progressionService.getUserStats(username);
            return CommandResult.success(formatStats(stats), stats);
        }
        String action = args.get(0).toLowerCase(Locale.ROOT);
        if (!"set".equals(action) && !"add".equals(action) || args.size() < MIN_STAT_ARGS) {
            return CommandResult.failure("Usage: play stats [set|add <xp|hp|gold> <n>]");
        }
        Optional<Long> value = parseLong(args.get(2));
        if (value.isEmpty()) {
            return CommandResult.failure("Invalid number: " + args.get(2));
        }
        OperationResult result = "set".equals(action)
                ? progressionService.setUserStat(username, args.get(1), value.get())
                : progressionService.addUserStat(username, args.get(1), value.get());
        if (!result.isOk()) {
            return CommandResult.failure(result.getError(), result);
        }
        return CommandResult.success(formatStats((GameplayStats) result.getData()), result.getData());
    }

    private CommandResult handleOptions(String username) {
        List<PlayOptionStatus> options = progressionService.listPlayOptions(username);
        StringBuilder sb = new StringBuilder("**Play options**").append(DOUBLE_NEWLINE);
        for (PlayOptionStatus option : options) {
            sb.append(String.format("%s `%s` %s - %s%n", option.available() ? "[open]" : "[locked]",
                    option.id(), option.title(), option.description()));
            if (!option.available()) {
                sb.append("  Blocked by: ").append(String.join(", ", option.blockedBy())).append("\n");
            }
        }
        return CommandResult.success(sb.toString(), options);
    }

    private CommandResult handleStart(String username, List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: play start <option>");
        }
        PlayStartResult result = progressionService.startPlayOption(username, args.get(0));
        if (result.started()) {
            return CommandResult.success("Started play option: " + result.optionId(), result);
        }
        if (PlayStartResult.UNKNOWN.equals(result.status())) {
            return CommandResult.failure("Unknown play option: " + result.optionId(), result);
        }
        return CommandResult.failure("Play option " + result.optionId() + " blocked by: "
                + String.join(", ", result.blockedBy()), result);
    }

    private CommandResult handleProceed() {
        boolean canProceed = progressionService.canProceed();
        return CommandResult.success(canProceed
                ? "All progression gates are complete."
                : "Progression is gated: complete the required gates first.", canProceed);
    }

    // ==================== Map ====================

    private CommandResult handleMap(String username, List<String> args) {
        String action = args.isEmpty() ? SUBCMD_STATUS : args.get(0).toLowerCase(Locale.ROOT);
        String target = args.size() > 1 ? args.get(1) : null;

        if (SUBCMD_STATUS.equals(action)) {
            MapStatus status = mapRuntimeService.status(username);
            if (!status.isOk()) {
                return CommandResult.failure(status.getError(), status);
            }
            return CommandResult.success(String.format("At `%s` (%s) z=%d chunk=%s%nLinks: %s%nTick: %d npc=%d world=%d",
                    status.getCurrentPlaceId(), status.getPlace().getLabel(), status.getPlace().getZ(),
                    status.getChunk2dId(), String.join(", ", status.getPlace().getLinks()),
                    status.getTickCounter(), status.getNpcPhase(), status.getWorldPhase()), status);
        }

        MapActionResult result;
        switch (action) {
        case "enter" -> result = target != null ? mapRuntimeService.enter(username, target) : null;
        case "move" -> result = target != null ? mapRuntimeService.move(username, target) : null;
        case "inspect" -> result = mapRuntimeService.inspect(username);
        case "interact" -> result = target != null ? mapRuntimeService.interact(username, target) : null;
        case "complete" -> result = target != null ? mapRuntimeService.complete(username, target) : null;
        case "tick" -> {
            Optional<Long> steps = target != null ? parseLong(target) : Optional.of(1L);
            if (steps.isEmpty()) {
                return CommandResult.failure("Invalid number: " + target);
            }
            if (steps.get() < 1 || steps.get() > Integer.MAX_VALUE) {
                return CommandResult.failure("Usage: play map tick [steps], steps between 1 and " + Integer.MAX_VALUE);
            }
            result = mapRuntimeService.tick(username, steps.get().intValue());
        }
        default -> {
            return CommandResult.failure("Usage: play map [status|enter|move|inspect|interact|complete|tick] [arg]");
        }
        }
        if (result == null) {
            return CommandResult.failure("Usage: play map " + action + " <id>");
        }
        if (!result.isOk()) {
            return CommandResult.failure(result.getError(), result);
        }

        TickResult tick = progressionService.tick(username);
        GameplayStats stats = progressionService.getUserStats(username);
        String output = String.format("%s ok at `%s` (applied %d event(s))%n%s",
                result.getAction(), result.getPlaceId(), tick.getApplied(), formatStats(stats));
        return CommandResult.success(output, result);
    }

    // ==================== Gates ====================

    private CommandResult handleGate(List<String> args) {
        String action = args.isEmpty() ? SUBCMD_STATUS : args.get(0).toLowerCase(Locale.ROOT);
        if (SUBCMD_STATUS.equals(action) || SUBCMD_LIST.equals(action)) {
            List<Gate> gates = progressionService.listGates();
            StringBuilder sb = new StringBuilder("**Gates**").append(DOUBLE_NEWLINE);
            gates.forEach(gate -> sb.append(formatGate(gate)).append("\n"));
            return CommandResult.success(sb.toString(), gates);
        }
        if (args.size() < 2) {
            return CommandResult.failure("Usage: play gate [status|complete <id>|reset <id>]");
        }
        String gateId = args.get(1);
        return switch (action) {
        case "complete" -> {
            Gate gate = progressionService.completeGate(gateId, ProgressionCatalog.SOURCE_MANUAL);
            yield CommandResult.success(formatGate(gate), gate);
        }
        case "reset" -> toCommandResult(progressionService.resetGate(gateId), "Gate reset: " + gateId);
        default -> CommandResult.failure("Usage: play gate [status|complete <id>|reset <id>]");
        };
    }

    // ==================== Toybox ====================

    private CommandResult handleToybox(String username, List<String> args) {
        String action = args.isEmpty() ? SUBCMD_LIST : args.get(0).toLowerCase(Locale.ROOT);
        if (SUBCMD_LIST.equals(action) || SUBCMD_STATUS.equals(action)) {
            Map<String, ToyboxProfile> profiles = progressionService.getToyboxProfiles();
            String active = progressionService.getActiveToybox();
            StringBuilder sb = new StringBuilder("**Toybox profiles**").append(DOUBLE_NEWLINE);
            for (ToyboxProfile profile : profiles.values()) {
                sb.append(profile.getId().equals(active) ? "* " : "  ")
                        .append("`").append(profile.getId()).append("` ")
                        .append(profile.getName()).append("\n");
            }
            return CommandResult.success(sb.toString(), profiles);
        }
        if ("set".equals(action) && args.size() > 1) {
            return toCommandResult(progressionService.setActiveToybox(args.get(1), username),
                    "Active toybox: " + args.get(1).toLowerCase(Locale.ROOT));
        }
        return CommandResult.failure("Usage: play toybox [list|set <profile>]");
    }

    // ==================== Lens ====================

    private CommandResult handleLens(String username, List<String> args) {
        String action = args.isEmpty() ? SUBCMD_STATUS : args.get(0).toLowerCase(Locale.ROOT);
        String lensId = args.size() > 1 ? args.get(1) : null;
        return switch (action) {
        case SUBCMD_STATUS -> formatLensStatus(lensStatus(username));
        case "enable", "disable" -> {
            worldLensService.setEnabled("enable".equals(action), "play:" + username);
            yield formatLensStatus(lensStatus(username));
        }
        case "score" -> {
            LensScore score = lensProgressService.lensScoreView(username, lensId);
            yield CommandResult.success(String.format("Lens `%s` score: %d (%s), checkpoints %d/%d",
                    score.getLens(), score.getTotal(), score.getTier(), score.getCompletedCheckpoints(),
                    score.getTotalCheckpoints()), score);
        }
        case "checkpoints" -> {
            LensCheckpointReport report = lensProgressService.listLensCheckpoints(username, lensId);
            StringBuilder sb = new StringBuilder();
            sb.append(String.format("**Lens `%s` checkpoints %d/%d**", report.lens(), report.completed(),
                    report.total())).append(DOUBLE_NEWLINE);
            for (LensCheckpointStatus checkpoint : report.checkpoints()) {
                sb.append(checkpoint.completed() ? "[x] " : "[ ] ")
                        .append(checkpoint.title()).append(" (").append(checkpoint.requirement()).append(")\n");
            }
            yield CommandResult.success(sb.toString(), report);
        }
        default -> CommandResult.failure(
                "Usage: play lens [status|enable|disable|score [lens]|checkpoints [lens]]");
        };
    }

    private LensStatus lensStatus(String username) {
        return worldLensService.status(username, mapRuntimeService.status(username),
                progressionService.canProceed());
    }

    private CommandResult formatLensStatus(LensStatus status) {
        String output = String.format("World lens %s (%s): %s%s",
                status.isEnabled() ? "enabled" : "disabled",
                status.getEnabledSource(),
                status.isReady() ? "ready" : "not ready",
                status.getBlockingReason() != null ? " - " + status.getBlockingReason().id() : "");
        return CommandResult.success(output, status);
    }

    // ==================== Profile overlays ====================

    private CommandResult handleProfile(String username, List<String> args) {
        String action = args.isEmpty() ? SUBCMD_STATUS : args.get(0).toLowerCase(Locale.ROOT);
        List<String> subArgs = args.isEmpty() ? List.of() : args.subList(1, args.size());
        try {
            return switch (action) {
            case SUBCMD_STATUS -> handleProfileStatus(username, subArgs);
            case "set" -> handleProfileSet(subArgs);
            case "clear" -> handleProfileClear(subArgs);
            default -> CommandResult.failure("Usage: play profile [status|set|clear]");
            };
        } catch (IllegalArgumentException e) {
            return CommandResult.failure(e.getMessage());
        }
    }

    private CommandResult handleProfileStatus(String username, List<String> args) {
        String groupId = optionValue(args, "--group");
        String sessionId = optionValue(args, "--session");
        ProfileVariables variables = progressionService.resolveProfileVariables(username, groupId, sessionId);
        StringBuilder sb = new StringBuilder("**Profile variables**").append(DOUBLE_NEWLINE);
        variables.getEffectiveVariables().forEach((key, value) -> sb.append(key).append(": ").append(value)
                .append("\n"));
        return CommandResult.success(sb.toString(), variables);
    }

    private CommandResult handleProfileSet(List<String> args) {
        if (args.size() < MIN_OVERLAY_SET_ARGS) {
            return CommandResult.failure("Usage: play profile set <group|session> <id> <key> <n>");
        }
        Optional<Long> value = parseLong(args.get(3));
        if (value.isEmpty()) {
            return CommandResult.failure("Invalid number: " + args.get(3));
        }
        return toCommandResult(
                progressionService.setProfileOverlayValue(args.get(0), args.get(1), args.get(2), value.get()),
                String.format("Set %s on %s overlay %s", args.get(2), args.get(0), args.get(1)));
    }

    private CommandResult handleProfileClear(List<String> args) {
        if (args.size() < MIN_OVERLAY_CLEAR_ARGS) {
            return CommandResult.failure("Usage: play profile clear <group|session> <id> [key]");
        }
        String key = args.size() > 2 ? args.get(2) : null;
        return toCommandResult(progressionService.clearProfileOverlay(args.get(0), args.get(1), key),
                String.format("Cleared %s overlay %s", args.get(0), args.get(1)));
    }

    // ==================== Rule Command ====================

    private CommandResult handleRule(String username, List<String> args) {
        String action = args.isEmpty() ? SUBCMD_LIST : args.get(0).toLowerCase(Locale.ROOT);
        List<String> subArgs = args.isEmpty() ? List.of() : args.subList(1, args.size());

        return switch (action) {
        case SUBCMD_LIST -> handleRuleList();
        case "show" -> handleRuleShow(subArgs);
        case "add", "set" -> handleRuleAdd(subArgs);
        case "remove", "delete" -> handleRuleRemove(subArgs);
        case "enable", "disable" -> handleRuleEnable(subArgs, "enable".equals(action));
        case "run" -> handleRuleRun(username, subArgs);
        case "test" -> handleRuleTest(username, subArgs);
        default -> CommandResult.failure("Usage: " + listCommands().get(1).usage());
        };
    }

    private CommandResult handleRuleList() {
        List<Rule> rules = progressionService.listRules();
        if (rules.isEmpty()) {
            return CommandResult.success("No rules defined.", rules);
        }
        StringBuilder sb = new StringBuilder();
        sb.append("**Rules (").append(rules.size()).append(")**").append(DOUBLE_NEWLINE);
        for (Rule rule : rules) {
            sb.append(formatRule(rule)).append("\n");
        }
        return CommandResult.success(sb.toString(), rules);
    }

    private CommandResult handleRuleShow(List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: rule show <id>");
        }
        return progressionService.getRule(args.get(0))
                .map(rule -> CommandResult.success(formatRule(rule), rule))
                .orElseGet(() -> CommandResult.failure("Rule not found: " + args.get(0)));
    }

    private CommandResult handleRuleAdd(List<String> args) {
        if (args.size() < 2) {
            return CommandResult.failure("Usage: rule add <id> IF <condition> THEN <actions>");
        }
        Matcher matcher = RULE_DEFINITION.matcher(String.join(" ", args.subList(1, args.size())).trim());
        if (!matcher.matches()) {
            return CommandResult.failure("Usage: rule add <id> IF <condition> THEN <actions>");
        }
        OperationResult result = progressionService.setRule(args.get(0), matcher.group(1), matcher.group(2), true,
                ProgressionCatalog.SOURCE_MANUAL);
        return toCommandResult(result, "Rule saved: " + args.get(0));
    }

    private CommandResult handleRuleRemove(List<String> args) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: rule remove <id>");
        }
        if (!progressionService.deleteRule(args.get(0))) {
            return CommandResult.failure("Rule not found: " + args.get(0));
        }
        return CommandResult.success("Rule removed: " + args.get(0));
    }

    private CommandResult handleRuleEnable(List<String> args, boolean enabled) {
        if (args.isEmpty()) {
            return CommandResult.failure("Usage: rule " + (enabled ? "enable" : "disable") + " <id>");
        }
        return progressionService.setRuleEnabled(args.get(0), enabled)
                .map(rule -> CommandResult.success(formatRule(rule), rule))
                .orElseGet(() -> CommandResult.failure("Rule not found: " + args.get(0)));
    }

    private CommandResult handleRuleRun(String username, List<String> args) {
        String ruleId = args.isEmpty() ? null : args.get(0);
        if (ruleId != null && progressionService.getRule(ruleId).isEmpty()) {
            return CommandResult.failure("Rule not found: " + ruleId);
        }
        RuleRunResult result = progressionService.runRules(username, ruleId);
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Rules evaluated: %d, fired: %d%n", result.evaluations().size(),
                result.fired().size()));
        for (RuleFiring firing : result.evaluations()) {
            sb.append(firing.fired() ? "[fired] " : "[blocked] ").append(firing.ruleId());
            if (!firing.fired()) {
                sb.append(" - ").append(String.join(", ", firing.blockedBy()));
            }
            for (ActionOutcome outcome : firing.actions()) {
                sb.append(String.format("%n  %s %s: %s", outcome.kind(), outcome.target(), outcome.detail()));
            }
            sb.append("\n");
        }
        return CommandResult.success(sb.toString(), result);
    }

    private CommandResult handleRuleTest(String username, List<String> args) {
        Matcher matcher = RULE_TEST.matcher(String.join(" ", args).trim());
        if (!matcher.matches()) {
            return CommandResult.failure("Usage: rule test IF <condition>");
        }
        RequirementVerdict verdict = progressionService.testCondition(username, matcher.group(1));
        String output = verdict.ok()
                ? "Condition holds."
                : "Condition blocked by: " + String.join(", ", verdict.blockedBy());
        return CommandResult.success(output, verdict);
    }

    // ==================== Replay Command ====================

    private CommandResult handleReplay(List<String> args) {
        if (args.size() < MIN_REPLAY_ARGS) {
            return CommandResult.failure("Usage: " + listCommands().get(2).usage());
        }
        Path input;
        Path outputState;
        Path report;
        try {
            input = Path.of(args.get(0));
            outputState = Path.of(args.get(1));
            report = args.size() > 2 ? Path.of(args.get(2)) : null;
        } catch (InvalidPathException e) {
            return CommandResult.failure("Invalid path: " + e.getMessage());
        }
        ReplayReport result = replayService.replay(input, outputState, report);
        String output = String.format("Replay %s: total=%d processed=%d applied=%d skipped=%d%nchecksum: %s",
                result.isOk() ? "ok" : "FAILED", result.getEventsTotal(), result.getEventsProcessed(),
                result.getEventsApplied(), result.getEventsSkipped(), result.getChecksumAfter());
        return result.isOk() ? CommandResult.success(output, result) : CommandResult.failure(output, result);
    }

    // ==================== Formatting ====================

    private CommandResult toCommandResult(OperationResult result, String successOutput) {
        if (!result.isOk()) {
            return CommandResult.failure(result.getError(), result);
        }
        return CommandResult.success(successOutput, result.getData());
    }

    private String formatStats(GameplayStats stats) {
        return String.format("XP: %d | HP: %d | Gold: %d", stats.getXp(), stats.getHp(), stats.getGold());
    }

    private String formatGate(Gate gate) {
        return String.format("%s `%s` %s", gate.isCompleted() ? "[done]" : "[pending]", gate.getId(),
                gate.getTitle() != null ? gate.getTitle() : "");
    }

    private String formatRule(Rule rule) {
        return String.format("%s `%s` IF %s THEN %s", rule.isEnabled() ? "[on]" : "[off]", rule.getId(),
                rule.getIfExpression(), rule.getThenExpression());
    }

    private String optionValue(List<String> args, String option) {
        int index = args.indexOf(option);
        return index >= 0 && index + 1 < args.size() ? args.get(index + 1) : null;
    }

    private Optional<Long> parseLong(String raw) {
        try {
            return Optional.of(Long.parseLong(raw.trim()));
        } catch (NumberFormatException e) {
            return Optional.empty();
        }
    }
}
