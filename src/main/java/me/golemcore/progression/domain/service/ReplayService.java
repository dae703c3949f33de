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

import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.extern.slf4j.Slf4j;
import me.golemcore.progression.domain.model.CanonicalEvent;
import me.golemcore.progression.domain.model.CanonicalEventType;
import me.golemcore.progression.domain.model.ReduceOutcome;
import me.golemcore.progression.domain.model.ReplayReport;
import me.golemcore.progression.domain.model.TickResult;
import me.golemcore.progression.infrastructure.config.ProgressionProperties;
import me.golemcore.progression.port.outbound.StorageFactory;
import me.golemcore.progression.port.outbound.StoragePort;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.TreeSet;
import java.util.stream.Stream;

/**
 * Replays a canonical event file through a fresh, isolated progression engine
 * and reports checksums of the state before and after.
 *
 * <p>
 * The engine runs in a temporary workspace that is removed afterwards, so the
 * live state is never touched. Given the same input file and initial state,
 * {@code checksum_after} is always the same.
 */
@Service
@Slf4j
public class ReplayService {

    static final String REPLAY_USERNAME = "replay";

    private final StorageFactory storageFactory;
    private final ObjectMapper objectMapper;
    private final AdapterEventContract adapterEventContract;
    private final ProgressionProperties properties;
    private final Clock clock;

    public ReplayService(StorageFactory storageFactory, ObjectMapper objectMapper,
            AdapterEventContract adapterEventContract, ProgressionProperties properties, Clock clock) {
        this.storageFactory = storageFactory;
        this.objectMapper = objectMapper;
        this.adapterEventContract = adapterEventContract;
        this.properties = properties;
        this.clock = clock;
    }

    public ReplayReport replay(Path inputEvents, Path outputState, Path outputReport) {
        return replay(inputEvents, outputState, outputReport, null, properties.getReplay().getMaxEventsPerTick());
    }

    /**
     * @param inputEvents
     *            NDJSON file of canonical events
     * @param outputState
     *            where to write the resulting state document
     * @param outputReport
     *            optional path for the JSON report
     * @param initialState
     *            optional state document to start from
     * @param maxEventsPerTick
     *            batch size of each tick
     */
    public ReplayReport replay(Path inputEvents, Path outputState, Path outputReport, Path initialState,
            int maxEventsPerTick) {
        Path workspace = createWorkspace();
        try {
            StoragePort storage = storageFactory.open(workspace);
            if (initialState != null && Files.exists(initialState)) {
                storage.putText(ProgressionStateStore.PROGRESSION_DIR, ProgressionStateStore.STATE_FILE,
                        Files.readString(initialState, StandardCharsets.UTF_8)).join();
            }
            IsolatedEngine engine = isolatedEngine(storage, maxEventsPerTick);
            // Loading writes the default document when the workspace has none.
            engine.store().load();
            String checksumBefore = StateChecksum.of(objectMapper, readState(storage));

            List<String> lines = readInputLines(inputEvents);
            Set<String> usernames = new TreeSet<>();
            Set<String> unknownTypes = new TreeSet<>();
            for (String line : lines) {
                engine.eventLog().appendRawLine(line);
                decode(engine.codec(), line).ifPresent(event -> {
                    if (event.username() != null && !event.username().isBlank()) {
                        usernames.add(event.username().trim());
                    }
                    if (event.eventType() == CanonicalEventType.UNKNOWN) {
                        unknownTypes.add(event.type() == null ? "" : event.type().trim().toUpperCase(Locale.ROOT));
                    }
                });
            }
            usernames.forEach(engine.service()::ensureUser);

            int ticks = 0;
            long processed = 0;
            long applied = 0;
            long unknownChanged = 0;
            while (true) {
                TickResult tick = engine.service().tick(REPLAY_USERNAME, maxEventsPerTick);
                ticks++;
                processed += tick.getProcessed();
                applied += tick.getApplied();
                for (ReduceOutcome outcome : tick.getOutcomes()) {
                    if (outcome.isChanged() && outcome.getEventType() == CanonicalEventType.UNKNOWN) {
                        unknownChanged++;
                    }
                }
                if (tick.getLinesConsumed() == 0) {
                    break;
                }
            }

            String finalState = readState(storage);
            writeFile(outputState, finalState != null ? finalState : "");
            String checksumAfter = StateChecksum.of(objectMapper, finalState);

            ReplayReport report = ReplayReport.builder()
                    .ok(unknownChanged == 0)
                    .inputEvents(inputEvents.toString())
                    .outputState(outputState.toString())
                    .maxEventsPerTick(maxEventsPerTick)
                    .ticks(ticks)
                    .eventsTotal(lines.size())
                    .eventsProcessed(processed)
                    .eventsApplied(applied)
                    .eventsSkipped(Math.max(0L, processed - applied))
                    .unknownEventTypes(new ArrayList<>(unknownTypes))
                    .unknownEventsChanged(unknownChanged)
                    .checksumBefore(checksumBefore)
                    .checksumAfter(checksumAfter)
                    .generatedAt(Instant.now(clock))
                    .build();
            if (outputReport != null) {
                writeFile(outputReport, objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report));
            }
            log.info("[Replay] Replayed {}: processed={}, applied={}, skipped={}, checksum={}",
                    inputEvents, processed, applied, report.getEventsSkipped(), checksumAfter);
            return report;
        } catch (IOException e) {
            throw new UncheckedIOException("Replay failed for " + inputEvents, e);
        } finally {
            deleteWorkspace(workspace);
        }
    }

    // ==================== Isolated engine ====================

    private IsolatedEngine isolatedEngine(StoragePort storage, int maxEventsPerTick) {
        ProgressionProperties isolated = new ProgressionProperties();
        isolated.getEngine().setMaxEventsPerTick(maxEventsPerTick);
        isolated.getEngine().setReadChunkBytes(properties.getEngine().getReadChunkBytes());

        CanonicalEventCodec codec = new CanonicalEventCodec(objectMapper);
        EventLogService eventLog = new EventLogService(storage, codec, isolated);
        RequirementEvaluator evaluator = new RequirementEvaluator();
        ProgressionMutator mutator = new ProgressionMutator(evaluator, clock);
        ProgressionStateStore store = new ProgressionStateStore(storage, objectMapper, mutator, clock);
        StateReducer reducer = new StateReducer(mutator, adapterEventContract);
        RuleEngine ruleEngine = new RuleEngine(mutator, evaluator);
        ProgressionService service = new ProgressionService(store, eventLog, reducer, ruleEngine, mutator,
                evaluator, isolated, clock);
        return new IsolatedEngine(service, store, eventLog, codec);
    }

    private record IsolatedEngine(ProgressionService service, ProgressionStateStore store, EventLogService eventLog,
            CanonicalEventCodec codec) {
    }

    // ==================== Files ====================

    private List<String> readInputLines(Path inputEvents) throws IOException {
        if (!Files.exists(inputEvents)) {
            log.warn("[Replay] Input events file not found: {}", inputEvents);
            return List.of();
        }
        try (Stream<String> lines = Files.lines(inputEvents, StandardCharsets.UTF_8)) {
            return lines.map(String::trim).filter(line -> !line.isEmpty()).toList();
        }
    }

    private Optional<CanonicalEvent> decode(CanonicalEventCodec codec, String line) {
        try {
            return Optional.of(codec.decode(line));
        } catch (CanonicalEventCodec.MalformedEventException e) {
            log.debug("[Replay] Carrying malformed line into the isolated log: {}", e.getMessage());
            return Optional.empty();
        }
    }

    private String readState(StoragePort storage) {
        return storage.getText(ProgressionStateStore.PROGRESSION_DIR, ProgressionStateStore.STATE_FILE).join();
    }

    private void writeFile(Path path, String content) throws IOException {
        Path parent = path.toAbsolutePath().getParent();
        if (parent != null) {
            Files.createDirectories(parent);
        }
        Files.writeString(path, content, StandardCharsets.UTF_8);
    }

    private Path createWorkspace() {
        try {
            return Files.createTempDirectory("progression-replay-");
        } catch (IOException e) {
            throw new IllegalStateException("Failed to create replay workspace", e);
        }
    }

    private void deleteWorkspace(Path workspace) {
        try (Stream<Path> paths = Files.walk(workspace)) {
            for (Path path : paths.sorted(Comparator.reverseOrder()).toList()) {
                Files.deleteIfExists(path);
            }
        } catch (IOException e) {
            log.warn("[Replay] Failed to clean up replay workspace {}: {}", workspace, e.getMessage());
        }
    }
}
