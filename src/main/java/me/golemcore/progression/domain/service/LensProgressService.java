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

import lombok.RequiredArgsConstructor;
import me.golemcore.progression.domain.ProgressionCatalog;
import me.golemcore.progression.domain.model.LensCheckpoint;
import me.golemcore.progression.domain.model.LensCheckpointReport;
import me.golemcore.progression.domain.model.LensCheckpointStatus;
import me.golemcore.progression.domain.model.LensScore;
import me.golemcore.progression.domain.model.RequirementVerdict;
import me.golemcore.progression.domain.model.UserProgressionState;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;

/**
 * Per-lens checkpoint table and score view.
 *
 * <p>
 * A lens defaults to the active toybox profile. Lenses without a checkpoint
 * table report zero checkpoints and score only {@code events_processed}.
 */
@Service
@RequiredArgsConstructor
public class LensProgressService {

    private static final long LEVEL_WEIGHT = 100L;
    private static final long ACHIEVEMENT_WEIGHT = 150L;
    private static final long METRIC_WEIGHT = 10L;
    private static final long CHECKPOINT_WEIGHT = 250L;

    private static final long LEGEND_SCORE = 5000L;
    private static final long VETERAN_SCORE = 2500L;
    private static final long RUNNER_SCORE = 1000L;

    private final ProgressionService progressionService;
    private final RequirementEvaluator requirementEvaluator;

    public LensCheckpointReport listLensCheckpoints(String username, String lensId) {
        String lens = resolveLens(lensId);
        List<LensCheckpointStatus> checkpoints = new ArrayList<>();
        for (LensCheckpoint checkpoint : ProgressionCatalog.LENS_CHECKPOINTS.getOrDefault(lens, List.of())) {
            RequirementVerdict verdict = progressionService.evaluate(username, List.of(checkpoint.requirement()));
            checkpoints.add(new LensCheckpointStatus(
                    checkpoint.id(),
                    checkpoint.title(),
                    checkpoint.requirement().label(),
                    verdict.ok(),
                    verdict.blockedBy()));
        }
        int completed = (int) checkpoints.stream().filter(LensCheckpointStatus::completed).count();
        LensCheckpointStatus next = checkpoints.stream()
                .filter(checkpoint -> !checkpoint.completed())
                .findFirst()
                .orElse(null);
        return new LensCheckpointReport(lens, List.copyOf(checkpoints), completed, checkpoints.size(), next);
    }

    public LensScore lensScoreView(String username, String lensId) {
        String lens = resolveLens(lensId);
        UserProgressionState user = progressionService.userView(username);
        LensCheckpointReport report = listLensCheckpoints(username, lens);

        Map<String, Long> variables = new LinkedHashMap<>();
        for (String key : ProgressionCatalog.PROFILE_VARIABLES) {
            variables.put(key, requirementEvaluator.variable(user, key));
        }
        Map<String, Long> metrics = new LinkedHashMap<>();
        for (String metric : ProgressionCatalog.LENS_SCORE_METRICS.getOrDefault(lens,
                ProgressionCatalog.FALLBACK_SCORE_METRICS)) {
            metrics.put(metric, user.getProgress().metric(metric));
        }
        long metricScore = metrics.values().stream().mapToLong(Long::longValue).sum();

        long total = variables.get("xp")
                + variables.get("gold")
                + variables.get("level") * LEVEL_WEIGHT
                + variables.get("achievement_level") * ACHIEVEMENT_WEIGHT
                + metricScore * METRIC_WEIGHT
                + report.completed() * CHECKPOINT_WEIGHT;

        return LensScore.builder()
                .lens(lens)
                .total(total)
                .tier(tier(total))
                .completedCheckpoints(report.completed())
                .totalCheckpoints(report.total())
                .variables(variables)
                .metrics(metrics)
                .checkpoints(report)
                .build();
    }

    static String tier(long total) {
        if (total >= LEGEND_SCORE) {
            return "legend";
        }
        if (total >= VETERAN_SCORE) {
            return "veteran";
        }
        if (total >= RUNNER_SCORE) {
            return "runner";
        }
        return "initiate";
    }

    private String resolveLens(String lensId) {
        String lens = lensId == null ? "" : lensId.trim().toLowerCase(Locale.ROOT);
        return lens.isEmpty() ? progressionService.getActiveToybox() : lens;
    }
}
