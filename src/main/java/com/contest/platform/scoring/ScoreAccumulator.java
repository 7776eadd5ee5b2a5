package com.contest.platform.scoring;

import com.contest.platform.model.ParticipationTaskScore;
import lombok.Getter;

import java.time.Instant;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Running aggregates of the facts folded so far for one (participation, task) pair.
 * Mutated only by {@link ScoreAggregator}.
 */
@Getter
public class ScoreAccumulator {

    double maxScore;
    double maxTokenedScore;
    Double lastSubmissionScore;
    Instant lastSubmissionTimestamp;
    Long lastSubmissionId;
    final Map<String, Double> subtaskMaxScores = new LinkedHashMap<>();
    boolean hasSubmissions;

    public static ScoreAccumulator empty() {
        return new ScoreAccumulator();
    }

    /**
     * Resume from a persisted cache entry. Under MAX the cached score is the
     * rounded running maximum; rounding is monotone so folding on top of it
     * yields the same rounded result as folding on the raw maximum.
     */
    public static ScoreAccumulator restore(ParticipationTaskScore entry) {
        ScoreAccumulator accumulator = new ScoreAccumulator();
        accumulator.maxScore = entry.getScore();
        accumulator.maxTokenedScore = entry.getMaxTokenedScore();
        accumulator.lastSubmissionScore = entry.getLastSubmissionScore();
        accumulator.lastSubmissionTimestamp = entry.getLastSubmissionTimestamp();
        accumulator.lastSubmissionId = entry.getLastSubmissionId();
        if (entry.getSubtaskMaxScores() != null) {
            entry.getSubtaskMaxScores().forEach((key, value) ->
                accumulator.subtaskMaxScores.put(ScoreDetailsParser.normalizeKey(key), value));
        }
        accumulator.hasSubmissions = entry.isHasSubmissions();
        return accumulator;
    }

    /**
     * Copy for persisting; null when no subtask score has been recorded.
     */
    public Map<String, Double> subtaskMaxScoresOrNull() {
        return subtaskMaxScores.isEmpty() ? null : new LinkedHashMap<>(subtaskMaxScores);
    }

    public Map<String, Double> getSubtaskMaxScores() {
        return Collections.unmodifiableMap(subtaskMaxScores);
    }
}
