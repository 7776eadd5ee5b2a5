package com.contest.platform.scoring;

import com.contest.platform.exception.InvalidScoreConfigurationException;
import com.contest.platform.model.ScoreMode;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.util.ArrayList;
import java.util.List;
import java.util.Map;

/**
 * Score-mode policies over a sequence of submission facts. Pure computation,
 * no I/O.
 */
public final class ScoreAggregator {

    /** Key of the single subtask assumed when a scored submission has no breakdown. */
    static final String IMPLICIT_SUBTASK_KEY = "1";

    private ScoreAggregator() {
    }

    /**
     * Fold one fact into the running state. The result does not depend on the
     * order facts are folded in: maxima are merged monotonically and the last
     * submission is picked by {@link ScoreFact#CHRONOLOGICAL}.
     */
    public static void fold(ScoreAccumulator state, ScoreFact fact, ScoreMode mode) {
        double score = fact.getScore();
        state.hasSubmissions = true;
        state.maxScore = Math.max(state.maxScore, score);

        if (fact.isTokened()) {
            state.maxTokenedScore = Math.max(state.maxTokenedScore, score);
        }

        if (!fact.precedes(state.lastSubmissionTimestamp, state.lastSubmissionId)) {
            state.lastSubmissionScore = score;
            state.lastSubmissionTimestamp = fact.getTimestamp();
            state.lastSubmissionId = fact.getSubmissionId();
        }

        if (mode == ScoreMode.MAX_SUBTASK) {
            for (SubtaskScore subtask : subtaskScoresOf(fact)) {
                state.subtaskMaxScores.merge(subtask.getKey(), subtask.getScore(), Math::max);
            }
        }
    }

    /**
     * Subtask scores contributed by a fact. A compilation failure (no breakdown,
     * zero score) contributes nothing; a scored submission without breakdown
     * counts as a single subtask.
     */
    static List<SubtaskScore> subtaskScoresOf(ScoreFact fact) {
        if (!fact.getSubtaskScores().isEmpty()) {
            return fact.getSubtaskScores();
        }
        if (fact.getScore() == 0.0) {
            return List.of();
        }
        return List.of(new SubtaskScore(IMPLICIT_SUBTASK_KEY, fact.getScore()));
    }

    /**
     * The rounded task score of the given state.
     */
    public static double aggregate(ScoreAccumulator state, ScoreMode mode, int precision) {
        double raw;
        switch (mode) {
            case MAX:
                raw = state.maxScore;
                break;
            case MAX_SUBTASK:
                // Key order, so a restored map sums exactly like a replayed one.
                raw = state.subtaskMaxScores.entrySet().stream()
                    .sorted(Map.Entry.comparingByKey())
                    .mapToDouble(Map.Entry::getValue)
                    .sum();
                break;
            case MAX_TOKENED_LAST:
                double last = state.lastSubmissionScore != null ? state.lastSubmissionScore : 0.0;
                raw = Math.max(last, state.maxTokenedScore);
                break;
            default:
                throw new InvalidScoreConfigurationException("Unsupported score mode: " + mode);
        }
        return round(raw, precision);
    }

    /**
     * Replay facts from an empty state in chronological order, recording every
     * change of the rounded score.
     */
    public static ScoreTimeline replay(List<ScoreFact> facts, ScoreMode mode, int precision) {
        List<ScoreFact> ordered = new ArrayList<>(facts);
        ordered.sort(ScoreFact.CHRONOLOGICAL);

        ScoreAccumulator state = ScoreAccumulator.empty();
        List<ScorePoint> changes = new ArrayList<>();
        double current = 0.0;

        for (ScoreFact fact : ordered) {
            fold(state, fact, mode);
            double score = aggregate(state, mode, precision);
            if (Double.compare(score, current) != 0) {
                changes.add(new ScorePoint(fact.getSubmissionId(), fact.getTimestamp(), score));
                current = score;
            }
        }

        return new ScoreTimeline(state, aggregate(state, mode, precision), changes);
    }

    /**
     * Round half away from zero to {@code precision} decimal digits.
     */
    public static double round(double value, int precision) {
        validatePrecision(precision);
        if (Double.isNaN(value) || Double.isInfinite(value)) {
            throw new IllegalArgumentException("Cannot round non-finite score: " + value);
        }
        return BigDecimal.valueOf(value).setScale(precision, RoundingMode.HALF_UP).doubleValue();
    }

    public static int validatePrecision(Integer precision) {
        if (precision == null) {
            throw new InvalidScoreConfigurationException("Score precision is not configured");
        }
        if (precision < 0) {
            throw new InvalidScoreConfigurationException("Score precision must be non-negative, got " + precision);
        }
        return precision;
    }
}
