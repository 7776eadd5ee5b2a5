package com.contest.platform.scoring;

import com.contest.platform.exception.MalformedScoreDetailsException;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;

/**
 * Reads the subtask breakdown produced by the evaluation pipeline.
 * Each element must carry an "idx" and a numeric "score".
 */
public final class ScoreDetailsParser {

    static final String INDEX_FIELD = "idx";
    static final String SCORE_FIELD = "score";

    private ScoreDetailsParser() {
    }

    public static List<SubtaskScore> parse(List<Map<String, Object>> scoreDetails) {
        if (scoreDetails == null || scoreDetails.isEmpty()) {
            return Collections.emptyList();
        }
        List<SubtaskScore> subtaskScores = new ArrayList<>(scoreDetails.size());
        for (int i = 0; i < scoreDetails.size(); i++) {
            Map<String, Object> detail = scoreDetails.get(i);
            if (detail == null) {
                throw new MalformedScoreDetailsException("Subtask entry " + i + " is null");
            }
            Object index = detail.get(INDEX_FIELD);
            if (index == null || index.toString().trim().isEmpty()) {
                throw new MalformedScoreDetailsException("Subtask entry " + i + " has no " + INDEX_FIELD);
            }
            Object score = detail.get(SCORE_FIELD);
            if (!(score instanceof Number)) {
                throw new MalformedScoreDetailsException(
                    "Subtask entry " + i + " has no numeric " + SCORE_FIELD + ": " + score);
            }
            subtaskScores.add(new SubtaskScore(normalizeKey(index), ((Number) score).doubleValue()));
        }
        return subtaskScores;
    }

    /**
     * Subtask indices may arrive as strings or numbers; 2, 2.0 and "2" all map to "2".
     */
    static String normalizeKey(Object index) {
        if (index instanceof Number) {
            double value = ((Number) index).doubleValue();
            if (!Double.isInfinite(value) && value == Math.rint(value)) {
                return Long.toString((long) value);
            }
        }
        return index.toString().trim();
    }
}
