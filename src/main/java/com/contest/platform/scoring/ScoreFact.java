package com.contest.platform.scoring;

import com.contest.platform.model.Submission;
import lombok.Builder;
import lombok.Singular;
import lombok.Value;

import java.time.Instant;
import java.util.Comparator;
import java.util.List;

/**
 * The contribution of one scored submission to a task score.
 */
@Value
@Builder
public class ScoreFact {

    /** Chronological order used everywhere: timestamp, then submission id. */
    public static final Comparator<ScoreFact> CHRONOLOGICAL = Comparator
        .comparing(ScoreFact::getTimestamp)
        .thenComparing(ScoreFact::getSubmissionId, Comparator.nullsFirst(Comparator.naturalOrder()));

    Long submissionId;
    Instant timestamp;
    double score;
    @Singular
    List<SubtaskScore> subtaskScores;
    boolean tokened;

    /**
     * Whether this fact comes strictly before the given (timestamp, submission id) position.
     */
    public boolean precedes(Instant otherTimestamp, Long otherSubmissionId) {
        if (otherTimestamp == null) {
            return false;
        }
        int byTime = timestamp.compareTo(otherTimestamp);
        if (byTime != 0) {
            return byTime < 0;
        }
        if (submissionId == null || otherSubmissionId == null) {
            return false;
        }
        return submissionId < otherSubmissionId;
    }

    public static ScoreFact fromSubmission(Submission submission) {
        if (!submission.isScored()) {
            throw new IllegalArgumentException("Submission " + submission.getId() + " has not been scored");
        }
        return ScoreFact.builder()
            .submissionId(submission.getId())
            .timestamp(submission.getTimestamp())
            .score(submission.getScore())
            .subtaskScores(ScoreDetailsParser.parse(submission.getScoreDetails()))
            .tokened(submission.isTokened())
            .build();
    }
}
