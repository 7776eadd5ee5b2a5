package com.contest.platform.scoring;

import lombok.Value;

/**
 * Score achieved on one subtask by one submission. The key is the
 * string-normalized subtask index.
 */
@Value
public class SubtaskScore {
    String key;
    double score;
}
