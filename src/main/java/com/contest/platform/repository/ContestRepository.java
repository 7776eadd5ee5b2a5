package com.contest.platform.repository;

import com.contest.platform.model.Contest;

public interface ContestRepository {
    Contest save(Contest contest);
    boolean existsById(Long contestId);
}
