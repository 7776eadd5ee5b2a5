package com.contest.platform.repository;

import com.contest.platform.model.Participation;

import java.util.List;
import java.util.Optional;

public interface ParticipationRepository {
    Participation save(Participation participation);
    Optional<Participation> findById(Long participationId);
    List<Long> findIdsByContestId(Long contestId);
}
