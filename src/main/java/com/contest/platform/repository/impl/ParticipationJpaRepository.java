package com.contest.platform.repository.impl;

import com.contest.platform.model.Participation;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.data.jpa.repository.Query;
import org.springframework.data.repository.query.Param;
import org.springframework.stereotype.Repository;

import java.util.List;

@Repository
public interface ParticipationJpaRepository extends JpaRepository<Participation, Long> {
    @Query("SELECT p.id FROM Participation p WHERE p.contestId = :contestId ORDER BY p.id")
    List<Long> findIdsByContestId(@Param("contestId") Long contestId);
}
