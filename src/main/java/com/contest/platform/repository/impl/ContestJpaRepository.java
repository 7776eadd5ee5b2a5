package com.contest.platform.repository.impl;

import com.contest.platform.model.Contest;
import org.springframework.data.jpa.repository.JpaRepository;
import org.springframework.stereotype.Repository;

@Repository
public interface ContestJpaRepository extends JpaRepository<Contest, Long> {
}
