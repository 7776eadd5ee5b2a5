package com.contest.platform.model;

import jakarta.persistence.*;
import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * A user's enrollment in a contest. Owned by the contest administration side;
 * the score cache only reads it.
 */
@Entity
@Table(name = "participations", indexes = {
    @Index(name = "idx_participation_contest", columnList = "contest_id")
})
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class Participation {
    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    @Column(name = "id")
    private Long id;

    @Column(name = "contest_id", nullable = false)
    private Long contestId;

    @Column(name = "user_id", nullable = false)
    private Long userId;
}
