package com.kickoff.tipping.model;

import jakarta.persistence.*;

import java.time.Instant;

/** One used adjustment: a single team moved one place after a completed round. */
@Entity
@Table(name = "ladder_adjustments", uniqueConstraints = {
        @UniqueConstraint(name = "uk_adjustment_user_season_round", columnNames = {"user_id", "season_year", "round_number"})
})
public class LadderAdjustment {

    public enum Direction { UP, DOWN }

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "season_year", nullable = false)
    private Integer seasonYear;

    @Column(name = "round_number", nullable = false)
    private Integer roundNumber;

    @Column(name = "team_name", nullable = false)
    private String teamName;

    @Enumerated(EnumType.STRING)
    @Column(name = "direction", nullable = false, length = 8)
    private Direction direction;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    public LadderAdjustment() {}

    public LadderAdjustment(Long userId, Integer seasonYear, Integer roundNumber, String teamName, Direction direction, Instant now) {
        this.userId = userId;
        this.seasonYear = seasonYear;
        this.roundNumber = roundNumber;
        this.teamName = teamName;
        this.direction = direction;
        this.createdAt = now;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

    public Integer getSeasonYear() { return seasonYear; }
    public void setSeasonYear(Integer seasonYear) { this.seasonYear = seasonYear; }

    public Integer getRoundNumber() { return roundNumber; }
    public void setRoundNumber(Integer roundNumber) { this.roundNumber = roundNumber; }

    public String getTeamName() { return teamName; }
    public void setTeamName(String teamName) { this.teamName = teamName; }

    public Direction getDirection() { return direction; }
    public void setDirection(Direction direction) { this.direction = direction; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }
}
