package com.kickoff.tipping.model;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "ladder_predictions", uniqueConstraints = {
        @UniqueConstraint(name = "uk_prediction_user_season_team", columnNames = {"user_id", "season_year", "team_name"})
})
public class LadderPrediction {

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "user_id", nullable = false)
    private Long userId;

    @Column(name = "season_year", nullable = false)
    private Integer seasonYear;

    @Column(name = "team_name", nullable = false)
    private String teamName;

    @Column(name = "predicted_position", nullable = false)
    private Integer predictedPosition;

    @Column(name = "created_at", nullable = false)
    private Instant createdAt;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public LadderPrediction() {}

    public LadderPrediction(Long userId, Integer seasonYear, String teamName, Integer predictedPosition, Instant now) {
        this.userId = userId;
        this.seasonYear = seasonYear;
        this.teamName = teamName;
        this.predictedPosition = predictedPosition;
        this.createdAt = now;
        this.updatedAt = now;
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

    public Integer getSeasonYear() { return seasonYear; }
    public void setSeasonYear(Integer seasonYear) { this.seasonYear = seasonYear; }

    public String getTeamName() { return teamName; }
    public void setTeamName(String teamName) { this.teamName = teamName; }

    public Integer getPredictedPosition() { return predictedPosition; }
    public void setPredictedPosition(Integer predictedPosition) { this.predictedPosition = predictedPosition; }

    public Instant getCreatedAt() { return createdAt; }
    public void setCreatedAt(Instant createdAt) { this.createdAt = createdAt; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
