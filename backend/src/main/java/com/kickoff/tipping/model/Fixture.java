package com.kickoff.tipping.model;

import jakarta.persistence.*;

import java.time.Instant;

@Entity
@Table(name = "fixtures", indexes = {
        @Index(name = "idx_fixtures_kickoff", columnList = "kickoff_utc"),
        @Index(name = "idx_fixtures_season_round", columnList = "season_year, round_number")
}, uniqueConstraints = {
        @UniqueConstraint(name = "uk_fixture_source_event", columnNames = {"source_event_id"})
})
public class Fixture {

    public static final String WINNER_DRAW = "draw";
    public static final String WINNER_UNKNOWN = "unknown";

    @Id
    @GeneratedValue(strategy = GenerationType.IDENTITY)
    private Long id;

    @Column(name = "source_event_id", nullable = false, length = 255)
    private String sourceEventId;

    @Column(name = "kickoff_utc", nullable = false)
    private Instant kickoff;

    @Column(name = "home_team", nullable = false)
    private String homeTeam;

    @Column(name = "away_team", nullable = false)
    private String awayTeam;

    @Column(name = "venue_name")
    private String venueName;

    @Column(name = "venue_city")
    private String venueCity;

    @Column(name = "home_logo_url", length = 500)
    private String homeLogoUrl;

    @Column(name = "away_logo_url", length = 500)
    private String awayLogoUrl;

    @Column(name = "season_year")
    private Integer seasonYear;

    @Column(name = "round_number")
    private Integer roundNumber;

    @Enumerated(EnumType.STRING)
    @Column(name = "status", nullable = false, length = 16)
    private FixtureStatus status = FixtureStatus.SCHEDULED;

    @Column(name = "home_score")
    private Integer homeScore;

    @Column(name = "away_score")
    private Integer awayScore;

    // team name, "draw" or "unknown" (completed but not scorable)
    @Column(name = "winner")
    private String winner;

    @Column(name = "home_price")
    private Double homePrice;

    @Column(name = "away_price")
    private Double awayPrice;

    @Column(name = "source", length = 32)
    private String source;

    @Lob
    @Column(name = "raw_payload")
    private String rawPayload;

    @Column(name = "updated_at", nullable = false)
    private Instant updatedAt;

    public Fixture() {}

    public Fixture(String sourceEventId, Instant kickoff, String homeTeam, String awayTeam) {
        this.sourceEventId = sourceEventId;
        this.kickoff = kickoff;
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
        this.updatedAt = Instant.now();
    }

    public boolean isCompleted() { return status == FixtureStatus.COMPLETED; }

    /** Completed with a usable result (a team name or "draw"). */
    public boolean hasKnownWinner() {
        return isCompleted() && winner != null && !WINNER_UNKNOWN.equals(winner);
    }

    public Long getId() { return id; }
    public void setId(Long id) { this.id = id; }

    public String getSourceEventId() { return sourceEventId; }
    public void setSourceEventId(String sourceEventId) { this.sourceEventId = sourceEventId; }

    public Instant getKickoff() { return kickoff; }
    public void setKickoff(Instant kickoff) { this.kickoff = kickoff; }

    public String getHomeTeam() { return homeTeam; }
    public void setHomeTeam(String homeTeam) { this.homeTeam = homeTeam; }

    public String getAwayTeam() { return awayTeam; }
    public void setAwayTeam(String awayTeam) { this.awayTeam = awayTeam; }

    public String getVenueName() { return venueName; }
    public void setVenueName(String venueName) { this.venueName = venueName; }

    public String getVenueCity() { return venueCity; }
    public void setVenueCity(String venueCity) { this.venueCity = venueCity; }

    public String getHomeLogoUrl() { return homeLogoUrl; }
    public void setHomeLogoUrl(String homeLogoUrl) { this.homeLogoUrl = homeLogoUrl; }

    public String getAwayLogoUrl() { return awayLogoUrl; }
    public void setAwayLogoUrl(String awayLogoUrl) { this.awayLogoUrl = awayLogoUrl; }

    public Integer getSeasonYear() { return seasonYear; }
    public void setSeasonYear(Integer seasonYear) { this.seasonYear = seasonYear; }

    public Integer getRoundNumber() { return roundNumber; }
    public void setRoundNumber(Integer roundNumber) { this.roundNumber = roundNumber; }

    public FixtureStatus getStatus() { return status; }
    public void setStatus(FixtureStatus status) { this.status = status; }

    public Integer getHomeScore() { return homeScore; }
    public void setHomeScore(Integer homeScore) { this.homeScore = homeScore; }

    public Integer getAwayScore() { return awayScore; }
    public void setAwayScore(Integer awayScore) { this.awayScore = awayScore; }

    public String getWinner() { return winner; }
    public void setWinner(String winner) { this.winner = winner; }

    public Double getHomePrice() { return homePrice; }
    public void setHomePrice(Double homePrice) { this.homePrice = homePrice; }

    public Double getAwayPrice() { return awayPrice; }
    public void setAwayPrice(Double awayPrice) { this.awayPrice = awayPrice; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public String getRawPayload() { return rawPayload; }
    public void setRawPayload(String rawPayload) { this.rawPayload = rawPayload; }

    public Instant getUpdatedAt() { return updatedAt; }
    public void setUpdatedAt(Instant updatedAt) { this.updatedAt = updatedAt; }
}
