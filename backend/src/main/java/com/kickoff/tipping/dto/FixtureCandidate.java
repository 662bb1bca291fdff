package com.kickoff.tipping.dto;

import com.kickoff.tipping.model.FixtureStatus;

import java.time.Instant;

/**
 * Source-neutral shape of one match as reported by a single adapter, or as the merged result of several.
 * Instances are treated as values once built: merging always returns a fresh copy.
 */
public class FixtureCandidate {
    private String sourceEventId;
    private String source;
    private Instant kickoff;
    private Integer seasonYear;
    private String homeTeam;
    private String awayTeam;
    private String venueName;
    private String venueCity;
    private String homeLogoUrl;
    private String awayLogoUrl;
    private Integer roundNumber;
    private FixtureStatus status = FixtureStatus.SCHEDULED;
    private Integer homeScore;
    private Integer awayScore;
    private String winner;
    private Double homePrice;
    private Double awayPrice;
    private String rawPayload;
    // round, venue and crests were set from the official draw
    private boolean drawConfirmed;

    public FixtureCandidate() {}

    public FixtureCandidate(String sourceEventId, String source, Instant kickoff, String homeTeam, String awayTeam) {
        this.sourceEventId = sourceEventId;
        this.source = source;
        this.kickoff = kickoff;
        this.homeTeam = homeTeam;
        this.awayTeam = awayTeam;
    }

    public FixtureCandidate copy() {
        FixtureCandidate c = new FixtureCandidate(sourceEventId, source, kickoff, homeTeam, awayTeam);
        c.seasonYear = seasonYear;
        c.venueName = venueName;
        c.venueCity = venueCity;
        c.homeLogoUrl = homeLogoUrl;
        c.awayLogoUrl = awayLogoUrl;
        c.roundNumber = roundNumber;
        c.status = status;
        c.homeScore = homeScore;
        c.awayScore = awayScore;
        c.winner = winner;
        c.homePrice = homePrice;
        c.awayPrice = awayPrice;
        c.rawPayload = rawPayload;
        c.drawConfirmed = drawConfirmed;
        return c;
    }

    public boolean isCompleted() { return status == FixtureStatus.COMPLETED; }

    public boolean isDrawConfirmed() { return drawConfirmed; }
    public void setDrawConfirmed(boolean drawConfirmed) { this.drawConfirmed = drawConfirmed; }

    public String getSourceEventId() { return sourceEventId; }
    public void setSourceEventId(String sourceEventId) { this.sourceEventId = sourceEventId; }

    public String getSource() { return source; }
    public void setSource(String source) { this.source = source; }

    public Instant getKickoff() { return kickoff; }
    public void setKickoff(Instant kickoff) { this.kickoff = kickoff; }

    public Integer getSeasonYear() { return seasonYear; }
    public void setSeasonYear(Integer seasonYear) { this.seasonYear = seasonYear; }

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

    public String getRawPayload() { return rawPayload; }
    public void setRawPayload(String rawPayload) { this.rawPayload = rawPayload; }
}
