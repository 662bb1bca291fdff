package com.kickoff.tipping.dto;

import com.kickoff.tipping.model.Fixture;

import java.time.Instant;

/** Fixture as shown to tippers; no raw source payload. */
public class FixtureDTO {
    private Long id;
    private Instant kickoff;
    private String homeTeam;
    private String awayTeam;
    private String venueName;
    private String venueCity;
    private String homeLogoUrl;
    private String awayLogoUrl;
    private Integer seasonYear;
    private Integer roundNumber;
    private String status;
    private Integer homeScore;
    private Integer awayScore;
    private String winner;
    private Double homePrice;
    private Double awayPrice;
    private boolean locked;

    public FixtureDTO() {}

    public static FixtureDTO from(Fixture f, boolean locked) {
        FixtureDTO d = new FixtureDTO();
        d.id = f.getId();
        d.kickoff = f.getKickoff();
        d.homeTeam = f.getHomeTeam();
        d.awayTeam = f.getAwayTeam();
        d.venueName = f.getVenueName();
        d.venueCity = f.getVenueCity();
        d.homeLogoUrl = f.getHomeLogoUrl();
        d.awayLogoUrl = f.getAwayLogoUrl();
        d.seasonYear = f.getSeasonYear();
        d.roundNumber = f.getRoundNumber();
        d.status = f.getStatus() == null ? null : f.getStatus().name();
        d.homeScore = f.getHomeScore();
        d.awayScore = f.getAwayScore();
        d.winner = f.getWinner();
        d.homePrice = f.getHomePrice();
        d.awayPrice = f.getAwayPrice();
        d.locked = locked;
        return d;
    }

    public Long getId() { return id; }
    public Instant getKickoff() { return kickoff; }
    public String getHomeTeam() { return homeTeam; }
    public String getAwayTeam() { return awayTeam; }
    public String getVenueName() { return venueName; }
    public String getVenueCity() { return venueCity; }
    public String getHomeLogoUrl() { return homeLogoUrl; }
    public String getAwayLogoUrl() { return awayLogoUrl; }
    public Integer getSeasonYear() { return seasonYear; }
    public Integer getRoundNumber() { return roundNumber; }
    public String getStatus() { return status; }
    public Integer getHomeScore() { return homeScore; }
    public Integer getAwayScore() { return awayScore; }
    public String getWinner() { return winner; }
    public Double getHomePrice() { return homePrice; }
    public Double getAwayPrice() { return awayPrice; }
    public boolean isLocked() { return locked; }
}
