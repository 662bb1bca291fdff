package com.kickoff.tipping.dto;

public class LadderStandingDTO {
    private int position;
    private String team;
    private int played;
    private int won;
    private int drawn;
    private int lost;
    private int pointsFor;
    private int pointsAgainst;
    private int pointDiff;
    private int compPoints;
    private String logoUrl;

    public LadderStandingDTO() {}

    public LadderStandingDTO(int position, String team, int played, int won, int drawn, int lost,
                             int pointsFor, int pointsAgainst, int pointDiff, int compPoints, String logoUrl) {
        this.position = position;
        this.team = team;
        this.played = played;
        this.won = won;
        this.drawn = drawn;
        this.lost = lost;
        this.pointsFor = pointsFor;
        this.pointsAgainst = pointsAgainst;
        this.pointDiff = pointDiff;
        this.compPoints = compPoints;
        this.logoUrl = logoUrl;
    }

    public int getPosition() { return position; }
    public void setPosition(int position) { this.position = position; }

    public String getTeam() { return team; }
    public void setTeam(String team) { this.team = team; }

    public int getPlayed() { return played; }
    public void setPlayed(int played) { this.played = played; }

    public int getWon() { return won; }
    public void setWon(int won) { this.won = won; }

    public int getDrawn() { return drawn; }
    public void setDrawn(int drawn) { this.drawn = drawn; }

    public int getLost() { return lost; }
    public void setLost(int lost) { this.lost = lost; }

    public int getPointsFor() { return pointsFor; }
    public void setPointsFor(int pointsFor) { this.pointsFor = pointsFor; }

    public int getPointsAgainst() { return pointsAgainst; }
    public void setPointsAgainst(int pointsAgainst) { this.pointsAgainst = pointsAgainst; }

    public int getPointDiff() { return pointDiff; }
    public void setPointDiff(int pointDiff) { this.pointDiff = pointDiff; }

    public int getCompPoints() { return compPoints; }
    public void setCompPoints(int compPoints) { this.compPoints = compPoints; }

    public String getLogoUrl() { return logoUrl; }
    public void setLogoUrl(String logoUrl) { this.logoUrl = logoUrl; }
}
