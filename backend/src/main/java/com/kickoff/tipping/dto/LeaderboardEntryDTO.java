package com.kickoff.tipping.dto;

import java.util.LinkedHashMap;
import java.util.Map;

public class LeaderboardEntryDTO {
    private Long userId;
    private String displayName;
    private int tipsMade;
    private int correctTips;
    private int totalPoints;
    // round number -> points, every requested round present
    private Map<Integer, Integer> roundPoints = new LinkedHashMap<>();

    public LeaderboardEntryDTO() {}

    public LeaderboardEntryDTO(Long userId, String displayName, int tipsMade, int correctTips, int totalPoints) {
        this.userId = userId;
        this.displayName = displayName;
        this.tipsMade = tipsMade;
        this.correctTips = correctTips;
        this.totalPoints = totalPoints;
    }

    public Long getUserId() { return userId; }
    public void setUserId(Long userId) { this.userId = userId; }

    public String getDisplayName() { return displayName; }
    public void setDisplayName(String displayName) { this.displayName = displayName; }

    public int getTipsMade() { return tipsMade; }
    public void setTipsMade(int tipsMade) { this.tipsMade = tipsMade; }

    public int getCorrectTips() { return correctTips; }
    public void setCorrectTips(int correctTips) { this.correctTips = correctTips; }

    public int getTotalPoints() { return totalPoints; }
    public void setTotalPoints(int totalPoints) { this.totalPoints = totalPoints; }

    public Map<Integer, Integer> getRoundPoints() { return roundPoints; }
    public void setRoundPoints(Map<Integer, Integer> roundPoints) { this.roundPoints = roundPoints; }
}
