package com.kickoff.tipping.model;

public enum FixtureStatus {
    SCHEDULED,
    COMPLETED
}
