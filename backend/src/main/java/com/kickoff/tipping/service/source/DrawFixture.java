package com.kickoff.tipping.service.source;

import java.time.Instant;

/** One premiership match as listed on the official draw page. {@code kickoffText} is the value exactly as published. */
public record DrawFixture(int roundNumber,
                          String homeName,
                          String awayName,
                          Instant kickoff,
                          String kickoffText,
                          String venueName,
                          String venueCity,
                          String homeLogoUrl,
                          String awayLogoUrl,
                          String matchCentreUrl) {
}
