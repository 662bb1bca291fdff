package com.kickoff.tipping.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Service
public class UpcomingOddsSource {
    private static final Logger log = LoggerFactory.getLogger(UpcomingOddsSource.class);

    public static final String SOURCE = "upcoming_odds";

    private final OddsApiClient client;

    public UpcomingOddsSource(OddsApiClient client) {
        this.client = client;
    }

    public SourcePull fetch() {
        OddsApiClient.ApiResponse resp = client.get("/sports/" + client.getSportKey() + "/odds/", client.oddsParams());
        List<JsonNode> events = OddsEventNormalizer.extractEvents(resp.body());
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("remaining_credits", resp.remainingCredits());
        details.put("source_endpoint", "odds");
        log.info("[SYNC] upcoming odds events={} remaining={}", events.size(), resp.remainingCredits());
        return new SourcePull(SOURCE, events, OddsEventNormalizer.normalizeAll(SOURCE, events), details);
    }
}
