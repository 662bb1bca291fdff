package com.kickoff.tipping.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kickoff.tipping.dto.FixtureCandidate;

import java.util.List;
import java.util.Map;

/**
 * Result of one adapter call: the raw events as received, the events that survived normalization,
 * and adapter-specific details (remaining credits, windows tried, warnings).
 */
public record SourcePull(String source, List<JsonNode> events, List<FixtureCandidate> fixtures, Map<String, Object> details) {

    public static SourcePull failed(String source, String error) {
        return new SourcePull(source, List.of(), List.of(), Map.of("error", error == null ? "unknown error" : error));
    }

    public boolean isFailed() {
        return details != null && details.containsKey("error");
    }
}
