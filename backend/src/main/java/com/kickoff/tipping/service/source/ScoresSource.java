package com.kickoff.tipping.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;

/**
 * Recent results. The upstream only accepts some days-back values, so a rejected window is retried
 * with progressively smaller ones; if all are rejected the pull is empty with a warning.
 */
@Service
public class ScoresSource {
    private static final Logger log = LoggerFactory.getLogger(ScoresSource.class);

    public static final String SOURCE = "scores";
    static final int[] FALLBACK_WINDOWS = {30, 14, 7, 3, 1};
    static final String INVALID_DAYS_CODE = "INVALID_SCORES_DAYS_FROM";

    private final OddsApiClient client;

    public ScoresSource(OddsApiClient client) {
        this.client = client;
    }

    public SourcePull fetch(int daysBack) {
        int requested = Math.max(1, daysBack);
        List<Integer> windows = windowsFor(requested);
        SourceFetchException lastError = null;
        for (Integer window : windows) {
            Map<String, Object> params = new LinkedHashMap<>();
            params.put("daysFrom", window);
            params.put("dateFormat", "iso");
            try {
                OddsApiClient.ApiResponse resp = client.get("/sports/" + client.getSportKey() + "/scores/", params);
                List<JsonNode> events = OddsEventNormalizer.extractEvents(resp.body());
                Map<String, Object> details = new LinkedHashMap<>();
                details.put("remaining_credits", resp.remainingCredits());
                details.put("days_back_requested", requested);
                details.put("days_back_used", window);
                details.put("source_endpoint", "scores");
                return new SourcePull(SOURCE, events, OddsEventNormalizer.normalizeAll(SOURCE, events), details);
            } catch (SourceFetchException ex) {
                if (!isRejectedWindow(ex)) throw ex;
                lastError = ex;
                log.debug("[SCORES] daysFrom={} rejected: {}", window, ex.getMessage());
            }
        }
        String warning = "Scores endpoint unavailable for requested daysFrom values. Tried " + windows
                + ". Last error: " + (lastError == null ? "none" : lastError.getMessage());
        log.warn("[SCORES] {}", warning);
        Map<String, Object> details = new LinkedHashMap<>();
        details.put("source_endpoint", "scores");
        details.put("days_back_requested", requested);
        details.put("days_back_used", null);
        details.put("warning", warning);
        return new SourcePull(SOURCE, List.of(), List.of(), details);
    }

    /** Requested value first, then the fixed fallbacks, without repeats. */
    static List<Integer> windowsFor(int requested) {
        LinkedHashSet<Integer> set = new LinkedHashSet<>();
        set.add(requested);
        for (int w : FALLBACK_WINDOWS) set.add(w);
        return new ArrayList<>(set);
    }

    private static boolean isRejectedWindow(SourceFetchException ex) {
        return ex.getStatusCode() == 422 || (ex.getMessage() != null && ex.getMessage().contains(INVALID_DAYS_CODE));
    }
}
