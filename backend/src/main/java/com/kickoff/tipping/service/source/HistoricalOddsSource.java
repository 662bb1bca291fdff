package com.kickoff.tipping.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.time.ZoneOffset;
import java.time.ZonedDateTime;
import java.time.format.DateTimeFormatter;
import java.time.temporal.ChronoUnit;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Walks weekly odds snapshots across the regular season window (1 March to 1 November, exclusive)
 * so fixtures that have already dropped off the live odds feed still get prices.
 */
@Service
public class HistoricalOddsSource {
    private static final Logger log = LoggerFactory.getLogger(HistoricalOddsSource.class);

    public static final String SOURCE = "historical_odds";
    static final int START_MONTH = 3;
    static final int END_MONTH = 11;
    static final int STEP_DAYS = 7;
    private static final DateTimeFormatter SNAPSHOT_FORMAT = DateTimeFormatter.ofPattern("yyyy-MM-dd'T'HH:mm:ss'Z'");

    private final OddsApiClient client;

    public HistoricalOddsSource(OddsApiClient client) {
        this.client = client;
    }

    public SourcePull fetch(int seasonYear) {
        List<String> candidatePaths = List.of(
                "/sports/" + client.getSportKey() + "/odds-history/",
                "/historical/sports/" + client.getSportKey() + "/odds/");
        List<JsonNode> events = new ArrayList<>();
        List<String> triedEndpoints = new ArrayList<>();
        int attempted = 0;
        int successful = 0;

        for (Instant snapshot : snapshotDates(seasonYear)) {
            attempted++;
            JsonNode payload = null;
            for (String path : candidatePaths) {
                if (!triedEndpoints.contains(path)) triedEndpoints.add(path);
                Map<String, Object> params = client.oddsParams();
                params.put("date", SNAPSHOT_FORMAT.format(snapshot.atZone(ZoneOffset.UTC)));
                try {
                    payload = client.get(path, params).body();
                    break;
                } catch (SourceFetchException ex) {
                    // alternate path exists on some plans
                    if (ex.getStatusCode() != 404) throw ex;
                }
            }
            if (payload != null) {
                events.addAll(OddsEventNormalizer.extractEvents(payload));
                successful++;
            }
        }

        Map<String, Object> details = new LinkedHashMap<>();
        details.put("attempted_snapshots", attempted);
        details.put("successful_snapshots", successful);
        details.put("candidate_endpoints", triedEndpoints);
        details.put("step_days", STEP_DAYS);
        details.put("season_year", seasonYear);
        log.info("[SYNC] historical odds season={} snapshots={}/{} events={}", seasonYear, successful, attempted, events.size());
        return new SourcePull(SOURCE, events, OddsEventNormalizer.normalizeAll(SOURCE, events), details);
    }

    static List<Instant> snapshotDates(int seasonYear) {
        ZonedDateTime cursor = ZonedDateTime.of(seasonYear, START_MONTH, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        ZonedDateTime end = ZonedDateTime.of(seasonYear, END_MONTH, 1, 12, 0, 0, 0, ZoneOffset.UTC);
        List<Instant> out = new ArrayList<>();
        while (cursor.isBefore(end)) {
            out.add(cursor.toInstant());
            cursor = cursor.plus(STEP_DAYS, ChronoUnit.DAYS);
        }
        return out;
    }
}
