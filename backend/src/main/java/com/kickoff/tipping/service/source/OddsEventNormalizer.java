package com.kickoff.tipping.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.kickoff.tipping.dto.FixtureCandidate;
import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.model.FixtureStatus;

import java.time.Instant;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;

/**
 * Turns odds-API event objects into {@link FixtureCandidate}s. Events missing an id, either team
 * or a parseable kickoff are dropped (null), never reported as errors.
 */
public final class OddsEventNormalizer {

    private static final String[] EVENT_LIST_KEYS = {"data", "events", "odds"};
    private static final String[] VENUE_KEYS = {"stadium_name", "venue_name", "venue", "stadium"};
    private static final String[] CITY_KEYS = {"stadium_city", "venue_city", "city"};

    private OddsEventNormalizer() {}

    /** Events are either the payload itself (array) or an array under data/events/odds. */
    public static List<JsonNode> extractEvents(JsonNode payload) {
        List<JsonNode> out = new ArrayList<>();
        if (payload == null || payload.isNull() || payload.isMissingNode()) return out;
        JsonNode list = null;
        if (payload.isArray()) {
            list = payload;
        } else if (payload.isObject()) {
            for (String key : EVENT_LIST_KEYS) {
                if (payload.path(key).isArray()) {
                    list = payload.get(key);
                    break;
                }
            }
        }
        if (list == null) return out;
        for (JsonNode item : list) {
            if (item != null && item.isObject()) out.add(item);
        }
        return out;
    }

    public static List<FixtureCandidate> normalizeAll(String source, List<JsonNode> events) {
        List<FixtureCandidate> out = new ArrayList<>();
        for (JsonNode e : events) {
            FixtureCandidate c = normalize(source, e);
            if (c != null) out.add(c);
        }
        return out;
    }

    public static FixtureCandidate normalize(String source, JsonNode event) {
        if (event == null || !event.isObject()) return null;
        String id = text(event, "id");
        String home = text(event, "home_team");
        String away = text(event, "away_team");
        Instant kickoff = parseInstant(text(event, "commence_time"));
        if (id == null || home == null || away == null || kickoff == null) return null;

        FixtureCandidate c = new FixtureCandidate(id, source, kickoff, home, away);
        c.setSeasonYear(kickoff.atZone(ZoneOffset.UTC).getYear());

        double[] prices = extractH2hPrices(event, home, away);
        if (prices != null) {
            c.setHomePrice(prices[0]);
            c.setAwayPrice(prices[1]);
        }

        Score score = extractScores(event, home, away);
        String winner = null;
        if (score != null) {
            c.setHomeScore(score.home());
            c.setAwayScore(score.away());
            winner = score.winner();
        }
        boolean completed = event.path("completed").asBoolean(false) || winner != null;
        if (completed) {
            c.setStatus(FixtureStatus.COMPLETED);
            // final but not scorable: still marked so the result is not mistaken for pending
            c.setWinner(winner != null ? winner : Fixture.WINNER_UNKNOWN);
        } else {
            c.setStatus(FixtureStatus.SCHEDULED);
        }

        c.setVenueName(firstText(event, VENUE_KEYS));
        c.setVenueCity(firstText(event, CITY_KEYS));
        c.setRawPayload(event.toString());
        return c;
    }

    record Score(int home, int away, String winner) {}

    // First h2h market that prices both teams; a non-numeric price voids the pair
    static double[] extractH2hPrices(JsonNode event, String home, String away) {
        for (JsonNode bookmaker : event.path("bookmakers")) {
            for (JsonNode market : bookmaker.path("markets")) {
                if (!"h2h".equals(market.path("key").asText(null))) continue;
                Map<String, JsonNode> byName = new HashMap<>();
                for (JsonNode outcome : market.path("outcomes")) {
                    String name = outcome.path("name").asText(null);
                    if (name != null) byName.put(name, outcome.path("price"));
                }
                JsonNode hp = byName.get(home);
                JsonNode ap = byName.get(away);
                if (hp == null || ap == null || hp.isNull() || ap.isNull()) continue;
                Double h = asDouble(hp);
                Double a = asDouble(ap);
                if (h == null || a == null) return null;
                return new double[]{h, a};
            }
        }
        return null;
    }

    static Score extractScores(JsonNode event, String home, String away) {
        JsonNode scores = event.path("scores");
        if (!scores.isArray()) return null;
        Map<String, Integer> byName = new HashMap<>();
        for (JsonNode row : scores) {
            String name = row.path("name").asText(null);
            JsonNode value = row.path("score");
            if (name == null || value.isMissingNode() || value.isNull()) continue;
            Integer parsed = asInt(value);
            if (parsed != null) byName.put(name, parsed);
        }
        Integer hs = byName.get(home);
        Integer as = byName.get(away);
        if (hs == null || as == null) return null;
        String winner = hs > as ? home : (as > hs ? away : Fixture.WINNER_DRAW);
        return new Score(hs, as, winner);
    }

    /** ISO-8601 with offset or Z; a value without offset is read as UTC. Null when unparseable. */
    public static Instant parseInstant(String value) {
        if (value == null || value.isBlank()) return null;
        String v = value.trim();
        try {
            return OffsetDateTime.parse(v).toInstant();
        } catch (DateTimeParseException ignored) {
            // fall through to the offset-less form
        }
        try {
            return LocalDateTime.parse(v).toInstant(ZoneOffset.UTC);
        } catch (DateTimeParseException e) {
            return null;
        }
    }

    private static String text(JsonNode node, String field) {
        JsonNode v = node.get(field);
        if (v == null || v.isNull() || v.isContainerNode()) return null;
        String s = v.asText();
        return s.isEmpty() ? null : s;
    }

    private static String firstText(JsonNode node, String[] keys) {
        for (String k : keys) {
            String v = text(node, k);
            if (v != null && !v.isBlank()) return v.trim();
        }
        return null;
    }

    private static Double asDouble(JsonNode n) {
        if (n.isNumber()) return n.asDouble();
        try {
            return Double.parseDouble(n.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }

    private static Integer asInt(JsonNode n) {
        if (n.isIntegralNumber()) return n.asInt();
        try {
            return Integer.parseInt(n.asText().trim());
        } catch (NumberFormatException e) {
            return null;
        }
    }
}
