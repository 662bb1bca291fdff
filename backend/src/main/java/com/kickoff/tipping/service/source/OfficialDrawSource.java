package com.kickoff.tipping.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.jsoup.Jsoup;
import org.jsoup.nodes.Document;
import org.jsoup.nodes.Element;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.stereotype.Service;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.TreeSet;

/**
 * Scrapes the official competition draw. Each round page embeds its data as JSON in the
 * {@code q-data} attribute of {@code #vue-draw}; the first round's blob also lists the valid rounds.
 */
@Service
public class OfficialDrawSource {
    private static final Logger log = LoggerFactory.getLogger(OfficialDrawSource.class);

    static final String SOURCE_NAME = "Official draw";
    static final String PREMIERSHIP_PATH = "/draw/nrl-premiership/";
    private static final String[] BADGE_FILES = {"badge.svg", "badge-light.svg", "badge.png", "badge-light.png"};

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String drawUrl;
    private final int competitionId;
    private final int maxRound;
    private final String logoBaseUrl;

    @Autowired
    public OfficialDrawSource(@Qualifier("sourceRestTemplate") RestTemplate restTemplate,
                              ObjectMapper objectMapper,
                              @Value("${tipping.draw.base-url:https://www.nrl.com/draw/}") String drawUrl,
                              @Value("${tipping.draw.competition-id:111}") int competitionId,
                              @Value("${tipping.draw.max-round:27}") int maxRound,
                              @Value("${tipping.draw.logo-base-url:https://www.nrl.com/.theme/}") String logoBaseUrl) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.drawUrl = drawUrl;
        this.competitionId = competitionId;
        this.maxRound = maxRound;
        this.logoBaseUrl = logoBaseUrl.endsWith("/") ? logoBaseUrl : logoBaseUrl + "/";
    }

    public int getMaxRound() { return maxRound; }

    /** All premiership matches for the season. Network failures propagate as {@link SourceFetchException}. */
    public List<DrawFixture> fetchSeason(int seasonYear) {
        JsonNode first = fetchRound(seasonYear, 1);
        List<Integer> rounds = discoverRounds(first);
        Map<Integer, JsonNode> pages = new HashMap<>();
        pages.put(1, first);

        List<DrawFixture> out = new ArrayList<>();
        for (Integer round : rounds) {
            JsonNode data = pages.computeIfAbsent(round, r -> fetchRound(seasonYear, r));
            out.addAll(parseFixtures(data, round));
        }
        log.info("[DRAW] season={} rounds={} fixtures={}", seasonYear, rounds.size(), out.size());
        return out;
    }

    /**
     * Rounds listed in the first page's {@code filterRounds}. A page without that list yields round 1
     * only; a list whose values all fall outside 1..max yields every round.
     */
    List<Integer> discoverRounds(JsonNode firstRound) {
        List<Integer> listed = new ArrayList<>();
        for (JsonNode item : firstRound.path("filterRounds")) {
            JsonNode value = item.path("value");
            if (value.isInt()) listed.add(value.asInt());
        }
        if (listed.isEmpty()) return List.of(1);

        TreeSet<Integer> found = new TreeSet<>();
        for (int v : listed) {
            if (v >= 1 && v <= maxRound) found.add(v);
        }
        if (found.isEmpty()) {
            for (int r = 1; r <= maxRound; r++) found.add(r);
        }
        return new ArrayList<>(found);
    }

    List<DrawFixture> parseFixtures(JsonNode data, int roundNumber) {
        List<DrawFixture> out = new ArrayList<>();
        for (JsonNode fixture : data.path("fixtures")) {
            if (!fixture.isObject()) continue;
            if (!"Match".equals(fixture.path("type").asText(null))) continue;
            String matchCentreUrl = fixture.path("matchCentreUrl").asText("");
            if (!matchCentreUrl.contains(PREMIERSHIP_PATH)) continue;
            String kickoffText = fixture.path("clock").path("kickOffTimeLong").asText("");
            Instant kickoff = OddsEventNormalizer.parseInstant(kickoffText);
            if (kickoff == null) continue;
            JsonNode home = fixture.path("homeTeam");
            JsonNode away = fixture.path("awayTeam");
            out.add(new DrawFixture(
                    roundNumber,
                    home.path("nickName").asText(""),
                    away.path("nickName").asText(""),
                    kickoff,
                    kickoffText,
                    blankToNull(fixture.path("venue").asText("")),
                    blankToNull(fixture.path("venueCity").asText("")),
                    themeLogoUrl(home.path("theme")),
                    themeLogoUrl(away.path("theme")),
                    matchCentreUrl));
        }
        return out;
    }

    String themeLogoUrl(JsonNode theme) {
        String key = theme.path("key").asText("");
        JsonNode logos = theme.path("logos");
        if (key.isEmpty() || !logos.isObject()) return null;
        for (String file : BADGE_FILES) {
            String bust = logos.path(file).asText("");
            if (!bust.isEmpty()) {
                return logoBaseUrl + key + "/" + file + "?bust=" + bust;
            }
        }
        return null;
    }

    JsonNode fetchRound(int seasonYear, int roundNumber) {
        URI uri = UriComponentsBuilder.fromHttpUrl(drawUrl)
                .queryParam("competition", competitionId)
                .queryParam("round", roundNumber)
                .queryParam("season", seasonYear)
                .build().toUri();
        String html;
        try {
            html = restTemplate.getForObject(uri, String.class);
        } catch (HttpStatusCodeException ex) {
            throw new SourceFetchException(SOURCE_NAME, ex.getStatusCode().value(), ex.getResponseBodyAsString());
        } catch (ResourceAccessException ex) {
            throw new SourceFetchException(SOURCE_NAME, ex.getMessage(), ex);
        }
        return extractDrawData(html);
    }

    /** JSON blob from {@code #vue-draw[q-data]}; an empty object when absent or malformed. */
    JsonNode extractDrawData(String html) {
        if (html == null || html.isBlank()) return objectMapper.createObjectNode();
        Document doc = Jsoup.parse(html);
        Element el = doc.getElementById("vue-draw");
        if (el == null || !el.hasAttr("q-data")) return objectMapper.createObjectNode();
        try {
            JsonNode parsed = objectMapper.readTree(el.attr("q-data"));
            return parsed != null && parsed.isObject() ? parsed : objectMapper.createObjectNode();
        } catch (IOException ex) {
            log.debug("[DRAW] malformed q-data: {}", ex.getMessage());
            return objectMapper.createObjectNode();
        }
    }

    private static String blankToNull(String s) {
        if (s == null) return null;
        String t = s.trim();
        return t.isEmpty() ? null : t;
    }
}
