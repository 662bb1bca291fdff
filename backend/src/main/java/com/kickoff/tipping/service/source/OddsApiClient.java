package com.kickoff.tipping.service.source;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.kickoff.tipping.service.SyncConfigurationException;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.beans.factory.annotation.Qualifier;
import org.springframework.beans.factory.annotation.Value;
import org.springframework.http.HttpEntity;
import org.springframework.http.HttpHeaders;
import org.springframework.http.HttpMethod;
import org.springframework.http.MediaType;
import org.springframework.http.ResponseEntity;
import org.springframework.stereotype.Component;
import org.springframework.web.client.HttpStatusCodeException;
import org.springframework.web.client.ResourceAccessException;
import org.springframework.web.client.RestTemplate;
import org.springframework.web.util.UriComponentsBuilder;

import java.io.IOException;
import java.net.URI;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Thin GET client for the odds/results API. Adds the API key, surfaces HTTP failures as
 * {@link SourceFetchException} with the status and the first 300 characters of the body.
 */
@Component
public class OddsApiClient {
    private static final Logger log = LoggerFactory.getLogger(OddsApiClient.class);

    static final String SOURCE_NAME = "Odds API";
    static final String REMAINING_HEADER = "x-requests-remaining";

    private final RestTemplate restTemplate;
    private final ObjectMapper objectMapper;
    private final String baseUrl;
    private final String apiKey;
    private final String sportKey;
    private final String region;

    @Autowired
    public OddsApiClient(@Qualifier("sourceRestTemplate") RestTemplate restTemplate,
                         ObjectMapper objectMapper,
                         @Value("${tipping.odds-api.base-url:https://api.the-odds-api.com/v4}") String baseUrl,
                         @Value("${tipping.odds-api.key:}") String apiKey,
                         @Value("${tipping.odds-api.sport-key:rugbyleague_nrl}") String sportKey,
                         @Value("${tipping.odds-api.region:au}") String region) {
        this.restTemplate = restTemplate;
        this.objectMapper = objectMapper;
        this.baseUrl = baseUrl;
        this.apiKey = apiKey;
        this.sportKey = sportKey;
        this.region = region;
    }

    public record ApiResponse(JsonNode body, String remainingCredits) {}

    public String getSportKey() { return sportKey; }

    public String getRegion() { return region; }

    public boolean hasApiKey() {
        return apiKey != null && !apiKey.isBlank();
    }

    public void requireApiKey() {
        if (!hasApiKey()) {
            throw new SyncConfigurationException("Odds API key not configured. Set ODDS_API_KEY (tipping.odds-api.key).");
        }
    }

    /** Base h2h/decimal/iso query used by the odds endpoints. */
    public Map<String, Object> oddsParams() {
        Map<String, Object> params = new LinkedHashMap<>();
        params.put("regions", region);
        params.put("markets", "h2h");
        params.put("oddsFormat", "decimal");
        params.put("dateFormat", "iso");
        return params;
    }

    public ApiResponse get(String path, Map<String, Object> params) {
        requireApiKey();
        URI uri = buildUri(path, params);
        log.debug("[ODDS_API] GET {}{} params={}", baseUrl, path, params.keySet());
        HttpHeaders headers = new HttpHeaders();
        headers.setAccept(List.of(MediaType.APPLICATION_JSON));
        ResponseEntity<String> entity;
        try {
            entity = restTemplate.exchange(uri, HttpMethod.GET, new HttpEntity<>(headers), String.class);
        } catch (HttpStatusCodeException ex) {
            throw new SourceFetchException(SOURCE_NAME, ex.getStatusCode().value(), ex.getResponseBodyAsString());
        } catch (ResourceAccessException ex) {
            throw new SourceFetchException(SOURCE_NAME, ex.getMessage(), ex);
        }
        String remaining = entity.getHeaders().getFirst(REMAINING_HEADER);
        String body = entity.getBody();
        if (body == null || body.isBlank()) {
            return new ApiResponse(objectMapper.createArrayNode(), remaining);
        }
        try {
            return new ApiResponse(objectMapper.readTree(body), remaining);
        } catch (IOException ex) {
            throw new SourceFetchException(SOURCE_NAME, entity.getStatusCode().value(), "Unreadable JSON: " + body);
        }
    }

    URI buildUri(String path, Map<String, Object> params) {
        UriComponentsBuilder b = UriComponentsBuilder.fromHttpUrl(baseUrl + path).queryParam("apiKey", apiKey);
        params.forEach(b::queryParam);
        return b.encode().build().toUri();
    }
}
