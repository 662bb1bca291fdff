package com.kickoff.tipping.service.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.time.Instant;
import java.util.LinkedHashMap;
import java.util.List;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class HistoricalOddsSourceTest {

    private static final String PRIMARY = "/sports/rugbyleague_nrl/odds-history/";
    private static final String ALTERNATE = "/historical/sports/rugbyleague_nrl/odds/";

    @Mock private OddsApiClient client;

    private HistoricalOddsSource source;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        source = new HistoricalOddsSource(client);
    }

    @Test
    void weeklySnapshotsCoverMarchToOctober() {
        List<Instant> dates = HistoricalOddsSource.snapshotDates(2025);

        assertThat(dates).hasSize(35);
        assertThat(dates.get(0)).isEqualTo(Instant.parse("2025-03-01T12:00:00Z"));
        assertThat(dates.get(34)).isEqualTo(Instant.parse("2025-10-25T12:00:00Z"));
    }

    @Test
    void notFoundFallsBackToAlternatePath() throws Exception {
        when(client.getSportKey()).thenReturn("rugbyleague_nrl");
        when(client.oddsParams()).thenAnswer(inv -> new LinkedHashMap<String, Object>());
        when(client.get(eq(PRIMARY), anyMap())).thenThrow(new SourceFetchException("Odds API", 404, "not found"));
        when(client.get(eq(ALTERNATE), anyMap())).thenReturn(new OddsApiClient.ApiResponse(mapper.readTree(
                "{\"timestamp\":\"2025-03-01T12:00:00Z\",\"data\":[{\"id\":\"h1\",\"commence_time\":\"2025-03-06T09:00:00Z\"," +
                        "\"home_team\":\"Storm\",\"away_team\":\"Panthers\"}]}"), "100"));

        SourcePull pull = source.fetch(2025);

        assertThat(pull.events()).hasSize(35);
        assertThat(pull.fixtures()).extracting(c -> c.getSourceEventId()).containsOnly("h1");
        assertThat(pull.details()).containsEntry("attempted_snapshots", 35).containsEntry("successful_snapshots", 35)
                .containsEntry("candidate_endpoints", List.of(PRIMARY, ALTERNATE));
    }

    @Test
    void nonNotFoundErrorsStopTheRun() {
        when(client.getSportKey()).thenReturn("rugbyleague_nrl");
        when(client.oddsParams()).thenAnswer(inv -> new LinkedHashMap<String, Object>());
        when(client.get(eq(PRIMARY), anyMap())).thenThrow(new SourceFetchException("Odds API", 401, "unauthorized"));

        assertThatThrownBy(() -> source.fetch(2025)).isInstanceOf(SourceFetchException.class);
    }
}
