package com.kickoff.tipping.service.source;

import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.ArgumentCaptor;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;

import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.anyMap;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.times;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;

@ExtendWith(MockitoExtension.class)
class ScoresSourceTest {

    private static final String EVENTS = "[{\"id\":\"e1\",\"commence_time\":\"2025-03-06T09:00:00Z\",\"home_team\":\"Storm\",\"away_team\":\"Panthers\"," +
            "\"completed\":true,\"scores\":[{\"name\":\"Storm\",\"score\":\"30\"},{\"name\":\"Panthers\",\"score\":\"12\"}]}]";

    @Mock private OddsApiClient client;

    private ScoresSource source;
    private final ObjectMapper mapper = new ObjectMapper();

    @BeforeEach
    void setUp() {
        source = new ScoresSource(client);
        lenient().when(client.getSportKey()).thenReturn("rugbyleague_nrl");
    }

    @Test
    void windowsStartWithRequestedValueWithoutRepeats() {
        assertThat(ScoresSource.windowsFor(45)).containsExactly(45, 30, 14, 7, 3, 1);
        assertThat(ScoresSource.windowsFor(7)).containsExactly(7, 30, 14, 3, 1);
    }

    @Test
    @SuppressWarnings("unchecked")
    void fallsBackToSmallerWindowWhenRejected() throws Exception {
        when(client.get(eq("/sports/rugbyleague_nrl/scores/"), anyMap())).thenAnswer(inv -> {
            Map<String, Object> params = inv.getArgument(1);
            int days = (Integer) params.get("daysFrom");
            if (days > 3) throw new SourceFetchException("Odds API", 422, "{\"error_code\":\"INVALID_SCORES_DAYS_FROM\"}");
            return new OddsApiClient.ApiResponse(mapper.readTree(EVENTS), "470");
        });

        SourcePull pull = source.fetch(10);

        assertThat(pull.fixtures()).hasSize(1);
        assertThat(pull.fixtures().get(0).getWinner()).isEqualTo("Storm");
        assertThat(pull.details()).containsEntry("days_back_requested", 10).containsEntry("days_back_used", 3)
                .containsEntry("remaining_credits", "470");
        ArgumentCaptor<Map<String, Object>> captor = ArgumentCaptor.forClass(Map.class);
        verify(client, times(5)).get(anyString(), captor.capture());
        assertThat(captor.getAllValues()).extracting(m -> m.get("daysFrom")).containsExactly(10, 30, 14, 7, 3);
    }

    @Test
    void allWindowsRejectedGivesEmptyPullWithWarning() {
        when(client.get(anyString(), anyMap())).thenThrow(new SourceFetchException("Odds API", 400, "INVALID_SCORES_DAYS_FROM"));

        SourcePull pull = source.fetch(2);

        assertThat(pull.events()).isEmpty();
        assertThat(pull.isFailed()).isFalse();
        assertThat((String) pull.details().get("warning")).contains("[2, 30, 14, 7, 3, 1]");
    }

    @Test
    void otherErrorsPropagate() {
        when(client.get(anyString(), anyMap())).thenThrow(new SourceFetchException("Odds API", 401, "bad key"));

        assertThatThrownBy(() -> source.fetch(3)).isInstanceOf(SourceFetchException.class).hasMessageContaining("401");
    }
}
