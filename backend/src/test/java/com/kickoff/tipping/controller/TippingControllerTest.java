package com.kickoff.tipping.controller;

import com.kickoff.tipping.model.Fixture;
import com.kickoff.tipping.service.LadderPredictionService;
import com.kickoff.tipping.service.RoundService;
import com.kickoff.tipping.service.SeasonClock;
import com.kickoff.tipping.service.TipService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.http.MediaType;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.List;
import java.util.Map;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyList;
import static org.mockito.ArgumentMatchers.anyLong;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.lenient;
import static org.mockito.Mockito.verifyNoInteractions;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.put;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = TippingController.class)
@ActiveProfiles("test")
class TippingControllerTest {

    private static final Instant NOW = Instant.parse("2025-03-20T00:00:00Z");

    @Autowired private MockMvc mockMvc;
    @MockBean private RoundService roundService;
    @MockBean private TipService tipService;
    @MockBean private LadderPredictionService predictionService;
    @MockBean private SeasonClock clock;

    @BeforeEach
    void setUp() {
        lenient().when(clock.resolveSeason(any())).thenReturn(2025);
        lenient().when(clock.now()).thenReturn(NOW);
    }

    @Test
    void roundFixturesCarryLockFlags() throws Exception {
        Fixture played = new Fixture("e1", Instant.parse("2025-03-06T09:00:00Z"), "Melbourne Storm", "Penrith Panthers");
        played.setId(11L);
        played.setRoundNumber(1);
        when(roundService.roundFixtures(1, 2025)).thenReturn(List.of(played));
        when(roundService.isRoundLocked(anyList(), eq(NOW))).thenReturn(true);
        when(roundService.isFixtureLocked(played, NOW)).thenReturn(true);

        mockMvc.perform(get("/api/tipping/rounds/1/fixtures"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.roundNumber").value(1))
                .andExpect(jsonPath("$.roundLocked").value(true))
                .andExpect(jsonPath("$.fixtures[0].id").value(11))
                .andExpect(jsonPath("$.fixtures[0].locked").value(true))
                .andExpect(jsonPath("$.fixtures[0].rawPayload").doesNotExist());
    }

    @Test
    void submitTipsPassesPicksThrough() throws Exception {
        when(tipService.submitTips(eq(7L), eq(2025), eq(3), eq(Map.of(11L, "Melbourne Storm")), eq(NOW)))
                .thenReturn(new TipService.SubmitResult(1, 0, 0));

        mockMvc.perform(post("/api/tipping/users/7/rounds/3/tips")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"11\":\"Melbourne Storm\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.saved").value(1))
                .andExpect(jsonPath("$.blocked").value(0));
    }

    @Test
    void closedPredictionWindowIsConflict() throws Exception {
        when(predictionService.savePrediction(eq(7L), eq(2025), anyList(), eq(NOW)))
                .thenThrow(new IllegalStateException("Ladder predictions for 2025 are closed"));

        mockMvc.perform(put("/api/tipping/users/7/ladder-prediction")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"teams\":[\"Storm\",\"Panthers\"]}"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.error").value("Ladder predictions for 2025 are closed"));
    }

    @Test
    void unknownDirectionIsBadRequest() throws Exception {
        mockMvc.perform(post("/api/tipping/users/7/ladder-prediction/adjustments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"round\":2,\"team\":\"Storm\",\"direction\":\"sideways\"}"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.error").value("direction must be up or down"));
        verifyNoInteractions(predictionService);
    }

    @Test
    void adjustmentReturnsNewOrder() throws Exception {
        when(predictionService.adjust(anyLong(), eq(2025), eq(2), eq("Panthers"), any(), eq(NOW)))
                .thenReturn(List.of("Panthers", "Storm"));

        mockMvc.perform(post("/api/tipping/users/7/ladder-prediction/adjustments")
                        .contentType(MediaType.APPLICATION_JSON)
                        .content("{\"round\":2,\"team\":\"Panthers\",\"direction\":\"up\"}"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.teams[0]").value("Panthers"));
    }
}
