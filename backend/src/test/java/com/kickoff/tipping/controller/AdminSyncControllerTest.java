package com.kickoff.tipping.controller;

import com.kickoff.tipping.service.AutoTipService;
import com.kickoff.tipping.service.DrawReconciler;
import com.kickoff.tipping.service.FixtureSyncService;
import com.kickoff.tipping.service.RoundAssigner;
import com.kickoff.tipping.service.ScoreUpdateService;
import com.kickoff.tipping.service.SeasonClock;
import com.kickoff.tipping.service.SettingsService;
import com.kickoff.tipping.service.SyncBusyException;
import com.kickoff.tipping.service.SyncConfigurationException;
import com.kickoff.tipping.service.TipScoringService;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.annotation.Autowired;
import org.springframework.boot.test.autoconfigure.web.servlet.WebMvcTest;
import org.springframework.boot.test.mock.mockito.MockBean;
import org.springframework.test.context.ActiveProfiles;
import org.springframework.test.web.servlet.MockMvc;

import java.time.Instant;
import java.util.Map;
import java.util.Optional;

import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.ArgumentMatchers.isNull;
import static org.mockito.Mockito.never;
import static org.mockito.Mockito.verify;
import static org.mockito.Mockito.when;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

@WebMvcTest(controllers = AdminSyncController.class)
@ActiveProfiles("test")
class AdminSyncControllerTest {

    @Autowired private MockMvc mockMvc;
    @MockBean private FixtureSyncService syncService;
    @MockBean private ScoreUpdateService scoreUpdateService;
    @MockBean private AutoTipService autoTipService;
    @MockBean private TipScoringService scoringService;
    @MockBean private RoundAssigner roundAssigner;
    @MockBean private SettingsService settingsService;
    @MockBean private SeasonClock clock;

    @Test
    void syncReturnsSummary() throws Exception {
        FixtureSyncService.SyncSummary summary = new FixtureSyncService.SyncSummary(2025, 3, 1, 4, 0, 2, 5, 6,
                "data/nrl_season_2025.json", Map.of("upcoming_odds", 4),
                new DrawReconciler.DrawEnrichment(0, 0, 0, 0, null), Map.of());
        when(syncService.runFullSync(2025, 10, false)).thenReturn(summary);

        mockMvc.perform(post("/api/admin/sync").param("season", "2025").param("daysBack", "10").param("prune", "false"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.success").value(true))
                .andExpect(jsonPath("$.summary.seasonYear").value(2025))
                .andExpect(jsonPath("$.summary.inserted").value(3))
                .andExpect(jsonPath("$.summary.bySourceCounts.upcoming_odds").value(4));
    }

    @Test
    void missingKeyIsBadRequest() throws Exception {
        when(syncService.runFullSync(null, null, null)).thenThrow(new SyncConfigurationException("Odds API key is not configured"));

        mockMvc.perform(post("/api/admin/sync"))
                .andExpect(status().isBadRequest())
                .andExpect(jsonPath("$.success").value(false))
                .andExpect(jsonPath("$.error").value("Odds API key is not configured"));
    }

    @Test
    void concurrentSyncIsConflict() throws Exception {
        when(syncService.runFullSync(null, null, null)).thenThrow(new SyncBusyException("score-catch-up"));

        mockMvc.perform(post("/api/admin/sync"))
                .andExpect(status().isConflict())
                .andExpect(jsonPath("$.success").value(false));
    }

    @Test
    void allSourcesDownIsBadGateway() throws Exception {
        when(syncService.runFullSync(null, null, null))
                .thenThrow(new IllegalStateException("Sync failed, no required source succeeded"));

        mockMvc.perform(post("/api/admin/sync"))
                .andExpect(status().isBadGateway())
                .andExpect(jsonPath("$.error").value("Sync failed, no required source succeeded"));
    }

    @Test
    void autoTipsOnlyRescoreWhenSomethingWasAdded() throws Exception {
        Instant now = Instant.parse("2025-03-20T00:00:00Z");
        when(clock.resolveSeason(isNull())).thenReturn(2025);
        when(clock.now()).thenReturn(now);
        when(autoTipService.applyAutomaticTips(eq(2025), eq(3), isNull(), eq(false), any())).thenReturn(0);

        mockMvc.perform(post("/api/admin/auto-tips").param("round", "3"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.autoUnderdogTipsAdded").value(0))
                .andExpect(jsonPath("$.tipsRescored").value(0));
        verify(scoringService, never()).rescoreAll();
    }

    @Test
    void lastSyncReadsSettings() throws Exception {
        when(settingsService.get(SettingsService.LAST_SYNC_AT)).thenReturn(Optional.of("2025-03-20T11:00:00+11:00"));
        when(settingsService.get(SettingsService.LAST_SYNC_SUMMARY)).thenReturn(Optional.empty());

        mockMvc.perform(get("/api/admin/sync/last"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.lastSyncAt").value("2025-03-20T11:00:00+11:00"))
                .andExpect(jsonPath("$.lastSyncSummary").doesNotExist());
    }
}
