package com.sqlrecall.controller;

import com.sqlrecall.model.dto.CacheStatistics;
import com.sqlrecall.model.dto.DailyStatisticSummary;
import com.sqlrecall.model.dto.MaintenanceReport;
import com.sqlrecall.service.CacheMaintenanceService;
import com.sqlrecall.service.QueryCacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.LocalDate;
import java.util.List;

import static org.mockito.Mockito.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.post;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class CacheControllerTest {

    private QueryCacheService cacheService;
    private CacheMaintenanceService maintenanceService;
    private MockMvc mockMvc;

    @BeforeEach
    void setUp() {
        cacheService = mock(QueryCacheService.class);
        maintenanceService = mock(CacheMaintenanceService.class);
        when(cacheService.isAvailable()).thenReturn(true);
        mockMvc = MockMvcBuilders.standaloneSetup(new CacheController(cacheService, maintenanceService)).build();
    }

    @Test
    void testStatsReturnsAggregatesAndTodaysCounters() throws Exception {
        when(cacheService.getStatistics()).thenReturn(CacheStatistics.builder()
                .totalEntries(12)
                .totalSizeBytes(2048)
                .date(LocalDate.of(2026, 3, 2))
                .todayHits(3)
                .todayMisses(1)
                .todayTotal(4)
                .todayHitRate(0.75)
                .apiCallsSaved(3)
                .build());

        mockMvc.perform(get("/v1/cache/stats"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.totalEntries").value(12))
                .andExpect(jsonPath("$.todayHitRate").value(0.75))
                .andExpect(jsonPath("$.date").value("2026-03-02"));
    }

    @Test
    void testDailyStatsClampsRequestedDays() throws Exception {
        when(cacheService.getDailyHistory(anyInt())).thenReturn(List.of(DailyStatisticSummary.builder()
                .date(LocalDate.of(2026, 3, 2))
                .hits(5)
                .build()));

        mockMvc.perform(get("/v1/cache/stats/daily").param("days", "1000"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$[0].hits").value(5));
        mockMvc.perform(get("/v1/cache/stats/daily").param("days", "0"))
                .andExpect(status().isOk());
        mockMvc.perform(get("/v1/cache/stats/daily"))
                .andExpect(status().isOk());

        verify(cacheService).getDailyHistory(365);
        verify(cacheService).getDailyHistory(1);
        verify(cacheService).getDailyHistory(7);
    }

    @Test
    void testClearReportsRemovedCount() throws Exception {
        when(cacheService.clearAll()).thenReturn(4);

        mockMvc.perform(post("/v1/cache/clear"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("success"))
                .andExpect(jsonPath("$.removed").value(4));
    }

    @Test
    void testClearExpiredReportsRemovedCount() throws Exception {
        when(cacheService.clearExpired()).thenReturn(2);

        mockMvc.perform(post("/v1/cache/clear-expired"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.removed").value(2));
    }

    @Test
    void testClearReturnsServiceUnavailableWithoutCache() throws Exception {
        when(cacheService.isAvailable()).thenReturn(false);

        mockMvc.perform(post("/v1/cache/clear"))
                .andExpect(status().isServiceUnavailable())
                .andExpect(jsonPath("$.status").value("unavailable"))
                .andExpect(jsonPath("$.removed").value(0));
        verify(cacheService, never()).clearAll();
    }

    @Test
    void testMaintenanceReturnsSweepReport() throws Exception {
        when(maintenanceService.runMaintenance()).thenReturn(MaintenanceReport.builder()
                .invalidated(2)
                .expiredRemoved(1)
                .invalidRemoved(2)
                .build());

        mockMvc.perform(post("/v1/cache/maintenance"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.invalidated").value(2))
                .andExpect(jsonPath("$.expiredRemoved").value(1))
                .andExpect(jsonPath("$.invalidRemoved").value(2));
    }

    @Test
    void testMaintenanceReturnsServiceUnavailableWithoutCache() throws Exception {
        when(cacheService.isAvailable()).thenReturn(false);

        mockMvc.perform(post("/v1/cache/maintenance"))
                .andExpect(status().isServiceUnavailable());
        verifyNoInteractions(maintenanceService);
    }
}
