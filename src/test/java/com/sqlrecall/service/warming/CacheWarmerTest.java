package com.sqlrecall.service.warming;

import com.sqlrecall.config.SqlRecallProperties;
import com.sqlrecall.model.CacheLookup;
import com.sqlrecall.model.CachedQueryResult;
import com.sqlrecall.model.dto.WarmingReport;
import com.sqlrecall.service.QueryCacheService;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.springframework.beans.factory.ObjectProvider;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyDouble;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.ArgumentMatchers.eq;
import static org.mockito.Mockito.*;

class CacheWarmerTest {

    private static final String MODEL = "modelA";

    private QueryCacheService cacheService;
    private ObjectProvider<QuestionAnswerer> answererProvider;
    private QuestionAnswerer answerer;
    private SqlRecallProperties properties;
    private CacheWarmer warmer;

    @BeforeEach
    @SuppressWarnings("unchecked")
    void setUp() {
        cacheService = mock(QueryCacheService.class);
        answererProvider = mock(ObjectProvider.class);
        answerer = mock(QuestionAnswerer.class);
        properties = new SqlRecallProperties();
        properties.getWarming().setModel(MODEL);
        properties.getWarming().setQuestions(List.of(
                "Show me all customers",
                "Top 5 products by revenue",
                "Monthly sales chart",
                "Orders by status"));

        when(cacheService.isAvailable()).thenReturn(true);
        when(answererProvider.getIfAvailable()).thenReturn(answerer);
        when(cacheService.get(anyString(), eq(MODEL))).thenReturn(CacheLookup.miss("key"));
        when(cacheService.set(anyString(), eq(MODEL), any(), any(), any(), anyDouble())).thenReturn(true);
        when(answerer.answer(anyString(), eq(MODEL))).thenAnswer(invocation -> AnsweredQuestion.builder()
                .sqlQuery("SELECT 1")
                .answer("Answer to " + invocation.getArgument(0))
                .build());

        warmer = new CacheWarmer(cacheService, answererProvider, properties);
    }

    @Test
    void testWarmCachesEveryQuestionNotAlreadyCached() {
        when(cacheService.get("Show me all customers", MODEL))
                .thenReturn(CacheLookup.hit("key", CachedQueryResult.builder().build()));

        WarmingReport report = warmer.warm(null);

        assertTrue(report.isSuccess());
        assertEquals(4, report.getTotalQuestions());
        assertEquals(1, report.getSkippedCount());
        assertEquals(3, report.getCachedCount());
        verify(answerer, never()).answer(eq("Show me all customers"), anyString());
        verify(cacheService).set("Top 5 products by revenue", MODEL, "SELECT 1",
                "Answer to Top 5 products by revenue", null, 0);
    }

    @Test
    void testWarmCountsRejectedAndFailedQuestions() {
        when(cacheService.set(eq("Monthly sales chart"), eq(MODEL), any(), any(), any(), anyDouble()))
                .thenReturn(false);
        when(answerer.answer("Orders by status", MODEL)).thenThrow(new IllegalStateException("LLM timeout"));

        WarmingReport report = warmer.warm(null);

        assertTrue(report.isSuccess());
        assertEquals(2, report.getCachedCount());
        assertEquals(1, report.getRejectedCount());
        assertEquals(1, report.getFailedCount());
    }

    @Test
    void testWarmUsesDefaultAnswerWhenNoneGenerated() {
        when(answerer.answer("Show me all customers", MODEL))
                .thenReturn(AnsweredQuestion.builder().sqlQuery("SELECT * FROM customers").build());

        warmer.warm(1);

        verify(cacheService).set("Show me all customers", MODEL, "SELECT * FROM customers",
                "Query executed successfully.", null, 0);
    }

    @Test
    void testWarmHonoursQuestionLimit() {
        WarmingReport report = warmer.warm(2);

        assertEquals(2, report.getTotalQuestions());
        verify(answerer, times(2)).answer(anyString(), eq(MODEL));
    }

    @Test
    void testWarmDoesNotRunWithoutCache() {
        when(cacheService.isAvailable()).thenReturn(false);

        WarmingReport report = warmer.warm(null);

        assertFalse(report.isSuccess());
        assertEquals("Cache not available", report.getReason());
        verifyNoInteractions(answerer);
    }

    @Test
    void testWarmDoesNotRunWithoutAnswerer() {
        when(answererProvider.getIfAvailable()).thenReturn(null);

        WarmingReport report = warmer.warm(null);

        assertFalse(report.isSuccess());
        assertEquals("No question answerer registered", report.getReason());
    }

    @Test
    void testWarmDoesNotRunWithoutModel() {
        properties.getWarming().setModel(" ");

        assertEquals("No warming model configured", warmer.warm(null).getReason());
    }

    @Test
    void testOnStartupSkipsWhenDisabled() {
        warmer.onStartup();

        verifyNoInteractions(answerer);
        verify(cacheService, never()).isAvailable();
    }
}
