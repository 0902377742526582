package com.sqlrecall.service.warming;

import com.sqlrecall.config.SqlRecallProperties;
import com.sqlrecall.model.dto.WarmingReport;
import com.sqlrecall.service.QueryCacheService;
import lombok.extern.slf4j.Slf4j;
import org.springframework.beans.factory.ObjectProvider;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.annotation.Order;
import org.springframework.stereotype.Service;

import java.util.List;

/**
 * Pre-populates the cache with answers to the configured suggested questions.
 */
@Slf4j
@Service
public class CacheWarmer {

    private static final String DEFAULT_ANSWER = "Query executed successfully.";

    private final QueryCacheService cacheService;
    private final ObjectProvider<QuestionAnswerer> answererProvider;
    private final SqlRecallProperties properties;

    public CacheWarmer(QueryCacheService cacheService,
                       ObjectProvider<QuestionAnswerer> answererProvider,
                       SqlRecallProperties properties) {
        this.cacheService = cacheService;
        this.answererProvider = answererProvider;
        this.properties = properties;
    }

    @Order(10)
    @EventListener(ApplicationReadyEvent.class)
    public void onStartup() {
        if (!properties.getWarming().isEnabled()) {
            return;
        }
        WarmingReport report = warm(properties.getWarming().getMaxQuestions());
        if (!report.isSuccess()) {
            log.warn("Cache warming failed: {}", report.getReason());
        }
    }

    /**
     * Answer and cache every suggested question not already cached.
     *
     * @param maxQuestions maximum number of questions to process, null for all
     */
    public WarmingReport warm(Integer maxQuestions) {
        if (!cacheService.isAvailable()) {
            log.warn("Query cache not available - skipping cache warming");
            return WarmingReport.notRun("Cache not available");
        }
        QuestionAnswerer answerer = answererProvider.getIfAvailable();
        if (answerer == null) {
            return WarmingReport.notRun("No question answerer registered");
        }
        String model = properties.getWarming().getModel();
        if (model == null || model.isBlank()) {
            return WarmingReport.notRun("No warming model configured");
        }

        List<String> questions = properties.getWarming().getQuestions();
        if (maxQuestions != null && maxQuestions >= 0 && maxQuestions < questions.size()) {
            questions = questions.subList(0, maxQuestions);
        }

        log.info("Warming cache with {} suggested questions...", questions.size());
        long start = System.nanoTime();
        int cached = 0;
        int skipped = 0;
        int rejected = 0;
        int failed = 0;

        for (int i = 0; i < questions.size(); i++) {
            String question = questions.get(i);
            String progress = "[" + (i + 1) + "/" + questions.size() + "]";
            try {
                if (cacheService.get(question, model).isHit()) {
                    log.info("{} Already cached: {}", progress, question);
                    skipped++;
                    continue;
                }

                AnsweredQuestion answered = answerer.answer(question, model);
                String answer = answered.getAnswer() != null ? answered.getAnswer() : DEFAULT_ANSWER;
                boolean stored = cacheService.set(question, model, answered.getSqlQuery(), answer,
                        answered.getTable(), 0);
                if (stored) {
                    log.info("{} Cached: {}", progress, question);
                    cached++;
                } else {
                    log.warn("{} Cache rejected answer for: {}", progress, question);
                    rejected++;
                }
            } catch (RuntimeException e) {
                log.error("Failed to cache question '{}'", question, e);
                failed++;
            }
        }

        double durationSeconds = Math.round((System.nanoTime() - start) / 10_000_000.0) / 100.0;
        log.info("Cache warming completed in {}s - Cached: {}, Skipped: {}, Rejected: {}, Failed: {}",
                durationSeconds, cached, skipped, rejected, failed);

        return WarmingReport.builder()
                .success(true)
                .cachedCount(cached)
                .skippedCount(skipped)
                .rejectedCount(rejected)
                .failedCount(failed)
                .totalQuestions(questions.size())
                .durationSeconds(durationSeconds)
                .build();
    }
}
