package com.sqlrecall.service.guard;

import com.sqlrecall.config.SqlRecallProperties;
import com.sqlrecall.entity.QueryCacheEntryEntity;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.List;
import java.util.Optional;
import java.util.regex.Pattern;
import java.util.stream.Collectors;

/**
 * Detects answers that record a failed execution rather than a result.
 * Such answers are never cached, and the maintenance sweep invalidates any that slipped in.
 */
@Slf4j
@Component
public class AnswerErrorGuard {

    private static final Pattern VISUAL_QUESTION =
            Pattern.compile("\\b(?:chart|report|graph)s?\\b", Pattern.CASE_INSENSITIVE);

    // Generic row-count answers stored before a chart/report was rendered
    private static final Pattern PLACEHOLDER_ANSWER =
            Pattern.compile("^\\s*(?:found|query returned)\\s+\\d+\\s+result(?:\\(s\\)|s)?", Pattern.CASE_INSENSITIVE);

    private final List<Pattern> signatures;

    public AnswerErrorGuard(SqlRecallProperties properties) {
        this.signatures = properties.getCache().getErrorSignatures().stream()
                .map(signature -> Pattern.compile(signature, Pattern.CASE_INSENSITIVE))
                .collect(Collectors.toList());
        log.debug("Answer error guard loaded {} signatures", signatures.size());
    }

    /**
     * Reason an answer must not be cached, if any.
     *
     * @return {@code blank_answer}, {@code error_signature}, or empty when the answer is cacheable
     */
    public Optional<String> rejectionReason(String answer) {
        if (answer == null || answer.isBlank()) {
            return Optional.of(QueryCacheEntryEntity.REASON_BLANK_ANSWER);
        }
        if (looksLikeFailure(answer)) {
            return Optional.of(QueryCacheEntryEntity.REASON_ERROR_SIGNATURE);
        }
        return Optional.empty();
    }

    public boolean looksLikeFailure(String answer) {
        if (answer == null) {
            return false;
        }
        for (Pattern signature : signatures) {
            if (signature.matcher(answer).find()) {
                return true;
            }
        }
        return false;
    }

    /**
     * A chart, report or graph question whose stored answer is only a row count.
     */
    public boolean isPlaceholderForVisualQuestion(String question, String answer) {
        return question != null && answer != null
                && VISUAL_QUESTION.matcher(question).find()
                && PLACEHOLDER_ANSWER.matcher(answer).find();
    }

    /**
     * Reason the sweep should invalidate an already stored entry, if any.
     */
    public Optional<String> sweepReason(String question, String answer) {
        Optional<String> rejection = rejectionReason(answer);
        if (rejection.isPresent()) {
            return rejection;
        }
        if (isPlaceholderForVisualQuestion(question, answer)) {
            return Optional.of(QueryCacheEntryEntity.REASON_PLACEHOLDER_ANSWER);
        }
        return Optional.empty();
    }
}
