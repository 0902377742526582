package com.sqlrecall.service.keys;

import org.apache.commons.codec.digest.DigestUtils;
import org.springframework.stereotype.Service;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Derives content-addressed cache keys from natural-language questions.
 *
 * Normalization:
 * 1. Lowercase
 * 2. Collapse whitespace runs (Unicode spaces included) to a single space
 * 3. Strip leading/trailing whitespace
 * 4. Strip trailing '?', '.' and '!'
 *
 * Key: SHA-256 of {@code normalized + "|" + model}, so the same question asked
 * of a different model is a different entry.
 */
@Service
public class QuestionKeyGenerator {

    private static final Pattern WHITESPACE = Pattern.compile("\\s+", Pattern.UNICODE_CHARACTER_CLASS);
    private static final Pattern TRAILING_PUNCTUATION = Pattern.compile("[?.!]+$");
    private static final String SEPARATOR = "|";

    /**
     * Normalize a question so trivially different phrasings collide.
     *
     * @param question raw question, null treated as empty
     * @return normalized question
     */
    public String normalize(String question) {
        if (question == null) {
            return "";
        }
        String normalized = WHITESPACE.matcher(question.toLowerCase(Locale.ROOT)).replaceAll(" ").strip();
        return TRAILING_PUNCTUATION.matcher(normalized).replaceAll("");
    }

    /**
     * Generate the cache key for a question/model pair.
     *
     * @return SHA-256 hash (64 hex chars) together with the normalized question
     */
    public CacheKey generate(String question, String modelName) {
        String normalized = normalize(question);
        String model = modelName == null ? "" : modelName;
        return new CacheKey(DigestUtils.sha256Hex(normalized + SEPARATOR + model), normalized);
    }

    public String key(String question, String modelName) {
        return generate(question, modelName).value();
    }

    public record CacheKey(String value, String normalizedQuestion) {

        /**
         * Short form for log lines.
         */
        public String abbreviated() {
            return value.substring(0, 16) + "...";
        }
    }
}
