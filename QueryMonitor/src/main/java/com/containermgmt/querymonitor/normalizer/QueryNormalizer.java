package com.containermgmt.querymonitor.normalizer;

import lombok.extern.slf4j.Slf4j;
import org.apache.commons.codec.digest.DigestUtils;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Component;

import java.util.regex.Pattern;

/**
 * Normalizes SQL text into a canonical signature so that statements
 * differing only in literal or parameter values are grouped together.
 *
 * Example:
 *    SELECT * FROM users WHERE id IN ($1, $2, $3) AND name = 'bob';
 * becomes
 *    select * from users where id in (...) and name = '?'
 *
 * Normalization is not idempotent: re-normalizing a normalized string may
 * still change it (for instance a second trailing semicolon is dropped on
 * the second pass).
 */
@Slf4j
@Component
public class QueryNormalizer {

    public static final String LIST_PLACEHOLDER = "in (...)";
    public static final String PARAM_PLACEHOLDER = "$?";

    private static final Pattern WHITESPACE = Pattern.compile("\\s+");

    // Single-quoted literal, '' escapes included
    private static final Pattern STRING_LITERAL = Pattern.compile("'(?:[^']|'')*'");

    // Bare numbers only: not part of an identifier and not a $n marker
    private static final Pattern NUMERIC_LITERAL = Pattern.compile("(?<![\\w$.])\\d+(?:\\.\\d+)?(?:e[+-]?\\d+)?\\b");

    // IN list made only of parameter markers or already replaced literals
    private static final Pattern IN_LIST = Pattern.compile(
        "\\bin\\s*\\(\\s*(?:\\$\\d+|\\?|'\\?')(?:\\s*,\\s*(?:\\$\\d+|\\?|'\\?'))*\\s*\\)"
    );

    private static final Pattern POSITIONAL_PARAM = Pattern.compile("\\$\\d+");

    /**
     * Returns the canonical form of {@code query}, or the query itself if
     * normalization fails. A null query normalizes to the empty string.
     */
    public String normalize(String query) {
        if (query == null) {
            return "";
        }

        try {
            String normalized = WHITESPACE.matcher(query.trim()).replaceAll(" ").toLowerCase();

            if (normalized.endsWith(";")) {
                normalized = normalized.substring(0, normalized.length() - 1).trim();
            }

            normalized = STRING_LITERAL.matcher(normalized).replaceAll("'?'");
            normalized = NUMERIC_LITERAL.matcher(normalized).replaceAll("?");
            normalized = IN_LIST.matcher(normalized).replaceAll(LIST_PLACEHOLDER);
            normalized = POSITIONAL_PARAM.matcher(normalized).replaceAll("\\$?");

            return normalized;
        } catch (RuntimeException e) {
            log.warn("Failed to normalize query, keeping raw text: {}", e.getMessage());
            return query;
        }
    }

    /**
     * MD5 of the normalized text. Depends on the text only.
     */
    public String hash(String normalizedText) {
        return DigestUtils.md5Hex(normalizedText == null ? "" : normalizedText);
    }

    /**
     * Normalized text truncated to {@code length} characters, as compared by
     * the continuous kill loop.
     */
    public String signature(String query, int length) {
        return StringUtils.left(normalize(query), length);
    }
}
