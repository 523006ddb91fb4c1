package com.xksgroup.mediadedup.service.detection;

import org.springframework.stereotype.Component;

import java.util.Locale;
import java.util.regex.Pattern;

/**
 * Canonical comparison key for display titles.
 */
@Component
public class TitleNormalizer {

    private static final Pattern NON_ALPHANUMERIC = Pattern.compile("[^\\p{L}\\p{N}\\s]");
    private static final Pattern WHITESPACE_RUN = Pattern.compile("\\s+");

    /**
     * Lower-cases the title, strips everything that is not a letter, digit or whitespace,
     * collapses whitespace runs and trims. Null or blank input gives an empty key.
     */
    public String normalize(String title) {
        if (title == null || title.isBlank()) {
            return "";
        }
        String normalized = title.toLowerCase(Locale.ROOT);
        normalized = NON_ALPHANUMERIC.matcher(normalized).replaceAll("");
        normalized = WHITESPACE_RUN.matcher(normalized).replaceAll(" ");
        return normalized.trim();
    }
}
