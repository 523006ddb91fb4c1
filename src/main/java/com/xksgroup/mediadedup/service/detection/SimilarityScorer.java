package com.xksgroup.mediadedup.service.detection;

import com.xksgroup.mediadedup.model.catalog.MediaItem;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.time.Duration;

/**
 * Weighted match score between two catalog items. The score is a raw sum (max 140)
 * compared as-is against the collection's similarity threshold.
 */
@Component
@RequiredArgsConstructor
public class SimilarityScorer {

    public static final int TITLE_MATCH = 30;
    public static final int SAME_YEAR = 20;
    public static final int ADJACENT_YEAR = 10;
    public static final int IMDB_MATCH = 40;
    public static final int TMDB_MATCH = 40;
    public static final int RUNTIME_MATCH = 10;
    public static final int MAX_SCORE = TITLE_MATCH + SAME_YEAR + IMDB_MATCH + TMDB_MATCH + RUNTIME_MATCH;

    static final String IMDB = "Imdb";
    static final String TMDB = "Tmdb";
    private static final Duration RUNTIME_TOLERANCE = Duration.ofMinutes(5);

    private final TitleNormalizer titleNormalizer;

    public int score(MediaItem first, MediaItem second) {
        int score = 0;

        if (titleNormalizer.normalize(first.getName()).equalsIgnoreCase(titleNormalizer.normalize(second.getName()))) {
            score += TITLE_MATCH;
        }

        if (first.getProductionYear() != null && second.getProductionYear() != null) {
            int yearDiff = Math.abs(first.getProductionYear() - second.getProductionYear());
            if (yearDiff == 0) {
                score += SAME_YEAR;
            } else if (yearDiff == 1) {
                score += ADJACENT_YEAR;
            }
        }

        if (sameProviderId(first, second, IMDB)) {
            score += IMDB_MATCH;
        }
        if (sameProviderId(first, second, TMDB)) {
            score += TMDB_MATCH;
        }

        if (first.getRuntime() != null && second.getRuntime() != null) {
            Duration diff = first.getRuntime().minus(second.getRuntime()).abs();
            if (diff.compareTo(RUNTIME_TOLERANCE) <= 0) {
                score += RUNTIME_MATCH;
            }
        }

        return score;
    }

    private boolean sameProviderId(MediaItem first, MediaItem second, String provider) {
        String a = first.getProviderId(provider);
        String b = second.getProviderId(provider);
        return a != null && !a.isEmpty() && b != null && !b.isEmpty() && a.equalsIgnoreCase(b);
    }
}
