package com.xksgroup.mediadedup.model.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.Duration;
import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * A movie or episode as reported by the media catalog. Read-only for the detection pipeline.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaItem {
    private String id;
    private String name;
    private Integer productionYear;

    @Builder.Default
    private Map<String, String> providerIds = new LinkedHashMap<>();

    private Duration runtime;

    @Builder.Default
    private List<String> genres = new ArrayList<>();
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    @Builder.Default
    private List<String> people = new ArrayList<>();
    @Builder.Default
    private List<String> studios = new ArrayList<>();

    private Double communityRating;
    private LocalDate premiereDate;
    private String overview;
    private String path;

    private MediaStreamInfo streams;

    /**
     * Provider id lookup ignoring the case of the provider key ("Imdb", "imdb", "IMDB").
     */
    public String getProviderId(String provider) {
        if (providerIds == null || provider == null) {
            return null;
        }
        for (Map.Entry<String, String> entry : providerIds.entrySet()) {
            if (provider.equalsIgnoreCase(entry.getKey())) {
                return entry.getValue();
            }
        }
        return null;
    }
}
