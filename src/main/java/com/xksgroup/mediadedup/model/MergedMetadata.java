package com.xksgroup.mediadedup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MergedMetadata {
    @Builder.Default
    private String title = "";
    @Builder.Default
    private List<String> genres = new ArrayList<>();
    @Builder.Default
    private List<String> tags = new ArrayList<>();
    @Builder.Default
    private List<String> people = new ArrayList<>();
    private double averageRating;
    private LocalDate releaseDate;
    @Builder.Default
    private List<String> studios = new ArrayList<>();
    @Builder.Default
    private Map<String, String> externalIds = new LinkedHashMap<>();
    @Builder.Default
    private List<String> descriptions = new ArrayList<>();
}
