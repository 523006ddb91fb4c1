package com.xksgroup.mediadedup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * Per-collection preferences for duplicate detection and quality ranking.
 * Priority lists are ordered most preferred first.
 */
@Data
@Builder(toBuilder = true)
@NoArgsConstructor
@AllArgsConstructor
public class LibraryPreferences {

    public static final int DEFAULT_SIMILARITY_THRESHOLD = 50;

    @Builder.Default
    private List<String> resolutionPriority = new ArrayList<>(List.of(
            "4320p", "2160p", "1440p", "1080p", "720p", "576p", "480p"));

    @Builder.Default
    private List<String> dynamicRangePriority = new ArrayList<>(List.of(
            "HDR10+", "Dolby Vision", "HDR10", "HLG", "SDR"));

    @Builder.Default
    private List<String> codecPriority = new ArrayList<>(List.of(
            "AV1", "HEVC", "H.264", "VP9", "MPEG-4"));

    @Builder.Default
    private List<String> audioPriority = new ArrayList<>(List.of(
            "Dolby Atmos", "DTS:X", "TrueHD 7.1", "DTS-HD MA 7.1", "DTS-HD MA 5.1", "AC3 5.1", "AAC Stereo"));

    @Builder.Default
    private List<String> sourceTypePriority = new ArrayList<>(List.of(
            "Remux", "BluRay", "WEB-DL", "WEBRip", "HDTV", "DVDRip"));

    @Builder.Default
    private int similarityThreshold = DEFAULT_SIMILARITY_THRESHOLD;

    @Builder.Default
    private GroupingMode groupingMode = GroupingMode.EDGE_DRIVEN;

    // Deletion policy, consumed by the deletion workflow only
    private boolean autoDeleteEnabled;
    @Builder.Default
    private String minimumQualityThreshold = "";
    @Builder.Default
    private boolean requireManualReview = true;

    public static LibraryPreferences defaults() {
        return LibraryPreferences.builder().build();
    }

    /**
     * Copy whose priority lists can be replaced or edited without touching this instance.
     */
    public LibraryPreferences copy() {
        return toBuilder()
                .resolutionPriority(new ArrayList<>(resolutionPriority))
                .dynamicRangePriority(new ArrayList<>(dynamicRangePriority))
                .codecPriority(new ArrayList<>(codecPriority))
                .audioPriority(new ArrayList<>(audioPriority))
                .sourceTypePriority(new ArrayList<>(sourceTypePriority))
                .build();
    }
}
