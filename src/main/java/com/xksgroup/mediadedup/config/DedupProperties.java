package com.xksgroup.mediadedup.config;

import com.xksgroup.mediadedup.model.GroupingMode;
import com.xksgroup.mediadedup.model.LibraryPreferences;
import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Strongly typed configuration of the duplicate manager ({@code dedup.*}).
 */
@Data
@Component
@ConfigurationProperties(prefix = "dedup")
public class DedupProperties {

    public static final int MIN_SCAN_THREADS = 1;
    public static final int MAX_SCAN_THREADS = 8;

    /**
     * Master switch, scans are skipped when false.
     */
    private boolean enabled = true;

    /**
     * Worker count used to rank and merge the groups of one collection (1-8).
     */
    private int scanThreads = 2;

    /**
     * Days of deletion audit records kept before the daily purge.
     */
    private int auditRetentionDays = 30;

    /**
     * Cron of the daily audit retention purge.
     */
    private String auditPurgeCron = "0 30 3 * * *";

    /**
     * Preview mode for the deletion workflow, reported by the health endpoint but not interpreted by the scanner.
     */
    private boolean dryRunMode = false;

    private Scan scan = new Scan();

    private Catalog catalog = new Catalog();

    /**
     * Preferences used by collections without their own entry in {@link #libraries}.
     */
    private LibraryPreferences defaults = LibraryPreferences.defaults();

    /**
     * Per-collection overrides keyed by collection id, unset fields fall back to {@link #defaults}.
     */
    private Map<String, LibraryOverrides> libraries = new LinkedHashMap<>();

    public int effectiveScanThreads() {
        return Math.max(MIN_SCAN_THREADS, Math.min(MAX_SCAN_THREADS, scanThreads));
    }

    public LibraryPreferences preferencesFor(String collectionId) {
        LibraryOverrides overrides = collectionId != null ? libraries.get(collectionId) : null;
        return overrides != null ? overrides.applyTo(defaults.copy()) : defaults;
    }

    @Data
    public static class Scan {
        /**
         * Cron of the automatic scan, "-" disables it (manual scans only).
         */
        private String cron = "-";
    }

    @Data
    public static class Catalog {
        /**
         * Library folders scanned by the filesystem catalog.
         */
        private List<Library> libraries = new ArrayList<>();

        /**
         * Probe files with ffprobe to read stream data and embedded tags.
         */
        private boolean ffprobeEnabled = true;

        private List<String> videoExtensions = new ArrayList<>(List.of(
                "mkv", "mp4", "m4v", "avi", "mov", "ts", "m2ts", "webm", "wmv"));
    }

    /**
     * Fields of {@link LibraryPreferences} a collection may override, null means inherited.
     */
    @Data
    public static class LibraryOverrides {
        private List<String> resolutionPriority;
        private List<String> dynamicRangePriority;
        private List<String> codecPriority;
        private List<String> audioPriority;
        private List<String> sourceTypePriority;
        private Integer similarityThreshold;
        private GroupingMode groupingMode;
        private Boolean autoDeleteEnabled;
        private String minimumQualityThreshold;
        private Boolean requireManualReview;

        LibraryPreferences applyTo(LibraryPreferences base) {
            if (resolutionPriority != null) {
                base.setResolutionPriority(new ArrayList<>(resolutionPriority));
            }
            if (dynamicRangePriority != null) {
                base.setDynamicRangePriority(new ArrayList<>(dynamicRangePriority));
            }
            if (codecPriority != null) {
                base.setCodecPriority(new ArrayList<>(codecPriority));
            }
            if (audioPriority != null) {
                base.setAudioPriority(new ArrayList<>(audioPriority));
            }
            if (sourceTypePriority != null) {
                base.setSourceTypePriority(new ArrayList<>(sourceTypePriority));
            }
            if (similarityThreshold != null) {
                base.setSimilarityThreshold(similarityThreshold);
            }
            if (groupingMode != null) {
                base.setGroupingMode(groupingMode);
            }
            if (autoDeleteEnabled != null) {
                base.setAutoDeleteEnabled(autoDeleteEnabled);
            }
            if (minimumQualityThreshold != null) {
                base.setMinimumQualityThreshold(minimumQualityThreshold);
            }
            if (requireManualReview != null) {
                base.setRequireManualReview(requireManualReview);
            }
            return base;
        }
    }

    @Data
    public static class Library {
        private String id;
        private String name;
        private String path;
    }
}
