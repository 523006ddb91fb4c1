package com.xksgroup.mediadedup.service.quality;

import com.xksgroup.mediadedup.model.DuplicateGroup;
import com.xksgroup.mediadedup.model.LibraryPreferences;
import com.xksgroup.mediadedup.model.VersionRecord;
import com.xksgroup.mediadedup.model.catalog.MediaItem;
import com.xksgroup.mediadedup.service.catalog.MediaCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.Comparator;
import java.util.List;
import java.util.Optional;

/**
 * Ranks the versions of a duplicate group against the collection's priority lists.
 *
 * <pre>
 * score = 0.30 * resolution + 0.25 * dynamic range + 0.20 * codec + 0.15 * audio + 0.10 * source type
 * </pre>
 * Each component is a {@link #priorityScore(String, List)} in [0, 100].
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class QualityScorer {

    static final double RESOLUTION_WEIGHT = 0.30;
    static final double DYNAMIC_RANGE_WEIGHT = 0.25;
    static final double CODEC_WEIGHT = 0.20;
    static final double AUDIO_WEIGHT = 0.15;
    static final double SOURCE_TYPE_WEIGHT = 0.10;

    private final TechnicalAttributeExtractor extractor;

    /**
     * Fills technical labels and scores of every version, sorts versions best first (stable on ties)
     * and points the primary at the best version unless a user already chose one.
     */
    public void scoreGroup(DuplicateGroup group, LibraryPreferences preferences, MediaCatalog catalog) {
        for (VersionRecord version : group.getVersions()) {
            Optional<MediaItem> item = catalog.resolveItem(version.getItemId());
            if (item.isEmpty()) {
                log.warn("Item {} not found, leaving version unscored", version.getItemId());
                version.setQualityScore(0);
                continue;
            }

            applyAttributes(version, item.get());
            version.setQualityScore(score(version, preferences));
        }

        // List.sort is stable, ties keep their input order
        group.getVersions().sort(Comparator.comparingInt(VersionRecord::getQualityScore).reversed());

        boolean keepManualPrimary = group.isPrimaryManuallySelected() && group.containsItem(group.getPrimaryVersionId());
        if (!group.getVersions().isEmpty() && !keepManualPrimary) {
            group.setPrimaryVersionId(group.getVersions().get(0).getItemId());
            group.setPrimaryManuallySelected(false);
        }
    }

    public int score(VersionRecord version, LibraryPreferences preferences) {
        double score = 0;
        score += RESOLUTION_WEIGHT * priorityScore(version.getResolution(), preferences.getResolutionPriority());
        score += DYNAMIC_RANGE_WEIGHT * priorityScore(version.getDynamicRange(), preferences.getDynamicRangePriority());
        score += CODEC_WEIGHT * priorityScore(version.getCodec(), preferences.getCodecPriority());
        score += AUDIO_WEIGHT * priorityScore(version.getAudioFormat(), preferences.getAudioPriority());
        score += SOURCE_TYPE_WEIGHT * priorityScore(version.getSourceType(), preferences.getSourceTypePriority());
        return (int) Math.round(score);
    }

    /**
     * 100 for the first entry of the list, decreasing linearly to {@code 100 / size} for the last one.
     * 0 when the value is empty or not in the list. Matching ignores case.
     */
    public static int priorityScore(String value, List<String> priorityList) {
        if (value == null || value.isEmpty() || priorityList == null || priorityList.isEmpty()) {
            return 0;
        }
        int index = -1;
        for (int i = 0; i < priorityList.size(); i++) {
            if (value.equalsIgnoreCase(priorityList.get(i))) {
                index = i;
                break;
            }
        }
        if (index < 0) {
            return 0;
        }
        return (int) Math.round((double) (priorityList.size() - index) / priorityList.size() * 100);
    }

    private void applyAttributes(VersionRecord version, MediaItem item) {
        TechnicalAttributes attributes;
        try {
            attributes = extractor.extract(item);
        } catch (RuntimeException e) {
            log.warn("Error extracting media info for {}: {}", version.getItemId(), e.getMessage());
            attributes = TechnicalAttributes.EMPTY;
        }
        version.setResolution(attributes.resolution());
        version.setDynamicRange(attributes.dynamicRange());
        version.setCodec(attributes.codec());
        version.setAudioCodec(attributes.audioCodec());
        version.setAudioChannels(attributes.audioChannels());
        version.setAudioFormat(attributes.audioFormat());
        version.setSourceType(attributes.sourceType());
        version.setBitrate(attributes.bitrateKbps());
    }
}
