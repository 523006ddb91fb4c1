package com.xksgroup.mediadedup.config;

import com.xksgroup.mediadedup.model.GroupingMode;
import com.xksgroup.mediadedup.model.LibraryPreferences;
import org.junit.jupiter.api.Test;
import org.springframework.boot.context.properties.bind.Bindable;
import org.springframework.boot.context.properties.bind.Binder;
import org.springframework.boot.context.properties.source.MapConfigurationPropertySource;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static org.assertj.core.api.Assertions.assertThat;

class DedupPropertiesTest {

    @Test
    void should_InheritDefaults_When_LibraryEntryLeavesFieldsUnset() {
        DedupProperties properties = bind(
                "dedup.defaults.similarity-threshold", "70",
                "dedup.defaults.grouping-mode", "CONNECTED_COMPONENTS",
                "dedup.defaults.codec-priority", "HEVC,AV1",
                "dedup.libraries.movies.resolution-priority", "2160p,1080p");

        LibraryPreferences movies = properties.preferencesFor("movies");

        assertThat(movies.getSimilarityThreshold()).isEqualTo(70);
        assertThat(movies.getGroupingMode()).isEqualTo(GroupingMode.CONNECTED_COMPONENTS);
        assertThat(movies.getCodecPriority()).containsExactly("HEVC", "AV1");
        assertThat(movies.getResolutionPriority()).containsExactly("2160p", "1080p");
    }

    @Test
    void should_OverrideDefaults_When_LibraryEntrySetsField() {
        DedupProperties properties = bind(
                "dedup.defaults.similarity-threshold", "70",
                "dedup.libraries.shows.similarity-threshold", "40",
                "dedup.libraries.shows.require-manual-review", "false");

        LibraryPreferences shows = properties.preferencesFor("shows");

        assertThat(shows.getSimilarityThreshold()).isEqualTo(40);
        assertThat(shows.isRequireManualReview()).isFalse();
        assertThat(properties.preferencesFor("other").getSimilarityThreshold()).isEqualTo(70);
        assertThat(properties.preferencesFor(null).isRequireManualReview()).isTrue();
    }

    @Test
    void should_LeaveDefaultsUntouched_When_ResolvedPreferencesChange() {
        DedupProperties properties = bind("dedup.libraries.movies.similarity-threshold", "60");

        LibraryPreferences movies = properties.preferencesFor("movies");
        movies.getResolutionPriority().clear();
        movies.setSimilarityThreshold(10);

        assertThat(properties.getDefaults()).isEqualTo(LibraryPreferences.defaults());
        assertThat(properties.preferencesFor("movies").getSimilarityThreshold()).isEqualTo(60);
        assertThat(properties.preferencesFor("movies").getResolutionPriority())
                .isEqualTo(LibraryPreferences.defaults().getResolutionPriority());
    }

    @Test
    void should_ClampScanThreads() {
        DedupProperties properties = new DedupProperties();

        properties.setScanThreads(0);
        assertThat(properties.effectiveScanThreads()).isEqualTo(DedupProperties.MIN_SCAN_THREADS);
        properties.setScanThreads(32);
        assertThat(properties.effectiveScanThreads()).isEqualTo(DedupProperties.MAX_SCAN_THREADS);
        properties.setScanThreads(4);
        assertThat(properties.effectiveScanThreads()).isEqualTo(4);
    }

    private static DedupProperties bind(String... keyValues) {
        Map<String, String> source = new LinkedHashMap<>();
        for (int i = 0; i < keyValues.length; i += 2) {
            source.put(keyValues[i], keyValues[i + 1]);
        }
        Binder binder = new Binder(List.of(new MapConfigurationPropertySource(source)));
        return binder.bind("dedup", Bindable.ofInstance(new DedupProperties())).get();
    }
}
