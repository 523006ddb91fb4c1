package com.xksgroup.mediadedup.service.detection;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.NullAndEmptySource;
import org.junit.jupiter.params.provider.ValueSource;

import static org.assertj.core.api.Assertions.assertThat;

class TitleNormalizerTest {

    private final TitleNormalizer normalizer = new TitleNormalizer();

    @Test
    void should_LowercaseAndStripPunctuation() {
        assertThat(normalizer.normalize("The Matrix: Reloaded!")).isEqualTo("the matrix reloaded");
    }

    @Test
    void should_CollapseWhitespaceAndTrim() {
        assertThat(normalizer.normalize("  Blade   Runner\t2049 ")).isEqualTo("blade runner 2049");
    }

    @Test
    void should_KeepLettersOutsideAscii() {
        assertThat(normalizer.normalize("Amélie")).isEqualTo("amélie");
        assertThat(normalizer.normalize("Léon: The Professional")).isEqualTo("léon the professional");
    }

    @Test
    void should_StripUnderscores() {
        assertThat(normalizer.normalize("star_wars")).isEqualTo("starwars");
    }

    @Test
    void should_GiveSameKey_When_TitlesOnlyDifferInPunctuation() {
        assertThat(normalizer.normalize("Spider-Man: No Way Home"))
                .isEqualTo(normalizer.normalize("SpiderMan No Way Home"));
    }

    @ParameterizedTest
    @NullAndEmptySource
    @ValueSource(strings = {"   ", "\t\n"})
    void should_ReturnEmptyKey_When_TitleIsBlank(String title) {
        assertThat(normalizer.normalize(title)).isEmpty();
    }

    @Test
    void should_ReturnEmptyKey_When_TitleIsOnlyPunctuation() {
        assertThat(normalizer.normalize("?!...")).isEmpty();
    }
}
