package com.xksgroup.mediadedup.service.helper;

import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Extracts title, year, provider ids and episode markers from release style names (without file extension),
 * e.g. {@code The.Matrix.1999.2160p.UHD.BluRay.REMUX.HDR.HEVC.Atmos-GRP [imdbid-tt0133093]}.
 */
@Slf4j
@Component
public class ReleaseNameParser {

    public static final String IMDB = "Imdb";
    public static final String TMDB = "Tmdb";

    // {imdb-tt0133093}, [imdbid-tt0133093] or a bare tt0133093
    private static final Pattern IMDB_PATTERN =
            Pattern.compile("(?i)[\\[{(]?\\s*imdb(?:id)?[-=\\s]?(tt\\d{7,8})\\s*[\\]})]?|\\b(tt\\d{7,8})\\b");

    // {tmdb-603} or [tmdbid-603]
    private static final Pattern TMDB_PATTERN =
            Pattern.compile("(?i)[\\[{(]?\\s*tmdb(?:id)?[-=\\s]?(\\d+)\\s*[\\]})]?");

    private static final Pattern EPISODE_PATTERN = Pattern.compile("(?i)\\bS(\\d{1,2})E(\\d{1,3})\\b");

    private static final Pattern YEAR_PATTERN = Pattern.compile("(?<=[\\s.(\\[_-])((?:19|20)\\d{2})(?=[\\s.)\\]_-]|$)");

    // First token that can no longer belong to a title
    private static final Pattern RELEASE_TAG_PATTERN = Pattern.compile(
            "(?i)(?<=[\\s.(\\[_-])(4320p|2160p|1440p|1080p|720p|576p|480p|4k|uhd|remux|bluray|blu-ray|bdrip|brrip"
                    + "|web-?dl|webrip|hdtv|dvdrip|dvd-rip|x264|x265|h\\.?264|h\\.?265|hevc|hdr10?\\+?|proper|repack)(?=[\\s.)\\]_-]|$)");

    public ParsedRelease parse(String releaseName) {
        if (releaseName == null || releaseName.isBlank()) {
            return new ParsedRelease("", null, Map.of(), null, null);
        }

        String name = releaseName.trim();

        Map<String, String> providerIds = new LinkedHashMap<>();
        int cut = name.length();

        Matcher imdb = IMDB_PATTERN.matcher(name);
        if (imdb.find()) {
            providerIds.put(IMDB, imdb.group(1) != null ? imdb.group(1) : imdb.group(2));
            cut = Math.min(cut, imdb.start());
        }
        Matcher tmdb = TMDB_PATTERN.matcher(name);
        if (tmdb.find()) {
            providerIds.put(TMDB, tmdb.group(1));
            cut = Math.min(cut, tmdb.start());
        }

        Integer season = null;
        Integer episode = null;
        Matcher episodeMatcher = EPISODE_PATTERN.matcher(name);
        if (episodeMatcher.find()) {
            season = Integer.parseInt(episodeMatcher.group(1));
            episode = Integer.parseInt(episodeMatcher.group(2));
            cut = Math.min(cut, episodeMatcher.start());
        }

        Matcher tag = RELEASE_TAG_PATTERN.matcher(name);
        int tagStart = tag.find() ? tag.start() : name.length();
        cut = Math.min(cut, tagStart);

        // last year ahead of the release tags, so "Blade Runner 2049 (2017)" keeps 2049 in the title
        Integer year = null;
        int yearStart = -1;
        Matcher yearMatcher = YEAR_PATTERN.matcher(name);
        while (yearMatcher.find() && yearMatcher.start() < tagStart) {
            if (!cleanTitle(name.substring(0, yearMatcher.start())).isEmpty()) {
                year = Integer.parseInt(yearMatcher.group(1));
                yearStart = yearMatcher.start();
            }
        }
        if (year != null) {
            cut = Math.min(cut, yearStart);
        }

        String title = cleanTitle(name.substring(0, cut));
        if (season != null && !title.isEmpty()) {
            title = String.format("%s S%02dE%02d", title, season, episode);
        }

        log.trace("Parsed release '{}' -> title='{}', year={}, ids={}", releaseName, title, year, providerIds);
        return new ParsedRelease(title, year, providerIds, season, episode);
    }

    private String cleanTitle(String raw) {
        return raw.replace('.', ' ')
                .replace('_', ' ')
                .replaceAll("[\\[({]\\s*$", "")
                .replaceAll("\\s+", " ")
                .replaceAll("^[\\s-]+|[\\s(\\[-]+$", "")
                .trim();
    }

    public record ParsedRelease(
            String title,
            Integer year,
            Map<String, String> providerIds,
            Integer season,
            Integer episode
    ) {
        public boolean isEpisode() {
            return season != null;
        }
    }
}
