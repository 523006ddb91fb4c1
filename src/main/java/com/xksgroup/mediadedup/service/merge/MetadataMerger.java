package com.xksgroup.mediadedup.service.merge;

import com.xksgroup.mediadedup.model.DuplicateGroup;
import com.xksgroup.mediadedup.model.MergedMetadata;
import com.xksgroup.mediadedup.model.VersionRecord;
import com.xksgroup.mediadedup.model.catalog.MediaItem;
import com.xksgroup.mediadedup.service.catalog.MediaCatalog;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.time.LocalDate;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.function.Function;

/**
 * Consolidates descriptive metadata of every member of a duplicate group into one record.
 *
 * <p>Field rules:
 * <ul>
 *   <li>title: longest non-empty member title (first one wins on equal length)</li>
 *   <li>genres, tags, studios, people: case-insensitive union, first spelling kept</li>
 *   <li>average rating: mean of the members' community ratings, 0 when none is rated</li>
 *   <li>release date: earliest premiere date, null when none</li>
 *   <li>external ids: first value seen for each provider key</li>
 *   <li>descriptions: case-insensitive distinct non-blank overviews</li>
 * </ul>
 * The merged record is recomputed from scratch on each call, so merging the same members twice gives
 * the same result. Each version's {@code metadataContribution} lists the fields it supplied a kept value for.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class MetadataMerger {

    public static final String TITLE = "Title";
    public static final String GENRES = "Genres";
    public static final String TAGS = "Tags";
    public static final String PEOPLE = "People";
    public static final String RATING = "Rating";
    public static final String RELEASE_DATE = "ReleaseDate";
    public static final String STUDIOS = "Studios";
    public static final String EXTERNAL_IDS = "ExternalIds";
    public static final String DESCRIPTIONS = "Descriptions";

    public MergeResult merge(DuplicateGroup group, MediaCatalog catalog) {
        List<Member> members = new ArrayList<>();
        List<String> unresolved = new ArrayList<>();

        for (VersionRecord version : group.getVersions()) {
            Optional<MediaItem> item = catalog.resolveItem(version.getItemId());
            if (item.isPresent()) {
                members.add(new Member(version, item.get(), catalog.getPeople(item.get())));
            } else {
                log.warn("Item {} of group {} could not be resolved, skipped for merge", version.getItemId(), group.getId());
                unresolved.add(version.getItemId());
            }
        }

        if (members.isEmpty()) {
            log.warn("No items found for duplicate group {}", group.getId());
            return new MergeResult(MergeResult.Status.NO_RESOLVABLE_MEMBERS, 0, unresolved);
        }

        group.getVersions().forEach(v -> v.getMetadataContribution().clear());
        MergedMetadata merged = new MergedMetadata();

        mergeTitle(members, merged);
        merged.setGenres(union(members, GENRES, m -> m.item().getGenres()));
        merged.setTags(union(members, TAGS, m -> m.item().getTags()));
        merged.setPeople(union(members, PEOPLE, Member::people));
        merged.setStudios(union(members, STUDIOS, m -> m.item().getStudios()));
        mergeRating(members, merged);
        mergeReleaseDate(members, merged);
        mergeExternalIds(members, merged);
        merged.setDescriptions(union(members, DESCRIPTIONS, m -> {
            String overview = m.item().getOverview();
            return overview == null || overview.isBlank() ? List.of() : List.of(overview);
        }));

        group.setMergedMetadata(merged);
        log.info("Merged metadata for duplicate group {} from {} members", group.getId(), members.size());
        return new MergeResult(MergeResult.Status.MERGED, members.size(), unresolved);
    }

    private void mergeTitle(List<Member> members, MergedMetadata merged) {
        Member best = null;
        for (Member member : members) {
            String name = member.item().getName();
            if (name == null || name.isEmpty()) {
                continue;
            }
            if (best == null || name.length() > best.item().getName().length()) {
                best = member;
            }
        }
        if (best != null) {
            merged.setTitle(best.item().getName());
            contribute(best, TITLE);
        } else {
            merged.setTitle("");
        }
    }

    private void mergeRating(List<Member> members, MergedMetadata merged) {
        double sum = 0;
        int count = 0;
        for (Member member : members) {
            Double rating = member.item().getCommunityRating();
            if (rating != null) {
                sum += rating;
                count++;
                contribute(member, RATING);
            }
        }
        merged.setAverageRating(count > 0 ? sum / count : 0);
    }

    private void mergeReleaseDate(List<Member> members, MergedMetadata merged) {
        Member earliest = null;
        for (Member member : members) {
            LocalDate date = member.item().getPremiereDate();
            if (date != null && (earliest == null || date.isBefore(earliest.item().getPremiereDate()))) {
                earliest = member;
            }
        }
        if (earliest != null) {
            merged.setReleaseDate(earliest.item().getPremiereDate());
            contribute(earliest, RELEASE_DATE);
        } else {
            merged.setReleaseDate(null);
        }
    }

    private void mergeExternalIds(List<Member> members, MergedMetadata merged) {
        Map<String, String> externalIds = new LinkedHashMap<>();
        for (Member member : members) {
            Map<String, String> providerIds = member.item().getProviderIds();
            if (providerIds == null) {
                continue;
            }
            for (Map.Entry<String, String> entry : providerIds.entrySet()) {
                if (!externalIds.containsKey(entry.getKey())) {
                    externalIds.put(entry.getKey(), entry.getValue());
                    contribute(member, EXTERNAL_IDS);
                }
            }
        }
        merged.setExternalIds(externalIds);
    }

    private List<String> union(List<Member> members, String field, Function<Member, Collection<String>> values) {
        Map<String, String> seen = new LinkedHashMap<>();
        for (Member member : members) {
            Collection<String> memberValues = values.apply(member);
            if (memberValues == null) {
                continue;
            }
            for (String value : memberValues) {
                if (value == null || value.isBlank()) {
                    continue;
                }
                String key = value.toLowerCase(Locale.ROOT);
                if (!seen.containsKey(key)) {
                    seen.put(key, value);
                    contribute(member, field);
                }
            }
        }
        return new ArrayList<>(seen.values());
    }

    private void contribute(Member member, String field) {
        List<String> contribution = member.version().getMetadataContribution();
        if (!contribution.contains(field)) {
            contribution.add(field);
        }
    }

    private record Member(VersionRecord version, MediaItem item, List<String> people) {
    }
}
