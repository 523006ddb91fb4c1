package com.xksgroup.mediadedup.service.detection;

import com.xksgroup.mediadedup.model.DuplicateGroup;
import com.xksgroup.mediadedup.model.GroupingMode;
import com.xksgroup.mediadedup.model.LibraryPreferences;
import com.xksgroup.mediadedup.model.VersionRecord;
import com.xksgroup.mediadedup.model.catalog.MediaItem;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.UUID;

/**
 * Partitions a collection's items into duplicate groups.
 *
 * <p>Items are bucketed by normalized title, then every unordered pair of a bucket is scored.
 * A pair scoring at or above the collection threshold is a match edge. In
 * {@link GroupingMode#EDGE_DRIVEN} mode every item touching an edge joins the bucket's group,
 * even when two members never matched each other directly. In
 * {@link GroupingMode#CONNECTED_COMPONENTS} mode the bucket yields one group per connected
 * component of the edge graph.
 *
 * <p>Versions only carry item id, path and file size here; ranking and merge happen later.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class DuplicateGrouper {

    private final TitleNormalizer titleNormalizer;
    private final SimilarityScorer similarityScorer;

    public List<DuplicateGroup> group(String collectionId, List<MediaItem> items, LibraryPreferences preferences) {
        List<DuplicateGroup> groups = new ArrayList<>();
        Map<String, List<MediaItem>> buckets = bucketByTitle(items);
        log.debug("Collection {}: {} items in {} title buckets", collectionId, items.size(), buckets.size());

        for (Map.Entry<String, List<MediaItem>> bucket : buckets.entrySet()) {
            List<MediaItem> members = bucket.getValue();
            if (members.size() < 2) {
                continue;
            }
            for (List<MediaItem> candidates : findCandidates(members, preferences)) {
                if (candidates.size() >= 2) {
                    groups.add(newGroup(collectionId, candidates));
                }
            }
        }
        return groups;
    }

    /**
     * Buckets items by normalized title, keeping first-seen order. Items with an empty key are dropped.
     */
    Map<String, List<MediaItem>> bucketByTitle(List<MediaItem> items) {
        Map<String, List<MediaItem>> buckets = new LinkedHashMap<>();
        for (MediaItem item : items) {
            String key = titleNormalizer.normalize(item.getName());
            if (key.isEmpty()) {
                continue;
            }
            buckets.computeIfAbsent(key, k -> new ArrayList<>()).add(item);
        }
        return buckets;
    }

    private List<List<MediaItem>> findCandidates(List<MediaItem> members, LibraryPreferences preferences) {
        int threshold = preferences.getSimilarityThreshold();
        GroupingMode mode = preferences.getGroupingMode() != null ? preferences.getGroupingMode() : GroupingMode.EDGE_DRIVEN;

        Set<Integer> touched = new LinkedHashSet<>();
        int[] parent = new int[members.size()];
        for (int i = 0; i < parent.length; i++) {
            parent[i] = i;
        }

        for (int i = 0; i < members.size(); i++) {
            for (int j = i + 1; j < members.size(); j++) {
                int score = similarityScorer.score(members.get(i), members.get(j));
                if (score >= threshold) {
                    touched.add(i);
                    touched.add(j);
                    union(parent, i, j);
                }
            }
        }

        if (mode == GroupingMode.EDGE_DRIVEN) {
            List<MediaItem> candidates = new ArrayList<>();
            touched.forEach(index -> candidates.add(members.get(index)));
            return List.of(candidates);
        }

        Map<Integer, List<MediaItem>> components = new LinkedHashMap<>();
        for (Integer index : touched) {
            components.computeIfAbsent(find(parent, index), root -> new ArrayList<>()).add(members.get(index));
        }
        return new ArrayList<>(components.values());
    }

    private DuplicateGroup newGroup(String collectionId, List<MediaItem> candidates) {
        DuplicateGroup group = DuplicateGroup.builder()
                .id(UUID.randomUUID().toString())
                .collectionId(collectionId)
                .detectedAt(Instant.now())
                .build();

        for (MediaItem item : candidates) {
            group.getVersions().add(VersionRecord.builder()
                    .itemId(item.getId())
                    .filePath(item.getPath() != null ? item.getPath() : "")
                    .fileSize(fileSize(item.getPath()))
                    .build());
        }

        // Provisional primary, replaced by the best ranked version once scored
        group.setPrimaryVersionId(group.getVersions().get(0).getItemId());
        return group;
    }

    long fileSize(String path) {
        if (path == null || path.isEmpty()) {
            return 0;
        }
        try {
            Path file = Path.of(path);
            if (Files.isRegularFile(file)) {
                return Files.size(file);
            }
            log.warn("File missing or not a regular file, size unknown: {}", path);
        } catch (IOException | InvalidPathException | SecurityException e) {
            log.warn("Error getting file size for {}: {}", path, e.getMessage());
        }
        return 0;
    }

    private static int find(int[] parent, int i) {
        while (parent[i] != i) {
            parent[i] = parent[parent[i]];
            i = parent[i];
        }
        return i;
    }

    private static void union(int[] parent, int a, int b) {
        int rootA = find(parent, a);
        int rootB = find(parent, b);
        if (rootA != rootB) {
            parent[Math.max(rootA, rootB)] = Math.min(rootA, rootB);
        }
    }
}
