package com.xksgroup.mediadedup.service.scan;

import com.xksgroup.mediadedup.config.DedupProperties;
import com.xksgroup.mediadedup.model.DuplicateGroup;
import com.xksgroup.mediadedup.model.LibraryPreferences;
import com.xksgroup.mediadedup.model.catalog.MediaItem;
import com.xksgroup.mediadedup.service.catalog.CatalogUnavailableException;
import com.xksgroup.mediadedup.service.catalog.MediaCatalog;
import com.xksgroup.mediadedup.service.detection.DuplicateGrouper;
import com.xksgroup.mediadedup.service.merge.MergeResult;
import com.xksgroup.mediadedup.service.merge.MetadataMerger;
import com.xksgroup.mediadedup.service.quality.QualityScorer;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

/**
 * Runs the detection pipeline on one collection: group, rank, merge, validate.
 *
 * <p>Groups are independent, so ranking and merging fan out over {@code dedup.scan-threads} workers.
 * Cancellation is checked before each group starts; a cancelled scan returns no groups at all.
 * Failures never escape as exceptions, they come back as a {@link ScanOutcome}.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateScanService {

    private final MediaCatalog catalog;
    private final DuplicateGrouper grouper;
    private final QualityScorer qualityScorer;
    private final MetadataMerger metadataMerger;
    private final DedupProperties properties;

    public ScanOutcome scanCollection(String collectionId, LibraryPreferences preferences, CancellationSignal cancellation) {
        log.info("Starting duplicate scan for collection {}", collectionId);

        List<MediaItem> items;
        try {
            items = catalog.listItems(collectionId);
        } catch (CatalogUnavailableException e) {
            log.error("Catalog unavailable for collection {}: {}", collectionId, e.getMessage());
            return ScanOutcome.failed(collectionId, ScanOutcome.FailureReason.CATALOG_UNAVAILABLE, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Error listing items of collection {}", collectionId, e);
            return ScanOutcome.failed(collectionId, ScanOutcome.FailureReason.UNEXPECTED_ERROR, e.getMessage());
        }
        log.info("Found {} items in collection {}", items.size(), collectionId);

        try {
            List<DuplicateGroup> candidates = grouper.group(collectionId, items, preferences);
            log.info("Collection {}: {} candidate duplicate groups", collectionId, candidates.size());

            if (cancellation.isCancelled()) {
                log.info("Scan of collection {} cancelled after grouping", collectionId);
                return ScanOutcome.cancelled(collectionId, items.size());
            }

            List<DuplicateGroup> groups = processGroups(candidates, preferences, cancellation);
            if (cancellation.isCancelled()) {
                log.info("Scan of collection {} cancelled, {} processed groups discarded", collectionId, groups.size());
                return ScanOutcome.cancelled(collectionId, items.size());
            }

            int dropped = candidates.size() - groups.size();
            log.info("Detected {} duplicate groups in collection {} ({} dropped)", groups.size(), collectionId, dropped);
            return ScanOutcome.completed(collectionId, groups, items.size(), dropped);

        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("Scan of collection {} interrupted", collectionId);
            return ScanOutcome.cancelled(collectionId, items.size());
        } catch (RuntimeException e) {
            log.error("Error scanning collection {}", collectionId, e);
            return ScanOutcome.failed(collectionId, ScanOutcome.FailureReason.UNEXPECTED_ERROR, e.getMessage());
        }
    }

    private List<DuplicateGroup> processGroups(List<DuplicateGroup> candidates, LibraryPreferences preferences,
                                               CancellationSignal cancellation) throws InterruptedException {
        List<DuplicateGroup> groups = new ArrayList<>();
        if (candidates.isEmpty()) {
            return groups;
        }

        int threads = Math.min(properties.effectiveScanThreads(), candidates.size());
        ExecutorService workers = Executors.newFixedThreadPool(threads);
        try {
            List<Future<Optional<DuplicateGroup>>> futures = new ArrayList<>();
            for (DuplicateGroup candidate : candidates) {
                futures.add(workers.submit(() -> cancellation.isCancelled()
                        ? Optional.<DuplicateGroup>empty()
                        : processGroup(candidate, preferences)));
            }

            for (int i = 0; i < futures.size(); i++) {
                try {
                    futures.get(i).get().ifPresent(groups::add);
                } catch (ExecutionException e) {
                    log.error("Error processing duplicate group {}, skipped", candidates.get(i).getId(), e.getCause());
                }
            }
        } finally {
            workers.shutdownNow();
        }
        return groups;
    }

    /**
     * Ranks and merges one group, then removes members the catalog could not resolve.
     * Empty when fewer than two versions survive.
     */
    Optional<DuplicateGroup> processGroup(DuplicateGroup group, LibraryPreferences preferences) {
        qualityScorer.scoreGroup(group, preferences, catalog);
        MergeResult mergeResult = metadataMerger.merge(group, catalog);

        if (!mergeResult.unresolvedItemIds().isEmpty()) {
            Set<String> unresolved = new HashSet<>(mergeResult.unresolvedItemIds());
            group.getVersions().removeIf(v -> unresolved.contains(v.getItemId()));
        }

        if (group.distinctItemCount() < 2) {
            log.warn("Duplicate group {} dropped, only {} resolvable versions left", group.getId(), group.distinctItemCount());
            return Optional.empty();
        }

        if (!group.containsItem(group.getPrimaryVersionId())) {
            group.setPrimaryVersionId(group.getVersions().get(0).getItemId());
            group.setPrimaryManuallySelected(false);
        }
        return Optional.of(group);
    }
}
