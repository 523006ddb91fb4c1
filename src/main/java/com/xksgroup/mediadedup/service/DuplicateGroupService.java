package com.xksgroup.mediadedup.service;

import com.xksgroup.mediadedup.exception.ResourceNotFoundException;
import com.xksgroup.mediadedup.model.CollectionDuplicates;
import com.xksgroup.mediadedup.model.DuplicateGroup;
import com.xksgroup.mediadedup.model.ReviewStatus;
import com.xksgroup.mediadedup.repo.CollectionDuplicatesRepository;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.OptimisticLockingFailureException;
import org.springframework.stereotype.Service;

import java.time.Instant;
import java.util.List;
import java.util.Optional;

/**
 * Stores the detection output of each collection and applies review decisions to it.
 */
@Slf4j
@Service
@RequiredArgsConstructor
public class DuplicateGroupService {

    private final CollectionDuplicatesRepository repository;

    private static final int SAVE_ATTEMPTS = 3;

    /**
     * Replaces the stored groups of a collection with the output of a completed scan.
     * Review decisions made on the previous output are carried over to the matching new groups.
     * A review saved concurrently makes the save start over from the fresh document, so the
     * decision is carried over too.
     */
    public CollectionDuplicates saveScanResult(String collectionId, String scanJobId, List<DuplicateGroup> groups) {
        for (int attempt = 1; ; attempt++) {
            Optional<CollectionDuplicates> previous = repository.findById(collectionId);
            previous.ifPresent(p -> carryOverReviewState(p.getGroups(), groups));

            CollectionDuplicates document = CollectionDuplicates.builder()
                    .collectionId(collectionId)
                    .groups(groups)
                    .scanJobId(scanJobId)
                    .scannedAt(Instant.now())
                    .version(previous.map(CollectionDuplicates::getVersion).orElse(null))
                    .build();

            try {
                CollectionDuplicates saved = repository.save(document);
                log.info("Saved {} duplicate groups for collection {}", groups.size(), collectionId);
                return saved;
            } catch (OptimisticLockingFailureException e) {
                if (attempt >= SAVE_ATTEMPTS) {
                    throw e;
                }
                log.warn("Duplicate groups of collection {} changed while saving scan {}, retrying ({}/{})",
                        collectionId, scanJobId, attempt, SAVE_ATTEMPTS);
            }
        }
    }

    public List<DuplicateGroup> findGroups(String collectionId) {
        return repository.findById(collectionId)
                .map(CollectionDuplicates::getGroups)
                .orElse(List.of());
    }

    public Optional<CollectionDuplicates> findDocument(String collectionId) {
        return repository.findById(collectionId);
    }

    public DuplicateGroup findGroup(String collectionId, String groupId) {
        return locate(loadDocument(collectionId), groupId);
    }

    /**
     * Makes {@code itemId} the primary version of the group. The item must be one of the group's versions.
     *
     * @throws OptimisticLockingFailureException when a scan replaced the groups since they were read
     */
    public DuplicateGroup selectPrimary(String collectionId, String groupId, String itemId) {
        CollectionDuplicates document = loadDocument(collectionId);
        DuplicateGroup group = locate(document, groupId);

        if (!group.containsItem(itemId)) {
            throw new IllegalArgumentException("Item " + itemId + " is not a version of group " + groupId);
        }

        group.setPrimaryVersionId(itemId);
        group.setPrimaryManuallySelected(true);
        group.setLastReviewedAt(Instant.now());
        if (group.getStatus() == ReviewStatus.PENDING) {
            group.setStatus(ReviewStatus.REVIEWED);
        }

        repository.save(document);
        log.info("Primary of group {} set to {}", groupId, itemId);
        return group;
    }

    public DuplicateGroup updateStatus(String collectionId, String groupId, ReviewStatus status) {
        if (status == null) {
            throw new IllegalArgumentException("status is required");
        }
        CollectionDuplicates document = loadDocument(collectionId);
        DuplicateGroup group = locate(document, groupId);

        ReviewStatus previous = group.getStatus();
        group.setStatus(status);
        group.setLastReviewedAt(Instant.now());

        repository.save(document);
        log.info("Updated group {} status from {} to {}", groupId, previous, status);
        return group;
    }

    /**
     * A new group inherits the review state of the first previous group whose primary is one of its versions.
     */
    void carryOverReviewState(List<DuplicateGroup> previousGroups, List<DuplicateGroup> newGroups) {
        if (previousGroups == null || previousGroups.isEmpty()) {
            return;
        }
        for (DuplicateGroup group : newGroups) {
            previousGroups.stream()
                    .filter(previous -> group.containsItem(previous.getPrimaryVersionId()))
                    .findFirst()
                    .ifPresent(previous -> {
                        group.setStatus(previous.getStatus());
                        group.setLastReviewedAt(previous.getLastReviewedAt());
                        if (previous.isPrimaryManuallySelected()) {
                            group.setPrimaryVersionId(previous.getPrimaryVersionId());
                            group.setPrimaryManuallySelected(true);
                        }
                    });
        }
    }

    private CollectionDuplicates loadDocument(String collectionId) {
        return repository.findById(collectionId)
                .orElseThrow(() -> new ResourceNotFoundException("No duplicate scan result for collection: " + collectionId));
    }

    private DuplicateGroup locate(CollectionDuplicates document, String groupId) {
        return document.getGroups().stream()
                .filter(g -> groupId.equals(g.getId()))
                .findFirst()
                .orElseThrow(() -> new ResourceNotFoundException("No duplicate group found with ID: " + groupId));
    }
}
