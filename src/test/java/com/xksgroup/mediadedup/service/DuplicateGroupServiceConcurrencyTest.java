package com.xksgroup.mediadedup.service;

import com.xksgroup.mediadedup.model.CollectionDuplicates;
import com.xksgroup.mediadedup.model.DuplicateGroup;
import com.xksgroup.mediadedup.model.ReviewStatus;
import com.xksgroup.mediadedup.model.VersionRecord;
import com.xksgroup.mediadedup.repo.CollectionDuplicatesRepository;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.extension.ExtendWith;
import org.mockito.Mock;
import org.mockito.junit.jupiter.MockitoExtension;
import org.springframework.dao.OptimisticLockingFailureException;

import java.time.Instant;
import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static org.assertj.core.api.Assertions.assertThat;
import static org.assertj.core.api.Assertions.assertThatThrownBy;
import static org.mockito.ArgumentMatchers.any;
import static org.mockito.ArgumentMatchers.anyString;
import static org.mockito.Mockito.when;

/**
 * Scans and reviews writing the same collection document. The repository double keeps a version per
 * document and rejects stale saves the way Spring Data does for {@code @Version} fields.
 */
@ExtendWith(MockitoExtension.class)
class DuplicateGroupServiceConcurrencyTest {

    @Mock
    private CollectionDuplicatesRepository repository;

    private final Map<String, CollectionDuplicates> stored = new HashMap<>();
    private Runnable onNextRead;
    private DuplicateGroupService service;

    @BeforeEach
    void setUp() {
        when(repository.findById(anyString())).thenAnswer(inv -> read(inv.getArgument(0)));
        when(repository.save(any(CollectionDuplicates.class))).thenAnswer(inv -> write(inv.getArgument(0)));
        service = new DuplicateGroupService(repository);

        write(CollectionDuplicates.builder()
                .collectionId("movies")
                .groups(new ArrayList<>(List.of(group("old", "a", "b"))))
                .scanJobId("scan-1")
                .build());
    }

    @Test
    void should_RejectReview_When_ScanReplacedGroupsMeanwhile() {
        onNextRead = () -> service.saveScanResult("movies", "scan-2", List.of(group("new", "a", "b", "c")));

        assertThatThrownBy(() -> service.selectPrimary("movies", "old", "b"))
                .isInstanceOf(OptimisticLockingFailureException.class);

        CollectionDuplicates current = stored.get("movies");
        assertThat(current.getScanJobId()).isEqualTo("scan-2");
        assertThat(current.getGroups()).extracting(DuplicateGroup::getId).containsExactly("new");
    }

    @Test
    void should_ApplyReview_When_RetriedOnFreshGroups() {
        onNextRead = () -> service.saveScanResult("movies", "scan-2", List.of(group("new", "a", "b", "c")));
        assertThatThrownBy(() -> service.selectPrimary("movies", "old", "b"))
                .isInstanceOf(OptimisticLockingFailureException.class);

        service.selectPrimary("movies", "new", "b");

        DuplicateGroup current = stored.get("movies").getGroups().get(0);
        assertThat(current.getPrimaryVersionId()).isEqualTo("b");
        assertThat(current.isPrimaryManuallySelected()).isTrue();
        assertThat(stored.get("movies").getScanJobId()).isEqualTo("scan-2");
    }

    @Test
    void should_KeepConcurrentReview_When_ScanSaves() {
        onNextRead = () -> service.selectPrimary("movies", "old", "b");

        service.saveScanResult("movies", "scan-2", List.of(group("new", "a", "b", "c")));

        CollectionDuplicates current = stored.get("movies");
        assertThat(current.getScanJobId()).isEqualTo("scan-2");
        DuplicateGroup group = current.getGroups().get(0);
        assertThat(group.getId()).isEqualTo("new");
        assertThat(group.getPrimaryVersionId()).isEqualTo("b");
        assertThat(group.isPrimaryManuallySelected()).isTrue();
        assertThat(group.getStatus()).isEqualTo(ReviewStatus.REVIEWED);
    }

    private Optional<CollectionDuplicates> read(String collectionId) {
        Optional<CollectionDuplicates> snapshot = Optional.ofNullable(stored.get(collectionId)).map(this::copy);
        if (onNextRead != null) {
            Runnable concurrentWrite = onNextRead;
            onNextRead = null;
            concurrentWrite.run();
        }
        return snapshot;
    }

    private CollectionDuplicates write(CollectionDuplicates document) {
        CollectionDuplicates current = stored.get(document.getCollectionId());
        Long expected = current != null ? current.getVersion() : null;
        if (!Objects.equals(expected, document.getVersion())) {
            throw new OptimisticLockingFailureException("Stale version " + document.getVersion() + ", stored " + expected);
        }
        CollectionDuplicates saved = copy(document);
        saved.setVersion(expected == null ? 0L : expected + 1);
        stored.put(saved.getCollectionId(), saved);
        return copy(saved);
    }

    private CollectionDuplicates copy(CollectionDuplicates document) {
        return CollectionDuplicates.builder()
                .collectionId(document.getCollectionId())
                .groups(document.getGroups().stream().map(this::copy).collect(Collectors.toCollection(ArrayList::new)))
                .scanJobId(document.getScanJobId())
                .scannedAt(document.getScannedAt())
                .version(document.getVersion())
                .build();
    }

    private DuplicateGroup copy(DuplicateGroup group) {
        return DuplicateGroup.builder()
                .id(group.getId())
                .collectionId(group.getCollectionId())
                .primaryVersionId(group.getPrimaryVersionId())
                .primaryManuallySelected(group.isPrimaryManuallySelected())
                .versions(new ArrayList<>(group.getVersions()))
                .mergedMetadata(group.getMergedMetadata())
                .detectedAt(group.getDetectedAt())
                .lastReviewedAt(group.getLastReviewedAt())
                .status(group.getStatus())
                .build();
    }

    private static DuplicateGroup group(String id, String... itemIds) {
        List<VersionRecord> versions = new ArrayList<>();
        for (String itemId : itemIds) {
            versions.add(VersionRecord.builder().itemId(itemId).filePath("/media/" + itemId + ".mkv").build());
        }
        return DuplicateGroup.builder()
                .id(id)
                .collectionId("movies")
                .primaryVersionId(itemIds[0])
                .versions(versions)
                .detectedAt(Instant.now())
                .build();
    }
}
