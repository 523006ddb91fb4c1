package com.xksgroup.mediadedup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;
import org.springframework.data.annotation.Id;
import org.springframework.data.annotation.Version;
import org.springframework.data.mongodb.core.mapping.Document;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;

/**
 * Detection output of the last completed scan of one collection, stored as a single document.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
@Document(collection = "collection_duplicates")
public class CollectionDuplicates {
    @Id
    private String collectionId;

    @Builder.Default
    private List<DuplicateGroup> groups = new ArrayList<>();

    private String scanJobId;
    private Instant scannedAt;

    // Optimistic lock, a save based on a stale read fails instead of overwriting newer groups
    @Version
    private Long version;
}
