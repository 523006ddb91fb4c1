package com.xksgroup.mediadedup.testutil;

import com.xksgroup.mediadedup.model.catalog.MediaCollection;
import com.xksgroup.mediadedup.model.catalog.MediaItem;
import com.xksgroup.mediadedup.service.catalog.CatalogUnavailableException;
import com.xksgroup.mediadedup.service.catalog.MediaCatalog;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;

/**
 * Catalog fake keeping collections and items in memory.
 */
public class InMemoryMediaCatalog implements MediaCatalog {

    private final Map<String, MediaCollection> collections = new LinkedHashMap<>();
    private final Map<String, List<MediaItem>> itemsByCollection = new LinkedHashMap<>();
    private final Map<String, MediaItem> itemsById = new LinkedHashMap<>();
    private final Set<String> unresolvable = new HashSet<>();
    private final Set<String> unavailableCollections = new HashSet<>();

    public InMemoryMediaCatalog addCollection(String collectionId, MediaItem... items) {
        collections.put(collectionId, MediaCollection.builder().id(collectionId).name(collectionId).path("/media/" + collectionId).build());
        List<MediaItem> list = itemsByCollection.computeIfAbsent(collectionId, id -> new ArrayList<>());
        for (MediaItem item : items) {
            list.add(item);
            itemsById.put(item.getId(), item);
        }
        return this;
    }

    /**
     * The item stays listed but can no longer be resolved, like a file deleted during a scan.
     */
    public InMemoryMediaCatalog makeUnresolvable(String itemId) {
        unresolvable.add(itemId);
        return this;
    }

    public InMemoryMediaCatalog makeUnavailable(String collectionId) {
        unavailableCollections.add(collectionId);
        return this;
    }

    @Override
    public List<MediaCollection> listCollections() {
        return new ArrayList<>(collections.values());
    }

    @Override
    public List<MediaItem> listItems(String collectionId) {
        if (unavailableCollections.contains(collectionId)) {
            throw new CatalogUnavailableException("Collection " + collectionId + " is offline");
        }
        return new ArrayList<>(itemsByCollection.getOrDefault(collectionId, List.of()));
    }

    @Override
    public Optional<MediaItem> resolveItem(String itemId) {
        if (unresolvable.contains(itemId)) {
            return Optional.empty();
        }
        return Optional.ofNullable(itemsById.get(itemId));
    }
}
