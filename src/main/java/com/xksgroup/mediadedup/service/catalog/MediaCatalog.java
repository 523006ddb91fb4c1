package com.xksgroup.mediadedup.service.catalog;

import com.xksgroup.mediadedup.model.catalog.MediaCollection;
import com.xksgroup.mediadedup.model.catalog.MediaItem;

import java.util.List;
import java.util.Optional;

/**
 * Read access to the media library. The detection pipeline only talks to the catalog through this interface.
 */
public interface MediaCatalog {

    List<MediaCollection> listCollections();

    /**
     * Movies and episodes found recursively under the collection.
     *
     * @throws CatalogUnavailableException when the collection cannot be read at all
     */
    List<MediaItem> listItems(String collectionId);

    Optional<MediaItem> resolveItem(String itemId);

    default List<String> getPeople(MediaItem item) {
        return item.getPeople() != null ? item.getPeople() : List.of();
    }
}
