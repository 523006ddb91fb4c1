package com.xksgroup.mediadedup.service.catalog;

import com.xksgroup.mediadedup.config.DedupProperties;
import com.xksgroup.mediadedup.model.catalog.MediaCollection;
import com.xksgroup.mediadedup.model.catalog.MediaItem;
import com.xksgroup.mediadedup.service.helper.FfprobeHelper;
import com.xksgroup.mediadedup.service.helper.ReleaseNameParser;
import com.xksgroup.mediadedup.service.helper.ReleaseNameParser.ParsedRelease;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.LocalDate;
import java.time.format.DateTimeParseException;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.UUID;
import java.util.concurrent.ConcurrentHashMap;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * Catalog over the library folders configured under {@code dedup.catalog.libraries}.
 *
 * <p>Metadata comes from release style names of the file and its parent folder, technical data and
 * embedded tags from ffprobe. Item ids are name based UUIDs of the absolute file path, so they stay
 * stable between scans as long as the file is not moved.
 */
@Slf4j
@Component
@RequiredArgsConstructor
public class FileSystemMediaCatalog implements MediaCatalog {

    private final DedupProperties properties;
    private final ReleaseNameParser releaseNameParser;
    private final FfprobeHelper ffprobeHelper;

    // Items seen by the last listing of each collection, used to resolve ids afterwards
    private final Map<String, MediaItem> itemCache = new ConcurrentHashMap<>();

    @Override
    public List<MediaCollection> listCollections() {
        return properties.getCatalog().getLibraries().stream()
                .filter(library -> library.getPath() != null && !library.getPath().isBlank())
                .map(library -> MediaCollection.builder()
                        .id(collectionId(library))
                        .name(library.getName() != null ? library.getName() : Paths.get(library.getPath()).getFileName().toString())
                        .path(library.getPath())
                        .build())
                .collect(Collectors.toList());
    }

    @Override
    public List<MediaItem> listItems(String collectionId) {
        Optional<MediaCollection> collection = listCollections().stream()
                .filter(c -> c.getId().equals(collectionId))
                .findFirst();
        if (collection.isEmpty()) {
            log.warn("Unknown collection {}, nothing to scan", collectionId);
            return List.of();
        }

        Path root = Paths.get(collection.get().getPath());
        if (!Files.isDirectory(root)) {
            throw new CatalogUnavailableException("Library folder not reachable: " + root);
        }

        Set<String> extensions = properties.getCatalog().getVideoExtensions().stream()
                .map(ext -> ext.toLowerCase(Locale.ROOT))
                .collect(Collectors.toSet());

        List<Path> files;
        try (Stream<Path> walk = Files.walk(root)) {
            files = walk.filter(Files::isRegularFile)
                    .filter(path -> extensions.contains(extension(path.getFileName().toString())))
                    .sorted()
                    .collect(Collectors.toList());
        } catch (IOException | UncheckedIOException e) {
            throw new CatalogUnavailableException("Failed to walk library folder " + root, e);
        }

        List<MediaItem> items = new ArrayList<>(files.size());
        for (Path file : files) {
            MediaItem item = buildItem(file);
            itemCache.put(item.getId(), item);
            items.add(item);
        }
        log.debug("Collection {}: {} video files under {}", collectionId, items.size(), root);
        return items;
    }

    @Override
    public Optional<MediaItem> resolveItem(String itemId) {
        if (itemId == null) {
            return Optional.empty();
        }
        MediaItem item = itemCache.get(itemId);
        if (item == null) {
            return Optional.empty();
        }
        Path path = Paths.get(item.getPath());
        if (!Files.exists(path)) {
            log.debug("Item {} no longer exists at {}", itemId, path);
            itemCache.remove(itemId);
            ffprobeHelper.evict(path);
            return Optional.empty();
        }
        return Optional.of(item);
    }

    MediaItem buildItem(Path file) {
        Path absolute = file.toAbsolutePath().normalize();
        String fileName = absolute.getFileName().toString();

        ParsedRelease fromFile = releaseNameParser.parse(stripExtension(fileName));
        ParsedRelease fromFolder = absolute.getParent() != null && absolute.getParent().getFileName() != null
                ? releaseNameParser.parse(absolute.getParent().getFileName().toString())
                : releaseNameParser.parse(null);

        Map<String, String> providerIds = new LinkedHashMap<>(fromFolder.providerIds());
        providerIds.putAll(fromFile.providerIds());

        MediaItem.MediaItemBuilder builder = MediaItem.builder()
                .id(itemId(absolute))
                .name(!fromFile.title().isEmpty() ? fromFile.title() : fromFolder.title())
                .productionYear(fromFile.year() != null ? fromFile.year() : fromFolder.year())
                .providerIds(providerIds)
                .path(absolute.toString());

        MediaItem item = builder.build();
        if (properties.getCatalog().isFfprobeEnabled()) {
            applyProbe(item, absolute);
        }
        return item;
    }

    private void applyProbe(MediaItem item, Path file) {
        FfprobeHelper.ProbeInfo probe;
        try {
            probe = ffprobeHelper.probeMedia(file);
        } catch (IOException e) {
            log.warn("ffprobe failed for {}: {}", file, e.getMessage());
            return;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            log.warn("ffprobe interrupted for {}", file);
            return;
        }

        item.setStreams(probe.streams());
        item.setRuntime(probe.duration());
        item.getGenres().addAll(probe.genres());
        item.getPeople().addAll(probe.people());
        item.getStudios().addAll(probe.studios());
        item.setOverview(probe.description());

        if ((item.getName() == null || item.getName().isEmpty()) && probe.title() != null) {
            item.setName(probe.title());
        }
        LocalDate premiere = parseDate(probe.date());
        item.setPremiereDate(premiere);
        if (item.getProductionYear() == null && premiere != null) {
            item.setProductionYear(premiere.getYear());
        }
    }

    private LocalDate parseDate(String raw) {
        if (raw == null || raw.length() < 4) {
            return null;
        }
        try {
            if (raw.length() >= 10) {
                return LocalDate.parse(raw.substring(0, 10));
            }
            return LocalDate.of(Integer.parseInt(raw.substring(0, 4)), 1, 1);
        } catch (DateTimeParseException | NumberFormatException e) {
            log.debug("Ignoring unparsable date tag '{}'", raw);
            return null;
        }
    }

    static String itemId(Path absolutePath) {
        return UUID.nameUUIDFromBytes(absolutePath.toString().getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String collectionId(DedupProperties.Library library) {
        if (library.getId() != null && !library.getId().isBlank()) {
            return library.getId();
        }
        String normalized = Paths.get(library.getPath()).toAbsolutePath().normalize().toString();
        return UUID.nameUUIDFromBytes(normalized.getBytes(StandardCharsets.UTF_8)).toString();
    }

    private static String extension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot < 0 ? "" : fileName.substring(dot + 1).toLowerCase(Locale.ROOT);
    }

    private static String stripExtension(String fileName) {
        int dot = fileName.lastIndexOf('.');
        return dot <= 0 ? fileName : fileName.substring(0, dot);
    }
}
