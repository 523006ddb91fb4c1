package com.xksgroup.mediadedup.service.helper;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.xksgroup.mediadedup.model.catalog.MediaStreamInfo;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.attribute.BasicFileAttributes;
import java.nio.file.attribute.FileTime;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Iterator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.ConcurrentHashMap;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.stream.Collectors;

/**
 * Reads stream descriptors and container tags of media files with ffprobe.
 */
@Slf4j
@Component
public class FfprobeHelper {

    private static final ObjectMapper OBJECT_MAPPER = new ObjectMapper();
    private static final long PROBE_TIMEOUT_SECONDS = 60;

    private final ExecutorService outputReaders = Executors.newCachedThreadPool();

    // One ffprobe run per file version, keyed by absolute path and checked against size and mtime
    private final Map<String, CachedInfo> infoCache = new ConcurrentHashMap<>();

    /**
     * Check if ffprobe is available in the system PATH
     */
    public boolean isFfprobeAvailable() {
        try {
            Process process = new ProcessBuilder("ffprobe", "-version").redirectErrorStream(true).start();
            process.getInputStream().transferTo(OutputStream.nullOutputStream());
            return process.waitFor() == 0;
        } catch (IOException e) {
            log.warn("ffprobe availability check failed: {}", e.getMessage());
            return false;
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            return false;
        }
    }

    /**
     * Single ffprobe call (JSON) cached per absolute path. A file replaced in place (other size or
     * modification time) goes through ffprobe again.
     */
    public ProbeInfo probeMedia(Path inputFile) throws IOException, InterruptedException {
        Path absolute = inputFile.toAbsolutePath().normalize();
        String key = absolute.toString();
        BasicFileAttributes attributes = Files.readAttributes(absolute, BasicFileAttributes.class);

        CachedInfo cached = infoCache.get(key);
        if (cached != null && cached.matches(attributes)) {
            return cached.info();
        }

        ProbeInfo info = parseProbeOutput(runFfprobe(key));
        infoCache.put(key, new CachedInfo(attributes.size(), attributes.lastModifiedTime(), info));
        return info;
    }

    public void evict(Path inputFile) {
        infoCache.remove(inputFile.toAbsolutePath().normalize().toString());
    }

    int cacheSize() {
        return infoCache.size();
    }

    String runFfprobe(String file) throws IOException, InterruptedException {
        List<String> command = List.of(
                "ffprobe", "-v", "quiet",
                "-print_format", "json",
                "-show_streams", "-show_format",
                file
        );
        return runCommand(command, file, PROBE_TIMEOUT_SECONDS);
    }

    /**
     * Runs the command and returns its stdout. Stdout is drained on a reader thread so the timeout
     * also applies to a process that never closes its output.
     */
    String runCommand(List<String> command, String file, long timeoutSeconds) throws IOException, InterruptedException {
        Process process = new ProcessBuilder(command).start();
        try {
            Future<String> stdout = outputReaders.submit(() -> {
                try (InputStream in = process.getInputStream()) {
                    return new String(in.readAllBytes(), StandardCharsets.UTF_8);
                }
            });

            if (!process.waitFor(timeoutSeconds, TimeUnit.SECONDS)) {
                stdout.cancel(true);
                throw new IOException("ffprobe timed out for " + file);
            }
            if (process.exitValue() != 0) {
                throw new IOException("ffprobe exited with code " + process.exitValue() + " for " + file);
            }
            return stdout.get(timeoutSeconds, TimeUnit.SECONDS);
        } catch (ExecutionException e) {
            throw new IOException("Failed to read ffprobe output for " + file, e.getCause());
        } catch (TimeoutException e) {
            throw new IOException("ffprobe output not closed for " + file, e);
        } finally {
            if (process.isAlive()) {
                process.destroyForcibly();
            }
        }
    }

    @PreDestroy
    public void shutdown() {
        outputReaders.shutdownNow();
    }

    ProbeInfo parseProbeOutput(String json) throws JsonProcessingException {
        JsonNode root = OBJECT_MAPPER.readTree(json);

        MediaStreamInfo.MediaStreamInfoBuilder streams = MediaStreamInfo.builder();
        boolean hasVideo = false;
        boolean hasAudio = false;

        for (JsonNode stream : root.path("streams")) {
            String codecType = stream.path("codec_type").asText("");
            // attached cover art shows up as a video stream
            boolean attachedPicture = stream.path("disposition").path("attached_pic").asInt(0) == 1;

            if ("video".equalsIgnoreCase(codecType) && !hasVideo && !attachedPicture) {
                hasVideo = true;
                streams.videoWidth(positiveOrNull(stream.path("width").asInt(0)))
                        .videoHeight(positiveOrNull(stream.path("height").asInt(0)))
                        .videoCodec(textOrNull(stream, "codec_name"))
                        .videoProfile(videoProfile(stream))
                        .videoRange(videoRange(stream))
                        .videoBitRate(bitRate(stream, root.path("format")));
            } else if ("audio".equalsIgnoreCase(codecType) && !hasAudio) {
                hasAudio = true;
                int channels = stream.path("channels").asInt(0);
                streams.audioCodec(audioCodec(stream))
                        .audioChannels(positiveOrNull(channels));
            }
        }

        JsonNode format = root.path("format");
        Map<String, String> tags = lowerCaseTags(format.path("tags"));

        Duration duration = null;
        double seconds = format.path("duration").asDouble(0);
        if (seconds > 0) {
            duration = Duration.ofMillis(Math.round(seconds * 1000));
        }

        return new ProbeInfo(
                hasVideo || hasAudio ? streams.build() : null,
                duration,
                tags.get("title"),
                splitList(tags.get("genre")),
                Optional.ofNullable(tags.get("description")).orElse(tags.get("comment")),
                Optional.ofNullable(tags.get("date")).orElse(tags.get("year")),
                splitList(Optional.ofNullable(tags.get("director")).orElse(tags.get("artist"))),
                splitList(Optional.ofNullable(tags.get("studio")).orElse(tags.get("publisher")))
        );
    }

    private String videoProfile(JsonNode stream) {
        for (JsonNode sideData : stream.path("side_data_list")) {
            String type = sideData.path("side_data_type").asText("");
            if (type.contains("DOVI")) {
                return "Dolby Vision";
            }
            if (type.contains("SMPTE2094-40")) {
                return "HDR10+";
            }
        }
        return textOrNull(stream, "profile");
    }

    private String videoRange(JsonNode stream) {
        String transfer = stream.path("color_transfer").asText("").toLowerCase(Locale.ROOT);
        return switch (transfer) {
            case "smpte2084" -> "HDR10";
            case "arib-std-b67" -> "HLG";
            default -> "SDR";
        };
    }

    private String audioCodec(JsonNode stream) {
        String codec = stream.path("codec_name").asText("").toUpperCase(Locale.ROOT);
        if (codec.isEmpty()) {
            return null;
        }
        // the profile carries the premium variant: "DTS-HD MA", "DTS:X", "Dolby TrueHD + Dolby Atmos"
        String profile = stream.path("profile").asText("");
        String upperProfile = profile.toUpperCase(Locale.ROOT);
        if (upperProfile.contains("ATMOS") || upperProfile.contains("DTS")) {
            return codec + " " + profile;
        }
        return codec;
    }

    private Long bitRate(JsonNode stream, JsonNode format) {
        long streamRate = stream.path("bit_rate").asLong(0);
        if (streamRate > 0) {
            return streamRate;
        }
        // MKV rarely reports per-stream rates, the container rate is the closest figure
        long containerRate = format.path("bit_rate").asLong(0);
        return containerRate > 0 ? containerRate : null;
    }

    private Map<String, String> lowerCaseTags(JsonNode tagsNode) {
        Map<String, String> tags = new LinkedHashMap<>();
        Iterator<Map.Entry<String, JsonNode>> fields = tagsNode.fields();
        while (fields.hasNext()) {
            Map.Entry<String, JsonNode> field = fields.next();
            String value = field.getValue().asText("").trim();
            if (!value.isEmpty()) {
                tags.putIfAbsent(field.getKey().toLowerCase(Locale.ROOT), value);
            }
        }
        return tags;
    }

    private List<String> splitList(String raw) {
        if (raw == null || raw.isBlank()) {
            return new ArrayList<>();
        }
        return Arrays.stream(raw.split("[;,/]"))
                .map(String::trim)
                .filter(s -> !s.isEmpty())
                .collect(Collectors.toCollection(ArrayList::new));
    }

    private static Integer positiveOrNull(int value) {
        return value > 0 ? value : null;
    }

    private static String textOrNull(JsonNode node, String field) {
        String value = node.path(field).asText("");
        return value.isEmpty() ? null : value;
    }

    private record CachedInfo(long size, FileTime lastModified, ProbeInfo info) {
        boolean matches(BasicFileAttributes attributes) {
            return size == attributes.size() && lastModified.equals(attributes.lastModifiedTime());
        }
    }

    /**
     * What ffprobe reports about one file. {@code streams} is null when no audio or video stream was found.
     */
    public record ProbeInfo(
            MediaStreamInfo streams,
            Duration duration,
            String title,
            List<String> genres,
            String description,
            String date,
            List<String> people,
            List<String> studios
    ) {
        public boolean isValidMedia() {
            return streams != null;
        }
    }
}
