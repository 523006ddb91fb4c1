package com.xksgroup.mediadedup.service.quality;

import com.xksgroup.mediadedup.model.catalog.MediaItem;
import com.xksgroup.mediadedup.model.catalog.MediaStreamInfo;
import org.springframework.stereotype.Component;

import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.util.Locale;

/**
 * Reduces raw stream data of an item to the labels used by the priority lists.
 */
@Component
public class TechnicalAttributeExtractor {

    public static final String UNKNOWN_SOURCE = "Unknown";

    public TechnicalAttributes extract(MediaItem item) {
        MediaStreamInfo streams = item.getStreams();
        String sourceType = sourceType(item.getPath());
        if (streams == null) {
            return new TechnicalAttributes("", "", "", "", "", "", sourceType, 0);
        }

        boolean hasVideo = streams.getVideoCodec() != null || streams.getVideoHeight() != null;
        String resolution = resolution(streams.getVideoHeight());
        String dynamicRange = hasVideo ? dynamicRange(streams.getVideoProfile(), streams.getVideoRange()) : "";
        String codec = codec(streams.getVideoCodec());

        String channels = streams.getAudioChannels() != null ? channelLabel(streams.getAudioChannels()) : "";
        String audioCodec = streams.getAudioCodec() != null ? streams.getAudioCodec() : "";
        String audioFormat = audioFormat(audioCodec, channels);

        int bitrate = streams.getVideoBitRate() != null ? (int) (streams.getVideoBitRate() / 1000) : 0;

        return new TechnicalAttributes(resolution, dynamicRange, codec, audioCodec, channels, audioFormat, sourceType, bitrate);
    }

    /**
     * Resolution bucket from the reported frame height.
     */
    public String resolution(Integer height) {
        if (height == null) {
            return "";
        }
        if (height >= 2160) return "2160p";
        if (height >= 1440) return "1440p";
        if (height >= 1080) return "1080p";
        if (height >= 720) return "720p";
        if (height >= 576) return "576p";
        if (height >= 480) return "480p";
        return "";
    }

    public String dynamicRange(String profile, String videoRange) {
        String p = profile != null ? profile.toUpperCase(Locale.ROOT) : "";
        if (p.contains("DOLBY VISION")) {
            return "Dolby Vision";
        }
        if (p.contains("HDR10+") || p.contains("HDR10PLUS")) {
            return "HDR10+";
        }

        String range = videoRange != null ? videoRange.toUpperCase(Locale.ROOT) : "";
        if (range.contains("HDR")) {
            return "HDR10";
        }
        if (range.contains("HLG")) {
            return "HLG";
        }
        return "SDR";
    }

    public String codec(String rawCodec) {
        if (rawCodec == null || rawCodec.isEmpty()) {
            return "";
        }
        String codec = rawCodec.toUpperCase(Locale.ROOT);
        if (codec.contains("HEVC") || codec.contains("H265") || codec.contains("H.265")) {
            return "HEVC";
        }
        if (codec.contains("H264") || codec.contains("H.264") || codec.contains("AVC")) {
            return "H.264";
        }
        if (codec.contains("AV1")) {
            return "AV1";
        }
        if (codec.contains("VP9")) {
            return "VP9";
        }
        if (codec.contains("MPEG")) {
            return "MPEG-4";
        }
        return codec;
    }

    public String channelLabel(int channels) {
        switch (channels) {
            case 8:
                return "7.1";
            case 6:
                return "5.1";
            case 2:
                return "Stereo";
            case 1:
                return "Mono";
            default:
                return String.valueOf(channels);
        }
    }

    public String audioFormat(String rawCodec, String channels) {
        if (rawCodec == null || rawCodec.isEmpty()) {
            return "";
        }
        String codec = rawCodec.toUpperCase(Locale.ROOT);

        // Premium formats first
        if (codec.contains("ATMOS")) {
            return "Dolby Atmos";
        }
        if (codec.contains("DTS:X") || codec.contains("DTSX")) {
            return "DTS:X";
        }
        if (codec.contains("TRUEHD")) {
            return "7.1".equals(channels) ? "TrueHD 7.1" : "TrueHD 5.1";
        }
        if (codec.contains("DTS-HD") || codec.contains("DTSHD")) {
            return "7.1".equals(channels) ? "DTS-HD MA 7.1" : "DTS-HD MA 5.1";
        }
        if (codec.contains("AC3") || codec.contains("DD")) {
            return "AC3 5.1";
        }
        if (codec.contains("AAC")) {
            return "AAC Stereo";
        }
        return (codec + " " + (channels != null ? channels : "")).trim();
    }

    /**
     * Source type inferred from release name markers in the file name.
     */
    public String sourceType(String filePath) {
        String fileName = fileName(filePath).toUpperCase(Locale.ROOT);

        if (fileName.contains("REMUX")) {
            return "Remux";
        }
        if (fileName.contains("BLURAY") || fileName.contains("BLU-RAY")) {
            return "BluRay";
        }
        if (fileName.contains("WEB-DL") || fileName.contains("WEBDL")) {
            return "WEB-DL";
        }
        if (fileName.contains("WEBRIP")) {
            return "WEBRip";
        }
        if (fileName.contains("HDTV")) {
            return "HDTV";
        }
        if (fileName.contains("DVDRIP") || fileName.contains("DVD-RIP")) {
            return "DVDRip";
        }
        return UNKNOWN_SOURCE;
    }

    private String fileName(String filePath) {
        if (filePath == null || filePath.isEmpty()) {
            return "";
        }
        try {
            Path name = Path.of(filePath).getFileName();
            return name != null ? name.toString() : "";
        } catch (InvalidPathException e) {
            int slash = Math.max(filePath.lastIndexOf('/'), filePath.lastIndexOf('\\'));
            return filePath.substring(slash + 1);
        }
    }
}
