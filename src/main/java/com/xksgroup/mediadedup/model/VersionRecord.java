package com.xksgroup.mediadedup.model;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

import java.util.ArrayList;
import java.util.List;

/**
 * One member of a duplicate group. Technical labels and score are filled by the quality scorer,
 * {@code metadataContribution} by the metadata merger.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class VersionRecord {
    private String itemId;
    private String filePath;
    private int qualityScore;

    @Builder.Default
    private String resolution = "";   // 2160p, 1080p...
    @Builder.Default
    private String codec = "";        // HEVC, H.264...
    @Builder.Default
    private String dynamicRange = ""; // HDR10, SDR...
    @Builder.Default
    private String audioCodec = "";
    @Builder.Default
    private String audioChannels = "";
    @Builder.Default
    private String audioFormat = "";  // Dolby Atmos, AAC Stereo...
    @Builder.Default
    private String sourceType = "";   // Remux, WEB-DL...

    private long fileSize;
    private int bitrate;              // kbps

    @Builder.Default
    private List<String> metadataContribution = new ArrayList<>();
}
