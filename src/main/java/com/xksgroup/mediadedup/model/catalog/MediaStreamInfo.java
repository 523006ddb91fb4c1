package com.xksgroup.mediadedup.model.catalog;

import lombok.AllArgsConstructor;
import lombok.Builder;
import lombok.Data;
import lombok.NoArgsConstructor;

/**
 * Technical stream descriptor of a media file: first video stream and first audio stream.
 * Every field is nullable, a missing value means the catalog could not report it.
 */
@Data
@Builder
@NoArgsConstructor
@AllArgsConstructor
public class MediaStreamInfo {
    private Integer videoWidth;
    private Integer videoHeight;
    private String videoCodec;
    private String videoProfile;
    private String videoRange;     // SDR, HDR10, HLG, DOVI...
    private Long videoBitRate;     // bits per second

    private String audioCodec;
    private Integer audioChannels;
}
