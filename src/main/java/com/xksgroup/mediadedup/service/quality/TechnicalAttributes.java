package com.xksgroup.mediadedup.service.quality;

/**
 * Normalized categorical attributes of one media file. Empty strings mean the stream data was missing.
 */
public record TechnicalAttributes(
        String resolution,
        String dynamicRange,
        String codec,
        String audioCodec,
        String audioChannels,
        String audioFormat,
        String sourceType,
        int bitrateKbps
) {
    public static final TechnicalAttributes EMPTY = new TechnicalAttributes("", "", "", "", "", "", "", 0);
}
