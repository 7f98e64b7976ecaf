package com.dcruver.marginnote.domain;

import lombok.Builder;
import lombok.Data;

/**
 * A media blob keyed by its content hash. Notes refer to media by hash only.
 */
@Data
@Builder
public class MediaRecord {
    private final String hash;
    private final MediaKind kind;
    private final byte[] rawData;

    // Raster images: bytes starting at the image signature
    private final byte[] imageData;

    // Ink drawings
    private final boolean hasStrokes;

    // Coordinate blobs: leading text sample for inspection
    private final String textSample;

    public int size() {
        return rawData != null ? rawData.length : 0;
    }
}
