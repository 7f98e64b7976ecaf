package com.dcruver.marginnote.domain;

import java.nio.charset.StandardCharsets;

/**
 * Best-effort sniffing of media blobs. Raster images are found by signature, anywhere in the
 * blob since images are often wrapped in an archive; ink and coordinate blobs by class-name markers.
 */
public class MediaClassifier {

    private static final byte[] PNG_SIGNATURE = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A};
    private static final byte[] JPEG_SIGNATURE = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF};
    private static final String INK_MARKER = "apple.ink.pen";
    private static final String STROKE_MARKER = "wrd";
    private static final String RECT_MARKER = "CGRect";
    static final int TEXT_SAMPLE_LENGTH = 200;

    public MediaRecord classify(String hash, byte[] data) {
        MediaRecord.MediaRecordBuilder builder = MediaRecord.builder().hash(hash).rawData(data);
        if (data == null || data.length == 0) {
            return builder.kind(MediaKind.UNCLASSIFIED).build();
        }

        int image = indexOf(data, PNG_SIGNATURE);
        if (image < 0 && startsWith(data, JPEG_SIGNATURE)) {
            image = 0;
        }
        if (image >= 0) {
            byte[] imageData = new byte[data.length - image];
            System.arraycopy(data, image, imageData, 0, imageData.length);
            return builder.kind(MediaKind.RASTER_IMAGE).imageData(imageData).build();
        }

        // markers are ASCII, so a byte-per-char view is enough to search them
        String text = new String(data, StandardCharsets.ISO_8859_1);
        if (text.contains(INK_MARKER)) {
            return builder.kind(MediaKind.INK_DRAWING).hasStrokes(text.contains(STROKE_MARKER)).build();
        }
        if (text.contains(RECT_MARKER)) {
            String sample = new String(data, StandardCharsets.UTF_8);
            return builder.kind(MediaKind.COORDINATES)
                .textSample(sample.substring(0, Math.min(TEXT_SAMPLE_LENGTH, sample.length())))
                .build();
        }
        return builder.kind(MediaKind.UNCLASSIFIED).build();
    }

    private static boolean startsWith(byte[] data, byte[] prefix) {
        if (data.length < prefix.length) {
            return false;
        }
        for (int i = 0; i < prefix.length; i++) {
            if (data[i] != prefix[i]) {
                return false;
            }
        }
        return true;
    }

    private static int indexOf(byte[] data, byte[] pattern) {
        outer:
        for (int i = 0; i <= data.length - pattern.length; i++) {
            for (int j = 0; j < pattern.length; j++) {
                if (data[i + j] != pattern[j]) {
                    continue outer;
                }
            }
            return i;
        }
        return -1;
    }
}
