package com.dcruver.marginnote.domain;

import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertTrue;

class MediaClassifierTest {

    private final MediaClassifier classifier = new MediaClassifier();

    @Test
    void testPngInsideWrapper() {
        byte[] png = {(byte) 0x89, 'P', 'N', 'G', 0x0D, 0x0A, 0x1A, 0x0A, 1, 2};
        byte[] data = new byte[png.length + 3];
        System.arraycopy(png, 0, data, 3, png.length);

        MediaRecord media = classifier.classify("h", data);

        assertEquals(MediaKind.RASTER_IMAGE, media.getKind());
        assertArrayEquals(png, media.getImageData());
        assertEquals(data.length, media.size());
    }

    @Test
    void testLeadingJpeg() {
        byte[] jpeg = {(byte) 0xFF, (byte) 0xD8, (byte) 0xFF, (byte) 0xE0, 0};

        assertEquals(MediaKind.RASTER_IMAGE, classifier.classify("h", jpeg).getKind());
    }

    @Test
    void testInkDrawing() {
        MediaRecord withStrokes = classifier.classify("h",
            "bplist..com.apple.ink.pen..wrd".getBytes(StandardCharsets.US_ASCII));
        MediaRecord withoutStrokes = classifier.classify("h",
            "com.apple.ink.pen".getBytes(StandardCharsets.US_ASCII));

        assertEquals(MediaKind.INK_DRAWING, withStrokes.getKind());
        assertTrue(withStrokes.isHasStrokes());
        assertFalse(withoutStrokes.isHasStrokes());
    }

    @Test
    void testCoordinatesKeepShortSample() {
        String text = "CGRect " + "x".repeat(500);

        MediaRecord media = classifier.classify("h", text.getBytes(StandardCharsets.UTF_8));

        assertEquals(MediaKind.COORDINATES, media.getKind());
        assertEquals(MediaClassifier.TEXT_SAMPLE_LENGTH, media.getTextSample().length());
    }

    @Test
    void testUnknownAndEmpty() {
        assertEquals(MediaKind.UNCLASSIFIED, classifier.classify("h", new byte[]{1, 2, 3}).getKind());
        assertEquals(MediaKind.UNCLASSIFIED, classifier.classify("h", new byte[0]).getKind());
        assertEquals(0, classifier.classify("h", null).size());
    }
}
