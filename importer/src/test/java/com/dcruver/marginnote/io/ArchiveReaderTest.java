package com.dcruver.marginnote.io;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.nio.charset.StandardCharsets;
import java.util.List;
import java.util.Random;

import static org.junit.jupiter.api.Assertions.*;

/**
 * Tests for reading entries out of ZIP containers.
 */
class ArchiveReaderTest {

    private static final List<String> DATABASE_PATTERNS = List.of("\\.marginnotes$", "\\.db$", "\\.sqlite$", "marginNote");

    private ArchiveReader reader;

    @BeforeEach
    void setUp() {
        reader = new ArchiveReader(64L * 1024 * 1024, DATABASE_PATTERNS);
    }

    @Test
    void testStoredEntriesRoundTrip() throws Exception {
        byte[] binary = new byte[300];
        new Random(7).nextBytes(binary);
        byte[] zip = new TestArchiveBuilder()
            .stored("readme.txt", "hello")
            .stored("data/blob.bin", binary)
            .stored("empty", new byte[0])
            .build();

        ArchiveExtraction extraction = reader.extractMatching(zip, entry -> true);

        assertFalse(extraction.hasFailures());
        assertEquals(List.of("readme.txt", "data/blob.bin", "empty"), List.copyOf(extraction.payloads().keySet()));
        assertArrayEquals("hello".getBytes(StandardCharsets.UTF_8), extraction.payloads().get("readme.txt"));
        assertArrayEquals(binary, extraction.payloads().get("data/blob.bin"));
        assertEquals(0, extraction.payloads().get("empty").length);
    }

    @Test
    void testDeflatedEntriesAtEveryLevel() throws Exception {
        byte[] data = ("MarginNote excerpt text repeated for compression. ".repeat(200)
            + "tail").getBytes(StandardCharsets.UTF_8);

        for (int level = 0; level <= 9; level++) {
            byte[] zip = new TestArchiveBuilder().deflated("notes.db", data, level).build();
            List<ArchiveEntry> entries = reader.listEntries(zip);

            assertEquals(1, entries.size());
            assertEquals(ArchiveEntry.METHOD_DEFLATE, entries.get(0).method());
            assertArrayEquals(data, reader.extract(zip, entries.get(0)), "level " + level);
        }
    }

    @Test
    void testEmptyDeflatedEntry() throws Exception {
        byte[] zip = new TestArchiveBuilder().deflated("empty.db", new byte[0], 6).build();
        ArchiveEntry entry = reader.listEntries(zip).get(0);

        assertEquals(0, reader.extract(zip, entry).length);
    }

    @Test
    void testCentralDirectoryMetadata() throws Exception {
        byte[] zip = new TestArchiveBuilder()
            .stored("a.txt", "abc")
            .stored("b.txt", "defg")
            .build();

        List<ArchiveEntry> entries = reader.listEntries(zip);

        assertEquals("a.txt", entries.get(0).name());
        assertEquals(3, entries.get(0).compressedSize());
        assertEquals(3, entries.get(0).uncompressedSize());
        assertEquals(0, entries.get(0).localHeaderOffset());
        assertEquals(30 + 5 + 3, entries.get(1).localHeaderOffset());
    }

    @Test
    void testMissingEndRecordIsFatal() {
        byte[] garbage = new byte[1024];
        new Random(1).nextBytes(garbage);

        assertThrows(ContainerFormatException.class, () -> reader.listEntries(garbage));
        assertThrows(ContainerFormatException.class, () -> reader.listEntries(new byte[5]));
    }

    @Test
    void testEndRecordFoundBehindComment() throws Exception {
        byte[] zip = new TestArchiveBuilder()
            .stored("x.db", "sqlite")
            .comment("c".repeat(4000))
            .build();

        assertEquals("x.db", reader.listEntries(zip).get(0).name());
    }

    @Test
    void testUnsupportedMethodSkipsOnlyThatEntry() throws Exception {
        byte[] zip = new TestArchiveBuilder()
            .withMethod("odd.bin", new byte[]{1, 2, 3}, 12)
            .stored("good.txt", "ok")
            .build();

        ArchiveExtraction extraction = reader.extractMatching(zip, entry -> true);

        assertEquals(1, extraction.failures().size());
        assertTrue(extraction.failures().get(0).contains("odd.bin"));
        assertTrue(extraction.failures().get(0).contains("unsupported compression method 12"));
        assertEquals(List.of("good.txt"), List.copyOf(extraction.payloads().keySet()));
    }

    @Test
    void testCrcMismatchRejectsWholeEntry() throws Exception {
        byte[] zip = new TestArchiveBuilder()
            .corruptCrc("broken.txt", "payload".getBytes(StandardCharsets.UTF_8))
            .build();
        ArchiveEntry entry = reader.listEntries(zip).get(0);

        EntryExtractionException e = assertThrows(EntryExtractionException.class, () -> reader.extract(zip, entry));
        assertEquals("broken.txt", e.getEntryName());
        assertTrue(e.getMessage().contains("CRC mismatch"));
    }

    @Test
    void testCorruptDeflateStreamIsPerEntryFailure() throws Exception {
        byte[] data = "some compressible text text text".getBytes(StandardCharsets.UTF_8);
        byte[] zip = new TestArchiveBuilder()
            .deflated("bad.db", data, 9)
            .stored("other.txt", "fine")
            .build();
        // first payload byte: final block with reserved block type
        zip[30 + "bad.db".length()] = (byte) 0xFF;

        ArchiveExtraction extraction = reader.extractMatching(zip, entry -> true);

        assertEquals(1, extraction.failures().size());
        assertTrue(extraction.failures().get(0).startsWith("bad.db"));
        assertTrue(extraction.payloads().containsKey("other.txt"));
    }

    @Test
    void testBadLocalHeaderSignatureIsFatal() throws Exception {
        byte[] zip = new TestArchiveBuilder().stored("x.db", "data").build();
        ArchiveEntry entry = reader.listEntries(zip).get(0);
        zip[0] = 0;

        assertThrows(ContainerFormatException.class, () -> reader.extract(zip, entry));
    }

    @Test
    void testEntryAboveSizeLimitIsSkipped() throws Exception {
        ArchiveReader small = new ArchiveReader(4, DATABASE_PATTERNS);
        byte[] zip = new TestArchiveBuilder()
            .stored("big.bin", new byte[10])
            .stored("tiny.bin", new byte[2])
            .build();

        ArchiveExtraction extraction = small.extractMatching(zip, entry -> true);

        assertEquals(1, extraction.failures().size());
        assertTrue(extraction.payloads().containsKey("tiny.bin"));
    }

    @Test
    void testExtractBySuffix() throws Exception {
        byte[] zip = new TestArchiveBuilder()
            .stored("book.PDF", "pdf")
            .stored("notes.db", "db")
            .stored("cover.png", "png")
            .build();

        ArchiveExtraction extraction = reader.extractBySuffix(zip, List.of(".pdf", ".png"));

        assertEquals(List.of("book.PDF", "cover.png"), List.copyOf(extraction.payloads().keySet()));
    }

    @Test
    void testDatabaseEntryFollowsPatternOrder() throws Exception {
        byte[] zip = new TestArchiveBuilder()
            .stored("media/cover.png", new byte[5000])
            .stored("backup.db", "db")
            .stored("Book.marginnotes", "notes")
            .build();

        ArchiveEntry entry = reader.findDatabaseEntry(reader.listEntries(zip)).orElseThrow();

        assertEquals("Book.marginnotes", entry.name());
    }

    @Test
    void testDatabaseEntryFallsBackToLargest() throws Exception {
        byte[] zip = new TestArchiveBuilder()
            .stored("small.bin", new byte[10])
            .stored("large.bin", new byte[500])
            .stored("folder/", new byte[0])
            .build();

        ArchiveEntry entry = reader.findDatabaseEntry(reader.listEntries(zip)).orElseThrow();

        assertEquals("large.bin", entry.name());
    }
}
