package com.dcruver.marginnote.io;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.function.Predicate;
import java.util.regex.Pattern;
import java.util.zip.CRC32;
import java.util.zip.DataFormatException;
import java.util.zip.Inflater;

/**
 * Reads entries straight out of a ZIP container held in memory.
 * Walks the end-of-central-directory record and the central directory,
 * then decodes each selected entry from its local file header.
 */
@Slf4j
public class ArchiveReader {

    static final int EOCD_SIGNATURE = 0x06054b50;
    static final int CENTRAL_HEADER_SIGNATURE = 0x02014b50;
    static final int LOCAL_HEADER_SIGNATURE = 0x04034b50;

    private static final int EOCD_SIZE = 22;
    private static final int MAX_COMMENT_SIZE = 0xFFFF;
    private static final int CENTRAL_HEADER_SIZE = 46;
    private static final int LOCAL_HEADER_SIZE = 30;
    private static final long ZIP64_SENTINEL = 0xFFFFFFFFL;

    private final long maxEntrySize;
    private final List<Pattern> databasePatterns;

    public ArchiveReader(long maxEntrySize, List<String> databasePatterns) {
        this.maxEntrySize = maxEntrySize;
        this.databasePatterns = databasePatterns.stream()
            .map(p -> Pattern.compile(p, Pattern.CASE_INSENSITIVE))
            .toList();
    }

    /**
     * List all entries of the central directory, in directory order.
     */
    public List<ArchiveEntry> listEntries(byte[] data) throws ContainerFormatException {
        int eocd = findEndOfCentralDirectory(data);
        int entryCount = readU16(data, eocd + 10);
        long directoryOffset = readU32(data, eocd + 16);

        if (entryCount == 0xFFFF || directoryOffset == ZIP64_SENTINEL) {
            throw new ContainerFormatException("ZIP64 containers are not supported");
        }
        if (directoryOffset > data.length) {
            throw new ContainerFormatException("Central directory offset " + directoryOffset + " is outside the buffer");
        }

        List<ArchiveEntry> entries = new ArrayList<>(entryCount);
        int pos = (int) directoryOffset;
        for (int i = 0; i < entryCount; i++) {
            if (pos + CENTRAL_HEADER_SIZE > data.length) {
                throw new ContainerFormatException("Central directory truncated at entry " + i);
            }
            if (readI32(data, pos) != CENTRAL_HEADER_SIGNATURE) {
                throw new ContainerFormatException(String.format("Bad central header signature at offset %d", pos));
            }

            int method = readU16(data, pos + 10);
            long crc = readU32(data, pos + 16);
            long compressedSize = readU32(data, pos + 20);
            long uncompressedSize = readU32(data, pos + 24);
            int nameLength = readU16(data, pos + 28);
            int extraLength = readU16(data, pos + 30);
            int commentLength = readU16(data, pos + 32);
            long localOffset = readU32(data, pos + 42);

            int nameStart = pos + CENTRAL_HEADER_SIZE;
            if (nameStart + nameLength > data.length) {
                throw new ContainerFormatException("Entry name runs past the end of the buffer");
            }
            String name = new String(data, nameStart, nameLength, StandardCharsets.UTF_8);

            entries.add(new ArchiveEntry(name, method, compressedSize, uncompressedSize, localOffset, crc));
            pos = nameStart + nameLength + extraLength + commentLength;
        }

        log.debug("Central directory lists {} entries", entries.size());
        return entries;
    }

    /**
     * Extract one entry. Either the whole verified payload is returned or an exception is thrown.
     */
    public byte[] extract(byte[] data, ArchiveEntry entry) throws ContainerFormatException, EntryExtractionException {
        if (entry.compressedSize() == ZIP64_SENTINEL || entry.uncompressedSize() == ZIP64_SENTINEL) {
            throw new EntryExtractionException(entry.name(), "ZIP64 sizes are not supported");
        }
        if (entry.uncompressedSize() > maxEntrySize) {
            throw new EntryExtractionException(entry.name(),
                String.format("uncompressed size %d exceeds limit %d", entry.uncompressedSize(), maxEntrySize));
        }

        long local = entry.localHeaderOffset();
        if (local + LOCAL_HEADER_SIZE > data.length) {
            throw new ContainerFormatException("Local header of " + entry.name() + " is outside the buffer");
        }
        int header = (int) local;
        if (readI32(data, header) != LOCAL_HEADER_SIGNATURE) {
            throw new ContainerFormatException(String.format("Bad local header signature for %s at offset %d",
                entry.name(), header));
        }

        int nameLength = readU16(data, header + 26);
        int extraLength = readU16(data, header + 28);
        long payloadStart = local + LOCAL_HEADER_SIZE + nameLength + extraLength;
        if (payloadStart + entry.compressedSize() > data.length) {
            throw new ContainerFormatException("Payload of " + entry.name() + " runs past the end of the buffer");
        }

        int start = (int) payloadStart;
        int length = (int) entry.compressedSize();
        byte[] payload = switch (entry.method()) {
            case ArchiveEntry.METHOD_STORED -> copyStored(data, start, length, entry);
            case ArchiveEntry.METHOD_DEFLATE -> inflate(data, start, length, entry);
            default -> throw new EntryExtractionException(entry.name(),
                "unsupported compression method " + entry.method());
        };

        CRC32 crc = new CRC32();
        crc.update(payload);
        if (crc.getValue() != entry.crc32()) {
            throw new EntryExtractionException(entry.name(),
                String.format("CRC mismatch (expected %08x, got %08x)", entry.crc32(), crc.getValue()));
        }
        return payload;
    }

    /**
     * Extract every entry accepted by the filter. Entries that fail are skipped and reported.
     */
    public ArchiveExtraction extractMatching(byte[] data, Predicate<ArchiveEntry> filter) throws ContainerFormatException {
        Map<String, byte[]> payloads = new LinkedHashMap<>();
        List<String> failures = new ArrayList<>();

        for (ArchiveEntry entry : listEntries(data)) {
            if (entry.isDirectory() || !filter.test(entry)) {
                continue;
            }
            try {
                payloads.put(entry.name(), extract(data, entry));
            } catch (EntryExtractionException e) {
                log.warn("Skipping entry {}", e.getMessage());
                failures.add(e.getMessage());
            }
        }
        return new ArchiveExtraction(payloads, failures);
    }

    /**
     * Extract entries whose names end with one of the given suffixes (case-insensitive).
     */
    public ArchiveExtraction extractBySuffix(byte[] data, List<String> suffixes) throws ContainerFormatException {
        return extractMatching(data, entry -> {
            String lower = entry.name().toLowerCase();
            return suffixes.stream().anyMatch(s -> lower.endsWith(s.toLowerCase()));
        });
    }

    /**
     * Pick the entry holding the notes database: the first pattern that matches any entry wins,
     * otherwise the largest file in the container.
     */
    public Optional<ArchiveEntry> findDatabaseEntry(List<ArchiveEntry> entries) {
        List<ArchiveEntry> files = entries.stream().filter(e -> !e.isDirectory()).toList();

        for (Pattern pattern : databasePatterns) {
            for (ArchiveEntry entry : files) {
                if (pattern.matcher(entry.name()).find()) {
                    log.debug("Database entry {} matched pattern {}", entry.name(), pattern.pattern());
                    return Optional.of(entry);
                }
            }
        }

        Optional<ArchiveEntry> largest = files.stream().max(Comparator.comparingLong(ArchiveEntry::uncompressedSize));
        largest.ifPresent(e -> log.info("No database entry matched, falling back to largest entry {}", e.name()));
        return largest;
    }

    private int findEndOfCentralDirectory(byte[] data) throws ContainerFormatException {
        int last = data.length - EOCD_SIZE;
        int floor = Math.max(0, data.length - EOCD_SIZE - MAX_COMMENT_SIZE);
        for (int pos = last; pos >= floor; pos--) {
            if (readI32(data, pos) == EOCD_SIGNATURE) {
                return pos;
            }
        }
        throw new ContainerFormatException("End of central directory not found; not a ZIP container");
    }

    private byte[] copyStored(byte[] data, int start, int length, ArchiveEntry entry) throws EntryExtractionException {
        if (length != entry.uncompressedSize()) {
            throw new EntryExtractionException(entry.name(),
                String.format("stored entry sizes differ (%d vs %d)", length, entry.uncompressedSize()));
        }
        byte[] out = new byte[length];
        System.arraycopy(data, start, out, 0, length);
        return out;
    }

    private byte[] inflate(byte[] data, int start, int length, ArchiveEntry entry) throws EntryExtractionException {
        // nowrap inflater wants one trailing byte past the raw deflate stream
        byte[] input = new byte[length + 1];
        System.arraycopy(data, start, input, 0, length);

        Inflater inflater = new Inflater(true);
        try {
            inflater.setInput(input);
            byte[] out = new byte[(int) entry.uncompressedSize()];
            int written = 0;
            while (!inflater.finished()) {
                if (written == out.length) {
                    // output is full, the stream must end without producing more
                    if (inflater.inflate(new byte[1]) > 0) {
                        throw new EntryExtractionException(entry.name(), "inflated data exceeds declared size");
                    }
                    break;
                }
                int n = inflater.inflate(out, written, out.length - written);
                if (n == 0 && (inflater.needsInput() || inflater.needsDictionary())) {
                    break;
                }
                written += n;
            }
            if (written != out.length || !inflater.finished()) {
                throw new EntryExtractionException(entry.name(),
                    String.format("inflated %d bytes, expected %d", written, out.length));
            }
            return out;
        } catch (DataFormatException e) {
            throw new EntryExtractionException(entry.name(), "inflate failed: " + e.getMessage(), e);
        } finally {
            inflater.end();
        }
    }

    private static int readU16(byte[] data, int pos) {
        return (data[pos] & 0xFF) | (data[pos + 1] & 0xFF) << 8;
    }

    private static long readU32(byte[] data, int pos) {
        return readI32(data, pos) & 0xFFFFFFFFL;
    }

    private static int readI32(byte[] data, int pos) {
        return (data[pos] & 0xFF)
            | (data[pos + 1] & 0xFF) << 8
            | (data[pos + 2] & 0xFF) << 16
            | (data[pos + 3] & 0xFF) << 24;
    }
}
