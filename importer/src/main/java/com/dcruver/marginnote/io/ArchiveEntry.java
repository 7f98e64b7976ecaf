package com.dcruver.marginnote.io;

/**
 * One file entry as described by the container's central directory.
 *
 * @param name               entry name as stored in the central directory
 * @param method             compression method code (0 stored, 8 deflate)
 * @param compressedSize     payload size inside the container
 * @param uncompressedSize   payload size after inflation
 * @param localHeaderOffset  offset of the entry's local file header
 * @param crc32              CRC-32 of the uncompressed payload
 */
public record ArchiveEntry(
    String name,
    int method,
    long compressedSize,
    long uncompressedSize,
    long localHeaderOffset,
    long crc32
) {
    public static final int METHOD_STORED = 0;
    public static final int METHOD_DEFLATE = 8;

    public boolean isDirectory() {
        return name.endsWith("/");
    }
}
