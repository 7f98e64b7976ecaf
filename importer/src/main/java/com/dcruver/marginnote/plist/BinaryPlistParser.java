package com.dcruver.marginnote.plist;

import lombok.extern.slf4j.Slf4j;

import java.nio.charset.StandardCharsets;
import java.time.Instant;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Decodes binary property lists ({@code bplist00}) into {@link PlistValue} trees.
 * Falls back to a linear marker scan that recovers strings and integers when the
 * trailer is missing or inconsistent.
 */
@Slf4j
public class BinaryPlistParser {

    static final byte[] MAGIC = "bplist".getBytes(StandardCharsets.US_ASCII);
    static final int HEADER_SIZE = 8;
    static final int TRAILER_SIZE = 32;

    /** Seconds between 1970-01-01 and 2001-01-01 */
    public static final long APPLE_EPOCH_OFFSET = 978307200L;

    private static final int MAX_NESTING = 512;

    private record Trailer(int offsetIntSize, int objectRefSize, int numObjects, int topObject, int offsetTableOffset) {
    }

    /**
     * Parse a binary property list
     */
    public ParsedPlist parse(byte[] data) throws PlistDecodeException {
        if (data == null || data.length < HEADER_SIZE || !hasMagic(data)) {
            throw new PlistDecodeException("Missing bplist header");
        }

        Optional<Trailer> trailer = readTrailer(data);
        if (trailer.isPresent()) {
            Decoder decoder = new Decoder(data, trailer.get());
            return ParsedPlist.complete(decoder.decodeObject(trailer.get().topObject(), 0));
        }

        log.debug("Unusable bplist trailer on {} bytes, scanning linearly", data.length);
        List<PlistValue> recovered = scanLinearly(data);
        if (recovered.isEmpty()) {
            throw new PlistDecodeException("Unusable trailer and nothing recoverable by linear scan");
        }
        return ParsedPlist.degraded(recovered);
    }

    private boolean hasMagic(byte[] data) {
        for (int i = 0; i < MAGIC.length; i++) {
            if (data[i] != MAGIC[i]) {
                return false;
            }
        }
        return true;
    }

    private Optional<Trailer> readTrailer(byte[] data) {
        if (data.length < HEADER_SIZE + TRAILER_SIZE) {
            return Optional.empty();
        }
        int t = data.length - TRAILER_SIZE;
        int offsetIntSize = data[t + 6] & 0xFF;
        int objectRefSize = data[t + 7] & 0xFF;
        long numObjects = readBigEndian(data, t + 8, 8);
        long topObject = readBigEndian(data, t + 16, 8);
        long offsetTableOffset = readBigEndian(data, t + 24, 8);

        if (offsetIntSize < 1 || offsetIntSize > 8 || objectRefSize < 1 || objectRefSize > 8) {
            return Optional.empty();
        }
        if (numObjects <= 0 || numObjects > data.length || topObject < 0 || topObject >= numObjects) {
            return Optional.empty();
        }
        if (offsetTableOffset < HEADER_SIZE || offsetTableOffset + numObjects * offsetIntSize > t) {
            return Optional.empty();
        }
        return Optional.of(new Trailer(offsetIntSize, objectRefSize, (int) numObjects, (int) topObject,
            (int) offsetTableOffset));
    }

    /**
     * Walks the object table in trailer-driven order, memoizing each decoded index.
     */
    private static final class Decoder {
        private final byte[] data;
        private final Trailer trailer;
        private final PlistValue[] decoded;
        private final boolean[] inProgress;

        Decoder(byte[] data, Trailer trailer) {
            this.data = data;
            this.trailer = trailer;
            this.decoded = new PlistValue[trailer.numObjects()];
            this.inProgress = new boolean[trailer.numObjects()];
        }

        PlistValue decodeObject(int index, int depth) throws PlistDecodeException {
            if (index < 0 || index >= decoded.length) {
                throw new PlistDecodeException("Object reference " + index + " out of range");
            }
            if (decoded[index] != null) {
                return decoded[index];
            }
            if (inProgress[index]) {
                throw new PlistDecodeException("Object " + index + " contains itself");
            }
            if (depth > MAX_NESTING) {
                throw new PlistDecodeException("Nesting deeper than " + MAX_NESTING);
            }

            inProgress[index] = true;
            long offset = readBigEndian(data, trailer.offsetTableOffset() + index * trailer.offsetIntSize(),
                trailer.offsetIntSize());
            if (offset < HEADER_SIZE || offset >= trailer.offsetTableOffset()) {
                throw new PlistDecodeException("Object " + index + " has offset " + offset + " outside the object area");
            }
            PlistValue value = decodeAt((int) offset, depth);
            inProgress[index] = false;
            decoded[index] = value;
            return value;
        }

        private PlistValue decodeAt(int offset, int depth) throws PlistDecodeException {
            int marker = data[offset] & 0xFF;
            int type = marker >> 4;
            int info = marker & 0x0F;

            return switch (type) {
                case 0x0 -> switch (info) {
                    case 0x0, 0xF -> PlistValue.Null.INSTANCE;
                    case 0x8 -> new PlistValue.Bool(false);
                    case 0x9 -> new PlistValue.Bool(true);
                    default -> throw new PlistDecodeException(String.format("Unknown marker 0x%02x", marker));
                };
                case 0x1 -> readInt(offset + 1, info);
                case 0x2 -> readReal(offset + 1, info);
                case 0x3 -> {
                    if (info != 0x3) {
                        throw new PlistDecodeException(String.format("Bad date marker 0x%02x", marker));
                    }
                    require(offset + 1, 8);
                    double seconds = Double.longBitsToDouble(readBigEndian(data, offset + 1, 8));
                    yield new PlistValue.Date(toInstant(seconds));
                }
                case 0x4 -> {
                    int[] span = readCount(offset, info, 1);
                    byte[] bytes = new byte[span[0]];
                    System.arraycopy(data, span[1], bytes, 0, span[0]);
                    yield new PlistValue.Data(bytes);
                }
                case 0x5 -> {
                    int[] span = readCount(offset, info, 1);
                    yield new PlistValue.Text(new String(data, span[1], span[0], StandardCharsets.US_ASCII));
                }
                case 0x6 -> {
                    int[] span = readCount(offset, info, 2);
                    yield new PlistValue.Text(new String(data, span[1], span[0] * 2, StandardCharsets.UTF_16BE));
                }
                case 0x7 -> {
                    int[] span = readCount(offset, info, 1);
                    yield new PlistValue.Text(new String(data, span[1], span[0], StandardCharsets.UTF_8));
                }
                case 0x8 -> {
                    int size = info + 1;
                    require(offset + 1, size);
                    long uid = readBigEndian(data, offset + 1, Math.min(size, 8));
                    if (size > 4 || uid > Integer.MAX_VALUE) {
                        throw new PlistDecodeException("UID too large at offset " + offset);
                    }
                    yield new PlistValue.Uid((int) uid);
                }
                case 0xA, 0xC -> {
                    int[] span = readCount(offset, info, trailer.objectRefSize());
                    List<PlistValue> items = new ArrayList<>(span[0]);
                    for (int i = 0; i < span[0]; i++) {
                        items.add(decodeObject(readRef(span[1], i), depth + 1));
                    }
                    yield new PlistValue.Array(items);
                }
                case 0xD -> {
                    int[] span = readCount(offset, info, trailer.objectRefSize() * 2);
                    int count = span[0];
                    Map<PlistValue, PlistValue> entries = new LinkedHashMap<>();
                    for (int i = 0; i < count; i++) {
                        PlistValue key = decodeObject(readRef(span[1], i), depth + 1);
                        PlistValue value = decodeObject(readRef(span[1], count + i), depth + 1);
                        entries.put(key, value);
                    }
                    yield new PlistValue.Dict(entries);
                }
                default -> throw new PlistDecodeException(String.format("Unknown marker 0x%02x at offset %d",
                    marker, offset));
            };
        }

        private PlistValue.Int readInt(int pos, int info) throws PlistDecodeException {
            if (info > 4) {
                throw new PlistDecodeException("Integer wider than 16 bytes at offset " + (pos - 1));
            }
            int size = 1 << info;
            require(pos, size);
            if (size == 16) {
                // keep the low 64 bits
                return new PlistValue.Int(readBigEndian(data, pos + 8, 8));
            }
            return new PlistValue.Int(readBigEndian(data, pos, size));
        }

        private PlistValue.Real readReal(int pos, int info) throws PlistDecodeException {
            return switch (info) {
                case 2 -> {
                    require(pos, 4);
                    yield new PlistValue.Real(Float.intBitsToFloat((int) readBigEndian(data, pos, 4)));
                }
                case 3 -> {
                    require(pos, 8);
                    yield new PlistValue.Real(Double.longBitsToDouble(readBigEndian(data, pos, 8)));
                }
                default -> throw new PlistDecodeException("Unsupported real width at offset " + (pos - 1));
            };
        }

        /**
         * Resolve the element count of a variable-length object.
         * Returns {count, payloadStart}; the payload is checked to lie inside the buffer.
         */
        private int[] readCount(int offset, int info, int unitSize) throws PlistDecodeException {
            long count = info;
            int start = offset + 1;
            if (info == 0xF) {
                require(start, 1);
                int intMarker = data[start] & 0xFF;
                if (intMarker >> 4 != 0x1) {
                    throw new PlistDecodeException("Expected integer count at offset " + start);
                }
                int size = 1 << (intMarker & 0x0F);
                if (size > 8) {
                    throw new PlistDecodeException("Count too wide at offset " + start);
                }
                require(start + 1, size);
                count = readBigEndian(data, start + 1, size);
                start = start + 1 + size;
            }
            if (count < 0 || count > data.length || count * unitSize > data.length - start) {
                throw new PlistDecodeException("Object at offset " + offset + " runs past the end of the data");
            }
            return new int[]{(int) count, start};
        }

        private int readRef(int base, int i) {
            return (int) readBigEndian(data, base + i * trailer.objectRefSize(), trailer.objectRefSize());
        }

        private void require(int pos, int length) throws PlistDecodeException {
            if (pos < 0 || (long) pos + length > data.length) {
                throw new PlistDecodeException("Truncated value at offset " + pos);
            }
        }
    }

    /**
     * Best-effort recovery of strings and integers by walking marker bytes after the header.
     */
    List<PlistValue> scanLinearly(byte[] data) {
        List<PlistValue> recovered = new ArrayList<>();
        int pos = HEADER_SIZE;
        while (pos < data.length) {
            int marker = data[pos] & 0xFF;
            int type = marker >> 4;
            int info = marker & 0x0F;

            if (type == 0x5 || type == 0x6) {
                int unit = type == 0x5 ? 1 : 2;
                long count = info;
                int start = pos + 1;
                if (info == 0xF && start < data.length && (data[start] & 0xF0) == 0x10) {
                    int size = 1 << (data[start] & 0x0F);
                    if (size <= 8 && start + 1 + size <= data.length) {
                        count = readBigEndian(data, start + 1, size);
                        start += 1 + size;
                    } else {
                        count = -1;
                    }
                } else if (info == 0xF) {
                    count = -1;
                }
                if (count > 0 && count * unit <= data.length - start) {
                    String text = new String(data, start, (int) count * unit,
                        unit == 1 ? StandardCharsets.US_ASCII : StandardCharsets.UTF_16BE);
                    if (isPrintable(text)) {
                        recovered.add(new PlistValue.Text(text));
                        pos = start + (int) count * unit;
                        continue;
                    }
                }
            } else if (type == 0x1 && info <= 3) {
                int size = 1 << info;
                if (pos + 1 + size <= data.length) {
                    recovered.add(new PlistValue.Int(readBigEndian(data, pos + 1, size)));
                    pos += 1 + size;
                    continue;
                }
            }
            pos++;
        }
        return recovered;
    }

    private static boolean isPrintable(String text) {
        for (int i = 0; i < text.length(); i++) {
            char c = text.charAt(i);
            if (Character.isISOControl(c) && c != '\n' && c != '\r' && c != '\t') {
                return false;
            }
            if (c == '\uFFFD') {
                return false;
            }
        }
        return true;
    }

    /**
     * Seconds since 2001-01-01 as an instant; non-finite or out-of-range values are rejected
     */
    static Instant toInstant(double appleSeconds) throws PlistDecodeException {
        double unixSeconds = appleSeconds + APPLE_EPOCH_OFFSET;
        if (!Double.isFinite(appleSeconds)
            || unixSeconds < Instant.MIN.getEpochSecond() || unixSeconds >= Instant.MAX.getEpochSecond()) {
            throw new PlistDecodeException("Date value " + appleSeconds + " is outside the representable range");
        }
        double whole = Math.floor(appleSeconds);
        long nanos = Math.round((appleSeconds - whole) * 1_000_000_000d);
        return Instant.ofEpochSecond(APPLE_EPOCH_OFFSET + (long) whole, nanos);
    }

    static long readBigEndian(byte[] data, int pos, int size) {
        long value = 0;
        for (int i = 0; i < size; i++) {
            value = (value << 8) | (data[pos + i] & 0xFF);
        }
        return value;
    }
}
