package com.dcruver.marginnote.plist;

import java.util.List;
import java.util.Map;

/**
 * Outcome of decoding one archived blob column.
 *
 * @param status           how far decoding got
 * @param value            simplified value, only set when {@code status} is DECODED
 * @param recoveredStrings strings found by the degraded scan
 */
public record DecodedBlob(Status status, Object value, List<String> recoveredStrings) {

    public enum Status {
        /** Column was null or zero-length */
        EMPTY,
        DECODED,
        /** A valid property list that is not a keyed archive */
        NOT_ARCHIVED,
        DEGRADED,
        FAILED
    }

    public static DecodedBlob empty() {
        return new DecodedBlob(Status.EMPTY, null, List.of());
    }

    public static DecodedBlob of(Status status) {
        return new DecodedBlob(status, null, List.of());
    }

    /**
     * The decoded value as a list of field maps. A single map is wrapped; anything else yields an empty list.
     */
    @SuppressWarnings("unchecked")
    public List<Map<String, Object>> entries() {
        if (value instanceof Map) {
            return List.of((Map<String, Object>) value);
        }
        if (value instanceof List) {
            return ((List<Object>) value).stream()
                .filter(item -> item instanceof Map)
                .map(item -> (Map<String, Object>) item)
                .toList();
        }
        return List.of();
    }
}
