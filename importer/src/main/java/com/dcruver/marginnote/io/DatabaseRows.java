package com.dcruver.marginnote.io;

import java.util.List;
import java.util.Map;

/**
 * Raw rows of the three tables the importer reads, one column-name to value map per row.
 * Blob columns arrive as {@code byte[]}.
 */
public record DatabaseRows(
    List<Map<String, Object>> notes,
    List<Map<String, Object>> topics,
    List<Map<String, Object>> media
) {
    public static DatabaseRows ofNotes(List<Map<String, Object>> notes) {
        return new DatabaseRows(notes, List.of(), List.of());
    }
}
