package com.dcruver.marginnote.io;

import java.util.List;
import java.util.Map;

/**
 * Result of extracting a selection of entries: payloads by entry name, in
 * central-directory order, plus one message per entry that had to be skipped.
 */
public record ArchiveExtraction(Map<String, byte[]> payloads, List<String> failures) {

    public boolean hasFailures() {
        return !failures.isEmpty();
    }
}
