package com.dcruver.marginnote.plist;

import java.util.List;

/**
 * Parser output. When the trailer was unusable the root is an array of whatever
 * the linear scan recovered and {@code degraded} is set.
 */
public record ParsedPlist(PlistValue root, boolean degraded, List<PlistValue> recovered) {

    public static ParsedPlist complete(PlistValue root) {
        return new ParsedPlist(root, false, List.of());
    }

    public static ParsedPlist degraded(List<PlistValue> recovered) {
        return new ParsedPlist(new PlistValue.Array(recovered), true, recovered);
    }

    /** Strings recovered by the linear scan, in stream order */
    public List<String> recoveredStrings() {
        return recovered.stream()
            .filter(v -> v instanceof PlistValue.Text)
            .map(v -> ((PlistValue.Text) v).value())
            .toList();
    }
}
