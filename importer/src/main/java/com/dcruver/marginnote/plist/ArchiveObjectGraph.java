package com.dcruver.marginnote.plist;

import java.util.List;

/**
 * The {@code $objects} table of a keyed archive and the index named by {@code $top.root}.
 */
public record ArchiveObjectGraph(List<PlistValue> objects, int rootUid) {

    public int size() {
        return objects.size();
    }
}
