package com.dcruver.marginnote.config;

import lombok.Data;
import org.springframework.boot.context.properties.ConfigurationProperties;
import org.springframework.stereotype.Component;

import java.util.ArrayList;
import java.util.List;

/**
 * Importer settings bound from {@code importer.*}.
 */
@Component
@ConfigurationProperties(prefix = "importer")
@Data
public class ImporterProperties {

    /** Raise on malformed archived blobs instead of degrading to empty results */
    private boolean strictDecoding = false;

    /** Share of input notes lost to deduplication above which the run is flagged */
    private double reductionWarningThreshold = 0.9;

    /** URL scheme of cross-note links */
    private String linkScheme = "marginnote4app";

    /** Maximum number of UID hops from an archive's root object */
    private int maxResolveDepth = 256;

    private long maxEntrySize = 512L * 1024 * 1024;

    /** Tried in order against entry names; the largest entry is used when none match */
    private List<String> databaseEntryPatterns = new ArrayList<>(List.of(
        "\\.marginnotes$", "\\.db$", "\\.sqlite$", "marginNote"));
}
