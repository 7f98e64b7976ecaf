package com.dcruver.marginnote.app;

/** Pipeline stages, in execution order */
public enum ImportStage {
    ARCHIVE,
    DATABASE,
    MAPPING,
    GROUPING,
    DEDUPLICATION
}
