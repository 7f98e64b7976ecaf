package com.dcruver.marginnote.domain;

public enum MediaKind {
    RASTER_IMAGE,
    INK_DRAWING,
    COORDINATES,
    UNCLASSIFIED
}
