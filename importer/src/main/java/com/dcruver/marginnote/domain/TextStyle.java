package com.dcruver.marginnote.domain;

/** Shape of a note's free text: enumerated list or running prose */
public enum TextStyle {
    LIST,
    PROSE
}
