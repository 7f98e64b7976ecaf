package com.dcruver.marginnote.domain;

/**
 * Page position of the area a note was clipped from.
 */
public record VisualExcerpt(int pageNo, Rect rect) {
}
