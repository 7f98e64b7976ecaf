package com.dcruver.marginnote.domain;

import java.util.List;

/**
 * One highlighted span from the highlights blob.
 */
public record HighlightFragment(String text, String coordsHash, List<TextSelection> selections) {
}
