package com.dcruver.marginnote.domain;

/**
 * A link to another note found in the notes blob.
 */
public record LinkedNote(String noteId, String displayText) {
}
