package com.dcruver.marginnote.domain;

import lombok.Builder;
import lombok.Data;

import java.time.Instant;
import java.util.ArrayList;
import java.util.List;
import java.util.stream.Collectors;
import java.util.stream.Stream;

/**
 * A single note row after decoding. A non-empty {@code groupNoteId} marks a merged
 * variant pointing at the note it was merged into; otherwise the record is an original.
 * Text and list fields may be back-filled by deduplication.
 */
@Data
@Builder(toBuilder = true)
public class NoteRecord {
    private final String noteId;

    // Relations
    private String topicId;
    private String groupNoteId;
    private String externalId;

    // Text
    private String excerptText;
    private String notesText;
    private String noteTitle;

    // Extracted features
    @Builder.Default
    private List<String> hashtags = new ArrayList<>();
    @Builder.Default
    private List<String> linkIds = new ArrayList<>();
    @Builder.Default
    private List<LinkedNote> linkedNotes = new ArrayList<>();
    @Builder.Default
    private List<String> childNoteIds = new ArrayList<>();
    @Builder.Default
    private List<String> formattedText = new ArrayList<>();
    @Builder.Default
    private TextStyle formattedStyle = TextStyle.PROSE;
    @Builder.Default
    private List<String> mediaHashes = new ArrayList<>();

    // Position
    private VisualExcerpt visualExcerpt;
    @Builder.Default
    private List<HighlightFragment> highlights = new ArrayList<>();

    // Metadata
    private Instant noteDate;
    private Instant highlightDate;
    private Integer startPage;
    private Integer endPage;
    private String bookMd5;
    private int wordCount;
    private String language;

    public boolean isMerged() {
        return groupNoteId != null && !groupNoteId.isBlank();
    }

    public boolean isOriginal() {
        return !isMerged();
    }

    /**
     * Whether the note carries anything worth keeping
     */
    public boolean hasContent() {
        return !isBlank(excerptText) || !isBlank(notesText) || !isBlank(noteTitle)
            || !formattedText.isEmpty() || !mediaHashes.isEmpty() || visualExcerpt != null;
    }

    /**
     * Excerpt, notes, title and any free text not already part of them, joined by blank lines
     */
    public String allText() {
        List<String> fields = Stream.of(excerptText, notesText, noteTitle).filter(s -> !isBlank(s)).toList();
        return Stream.concat(fields.stream(),
                formattedText.stream().filter(line -> fields.stream().noneMatch(f -> f.contains(line))))
            .filter(s -> !isBlank(s))
            .collect(Collectors.joining("\n\n"));
    }

    /**
     * Copy with independent list fields, so that back-filling never touches the source record
     */
    public NoteRecord copy() {
        return toBuilder()
            .hashtags(new ArrayList<>(hashtags))
            .linkIds(new ArrayList<>(linkIds))
            .linkedNotes(new ArrayList<>(linkedNotes))
            .childNoteIds(new ArrayList<>(childNoteIds))
            .formattedText(new ArrayList<>(formattedText))
            .mediaHashes(new ArrayList<>(mediaHashes))
            .highlights(new ArrayList<>(highlights))
            .build();
    }

    static boolean isBlank(String s) {
        return s == null || s.isBlank();
    }
}
