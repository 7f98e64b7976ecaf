package com.dcruver.marginnote.domain;

/**
 * Shape of the grouping outcome, for reporting.
 */
public record GroupingStatistics(
    int totalGroups,
    int singleNoteGroups,
    int multiNoteGroups,
    int largestGroupSize,
    double averageGroupSize,
    int notesWithHashtags,
    int notesWithLinks,
    int notesWithMedia,
    int notesWithContent
) {
}
