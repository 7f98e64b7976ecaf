package com.dcruver.marginnote.app;

import com.dcruver.marginnote.domain.ContentGroup;
import com.dcruver.marginnote.domain.DeduplicationReport;
import com.dcruver.marginnote.domain.MediaRecord;
import com.dcruver.marginnote.domain.NoteRecord;
import com.dcruver.marginnote.domain.TopicRecord;

import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Everything an import produces, handed to renderers and reporting.
 *
 * @param groups        one single-record group per surviving annotation
 * @param groupedNotes  groups as formed before deduplication
 * @param topics        topics by id
 * @param media         media by content hash
 */
public record ImportResult(
    List<ContentGroup> groups,
    List<ContentGroup> groupedNotes,
    Map<String, TopicRecord> topics,
    Map<String, MediaRecord> media,
    DeduplicationReport deduplication,
    ImportStatistics statistics
) {
    public List<NoteRecord> records() {
        return groups.stream().map(ContentGroup::getMaster).toList();
    }

    public Optional<NoteRecord> findRecord(String noteId) {
        return records().stream().filter(r -> r.getNoteId().equals(noteId)).findFirst();
    }

    /**
     * The pre-deduplication group a note ended up in
     */
    public Optional<ContentGroup> findGroup(String noteId) {
        return groupedNotes.stream().filter(g -> g.getMemberIds().contains(noteId)).findFirst();
    }
}
