package com.dcruver.marginnote.reporting;

import com.dcruver.marginnote.app.ImportException;
import com.dcruver.marginnote.app.ImportResult;
import com.dcruver.marginnote.app.ImportStatistics;
import com.dcruver.marginnote.domain.DeduplicationReport;
import com.dcruver.marginnote.domain.GroupingStatistics;
import com.dcruver.marginnote.domain.MediaKind;
import com.dcruver.marginnote.domain.MediaRecord;
import com.dcruver.marginnote.domain.NoteRecord;
import com.dcruver.marginnote.domain.TopicType;
import com.dcruver.marginnote.domain.ValidationReport;
import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import lombok.RequiredArgsConstructor;
import org.springframework.stereotype.Component;

import java.util.EnumMap;
import java.util.LinkedHashMap;
import java.util.Map;

/**
 * Renders import outcomes as plain text or JSON.
 */
@Component
@RequiredArgsConstructor
public class ImportReportFormatter {

    private final ObjectMapper objectMapper;

    /**
     * Plain-text summary of a finished import
     */
    public String formatText(ImportResult result) {
        ImportStatistics stats = result.statistics();
        StringBuilder sb = new StringBuilder();

        sb.append("Import completed.\n\n");

        sb.append("Package:\n");
        if (stats.getDatabaseEntry() != null) {
            sb.append(String.format("- Entries: %d\n", stats.getArchiveEntries()));
            sb.append(String.format("- Database entry: %s\n", stats.getDatabaseEntry()));
        }
        sb.append("\n");

        sb.append("Rows:\n");
        sb.append(String.format("- Notes: %d read, %d mapped, %d skipped\n",
            stats.getNoteRowsRead(), stats.getNotesMapped(), stats.getNotesSkipped()));
        sb.append(String.format("- Topics: %d read, %d mapped, %d skipped\n",
            stats.getTopicRowsRead(), stats.getTopicsMapped(), stats.getTopicsSkipped()));
        sb.append(String.format("- Media: %d read, %d mapped, %d skipped\n\n",
            stats.getMediaRowsRead(), stats.getMediaMapped(), stats.getMediaSkipped()));

        GroupingStatistics grouping = stats.getGrouping();
        if (grouping != null) {
            sb.append("Groups:\n");
            sb.append(String.format("- Total: %d (%d single, %d multi)\n",
                grouping.totalGroups(), grouping.singleNoteGroups(), grouping.multiNoteGroups()));
            sb.append(String.format("- Largest: %d, average size %.2f\n",
                grouping.largestGroupSize(), grouping.averageGroupSize()));
            sb.append(String.format("- Notes with hashtags: %d, links: %d, media: %d, content: %d\n\n",
                grouping.notesWithHashtags(), grouping.notesWithLinks(), grouping.notesWithMedia(),
                grouping.notesWithContent()));
        }

        DeduplicationReport dedup = result.deduplication();
        sb.append("Deduplication:\n");
        sb.append(String.format("- Groups processed: %d\n", dedup.totalGroupsProcessed()));
        sb.append(String.format("- Merged content found: %d\n", dedup.mergedContentFound()));
        sb.append(String.format("- Original content preserved: %d\n", dedup.originalContentPreserved()));
        sb.append(String.format("- Duplicates removed: %d (%.1f%%)\n",
            dedup.duplicatesRemoved(), dedup.duplicateRemovalRate() * 100));
        sb.append(String.format("- Content combined: %d\n", dedup.contentCombined()));
        sb.append(String.format("- Groups dropped: %d\n", dedup.groupsDropped()));
        sb.append(String.format("- Final records: %d\n", stats.getFinalRecords()));

        ValidationReport validation = dedup.validation();
        if (!validation.contentPreserved()) {
            sb.append("\nWarnings:\n");
            validation.issues().forEach(issue -> sb.append("- ").append(issue).append("\n"));
        }

        sb.append("\nTopics by type:\n");
        topicCounts(result).forEach((type, count) -> sb.append(String.format("- %s: %d\n", type, count)));

        sb.append("\nMedia by kind:\n");
        mediaCounts(result).forEach((kind, count) -> sb.append(String.format("- %s: %d\n", kind, count)));

        return sb.toString();
    }

    /**
     * Failure summary: the stage that failed and the counts reached before it
     */
    public String formatFailure(ImportException e) {
        ImportStatistics stats = e.getStatistics();
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Import failed at stage %s.\n", e.getStage()));
        sb.append(String.format("Reason: %s\n", e.getCause() != null ? e.getCause().getMessage() : e.getMessage()));
        if (stats != null) {
            sb.append(String.format("Notes mapped: %d, rows skipped: %d\n", stats.getNotesMapped(), stats.getRowsSkipped()));
            stats.getArchiveFailures().forEach(f -> sb.append("- ").append(f).append("\n"));
        }
        return sb.toString();
    }

    /**
     * One note, for inspection
     */
    public String formatNote(NoteRecord note) {
        StringBuilder sb = new StringBuilder();
        sb.append(String.format("Note %s%s\n", note.getNoteId(), note.isMerged() ? " (merged into " + note.getGroupNoteId() + ")" : ""));
        appendField(sb, "Title", note.getNoteTitle());
        appendField(sb, "Excerpt", note.getExcerptText());
        appendField(sb, "Notes", note.getNotesText());
        if (!note.getHashtags().isEmpty()) {
            sb.append("Hashtags: ").append(String.join(", ", note.getHashtags())).append("\n");
        }
        if (!note.getLinkIds().isEmpty()) {
            sb.append("Links: ").append(String.join(", ", note.getLinkIds())).append("\n");
        }
        if (!note.getFormattedText().isEmpty()) {
            sb.append("Text (").append(note.getFormattedStyle()).append("):\n");
            note.getFormattedText().forEach(line -> sb.append("  ").append(line).append("\n"));
        }
        if (!note.getMediaHashes().isEmpty()) {
            sb.append("Media: ").append(String.join(", ", note.getMediaHashes())).append("\n");
        }
        if (note.getVisualExcerpt() != null) {
            sb.append(String.format("Region: page %d %s\n", note.getVisualExcerpt().pageNo(), note.getVisualExcerpt().rect()));
        }
        sb.append(String.format("Words: %d (%s)\n", note.getWordCount(), note.getLanguage()));
        return sb.toString();
    }

    /**
     * Machine-readable summary
     */
    public String formatJson(ImportResult result) throws JsonProcessingException {
        Map<String, Object> report = new LinkedHashMap<>();
        report.put("statistics", result.statistics());
        report.put("deduplication", result.deduplication());
        report.put("topicsByType", topicCounts(result));
        report.put("mediaByKind", mediaCounts(result));
        return objectMapper.writerWithDefaultPrettyPrinter().writeValueAsString(report);
    }

    private Map<TopicType, Integer> topicCounts(ImportResult result) {
        Map<TopicType, Integer> counts = new EnumMap<>(TopicType.class);
        result.topics().values().forEach(t -> counts.merge(t.getType(), 1, Integer::sum));
        return counts;
    }

    private Map<MediaKind, Integer> mediaCounts(ImportResult result) {
        Map<MediaKind, Integer> counts = new EnumMap<>(MediaKind.class);
        for (MediaRecord media : result.media().values()) {
            counts.merge(media.getKind(), 1, Integer::sum);
        }
        return counts;
    }

    private static void appendField(StringBuilder sb, String label, String value) {
        if (value != null && !value.isBlank()) {
            sb.append(label).append(": ").append(value).append("\n");
        }
    }
}
