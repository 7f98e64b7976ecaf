package com.dcruver.marginnote.app;

import com.dcruver.marginnote.domain.ContentGroup;
import com.dcruver.marginnote.domain.ContentGrouper;
import com.dcruver.marginnote.domain.DeduplicationResult;
import com.dcruver.marginnote.domain.Deduplicator;
import com.dcruver.marginnote.domain.GroupingInvariantException;
import com.dcruver.marginnote.domain.MediaRecord;
import com.dcruver.marginnote.domain.NoteRecord;
import com.dcruver.marginnote.domain.RecordMapper;
import com.dcruver.marginnote.domain.RowMappingException;
import com.dcruver.marginnote.domain.TopicRecord;
import com.dcruver.marginnote.io.ArchiveEntry;
import com.dcruver.marginnote.io.ArchiveReader;
import com.dcruver.marginnote.io.ContainerFormatException;
import com.dcruver.marginnote.io.DatabaseRows;
import com.dcruver.marginnote.io.DatabaseShapeException;
import com.dcruver.marginnote.io.EntryExtractionException;
import com.dcruver.marginnote.io.PackageDatabaseReader;
import com.dcruver.marginnote.plist.PlistDecodeException;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Runs an import end to end: container, database rows, record mapping, grouping, deduplication.
 * Per-row and per-entry failures are counted and skipped; container, database-shape and
 * strict-mode decode failures abort with the failing stage.
 */
@Component
@Slf4j
@RequiredArgsConstructor
public class ImportPipeline {

    private final ArchiveReader archiveReader;
    private final PackageDatabaseReader databaseReader;
    private final RecordMapper recordMapper;
    private final ContentGrouper contentGrouper;
    private final Deduplicator deduplicator;

    /**
     * Import a package file from disk
     */
    public ImportResult importPackage(Path packageFile) throws ImportException {
        try {
            log.info("Importing package {}", packageFile);
            return importArchive(Files.readAllBytes(packageFile));
        } catch (IOException e) {
            throw new ImportException(ImportStage.ARCHIVE, "Cannot read " + packageFile + ": " + e.getMessage(),
                new ImportStatistics(), e);
        }
    }

    /**
     * Import a package held in memory
     */
    public ImportResult importArchive(byte[] packageBytes) throws ImportException {
        ImportStatistics stats = new ImportStatistics();
        long started = System.currentTimeMillis();

        byte[] databaseBytes;
        try {
            List<ArchiveEntry> entries = archiveReader.listEntries(packageBytes);
            stats.setArchiveEntries(entries.size());

            Optional<ArchiveEntry> databaseEntry = archiveReader.findDatabaseEntry(entries);
            if (databaseEntry.isEmpty()) {
                throw new ImportException(ImportStage.ARCHIVE, "Package contains no files", stats, null);
            }
            stats.setDatabaseEntry(databaseEntry.get().name());
            databaseBytes = archiveReader.extract(packageBytes, databaseEntry.get());
        } catch (ContainerFormatException e) {
            throw new ImportException(ImportStage.ARCHIVE, e.getMessage(), stats, e);
        } catch (EntryExtractionException e) {
            stats.getArchiveFailures().add(e.getMessage());
            throw new ImportException(ImportStage.ARCHIVE, "Database entry unreadable: " + e.getMessage(), stats, e);
        }
        stats.recordStage(ImportStage.ARCHIVE, started);
        log.info("Extracted database entry {} ({} bytes)", stats.getDatabaseEntry(), databaseBytes.length);

        started = System.currentTimeMillis();
        DatabaseRows rows;
        try {
            rows = databaseReader.read(databaseBytes);
        } catch (DatabaseShapeException e) {
            throw new ImportException(ImportStage.DATABASE, e.getMessage(), stats, e);
        }
        stats.recordStage(ImportStage.DATABASE, started);

        return importRows(rows, stats);
    }

    /**
     * Import rows that were already read from a database
     */
    public ImportResult importRows(DatabaseRows rows) throws ImportException {
        return importRows(rows, new ImportStatistics());
    }

    private ImportResult importRows(DatabaseRows rows, ImportStatistics stats) throws ImportException {
        long started = System.currentTimeMillis();
        Map<String, TopicRecord> topics;
        Map<String, MediaRecord> media;
        List<NoteRecord> notes;
        try {
            topics = mapTopics(rows.topics(), stats);
            media = mapMedia(rows.media(), stats);
            notes = mapNotes(rows.notes(), stats);
        } catch (PlistDecodeException e) {
            throw new ImportException(ImportStage.MAPPING, "Strict decoding failed: " + e.getMessage(), stats, e);
        }
        stats.recordStage(ImportStage.MAPPING, started);
        log.info("Mapped {} notes ({} skipped), {} topics, {} media",
            stats.getNotesMapped(), stats.getNotesSkipped(), topics.size(), media.size());

        started = System.currentTimeMillis();
        List<ContentGroup> groups;
        try {
            groups = contentGrouper.group(notes, topics);
        } catch (GroupingInvariantException e) {
            throw new ImportException(ImportStage.GROUPING, e.getMessage(), stats, e);
        }
        stats.setGrouping(contentGrouper.statistics(groups));
        stats.recordStage(ImportStage.GROUPING, started);

        started = System.currentTimeMillis();
        DeduplicationResult deduplicated;
        try {
            deduplicated = deduplicator.deduplicate(groups);
        } catch (GroupingInvariantException e) {
            throw new ImportException(ImportStage.DEDUPLICATION, e.getMessage(), stats, e);
        }
        stats.setFinalRecords(deduplicated.groups().size());
        stats.recordStage(ImportStage.DEDUPLICATION, started);

        log.info("Import finished: {} records from {} note rows", stats.getFinalRecords(), stats.getNoteRowsRead());
        return new ImportResult(deduplicated.groups(), groups, topics, media, deduplicated.report(), stats);
    }

    private Map<String, TopicRecord> mapTopics(List<Map<String, Object>> rows, ImportStatistics stats)
        throws PlistDecodeException {
        Map<String, TopicRecord> topics = new LinkedHashMap<>();
        stats.setTopicRowsRead(rows.size());
        for (Map<String, Object> row : rows) {
            try {
                TopicRecord topic = recordMapper.mapTopic(row);
                topics.put(topic.getTopicId(), topic);
                stats.setTopicsMapped(stats.getTopicsMapped() + 1);
            } catch (RowMappingException e) {
                log.warn("Skipping topic row: {}", e.getMessage());
                stats.setTopicsSkipped(stats.getTopicsSkipped() + 1);
            }
        }
        return topics;
    }

    private Map<String, MediaRecord> mapMedia(List<Map<String, Object>> rows, ImportStatistics stats) {
        Map<String, MediaRecord> media = new LinkedHashMap<>();
        stats.setMediaRowsRead(rows.size());
        for (Map<String, Object> row : rows) {
            try {
                MediaRecord record = recordMapper.mapMedia(row);
                media.put(record.getHash(), record);
                stats.setMediaMapped(stats.getMediaMapped() + 1);
            } catch (RowMappingException e) {
                log.warn("Skipping media row: {}", e.getMessage());
                stats.setMediaSkipped(stats.getMediaSkipped() + 1);
            }
        }
        return media;
    }

    private List<NoteRecord> mapNotes(List<Map<String, Object>> rows, ImportStatistics stats)
        throws PlistDecodeException {
        List<NoteRecord> notes = new ArrayList<>();
        stats.setNoteRowsRead(rows.size());
        for (Map<String, Object> row : rows) {
            try {
                notes.add(recordMapper.mapNote(row));
                stats.setNotesMapped(stats.getNotesMapped() + 1);
            } catch (RowMappingException e) {
                log.warn("Skipping note row: {}", e.getMessage());
                stats.setNotesSkipped(stats.getNotesSkipped() + 1);
            }
        }
        return notes;
    }
}
