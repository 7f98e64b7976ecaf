package com.dcruver.marginnote.reporting;

import com.dcruver.marginnote.app.ImportException;
import com.dcruver.marginnote.app.ImportPipeline;
import com.dcruver.marginnote.app.ImportResult;
import com.dcruver.marginnote.app.ImportStage;
import com.dcruver.marginnote.app.ImportStatistics;
import com.dcruver.marginnote.config.ImporterConfiguration;
import com.dcruver.marginnote.domain.ContentGrouper;
import com.dcruver.marginnote.domain.Deduplicator;
import com.dcruver.marginnote.domain.MediaClassifier;
import com.dcruver.marginnote.domain.RecordMapper;
import com.dcruver.marginnote.domain.TextFeatureExtractor;
import com.dcruver.marginnote.io.ArchiveReader;
import com.dcruver.marginnote.io.DatabaseRows;
import com.dcruver.marginnote.io.PackageDatabaseReader;
import com.dcruver.marginnote.plist.ArchivedBlobDecoder;
import com.dcruver.marginnote.plist.BinaryPlistParser;
import com.dcruver.marginnote.plist.KeyedArchiverResolver;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import java.util.HashMap;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertTrue;

class ImportReportFormatterTest {

    private ObjectMapper objectMapper;
    private ImportReportFormatter formatter;
    private ImportResult result;

    @BeforeEach
    void setUp() throws Exception {
        objectMapper = new ImporterConfiguration().objectMapper();
        formatter = new ImportReportFormatter(objectMapper);

        ArchivedBlobDecoder decoder = new ArchivedBlobDecoder(new BinaryPlistParser(),
            new KeyedArchiverResolver(256), false);
        RecordMapper mapper = new RecordMapper(decoder, new TextFeatureExtractor("marginnote4app"),
            new MediaClassifier(), objectMapper);
        ImportPipeline pipeline = new ImportPipeline(new ArchiveReader(1024, List.of()), new PackageDatabaseReader(),
            mapper, new ContentGrouper(), new Deduplicator(0.9));

        Map<String, Object> original = new HashMap<>();
        original.put("ZNOTEID", "N1");
        original.put("ZHIGHLIGHT_TEXT", "first passage");
        original.put("ZNOTE_DATE", 0.0);
        Map<String, Object> merged = new HashMap<>();
        merged.put("ZNOTEID", "N2");
        merged.put("ZGROUPNOTEID", "N1");
        merged.put("ZNOTES_TEXT", "#idea\nmore");
        Map<String, Object> topic = new HashMap<>();
        topic.put("ZTOPICID", "T1");
        topic.put("ZFORUMOWNER", "{\"projectTopic\": true}");

        result = pipeline.importRows(new DatabaseRows(List.of(original, merged), List.of(topic), List.of()));
    }

    @Test
    void testTextReport() {
        String text = formatter.formatText(result);

        assertTrue(text.contains("- Notes: 2 read, 2 mapped, 0 skipped"));
        assertTrue(text.contains("- Final records: 1"));
        assertTrue(text.contains("- Duplicates removed: 1 (50.0%)"));
        assertTrue(text.contains("- PROJECT: 1"));
    }

    @Test
    void testJsonReport() throws Exception {
        JsonNode json = objectMapper.readTree(formatter.formatJson(result));

        assertEquals(1, json.path("statistics").path("finalRecords").asInt());
        assertEquals(2, json.path("statistics").path("notesMapped").asInt());
        assertEquals(1, json.path("deduplication").path("mergedContentFound").asInt());
        assertEquals(1, json.path("topicsByType").path("PROJECT").asInt());
    }

    @Test
    void testNoteDetails() {
        String text = formatter.formatNote(result.records().get(0));

        assertTrue(text.startsWith("Note N2 (merged into N1)"));
        assertTrue(text.contains("Hashtags: idea"));
        assertTrue(text.contains("Excerpt: first passage"));
    }

    @Test
    void testFailureReport() {
        ImportStatistics stats = new ImportStatistics();
        stats.getArchiveFailures().add("x.db: CRC mismatch");
        ImportException e = new ImportException(ImportStage.ARCHIVE, "Database entry unreadable", stats, null);

        String text = formatter.formatFailure(e);

        assertTrue(text.contains("Import failed at stage ARCHIVE."));
        assertTrue(text.contains("- x.db: CRC mismatch"));
    }
}
