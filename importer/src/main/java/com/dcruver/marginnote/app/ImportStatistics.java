package com.dcruver.marginnote.app;

import com.dcruver.marginnote.domain.GroupingStatistics;
import lombok.Data;

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;

/**
 * Counts collected across one import run.
 */
@Data
public class ImportStatistics {
    private int archiveEntries;
    private String databaseEntry;
    private final List<String> archiveFailures = new ArrayList<>();

    private int noteRowsRead;
    private int notesMapped;
    private int notesSkipped;
    private int topicRowsRead;
    private int topicsMapped;
    private int topicsSkipped;
    private int mediaRowsRead;
    private int mediaMapped;
    private int mediaSkipped;

    private GroupingStatistics grouping;
    private int finalRecords;

    private final Map<ImportStage, Long> stageMillis = new EnumMap<>(ImportStage.class);

    public int getRowsSkipped() {
        return notesSkipped + topicsSkipped + mediaSkipped;
    }

    public void recordStage(ImportStage stage, long startedAt) {
        stageMillis.put(stage, System.currentTimeMillis() - startedAt);
    }
}
