package com.dcruver.marginnote.app;

import com.dcruver.marginnote.domain.ContentGroup;
import com.dcruver.marginnote.io.ArchiveEntry;
import com.dcruver.marginnote.io.ArchiveExtraction;
import com.dcruver.marginnote.io.ArchiveReader;
import com.dcruver.marginnote.reporting.ImportReportFormatter;
import lombok.RequiredArgsConstructor;
import lombok.extern.slf4j.Slf4j;
import org.springframework.shell.standard.ShellComponent;
import org.springframework.shell.standard.ShellMethod;
import org.springframework.shell.standard.ShellOption;

import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

/**
 * Spring Shell commands for importing MarginNote packages.
 */
@ShellComponent
@Slf4j
@RequiredArgsConstructor
public class ImporterShellCommands {

    private final ImportPipeline importPipeline;
    private final ArchiveReader archiveReader;
    private final ImportReportFormatter reportFormatter;

    // Result of the last successful import
    private ImportResult lastResult;

    @ShellMethod(key = {"import", "import-package"}, value = "Import a .marginpkg package and summarize it")
    public String importPackage(@ShellOption(help = "Path to the package file") String path) {
        try {
            lastResult = importPipeline.importPackage(Path.of(path));
            return reportFormatter.formatText(lastResult);
        } catch (ImportException e) {
            log.error("Import of {} failed", path, e);
            return reportFormatter.formatFailure(e);
        }
    }

    @ShellMethod(key = "entries", value = "List and verify the entries of a package")
    public String entries(@ShellOption(help = "Path to the package file") String path) {
        try {
            byte[] data = Files.readAllBytes(Path.of(path));
            List<ArchiveEntry> entries = archiveReader.listEntries(data);
            ArchiveExtraction extraction = archiveReader.extractMatching(data, entry -> true);

            StringBuilder sb = new StringBuilder();
            for (ArchiveEntry entry : entries) {
                sb.append(String.format("%-50s %10d bytes  %s\n", entry.name(), entry.uncompressedSize(),
                    entry.method() == ArchiveEntry.METHOD_STORED ? "stored" : "deflate(" + entry.method() + ")"));
            }
            sb.append(String.format("\n%d entries, %d readable\n", entries.size(), extraction.payloads().size()));
            extraction.failures().forEach(f -> sb.append("- ").append(f).append("\n"));
            archiveReader.findDatabaseEntry(entries)
                .ifPresent(db -> sb.append("Database entry: ").append(db.name()).append("\n"));
            return sb.toString();
        } catch (Exception e) {
            log.error("Could not read {}", path, e);
            return "Could not read package: " + e.getMessage();
        }
    }

    @ShellMethod(key = "groups", value = "Show content groups of the last import")
    public String groups(@ShellOption(defaultValue = "20", help = "Maximum groups to show") int limit,
                         @ShellOption(defaultValue = "false", help = "Only groups with several notes") boolean multiOnly) {
        if (lastResult == null) {
            return "No import yet. Run 'import <path>' first.";
        }
        StringBuilder sb = new StringBuilder();
        int shown = 0;
        for (ContentGroup group : lastResult.groupedNotes()) {
            if (multiOnly && group.isSingleton()) {
                continue;
            }
            if (shown++ >= limit) {
                break;
            }
            sb.append(String.format("%s [%s] %d note(s): %s\n", group.getMasterNoteId(), group.getGroupType(),
                group.size(), String.join(", ", group.getMemberIds())));
        }
        return sb.length() == 0 ? "No groups.\n" : sb.toString();
    }

    @ShellMethod(key = "note", value = "Show a deduplicated note of the last import")
    public String note(@ShellOption(help = "Note id") String noteId) {
        if (lastResult == null) {
            return "No import yet. Run 'import <path>' first.";
        }
        return lastResult.findRecord(noteId)
            .map(reportFormatter::formatNote)
            .orElseGet(() -> lastResult.findGroup(noteId)
                .map(g -> "Note " + noteId + " was merged into " + g.getMasterNoteId() + "\n")
                .orElse("Note not found: " + noteId + "\n"));
    }

    @ShellMethod(key = "report", value = "Print the last import report as JSON")
    public String report() {
        if (lastResult == null) {
            return "No import yet. Run 'import <path>' first.";
        }
        try {
            return reportFormatter.formatJson(lastResult);
        } catch (Exception e) {
            log.error("Report generation failed", e);
            return "Report generation failed: " + e.getMessage();
        }
    }
}
