package com.dcruver.marginnote.io;

import lombok.extern.slf4j.Slf4j;
import org.springframework.dao.DataAccessException;
import org.springframework.jdbc.core.JdbcTemplate;
import org.springframework.jdbc.datasource.SingleConnectionDataSource;
import org.springframework.stereotype.Component;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.HashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Reads note, topic and media rows out of the SQLite database shipped inside a package.
 * The database bytes are written to a temporary file for the driver and removed afterwards.
 */
@Component
@Slf4j
public class PackageDatabaseReader {

    static final String NOTES_TABLE = "ZBOOKNOTE";
    static final String TOPICS_TABLE = "ZTOPIC";
    static final String MEDIA_TABLE = "ZMEDIA";

    /**
     * Read all rows from a database given as raw bytes
     */
    public DatabaseRows read(byte[] databaseBytes) throws DatabaseShapeException {
        Path tempFile = null;
        try {
            tempFile = Files.createTempFile("marginnote-", ".sqlite");
            Files.write(tempFile, databaseBytes);
            return read(tempFile);
        } catch (IOException e) {
            throw new DatabaseShapeException("Could not stage database file: " + e.getMessage(), e);
        } finally {
            if (tempFile != null) {
                try {
                    Files.deleteIfExists(tempFile);
                } catch (IOException e) {
                    log.warn("Could not delete temporary database {}", tempFile, e);
                }
            }
        }
    }

    /**
     * Read all rows from a database file on disk
     */
    public DatabaseRows read(Path databaseFile) throws DatabaseShapeException {
        SingleConnectionDataSource dataSource = new SingleConnectionDataSource();
        dataSource.setDriverClassName("org.sqlite.JDBC");
        dataSource.setUrl("jdbc:sqlite:" + databaseFile.toAbsolutePath());
        dataSource.setSuppressClose(true);

        try {
            JdbcTemplate jdbcTemplate = new JdbcTemplate(dataSource);
            Set<String> tables = listTables(jdbcTemplate);

            if (!tables.contains(NOTES_TABLE)) {
                throw new DatabaseShapeException("Database has no " + NOTES_TABLE + " table");
            }

            List<Map<String, Object>> notes = jdbcTemplate.queryForList("SELECT * FROM " + NOTES_TABLE);
            List<Map<String, Object>> topics = readOptional(jdbcTemplate, tables, TOPICS_TABLE);
            List<Map<String, Object>> media = readOptional(jdbcTemplate, tables, MEDIA_TABLE);

            log.info("Read {} note rows, {} topic rows, {} media rows", notes.size(), topics.size(), media.size());
            return new DatabaseRows(notes, topics, media);
        } catch (DataAccessException e) {
            throw new DatabaseShapeException("Could not read database: " + e.getMostSpecificCause().getMessage(), e);
        } finally {
            dataSource.destroy();
        }
    }

    private Set<String> listTables(JdbcTemplate jdbcTemplate) {
        List<String> names = jdbcTemplate.queryForList(
            "SELECT name FROM sqlite_master WHERE type = 'table'", String.class);
        Set<String> tables = new HashSet<>();
        for (String name : names) {
            tables.add(name.toUpperCase());
        }
        return tables;
    }

    private List<Map<String, Object>> readOptional(JdbcTemplate jdbcTemplate, Set<String> tables, String table) {
        if (!tables.contains(table)) {
            log.warn("Database has no {} table, continuing without it", table);
            return List.of();
        }
        return jdbcTemplate.queryForList("SELECT * FROM " + table);
    }
}
