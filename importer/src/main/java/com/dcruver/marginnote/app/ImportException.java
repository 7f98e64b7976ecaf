package com.dcruver.marginnote.app;

/**
 * An import failed. Carries the stage that failed and the counts gathered up to that point.
 */
public class ImportException extends Exception {
    private final ImportStage stage;
    private final ImportStatistics statistics;

    public ImportException(ImportStage stage, String message, ImportStatistics statistics, Throwable cause) {
        super(stage + ": " + message, cause);
        this.stage = stage;
        this.statistics = statistics;
    }

    public ImportStage getStage() {
        return stage;
    }

    public ImportStatistics getStatistics() {
        return statistics;
    }
}
