package com.dcruver.marginnote.io;

/**
 * A single entry could not be extracted. Other entries remain readable.
 */
public class EntryExtractionException extends Exception {
    private final String entryName;

    public EntryExtractionException(String entryName, String message) {
        super(entryName + ": " + message);
        this.entryName = entryName;
    }

    public EntryExtractionException(String entryName, String message, Throwable cause) {
        super(entryName + ": " + message, cause);
        this.entryName = entryName;
    }

    public String getEntryName() {
        return entryName;
    }
}
