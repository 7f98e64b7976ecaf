package com.dcruver.marginnote.io;

/**
 * The extracted database cannot be opened or lacks the notes table.
 */
public class DatabaseShapeException extends Exception {
    public DatabaseShapeException(String message) {
        super(message);
    }

    public DatabaseShapeException(String message, Throwable cause) {
        super(message, cause);
    }
}
