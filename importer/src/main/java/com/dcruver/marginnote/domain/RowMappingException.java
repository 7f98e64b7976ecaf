package com.dcruver.marginnote.domain;

/**
 * One database row could not be mapped. The row is skipped and counted.
 */
public class RowMappingException extends Exception {
    public RowMappingException(String message) {
        super(message);
    }

    public RowMappingException(String message, Throwable cause) {
        super(message, cause);
    }
}
