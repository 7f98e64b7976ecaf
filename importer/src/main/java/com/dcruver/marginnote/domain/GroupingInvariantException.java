package com.dcruver.marginnote.domain;

/**
 * A group refers to a note id that does not resolve to a record.
 */
public class GroupingInvariantException extends IllegalStateException {
    public GroupingInvariantException(String message) {
        super(message);
    }
}
