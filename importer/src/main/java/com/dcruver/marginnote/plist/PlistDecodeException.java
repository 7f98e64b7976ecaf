package com.dcruver.marginnote.plist;

/**
 * Malformed binary property list or unresolvable keyed-archiver object graph.
 */
public class PlistDecodeException extends Exception {
    public PlistDecodeException(String message) {
        super(message);
    }
}
