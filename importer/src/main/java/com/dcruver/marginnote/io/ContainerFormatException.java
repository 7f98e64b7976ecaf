package com.dcruver.marginnote.io;

import java.io.IOException;

/**
 * The buffer is not a readable container: the central directory or a local
 * header cannot be located or lies outside the buffer. Fatal for the whole read.
 */
public class ContainerFormatException extends IOException {
    public ContainerFormatException(String message) {
        super(message);
    }
}
