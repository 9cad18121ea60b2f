package org.trypticon.fstkit;

import java.io.IOException;

/**
 * Thrown by codecs when persisted FST data is malformed.
 */
public class CorruptFstException extends IOException {
    public CorruptFstException(String message, String source) {
        super(message + " (source=" + source + ")");
    }

    public CorruptFstException(String message, String source, Throwable cause) {
        super(message + " (source=" + source + ")", cause);
    }
}
