package com.screening.exception;

import com.screening.engine.ListSource;

/**
 * A reference list snapshot could not be read (missing file, malformed content).
 *
 * Never escapes the snapshot loader; it is turned into an unavailable or
 * fallback snapshot for that source only.
 */
public class SourceUnavailableException extends RuntimeException {

    private final ListSource source;

    public SourceUnavailableException(ListSource source, String message) {
        super(message);
        this.source = source;
    }

    public SourceUnavailableException(ListSource source, String message, Throwable cause) {
        super(message, cause);
        this.source = source;
    }

    public ListSource getSource() {
        return source;
    }
}
