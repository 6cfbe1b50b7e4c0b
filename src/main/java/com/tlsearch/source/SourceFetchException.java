package com.tlsearch.source;

import java.io.IOException;

public class SourceFetchException extends IOException {
    public SourceFetchException(String message) {
        super(message);
    }

    public SourceFetchException(String message, Throwable cause) {
        super(message, cause);
    }
}
