package com.tlsearch.refresh;

/**
 * Raised when a build is requested while another one is still running.
 */
public class RefreshRejectedException extends IllegalStateException {
    public RefreshRejectedException(String message) {
        super(message);
    }
}
