package com.tlsearch.api;

import java.time.Instant;

public record RefreshResponse(boolean success, String message, Instant timestamp) {
}
