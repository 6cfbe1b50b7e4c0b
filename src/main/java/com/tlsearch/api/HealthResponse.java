package com.tlsearch.api;

import java.time.Instant;

public record HealthResponse(String status, boolean embeddingsLoaded, boolean cacheValid, Instant timestamp) {
}
