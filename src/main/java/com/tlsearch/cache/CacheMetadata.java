package com.tlsearch.cache;

import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public record CacheMetadata(Instant lastUpdated, int itemCount, String version) {
}
