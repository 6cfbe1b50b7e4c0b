package com.tlsearch.source;

import java.util.List;

public interface SourceFetcher {
    /**
     * Returns the whole library in source order. Not retried; the caller decides what a failure means.
     */
    List<TrainingResource> fetchAll() throws SourceFetchException;
}
