package com.tlsearch.index;

import com.tlsearch.source.TrainingResource;

public record SearchResult(TrainingResource resource, double score) {
}
