package com.tlsearch.index;

import java.util.Comparator;
import java.util.List;
import java.util.concurrent.atomic.AtomicReference;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tlsearch.source.TrainingResource;

/**
 * The collection currently answering queries. Readers take one reference to an immutable list per query;
 * {@link #publish(List)} swaps the whole list, so a query never sees a partly replaced collection.
 * <p>
 * Scoring is an exact scan over every item.
 */
public class SearchIndex {
    private static final Logger log = LoggerFactory.getLogger(SearchIndex.class);
    public static final int DEFAULT_TOP_K = 6;

    private final AtomicReference<List<TrainingResource>> served = new AtomicReference<>(List.of());

    public void publish(List<TrainingResource> resources) {
        for (TrainingResource resource : resources) {
            if (!resource.hasEmbedding()) {
                throw new IllegalArgumentException("cannot publish an item without an embedding: " + resource.title());
            }
        }
        List<TrainingResource> snapshot = List.copyOf(resources);
        List<TrainingResource> previous = served.getAndSet(snapshot);
        log.info("index.published items={} previous={}", snapshot.size(), previous.size());
    }

    public List<TrainingResource> current() {
        return served.get();
    }

    public int size() {
        return served.get().size();
    }

    public boolean isEmpty() {
        return served.get().isEmpty();
    }

    public List<SearchResult> query(float[] queryVector) {
        return query(queryVector, DEFAULT_TOP_K);
    }

    /**
     * @return at most {@code k} results from the served collection, highest cosine similarity first
     */
    public List<SearchResult> query(float[] queryVector, int k) {
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }
        List<TrainingResource> snapshot = served.get();
        return snapshot.stream()
                .map(resource -> new SearchResult(resource, VectorMath.cosine(queryVector, resource.embedding())))
                .sorted(Comparator.comparingDouble(SearchResult::score).reversed())
                .limit(k)
                .toList();
    }
}
