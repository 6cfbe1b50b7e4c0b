package com.tlsearch.api;

import java.time.Clock;
import java.time.Instant;
import java.util.List;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tlsearch.build.BuildException;
import com.tlsearch.cache.CacheStore;
import com.tlsearch.embed.EmbeddingService;
import com.tlsearch.embed.VectorProviderException;
import com.tlsearch.index.SearchIndex;
import com.tlsearch.refresh.IndexRefresher;
import com.tlsearch.source.TrainingResource;

/**
 * Operations exposed to clients. Searches only read the published index and never wait on a build.
 */
public class SearchApi {
    private static final Logger log = LoggerFactory.getLogger(SearchApi.class);

    private final SearchIndex searchIndex;
    private final EmbeddingService queryEmbeddings;
    private final IndexRefresher refresher;
    private final CacheStore cacheStore;
    private final Clock clock;
    private final int topK;

    public SearchApi(SearchIndex searchIndex,
            EmbeddingService queryEmbeddings,
            IndexRefresher refresher,
            CacheStore cacheStore,
            Clock clock,
            int topK) {
        this.searchIndex = searchIndex;
        this.queryEmbeddings = queryEmbeddings;
        this.refresher = refresher;
        this.cacheStore = cacheStore;
        this.clock = clock;
        this.topK = topK;
    }

    public List<SearchHit> search(String query) {
        if (query == null || query.isBlank()) {
            throw QueryException.badRequest("Missing query");
        }
        if (searchIndex.isEmpty()) {
            throw QueryException.unavailable("Embeddings not yet loaded");
        }
        try {
            float[] queryVector = queryEmbeddings.embed(query);
            return searchIndex.query(queryVector, topK).stream()
                    .map(SearchHit::from)
                    .toList();
        } catch (VectorProviderException | RuntimeException e) {
            log.error("search.failed reason={}", e.getMessage(), e);
            throw QueryException.internal("Failed to process query", e);
        }
    }

    /**
     * Forces a rebuild and publishes it.
     *
     * @throws com.tlsearch.refresh.RefreshRejectedException when a build is already running
     */
    public RefreshResponse refresh() throws BuildException {
        log.info("refresh.manual.requested");
        List<TrainingResource> resources = refresher.refresh("manual");
        return new RefreshResponse(true, "Refreshed %d embeddings".formatted(resources.size()), Instant.now(clock));
    }

    public HealthResponse health() {
        return new HealthResponse("healthy", !searchIndex.isEmpty(), cacheStore.isValid(), Instant.now(clock));
    }
}
