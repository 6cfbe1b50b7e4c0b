package com.tlsearch.refresh;

import java.io.IOException;
import java.time.Duration;
import java.util.List;
import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tlsearch.build.BuildException;
import com.tlsearch.build.EmbeddingBuilder;
import com.tlsearch.cache.CacheStore;
import com.tlsearch.index.SearchIndex;
import com.tlsearch.source.TrainingResource;

/**
 * Runs builds one at a time and publishes their results to the {@link SearchIndex}. A failed build leaves
 * the served collection untouched. A request that arrives while a build is running is rejected.
 */
public class IndexRefresher {
    private static final Logger log = LoggerFactory.getLogger(IndexRefresher.class);

    private final EmbeddingBuilder builder;
    private final CacheStore cacheStore;
    private final SearchIndex searchIndex;
    private final ReentrantLock buildLock = new ReentrantLock();

    public IndexRefresher(EmbeddingBuilder builder, CacheStore cacheStore, SearchIndex searchIndex) {
        this.builder = builder;
        this.cacheStore = cacheStore;
        this.searchIndex = searchIndex;
    }

    /**
     * Forced rebuild followed by a publish.
     *
     * @param trigger label for the logs, e.g. {@code scheduled} or {@code manual}
     */
    public List<TrainingResource> refresh(String trigger) throws BuildException {
        return buildAndPublish(trigger, true, false);
    }

    public List<TrainingResource> buildAndPublish(String trigger, boolean forceRefresh, boolean resumeFromPartial)
            throws BuildException {
        if (!buildLock.tryLock()) {
            log.warn("refresh.rejected trigger={} reason=build-in-progress", trigger);
            throw new RefreshRejectedException("A build is already in progress");
        }
        long start = System.nanoTime();
        try {
            log.info("refresh.start trigger={} force={} resume={}", trigger, forceRefresh, resumeFromPartial);
            List<TrainingResource> resources = builder.build(forceRefresh, resumeFromPartial);
            searchIndex.publish(resources);
            log.info("refresh.complete trigger={} items={} elapsedMs={}",
                    trigger, resources.size(), Duration.ofNanos(System.nanoTime() - start).toMillis());
            return resources;
        } catch (BuildException e) {
            log.error("refresh.failed trigger={} completed={} total={} servedItems={} reason={}",
                    trigger, e.completed(), e.total(), searchIndex.size(), e.getMessage(), e);
            throw e;
        } finally {
            buildLock.unlock();
        }
    }

    /**
     * Startup path: serve the stored snapshot when there is one, otherwise run a normal (non-forced) build.
     */
    public List<TrainingResource> loadInitial() throws BuildException {
        if (cacheStore.snapshotExists()) {
            log.info("startup.load.cached path={}", cacheStore.snapshotPath());
            try {
                List<TrainingResource> cached = cacheStore.load();
                searchIndex.publish(cached);
                return cached;
            } catch (IOException e) {
                throw BuildException.beforeItems("Failed to load cached embeddings", e);
            }
        }
        log.info("startup.load.build reason=no-snapshot");
        return buildAndPublish("startup", false, false);
    }

    public boolean isBuilding() {
        return buildLock.isLocked();
    }
}
