package com.tlsearch.build;

import java.io.IOException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.tlsearch.cache.CacheStore;
import com.tlsearch.embed.EmbeddingService;
import com.tlsearch.embed.VectorProviderException;
import com.tlsearch.runtime.AppConfig;
import com.tlsearch.runtime.Sleeper;
import com.tlsearch.source.SourceFetchException;
import com.tlsearch.source.SourceFetcher;
import com.tlsearch.source.TrainingResource;

/**
 * Fetches the library and embeds it item by item, checkpointing progress so an interrupted build can be
 * resumed from the first item that was not embedded.
 * <p>
 * Items are embedded strictly one after another. Callers must not run two builds against the same
 * {@link CacheStore} at once.
 */
public class EmbeddingBuilder {
    private static final Logger log = LoggerFactory.getLogger(EmbeddingBuilder.class);

    private final SourceFetcher sourceFetcher;
    private final EmbeddingService embeddingService;
    private final CacheStore cacheStore;
    private final AppConfig.BuildConfig settings;
    private final String cacheVersion;
    private final Sleeper sleeper;

    public EmbeddingBuilder(SourceFetcher sourceFetcher,
            EmbeddingService embeddingService,
            CacheStore cacheStore,
            AppConfig.BuildConfig settings,
            String cacheVersion,
            Sleeper sleeper) {
        this.sourceFetcher = sourceFetcher;
        this.embeddingService = embeddingService;
        this.cacheStore = cacheStore;
        this.settings = settings;
        this.cacheVersion = cacheVersion;
        this.sleeper = sleeper;
    }

    /**
     * @param forceRefresh rebuild even when the cached snapshot is still fresh
     * @param resumeFromPartial continue from the partial progress file when one exists
     * @return the complete embedded collection, in source order
     */
    public List<TrainingResource> build(boolean forceRefresh, boolean resumeFromPartial) throws BuildException {
        if (!forceRefresh && !resumeFromPartial && cacheStore.isValid()) {
            log.info("build.skipped reason=cache-valid snapshot={}", cacheStore.snapshotPath());
            try {
                return List.copyOf(cacheStore.load());
            } catch (IOException e) {
                throw BuildException.beforeItems("Failed to read cached snapshot", e);
            }
        }

        List<TrainingResource> items = fetchSource();
        int total = items.size();
        log.info("build.start items={} force={} resume={} provider={}",
                total, forceRefresh, resumeFromPartial, embeddingService.version());

        List<TrainingResource> processed = resumeFromPartial ? resumedPrefix() : new ArrayList<>();
        if (processed.size() > total) {
            log.warn("build.resume.truncated partial={} source={}", processed.size(), total);
            processed = new ArrayList<>(processed.subList(0, total));
        }

        int consecutiveErrors = 0;
        for (int i = processed.size(); i < total; i++) {
            TrainingResource item = items.get(i);
            float[] vector;
            try {
                vector = embeddingService.embed(item.combinedText());
            } catch (VectorProviderException | RuntimeException e) {
                consecutiveErrors++;
                log.error("build.item.failed index={} total={} title={} consecutiveErrors={} reason={}",
                        i + 1, total, item.title(), consecutiveErrors, e.getMessage());
                savePartialBeforeFailure(processed, total, e);
                throw BuildException.afterItems(processed.size(), total, e);
            }

            processed.add(item.withEmbedding(vector));
            consecutiveErrors = 0;
            log.info("build.item.embedded index={} total={} title={}", i + 1, total, item.title());

            if (processed.size() % settings.getCheckpointInterval() == 0) {
                checkpoint(processed, total);
            }
            if (i < total - 1) {
                pause(interItemDelayMs(consecutiveErrors), processed, total);
            }
        }

        return complete(processed, total);
    }

    /**
     * Delay applied after each embedded item: the base delay plus a capped step per consecutive error.
     */
    long interItemDelayMs(int consecutiveErrors) {
        long errorDelay = Math.min(consecutiveErrors * settings.getErrorDelayStepMs(), settings.getMaxErrorDelayMs());
        return settings.getBaseDelayMs() + errorDelay;
    }

    private List<TrainingResource> fetchSource() throws BuildException {
        log.info("build.fetch.start");
        try {
            return sourceFetcher.fetchAll();
        } catch (SourceFetchException e) {
            log.error("build.fetch.failed reason={}", e.getMessage(), e);
            throw BuildException.beforeItems("Source fetch failed", e);
        }
    }

    private List<TrainingResource> resumedPrefix() {
        try {
            Optional<List<TrainingResource>> partial = cacheStore.loadPartial();
            if (partial.isEmpty()) {
                log.info("build.resume.none path={}", cacheStore.partialPath());
                return new ArrayList<>();
            }
            log.info("build.resume items={} path={}", partial.get().size(), cacheStore.partialPath());
            return new ArrayList<>(partial.get());
        } catch (IOException e) {
            log.warn("build.resume.unreadable path={} reason={} action=start-fresh", cacheStore.partialPath(), e.getMessage());
            return new ArrayList<>();
        }
    }

    private void checkpoint(List<TrainingResource> processed, int total) throws BuildException {
        try {
            cacheStore.savePartial(processed);
            log.info("build.checkpoint saved={} total={}", processed.size(), total);
        } catch (IOException e) {
            throw new BuildException("Failed to write progress checkpoint: " + e.getMessage(), processed.size(), total, e);
        }
    }

    private void savePartialBeforeFailure(List<TrainingResource> processed, int total, Exception failure) {
        if (processed.isEmpty()) {
            return;
        }
        try {
            cacheStore.savePartial(processed);
            log.info("build.partial.saved items={} total={}", processed.size(), total);
        } catch (IOException e) {
            log.error("build.partial.write.failed items={} path={}", processed.size(), cacheStore.partialPath(), e);
            failure.addSuppressed(e);
        }
    }

    private void pause(long delayMs, List<TrainingResource> processed, int total) throws BuildException {
        if (delayMs <= 0) {
            return;
        }
        try {
            sleeper.sleep(delayMs);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            savePartialBeforeFailure(processed, total, e);
            throw BuildException.afterItems(processed.size(), total, e);
        }
    }

    private List<TrainingResource> complete(List<TrainingResource> processed, int total) throws BuildException {
        try {
            cacheStore.save(processed, cacheStore.freshMetadata(total, cacheVersion));
        } catch (IOException e) {
            savePartialBeforeFailure(processed, total, e);
            throw new BuildException("Failed to write cache snapshot: " + e.getMessage(), processed.size(), total, e);
        }
        try {
            cacheStore.deletePartial();
        } catch (IOException e) {
            log.warn("build.partial.delete.failed path={} reason={}", cacheStore.partialPath(), e.getMessage());
        }
        log.info("build.complete items={}", processed.size());
        return List.copyOf(processed);
    }
}
