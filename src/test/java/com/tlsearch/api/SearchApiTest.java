package com.tlsearch.api;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tlsearch.build.EmbeddingBuilder;
import com.tlsearch.cache.CacheStore;
import com.tlsearch.embed.EmbeddingService;
import com.tlsearch.index.SearchIndex;
import com.tlsearch.refresh.IndexRefresher;
import com.tlsearch.runtime.AppConfig;
import com.tlsearch.source.TrainingResource;
import com.tlsearch.support.ListSourceFetcher;
import com.tlsearch.support.RecordingSleeper;
import com.tlsearch.support.ScriptedEmbeddingService;

class SearchApiTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private Clock clock;
    private CacheStore store;
    private SearchIndex index;

    @BeforeEach
    void setUp() {
        clock = Clock.fixed(NOW, ZoneOffset.UTC);
        store = new CacheStore(
                tempDir.resolve("embedded-resources.json"),
                tempDir.resolve("cache-metadata.json"),
                tempDir.resolve("embedded-resources.json.partial"),
                Duration.ofHours(24),
                clock);
        index = new SearchIndex();
    }

    @Test
    void shouldReturnRankedHitsWithoutEmbeddings() {
        index.publish(List.of(
                TrainingResource.of("Knots", "Lines", "Cleat hitch").withEmbedding(new float[] { 0f, 1f }),
                TrainingResource.of("Docking", "Seamanship", "Approach slowly").withEmbedding(new float[] { 1f, 0f })));
        ScriptedEmbeddingService queries = ScriptedEmbeddingService.constant(1f, 0f);

        List<SearchHit> hits = api(queries, ListSourceFetcher.numbered(1)).search("how do I dock");

        assertEquals(List.of("how do I dock"), queries.calls());
        assertEquals(2, hits.size());
        assertEquals("Docking", hits.get(0).title());
        assertEquals("Seamanship", hits.get(0).topic());
        assertEquals(1.0d, hits.get(0).score(), 1e-9);
        assertEquals("Knots", hits.get(1).title());
    }

    @Test
    void shouldLimitHitsToConfiguredTopK() {
        index.publish(List.of(
                TrainingResource.of("A", "T", "D").withEmbedding(new float[] { 1f }),
                TrainingResource.of("B", "T", "D").withEmbedding(new float[] { 1f }),
                TrainingResource.of("C", "T", "D").withEmbedding(new float[] { 1f })));
        SearchApi api = new SearchApi(index, ScriptedEmbeddingService.constant(1f), refresher(ListSourceFetcher.numbered(1)),
                store, clock, 2);

        assertEquals(2, api.search("anything").size());
    }

    @Test
    void shouldRejectMissingQuery() {
        SearchApi api = api(ScriptedEmbeddingService.constant(1f), ListSourceFetcher.numbered(1));

        QueryException blank = assertThrows(QueryException.class, () -> api.search("   "));
        QueryException missing = assertThrows(QueryException.class, () -> api.search(null));

        assertEquals(QueryException.Kind.BAD_REQUEST, blank.kind());
        assertEquals("Missing query", blank.getMessage());
        assertEquals(QueryException.Kind.BAD_REQUEST, missing.kind());
    }

    @Test
    void shouldReportUnavailableBeforeEmbeddingsAreLoaded() {
        ScriptedEmbeddingService queries = ScriptedEmbeddingService.constant(1f);

        QueryException ex = assertThrows(QueryException.class,
                () -> api(queries, ListSourceFetcher.numbered(1)).search("docking"));

        assertEquals(QueryException.Kind.UNAVAILABLE, ex.kind());
        assertEquals("Embeddings not yet loaded", ex.getMessage());
        assertTrue(queries.calls().isEmpty());
    }

    @Test
    void shouldReportInternalErrorWhenQueryEmbeddingFails() {
        index.publish(List.of(TrainingResource.of("A", "T", "D").withEmbedding(new float[] { 1f })));
        ScriptedEmbeddingService queries = ScriptedEmbeddingService.constant(1f).failOnCall(1);

        QueryException ex = assertThrows(QueryException.class,
                () -> api(queries, ListSourceFetcher.numbered(1)).search("docking"));

        assertEquals(QueryException.Kind.INTERNAL, ex.kind());
        assertEquals("Failed to process query", ex.getMessage());
    }

    @Test
    void shouldReportInternalErrorOnDimensionMismatch() {
        index.publish(List.of(TrainingResource.of("A", "T", "D").withEmbedding(new float[] { 1f, 0f })));

        QueryException ex = assertThrows(QueryException.class,
                () -> api(ScriptedEmbeddingService.constant(1f), ListSourceFetcher.numbered(1)).search("docking"));

        assertEquals(QueryException.Kind.INTERNAL, ex.kind());
    }

    @Test
    void shouldRefreshAndReportCount() throws Exception {
        RefreshResponse response = api(ScriptedEmbeddingService.constant(1f), ListSourceFetcher.numbered(3)).refresh();

        assertTrue(response.success());
        assertEquals("Refreshed 3 embeddings", response.message());
        assertEquals(NOW, response.timestamp());
        assertEquals(3, index.size());
    }

    @Test
    void shouldReportHealthBeforeAndAfterLoad() throws Exception {
        SearchApi api = api(ScriptedEmbeddingService.constant(1f), ListSourceFetcher.numbered(2));

        HealthResponse before = api.health();
        api.refresh();
        HealthResponse after = api.health();

        assertEquals("healthy", before.status());
        assertFalse(before.embeddingsLoaded());
        assertFalse(before.cacheValid());
        assertTrue(after.embeddingsLoaded());
        assertTrue(after.cacheValid());
        assertEquals(NOW, after.timestamp());
    }

    private SearchApi api(EmbeddingService queries, ListSourceFetcher source) {
        return new SearchApi(index, queries, refresher(source), store, clock, SearchIndex.DEFAULT_TOP_K);
    }

    private IndexRefresher refresher(ListSourceFetcher source) {
        EmbeddingBuilder builder = new EmbeddingBuilder(source, ScriptedEmbeddingService.constant(1f), store,
                new AppConfig.BuildConfig(), "1.0", new RecordingSleeper());
        return new IndexRefresher(builder, store, index);
    }
}
