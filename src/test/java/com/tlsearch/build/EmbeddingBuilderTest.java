package com.tlsearch.build;

import static org.junit.jupiter.api.Assertions.assertArrayEquals;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.ArrayList;
import java.util.List;

import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import com.tlsearch.cache.CacheStore;
import com.tlsearch.index.SearchIndex;
import com.tlsearch.index.SearchResult;
import com.tlsearch.runtime.AppConfig;
import com.tlsearch.source.TrainingResource;
import com.tlsearch.support.ListSourceFetcher;
import com.tlsearch.support.RecordingSleeper;
import com.tlsearch.support.ScriptedEmbeddingService;

class EmbeddingBuilderTest {
    private static final Instant NOW = Instant.parse("2024-05-01T12:00:00Z");

    @TempDir
    Path tempDir;

    private CacheStore store;
    private RecordingSleeper sleeper;

    @BeforeEach
    void setUp() {
        store = new CacheStore(
                tempDir.resolve("embedded-resources.json"),
                tempDir.resolve("cache-metadata.json"),
                tempDir.resolve("embedded-resources.json.partial"),
                Duration.ofHours(24),
                Clock.fixed(NOW, ZoneOffset.UTC));
        sleeper = new RecordingSleeper();
    }

    @Test
    void shouldEmbedEverythingAndProduceSearchableCollection() throws Exception {
        ListSourceFetcher source = new ListSourceFetcher(List.of(
                TrainingResource.of("A", "X", "d1"),
                TrainingResource.of("B", "Y", "d2")));
        ScriptedEmbeddingService embeddings = new ScriptedEmbeddingService(
                text -> text.startsWith("A") ? new float[] { 1f, 0f } : new float[] { 0f, 1f });

        List<TrainingResource> built = builder(source, embeddings).build(false, false);

        assertEquals(List.of("A X d1", "B Y d2"), embeddings.calls());
        assertEquals(2, built.size());
        assertTrue(Files.exists(store.snapshotPath()));
        assertEquals(2, store.readMetadata().orElseThrow().itemCount());
        assertEquals("1.0", store.readMetadata().orElseThrow().version());
        assertFalse(Files.exists(store.partialPath()));

        SearchIndex index = new SearchIndex();
        index.publish(built);
        List<SearchResult> results = index.query(new float[] { 1f, 0f });
        assertEquals("A", results.get(0).resource().title());
        assertEquals(1.0d, results.get(0).score(), 1e-9);
        assertEquals("B", results.get(1).resource().title());
        assertEquals(0.0d, results.get(1).score(), 1e-9);
    }

    @Test
    void shouldSavePartialAndReportProgressWhenProviderFails() throws Exception {
        ScriptedEmbeddingService embeddings = ScriptedEmbeddingService.constant(1f, 0f).failOnCall(2);

        BuildException ex = assertThrows(BuildException.class,
                () -> builder(ListSourceFetcher.numbered(3), embeddings).build(false, false));

        assertTrue(ex.getMessage().contains("Failed after processing 1/3 items"), ex.getMessage());
        assertEquals(1, ex.completed());
        assertEquals(3, ex.total());
        assertEquals(1, store.loadPartial().orElseThrow().size());
        assertFalse(store.snapshotExists());
    }

    @Test
    void shouldNotWritePartialWhenFirstItemFails() {
        ScriptedEmbeddingService embeddings = ScriptedEmbeddingService.constant(1f).failOnCall(1);

        BuildException ex = assertThrows(BuildException.class,
                () -> builder(ListSourceFetcher.numbered(3), embeddings).build(false, false));

        assertEquals(0, ex.completed());
        assertFalse(Files.exists(store.partialPath()));
    }

    @Test
    void shouldResumeFromFirstUnembeddedItem() throws Exception {
        ListSourceFetcher source = ListSourceFetcher.numbered(5);
        List<TrainingResource> prefix = new ArrayList<>();
        for (TrainingResource item : source.fetchAll().subList(0, 2)) {
            prefix.add(item.withEmbedding(new float[] { 0f, 1f }));
        }
        store.savePartial(prefix);
        ScriptedEmbeddingService embeddings = ScriptedEmbeddingService.constant(1f, 0f);

        List<TrainingResource> built = builder(source, embeddings).build(false, true);

        assertEquals(List.of(
                "Item 3 Topic 3 Description 3",
                "Item 4 Topic 4 Description 4",
                "Item 5 Topic 5 Description 5"), embeddings.calls());
        assertEquals(5, built.size());
        assertArrayEquals(new float[] { 0f, 1f }, built.get(0).embedding());
        assertArrayEquals(new float[] { 1f, 0f }, built.get(4).embedding());
        assertFalse(Files.exists(store.partialPath()));
    }

    @Test
    void shouldCompleteWithoutCallsWhenPartialCoversSource() throws Exception {
        ListSourceFetcher larger = ListSourceFetcher.numbered(4);
        List<TrainingResource> prefix = new ArrayList<>();
        for (TrainingResource item : larger.fetchAll()) {
            prefix.add(item.withEmbedding(new float[] { 1f }));
        }
        store.savePartial(prefix);
        ScriptedEmbeddingService embeddings = ScriptedEmbeddingService.constant(1f);

        List<TrainingResource> built = builder(ListSourceFetcher.numbered(3), embeddings).build(false, true);

        assertTrue(embeddings.calls().isEmpty());
        assertEquals(3, built.size());
        assertEquals(3, store.readMetadata().orElseThrow().itemCount());
    }

    @Test
    void shouldStartFreshWhenPartialIsUnreadable() throws Exception {
        Files.writeString(store.partialPath(), "{broken");
        ScriptedEmbeddingService embeddings = ScriptedEmbeddingService.constant(1f);

        List<TrainingResource> built = builder(ListSourceFetcher.numbered(3), embeddings).build(false, true);

        assertEquals(3, embeddings.calls().size());
        assertEquals(3, built.size());
    }

    @Test
    void shouldCheckpointEveryTwentyFiveItems() throws Exception {
        List<Integer> partialSizesSeen = new ArrayList<>();
        ScriptedEmbeddingService[] holder = new ScriptedEmbeddingService[1];
        holder[0] = new ScriptedEmbeddingService(text -> {
            int call = holder[0].calls().size();
            if (call == 26 || call == 51 || call == 76) {
                try {
                    partialSizesSeen.add(store.loadPartial().map(List::size).orElse(0));
                } catch (IOException e) {
                    throw new UncheckedIOException(e);
                }
            }
            return new float[] { 1f };
        });

        List<TrainingResource> built = builder(ListSourceFetcher.numbered(80), holder[0]).build(false, false);

        assertEquals(List.of(25, 50, 75), partialSizesSeen);
        assertEquals(80, built.size());
        assertFalse(Files.exists(store.partialPath()));
    }

    @Test
    void shouldReturnCachedSnapshotWithoutFetchingWhenCacheIsValid() throws Exception {
        store.save(List.of(TrainingResource.of("Cached", "T", "D").withEmbedding(new float[] { 1f })),
                store.freshMetadata(1, "1.0"));
        ListSourceFetcher source = ListSourceFetcher.numbered(3);
        ScriptedEmbeddingService embeddings = ScriptedEmbeddingService.constant(1f);

        List<TrainingResource> built = builder(source, embeddings).build(false, false);

        assertEquals(0, source.fetches());
        assertTrue(embeddings.calls().isEmpty());
        assertEquals("Cached", built.get(0).title());
    }

    @Test
    void shouldRebuildValidCacheWhenForced() throws Exception {
        store.save(List.of(TrainingResource.of("Cached", "T", "D").withEmbedding(new float[] { 1f })),
                store.freshMetadata(1, "1.0"));
        ListSourceFetcher source = ListSourceFetcher.numbered(2);

        List<TrainingResource> built = builder(source, ScriptedEmbeddingService.constant(1f)).build(true, false);

        assertEquals(1, source.fetches());
        assertEquals("Item 1", built.get(0).title());
    }

    @Test
    void shouldPauseBetweenItemsButNotAfterLast() throws Exception {
        builder(ListSourceFetcher.numbered(3), ScriptedEmbeddingService.constant(1f)).build(false, false);

        assertEquals(List.of(200L, 200L), sleeper.sleeps());
    }

    @Test
    void shouldGrowInterItemDelayWithConsecutiveErrorsUpToCap() {
        EmbeddingBuilder builder = builder(ListSourceFetcher.numbered(1), ScriptedEmbeddingService.constant(1f));

        assertEquals(200L, builder.interItemDelayMs(0));
        assertEquals(700L, builder.interItemDelayMs(1));
        assertEquals(1200L, builder.interItemDelayMs(2));
        assertEquals(5200L, builder.interItemDelayMs(20));
    }

    @Test
    void shouldFailBeforeItemsWhenSourceFetchFails() {
        ScriptedEmbeddingService embeddings = ScriptedEmbeddingService.constant(1f);

        BuildException ex = assertThrows(BuildException.class,
                () -> builder(ListSourceFetcher.numbered(3).failing(), embeddings).build(true, false));

        assertTrue(ex.getMessage().startsWith("Source fetch failed"), ex.getMessage());
        assertEquals(0, ex.completed());
        assertTrue(embeddings.calls().isEmpty());
        assertFalse(store.snapshotExists());
    }

    private EmbeddingBuilder builder(ListSourceFetcher source, ScriptedEmbeddingService embeddings) {
        return new EmbeddingBuilder(source, embeddings, store, new AppConfig.BuildConfig(), "1.0", sleeper);
    }
}
