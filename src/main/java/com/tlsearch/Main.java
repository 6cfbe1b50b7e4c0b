package com.tlsearch;

import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Duration;
import java.util.List;
import java.util.Map;
import java.util.concurrent.Callable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.databind.json.JsonMapper;
import com.fasterxml.jackson.dataformat.yaml.YAMLFactory;
import com.tlsearch.api.QueryException;
import com.tlsearch.api.SearchApi;
import com.tlsearch.api.SearchHit;
import com.tlsearch.build.BuildException;
import com.tlsearch.build.EmbeddingBuilder;
import com.tlsearch.cache.CacheStore;
import com.tlsearch.embed.EmbeddingService;
import com.tlsearch.embed.EmbeddingServices;
import com.tlsearch.index.SearchIndex;
import com.tlsearch.refresh.IndexRefresher;
import com.tlsearch.refresh.RefreshScheduler;
import com.tlsearch.runtime.AppConfig;
import com.tlsearch.runtime.ConfigurationException;
import com.tlsearch.runtime.Sleeper;
import com.tlsearch.server.SearchHttpServer;
import com.tlsearch.source.HttpSourceFetcher;
import com.tlsearch.source.SourceFetcher;
import com.tlsearch.source.TrainingResource;

import okhttp3.OkHttpClient;
import picocli.CommandLine;
import picocli.CommandLine.Command;
import picocli.CommandLine.Option;

@Command(
        name = "training-search",
        mixinStandardHelpOptions = true,
        version = "training-search 0.1.0",
        description = "Semantic search over the training resource library.")
public class Main implements Callable<Integer> {
    private static final Logger log = LoggerFactory.getLogger(Main.class);

    public static final int EXIT_OK = 0;
    public static final int EXIT_USAGE_ERROR = 2;
    public static final int EXIT_CONFIG_ERROR = 3;
    public static final int EXIT_BUILD_FAILURE = 4;
    public static final int EXIT_SEARCH_FAILURE = 5;

    @Option(names = { "-c", "--config" }, description = "Path to YAML config file", defaultValue = "src/main/resources/application.yml")
    String configPath;

    @Option(names = "--mode", description = "Execution mode: ${COMPLETION-CANDIDATES}", defaultValue = "serve")
    Mode mode;

    @Option(names = "--force", description = "Rebuild embeddings even when the cache is fresh (build mode)", defaultValue = "false")
    boolean force;

    @Option(names = "--resume", description = "Continue from the saved partial progress file (build mode)", defaultValue = "false")
    boolean resume;

    @Option(names = "--query", description = "Query text used in search mode")
    String query;

    @Option(names = "--top-k", description = "Top results to return in search mode (defaults to server.topK)")
    Integer topK;

    private final Map<String, String> environment;
    private final Clock clock;
    private final Sleeper sleeper;
    private final OkHttpClient httpClient = new OkHttpClient();

    enum Mode {
        serve,
        build,
        search
    }

    public Main() {
        this(System.getenv(), Clock.systemDefaultZone(), Sleeper.THREAD);
    }

    Main(Map<String, String> environment, Clock clock, Sleeper sleeper) {
        this.environment = environment;
        this.clock = clock;
        this.sleeper = sleeper;
    }

    public static void main(String[] args) {
        int exitCode = new CommandLine(new Main()).execute(args);
        System.exit(exitCode);
    }

    @Override
    public Integer call() throws Exception {
        AppConfig config = loadConfig(Path.of(configPath));
        String apiKey;
        try {
            config.validate();
            apiKey = config.resolveApiKey(environment);
        } catch (ConfigurationException e) {
            log.error("Configuration error: {}", e.getMessage());
            return EXIT_CONFIG_ERROR;
        }
        if (mode == Mode.search && (query == null || query.isBlank())) {
            log.error("--query is required in search mode");
            return EXIT_USAGE_ERROR;
        }
        if (topK != null && topK < 1) {
            log.error("--top-k must be >= 1, got {}", topK);
            return EXIT_USAGE_ERROR;
        }

        log.info("Starting training-search in {} mode", mode);
        log.info("Using config file: {}", configPath);
        log.info("Cache snapshot={} metadata={} freshnessHours={}",
                config.getCache().snapshotPath(),
                config.getCache().metadataPath(),
                config.getCache().getFreshnessHours());

        Components components = wire(config, apiKey);
        return switch (mode) {
            case serve -> serve(config, components);
            case build -> build(components);
            case search -> search(components);
        };
    }

    protected SourceFetcher createSourceFetcher(AppConfig config) {
        return new HttpSourceFetcher(httpClientWithTimeout(config.getSource().getTimeoutMs()), config.getSource().getUrl());
    }

    protected EmbeddingService createBuildEmbeddings(AppConfig config, String apiKey) {
        return EmbeddingServices.forBuilds(httpClientWithTimeout(config.getProvider().getTimeoutMs()), config.getProvider(), apiKey, sleeper);
    }

    protected EmbeddingService createQueryEmbeddings(AppConfig config, String apiKey) {
        return EmbeddingServices.forQueries(httpClientWithTimeout(config.getProvider().getTimeoutMs()), config.getProvider(), apiKey, sleeper);
    }

    Components wire(AppConfig config, String apiKey) {
        CacheStore cacheStore = CacheStore.fromConfig(config.getCache(), clock);
        SearchIndex searchIndex = new SearchIndex();
        EmbeddingBuilder builder = new EmbeddingBuilder(
                createSourceFetcher(config),
                createBuildEmbeddings(config, apiKey),
                cacheStore,
                config.getBuild(),
                config.getCache().getVersion(),
                sleeper);
        IndexRefresher refresher = new IndexRefresher(builder, cacheStore, searchIndex);
        int k = topK == null ? config.getServer().getTopK() : topK;
        SearchApi api = new SearchApi(searchIndex, createQueryEmbeddings(config, apiKey), refresher, cacheStore, clock, k);
        return new Components(cacheStore, searchIndex, refresher, api);
    }

    private int serve(AppConfig config, Components components) throws InterruptedException {
        try {
            components.refresher().loadInitial();
        } catch (BuildException e) {
            log.error("Failed to start server: {}", e.getMessage(), e);
            return EXIT_BUILD_FAILURE;
        }
        log.info("Loaded {} training resources", components.searchIndex().size());

        RefreshScheduler scheduler = new RefreshScheduler(components.refresher(), clock, config.getRefresh().zoneId());
        if (config.getRefresh().isEnabled()) {
            scheduler.start();
        }
        SearchHttpServer server = new SearchHttpServer(config.getServer(), components.api(), jsonMapper());
        Runtime.getRuntime().addShutdownHook(new Thread(() -> {
            scheduler.stop();
            server.close();
        }, "shutdown"));
        server.start();
        server.awaitClose();
        scheduler.stop();
        scheduler.awaitTermination(Duration.ofSeconds(5));
        return EXIT_OK;
    }

    private int build(Components components) {
        try {
            List<TrainingResource> resources = components.refresher().buildAndPublish("cli", force, resume);
            log.info("Embeddings ready: items={} snapshot={}", resources.size(), components.cacheStore().snapshotPath());
            return EXIT_OK;
        } catch (BuildException e) {
            if (e.completed() > 0) {
                log.error("Build failed: {}. Progress saved to {}; rerun with --resume to continue.",
                        e.getMessage(), components.cacheStore().partialPath());
            } else {
                log.error("Build failed: {}", e.getMessage());
            }
            return EXIT_BUILD_FAILURE;
        }
    }

    private int search(Components components) throws IOException {
        if (!components.cacheStore().snapshotExists()) {
            log.error("No cached embeddings at {}; run --mode build first", components.cacheStore().snapshotPath());
            return EXIT_SEARCH_FAILURE;
        }
        components.searchIndex().publish(components.cacheStore().load());
        try {
            List<SearchHit> hits = components.api().search(query);
            for (int i = 0; i < hits.size(); i++) {
                SearchHit hit = hits.get(i);
                log.info("Result #{} score={} title={} topic={}",
                        i + 1,
                        String.format("%.4f", hit.score()),
                        hit.title(),
                        hit.topic());
            }
            return EXIT_OK;
        } catch (QueryException e) {
            log.error("Search failed: {}", e.getMessage());
            return EXIT_SEARCH_FAILURE;
        }
    }

    private OkHttpClient httpClientWithTimeout(long timeoutMs) {
        return httpClient.newBuilder()
                .callTimeout(Duration.ofMillis(timeoutMs))
                .build();
    }

    static ObjectMapper jsonMapper() {
        return JsonMapper.builder()
                .findAndAddModules()
                .disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS)
                .build();
    }

    static AppConfig loadConfig(Path config) throws IOException {
        if (!Files.exists(config)) {
            return new AppConfig();
        }
        ObjectMapper mapper = new ObjectMapper(new YAMLFactory());
        return mapper.readValue(config.toFile(), AppConfig.class);
    }

    record Components(CacheStore cacheStore, SearchIndex searchIndex, IndexRefresher refresher, SearchApi api) {
    }
}
