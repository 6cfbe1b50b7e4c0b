package com.tlsearch.runtime;

import java.nio.file.Path;
import java.time.DateTimeException;
import java.time.ZoneId;
import java.util.Map;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;

@JsonIgnoreProperties(ignoreUnknown = true)
public class AppConfig {
    private ProviderConfig provider = new ProviderConfig();
    private SourceConfig source = new SourceConfig();
    private CacheConfig cache = new CacheConfig();
    private BuildConfig build = new BuildConfig();
    private ServerConfig server = new ServerConfig();
    private RefreshConfig refresh = new RefreshConfig();

    public ProviderConfig getProvider() {
        return provider;
    }

    public void setProvider(ProviderConfig provider) {
        this.provider = provider == null ? new ProviderConfig() : provider;
    }

    public SourceConfig getSource() {
        return source;
    }

    public void setSource(SourceConfig source) {
        this.source = source == null ? new SourceConfig() : source;
    }

    public CacheConfig getCache() {
        return cache;
    }

    public void setCache(CacheConfig cache) {
        this.cache = cache == null ? new CacheConfig() : cache;
    }

    public BuildConfig getBuild() {
        return build;
    }

    public void setBuild(BuildConfig build) {
        this.build = build == null ? new BuildConfig() : build;
    }

    public ServerConfig getServer() {
        return server;
    }

    public void setServer(ServerConfig server) {
        this.server = server == null ? new ServerConfig() : server;
    }

    public RefreshConfig getRefresh() {
        return refresh;
    }

    public void setRefresh(RefreshConfig refresh) {
        this.refresh = refresh == null ? new RefreshConfig() : refresh;
    }

    /**
     * Rejects settings that would break the build loop or the retry policy.
     */
    public void validate() {
        if (provider.getMaxAttempts() < 1 || provider.getQueryMaxAttempts() < 1) {
            throw new ConfigurationException("provider attempts must be >= 1");
        }
        if (provider.getBaseDelayMs() < 0 || provider.getMaxDelayMs() < 0) {
            throw new ConfigurationException("provider retry delays must be >= 0");
        }
        if (build.getCheckpointInterval() < 1) {
            throw new ConfigurationException("build.checkpointInterval must be >= 1");
        }
        if (build.getBaseDelayMs() < 0 || build.getErrorDelayStepMs() < 0 || build.getMaxErrorDelayMs() < 0) {
            throw new ConfigurationException("build delays must be >= 0");
        }
        if (cache.getFreshnessHours() <= 0) {
            throw new ConfigurationException("cache.freshnessHours must be > 0");
        }
        if (server.getTopK() < 1) {
            throw new ConfigurationException("server.topK must be >= 1");
        }
        try {
            refresh.zoneId();
        } catch (DateTimeException e) {
            throw new ConfigurationException("refresh.zone is not a valid zone id: " + refresh.getZone());
        }
    }

    /**
     * Looks up the provider credential in the given environment.
     *
     * @throws ConfigurationException when the variable is unset or blank
     */
    public String resolveApiKey(Map<String, String> environment) {
        String apiKey = environment.get(provider.getApiKeyEnv());
        if (apiKey == null || apiKey.isBlank()) {
            throw new ConfigurationException(provider.getApiKeyEnv() + " environment variable is required");
        }
        return apiKey;
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ProviderConfig {
        private String endpoint = "https://api.openai.com/v1/embeddings";
        private String model = "text-embedding-3-small";
        private String apiKeyEnv = "OPENAI_API_KEY";
        private int maxAttempts = 5;
        private long baseDelayMs = 1000;
        private long maxDelayMs = 30000;
        private int queryMaxAttempts = 1;
        private long timeoutMs = 30000;

        public String getEndpoint() {
            return endpoint;
        }

        public void setEndpoint(String endpoint) {
            this.endpoint = endpoint;
        }

        public String getModel() {
            return model;
        }

        public void setModel(String model) {
            this.model = model;
        }

        public String getApiKeyEnv() {
            return apiKeyEnv;
        }

        public void setApiKeyEnv(String apiKeyEnv) {
            this.apiKeyEnv = apiKeyEnv;
        }

        public int getMaxAttempts() {
            return maxAttempts;
        }

        public void setMaxAttempts(int maxAttempts) {
            this.maxAttempts = maxAttempts;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getMaxDelayMs() {
            return maxDelayMs;
        }

        public void setMaxDelayMs(long maxDelayMs) {
            this.maxDelayMs = maxDelayMs;
        }

        public int getQueryMaxAttempts() {
            return queryMaxAttempts;
        }

        public void setQueryMaxAttempts(int queryMaxAttempts) {
            this.queryMaxAttempts = queryMaxAttempts;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class SourceConfig {
        private String url = "https://teamavalonpontoons.com/api/traininglibrary.php";
        private long timeoutMs = 30000;

        public String getUrl() {
            return url;
        }

        public void setUrl(String url) {
            this.url = url;
        }

        public long getTimeoutMs() {
            return timeoutMs;
        }

        public void setTimeoutMs(long timeoutMs) {
            this.timeoutMs = timeoutMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class CacheConfig {
        private String directory = ".";
        private String snapshotFile = "embedded-resources.json";
        private String metadataFile = "cache-metadata.json";
        private String partialSuffix = ".partial";
        private long freshnessHours = 24;
        private String version = "1.0";

        public String getDirectory() {
            return directory;
        }

        public void setDirectory(String directory) {
            this.directory = directory;
        }

        public String getSnapshotFile() {
            return snapshotFile;
        }

        public void setSnapshotFile(String snapshotFile) {
            this.snapshotFile = snapshotFile;
        }

        public String getMetadataFile() {
            return metadataFile;
        }

        public void setMetadataFile(String metadataFile) {
            this.metadataFile = metadataFile;
        }

        public String getPartialSuffix() {
            return partialSuffix;
        }

        public void setPartialSuffix(String partialSuffix) {
            this.partialSuffix = partialSuffix;
        }

        public long getFreshnessHours() {
            return freshnessHours;
        }

        public void setFreshnessHours(long freshnessHours) {
            this.freshnessHours = freshnessHours;
        }

        public String getVersion() {
            return version;
        }

        public void setVersion(String version) {
            this.version = version;
        }

        public Path snapshotPath() {
            return Path.of(directory).resolve(snapshotFile);
        }

        public Path metadataPath() {
            return Path.of(directory).resolve(metadataFile);
        }

        public Path partialPath() {
            return Path.of(directory).resolve(snapshotFile + partialSuffix);
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class BuildConfig {
        private int checkpointInterval = 25;
        private long baseDelayMs = 200;
        private long errorDelayStepMs = 500;
        private long maxErrorDelayMs = 5000;

        public int getCheckpointInterval() {
            return checkpointInterval;
        }

        public void setCheckpointInterval(int checkpointInterval) {
            this.checkpointInterval = checkpointInterval;
        }

        public long getBaseDelayMs() {
            return baseDelayMs;
        }

        public void setBaseDelayMs(long baseDelayMs) {
            this.baseDelayMs = baseDelayMs;
        }

        public long getErrorDelayStepMs() {
            return errorDelayStepMs;
        }

        public void setErrorDelayStepMs(long errorDelayStepMs) {
            this.errorDelayStepMs = errorDelayStepMs;
        }

        public long getMaxErrorDelayMs() {
            return maxErrorDelayMs;
        }

        public void setMaxErrorDelayMs(long maxErrorDelayMs) {
            this.maxErrorDelayMs = maxErrorDelayMs;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class ServerConfig {
        private int port = 3001;
        private int topK = 6;
        private int bossThreads = 1;
        private int workerThreads = 4;
        private int maxContentLength = 65536;

        public int getPort() {
            return port;
        }

        public void setPort(int port) {
            this.port = port;
        }

        public int getTopK() {
            return topK;
        }

        public void setTopK(int topK) {
            this.topK = topK;
        }

        public int getBossThreads() {
            return bossThreads;
        }

        public void setBossThreads(int bossThreads) {
            this.bossThreads = bossThreads;
        }

        public int getWorkerThreads() {
            return workerThreads;
        }

        public void setWorkerThreads(int workerThreads) {
            this.workerThreads = workerThreads;
        }

        public int getMaxContentLength() {
            return maxContentLength;
        }

        public void setMaxContentLength(int maxContentLength) {
            this.maxContentLength = maxContentLength;
        }
    }

    @JsonIgnoreProperties(ignoreUnknown = true)
    public static class RefreshConfig {
        private boolean enabled = true;
        private String zone = "";

        public boolean isEnabled() {
            return enabled;
        }

        public void setEnabled(boolean enabled) {
            this.enabled = enabled;
        }

        public String getZone() {
            return zone;
        }

        public void setZone(String zone) {
            this.zone = zone;
        }

        public ZoneId zoneId() {
            if (zone == null || zone.isBlank()) {
                return ZoneId.systemDefault();
            }
            return ZoneId.of(zone);
        }
    }
}
