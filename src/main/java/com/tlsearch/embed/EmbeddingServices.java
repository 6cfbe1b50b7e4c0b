package com.tlsearch.embed;

import com.tlsearch.runtime.AppConfig;
import com.tlsearch.runtime.Sleeper;

import okhttp3.OkHttpClient;

public final class EmbeddingServices {
    private EmbeddingServices() {
    }

    /**
     * Client used while building the index: retries with the configured backoff.
     */
    public static EmbeddingService forBuilds(OkHttpClient httpClient, AppConfig.ProviderConfig provider, String apiKey, Sleeper sleeper) {
        BackoffPolicy policy = BackoffPolicy.forProvider(
                provider.getMaxAttempts(),
                provider.getBaseDelayMs(),
                provider.getMaxDelayMs(),
                sleeper);
        return new OpenAiEmbeddingService(httpClient, provider.getEndpoint(), provider.getModel(), apiKey, policy);
    }

    /**
     * Client used on the query path, where a caller is waiting on the answer.
     */
    public static EmbeddingService forQueries(OkHttpClient httpClient, AppConfig.ProviderConfig provider, String apiKey, Sleeper sleeper) {
        BackoffPolicy policy = BackoffPolicy.forProvider(
                provider.getQueryMaxAttempts(),
                provider.getBaseDelayMs(),
                provider.getMaxDelayMs(),
                sleeper);
        return new OpenAiEmbeddingService(httpClient, provider.getEndpoint(), provider.getModel(), apiKey, policy);
    }
}
