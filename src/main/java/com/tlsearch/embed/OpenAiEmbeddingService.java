package com.tlsearch.embed;

import java.io.IOException;
import java.util.LinkedHashMap;
import java.util.Map;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.MediaType;
import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.RequestBody;
import okhttp3.Response;
import okhttp3.ResponseBody;

/**
 * Calls an OpenAI-compatible {@code /v1/embeddings} endpoint, one input per request.
 */
public class OpenAiEmbeddingService implements EmbeddingService {
    private static final MediaType JSON = MediaType.parse("application/json");
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String endpoint;
    private final String model;
    private final String apiKey;
    private final BackoffPolicy backoffPolicy;

    public OpenAiEmbeddingService(OkHttpClient httpClient,
            String endpoint,
            String model,
            String apiKey,
            BackoffPolicy backoffPolicy) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.endpoint = endpoint;
        this.model = model;
        this.apiKey = apiKey;
        this.backoffPolicy = backoffPolicy;
    }

    @Override
    public float[] embed(String text) throws VectorProviderException {
        try {
            return backoffPolicy.execute("provider.embed", attempt -> requestEmbedding(text));
        } catch (VectorProviderException e) {
            throw e;
        } catch (IOException e) {
            throw VectorProviderException.transport(e);
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            throw new VectorProviderException("Interrupted while waiting to retry the embedding provider",
                    VectorProviderException.NO_STATUS, "", false, e);
        }
    }

    @Override
    public String version() {
        return "openai-" + model;
    }

    private float[] requestEmbedding(String text) throws IOException {
        Map<String, Object> body = new LinkedHashMap<>();
        body.put("model", model);
        body.put("input", text);
        Request request = new Request.Builder()
                .url(endpoint)
                .header("Authorization", "Bearer " + apiKey)
                .post(RequestBody.create(mapper.writeValueAsString(body), JSON))
                .build();
        try (Response response = httpClient.newCall(request).execute()) {
            ResponseBody responseBody = response.body();
            String payload = responseBody == null ? "" : responseBody.string();
            if (!response.isSuccessful()) {
                throw VectorProviderException.httpError(response.code(), response.message(), payload);
            }
            return parseVector(payload);
        }
    }

    private float[] parseVector(String payload) throws VectorProviderException {
        JsonNode vectorNode;
        try {
            vectorNode = mapper.readTree(payload).path("data").path(0).path("embedding");
        } catch (IOException e) {
            throw VectorProviderException.malformed(e.getMessage());
        }
        if (!vectorNode.isArray() || vectorNode.isEmpty()) {
            throw VectorProviderException.malformed("missing data[0].embedding");
        }
        float[] out = new float[vectorNode.size()];
        for (int i = 0; i < vectorNode.size(); i++) {
            out[i] = (float) vectorNode.get(i).asDouble();
        }
        return out;
    }
}
