package com.tlsearch.source;

import java.io.IOException;
import java.util.List;

import com.fasterxml.jackson.core.type.TypeReference;
import com.fasterxml.jackson.databind.ObjectMapper;

import okhttp3.OkHttpClient;
import okhttp3.Request;
import okhttp3.Response;
import okhttp3.ResponseBody;

public class HttpSourceFetcher implements SourceFetcher {
    private final OkHttpClient httpClient;
    private final ObjectMapper mapper;
    private final String url;

    public HttpSourceFetcher(OkHttpClient httpClient, String url) {
        this.httpClient = httpClient;
        this.mapper = new ObjectMapper();
        this.url = url;
    }

    @Override
    public List<TrainingResource> fetchAll() throws SourceFetchException {
        Request request = new Request.Builder().url(url).get().build();
        try (Response response = httpClient.newCall(request).execute()) {
            if (!response.isSuccessful()) {
                throw new SourceFetchException("Failed to fetch training data: %d %s".formatted(response.code(), response.message()));
            }
            ResponseBody body = response.body();
            if (body == null) {
                throw new SourceFetchException("Failed to fetch training data: empty body");
            }
            List<TrainingResource> items = mapper.readValue(body.string(), new TypeReference<List<TrainingResource>>() {
            });
            return items == null ? List.of() : items;
        } catch (SourceFetchException e) {
            throw e;
        } catch (IOException e) {
            throw new SourceFetchException("Failed to fetch training data from " + url + ": " + e.getMessage(), e);
        }
    }
}
