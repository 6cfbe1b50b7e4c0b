package com.tlsearch.embed;

public interface EmbeddingService {
    float[] embed(String text) throws VectorProviderException;

    default String version() {
        return "unversioned";
    }
}
