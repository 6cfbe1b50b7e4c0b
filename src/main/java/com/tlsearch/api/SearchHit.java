package com.tlsearch.api;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.tlsearch.index.SearchResult;

public record SearchHit(
        @JsonProperty("Title") String title,
        @JsonProperty("Topic") String topic,
        @JsonProperty("Description") String description,
        @JsonProperty("score") double score) {

    public static SearchHit from(SearchResult result) {
        return new SearchHit(
                result.resource().title(),
                result.resource().topic(),
                result.resource().description(),
                result.score());
    }
}
