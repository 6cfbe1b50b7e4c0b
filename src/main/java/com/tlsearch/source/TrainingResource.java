package com.tlsearch.source;

import java.util.Arrays;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonIgnoreProperties;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * One training library item. {@code embedding} is null until the item has been embedded.
 * <p>
 * The vector is copied on the way in and on the way out; equality compares its contents.
 */
@JsonIgnoreProperties(ignoreUnknown = true)
@JsonInclude(JsonInclude.Include.NON_NULL)
public record TrainingResource(
        @JsonProperty("Title") String title,
        @JsonProperty("Topic") String topic,
        @JsonProperty("Description") String description,
        @JsonProperty("embedding") float[] embedding) {

    public TrainingResource {
        embedding = embedding == null ? null : embedding.clone();
    }

    public static TrainingResource of(String title, String topic, String description) {
        return new TrainingResource(title, topic, description, null);
    }

    @Override
    public float[] embedding() {
        return embedding == null ? null : embedding.clone();
    }

    /**
     * Text sent to the embedding provider for this item.
     */
    public String combinedText() {
        return "%s %s %s".formatted(orEmpty(title), orEmpty(topic), orEmpty(description));
    }

    public TrainingResource withEmbedding(float[] vector) {
        return new TrainingResource(title, topic, description, vector);
    }

    public boolean hasEmbedding() {
        return embedding != null && embedding.length > 0;
    }

    @Override
    public boolean equals(Object other) {
        if (this == other) {
            return true;
        }
        if (!(other instanceof TrainingResource that)) {
            return false;
        }
        return Objects.equals(title, that.title)
                && Objects.equals(topic, that.topic)
                && Objects.equals(description, that.description)
                && Arrays.equals(embedding, that.embedding);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(title, topic, description) + Arrays.hashCode(embedding);
    }

    @Override
    public String toString() {
        return "TrainingResource[title=%s, topic=%s, description=%s, dimensions=%d]"
                .formatted(title, topic, description, embedding == null ? 0 : embedding.length);
    }

    private static String orEmpty(String value) {
        return value == null ? "" : value;
    }
}
