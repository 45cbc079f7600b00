package eu.virtualparadox.ragservice.source.model;

import com.fasterxml.jackson.databind.JsonNode;

import java.time.Instant;
import java.util.Arrays;
import java.util.Objects;

/**
 * One embedding row written by the producer.
 * <p>
 * The vector is copied on construction and compared by content. {@link #vector()} returns the record's own
 * array so the index builder can read it without copying; callers must treat it as read-only.
 *
 * @param id        Unique identifier of the logical item (the error id).
 * @param vector    Embedding, exactly {@code dimension} values long.
 * @param title     Human readable title.
 * @param metadata  Schema-free metadata tree, never null (empty object when absent).
 * @param modelName Name of the embedding model that produced {@code vector}.
 * @param dimension Dimension declared by the producer.
 * @param writtenAt Write timestamp when the store exposes one, otherwise null.
 */
public record EmbeddingRecord(String id,
                              float[] vector,
                              String title,
                              JsonNode metadata,
                              String modelName,
                              int dimension,
                              Instant writtenAt) {

    public EmbeddingRecord {
        vector = vector == null ? null : vector.clone();
    }

    @Override
    public boolean equals(final Object o) {
        if (this == o) {
            return true;
        }
        if (!(o instanceof EmbeddingRecord other)) {
            return false;
        }
        return dimension == other.dimension
                && Objects.equals(id, other.id)
                && Arrays.equals(vector, other.vector)
                && Objects.equals(title, other.title)
                && Objects.equals(metadata, other.metadata)
                && Objects.equals(modelName, other.modelName)
                && Objects.equals(writtenAt, other.writtenAt);
    }

    @Override
    public int hashCode() {
        return 31 * Objects.hash(id, title, metadata, modelName, dimension, writtenAt) + Arrays.hashCode(vector);
    }

    @Override
    public String toString() {
        return "EmbeddingRecord[id=" + id + ", dimension=" + dimension + ", modelName=" + modelName
                + ", title=" + title + ", writtenAt=" + writtenAt + "]";
    }
}
