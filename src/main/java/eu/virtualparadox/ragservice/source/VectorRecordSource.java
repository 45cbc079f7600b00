package eu.virtualparadox.ragservice.source;

import eu.virtualparadox.ragservice.source.model.EmbeddingRecord;

import java.util.List;

/**
 * Read side of the store shared with the embedding producer.
 * <p>
 * The producer writes rows independently; this service never calls it. Implementations
 * must be safe to call repeatedly from the poll loop and must not cache results.
 */
public interface VectorRecordSource {

    /**
     * Cheap existence check used before a full read.
     *
     * @return number of rows currently visible, {@code 0} when the producer has not written yet
     * @throws SourceUnavailableException if the store cannot be reached or the table does not exist yet
     */
    long countAvailable();

    /**
     * Reads a full snapshot, one record per id.
     * <p>
     * Rows with malformed vectors are skipped and logged; they never fail the batch.
     * When the store holds several rows for the same id, only the most recent one is returned.
     *
     * @return records in ascending id order, never null
     * @throws SourceUnavailableException if the store cannot be reached
     */
    List<EmbeddingRecord> fetchAll();
}
