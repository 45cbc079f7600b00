package eu.virtualparadox.ragservice.rag.embed;

/**
 * Computes dense vector embeddings for query text.
 * <p>
 * The vectors must come from the same model the producer used for the stored records.
 */
public interface EmbeddingService {

    /**
     * Embeds a single query string into dense vector space.
     * <p>
     * Used at query time for semantic search. Not retried here; retry policy belongs to the caller.
     *
     * @param text the query string (non-null, non-blank)
     * @return a unit-length dense vector representation of the query
     * @throws EmbeddingServiceException if the embedding backend fails or answers with something unusable
     */
    float[] embedQuery(String text);
}
