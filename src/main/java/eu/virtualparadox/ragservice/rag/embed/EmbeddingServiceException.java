package eu.virtualparadox.ragservice.rag.embed;

/**
 * The embedding backend failed. Retryable from the caller's point of view.
 */
public class EmbeddingServiceException extends RuntimeException {

    public EmbeddingServiceException(final String message) {
        super(message);
    }

    public EmbeddingServiceException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
