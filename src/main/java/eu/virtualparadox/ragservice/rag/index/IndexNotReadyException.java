package eu.virtualparadox.ragservice.rag.index;

/**
 * No generation has been published yet. Callers report "service unavailable", not a query error.
 */
public class IndexNotReadyException extends RuntimeException {

    public IndexNotReadyException(final String message) {
        super(message);
    }
}
