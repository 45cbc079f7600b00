package eu.virtualparadox.ragservice.rag.index;

/**
 * A generation was offered to an {@link IndexState} that has already been shut down.
 */
public class IndexStateClosedException extends IllegalStateException {

    public IndexStateClosedException(final String message) {
        super(message);
    }
}
