package eu.virtualparadox.ragservice.rag.index;

/**
 * Nothing to build from. The caller must not publish anything.
 */
public class EmptyInputException extends RuntimeException {

    public EmptyInputException(final String message) {
        super(message);
    }
}
