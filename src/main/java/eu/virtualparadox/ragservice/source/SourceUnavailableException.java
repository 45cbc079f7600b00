package eu.virtualparadox.ragservice.source;

/**
 * The shared store could not be read. Transient: the next poll tick simply tries again.
 */
public class SourceUnavailableException extends RuntimeException {

    public SourceUnavailableException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
