package eu.virtualparadox.ragservice.rag.index;

/**
 * Building a generation failed for a reason other than missing input.
 * The previously published generation stays authoritative.
 */
public class IndexBuildException extends RuntimeException {

    public IndexBuildException(final String message, final Throwable cause) {
        super(message, cause);
    }
}
