package eu.virtualparadox.ragservice.source;

import lombok.Getter;

/**
 * A single row carries a vector that cannot be used. The row is skipped, the batch continues.
 */
@Getter
public class MalformedVectorException extends RuntimeException {

    private final String recordId;

    public MalformedVectorException(final String recordId, final String message) {
        super("Malformed vector for " + recordId + ": " + message);
        this.recordId = recordId;
    }

    public MalformedVectorException(final String recordId, final String message, final Throwable cause) {
        super("Malformed vector for " + recordId + ": " + message, cause);
        this.recordId = recordId;
    }
}
