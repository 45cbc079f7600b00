package eu.virtualparadox.ragservice.query;

public class QueryTimeoutException extends RuntimeException {

    public QueryTimeoutException(final String message) {
        super(message);
    }
}
