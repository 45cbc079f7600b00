package eu.virtualparadox.ragservice.rag.index.lifecycle;

/**
 * Result of one poll or reload cycle.
 *
 * @param status     What the cycle did.
 * @param indexSize  Size of the generation being served after the cycle ({@code 0} if none).
 * @param generation Number of the generation being served after the cycle ({@code 0} if none).
 * @param message    Human readable detail, suitable for logs and API responses.
 */
public record CycleOutcome(Status status, int indexSize, long generation, String message) {

    public enum Status {
        /** A new generation was built and published. */
        PUBLISHED,
        /** The store had nothing usable; nothing was published. */
        NO_DATA,
        /** The store was unreachable or the build failed; nothing was published. */
        FAILED,
        /** A generation was built during shutdown and thrown away. */
        DISCARDED
    }

    public boolean published() {
        return status == Status.PUBLISHED;
    }
}
