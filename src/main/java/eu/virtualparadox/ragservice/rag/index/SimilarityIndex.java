package eu.virtualparadox.ragservice.rag.index;

import eu.virtualparadox.ragservice.rag.index.model.SearchHit;

import java.io.Closeable;
import java.io.IOException;
import java.util.List;

/**
 * Immutable nearest-neighbour structure over a fixed batch of vectors.
 * <p>
 * An instance never changes after construction; new data always produces a new instance.
 * Searches may run concurrently. {@link #close()} must only be called once no search is running,
 * which {@link IndexGeneration} guarantees through reference counting.
 */
public interface SimilarityIndex extends Closeable {

    /**
     * @return number of indexed vectors
     */
    int size();

    /**
     * @return dimension every indexed vector (and every query) has
     */
    int dimension();

    /**
     * Finds the {@code k} most similar vectors.
     *
     * @param query unit-length query vector of {@link #dimension()} values
     * @param k     number of candidates, at least 1
     * @return hits ordered by descending similarity, ties by ascending slot; at most {@code k} entries
     * @throws IOException if the underlying index cannot be read
     */
    List<SearchHit> search(float[] query, int k) throws IOException;
}
