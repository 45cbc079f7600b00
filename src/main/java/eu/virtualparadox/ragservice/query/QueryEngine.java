package eu.virtualparadox.ragservice.query;

import eu.virtualparadox.ragservice.application.config.ApplicationConfig;
import eu.virtualparadox.ragservice.application.executor.QueryExecutor;
import eu.virtualparadox.ragservice.rag.embed.EmbeddingService;
import eu.virtualparadox.ragservice.rag.embed.EmbeddingServiceException;
import eu.virtualparadox.ragservice.rag.index.IndexGeneration;
import eu.virtualparadox.ragservice.rag.index.IndexState;
import eu.virtualparadox.ragservice.rag.index.model.SearchHit;
import eu.virtualparadox.ragservice.query.model.ScoredResult;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Duration;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.TimeoutException;
import java.util.concurrent.atomic.AtomicBoolean;

/**
 * Answers nearest-neighbour queries against whatever generation is published when the query starts.
 * <p>
 * Steps:
 * <ol>
 *   <li>Take a reference on the current generation ({@link IndexState#acquire()}), or fail with "not ready"</li>
 *   <li>Embed the query text with {@link EmbeddingService}</li>
 *   <li>Fetch {@code topK} candidates from the generation's similarity index</li>
 *   <li>Drop candidates below the threshold, sort by similarity (ties by slot), keep {@code topN}</li>
 *   <li>Map slots to records through the same generation's entry map</li>
 * </ol>
 * Steps 2-5 run on the {@link QueryExecutor} so the caller can bound them with a timeout. The generation
 * reference is given back by whichever side finishes last, so a timed-out query never closes an index that
 * is still being searched.
 */
@Service
@Slf4j
public class QueryEngine {

    private static final Comparator<SearchHit> BY_SIMILARITY_THEN_SLOT =
            Comparator.comparing(SearchHit::similarity, Comparator.reverseOrder())
                    .thenComparingInt(SearchHit::slot);

    private final IndexState indexState;
    private final EmbeddingService embeddingService;
    private final QueryExecutor queryExecutor;
    private final Duration defaultTimeout;

    public QueryEngine(final IndexState indexState,
                       final EmbeddingService embeddingService,
                       final QueryExecutor queryExecutor,
                       final ApplicationConfig config) {
        this.indexState = indexState;
        this.embeddingService = embeddingService;
        this.queryExecutor = queryExecutor;
        this.defaultTimeout = config.getQuery().getTimeout();
    }

    public List<ScoredResult> query(final String text,
                                    final int topK,
                                    final int topN,
                                    final float similarityThreshold) {
        return query(text, topK, topN, similarityThreshold, defaultTimeout);
    }

    /**
     * @param text                query text, not blank
     * @param topK                candidates fetched from the index, at least 1
     * @param topN                results returned, between 1 and {@code topK}
     * @param similarityThreshold minimum similarity; anything above 1 simply yields no results
     * @param timeout             upper bound for embedding plus search
     * @return results by descending similarity, possibly empty
     * @throws IllegalArgumentException                                      on invalid parameters
     * @throws eu.virtualparadox.ragservice.rag.index.IndexNotReadyException if no index is published yet
     * @throws EmbeddingServiceException                                     if the query cannot be embedded
     * @throws QueryTimeoutException                                         if {@code timeout} expires first
     */
    public List<ScoredResult> query(final String text,
                                    final int topK,
                                    final int topN,
                                    final float similarityThreshold,
                                    final Duration timeout) {
        validate(text, topK, topN, similarityThreshold);

        final IndexGeneration generation = indexState.acquire();
        final AtomicBoolean claimed = new AtomicBoolean();

        final Future<List<ScoredResult>> future;
        try {
            future = queryExecutor.submit(() -> {
                if (!claimed.compareAndSet(false, true)) {
                    return List.of(); // caller already gave up and released the generation
                }
                try {
                    return search(generation, text, topK, topN, similarityThreshold);
                } finally {
                    indexState.release(generation);
                }
            });
        } catch (RuntimeException e) {
            indexState.release(generation);
            throw e;
        }

        try {
            return future.get(timeout.toMillis(), TimeUnit.MILLISECONDS);
        } catch (TimeoutException e) {
            abandon(future, claimed, generation);
            throw new QueryTimeoutException("Query did not complete within " + timeout.toMillis() + " ms");
        } catch (InterruptedException e) {
            Thread.currentThread().interrupt();
            abandon(future, claimed, generation);
            throw new QueryTimeoutException("Interrupted while waiting for the query to complete");
        } catch (ExecutionException e) {
            final Throwable cause = e.getCause();
            if (cause instanceof RuntimeException runtime) {
                throw runtime;
            }
            throw new IllegalStateException("Similarity search failed", cause);
        }
    }

    private List<ScoredResult> search(final IndexGeneration generation,
                                      final String text,
                                      final int topK,
                                      final int topN,
                                      final float similarityThreshold) throws IOException {
        final float[] vector = embeddingService.embedQuery(text);
        final int dimension = generation.getIndex().dimension();
        if (vector.length != dimension) {
            throw new EmbeddingServiceException("Query embedding has " + vector.length
                    + " dimensions but index generation " + generation.getNumber() + " has " + dimension);
        }

        final List<SearchHit> candidates = generation.getIndex().search(vector, topK);

        final List<ScoredResult> results = candidates.stream()
                .filter(hit -> hit.similarity() >= similarityThreshold)
                .sorted(BY_SIMILARITY_THEN_SLOT)
                .limit(topN)
                .map(hit -> new ScoredResult(hit.slot(), hit.similarity(), generation.getEntries().record(hit.slot())))
                .toList();

        log.debug("Query against generation {}: {} candidates, {} above {}, returning {}",
                generation.getNumber(), candidates.size(),
                candidates.stream().filter(hit -> hit.similarity() >= similarityThreshold).count(),
                similarityThreshold, results.size());
        return results;
    }

    private void abandon(final Future<?> future, final AtomicBoolean claimed, final IndexGeneration generation) {
        future.cancel(true);
        if (claimed.compareAndSet(false, true)) {
            // the task never started and never will touch the generation
            indexState.release(generation);
        }
    }

    private void validate(final String text, final int topK, final int topN, final float similarityThreshold) {
        if (StringUtils.isBlank(text)) {
            throw new IllegalArgumentException("query must not be blank");
        }
        if (topK < 1 || topN < 1) {
            throw new IllegalArgumentException("top_k and top_n must be positive");
        }
        if (topN > topK) {
            throw new IllegalArgumentException("top_n (" + topN + ") must not exceed top_k (" + topK + ")");
        }
        if (Float.isNaN(similarityThreshold)) {
            throw new IllegalArgumentException("similarity_threshold must be a number");
        }
    }
}
