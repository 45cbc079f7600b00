package eu.virtualparadox.ragservice.query;

import eu.virtualparadox.ragservice.application.config.ApplicationConfig;
import eu.virtualparadox.ragservice.application.executor.QueryExecutor;
import eu.virtualparadox.ragservice.query.model.ScoredResult;
import eu.virtualparadox.ragservice.rag.embed.EmbeddingService;
import eu.virtualparadox.ragservice.rag.embed.EmbeddingServiceException;
import eu.virtualparadox.ragservice.rag.index.IndexBuilder;
import eu.virtualparadox.ragservice.rag.index.IndexGeneration;
import eu.virtualparadox.ragservice.rag.index.IndexNotReadyException;
import eu.virtualparadox.ragservice.rag.index.IndexState;
import eu.virtualparadox.ragservice.source.model.EmbeddingRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CountDownLatch;
import java.util.concurrent.TimeUnit;

import static eu.virtualparadox.ragservice.RecordFixtures.atCosine;
import static eu.virtualparadox.ragservice.RecordFixtures.axis;
import static eu.virtualparadox.ragservice.RecordFixtures.record;
import static org.assertj.core.api.Assertions.assertThat;
import static org.junit.jupiter.api.Assertions.*;

class QueryEngineTest {

    private static final int DIM = 4;

    private final ApplicationConfig config = new ApplicationConfig();
    private final IndexState state = new IndexState();
    private final QueryExecutor executor = new QueryExecutor();

    private volatile EmbeddingService embeddingService = text -> axis(0, DIM);
    private QueryEngine engine;

    @BeforeEach
    void setUp() {
        executor.setCorePoolSize(2);
        executor.setMaxPoolSize(2);
        executor.initialize();
        engine = new QueryEngine(state, text -> embeddingService.embedQuery(text), executor, config);
    }

    @AfterEach
    void tearDown() {
        executor.shutdown();
        state.close();
    }

    private IndexGeneration publishCosines(final double... cosines) {
        final IndexBuilder builder = new IndexBuilder(config, Clock.systemUTC());
        final List<EmbeddingRecord> records = new ArrayList<>();
        for (int i = 0; i < cosines.length; i++) {
            records.add(record("E" + i, atCosine(cosines[i], DIM)));
        }
        final IndexGeneration generation = builder.build(records).generation();
        state.publish(generation);
        return generation;
    }

    @Test
    @DisplayName("Only candidates above the threshold are returned, best first")
    void thresholdLimitsResults() {
        publishCosines(0.1, 0.7, 0.3, 0.9, 0.5);

        final List<ScoredResult> results = engine.query("disk full", 10, 3, 0.6f);

        assertEquals(2, results.size());
        assertEquals("E3", results.get(0).record().id());
        assertEquals("E1", results.get(1).record().id());
        assertEquals(0.9f, results.get(0).similarity(), 1e-4);
        assertEquals(0.7f, results.get(1).similarity(), 1e-4);
    }

    @Test
    @DisplayName("top_n caps the number of results")
    void topNCapsResults() {
        publishCosines(0.95, 0.9, 0.85, 0.8, 0.75);

        final List<ScoredResult> results = engine.query("q", 10, 3, 0.0f);

        assertThat(results.stream().map(r -> r.record().id()).toList())
                .containsExactly("E0", "E1", "E2");
        assertThat(results.stream().map(ScoredResult::similarity).toList())
                .isSortedAccordingTo(Comparator.reverseOrder());
    }

    @Test
    @DisplayName("A threshold above 1 yields no results rather than an error")
    void thresholdAboveOne() {
        publishCosines(1.0, 0.9);
        assertTrue(engine.query("q", 10, 3, 1.1f).isEmpty());
    }

    @Test
    @DisplayName("Queries before the first publish are rejected as not ready")
    void notReady() {
        assertThrows(IndexNotReadyException.class, () -> engine.query("q", 10, 3, 0.6f));
    }

    @Test
    @DisplayName("Invalid parameters are rejected before touching the index")
    void invalidParameters() {
        assertThrows(IllegalArgumentException.class, () -> engine.query(" ", 10, 3, 0.6f));
        assertThrows(IllegalArgumentException.class, () -> engine.query("q", 0, 1, 0.6f));
        assertThrows(IllegalArgumentException.class, () -> engine.query("q", 2, 3, 0.6f));
        assertThrows(IllegalArgumentException.class, () -> engine.query("q", 10, 3, Float.NaN));
    }

    @Test
    @DisplayName("Embedding failures reach the caller and release the generation")
    void embeddingFailure() {
        final IndexGeneration generation = publishCosines(0.9);
        embeddingService = text -> {
            throw new EmbeddingServiceException("connection refused");
        };

        assertThrows(EmbeddingServiceException.class, () -> engine.query("q", 10, 3, 0.6f));
        assertEquals(1, generation.getRefCount());
    }

    @Test
    @DisplayName("A query vector of the wrong dimension is an embedding failure")
    void dimensionMismatch() {
        publishCosines(0.9);
        embeddingService = text -> axis(0, DIM + 1);

        assertThrows(EmbeddingServiceException.class, () -> engine.query("q", 10, 3, 0.6f));
    }

    @Test
    @DisplayName("A slow embedding call times out; the generation is released once the call returns")
    void timeout() throws InterruptedException {
        final IndexGeneration generation = publishCosines(0.9);
        final CountDownLatch release = new CountDownLatch(1);
        embeddingService = text -> {
            try {
                release.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return axis(0, DIM);
        };

        assertThrows(QueryTimeoutException.class,
                () -> engine.query("q", 10, 3, 0.6f, Duration.ofMillis(100)));

        release.countDown();
        final long deadline = System.currentTimeMillis() + 5_000;
        while (generation.getRefCount() != 1 && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }
        assertEquals(1, generation.getRefCount());
    }

    @Test
    @DisplayName("A query started before a republish completes against the old generation")
    void inFlightQueryUsesOldGeneration() throws Exception {
        final IndexGeneration old = publishCosines(0.9);
        final CountDownLatch entered = new CountDownLatch(1);
        final CountDownLatch proceed = new CountDownLatch(1);
        embeddingService = text -> {
            entered.countDown();
            try {
                proceed.await(5, TimeUnit.SECONDS);
            } catch (InterruptedException e) {
                Thread.currentThread().interrupt();
            }
            return axis(0, DIM);
        };

        final CompletableFuture<List<ScoredResult>> inFlight = CompletableFuture.supplyAsync(() -> engine.query("q", 10, 3, 0.0f));
        assertTrue(entered.await(5, TimeUnit.SECONDS));

        publishCosines(0.5, 0.4);
        assertEquals(1, old.getRefCount());

        proceed.countDown();
        final List<ScoredResult> results = inFlight.get(5, TimeUnit.SECONDS);

        assertEquals(1, results.size());
        assertEquals(0.9f, results.get(0).similarity(), 1e-4);
        assertEquals(0, old.getRefCount());
    }
}
