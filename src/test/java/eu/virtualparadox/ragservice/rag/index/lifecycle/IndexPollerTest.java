package eu.virtualparadox.ragservice.rag.index.lifecycle;

import eu.virtualparadox.ragservice.api.HealthController;
import eu.virtualparadox.ragservice.application.config.ApplicationConfig;
import eu.virtualparadox.ragservice.application.executor.IndexPollScheduler;
import eu.virtualparadox.ragservice.rag.index.IndexBuilder;
import eu.virtualparadox.ragservice.rag.index.IndexGeneration;
import eu.virtualparadox.ragservice.rag.index.IndexState;
import eu.virtualparadox.ragservice.rag.index.model.BuildResult;
import eu.virtualparadox.ragservice.rag.index.lifecycle.CycleOutcome.Status;
import eu.virtualparadox.ragservice.source.SourceUnavailableException;
import eu.virtualparadox.ragservice.source.VectorRecordSource;
import eu.virtualparadox.ragservice.source.model.EmbeddingRecord;
import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;
import org.springframework.test.web.servlet.MockMvc;
import org.springframework.test.web.servlet.setup.MockMvcBuilders;

import java.time.Clock;
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicReference;

import static eu.virtualparadox.ragservice.RecordFixtures.axis;
import static eu.virtualparadox.ragservice.RecordFixtures.record;
import static org.junit.jupiter.api.Assertions.*;
import static org.springframework.test.web.servlet.request.MockMvcRequestBuilders.get;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.jsonPath;
import static org.springframework.test.web.servlet.result.MockMvcResultMatchers.status;

class IndexPollerTest {

    private final ApplicationConfig config = new ApplicationConfig();
    private final FakeSource source = new FakeSource();
    private final IndexState state = new IndexState();
    private final IndexPollScheduler scheduler = new IndexPollScheduler();

    private IndexPoller poller;

    @BeforeEach
    void setUp() {
        config.getPoll().setInterval(Duration.ofMillis(20));
        config.getPoll().setRefreshInterval(Duration.ofMillis(20));
        scheduler.setPoolSize(1);
        scheduler.initialize();

        final Clock clock = Clock.systemUTC();
        poller = new IndexPoller(source, new IndexBuilder(config, clock), state, scheduler, config, clock);
    }

    @AfterEach
    void tearDown() {
        poller.stop();
        scheduler.shutdown();
        state.close();
    }

    private static List<EmbeddingRecord> records(final int count) {
        final List<EmbeddingRecord> records = new ArrayList<>();
        for (int i = 0; i < count; i++) {
            records.add(record("E" + i, axis(i % 4, 4)));
        }
        return records;
    }

    @Test
    @DisplayName("Readiness flips only once the store has data: 503, 503, 503, then 200")
    void becomesReadyWhenDataAppears() throws Exception {
        final MockMvc mvc = MockMvcBuilders.standaloneSetup(new HealthController(state)).build();

        for (int tick = 0; tick < 3; tick++) {
            assertEquals(Status.NO_DATA, poller.poll().status());
            mvc.perform(get("/ready")).andExpect(status().isServiceUnavailable());
            mvc.perform(get("/health"))
                    .andExpect(status().isOk())
                    .andExpect(jsonPath("$.status").value("unhealthy"))
                    .andExpect(jsonPath("$.index_size").value(0));
        }

        source.records = records(5);
        final CycleOutcome outcome = poller.poll();

        assertTrue(outcome.published());
        assertEquals(5, outcome.indexSize());
        mvc.perform(get("/ready"))
                .andExpect(status().isOk())
                .andExpect(jsonPath("$.status").value("ready"))
                .andExpect(jsonPath("$.index_size").value(5));
    }

    @Test
    @DisplayName("An unavailable store leaves the service not ready and is retried")
    void unavailableStoreIsRetried() {
        source.unavailable = true;
        assertEquals(Status.FAILED, poller.poll().status());
        assertFalse(state.isReady());

        source.unavailable = false;
        source.records = records(2);
        assertTrue(poller.poll().published());
        assertTrue(state.isReady());
    }

    @Test
    @DisplayName("A failed refresh keeps serving the previous generation")
    void failedRefreshKeepsPreviousGeneration() {
        source.records = records(3);
        assertTrue(poller.poll().published());
        final IndexGeneration served = state.current().orElseThrow();

        source.unavailable = true;
        final CycleOutcome unavailable = poller.poll();
        assertEquals(Status.FAILED, unavailable.status());
        assertEquals(3, unavailable.indexSize());
        assertSame(served, state.current().orElseThrow());

        source.unavailable = false;
        source.fetchFailure = new IllegalStateException("boom");
        assertEquals(Status.FAILED, poller.poll().status());
        assertSame(served, state.current().orElseThrow());
        assertEquals(1, served.getRefCount());
    }

    @Test
    @DisplayName("Rows that are all unusable never publish an index")
    void unusableRowsNeverPublish() {
        source.records = List.of(record("E1", 0f, 0f));
        assertEquals(Status.NO_DATA, poller.poll().status());
        assertFalse(state.isReady());
    }

    @Test
    @DisplayName("Reload reports the outcome of its own build")
    void reloadReportsOwnOutcome() {
        assertEquals(Status.NO_DATA, poller.reload().status());

        source.records = records(4);
        final CycleOutcome first = poller.reload();
        assertTrue(first.published());
        assertEquals(4, first.indexSize());

        source.records = records(6);
        final CycleOutcome second = poller.reload();
        assertTrue(second.published());
        assertEquals(6, second.indexSize());
        assertTrue(second.generation() > first.generation());
    }

    @Test
    @DisplayName("A build finishing during shutdown is discarded, not published")
    void discardsBuildDuringShutdown() {
        source.records = records(2);
        poller.stop();

        final CycleOutcome outcome = poller.poll();

        assertEquals(Status.DISCARDED, outcome.status());
        assertFalse(state.isReady());
    }

    @Test
    @DisplayName("A build finishing after the index state closed is released, not leaked")
    void releasesBuildWhenStateClosedFirst() {
        final AtomicReference<IndexGeneration> built = new AtomicReference<>();
        final Clock clock = Clock.systemUTC();
        final IndexBuilder capturing = new IndexBuilder(config, clock) {
            @Override
            public BuildResult build(final List<EmbeddingRecord> records) {
                final BuildResult result = super.build(records);
                built.set(result.generation());
                return result;
            }
        };
        final IndexPoller late = new IndexPoller(source, capturing, state, scheduler, config, clock);
        source.records = records(2);
        state.close();

        final CycleOutcome outcome = late.poll();

        assertEquals(Status.DISCARDED, outcome.status());
        assertFalse(state.isReady());
        assertEquals(0, built.get().getRefCount());
    }

    @Test
    @DisplayName("No tick runs once the loop has been stopped")
    void stopEndsTheLoop() throws InterruptedException {
        source.records = records(2);
        poller.start();

        final long deadline = System.currentTimeMillis() + 5_000;
        while (source.counts.get() < 3 && System.currentTimeMillis() < deadline) {
            Thread.sleep(5);
        }
        assertTrue(source.counts.get() >= 3);

        poller.stop();
        Thread.sleep(100);
        final int afterStop = source.counts.get();
        Thread.sleep(200);

        assertEquals(afterStop, source.counts.get());
    }

    @Test
    @DisplayName("The background loop publishes without any explicit call")
    void backgroundLoopPublishes() throws InterruptedException {
        poller.start();
        source.records = records(3);

        final long deadline = System.currentTimeMillis() + 5_000;
        while (!state.isReady() && System.currentTimeMillis() < deadline) {
            Thread.sleep(10);
        }

        assertTrue(state.isReady());
        assertEquals(3, state.size());
        assertTrue(source.counts.get() >= 1);
    }

    private static final class FakeSource implements VectorRecordSource {

        private final AtomicInteger counts = new AtomicInteger();
        private volatile List<EmbeddingRecord> records = List.of();
        private volatile boolean unavailable;
        private volatile RuntimeException fetchFailure;

        @Override
        public long countAvailable() {
            counts.incrementAndGet();
            if (unavailable) {
                throw new SourceUnavailableException("connection refused", null);
            }
            return records.size();
        }

        @Override
        public List<EmbeddingRecord> fetchAll() {
            if (fetchFailure != null) {
                throw fetchFailure;
            }
            return records;
        }
    }
}
