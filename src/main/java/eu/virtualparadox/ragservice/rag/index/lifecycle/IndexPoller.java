package eu.virtualparadox.ragservice.rag.index.lifecycle;

import eu.virtualparadox.ragservice.application.config.ApplicationConfig;
import eu.virtualparadox.ragservice.application.executor.IndexPollScheduler;
import eu.virtualparadox.ragservice.rag.index.EmptyInputException;
import eu.virtualparadox.ragservice.rag.index.IndexBuilder;
import eu.virtualparadox.ragservice.rag.index.IndexGeneration;
import eu.virtualparadox.ragservice.rag.index.IndexState;
import eu.virtualparadox.ragservice.rag.index.IndexStateClosedException;
import eu.virtualparadox.ragservice.rag.index.lifecycle.CycleOutcome.Status;
import eu.virtualparadox.ragservice.rag.index.model.BuildResult;
import eu.virtualparadox.ragservice.source.SourceUnavailableException;
import eu.virtualparadox.ragservice.source.VectorRecordSource;
import eu.virtualparadox.ragservice.source.model.EmbeddingRecord;
import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.boot.context.event.ApplicationReadyEvent;
import org.springframework.context.event.EventListener;
import org.springframework.core.task.TaskRejectedException;
import org.springframework.stereotype.Service;

import java.time.Clock;
import java.time.Duration;
import java.time.Instant;
import java.util.List;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.locks.ReentrantLock;

/**
 * Keeps the published index in step with the shared store, without any handshake with the producer.
 * <p>
 * Each cycle:
 * <ol>
 *   <li>check the store with {@link VectorRecordSource#countAvailable()}; stop here if it is empty or unreachable</li>
 *   <li>read a full snapshot and hand it to {@link IndexBuilder}</li>
 *   <li>publish the new generation into {@link IndexState}</li>
 * </ol>
 * Cycles repeat every {@code rag.poll.interval} until the first publish and every {@code rag.poll.refresh-interval}
 * afterwards, for the whole life of the process. A failed cycle never touches the generation being served.
 * <p>
 * {@code rag.poll.max-wait} is a soft deadline: once it passes without an index, a warning is logged and
 * polling simply goes on. Explicit reloads run through the same lock as regular ticks, so two builds
 * never overlap.
 */
@Service
@Slf4j
public class IndexPoller {

    private final VectorRecordSource source;
    private final IndexBuilder builder;
    private final IndexState state;
    private final IndexPollScheduler scheduler;
    private final ApplicationConfig.Poll config;
    private final Clock clock;

    private final ReentrantLock cycleLock = new ReentrantLock();

    private volatile boolean running;
    private volatile boolean shuttingDown;
    private volatile ScheduledFuture<?> nextTick;

    // guarded by cycleLock
    private Instant startedAt;
    private Instant lastProgressLog;
    private boolean deadlineWarned;

    public IndexPoller(final VectorRecordSource source,
                       final IndexBuilder builder,
                       final IndexState state,
                       final IndexPollScheduler scheduler,
                       final ApplicationConfig config,
                       final Clock clock) {
        this.source = source;
        this.builder = builder;
        this.state = state;
        this.scheduler = scheduler;
        this.config = config.getPoll();
        this.clock = clock;
    }

    @EventListener(ApplicationReadyEvent.class)
    public void onApplicationReady() {
        if (!config.isEnabled()) {
            log.info("Index polling disabled (rag.poll.enabled=false); only explicit reloads will build the index");
            return;
        }
        start();
    }

    /**
     * Starts the background loop. The first tick runs immediately; this method does not wait for it.
     */
    public synchronized void start() {
        if (running) {
            return;
        }
        running = true;

        cycleLock.lock();
        try {
            startedAt = clock.instant();
        } finally {
            cycleLock.unlock();
        }

        log.info("Waiting for embeddings to become available (poll every {}, soft deadline {})",
                config.getInterval(), config.getMaxWait());
        scheduleNext(Duration.ZERO);
    }

    /**
     * Runs one extra cycle outside the regular schedule, after any tick in progress has finished.
     *
     * @return the outcome of this cycle, not of an earlier one
     */
    public CycleOutcome reload() {
        log.info("Index reload requested");
        return runCycle(true);
    }

    /**
     * One regular tick. Exposed for tests; the scheduler calls it through {@link #tick()}.
     */
    public CycleOutcome poll() {
        return runCycle(false);
    }

    @PreDestroy
    public synchronized void stop() {
        shuttingDown = true;
        running = false;

        final ScheduledFuture<?> pending = nextTick;
        if (pending != null) {
            pending.cancel(false);
        }
        log.info("Index polling stopped");
    }

    private void tick() {
        if (!running) {
            return;
        }
        try {
            poll();
        } finally {
            scheduleNext(state.isReady() ? config.getRefreshInterval() : config.getInterval());
        }
    }

    /**
     * Synchronized with {@link #start()} and {@link #stop()} so {@code nextTick} always holds the latest
     * pending tick, even when a zero-delay tick reschedules before {@code start()} returns.
     */
    private synchronized void scheduleNext(final Duration delay) {
        if (!running) {
            return;
        }
        try {
            nextTick = scheduler.schedule(this::tick, scheduler.getClock().instant().plus(delay));
        } catch (TaskRejectedException e) {
            log.info("Poll scheduler no longer accepts tasks, polling ends: {}", e.getMessage());
            running = false;
        }
    }

    private CycleOutcome runCycle(final boolean explicitReload) {
        cycleLock.lock();
        try {
            warnIfPastDeadline();
            return doCycle(explicitReload);
        } finally {
            cycleLock.unlock();
        }
    }

    private CycleOutcome doCycle(final boolean explicitReload) {
        final long available;
        try {
            available = source.countAvailable();
        } catch (SourceUnavailableException e) {
            final String reason = "Embedding store unavailable: " + rootMessage(e);
            reportNotBuilt(explicitReload, reason);
            return outcome(Status.FAILED, reason);
        } catch (RuntimeException e) {
            log.error("Probing the embedding store failed; {}", servingDescription(), e);
            return outcome(Status.FAILED, "Probing the embedding store failed: " + rootMessage(e));
        }

        if (available == 0) {
            final String reason = "No embeddings found in the store";
            reportNotBuilt(explicitReload, reason);
            return outcome(Status.NO_DATA, reason);
        }

        final BuildResult result;
        try {
            final List<EmbeddingRecord> records = source.fetchAll();
            result = builder.build(records);
        } catch (SourceUnavailableException e) {
            final String reason = "Embedding store unavailable: " + rootMessage(e);
            reportNotBuilt(explicitReload, reason);
            return outcome(Status.FAILED, reason);
        } catch (EmptyInputException e) {
            reportNotBuilt(explicitReload, e.getMessage());
            return outcome(Status.NO_DATA, e.getMessage());
        } catch (RuntimeException e) {
            log.error("Index build failed; {}", servingDescription(), e);
            return outcome(Status.FAILED, "Index build failed: " + rootMessage(e));
        }

        final IndexGeneration generation = result.generation();
        if (shuttingDown) {
            return discard(generation);
        }
        try {
            state.publish(generation);
        } catch (IndexStateClosedException e) {
            return discard(generation);
        }
        return new CycleOutcome(Status.PUBLISHED, generation.size(), generation.getNumber(),
                "Published generation " + generation.getNumber() + " with " + generation.size()
                        + " vectors (" + result.dropped() + " records dropped)");
    }

    private CycleOutcome discard(final IndexGeneration generation) {
        generation.decRef();
        log.info("Shutting down, discarded freshly built generation {}", generation.getNumber());
        return outcome(Status.DISCARDED, "Shutting down");
    }

    private void reportNotBuilt(final boolean explicitReload, final String reason) {
        if (explicitReload) {
            log.warn("Reload did not build an index: {}; {}", reason, servingDescription());
            return;
        }
        if (state.isReady()) {
            log.warn("Index refresh skipped: {}; {}", reason, servingDescription());
            return;
        }

        final Instant now = clock.instant();
        if (lastProgressLog != null && Duration.between(lastProgressLog, now).compareTo(config.getProgressLogInterval()) < 0) {
            return;
        }
        lastProgressLog = now;

        final long waitedSeconds = startedAt == null ? 0 : Duration.between(startedAt, now).toSeconds();
        if (deadlineWarned) {
            log.warn("{} (waited {}s, past the {} deadline); still not ready, retrying in {}",
                    reason, waitedSeconds, config.getMaxWait(), config.getInterval());
        } else {
            log.info("{} (waited {}s), retrying in {}", reason, waitedSeconds, config.getInterval());
        }
    }

    private void warnIfPastDeadline() {
        if (deadlineWarned || startedAt == null || state.isReady()) {
            return;
        }
        final Duration waited = Duration.between(startedAt, clock.instant());
        if (waited.compareTo(config.getMaxWait()) >= 0) {
            deadlineWarned = true;
            log.warn("No index after {}; the service stays not ready and keeps polling until embeddings appear",
                    config.getMaxWait());
        }
    }

    private CycleOutcome outcome(final Status status, final String message) {
        final IndexGeneration serving = state.current().orElse(null);
        return serving == null
                ? new CycleOutcome(status, 0, 0, message)
                : new CycleOutcome(status, serving.size(), serving.getNumber(), message);
    }

    private String servingDescription() {
        return state.current()
                .map(g -> "still serving generation " + g.getNumber() + " (" + g.size() + " vectors)")
                .orElse("no index loaded yet");
    }

    private static String rootMessage(final Throwable e) {
        Throwable t = e;
        while (t.getCause() != null && t.getCause() != t) {
            t = t.getCause();
        }
        return t.getMessage() == null ? t.getClass().getSimpleName() : t.getMessage();
    }
}
