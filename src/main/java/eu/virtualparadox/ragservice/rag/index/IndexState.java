package eu.virtualparadox.ragservice.rag.index;

import jakarta.annotation.PreDestroy;
import lombok.extern.slf4j.Slf4j;
import org.springframework.stereotype.Service;

import java.util.Optional;
import java.util.concurrent.atomic.AtomicReference;

/**
 * Holds the generation queries run against. The only mutable state shared between the poll loop and queries.
 * <p>
 * Publishing swaps a single reference, so readers see either the old generation or the new one, never a mix,
 * and never wait on the writer. The swapped-out generation is released here and closes itself once the last
 * query using it calls {@link #release(IndexGeneration)}.
 * <p>
 * Readiness is {@code current() != null}; it never goes back to false while the service runs because
 * nothing but {@link #close()} ever clears the reference.
 * <p>
 * Writers ({@link #publish(IndexGeneration)} and {@link #close()}) are serialized on this instance; readers
 * never take the lock. Once closed, the state accepts no further generations.
 */
@Service
@Slf4j
public class IndexState {

    private final AtomicReference<IndexGeneration> current = new AtomicReference<>();

    // guarded by this
    private boolean closed;

    /**
     * Makes {@code generation} visible to all subsequent reads. Ownership of the caller's reference moves here.
     *
     * @throws IllegalArgumentException if {@code generation} is already the current one
     * @throws IndexStateClosedException if the state has been closed; the caller keeps its reference
     */
    public synchronized void publish(final IndexGeneration generation) {
        if (generation == null) {
            throw new IllegalArgumentException("generation must not be null");
        }
        if (closed) {
            throw new IndexStateClosedException("Index state is closed, generation " + generation.getNumber() + " not published");
        }
        if (current.get() == generation) {
            throw new IllegalArgumentException("Generation " + generation.getNumber() + " is already published");
        }
        final IndexGeneration previous = current.getAndSet(generation);

        if (previous == null) {
            log.info("Index ready: generation {} with {} vectors", generation.getNumber(), generation.size());
        } else {
            log.info("Index generation {} ({} vectors) replaces generation {} ({} vectors)",
                    generation.getNumber(), generation.size(), previous.getNumber(), previous.size());
            previous.decRef();
        }
    }

    /**
     * Peek at the current generation without taking a reference. Fine for metadata such as the size;
     * searches must use {@link #acquire()}.
     */
    public Optional<IndexGeneration> current() {
        return Optional.ofNullable(current.get());
    }

    public boolean isReady() {
        return current.get() != null;
    }

    /**
     * @return size of the current generation, {@code 0} before the first publish
     */
    public int size() {
        final IndexGeneration generation = current.get();
        return generation == null ? 0 : generation.size();
    }

    /**
     * Takes a reference on the current generation. Every successful call must be paired with
     * {@link #release(IndexGeneration)}, typically in a {@code finally} block.
     *
     * @throws IndexNotReadyException if nothing has been published yet
     */
    public IndexGeneration acquire() {
        while (true) {
            final IndexGeneration generation = current.get();
            if (generation == null) {
                throw new IndexNotReadyException("Index not loaded");
            }
            if (generation.tryIncRef()) {
                return generation;
            }
            // superseded and closed between get() and tryIncRef(); the next get() sees its successor
        }
    }

    public void release(final IndexGeneration generation) {
        generation.decRef();
    }

    @PreDestroy
    public synchronized void close() {
        closed = true;
        final IndexGeneration generation = current.getAndSet(null);
        if (generation != null) {
            generation.decRef();
        }
    }
}
