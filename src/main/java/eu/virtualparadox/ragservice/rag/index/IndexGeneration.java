package eu.virtualparadox.ragservice.rag.index;

import lombok.Getter;
import lombok.extern.slf4j.Slf4j;

import java.io.IOException;
import java.time.Instant;
import java.util.concurrent.atomic.AtomicInteger;

/**
 * One complete build: a {@link SimilarityIndex} and the {@link IndexEntryMap} describing its slots.
 * <p>
 * The pair is only ever handed out together, so a reader can never combine an index from one build
 * with entries from another.
 *
 * <h3>Reference counting</h3>
 * A generation starts with one reference, owned by whoever built it (later by {@link IndexState}).
 * Queries take an extra reference for the duration of a search. The similarity index is closed when
 * the count drops to zero, which happens only after the generation was superseded and the last
 * in-flight query released it. Same contract as Lucene's {@code IndexReader#tryIncRef/decRef}.
 */
@Slf4j
@Getter
public final class IndexGeneration {

    private final long number;
    private final SimilarityIndex index;
    private final IndexEntryMap entries;
    private final Instant builtAt;

    @Getter(lombok.AccessLevel.NONE)
    private final AtomicInteger refCount = new AtomicInteger(1);

    public IndexGeneration(final long number,
                           final SimilarityIndex index,
                           final IndexEntryMap entries,
                           final Instant builtAt) {
        if (index.size() != entries.size()) {
            throw new IllegalArgumentException(
                    "Index size " + index.size() + " does not match entry map size " + entries.size());
        }
        this.number = number;
        this.index = index;
        this.entries = entries;
        this.builtAt = builtAt;
    }

    public int size() {
        return entries.size();
    }

    /**
     * Takes a reference unless the generation has already been closed.
     *
     * @return {@code true} if a reference was taken and must be given back with {@link #decRef()}
     */
    public boolean tryIncRef() {
        int count;
        while ((count = refCount.get()) > 0) {
            if (refCount.compareAndSet(count, count + 1)) {
                return true;
            }
        }
        return false;
    }

    /**
     * Gives back a reference; the last one closes the similarity index.
     */
    public void decRef() {
        final int count = refCount.decrementAndGet();
        if (count == 0) {
            try {
                index.close();
                log.debug("Closed index generation {}", number);
            } catch (IOException e) {
                log.error("Unable to close index generation {}", number, e);
            }
        } else if (count < 0) {
            throw new IllegalStateException("Index generation " + number + " released too many times");
        }
    }

    public int getRefCount() {
        return refCount.get();
    }
}
