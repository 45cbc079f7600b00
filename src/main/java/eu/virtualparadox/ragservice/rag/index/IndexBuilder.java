package eu.virtualparadox.ragservice.rag.index;

import eu.virtualparadox.ragservice.application.config.ApplicationConfig;
import eu.virtualparadox.ragservice.rag.index.model.BuildResult;
import eu.virtualparadox.ragservice.source.model.EmbeddingRecord;
import lombok.extern.slf4j.Slf4j;
import org.apache.commons.lang3.StringUtils;
import org.springframework.stereotype.Service;

import java.io.IOException;
import java.time.Clock;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.TreeMap;
import java.util.concurrent.atomic.AtomicLong;

/**
 * Turns a snapshot of embedding records into a new, unpublished {@link IndexGeneration}.
 * <p>
 * Steps:
 * <ol>
 *   <li>Collapse duplicate ids (last occurrence wins) and sort by id; id order is slot order</li>
 *   <li>Drop records whose vector length disagrees with their declared dimension, or whose vector is zero</li>
 *   <li>Pick the batch dimension (configured, or the majority) and drop records of any other dimension</li>
 *   <li>L2-normalize the vectors and write them into a {@link LuceneSimilarityIndex}</li>
 * </ol>
 * Vectors are never truncated or padded. Sorting by id makes the result independent of input order.
 * The builder keeps no reference to what it builds; the caller owns the returned generation.
 */
@Service
@Slf4j
public class IndexBuilder {

    private final ApplicationConfig config;
    private final Clock clock;
    private final AtomicLong generationCounter = new AtomicLong();

    public IndexBuilder(final ApplicationConfig config, final Clock clock) {
        this.config = config;
        this.clock = clock;
    }

    /**
     * @param records snapshot from the record source
     * @return the new generation plus drop statistics
     * @throws EmptyInputException if {@code records} is empty or nothing usable remains
     * @throws IndexBuildException if the similarity index cannot be written
     */
    public BuildResult build(final List<EmbeddingRecord> records) {
        if (records == null || records.isEmpty()) {
            throw new EmptyInputException("No embedding records to index");
        }

        // 1. dedupe + stable order
        final Map<String, EmbeddingRecord> byId = new TreeMap<>();
        int duplicates = 0;
        int malformed = 0;
        for (final EmbeddingRecord rec : records) {
            if (rec == null || rec.id() == null || rec.vector() == null) {
                malformed++;
                continue;
            }
            if (byId.put(rec.id(), rec) != null) {
                duplicates++;
            }
        }

        // 2. per-record consistency
        final List<EmbeddingRecord> consistent = new ArrayList<>(byId.size());
        for (final EmbeddingRecord rec : byId.values()) {
            if (rec.vector().length != rec.dimension() || norm(rec.vector()) == 0.0) {
                log.warn("Dropping {}: vector length {} (declared {}) or zero norm",
                        rec.id(), rec.vector().length, rec.dimension());
                malformed++;
                continue;
            }
            consistent.add(rec);
        }
        if (consistent.isEmpty()) {
            throw new EmptyInputException("No usable embedding records (" + malformed + " malformed)");
        }

        // 3. batch dimension
        final Integer expected = config.getIndex().getExpectedDimension();
        final int dimension = expected != null ? expected : majorityDimension(consistent);

        final List<EmbeddingRecord> kept = new ArrayList<>(consistent.size());
        for (final EmbeddingRecord rec : consistent) {
            if (rec.dimension() == dimension) {
                kept.add(rec);
            }
        }
        final int droppedDimension = consistent.size() - kept.size();
        if (droppedDimension > 0) {
            log.warn("Dropped {} records whose dimension differs from {}", droppedDimension, dimension);
        }
        if (kept.isEmpty()) {
            throw new EmptyInputException("No embedding records of dimension " + dimension);
        }

        warnOnModelMismatch(kept);

        // 4. normalize + index
        final List<String> ids = new ArrayList<>(kept.size());
        final List<float[]> vectors = new ArrayList<>(kept.size());
        double minNorm = Double.MAX_VALUE;
        double maxNorm = 0.0;
        double sumNorm = 0.0;
        for (final EmbeddingRecord rec : kept) {
            final double n = norm(rec.vector());
            minNorm = Math.min(minNorm, n);
            maxNorm = Math.max(maxNorm, n);
            sumNorm += n;

            ids.add(rec.id());
            vectors.add(normalized(rec.vector(), n));
        }
        log.info("Embedding norms: min={}, max={}, mean={}",
                format(minNorm), format(maxNorm), format(sumNorm / kept.size()));

        final LuceneSimilarityIndex index;
        try {
            index = LuceneSimilarityIndex.create(ids, vectors);
        } catch (IOException | RuntimeException e) {
            throw new IndexBuildException("Failed to build similarity index over " + kept.size() + " vectors", e);
        }

        final IndexGeneration generation = new IndexGeneration(
                generationCounter.incrementAndGet(), index, new IndexEntryMap(kept), clock.instant());

        log.info("Built index generation {} with {} vectors of dimension {} ({} dropped, {} duplicate ids)",
                generation.getNumber(), generation.size(), dimension, droppedDimension + malformed, duplicates);

        return new BuildResult(generation, dimension, droppedDimension, malformed, duplicates);
    }

    /**
     * Most frequent declared dimension; on a tie the dimension seen first in id order wins.
     */
    private int majorityDimension(final List<EmbeddingRecord> records) {
        final Map<Integer, Integer> counts = new LinkedHashMap<>();
        for (final EmbeddingRecord rec : records) {
            counts.merge(rec.dimension(), 1, Integer::sum);
        }

        int best = records.get(0).dimension();
        int bestCount = 0;
        for (final Map.Entry<Integer, Integer> e : counts.entrySet()) {
            if (e.getValue() > bestCount) {
                best = e.getKey();
                bestCount = e.getValue();
            }
        }
        return best;
    }

    private void warnOnModelMismatch(final List<EmbeddingRecord> records) {
        final String expectedModel = config.getEmbedding().getModel();
        if (StringUtils.isBlank(expectedModel)) {
            return;
        }
        final long mismatched = records.stream()
                .filter(r -> !Objects.equals(expectedModel, r.modelName()))
                .count();
        if (mismatched > 0) {
            log.warn("Model mismatch: {} of {} records were not embedded with {}",
                    mismatched, records.size(), expectedModel);
        }
    }

    private static double norm(final float[] vec) {
        double norm = 0.0;
        for (final float v : vec) {
            norm += (double) v * v;
        }
        return Math.sqrt(norm);
    }

    private static float[] normalized(final float[] vec, final double norm) {
        final float[] out = new float[vec.length];
        for (int i = 0; i < vec.length; i++) {
            out[i] = (float) (vec[i] / norm);
        }
        return out;
    }

    private static String format(final double value) {
        return String.format(Locale.ROOT, "%.4f", value);
    }
}
