package eu.virtualparadox.ragservice.rag.index;

import eu.virtualparadox.ragservice.rag.index.model.SearchHit;
import org.junit.jupiter.api.DisplayName;
import org.junit.jupiter.api.Test;

import org.apache.lucene.util.VectorUtil;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.Random;
import java.util.stream.IntStream;

import static eu.virtualparadox.ragservice.RecordFixtures.atCosine;
import static eu.virtualparadox.ragservice.RecordFixtures.axis;
import static org.junit.jupiter.api.Assertions.*;

class LuceneSimilarityIndexTest {

    @Test
    @DisplayName("Returns cosine similarities in descending order")
    void ranksByCosine() throws IOException {
        try (LuceneSimilarityIndex index = LuceneSimilarityIndex.create(
                List.of("low", "high", "mid"),
                List.of(atCosine(0.2, 4), atCosine(0.9, 4), atCosine(0.5, 4)))) {

            assertEquals(3, index.size());
            assertEquals(4, index.dimension());

            final List<SearchHit> hits = index.search(axis(0, 4), 3);
            assertEquals(List.of(1, 2, 0), hits.stream().map(SearchHit::slot).toList());
            assertEquals(0.9f, hits.get(0).similarity(), 1e-4);
            assertEquals(0.5f, hits.get(1).similarity(), 1e-4);
            assertEquals(0.2f, hits.get(2).similarity(), 1e-4);
        }
    }

    @Test
    @DisplayName("k larger than the index returns every vector")
    void kLargerThanIndex() throws IOException {
        try (LuceneSimilarityIndex index = LuceneSimilarityIndex.create(
                List.of("a", "b"), List.of(axis(0, 2), axis(1, 2)))) {
            assertEquals(2, index.search(axis(0, 2), 50).size());
        }
    }

    @Test
    @DisplayName("Opposite vectors score -1")
    void negativeSimilarity() throws IOException {
        try (LuceneSimilarityIndex index = LuceneSimilarityIndex.create(
                List.of("a"), List.of(new float[]{-1f, 0f}))) {
            assertEquals(-1f, index.search(axis(0, 2), 1).get(0).similarity(), 1e-4);
        }
    }

    @Test
    @DisplayName("Rejects inconsistent input and mismatched queries")
    void rejectsBadInput() throws IOException {
        assertThrows(IllegalArgumentException.class,
                () -> LuceneSimilarityIndex.create(List.of(), List.of()));
        assertThrows(IllegalArgumentException.class,
                () -> LuceneSimilarityIndex.create(List.of("a", "b"), List.of(axis(0, 2), axis(0, 3))));

        try (LuceneSimilarityIndex index = LuceneSimilarityIndex.create(List.of("a"), List.of(axis(0, 2)))) {
            assertThrows(IllegalArgumentException.class, () -> index.search(axis(0, 3), 1));
            assertThrows(IllegalArgumentException.class, () -> index.search(axis(0, 2), 0));
        }
    }

    @Test
    @DisplayName("Top k equals a brute-force scan over every vector")
    void matchesBruteForce() throws IOException {
        assertExactTopK(300, 768, 50, 10);
        assertExactTopK(3000, 64, 50, 10);
    }

    @Test
    @DisplayName("Indexes and searches vectors wider than Lucene's default 1024 dimensions")
    void highDimensionVectors() throws IOException {
        try (LuceneSimilarityIndex index = LuceneSimilarityIndex.create(
                List.of("a", "b"), List.of(axis(0, 1536), axis(1535, 1536)))) {
            assertEquals(1536, index.dimension());

            final List<SearchHit> hits = index.search(axis(1535, 1536), 2);
            assertEquals(1, hits.get(0).slot());
            assertEquals(1f, hits.get(0).similarity(), 1e-4);
            assertEquals(0f, hits.get(1).similarity(), 1e-4);
        }
    }

    private static void assertExactTopK(final int count, final int dim, final int queries, final int k) throws IOException {
        final Random random = new Random(count * 31L + dim);
        final List<float[]> vectors = new ArrayList<>(count);
        final List<String> ids = new ArrayList<>(count);
        for (int i = 0; i < count; i++) {
            vectors.add(randomUnitVector(random, dim));
            ids.add("e" + i);
        }

        try (LuceneSimilarityIndex index = LuceneSimilarityIndex.create(ids, vectors)) {
            for (int q = 0; q < queries; q++) {
                final float[] query = randomUnitVector(random, dim);

                final List<Integer> expected = IntStream.range(0, count).boxed()
                        .sorted(Comparator.comparing((Integer slot) -> VectorUtil.dotProduct(query, vectors.get(slot)))
                                .reversed()
                                .thenComparing(Comparator.naturalOrder()))
                        .limit(k)
                        .toList();

                final List<SearchHit> hits = index.search(query, k);
                assertEquals(expected, hits.stream().map(SearchHit::slot).toList(),
                        "top " + k + " of " + count + " vectors (dim " + dim + "), query " + q);
                assertEquals(VectorUtil.dotProduct(query, vectors.get(expected.get(0))), hits.get(0).similarity(), 1e-6);
            }
        }
    }

    private static float[] randomUnitVector(final Random random, final int dim) {
        final float[] v = new float[dim];
        double norm = 0;
        for (int i = 0; i < dim; i++) {
            v[i] = (float) random.nextGaussian();
            norm += (double) v[i] * v[i];
        }
        final float scale = (float) (1.0 / Math.sqrt(norm));
        for (int i = 0; i < dim; i++) {
            v[i] *= scale;
        }
        return v;
    }
}
