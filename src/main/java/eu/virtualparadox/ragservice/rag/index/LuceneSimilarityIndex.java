package eu.virtualparadox.ragservice.rag.index;

import eu.virtualparadox.ragservice.rag.index.model.SearchHit;
import org.apache.lucene.codecs.Codec;
import org.apache.lucene.codecs.FilterCodec;
import org.apache.lucene.codecs.KnnVectorsFormat;
import org.apache.lucene.codecs.perfield.PerFieldKnnVectorsFormat;
import org.apache.lucene.document.Document;
import org.apache.lucene.document.Field;
import org.apache.lucene.document.KnnFloatVectorField;
import org.apache.lucene.document.StoredField;
import org.apache.lucene.document.StringField;
import org.apache.lucene.index.DirectoryReader;
import org.apache.lucene.index.FloatVectorValues;
import org.apache.lucene.index.IndexWriter;
import org.apache.lucene.index.IndexWriterConfig;
import org.apache.lucene.index.LeafReaderContext;
import org.apache.lucene.index.StoredFields;
import org.apache.lucene.index.VectorSimilarityFunction;
import org.apache.lucene.search.DocIdSetIterator;
import org.apache.lucene.store.ByteBuffersDirectory;
import org.apache.lucene.store.Directory;
import org.apache.lucene.util.VectorUtil;

import java.io.IOException;
import java.util.ArrayList;
import java.util.Comparator;
import java.util.List;
import java.util.PriorityQueue;

import static eu.virtualparadox.ragservice.util.LuceneConstants.*;

/**
 * {@link SimilarityIndex} over vectors stored with Lucene's vector format, held entirely in heap memory.
 * <p>
 * Each instance owns its own {@link ByteBuffersDirectory}, written once by {@link #create(List, List)}
 * and only read afterwards, so an instance is immutable for its whole life.
 *
 * <h3>Field layout</h3>
 * <ul>
 *   <li>{@code recordId} – {@link StringField}, stored: id of the embedding record</li>
 *   <li>{@code slot} – {@link StoredField}: position in the owning {@link IndexEntryMap}</li>
 *   <li>{@code vector} – {@link KnnFloatVectorField} with {@link VectorSimilarityFunction#DOT_PRODUCT}</li>
 * </ul>
 *
 * <p><b>Search</b> is exhaustive: every stored vector is scored with {@link VectorUtil#dotProduct}, so the
 * result is the exact top {@code k}, not an approximation from the HNSW graph. Vectors are unit length,
 * so the dot product is the cosine in [-1, 1].</p>
 *
 * <p><b>Dimension:</b> up to {@value HighDimensionVectorsFormat#MAX_DIMENSIONS} per vector, see
 * {@link HighDimensionVectorsFormat}.</p>
 */
public final class LuceneSimilarityIndex implements SimilarityIndex {

    private static final Comparator<SearchHit> WORST_FIRST =
            Comparator.comparing(SearchHit::similarity)
                    .thenComparing(SearchHit::slot, Comparator.reverseOrder());

    private static final Comparator<SearchHit> BEST_FIRST = WORST_FIRST.reversed();

    private final Directory directory;
    private final DirectoryReader reader;
    private final int[] slotByDoc;
    private final int size;
    private final int dimension;

    private LuceneSimilarityIndex(final Directory directory,
                                  final DirectoryReader reader,
                                  final int dimension) throws IOException {
        this.directory = directory;
        this.reader = reader;
        this.size = reader.numDocs();
        this.dimension = dimension;
        this.slotByDoc = readSlots(reader);
    }

    /**
     * Writes the vectors into a fresh in-memory index.
     * <p>
     * Vector {@code i} gets slot {@code i}. Everything is force-merged into one segment before the
     * reader is opened, so no later background work touches the directory.
     *
     * @param ids     record ids, one per slot
     * @param vectors unit-length vectors, same order and count as {@code ids}, all of one dimension
     * @return an open index, owned by the caller
     * @throws IOException              if Lucene fails to write or open the index
     * @throws IllegalArgumentException if inputs are empty or inconsistent
     */
    public static LuceneSimilarityIndex create(final List<String> ids,
                                               final List<float[]> vectors) throws IOException {
        if (ids.isEmpty() || ids.size() != vectors.size()) {
            throw new IllegalArgumentException("ids and vectors must be non-empty and of equal size");
        }
        final int dim = vectors.get(0).length;

        final Directory dir = new ByteBuffersDirectory();
        try {
            final IndexWriterConfig cfg = new IndexWriterConfig()
                    .setOpenMode(IndexWriterConfig.OpenMode.CREATE)
                    .setCodec(highDimensionCodec());

            try (IndexWriter writer = new IndexWriter(dir, cfg)) {
                for (int slot = 0; slot < vectors.size(); slot++) {
                    final float[] vec = vectors.get(slot);
                    if (vec.length != dim) {
                        throw new IllegalArgumentException("All vectors must be of length " + dim);
                    }
                    writer.addDocument(buildLuceneDocument(slot, ids.get(slot), vec));
                }
                writer.forceMerge(1);
                writer.commit();
            }

            final DirectoryReader reader = DirectoryReader.open(dir);
            try {
                return new LuceneSimilarityIndex(dir, reader, dim);
            } catch (IOException | RuntimeException e) {
                reader.close();
                throw e;
            }
        } catch (IOException | RuntimeException e) {
            dir.close();
            throw e;
        }
    }

    @Override
    public int size() {
        return size;
    }

    @Override
    public int dimension() {
        return dimension;
    }

    @Override
    public List<SearchHit> search(final float[] query, final int k) throws IOException {
        if (query.length != dimension) {
            throw new IllegalArgumentException("Query dimension " + query.length + " != index dimension " + dimension);
        }
        if (k < 1) {
            throw new IllegalArgumentException("k must be >= 1");
        }

        final PriorityQueue<SearchHit> best = new PriorityQueue<>(Math.min(k, size) + 1, WORST_FIRST);
        for (final LeafReaderContext leaf : reader.leaves()) {
            final FloatVectorValues values = leaf.reader().getFloatVectorValues(FIELD_VECTOR);
            if (values == null) {
                continue;
            }
            for (int doc = values.nextDoc(); doc != DocIdSetIterator.NO_MORE_DOCS; doc = values.nextDoc()) {
                final SearchHit hit = new SearchHit(
                        slotByDoc[leaf.docBase + doc], VectorUtil.dotProduct(query, values.vectorValue()));
                if (best.size() < k) {
                    best.add(hit);
                } else if (WORST_FIRST.compare(hit, best.peek()) > 0) {
                    best.poll();
                    best.add(hit);
                }
            }
        }

        final List<SearchHit> hits = new ArrayList<>(best);
        hits.sort(BEST_FIRST);
        return hits;
    }

    @Override
    public void close() throws IOException {
        try {
            reader.close();
        } finally {
            directory.close();
        }
    }

    private static int[] readSlots(final DirectoryReader reader) throws IOException {
        final int[] slots = new int[reader.maxDoc()];
        final StoredFields storedFields = reader.storedFields();
        for (int doc = 0; doc < slots.length; doc++) {
            slots[doc] = storedFields.document(doc).getField(FIELD_SLOT).numericValue().intValue();
        }
        return slots;
    }

    /**
     * Default codec with {@link HighDimensionVectorsFormat} for every vector field. It keeps the default
     * codec's name, so the stock codec reads the segments back.
     */
    private static Codec highDimensionCodec() {
        final Codec base = Codec.getDefault();
        final KnnVectorsFormat vectors = new PerFieldKnnVectorsFormat() {
            private final KnnVectorsFormat format = new HighDimensionVectorsFormat();

            @Override
            public KnnVectorsFormat getKnnVectorsFormatForField(final String field) {
                return format;
            }
        };
        return new FilterCodec(base.getName(), base) {
            @Override
            public KnnVectorsFormat knnVectorsFormat() {
                return vectors;
            }
        };
    }

    private static Document buildLuceneDocument(final int slot,
                                                final String recordId,
                                                final float[] vec) {
        final Document d = new Document();

        d.add(new StringField(FIELD_RECORD_ID, recordId, Field.Store.YES));
        d.add(new StoredField(FIELD_SLOT, slot));

        d.add(new KnnFloatVectorField(FIELD_VECTOR, vec, VectorSimilarityFunction.DOT_PRODUCT));

        return d;
    }
}
