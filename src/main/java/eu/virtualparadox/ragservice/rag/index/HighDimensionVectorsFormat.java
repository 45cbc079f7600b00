package eu.virtualparadox.ragservice.rag.index;

import org.apache.lucene.codecs.KnnVectorsFormat;
import org.apache.lucene.codecs.KnnVectorsReader;
import org.apache.lucene.codecs.KnnVectorsWriter;
import org.apache.lucene.codecs.lucene99.Lucene99HnswVectorsFormat;
import org.apache.lucene.index.SegmentReadState;
import org.apache.lucene.index.SegmentWriteState;

import java.io.IOException;

/**
 * Lucene's HNSW vector format with a higher dimension limit than the default codec's 1024.
 * <p>
 * Registers under the delegate's name, so segments written with it are read back by the stock
 * {@link Lucene99HnswVectorsFormat} and need no SPI registration of their own.
 */
final class HighDimensionVectorsFormat extends KnnVectorsFormat {

    static final int MAX_DIMENSIONS = 16_384;

    private static final KnnVectorsFormat DELEGATE = new Lucene99HnswVectorsFormat();

    HighDimensionVectorsFormat() {
        super(DELEGATE.getName());
    }

    @Override
    public KnnVectorsWriter fieldsWriter(final SegmentWriteState state) throws IOException {
        return DELEGATE.fieldsWriter(state);
    }

    @Override
    public KnnVectorsReader fieldsReader(final SegmentReadState state) throws IOException {
        return DELEGATE.fieldsReader(state);
    }

    @Override
    public int getMaxDimensions(final String fieldName) {
        return MAX_DIMENSIONS;
    }
}
