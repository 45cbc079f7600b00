package eu.virtualparadox.ragservice.rag.index;

import eu.virtualparadox.ragservice.source.model.EmbeddingRecord;

import java.util.List;

/**
 * Translates index slots back to the records they were built from.
 * Slot {@code i} of the {@link SimilarityIndex} built alongside this map holds the vector of {@code record(i)}.
 */
public final class IndexEntryMap {

    private final List<EmbeddingRecord> records;

    public IndexEntryMap(final List<EmbeddingRecord> recordsBySlot) {
        this.records = List.copyOf(recordsBySlot);
    }

    public int size() {
        return records.size();
    }

    /**
     * @throws IndexOutOfBoundsException if {@code slot} is outside 0..size-1
     */
    public EmbeddingRecord record(final int slot) {
        return records.get(slot);
    }

    public String id(final int slot) {
        return records.get(slot).id();
    }
}
