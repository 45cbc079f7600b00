package eu.virtualparadox.ragservice.util;

/**
 * Field names of the documents written by {@link eu.virtualparadox.ragservice.rag.index.LuceneSimilarityIndex}.
 */
public final class LuceneConstants {
    public static final String FIELD_VECTOR = "vector";
    public static final String FIELD_RECORD_ID = "recordId";
    public static final String FIELD_SLOT = "slot";

    private LuceneConstants() {
        // prevent instantiation
    }
}
