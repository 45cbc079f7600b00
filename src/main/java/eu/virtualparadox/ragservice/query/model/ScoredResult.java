package eu.virtualparadox.ragservice.query.model;

import eu.virtualparadox.ragservice.source.model.EmbeddingRecord;

/**
 * @param slot       Slot of the hit in the generation it was found in.
 * @param similarity Cosine similarity to the query (higher = better).
 * @param record     The full record behind the slot.
 */
public record ScoredResult(int slot, float similarity, EmbeddingRecord record) {

}
