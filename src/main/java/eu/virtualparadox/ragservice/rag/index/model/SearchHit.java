package eu.virtualparadox.ragservice.rag.index.model;

/**
 * @param slot       Position of the vector inside its generation (0..N-1).
 * @param similarity Inner product between the normalized query and the stored vector, in [-1, 1].
 */
public record SearchHit(int slot, float similarity) {

}
