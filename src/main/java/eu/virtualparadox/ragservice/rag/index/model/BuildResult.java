package eu.virtualparadox.ragservice.rag.index.model;

import eu.virtualparadox.ragservice.rag.index.IndexGeneration;

/**
 * @param generation        The new, not yet published generation (caller owns its reference).
 * @param dimension         Dimension chosen for this build.
 * @param droppedDimension  Records dropped because their dimension disagreed with {@code dimension}.
 * @param droppedMalformed  Records dropped because their vector was unusable (length, zero norm, missing id).
 * @param duplicateIds      Input records collapsed because their id was already present.
 */
public record BuildResult(IndexGeneration generation,
                          int dimension,
                          int droppedDimension,
                          int droppedMalformed,
                          int duplicateIds) {

    public int dropped() {
        return droppedDimension + droppedMalformed;
    }
}
