package eu.virtualparadox.ragservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.databind.JsonNode;
import eu.virtualparadox.ragservice.query.model.ScoredResult;
import eu.virtualparadox.ragservice.source.model.EmbeddingRecord;

/**
 * One hit of {@code POST /rag/query}, shaped from the record's metadata document
 * ({@code {"sections": {...}, "metadata": {"source_file": ..., "page": ...}}}).
 */
public record ErrorResult(@JsonProperty("error_id") String errorId,
                          @JsonProperty("error_title") String errorTitle,
                          @JsonProperty("similarity_score") float similarityScore,
                          @JsonProperty("source_file") String sourceFile,
                          @JsonProperty("page") Integer page,
                          @JsonProperty("sections") ErrorSections sections) {

    public static ErrorResult from(final ScoredResult result) {
        final EmbeddingRecord rec = result.record();
        final JsonNode metadata = rec.metadata().path("metadata");

        final JsonNode sourceFile = metadata.path("source_file");
        return new ErrorResult(
                rec.id(),
                rec.title(),
                result.similarity(),
                sourceFile.isTextual() ? sourceFile.asText() : null,
                page(metadata.path("page")),
                ErrorSections.from(rec.metadata().path("sections")));
    }

    private static Integer page(final JsonNode page) {
        if (page.canConvertToInt() && page.isNumber()) {
            return page.intValue();
        }
        if (page.isTextual()) {
            try {
                return Integer.valueOf(page.asText().trim());
            } catch (NumberFormatException e) {
                return null;
            }
        }
        return null;
    }
}
