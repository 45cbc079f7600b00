package eu.virtualparadox.ragservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import jakarta.validation.constraints.DecimalMin;
import jakarta.validation.constraints.Max;
import jakarta.validation.constraints.Min;
import jakarta.validation.constraints.NotBlank;

/**
 * Body of {@code POST /rag/query}. Missing numbers fall back to their defaults.
 *
 * @param query               Text to search for.
 * @param topK                Candidates fetched from the index (1-100, default 10).
 * @param topN                Results returned (1-20, default 3).
 * @param similarityThreshold Minimum similarity (default 0.6). Values above 1 are allowed and match nothing.
 */
public record QueryRequest(
        @NotBlank @JsonProperty("query") String query,
        @Min(1) @Max(100) @JsonProperty("top_k") Integer topK,
        @Min(1) @Max(20) @JsonProperty("top_n") Integer topN,
        @DecimalMin("-1.0") @JsonProperty("similarity_threshold") Double similarityThreshold) {

    public static final int DEFAULT_TOP_K = 10;
    public static final int DEFAULT_TOP_N = 3;
    public static final double DEFAULT_SIMILARITY_THRESHOLD = 0.6;

    public QueryRequest {
        topK = topK == null ? DEFAULT_TOP_K : topK;
        topN = topN == null ? DEFAULT_TOP_N : topN;
        similarityThreshold = similarityThreshold == null ? DEFAULT_SIMILARITY_THRESHOLD : similarityThreshold;
    }
}
