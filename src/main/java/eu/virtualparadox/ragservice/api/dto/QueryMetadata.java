package eu.virtualparadox.ragservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record QueryMetadata(@JsonProperty("num_results") int numResults,
                            @JsonProperty("search_time_ms") double searchTimeMs,
                            @JsonProperty("top_k") int topK,
                            @JsonProperty("top_n") int topN,
                            @JsonProperty("similarity_threshold") double similarityThreshold) {
}
