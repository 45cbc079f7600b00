package eu.virtualparadox.ragservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;
import eu.virtualparadox.ragservice.query.model.ScoredResult;

import java.util.List;

public record QueryResponse(@JsonProperty("query") String query,
                            @JsonProperty("results") List<ErrorResult> results,
                            @JsonProperty("metadata") QueryMetadata metadata) {

    public static QueryResponse of(final QueryRequest request,
                                   final List<ScoredResult> results,
                                   final double searchTimeMs) {
        final List<ErrorResult> shaped = results.stream().map(ErrorResult::from).toList();
        return new QueryResponse(
                request.query(),
                shaped,
                new QueryMetadata(shaped.size(), searchTimeMs, request.topK(), request.topN(), request.similarityThreshold()));
    }
}
