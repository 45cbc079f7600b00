package eu.virtualparadox.ragservice.api.dto;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;

@JsonInclude(JsonInclude.Include.NON_NULL)
public record HealthResponse(@JsonProperty("status") String status,
                             @JsonProperty("reason") String reason,
                             @JsonProperty("index_size") int indexSize) {

    public static HealthResponse healthy(final int indexSize) {
        return new HealthResponse("healthy", null, indexSize);
    }

    public static HealthResponse unhealthy(final String reason) {
        return new HealthResponse("unhealthy", reason, 0);
    }
}
