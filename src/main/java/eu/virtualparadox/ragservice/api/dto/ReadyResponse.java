package eu.virtualparadox.ragservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ReadyResponse(@JsonProperty("status") String status,
                            @JsonProperty("index_size") int indexSize) {
}
