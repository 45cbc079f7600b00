package eu.virtualparadox.ragservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

/**
 * @param status    {@code success} or {@code failure} of this reload attempt.
 * @param message   What happened.
 * @param indexSize Size of the generation served after the attempt.
 */
public record ReloadResponse(@JsonProperty("status") String status,
                             @JsonProperty("message") String message,
                             @JsonProperty("index_size") int indexSize) {
}
