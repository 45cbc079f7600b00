package eu.virtualparadox.ragservice.api.dto;

import com.fasterxml.jackson.annotation.JsonProperty;

public record ErrorResponse(@JsonProperty("detail") String detail) {
}
