package eu.virtualparadox.ragservice.api.dto;

import com.fasterxml.jackson.databind.JsonNode;

/**
 * The fixed set of sections the producer extracts per error. Any section may be null.
 */
public record ErrorSections(String description,
                            String symptoms,
                            String resolution,
                            String code,
                            String benefits) {

    public static ErrorSections from(final JsonNode sections) {
        return new ErrorSections(
                text(sections, "description"),
                text(sections, "symptoms"),
                text(sections, "resolution"),
                text(sections, "code"),
                text(sections, "benefits"));
    }

    private static String text(final JsonNode node, final String field) {
        final JsonNode value = node.path(field);
        return value.isMissingNode() || value.isNull() ? null : value.asText();
    }
}
