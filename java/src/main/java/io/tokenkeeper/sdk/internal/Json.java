package io.tokenkeeper.sdk.internal;

import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.databind.DeserializationFeature;
import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

/**
 * Centralised ObjectMapper configuration plus a few tree helpers shared by the response parsers.
 */
public final class Json {

    private static final ObjectMapper MAPPER = new ObjectMapper()
        .registerModule(new JavaTimeModule())
        .configure(DeserializationFeature.FAIL_ON_UNKNOWN_PROPERTIES, false)
        .configure(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS, false)
        .setSerializationInclusion(JsonInclude.Include.NON_NULL);

    private Json() {
    }

    public static ObjectMapper mapper() {
        return MAPPER;
    }

    /**
     * @return the trimmed text of {@code field}, or {@code null} when it is missing, null or blank.
     */
    public static String text(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull() || value.isContainerNode()) {
            return null;
        }
        String text = value.asText();
        return text == null || text.isBlank() ? null : text.trim();
    }

    /**
     * Reads an OAuth scope field which servers send either as a JSON array or as a space-delimited string.
     *
     * @return the scopes, or {@code null} when the field is absent.
     */
    public static Set<String> scopes(JsonNode node, String field) {
        JsonNode value = node.path(field);
        if (value.isMissingNode() || value.isNull()) {
            return null;
        }
        Set<String> scopes = new LinkedHashSet<>();
        if (value.isArray()) {
            value.forEach(item -> {
                if (item.isTextual() && !item.asText().isBlank()) {
                    scopes.add(item.asText().trim());
                }
            });
        } else if (value.isTextual()) {
            Arrays.stream(value.asText().split("\\s+"))
                .filter(s -> !s.isEmpty())
                .forEach(scopes::add);
        } else {
            return null;
        }
        return Collections.unmodifiableSet(scopes);
    }
}
