package io.tokenkeeper.sdk.internal;

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.databind.ObjectMapper;

import java.io.IOException;
import java.nio.charset.StandardCharsets;

/**
 * Utility for decoding RFC 6749 error payloads ({@code error}, {@code error_description}).
 */
public final class OAuthErrorDecoder {

    private static final ObjectMapper MAPPER = Json.mapper();
    private static final int MAX_RAW_LENGTH = 200;

    private OAuthErrorDecoder() {
    }

    public record OAuthError(int statusCode, String code, String description) {

        public String describe() {
            StringBuilder sb = new StringBuilder("status ").append(statusCode);
            if (code != null) {
                sb.append(" (").append(code).append(')');
            }
            if (description != null) {
                sb.append(": ").append(description);
            }
            return sb.toString();
        }
    }

    public static OAuthError decode(int statusCode, byte[] bytes) {
        if (bytes == null || bytes.length == 0) {
            return new OAuthError(statusCode, null, null);
        }

        try {
            JsonNode node = MAPPER.readTree(bytes);
            if (node == null || !node.isObject()) {
                return new OAuthError(statusCode, null, truncate(new String(bytes, StandardCharsets.UTF_8)));
            }
            String code = Json.text(node, "error");
            String description = Json.text(node, "error_description");
            if (description == null) {
                description = Json.text(node, "message");
            }
            return new OAuthError(statusCode, code, description);
        } catch (IOException ex) {
            return new OAuthError(statusCode, null, truncate(new String(bytes, StandardCharsets.UTF_8)));
        }
    }

    private static String truncate(String raw) {
        String trimmed = raw.trim();
        if (trimmed.isEmpty()) {
            return null;
        }
        return trimmed.length() > MAX_RAW_LENGTH ? trimmed.substring(0, MAX_RAW_LENGTH) + "..." : trimmed;
    }
}
