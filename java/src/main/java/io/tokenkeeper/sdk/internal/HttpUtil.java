package io.tokenkeeper.sdk.internal;

import java.io.IOException;
import java.net.URI;
import java.net.URLEncoder;
import java.net.http.HttpClient;
import java.net.http.HttpRequest;
import java.net.http.HttpResponse;
import java.nio.charset.StandardCharsets;
import java.time.Duration;
import java.util.Base64;
import java.util.Map;
import java.util.stream.Collectors;

/**
 * Helper methods for the two request shapes the SDK issues: form POSTs to token endpoints and GETs to token-info
 * endpoints.
 */
public final class HttpUtil {

    private HttpUtil() {
    }

    public static HttpResponse<byte[]> postForm(HttpClient client, String url, Map<String, String> form,
                                                String basicUser, String basicPassword, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest.Builder builder = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .POST(HttpRequest.BodyPublishers.ofString(formEncode(form)))
            .header("Content-Type", "application/x-www-form-urlencoded")
            .header("Accept", "application/json")
            .timeout(timeout);

        if (basicUser != null) {
            String credentials = Base64.getEncoder()
                .encodeToString((basicUser + ":" + basicPassword).getBytes(StandardCharsets.UTF_8));
            builder.header("Authorization", "Basic " + credentials);
        }

        return client.send(builder.build(), HttpResponse.BodyHandlers.ofByteArray());
    }

    public static HttpResponse<byte[]> get(HttpClient client, String url, Duration timeout)
        throws IOException, InterruptedException {

        HttpRequest request = HttpRequest.newBuilder()
            .uri(URI.create(url))
            .GET()
            .header("Accept", "application/json")
            .timeout(timeout)
            .build();
        return client.send(request, HttpResponse.BodyHandlers.ofByteArray());
    }

    public static String formEncode(Map<String, String> form) {
        return form.entrySet().stream()
            .map(e -> encode(e.getKey()) + "=" + encode(e.getValue()))
            .collect(Collectors.joining("&"));
    }

    /**
     * Appends {@code name=value} to {@code url}, respecting an existing query string.
     */
    public static String withQueryParameter(String url, String name, String value) {
        String separator = url.contains("?") ? "&" : "?";
        return url + separator + encode(name) + "=" + encode(value);
    }

    public static boolean isSuccess(int status) {
        return status >= 200 && status < 300;
    }

    /**
     * Statuses worth retrying against another endpoint: server errors, request timeout and throttling.
     */
    public static boolean isTransient(int status) {
        return status >= 500 || status == 408 || status == 429;
    }

    private static String encode(String value) {
        return URLEncoder.encode(value, StandardCharsets.UTF_8);
    }
}
